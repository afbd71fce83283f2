package io.github.riemr.cpe.application.service;

import io.github.riemr.cpe.domain.model.AttendanceRole;
import io.github.riemr.cpe.domain.model.TimelineEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Combines adjacent timeline entries separated by less than a minute. A promotion from attendee
 * to panelist without disconnecting leaves a gap of 0-1 seconds.
 */
@Service
@Slf4j
public class TimelineReconciler {

    static final long MERGE_TOLERANCE_SECONDS = 60;

    /** Merges {@code timeline} in place, keeping discovery order, and returns it. */
    public List<TimelineEntry> reconcile(List<TimelineEntry> timeline) {
        int index = 0;
        while (index < timeline.size() - 1) {
            TimelineEntry current = timeline.get(index);
            TimelineEntry next = timeline.get(index + 1);
            long gap = Duration.between(current.getLeaveTime(), next.getJoinTime()).getSeconds();
            if (gap >= 0 && gap < MERGE_TOLERANCE_SECONDS) {
                List<AttendanceRole> roles = new ArrayList<>(current.getRoles());
                roles.addAll(next.getRoles());
                current.setRoles(roles);
                current.setLeaveTime(next.getLeaveTime());
                current.setSessionMinutes(current.getSessionMinutes() + next.getSessionMinutes());
                timeline.remove(index + 1);
                log.debug("merged entries at {} ({}s gap) -> {}", index, gap, current.roleTag());
            } else {
                index++;
            }
        }
        return timeline;
    }
}
