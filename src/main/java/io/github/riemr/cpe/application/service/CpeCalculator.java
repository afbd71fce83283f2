package io.github.riemr.cpe.application.service;

import io.github.riemr.cpe.application.dto.CpeResult;
import io.github.riemr.cpe.domain.model.Attendee;
import io.github.riemr.cpe.domain.model.MeetingTimestamps;
import io.github.riemr.cpe.domain.model.TimelineEntry;
import org.springframework.stereotype.Service;

import java.util.Optional;

import static io.github.riemr.cpe.application.util.CpeQuarterUtils.minutesBetween;
import static io.github.riemr.cpe.application.util.CpeQuarterUtils.toQuarterCredits;

/** Computes CPEs from an attendee's reconciled timeline. */
@Service
public class CpeCalculator {

    /**
     * Returns the credit for {@code attendee}, or empty when there is no attendance to credit.
     *
     * <p>An entry covering the whole business window earns the maximum at once. An entry present at
     * the start of business counts from the scheduled start; one present at the end of business
     * counts up to the scheduled end and replaces whatever was tallied before it.</p>
     */
    public Optional<CpeResult> compute(Attendee attendee, MeetingTimestamps ts, int maxCpe) {
        if (attendee.getTimeline().isEmpty()) {
            return Optional.empty();
        }
        double minutes = 0.0;
        for (TimelineEntry entry : attendee.getTimeline()) {
            boolean atStart = !entry.getJoinTime().isAfter(ts.busStart());
            boolean atEnd = !entry.getLeaveTime().isBefore(ts.busEnd());
            if (atStart && atEnd) {
                return Optional.of(new CpeResult(maxCpe, minutesBetween(ts.start(), ts.end())));
            }
            if (atStart) {
                minutes += minutesBetween(ts.start(), entry.getLeaveTime());
            } else if (atEnd) {
                minutes = minutesBetween(entry.getJoinTime(), ts.end());
            } else {
                minutes += minutesBetween(entry.getJoinTime(), entry.getLeaveTime());
            }
        }
        return Optional.of(new CpeResult(toQuarterCredits(minutes, maxCpe), minutes));
    }
}
