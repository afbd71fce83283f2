package io.github.riemr.cpe.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** One presence interval of an attendee. Merged entries keep every role they span. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimelineEntry {
    private List<AttendanceRole> roles = new ArrayList<>();
    private LocalDateTime joinTime;
    private LocalDateTime leaveTime;
    private double sessionMinutes;

    public TimelineEntry(AttendanceRole role, LocalDateTime joinTime, LocalDateTime leaveTime, double sessionMinutes) {
        this(new ArrayList<>(List.of(role)), joinTime, leaveTime, sessionMinutes);
    }

    /** Roles joined by "/", e.g. {@code attendee/panelist}. */
    public String roleTag() {
        return roles.stream().map(AttendanceRole::getTag).collect(Collectors.joining("/"));
    }
}
