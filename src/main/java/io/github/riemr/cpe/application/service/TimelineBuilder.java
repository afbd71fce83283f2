package io.github.riemr.cpe.application.service;

import io.github.riemr.cpe.application.util.ReportDateParser;
import io.github.riemr.cpe.config.CpeProperties;
import io.github.riemr.cpe.domain.model.AttendanceRole;
import io.github.riemr.cpe.domain.model.Attendee;
import io.github.riemr.cpe.domain.model.ParsedReport;
import io.github.riemr.cpe.domain.model.ReportTable;
import io.github.riemr.cpe.domain.model.TimelineEntry;
import io.github.riemr.cpe.exception.ReportFormatException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects attendance records per email from the host, attendee and panelist tables.
 * One person may appear several times after a reconnect or a promotion to panelist.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimelineBuilder {

    static final String COL_ATTENDED = "attended";
    static final String COL_EMAIL = "email";
    static final String COL_FIRST_NAME = "first name";
    static final String COL_LAST_NAME = "last name";
    static final String COL_JOIN_TIME = "join time";
    static final String COL_LEAVE_TIME = "leave time";
    static final String COL_SESSION_MINUTES = "time in session (minutes)";

    private final CpeProperties properties;

    /**
     * Adds the attendance found in {@code report} to {@code attendees} and returns the same map.
     * Fields already present on an attendee, e.g. from a seed record, are never overwritten.
     */
    public Map<String, Attendee> build(ParsedReport report, Map<String, Attendee> attendees) {
        for (AttendanceRole role : AttendanceRole.values()) {
            Optional<ReportTable> table = report.findTable(role.getTableName());
            if (table.isEmpty()) {
                log.info("No '{}' table in report, skipping", role.getTableName());
                continue;
            }
            scan(table.get(), role, attendees);
        }
        return attendees;
    }

    private void scan(ReportTable table, AttendanceRole role, Map<String, Attendee> attendees) {
        int attendedIdx = table.columnIndex(COL_ATTENDED);
        int emailIdx = table.columnIndex(COL_EMAIL);
        int joinIdx = table.columnIndex(COL_JOIN_TIME);
        int leaveIdx = table.columnIndex(COL_LEAVE_TIME);
        int minutesIdx = table.columnIndex(COL_SESSION_MINUTES);
        Integer firstIdx = table.hasColumn(COL_FIRST_NAME) ? table.columnIndex(COL_FIRST_NAME) : null;
        Integer lastIdx = table.hasColumn(COL_LAST_NAME) ? table.columnIndex(COL_LAST_NAME) : null;
        Integer certIdx = certificationColumn(table);

        int added = 0;
        for (List<String> row : table.getRows()) {
            String attended = row.get(attendedIdx);
            String email = row.get(emailIdx);
            if (!"yes".equalsIgnoreCase(attended) || email == null) {
                continue;
            }
            Attendee attendee = attendees.computeIfAbsent(email, Attendee::new);
            attendee.fillMissing(valueAt(row, firstIdx), valueAt(row, lastIdx), valueAt(row, certIdx));

            LocalDateTime join = ReportDateParser.parse(required(row, joinIdx, table, COL_JOIN_TIME));
            LocalDateTime leave = ReportDateParser.parse(required(row, leaveIdx, table, COL_LEAVE_TIME));
            attendee.getTimeline().add(new TimelineEntry(role, join, leave, sessionMinutes(row.get(minutesIdx), table)));
            added++;
        }
        log.debug("table '{}': {} timeline record(s) as {}", table.getName(), added, role.getTag());
    }

    private Integer certificationColumn(ReportTable table) {
        for (String column : properties.getCertificationColumns()) {
            if (table.hasColumn(column)) {
                return table.columnIndex(column);
            }
        }
        return null;
    }

    private static String valueAt(List<String> row, Integer idx) {
        return idx == null ? null : row.get(idx);
    }

    private static String required(List<String> row, int idx, ReportTable table, String column) {
        String v = row.get(idx);
        if (v == null) {
            throw new ReportFormatException("table '" + table.getName() + "': blank '" + column
                    + "' for " + row);
        }
        return v;
    }

    private static double sessionMinutes(String value, ReportTable table) {
        if (value == null) return 0.0;
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ReportFormatException("table '" + table.getName() + "': bad session minutes '" + value + "'", e);
        }
    }
}
