package io.github.riemr.cpe.application.service;

import io.github.riemr.cpe.application.util.ReportDateParser;
import io.github.riemr.cpe.config.CpeProperties;
import io.github.riemr.cpe.domain.model.MeetingTimestamps;
import io.github.riemr.cpe.domain.model.ParsedReport;
import io.github.riemr.cpe.domain.model.ReportTable;
import io.github.riemr.cpe.exception.ReportFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Determines the meeting boundaries.
 * <ul>
 *   <li>stream start/end: from the webinar summary table</li>
 *   <li>start: scheduled start, defaults to the stream start</li>
 *   <li>end: scheduled end, defaults to start + max-cpe hours</li>
 *   <li>business start: start + grace period</li>
 *   <li>business end: defaults to end</li>
 * </ul>
 */
@Service
@Slf4j
public class MeetingTimestampResolver {

    static final String SUMMARY_TABLE = "attendee report";
    static final String COL_ACTUAL_START = "actual start time";
    static final String COL_ACTUAL_DURATION = "actual duration (minutes)";
    static final String COL_TOPIC = "topic";

    public MeetingTimestamps resolve(ParsedReport report, CpeProperties properties) {
        LocalDateTime streamStart = null;
        LocalDateTime streamEnd = null;
        Optional<ReportTable> summary = report.findTable(SUMMARY_TABLE);
        if (properties.getStart() == null) {
            ReportTable table = report.table(SUMMARY_TABLE);
            streamStart = ReportDateParser.parse(table.value(0, COL_ACTUAL_START));
            streamEnd = streamStart.plusSeconds(Math.round(durationMinutes(table) * 60));
        } else if (summary.isPresent() && hasStreamTimes(summary.get())) {
            ReportTable table = summary.get();
            streamStart = ReportDateParser.parse(table.value(0, COL_ACTUAL_START));
            streamEnd = streamStart.plusSeconds(Math.round(durationMinutes(table) * 60));
        } else {
            log.debug("stream times unavailable, using configured start");
        }

        LocalDateTime start = properties.getStart() != null ? ReportDateParser.parse(properties.getStart()) : streamStart;
        LocalDateTime busStart = start.plusMinutes(properties.getStartGracePeriod());
        LocalDateTime end = properties.getEnd() != null
                ? ReportDateParser.parse(properties.getEnd())
                : start.plusHours(properties.getMaxCpe());
        LocalDateTime busEnd = properties.getBusEnd() != null ? ReportDateParser.parse(properties.getBusEnd()) : end;

        MeetingTimestamps ts = new MeetingTimestamps(report.generatedAt(), streamStart, streamEnd, start, end, busStart, busEnd);
        log.debug("timestamps: {}", ts);
        return ts;
    }

    /** Configured title, else the webinar topic, else blank. */
    public String resolveTitle(ParsedReport report, CpeProperties properties) {
        if (properties.getTitle() != null) {
            return properties.getTitle();
        }
        return report.findTable(SUMMARY_TABLE)
                .filter(t -> t.rowCount() > 0 && t.hasColumn(COL_TOPIC))
                .map(t -> t.value(0, COL_TOPIC))
                .orElse("");
    }

    private static boolean hasStreamTimes(ReportTable table) {
        return table.rowCount() > 0
                && table.hasColumn(COL_ACTUAL_START) && table.hasColumn(COL_ACTUAL_DURATION)
                && table.value(0, COL_ACTUAL_START) != null && table.value(0, COL_ACTUAL_DURATION) != null;
    }

    private static double durationMinutes(ReportTable table) {
        String value = table.value(0, COL_ACTUAL_DURATION);
        try {
            return value == null ? 0.0 : Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ReportFormatException("bad actual duration '" + value + "'", e);
        }
    }
}
