package io.github.riemr.cpe.domain.model;

import java.time.LocalDateTime;

/**
 * Time boundaries of one meeting.
 *
 * @param generated   report generation time, {@code null} when the export lacks it
 * @param streamStart video stream start from the report summary, {@code null} without one
 * @param streamEnd   stream start + actual duration, {@code null} without a summary
 * @param start       scheduled start
 * @param end         scheduled end
 * @param busStart    scheduled start + grace period
 * @param busEnd      end of business
 */
public record MeetingTimestamps(
        LocalDateTime generated,
        LocalDateTime streamStart,
        LocalDateTime streamEnd,
        LocalDateTime start,
        LocalDateTime end,
        LocalDateTime busStart,
        LocalDateTime busEnd) {
}
