package io.github.riemr.cpe.application.util;

import io.github.riemr.cpe.exception.ReportFormatException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportDateParserTest {

    @Test
    void parse_monthNameWith12HourClock() {
        assertThat(ReportDateParser.parse("Apr 14, 2021 7:05 PM"))
                .isEqualTo(LocalDateTime.of(2021, 4, 14, 19, 5, 0));
        assertThat(ReportDateParser.parse("April 14, 2021 06:59:41 pm"))
                .isEqualTo(LocalDateTime.of(2021, 4, 14, 18, 59, 41));
    }

    @Test
    void parse_noonAndMidnight() {
        assertThat(ReportDateParser.parse("Apr 14, 2021 12:00 PM")).isEqualTo(LocalDateTime.of(2021, 4, 14, 12, 0));
        assertThat(ReportDateParser.parse("Apr 14, 2021 12:30 AM")).isEqualTo(LocalDateTime.of(2021, 4, 14, 0, 30));
    }

    @Test
    void parse_monthNameWith24HourClock() {
        assertThat(ReportDateParser.parse("Sep 2, 2021 18:52:26"))
                .isEqualTo(LocalDateTime.of(2021, 9, 2, 18, 52, 26));
    }

    @Test
    void parse_isoLikeDateTime() {
        assertThat(ReportDateParser.parse("2021-11-10 19:00:00"))
                .isEqualTo(LocalDateTime.of(2021, 11, 10, 19, 0, 0));
    }

    @Test
    void parse_fallbackForms() {
        assertThat(ReportDateParser.parse("4/14/2021 7:58:12 PM")).isEqualTo(LocalDateTime.of(2021, 4, 14, 19, 58, 12));
        assertThat(ReportDateParser.parse("2021-04-14T19:00:00")).isEqualTo(LocalDateTime.of(2021, 4, 14, 19, 0));
        assertThat(ReportDateParser.parse("2021-04-14")).isEqualTo(LocalDateTime.of(2021, 4, 14, 0, 0));
        assertThat(ReportDateParser.parse("Apr 14, 2021")).isEqualTo(LocalDateTime.of(2021, 4, 14, 0, 0));
    }

    @Test
    void parse_rejectsUnparseableText() {
        assertThatThrownBy(() -> ReportDateParser.parse("--"))
                .isInstanceOf(ReportFormatException.class)
                .hasMessageContaining("--");
        assertThatThrownBy(() -> ReportDateParser.parse(null)).isInstanceOf(ReportFormatException.class);
    }

    @Test
    void parse_rejectsUnknownMonthAndInvalidDay() {
        assertThatThrownBy(() -> ReportDateParser.parse("Foo 14, 2021 18:52:26"))
                .isInstanceOf(ReportFormatException.class)
                .hasMessageContaining("unknown month");
        assertThatThrownBy(() -> ReportDateParser.parse("2021-02-30 10:00:00"))
                .isInstanceOf(ReportFormatException.class);
    }

    @Test
    void parse_rejectsOverflowingNumbers() {
        assertThatThrownBy(() -> ReportDateParser.parse("Apr 99999999999, 2021 10:00:00"))
                .isInstanceOf(ReportFormatException.class)
                .hasMessageContaining("Apr 99999999999, 2021 10:00:00");
    }
}
