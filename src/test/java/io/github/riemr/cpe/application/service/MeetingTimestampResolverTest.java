package io.github.riemr.cpe.application.service;

import io.github.riemr.cpe.config.CpeProperties;
import io.github.riemr.cpe.domain.model.MeetingTimestamps;
import io.github.riemr.cpe.domain.model.ParsedReport;
import io.github.riemr.cpe.exception.ReportFormatException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MeetingTimestampResolverTest {

    private final AttendanceReportReader reader = new AttendanceReportReader(new ReportTableSplitter(), new ReportTableParser());
    private final MeetingTimestampResolver resolver = new MeetingTimestampResolver();

    private final ParsedReport report = reader.parse(List.of(
            "Attendee Report,",
            "Report Generated:,\"Apr 15, 2021 09:12:04\"",
            "Webinar ID,Topic,Actual Start Time,Actual Duration (minutes)",
            "123,\"Threat Modeling, Revisited\",\"Apr 14, 2021 18:52:26\",139"));

    @Test
    void resolve_defaultsFromStreamStart() {
        MeetingTimestamps ts = resolver.resolve(report, new CpeProperties());

        LocalDateTime stream = LocalDateTime.of(2021, 4, 14, 18, 52, 26);
        assertThat(ts.generated()).isEqualTo(LocalDateTime.of(2021, 4, 15, 9, 12, 4));
        assertThat(ts.streamStart()).isEqualTo(stream);
        assertThat(ts.streamEnd()).isEqualTo(stream.plusMinutes(139));
        assertThat(ts.start()).isEqualTo(stream);
        assertThat(ts.busStart()).isEqualTo(stream.plusMinutes(10));
        assertThat(ts.end()).isEqualTo(stream.plusHours(2));
        assertThat(ts.busEnd()).isEqualTo(ts.end());
    }

    @Test
    void resolve_configuredTimesWin() {
        CpeProperties properties = new CpeProperties();
        properties.setStart("2021-04-14 19:00:00");
        properties.setEnd("April 14, 2021 9:00 PM");
        properties.setBusEnd("2021-04-14 20:45:00");
        properties.setStartGracePeriod(5);

        MeetingTimestamps ts = resolver.resolve(report, properties);

        assertThat(ts.start()).isEqualTo(LocalDateTime.of(2021, 4, 14, 19, 0));
        assertThat(ts.busStart()).isEqualTo(LocalDateTime.of(2021, 4, 14, 19, 5));
        assertThat(ts.end()).isEqualTo(LocalDateTime.of(2021, 4, 14, 21, 0));
        assertThat(ts.busEnd()).isEqualTo(LocalDateTime.of(2021, 4, 14, 20, 45));
    }

    @Test
    void resolve_withoutSummaryNeedsConfiguredStart() {
        ParsedReport noSummary = reader.parse(List.of("Host Details,", "Attended,Email"));

        assertThatThrownBy(() -> resolver.resolve(noSummary, new CpeProperties()))
                .isInstanceOf(ReportFormatException.class)
                .hasMessageContaining("attendee report");

        CpeProperties properties = new CpeProperties();
        properties.setStart("2021-04-14 19:00:00");
        MeetingTimestamps ts = resolver.resolve(noSummary, properties);
        assertThat(ts.streamStart()).isNull();
        assertThat(ts.end()).isEqualTo(LocalDateTime.of(2021, 4, 14, 21, 0));
    }

    @Test
    void resolve_configuredStartToleratesBlankStreamTimes() {
        ParsedReport blankSummary = reader.parse(List.of(
                "Attendee Report,",
                "Webinar ID,Topic,Actual Start Time,Actual Duration (minutes)",
                "123,Chapter Meeting,,"));
        CpeProperties properties = new CpeProperties();
        properties.setStart("2021-04-14 19:00:00");

        MeetingTimestamps ts = resolver.resolve(blankSummary, properties);

        assertThat(ts.streamStart()).isNull();
        assertThat(ts.streamEnd()).isNull();
        assertThat(ts.start()).isEqualTo(LocalDateTime.of(2021, 4, 14, 19, 0));

        assertThatThrownBy(() -> resolver.resolve(blankSummary, new CpeProperties()))
                .isInstanceOf(ReportFormatException.class);
    }

    @Test
    void resolveTitle_fallsBackToTopic() {
        assertThat(resolver.resolveTitle(report, new CpeProperties())).isEqualTo("Threat Modeling, Revisited");

        CpeProperties properties = new CpeProperties();
        properties.setTitle("Chapter Meeting");
        assertThat(resolver.resolveTitle(report, properties)).isEqualTo("Chapter Meeting");
    }
}
