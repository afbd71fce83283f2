package io.github.riemr.cpe.application.service;

import io.github.riemr.cpe.application.dto.CpeReportRow;
import io.github.riemr.cpe.domain.model.Attendee;
import io.github.riemr.cpe.domain.model.MeetingTimestamps;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CpeReportAssemblerTest {

    private static final LocalDateTime START = LocalDateTime.of(2021, 4, 14, 19, 0);
    private static final MeetingTimestamps TS = new MeetingTimestamps(null, null, null, START, START.plusHours(2),
            START.plusMinutes(10), START.plusHours(2));

    private final CpeReportAssembler assembler = new CpeReportAssembler();

    private static Attendee attendee(String email, String first, String last, String cert, Double cpe, String minutes) {
        Attendee a = new Attendee(email);
        a.setFirstName(first);
        a.setLastName(last);
        a.setCertificationId(cert);
        a.setCpe(cpe);
        a.setCpeMinutes(minutes);
        return a;
    }

    @Test
    void assemble_ordersByLastNameOrdinal() {
        List<CpeReportRow> rows = assembler.assemble(List.of(
                attendee("z@x", "Zed", "smith", "111", 1.0, "60.000"),
                attendee("b@x", "Bea", "Smith", "222", 2.0, "120.000"),
                attendee("a@x", "Al", "Smith", "333", 0.5, "30.000"),
                attendee("n@x", "No", null, "444", 0.25, "15.000")), TS, "Meeting");

        assertThat(rows).extracting(CpeReportRow::getMemberNumber).containsExactly("444", "333", "222", "111");
    }

    @Test
    void assemble_buildsSevenFieldRows() {
        List<CpeReportRow> rows = assembler.assemble(List.of(
                attendee("a@x", "Alice", "Zimmerman", "CISSP #12345", 1.5, "97.000")), TS, "Chapter Meeting");

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).toFields())
                .containsExactly("12345", "Alice", "Zimmerman", "Chapter Meeting", "1.5", "04/14/2021", "97.000");
    }

    @Test
    void assemble_skipsAttendeesWithoutNumberOrCredit() {
        List<CpeReportRow> rows = assembler.assemble(List.of(
                attendee("a@x", "A", "A", "member", 2.0, "120.000"),
                attendee("b@x", "B", "B", null, 2.0, "120.000"),
                attendee("c@x", "C", "C", "CISSP 777", null, null)), TS, "Meeting");

        assertThat(rows).isEmpty();
    }

    @Test
    void normalizeCertification_stripsOnlyWithDesignation() {
        assertThat(CpeReportAssembler.normalizeCertification("CISSP #12345")).isEqualTo("12345");
        assertThat(CpeReportAssembler.normalizeCertification("hcispp: 55-12")).isEqualTo("5512");
        assertThat(CpeReportAssembler.normalizeCertification("#98765")).isEqualTo("#98765");
    }
}
