package io.github.riemr.cpe.application.service;

import io.github.riemr.cpe.application.dto.CpeReportRow;
import io.github.riemr.cpe.application.util.CpeQuarterUtils;
import io.github.riemr.cpe.domain.model.Attendee;
import io.github.riemr.cpe.domain.model.MeetingTimestamps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

@Service
@Slf4j
public class CpeReportAssembler {

    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern CERT_DESIGNATION = Pattern.compile("cissp|csslp|sscp|ccsp|cap|hcispp",
            Pattern.CASE_INSENSITIVE);
    private static final DateTimeFormatter ACTIVITY_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy");

    static final Comparator<Attendee> BY_LAST_NAME =
            Comparator.comparing((Attendee a) -> Objects.toString(a.getLastName(), ""))
                    .thenComparing(a -> Objects.toString(a.getEmail(), ""));

    /**
     * Builds the report rows, ordered by last name (ordinal). Attendees without a certification number
     * or without credit are logged and left out.
     */
    public List<CpeReportRow> assemble(Collection<Attendee> attendees, MeetingTimestamps ts, String title) {
        String activityDate = ts.start().format(ACTIVITY_DATE);
        List<CpeReportRow> rows = new ArrayList<>();
        List<Attendee> sorted = attendees.stream().sorted(BY_LAST_NAME).toList();
        for (Attendee a : sorted) {
            String cert = a.getCertificationId();
            if (cert == null || !DIGIT.matcher(cert).find()) {
                log.warn("skipping {}, {}: no ISC2 number data", a.getLastName(), a.getFirstName());
                continue;
            }
            if (a.getCpe() == null) {
                log.warn("skipping {}, {}: no attendance to credit", a.getLastName(), a.getFirstName());
                continue;
            }
            rows.add(CpeReportRow.builder()
                    .memberNumber(normalizeCertification(cert))
                    .firstName(a.getFirstName())
                    .lastName(a.getLastName())
                    .meetingTitle(title)
                    .cpe(CpeQuarterUtils.formatCredits(a.getCpe()))
                    .activityDate(activityDate)
                    .qualifyingMinutes(Objects.toString(a.getCpeMinutes(), ""))
                    .build());
        }
        log.info("Assembled {} CPE record(s) from {} attendee(s)", rows.size(), attendees.size());
        return rows;
    }

    /** Strips extraneous text when the value names a certification, e.g. "CISSP #12345" becomes "12345". */
    static String normalizeCertification(String raw) {
        if (CERT_DESIGNATION.matcher(raw).find()) {
            return raw.replaceAll("\\D+", "");
        }
        return raw;
    }
}
