package io.github.riemr.cpe.application.service;

import io.github.riemr.cpe.domain.model.Attendee;
import io.github.riemr.cpe.domain.model.ParsedReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up names and certification numbers in earlier months' attendance exports for attendees
 * who did not fill in the survey this time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemberHistoryService {

    private final AttendanceReportReader reader;
    private final TimelineBuilder timelineBuilder;

    public void fillFromHistory(Map<String, Attendee> attendees, List<String> historyReports) {
        for (String location : historyReports) {
            Path path = Path.of(location);
            if (!Files.isRegularFile(path)) {
                throw new IllegalArgumentException("history report " + location + " does not exist");
            }
            ParsedReport past;
            try {
                past = reader.read(path);
            } catch (IOException e) {
                throw new UncheckedIOException("failed to read history report " + location, e);
            }
            Map<String, Attendee> known = timelineBuilder.build(past, new LinkedHashMap<>());

            int filled = 0;
            for (Attendee attendee : attendees.values()) {
                Attendee member = known.get(attendee.getEmail());
                if (member != null
                        && attendee.fillMissing(member.getFirstName(), member.getLastName(), member.getCertificationId())) {
                    filled++;
                }
            }
            log.info("History report {}: {} member(s) known, {} attendee(s) completed", location, known.size(), filled);
        }
    }
}
