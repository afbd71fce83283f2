package io.github.riemr.cpe.application.service;

import io.github.riemr.cpe.application.dto.CpeReportRow;
import io.github.riemr.cpe.application.util.CpeQuarterUtils;
import io.github.riemr.cpe.config.CpeProperties;
import io.github.riemr.cpe.domain.model.Attendee;
import io.github.riemr.cpe.domain.model.MeetingTimestamps;
import io.github.riemr.cpe.domain.model.ParsedReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Runs one attendance export through the CPE pipeline. */
@Service
@RequiredArgsConstructor
@Slf4j
public class CpeReportService {

    private final CpeProperties properties;
    private final MeetingTimestampResolver timestampResolver;
    private final TimelineBuilder timelineBuilder;
    private final MemberHistoryService memberHistoryService;
    private final TimelineReconciler reconciler;
    private final CpeCalculator calculator;
    private final CpeReportAssembler assembler;

    public List<CpeReportRow> generate(ParsedReport report) {
        MeetingTimestamps ts = timestampResolver.resolve(report, properties);
        log.info("Meeting {} - {}, business {} - {}", ts.start(), ts.end(), ts.busStart(), ts.busEnd());

        Map<String, Attendee> attendees = timelineBuilder.build(report, seedAttendees());
        memberHistoryService.fillFromHistory(attendees, properties.getHistoryReports());

        for (Attendee attendee : attendees.values()) {
            if (attendee.isPresetCpe()) {
                continue;
            }
            reconciler.reconcile(attendee.getTimeline());
            calculator.compute(attendee, ts, properties.getMaxCpe()).ifPresentOrElse(
                    result -> {
                        attendee.setCpe(result.cpe());
                        attendee.setCpeMinutes(CpeQuarterUtils.formatMinutes(result.minutes()));
                    },
                    () -> log.debug("{}: empty timeline, no CPE computed", attendee.getEmail()));
        }
        return assembler.assemble(attendees.values(), ts, timestampResolver.resolveTitle(report, properties));
    }

    /** Attendees from configuration, for hosts and speakers the export does not list properly. */
    Map<String, Attendee> seedAttendees() {
        Map<String, Attendee> attendees = new LinkedHashMap<>();
        properties.getAttendee().forEach((email, seed) -> {
            Attendee a = new Attendee(email);
            a.setFirstName(seed.getFirstName());
            a.setLastName(seed.getLastName());
            a.setCertificationId(seed.getCertification());
            if (seed.getCpe() != null) {
                a.setCpe(seed.getCpe());
                a.setPresetCpe(true);
            }
            attendees.put(email, a);
        });
        return attendees;
    }
}
