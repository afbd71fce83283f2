package io.github.riemr.cpe.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Meeting settings for one CPE report run.
 *
 * <p>Values come from {@code application.yml}, an optional meeting file imported with
 * {@code --spring.config.import=file:cpe-config-yyyy-mm.yaml}, and {@code --cpe.*}
 * command-line options, in increasing order of precedence.</p>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "cpe")
public class CpeProperties {

    /** Maximum CPEs for the event. Also the default meeting length in hours. */
    @Min(0)
    private int maxCpe = 2;

    /** Minutes after the scheduled start that still count as present at the start. */
    @Min(0)
    private int startGracePeriod = 10;

    /** Scheduled start time. Defaults to the stream start from the report summary. */
    private String start;

    /** Scheduled end time. Defaults to start + max-cpe hours. */
    private String end;

    /** Actual end of business. Defaults to the scheduled end. */
    private String busEnd;

    /** Meeting title. Defaults to the webinar topic in the report summary. */
    private String title;

    /** Attendance export to read; "-" or unset reads standard input. */
    private String input;

    /** Report destination; "-" writes to standard output. */
    private String output = "-";

    /** Earlier attendance exports searched for member names and certification numbers. */
    private List<String> historyReports = new ArrayList<>();

    /** Survey columns (case-folded) that may hold the certification number, in lookup order. */
    @NotEmpty
    private List<String> certificationColumns = new ArrayList<>(List.of(
            "(isc)2 certification:",
            "isc2 certification:"
    ));

    /**
     * Hosts and speakers missing from the export, keyed by email. Use bracket keys so the
     * dots survive binding, e.g. {@code cpe.attendee.[host@example.org].last-name}.
     */
    @Valid
    private Map<String, SeedAttendee> attendee = new LinkedHashMap<>();

    @Data
    public static class SeedAttendee {
        private String firstName;
        private String lastName;
        private String certification;

        /** Preset CPE value; skips the attendance computation for this person. */
        @DecimalMin("0")
        private Double cpe;
    }
}
