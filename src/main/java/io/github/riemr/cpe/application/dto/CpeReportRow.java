package io.github.riemr.cpe.application.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CpeReportRow {
    public static final List<String> HEADER = List.of(
            "(ISC)2 Member #", "Member First Name", "Member Last Name", "Title of Meeting", "# CPEs",
            "Date of Activity", "CPE qualifying minutes");

    private String memberNumber;
    private String firstName;
    private String lastName;
    private String meetingTitle;
    private String cpe;
    private String activityDate; // MM/dd/yyyy
    private String qualifyingMinutes;

    public List<String> toFields() {
        return Arrays.asList(memberNumber, firstName, lastName, meetingTitle, cpe, activityDate, qualifyingMinutes);
    }
}
