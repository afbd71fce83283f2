package io.github.riemr.cpe.domain.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class Attendee {
    private String email;
    private String firstName;
    private String lastName;
    private String certificationId;
    private List<TimelineEntry> timeline = new ArrayList<>();
    private Double cpe;
    private String cpeMinutes; // blank when cpe was preset
    private boolean presetCpe;

    public Attendee(String email) {
        this.email = email;
    }

    /** Sets each given value only where the field is still empty. Returns whether anything changed. */
    public boolean fillMissing(String first, String last, String certification) {
        boolean changed = false;
        if (firstName == null && first != null) {
            firstName = first;
            changed = true;
        }
        if (lastName == null && last != null) {
            lastName = last;
            changed = true;
        }
        if (certificationId == null && certification != null) {
            certificationId = certification;
            changed = true;
        }
        return changed;
    }
}
