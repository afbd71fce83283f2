package io.github.riemr.cpe.application.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class CpeQuarterUtilsTest {

    @Test
    void toQuarterCredits_roundsWithBias() {
        assertThat(CpeQuarterUtils.toQuarterCredits(97, 2)).isEqualTo(1.5);
        assertThat(CpeQuarterUtils.toQuarterCredits(60, 2)).isEqualTo(1.0);
        // 8 minutes = 0.533 quarters + 0.45 rounds down, 9 minutes = 0.6 + 0.45 rounds up
        assertThat(CpeQuarterUtils.toQuarterCredits(8, 2)).isEqualTo(0.0);
        assertThat(CpeQuarterUtils.toQuarterCredits(9, 2)).isEqualTo(0.25);
    }

    @Test
    void toQuarterCredits_clampsToRange() {
        assertThat(CpeQuarterUtils.toQuarterCredits(239, 2)).isEqualTo(2.0);
        assertThat(CpeQuarterUtils.toQuarterCredits(-30, 2)).isEqualTo(0.0);
    }

    @Test
    void minutesBetween_usesSeconds() {
        LocalDateTime t = LocalDateTime.of(2021, 4, 14, 19, 0);
        assertThat(CpeQuarterUtils.minutesBetween(t, t.plusSeconds(90))).isEqualTo(1.5);
    }

    @Test
    void formatting() {
        assertThat(CpeQuarterUtils.formatMinutes(97)).isEqualTo("97.000");
        assertThat(CpeQuarterUtils.formatCredits(2.0)).isEqualTo("2");
        assertThat(CpeQuarterUtils.formatCredits(1.5)).isEqualTo("1.5");
        assertThat(CpeQuarterUtils.formatCredits(0.25)).isEqualTo("0.25");
        assertThat(CpeQuarterUtils.formatCredits(0.0)).isEqualTo("0");
    }
}
