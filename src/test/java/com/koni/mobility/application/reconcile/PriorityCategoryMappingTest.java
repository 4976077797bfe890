package com.koni.mobility.application.reconcile;

import com.koni.mobility.domain.model.TypeUnit;
import com.koni.mobility.tags.UnitTest;
import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

@UnitTest
class PriorityCategoryMappingTest {

    private final PriorityCategoryMapping mapping = PriorityCategoryMapping.builder()
            .labels(new TypeUnit("E-Ladepunkt", "Occupancy status"), "E-Ladepunkt")
            .keepingLabel("Vacant Spaces", "Parkobjekt", "ParkingArea")
            .labels(new TypeUnit("motor traffic measurement", "Vehicles Counted"), "cC1", "vC1")
            .pattern(Pattern.compile("(?i)c.*"), new TypeUnit("catch-all", "n/a"))
            .build();

    @Test
    void shouldMatchLabelsTrimmedAndCaseInsensitively() {
        assertThat(mapping.resolve("  e-ladepunkt "))
                .contains(new TypeUnit("E-Ladepunkt", "Occupancy status"));
        assertThat(mapping.resolve("VC1")).contains(new TypeUnit("motor traffic measurement", "Vehicles Counted"));
    }

    @Test
    void shouldUseLabelItselfAsTypeForKeepingRules() {
        assertThat(mapping.resolve("ParkingArea")).contains(new TypeUnit("ParkingArea", "Vacant Spaces"));
    }

    @Test
    void shouldApplyFirstMatchingRule() {
        // "cC1" matches both the explicit label rule and the later pattern
        assertThat(mapping.resolve("cC1")).contains(new TypeUnit("motor traffic measurement", "Vehicles Counted"));
        assertThat(mapping.resolve("cC9")).contains(new TypeUnit("catch-all", "n/a"));
        assertThat(mapping.size()).isEqualTo(4);
    }

    @Test
    void shouldReturnEmptyForUnknownOrBlankLabels() {
        assertThat(mapping.resolve("Wasserstand")).isEmpty();
        assertThat(mapping.resolve(" ")).isEmpty();
        assertThat(mapping.resolve(null)).isEmpty();
    }
}
