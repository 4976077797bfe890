package com.koni.mobility.domain.model;

import com.koni.mobility.tags.UnitTest;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@UnitTest
class ExternalIdTest {

    @Test
    void shouldNormalizeNumbersTextAndLossyFloatsToSameId() {
        // Given
        ExternalId fromInt = ExternalId.of(123);
        ExternalId fromLong = ExternalId.of(123L);
        ExternalId fromText = ExternalId.of("123");
        ExternalId fromDouble = ExternalId.of(123.0);
        ExternalId fromFloatText = ExternalId.of(" 123.00 ");

        // Then
        assertThat(fromInt).isEqualTo(fromLong).isEqualTo(fromText).isEqualTo(fromDouble).isEqualTo(fromFloatText);
        assertThat(fromDouble.getValue()).isEqualTo("123");
        assertThat(fromDouble.hashCode()).isEqualTo(fromText.hashCode());
    }

    @Test
    void shouldKeepNonIntegralAndNonNumericIdsAsText() {
        assertThat(ExternalId.of(12.5).getValue()).isEqualTo("12.5");
        assertThat(ExternalId.of("urn:thing:7").getValue()).isEqualTo("urn:thing:7");
        assertThat(ExternalId.of(new BigInteger("123456789012345678901234567890")).getValue())
                .isEqualTo("123456789012345678901234567890");
    }

    @Test
    void shouldMapAbsentIdsToUnknownSentinel() {
        assertThat(ExternalId.of(null)).isSameAs(ExternalId.UNKNOWN);
        assertThat(ExternalId.of("  ")).isSameAs(ExternalId.UNKNOWN);
        assertThat(ExternalId.of(-1)).isSameAs(ExternalId.UNKNOWN);
        assertThat(ExternalId.of("-1.0")).isSameAs(ExternalId.UNKNOWN);
        assertThat(ExternalId.UNKNOWN.isKnown()).isFalse();
        assertThat(ExternalId.UNKNOWN.getValue()).isEqualTo("-1");
    }

    @Test
    void shouldTreatNegativeZeroAsZero() {
        assertThat(ExternalId.of("-0")).isEqualTo(ExternalId.of(0));
        assertThat(ExternalId.of(-0.0)).isEqualTo(ExternalId.of(0));
    }

    @Test
    void shouldReturnSameInstanceForExternalIdInput() {
        ExternalId id = ExternalId.of(9);

        assertThat(ExternalId.of(id)).isSameAs(id);
    }

    @Test
    void shouldSortNumericIdsNumericallyBeforeTextIds() {
        // Given
        List<ExternalId> ids = new ArrayList<>(List.of(
                ExternalId.of("abc"), ExternalId.of(10), ExternalId.of(9), ExternalId.of("-3")));

        // When
        ids.sort(null);

        // Then
        assertThat(ids).extracting(ExternalId::getValue).containsExactly("-3", "9", "10", "abc");
    }
}
