package com.example.invoiceverify.domain.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FieldValueTest {

    @Test
    void absentValueHasNoConfidence() {
        FieldValue absent = FieldValue.absent();

        assertThat(absent.value()).isNull();
        assertThat(absent.present()).isFalse();
        assertThat(absent.confidence()).isZero();
    }

    @Test
    void presentValueKeepsConfidence() {
        FieldValue value = FieldValue.of("INV-1", 0.95);

        assertThat(value.present()).isTrue();
        assertThat(value.confidence()).isEqualTo(0.95);
    }

    @Test
    void presenceMustFollowValue() {
        assertThrows(IllegalArgumentException.class, () -> new FieldValue("x", 0.5, false));
        assertThrows(IllegalArgumentException.class, () -> new FieldValue(null, 0.0, true));
        assertThrows(IllegalArgumentException.class, () -> FieldValue.of(null, 0.5));
    }

    @Test
    void absentValueCannotCarryConfidence() {
        assertThrows(IllegalArgumentException.class, () -> new FieldValue(null, 0.3, false));
    }

    @Test
    void confidenceMustStayWithinUnitRange() {
        assertThrows(IllegalArgumentException.class, () -> FieldValue.of("x", 1.5));
        assertThrows(IllegalArgumentException.class, () -> FieldValue.of("x", -0.1));
    }
}
