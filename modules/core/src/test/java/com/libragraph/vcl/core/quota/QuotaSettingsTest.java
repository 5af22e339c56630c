package com.libragraph.vcl.core.quota;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class QuotaSettingsTest {

    private static final QuotaSettings BASE = new QuotaSettings(1000, 100, 5, true, true, 30, 300);

    @Test
    void acceptsValidSettings() {
        assertThat(BASE.maxSizeBytes()).isEqualTo(1000);
        assertThat(BASE.headroomBytes()).isEqualTo(100);
    }

    @Test
    void rejectsHeadroomAboveMax() {
        assertThatThrownBy(() -> BASE.withMaxSize(100, 200))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("headroomBytes");
    }

    @Test
    void rejectsNegativeValues() {
        assertThatThrownBy(() -> BASE.withMaxSize(-1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BASE.withBatchWindows(-1, 10)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsZeroDepth() {
        assertThatThrownBy(() -> BASE.withMaxDepth(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxDepth");
    }

    @Test
    void rejectsBatchWindowShorterThanDebounce() {
        assertThatThrownBy(() -> BASE.withBatchWindows(60, 30))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void namedCopiesChangeOneField() {
        QuotaSettings changed = BASE.withEnabled(false).withCompressionEnabled(false).withMaxDepth(2);

        assertThat(changed.enabled()).isFalse();
        assertThat(changed.compressionEnabled()).isFalse();
        assertThat(changed.maxDepth()).isEqualTo(2);
        assertThat(changed.maxSizeBytes()).isEqualTo(BASE.maxSizeBytes());
        assertThat(changed.debounceWindowSeconds()).isEqualTo(BASE.debounceWindowSeconds());
    }
}
