package com.libragraph.vcl.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class QuotaStatusTest {

    @Test
    void severityIsOrdered() {
        assertThat(QuotaStatus.CRITICAL.isAtLeast(QuotaStatus.WARNING)).isTrue();
        assertThat(QuotaStatus.WARNING.isAtLeast(QuotaStatus.APPROACHING_LIMIT)).isTrue();
        assertThat(QuotaStatus.OK.isAtLeast(QuotaStatus.APPROACHING_LIMIT)).isFalse();
    }

    @Test
    void labelsMatchReportVocabulary() {
        assertThat(QuotaStatus.APPROACHING_LIMIT.label()).isEqualTo("approaching_limit");
        assertThat(SkipReason.QUOTA_EXCEEDED.label()).isEqualTo("quota_exceeded");
    }

    @Test
    void shouldRejectUnknownIds() {
        assertThatIllegalArgumentException().isThrownBy(() -> QuotaStatus.fromId(7));
        assertThatIllegalArgumentException().isThrownBy(() -> SkipReason.fromId(-1));
    }
}
