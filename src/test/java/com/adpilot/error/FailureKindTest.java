package com.adpilot.error;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;

import static org.assertj.core.api.Assertions.assertThat;

class FailureKindTest {

    @Test
    void shouldClassifyOwnExceptionsByKind() {
        assertThat(FailureKind.classify(new ValidationException("bad payload"))).isEqualTo(FailureKind.VALIDATION);
        assertThat(FailureKind.classify(new PermanentException("gone"))).isEqualTo(FailureKind.PERMANENT);
        assertThat(FailureKind.classify(new ConfigurationException("no key"))).isEqualTo(FailureKind.CONFIGURATION);
        assertThat(FailureKind.classify(new TransientException("timeout"))).isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void shouldFindClassifiedCauseInChain() {
        RuntimeException wrapped = new IllegalStateException("adapter failed",
                new PermanentException("Campaign not found: c1"));

        assertThat(FailureKind.classify(wrapped)).isEqualTo(FailureKind.PERMANENT);
    }

    @Test
    void shouldTreatUnknownFailuresAsTransient() {
        assertThat(FailureKind.classify(new UncheckedIOException(new IOException("reset"))))
                .isEqualTo(FailureKind.TRANSIENT);
        assertThat(FailureKind.classify(null)).isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void shouldOnlyRetryTransientFailures() {
        assertThat(FailureKind.TRANSIENT.isRetryable()).isTrue();
        assertThat(FailureKind.VALIDATION.isRetryable()).isFalse();
        assertThat(FailureKind.PERMANENT.isRetryable()).isFalse();
        assertThat(FailureKind.CONFIGURATION.isRetryable()).isFalse();
    }
}
