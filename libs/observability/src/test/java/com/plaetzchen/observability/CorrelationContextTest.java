package com.plaetzchen.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CorrelationContext")
class CorrelationContextTest {

    @Test
    @DisplayName("should reject null correlationId")
    void shouldRejectNullCorrelationId() {
        assertThatThrownBy(() -> new CorrelationContext(null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
    }

    @Test
    @DisplayName("should reject blank correlationId")
    void shouldRejectBlankCorrelationId() {
        assertThatThrownBy(() -> new CorrelationContext("  ", "42", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("withUserId keeps correlation and request ids")
    void withUserIdKeepsOtherFields() {
        var anonymous = new CorrelationContext("corr-1", null, "req-1");

        var bound = anonymous.withUserId("42");

        assertThat(bound.correlationId()).isEqualTo("corr-1");
        assertThat(bound.requestId()).isEqualTo("req-1");
        assertThat(bound.userId()).isEqualTo("42");
        assertThat(anonymous.userId()).isNull();
    }
}
