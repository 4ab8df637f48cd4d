package com.phillippitts.labreasoning.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelCallExceptionBuilderTest {

    @Test
    void shouldBuildSimpleException() {
        ModelCallException ex = ModelCallExceptionBuilder.create("Model not configured")
                .model("gpt-4o-mini")
                .build();

        assertThat(ex.getMessage()).isEqualTo("Model not configured (model: gpt-4o-mini)");
        assertThat(ex.getModelId()).isEqualTo("gpt-4o-mini");
        assertThat(ex.getCause()).isNull();
    }

    @Test
    void shouldIncludeDurationAndMetadataInOrder() {
        RuntimeException cause = new RuntimeException("HTTP 503");
        ModelCallException ex = ModelCallExceptionBuilder.create("Model call failed")
                .model("gemini-flash")
                .cause(cause)
                .durationMs(1500)
                .metadata("jsonMode", true)
                .metadata("attempt", 1)
                .build();

        assertThat(ex.getMessage())
                .isEqualTo("Model call failed (durationMs=1500, jsonMode=true, attempt=1) (model: gemini-flash)");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void shouldIgnoreNullMetadata() {
        ModelCallException ex = ModelCallExceptionBuilder.create("Empty model reply")
                .metadata(null, "x")
                .metadata("key", null)
                .build();

        assertThat(ex.getMessage()).isEqualTo("Empty model reply (model: unknown)");
    }

    @Test
    void shouldRejectEmptyMessage() {
        assertThatThrownBy(() -> ModelCallExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ModelCallExceptionBuilder.create(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
