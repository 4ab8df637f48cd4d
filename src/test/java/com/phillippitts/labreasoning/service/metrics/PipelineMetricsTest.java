package com.phillippitts.labreasoning.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineMetricsTest {

    private MeterRegistry registry;
    private PipelineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(registry);
    }

    @Test
    void shouldRecordLatencyPerLayerAndModel() {
        metrics.recordModelLatency("fusion", "gemini-flash", 1200);
        metrics.recordModelLatency("fusion", "gemini-flash", 800);

        Timer timer = registry.find("labreasoning.pipeline.model.latency")
                .tag("layer", "fusion")
                .tag("model", "gemini-flash")
                .timer();

        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(2000);
    }

    @Test
    void shouldSeparateModelsWithinLayer() {
        metrics.incrementModelSuccess("fusion", "gemini-flash");
        metrics.incrementModelSuccess("fusion", "gpt-4o-mini");
        metrics.incrementModelSuccess("fusion", "gpt-4o-mini");

        assertThat(registry.find("labreasoning.pipeline.model.success").tag("model", "gemini-flash")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.find("labreasoning.pipeline.model.success").tag("model", "gpt-4o-mini")
                .counter().count()).isEqualTo(2.0);
    }

    @Test
    void shouldTagFailuresWithReason() {
        metrics.incrementModelFailure("triage", "gemini-flash", "parse_error");
        metrics.incrementModelFailure("triage", "gemini-flash", "timeout");
        metrics.incrementModelFailure("triage", "gemini-flash", "timeout");

        Counter timeouts = registry.find("labreasoning.pipeline.model.failure")
                .tag("reason", "timeout")
                .counter();

        assertThat(timeouts).isNotNull();
        assertThat(timeouts.count()).isEqualTo(2.0);
    }

    @Test
    void shouldCountConsensusLevels() {
        metrics.recordConsensusLevel("strong");
        metrics.recordConsensusLevel("divergent");
        metrics.recordConsensusLevel("strong");

        assertThat(registry.find("labreasoning.pipeline.consensus").tag("level", "strong").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("labreasoning.pipeline.consensus").tag("level", "divergent").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldRecordAnalysisOutcome() {
        metrics.recordAnalysis(5000, "success");
        metrics.recordAnalysis(100, "failure");

        assertThat(registry.find("labreasoning.pipeline.analysis").tag("outcome", "success").timer().count())
                .isEqualTo(1);
        assertThat(registry.find("labreasoning.pipeline.analysis").tag("outcome", "failure").timer().count())
                .isEqualTo(1);
    }
}
