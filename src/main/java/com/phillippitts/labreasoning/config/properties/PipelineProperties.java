package com.phillippitts.labreasoning.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the four-layer reasoning pipeline.
 */
@Validated
@ConfigurationProperties(prefix = "reasoning.pipeline")
public class PipelineProperties {

    /** Model id (key under {@code reasoning.models}) used by every layer. */
    @NotBlank
    private final String primaryModel;

    /** Model id queried alongside the primary in the fusion layer. */
    private final String challengerModel;

    /** Disable to run the fusion layer in single-model mode. */
    private final boolean challengerEnabled;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private final double triageTemperature;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private final double specialtyTemperature;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private final double fusionTemperature;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private final double explainabilityTemperature;

    /** Join timeout for the two concurrent fusion calls. */
    @Min(1)
    private final long fusionTimeoutMs;

    @ConstructorBinding
    public PipelineProperties(String primaryModel, String challengerModel, Boolean challengerEnabled,
                              Double triageTemperature, Double specialtyTemperature,
                              Double fusionTemperature, Double explainabilityTemperature,
                              Long fusionTimeoutMs) {
        this.primaryModel = primaryModel == null ? "gemini-flash" : primaryModel;
        this.challengerModel = challengerModel;
        this.challengerEnabled = challengerEnabled == null
                ? challengerModel != null && !challengerModel.isBlank()
                : challengerEnabled && challengerModel != null && !challengerModel.isBlank();
        this.triageTemperature = triageTemperature == null ? 0.1 : triageTemperature;
        this.specialtyTemperature = specialtyTemperature == null ? 0.3 : specialtyTemperature;
        this.fusionTemperature = fusionTemperature == null ? 0.2 : fusionTemperature;
        this.explainabilityTemperature = explainabilityTemperature == null ? 0.1 : explainabilityTemperature;
        this.fusionTimeoutMs = fusionTimeoutMs == null || fusionTimeoutMs <= 0 ? 60_000L : fusionTimeoutMs;
    }

    /**
     * Convenience constructor for tests: default temperatures and timeout.
     */
    public PipelineProperties(String primaryModel, String challengerModel, boolean challengerEnabled) {
        this(primaryModel, challengerModel, challengerEnabled, null, null, null, null, null);
    }

    public String getPrimaryModel() {
        return primaryModel;
    }

    public String getChallengerModel() {
        return challengerModel;
    }

    /**
     * True only when enabled and a challenger model id is configured.
     */
    public boolean isChallengerEnabled() {
        return challengerEnabled;
    }

    public double getTriageTemperature() {
        return triageTemperature;
    }

    public double getSpecialtyTemperature() {
        return specialtyTemperature;
    }

    public double getFusionTemperature() {
        return fusionTemperature;
    }

    public double getExplainabilityTemperature() {
        return explainabilityTemperature;
    }

    public long getFusionTimeoutMs() {
        return fusionTimeoutMs;
    }
}
