package com.phillippitts.labreasoning.service.health;

import com.phillippitts.labreasoning.config.properties.PipelineProperties;
import com.phillippitts.labreasoning.service.model.ModelClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Health indicator for model availability.
 *
 * <p>DOWN when the primary model is not registered. UP otherwise; a missing challenger is
 * reported as a detail because the pipeline still runs in single-model mode.
 */
@Component
public class ModelClientHealthIndicator implements HealthIndicator {

    private final ModelClient modelClient;
    private final PipelineProperties properties;

    public ModelClientHealthIndicator(ModelClient modelClient, PipelineProperties properties) {
        this.modelClient = modelClient;
        this.properties = properties;
    }

    @Override
    public Health health() {
        Set<String> available = modelClient.availableModels();
        boolean primaryOk = available.contains(properties.getPrimaryModel());
        String challenger = properties.isChallengerEnabled()
                ? (available.contains(properties.getChallengerModel()) ? "available" : "missing")
                : "disabled";

        Health.Builder builder = primaryOk ? Health.up() : Health.down();
        return builder
                .withDetail("primaryModel", properties.getPrimaryModel() + (primaryOk ? " (available)" : " (missing)"))
                .withDetail("challengerModel", properties.getChallengerModel() + " (" + challenger + ")")
                .withDetail("availableModels", available)
                .build();
    }
}
