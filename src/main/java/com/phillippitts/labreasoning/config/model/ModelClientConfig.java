package com.phillippitts.labreasoning.config.model;

import com.phillippitts.labreasoning.config.properties.ModelClientProperties;
import com.phillippitts.labreasoning.config.properties.PipelineProperties;
import com.phillippitts.labreasoning.service.model.LangChain4jModelClient;
import com.phillippitts.labreasoning.service.model.ModelClient;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds one OpenAI-compatible chat model per {@code reasoning.models.<id>} entry.
 *
 * <p>Entries without an API key are skipped with a warning. A missing primary model is reported
 * at startup but does not fail the context: every call to it will fail with a
 * {@link com.phillippitts.labreasoning.exception.ModelCallException} and the pipeline degrades
 * accordingly.
 */
@Configuration
public class ModelClientConfig {

    private static final Logger LOG = LogManager.getLogger(ModelClientConfig.class);

    @Bean
    @ConditionalOnMissingBean(ModelClient.class)
    public ModelClient modelClient(ModelClientProperties props, PipelineProperties pipeline) {
        Map<String, ChatModel> models = new LinkedHashMap<>();
        props.getModels().forEach((id, endpoint) -> {
            if (!endpoint.hasApiKey()) {
                LOG.warn("Model '{}' has no API key configured; it will not be available", id);
                return;
            }
            models.put(id, OpenAiChatModel.builder()
                    .baseUrl(endpoint.getBaseUrl())
                    .apiKey(endpoint.getApiKey())
                    .modelName(endpoint.getModelName())
                    .timeout(Duration.ofMillis(endpoint.getTimeoutMs()))
                    .maxRetries(endpoint.getMaxRetries())
                    .build());
            LOG.info("Registered model '{}' ({} at {})", id, endpoint.getModelName(), endpoint.getBaseUrl());
        });

        if (!models.containsKey(pipeline.getPrimaryModel())) {
            LOG.error("Primary model '{}' is not available; analyses will fail at the fusion layer",
                    pipeline.getPrimaryModel());
        }
        if (pipeline.isChallengerEnabled() && !models.containsKey(pipeline.getChallengerModel())) {
            LOG.warn("Challenger model '{}' is not available; fusion will run in single-model mode",
                    pipeline.getChallengerModel());
        }
        return new LangChain4jModelClient(models);
    }
}
