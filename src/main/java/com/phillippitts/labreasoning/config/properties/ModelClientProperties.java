package com.phillippitts.labreasoning.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Model endpoint configuration, keyed by model id.
 *
 * <pre>
 * reasoning.models.gemini-flash.base-url=...
 * reasoning.models.gemini-flash.api-key=${GEMINI_API_KEY:}
 * reasoning.models.gemini-flash.model-name=gemini-2.5-flash
 * </pre>
 */
@ConfigurationProperties(prefix = "reasoning")
public class ModelClientProperties {

    private Map<String, ModelEndpoint> models = new LinkedHashMap<>();

    public Map<String, ModelEndpoint> getModels() {
        return models;
    }

    public void setModels(Map<String, ModelEndpoint> models) {
        this.models = models;
    }

    /**
     * One OpenAI-compatible chat endpoint.
     */
    public static class ModelEndpoint {
        private String baseUrl;
        private String apiKey;
        private String modelName;
        private long timeoutMs = 45_000;
        private int maxRetries = 0;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
