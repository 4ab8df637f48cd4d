package com.phillippitts.labreasoning.service.model;

import com.phillippitts.labreasoning.exception.ModelCallException;
import com.phillippitts.labreasoning.exception.ModelCallExceptionBuilder;
import com.phillippitts.labreasoning.util.LogSanitizer;
import com.phillippitts.labreasoning.util.TimeUtils;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link ModelClient} backed by langchain4j {@link ChatModel}s, one per configured model id.
 *
 * <p>Timeouts are applied by the underlying chat model (see
 * {@link com.phillippitts.labreasoning.config.model.ModelClientConfig}). Any provider exception is
 * wrapped in a {@link ModelCallException} carrying the model id and call duration.
 */
public class LangChain4jModelClient implements ModelClient {

    private static final Logger LOG = LogManager.getLogger(LangChain4jModelClient.class);

    private static final ResponseFormat JSON_FORMAT = ResponseFormat.builder()
            .type(ResponseFormatType.JSON)
            .build();

    private final Map<String, ChatModel> models;

    public LangChain4jModelClient(Map<String, ChatModel> models) {
        Objects.requireNonNull(models, "models");
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
    }

    @Override
    public String invoke(String modelId, String systemPrompt, String userPrompt, ModelCallOptions options) {
        Objects.requireNonNull(options, "options");
        ChatModel model = models.get(modelId);
        if (model == null) {
            throw ModelCallExceptionBuilder.create("Model not configured")
                    .model(modelId)
                    .metadata("available", models.keySet())
                    .build();
        }

        ChatRequestParameters params = ChatRequestParameters.builder()
                .temperature(options.temperature())
                .responseFormat(options.jsonMode() ? JSON_FORMAT : null)
                .build();
        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt))
                .parameters(params)
                .build();

        long t0 = System.nanoTime();
        ChatResponse response;
        try {
            response = model.chat(request);
        } catch (RuntimeException e) {
            throw ModelCallExceptionBuilder.create("Model call failed")
                    .model(modelId)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .metadata("jsonMode", options.jsonMode())
                    .build();
        }
        long ms = TimeUtils.elapsedMillis(t0);

        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw ModelCallExceptionBuilder.create("Empty model reply")
                    .model(modelId)
                    .durationMs(ms)
                    .build();
        }
        LOG.debug("Model {} replied in {} ms: {}", modelId, ms, LogSanitizer.preview(text));
        return text;
    }

    @Override
    public Set<String> availableModels() {
        return models.keySet();
    }
}
