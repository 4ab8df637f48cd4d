package com.phillippitts.labreasoning.service.model;

import com.phillippitts.labreasoning.exception.ModelCallException;

import java.util.Set;

/**
 * Abstraction over chat-completion providers.
 *
 * <p>Implementations send one system prompt and one user prompt to the model registered under
 * {@code modelId} and return the raw reply text. No parsing happens here; callers decide how to
 * interpret the reply.
 *
 * <p><b>Thread Safety:</b> implementations must be safe for concurrent use; the fusion layer
 * issues two calls at once.
 *
 * <p><b>Retries:</b> implementations do not retry. A failed call surfaces as a
 * {@link ModelCallException} immediately.
 */
public interface ModelClient {

    /**
     * Invokes a model.
     *
     * @param modelId      configured model id
     * @param systemPrompt system instructions
     * @param userPrompt   user content
     * @param options      temperature and JSON mode
     * @return raw reply text, never blank
     * @throws ModelCallException on transport, authentication, quota or timeout errors, on an
     *                            unknown model id, or when the reply is empty
     */
    String invoke(String modelId, String systemPrompt, String userPrompt, ModelCallOptions options);

    default String invoke(ModelCallRequest request) {
        return invoke(request.modelId(), request.systemPrompt(), request.userPrompt(), request.options());
    }

    /**
     * Model ids this client can serve.
     */
    Set<String> availableModels();
}
