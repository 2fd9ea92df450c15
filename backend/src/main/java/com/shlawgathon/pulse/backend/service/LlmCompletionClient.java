package com.shlawgathon.pulse.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.shlawgathon.pulse.backend.exception.LlmInvocationException;

/**
 * External completion service constrained to a JSON output schema.
 */
public interface LlmCompletionClient {

    /**
     * Run a completion and return the raw model text. The caller validates the
     * text against {@code schema}; this method only reports transport failures.
     *
     * @throws LlmInvocationException on timeout, network error or non-200 status
     */
    String complete(String prompt, JsonNode schema) throws LlmInvocationException;

    /**
     * Model identifier reported in digest metadata.
     */
    String modelName();
}
