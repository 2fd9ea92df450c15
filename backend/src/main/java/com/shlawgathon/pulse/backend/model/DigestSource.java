package com.shlawgathon.pulse.backend.model;

/**
 * Where a digest came from.
 */
public enum DigestSource {
    LLM, // Schema-valid model output
    FALLBACK // Keyword heuristics after an LLM failure
}
