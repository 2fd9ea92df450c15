package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.model.DigestResult;

import java.util.Objects;

/**
 * Result of one LLM digest attempt. Only {@link Kind#OK} carries a digest.
 */
public record DigestOutcome(Kind kind, DigestResult digest, String error) {

    public enum Kind {
        OK,
        SCHEMA_ERROR,
        TRANSPORT_ERROR
    }

    public DigestOutcome {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.OK && digest == null) {
            throw new IllegalArgumentException("OK outcome requires a digest");
        }
    }

    public static DigestOutcome ok(DigestResult digest) {
        return new DigestOutcome(Kind.OK, digest, null);
    }

    public static DigestOutcome schemaError(String error) {
        return new DigestOutcome(Kind.SCHEMA_ERROR, null, error);
    }

    public static DigestOutcome transportError(String error) {
        return new DigestOutcome(Kind.TRANSPORT_ERROR, null, error);
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }
}
