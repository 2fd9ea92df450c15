package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.exception.LlmInvocationException;
import com.shlawgathon.pulse.backend.model.DigestResult;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Produces a digest through the LLM and falls back to keyword heuristics on any
 * failure. Exactly one fallback runs per failed attempt; there are no retries.
 */
@Service
public class DigestGenerator {

    private static final Logger log = LoggerFactory.getLogger(DigestGenerator.class);

    private final LlmCompletionClient llmCompletionClient;
    private final DigestPromptBuilder digestPromptBuilder;
    private final DigestResponseParser digestResponseParser;
    private final DigestFallbackBuilder digestFallbackBuilder;
    private final DigestSchema digestSchema;
    private final Clock clock;

    public DigestGenerator(LlmCompletionClient llmCompletionClient,
            DigestPromptBuilder digestPromptBuilder,
            DigestResponseParser digestResponseParser,
            DigestFallbackBuilder digestFallbackBuilder,
            DigestSchema digestSchema,
            Clock clock) {
        this.llmCompletionClient = llmCompletionClient;
        this.digestPromptBuilder = digestPromptBuilder;
        this.digestResponseParser = digestResponseParser;
        this.digestFallbackBuilder = digestFallbackBuilder;
        this.digestSchema = digestSchema;
        this.clock = clock;
    }

    /**
     * Generate a digest. Never throws for LLM failures and never returns null.
     *
     * @param sample the user's records, newest first
     */
    public DigestResult generate(String userId, List<InteractionRecord> sample) {
        DigestOutcome outcome = attempt(userId, sample);
        return switch (outcome.kind()) {
            case OK -> {
                log.info("[DIGEST] LLM digest for user: {} | records: {} | confidence: {}",
                        userId, sample.size(), outcome.digest().getConfidenceScore());
                yield outcome.digest();
            }
            case SCHEMA_ERROR -> {
                log.warn("[DIGEST] Reply for user: {} failed validation, using fallback: {}",
                        userId, outcome.error());
                yield digestFallbackBuilder.build(userId, sample, clock.instant());
            }
            case TRANSPORT_ERROR -> {
                log.warn("[DIGEST] LLM call for user: {} failed, using fallback: {}", userId, outcome.error());
                yield digestFallbackBuilder.build(userId, sample, clock.instant());
            }
        };
    }

    DigestOutcome attempt(String userId, List<InteractionRecord> sample) {
        String prompt = digestPromptBuilder.build(sample);
        String raw;
        try {
            raw = llmCompletionClient.complete(prompt, digestSchema.schema());
        } catch (LlmInvocationException e) {
            String reason = e.isRateLimited() ? "rate limited" : e.getMessage();
            return DigestOutcome.transportError(reason);
        } catch (RuntimeException e) {
            log.debug("[DIGEST] Unexpected client failure", e);
            return DigestOutcome.transportError(e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        Instant generatedAt = clock.instant();
        return digestResponseParser.parse(raw, userId, sample.size(), generatedAt);
    }
}
