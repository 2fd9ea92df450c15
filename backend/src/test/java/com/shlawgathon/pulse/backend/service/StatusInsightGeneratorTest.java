package com.shlawgathon.pulse.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.pulse.backend.config.PulseProperties;
import com.shlawgathon.pulse.backend.exception.LlmInvocationException;
import com.shlawgathon.pulse.backend.model.DeveloperMood;
import com.shlawgathon.pulse.backend.model.DeveloperStatus;
import com.shlawgathon.pulse.backend.model.DigestSource;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.model.ProductivityLevel;
import com.shlawgathon.pulse.backend.model.StatusInsight;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

import static com.shlawgathon.pulse.backend.TestRecords.record;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class StatusInsightGeneratorTest {

    private static final String VALID_REPLY = """
            {
              "status": "problem_solving",
              "confidence": 0.9,
              "reason": "Several attempts at the same websocket reconnect issue",
              "topics": ["websocket", "redis"],
              "mood": "focused",
              "productivity": "medium"
            }
            """;

    private ObjectMapper objectMapper;
    private StatusInsightSchema schema;
    private LlmCompletionClient client;
    private StatusInsightGenerator generator;

    private final List<InteractionRecord> records = List.of(
            record("alice", "why does the websocket reconnect loop?", Duration.ofMinutes(2)),
            record("alice", "add redis pub/sub fan-out", Duration.ofMinutes(15)));

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        schema = new StatusInsightSchema(objectMapper);
        client = mock(LlmCompletionClient.class);
        generator = new StatusInsightGenerator(client, schema, objectMapper, new PulseProperties());
    }

    @Test
    void shouldReturnLlmInsightForValidReply() throws Exception {
        when(client.complete(anyString(), any(JsonNode.class))).thenReturn(VALID_REPLY);

        StatusInsight insight = generator.analyze("alice", records);

        assertEquals(DigestSource.LLM, insight.getSource());
        assertEquals("alice", insight.getUserId());
        assertEquals(DeveloperStatus.PROBLEM_SOLVING, insight.getEnhancedStatus());
        assertEquals(DeveloperMood.FOCUSED, insight.getMood());
        assertEquals(ProductivityLevel.MEDIUM, insight.getProductivity());
        assertEquals(0.9, insight.getConfidence(), 1e-9);
        assertEquals(List.of("websocket", "redis"), insight.getKeyTopics());
        assertEquals(List.of("Break down the problem into smaller parts", "Consider alternative approaches"),
                insight.getRecommendations());
    }

    @Test
    void shouldSendStatusSchemaWithPrompt() throws Exception {
        when(client.complete(anyString(), any(JsonNode.class))).thenReturn(VALID_REPLY);

        generator.analyze("alice", records);

        verify(client).complete(anyString(), eq(schema.schema()));
        assertEquals(StatusInsightSchema.NAME, schema.schema().path("title").asText());
    }

    @Test
    void shouldFallBackWhenReplyViolatesSchema() throws Exception {
        when(client.complete(anyString(), any(JsonNode.class)))
                .thenReturn("{\"status\": \"sleeping\", \"confidence\": 2, \"reason\": \"\", \"topics\": [],"
                        + " \"mood\": \"focused\", \"productivity\": \"medium\"}");

        StatusInsight insight = generator.analyze("alice", records);

        assertEquals(DigestSource.FALLBACK, insight.getSource());
        assertEquals(StatusInsightGenerator.FALLBACK_CONFIDENCE, insight.getConfidence(), 1e-9);
    }

    @Test
    void shouldFallBackOnTransportFailure() throws Exception {
        when(client.complete(anyString(), any(JsonNode.class)))
                .thenThrow(new LlmInvocationException("timed out", new HttpTimeoutException("request timed out")));

        StatusInsight insight = generator.analyze("alice", records);

        assertEquals(DigestSource.FALLBACK, insight.getSource());
        assertEquals(DeveloperStatus.FLOW, insight.getEnhancedStatus());
        verify(client, times(1)).complete(anyString(), any(JsonNode.class));
    }

    @Test
    void shouldFallBackOnReplyWithoutJson() throws Exception {
        when(client.complete(anyString(), any(JsonNode.class))).thenReturn("I cannot tell from these messages.");

        assertEquals(DigestSource.FALLBACK, generator.analyze("alice", records).getSource());
    }

    @Test
    void shouldReadBlockedAndFrustratedFromErrorKeywords() {
        List<InteractionRecord> stuck = List.of(
                record("bob", "stuck on the auth error again", Duration.ofMinutes(1)),
                record("bob", "auth test still failing", Duration.ofMinutes(5)),
                record("bob", "api returns 401", Duration.ofMinutes(9)),
                record("bob", "ui flickers", Duration.ofMinutes(12)));

        StatusInsight insight = StatusInsightGenerator.fallback("bob", stuck);

        assertEquals(DeveloperStatus.BLOCKED, insight.getEnhancedStatus());
        assertEquals(DeveloperMood.FRUSTRATED, insight.getMood());
        assertEquals(ProductivityLevel.HIGH, insight.getProductivity());
        assertEquals("Fallback analysis (LLM unavailable)", insight.getStatusReason());
        assertEquals(List.of("api", "auth", "test"), insight.getKeyTopics());
        assertTrue(insight.getRecommendations().isEmpty());
    }

    @Test
    void shouldReadProblemSolvingFromDebugKeywords() {
        StatusInsight insight = StatusInsightGenerator.fallback("bob", List.of(
                record("bob", "debug the flaky scheduler", Duration.ofMinutes(1)),
                record("bob", "add a chart", Duration.ofMinutes(3))));

        assertEquals(DeveloperStatus.PROBLEM_SOLVING, insight.getEnhancedStatus());
        assertEquals(DeveloperMood.FOCUSED, insight.getMood());
        assertEquals(ProductivityLevel.MEDIUM, insight.getProductivity());
    }

    @Test
    void shouldOnlyReadNewestThreeRecordsForKeywords() {
        StatusInsight insight = StatusInsightGenerator.fallback("bob", List.of(
                record("bob", "add search", Duration.ofMinutes(1)),
                record("bob", "add filters", Duration.ofMinutes(2)),
                record("bob", "add sorting", Duration.ofMinutes(3)),
                record("bob", "stuck on an error", Duration.ofMinutes(4))));

        assertEquals(DeveloperStatus.FLOW, insight.getEnhancedStatus());
        assertEquals(DeveloperMood.POSITIVE, insight.getMood());
    }

    @Test
    void shouldBeIdleWithoutRecords() {
        StatusInsight insight = StatusInsightGenerator.fallback("bob", List.of());

        assertEquals(DeveloperStatus.IDLE, insight.getEnhancedStatus());
        assertEquals(DeveloperMood.NEUTRAL, insight.getMood());
        assertEquals(ProductivityLevel.LOW, insight.getProductivity());
    }

    @Test
    void shouldRecommendBreakOnlyWhenBlockedAndFrustrated() {
        assertEquals(2, StatusInsightGenerator.recommendationsFor(DeveloperStatus.BLOCKED, DeveloperMood.FRUSTRATED).size());
        assertTrue(StatusInsightGenerator.recommendationsFor(DeveloperStatus.BLOCKED, DeveloperMood.FOCUSED).isEmpty());
        assertEquals("Consider helping blocked teammates",
                StatusInsightGenerator.recommendationsFor(DeveloperStatus.FLOW, DeveloperMood.POSITIVE).get(1));
    }

    @Test
    void shouldLimitPromptToNewestRecords() {
        List<InteractionRecord> many = List.of(
                record("alice", "first question", Duration.ofMinutes(1)),
                record("alice", "second question", Duration.ofMinutes(2)),
                record("alice", "third question", Duration.ofMinutes(3)),
                record("alice", "fourth question", Duration.ofMinutes(4)),
                record("alice", "fifth question", Duration.ofMinutes(5)),
                record("alice", "sixth question", Duration.ofMinutes(6)));

        String prompt = generator.buildPrompt(many);

        assertTrue(prompt.contains("1. Query: \"first question\""));
        assertTrue(prompt.contains("fifth question"));
        assertFalse(prompt.contains("sixth question"));
        assertTrue(prompt.contains(StatusInsightSchema.VERSION));
    }

    @Test
    void shouldRejectUnexpectedFields() throws Exception {
        JsonNode node = objectMapper.readTree(VALID_REPLY.replace("\"mood\"", "\"extra\": 1, \"mood\""));

        assertEquals(List.of("extra: unexpected field"), schema.validate(node));
    }
}
