package com.shlawgathon.pulse.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Output contract of the per-developer status completion.
 */
@Component
public class StatusInsightSchema {

    public static final String VERSION = "pulse-status-insight/v1";

    public static final String NAME = "pulse_status_insight";

    public static final String STATUS = "status";
    public static final String CONFIDENCE = "confidence";
    public static final String REASON = "reason";
    public static final String TOPICS = "topics";
    public static final String MOOD = "mood";
    public static final String PRODUCTIVITY = "productivity";

    static final List<String> STATUS_VALUES = List.of("flow", "problem_solving", "blocked", "idle");
    static final List<String> MOOD_VALUES = List.of("positive", "neutral", "frustrated", "focused");
    static final List<String> PRODUCTIVITY_VALUES = List.of("high", "medium", "low");

    private static final Set<String> FIELDS = Set.of(STATUS, CONFIDENCE, REASON, TOPICS, MOOD, PRODUCTIVITY);

    private final JsonNode schema;

    public StatusInsightSchema(ObjectMapper objectMapper) {
        this.schema = buildSchema(objectMapper);
    }

    public JsonNode schema() {
        return schema;
    }

    /**
     * @return violations, empty when the reply conforms
     */
    public List<String> validate(JsonNode node) {
        List<String> violations = new ArrayList<>();
        if (node == null || !node.isObject()) {
            violations.add("reply is not a JSON object");
            return violations;
        }

        checkEnum(node, STATUS, STATUS_VALUES, violations);
        checkEnum(node, MOOD, MOOD_VALUES, violations);
        checkEnum(node, PRODUCTIVITY, PRODUCTIVITY_VALUES, violations);

        JsonNode confidence = node.get(CONFIDENCE);
        if (confidence == null || !confidence.isNumber()
                || confidence.asDouble() < 0 || confidence.asDouble() > 1) {
            violations.add(CONFIDENCE + ": expected number in [0, 1]");
        }

        JsonNode reason = node.get(REASON);
        if (reason == null || !reason.isTextual() || reason.asText().isBlank()) {
            violations.add(REASON + ": expected non-empty string");
        }

        JsonNode topics = node.get(TOPICS);
        if (topics == null || !topics.isArray()) {
            violations.add(TOPICS + ": expected array of strings");
        } else {
            for (JsonNode topic : topics) {
                if (!topic.isTextual()) {
                    violations.add(TOPICS + ": expected array of strings");
                    break;
                }
            }
        }

        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!FIELDS.contains(name)) {
                violations.add(name + ": unexpected field");
            }
        }
        return violations;
    }

    private static void checkEnum(JsonNode node, String field, List<String> allowed, List<String> violations) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || !allowed.contains(value.asText())) {
            violations.add(field + ": expected one of " + allowed);
        }
    }

    private static JsonNode buildSchema(ObjectMapper objectMapper) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("$id", VERSION);
        root.put("title", NAME);
        root.put("type", "object");
        root.put("additionalProperties", false);

        ObjectNode properties = root.putObject("properties");
        putEnum(properties, STATUS, STATUS_VALUES);
        ObjectNode confidence = properties.putObject(CONFIDENCE);
        confidence.put("type", "number");
        confidence.put("minimum", 0);
        confidence.put("maximum", 1);
        properties.putObject(REASON).put("type", "string");
        ObjectNode topics = properties.putObject(TOPICS);
        topics.put("type", "array");
        topics.putObject("items").put("type", "string");
        putEnum(properties, MOOD, MOOD_VALUES);
        putEnum(properties, PRODUCTIVITY, PRODUCTIVITY_VALUES);

        ArrayNode required = root.putArray("required");
        List.of(STATUS, CONFIDENCE, REASON, TOPICS, MOOD, PRODUCTIVITY).forEach(required::add);
        return root;
    }

    private static void putEnum(ObjectNode properties, String field, List<String> values) {
        ObjectNode property = properties.putObject(field);
        property.put("type", "string");
        ArrayNode allowed = property.putArray("enum");
        values.forEach(allowed::add);
    }
}
