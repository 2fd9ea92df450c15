package com.shlawgathon.pulse.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Output contract of the digest completion, version {@value #VERSION}.
 * Produces the JSON Schema sent to the model and validates replies against it.
 */
@Component
public class DigestSchema {

    public static final String VERSION = "pulse-digest/v1";

    public static final String NAME = "pulse_digest";

    public static final String RECENT_FOCUS = "recent_focus";
    public static final String ACTIVITY_SUMMARY = "activity_summary";
    public static final String KEY_LEARNINGS = "key_learnings";
    public static final String PROGRESS_HIGHLIGHTS = "progress_highlights";
    public static final String CURRENT_MOMENTUM = "current_momentum";
    public static final String LEARNING_TRAJECTORY = "learning_trajectory";
    public static final String PROBLEM_SOLVING_APPROACH = "problem_solving_approach";
    public static final String COLLABORATION_PATTERNS = "collaboration_patterns";
    public static final String GROWTH_AREAS = "growth_areas";
    public static final String TECHNICAL_DEPTH = "technical_depth";
    public static final String CONFIDENCE_SCORE = "confidence_score";

    static final Set<String> MOMENTUM_VALUES = Set.of("high", "medium", "low");
    static final Set<String> DEPTH_VALUES = Set.of("beginner", "intermediate", "advanced");

    private enum FieldKind { STRING, STRING_LIST, MOMENTUM, DEPTH, SCORE }

    private static final Map<String, FieldKind> FIELDS = new LinkedHashMap<>();

    static {
        FIELDS.put(RECENT_FOCUS, FieldKind.STRING);
        FIELDS.put(ACTIVITY_SUMMARY, FieldKind.STRING);
        FIELDS.put(KEY_LEARNINGS, FieldKind.STRING_LIST);
        FIELDS.put(PROGRESS_HIGHLIGHTS, FieldKind.STRING_LIST);
        FIELDS.put(CURRENT_MOMENTUM, FieldKind.MOMENTUM);
        FIELDS.put(LEARNING_TRAJECTORY, FieldKind.STRING);
        FIELDS.put(PROBLEM_SOLVING_APPROACH, FieldKind.STRING);
        FIELDS.put(COLLABORATION_PATTERNS, FieldKind.STRING);
        FIELDS.put(GROWTH_AREAS, FieldKind.STRING_LIST);
        FIELDS.put(TECHNICAL_DEPTH, FieldKind.DEPTH);
        FIELDS.put(CONFIDENCE_SCORE, FieldKind.SCORE);
    }

    private final JsonNode schema;

    public DigestSchema(ObjectMapper objectMapper) {
        this.schema = buildSchema(objectMapper);
    }

    public JsonNode schema() {
        return schema;
    }

    public static Set<String> fieldNames() {
        return FIELDS.keySet();
    }

    /**
     * Check a parsed reply against the contract.
     *
     * @return violations, empty when the reply conforms
     */
    public List<String> validate(JsonNode node) {
        List<String> violations = new ArrayList<>();
        if (node == null || !node.isObject()) {
            violations.add("reply is not a JSON object");
            return violations;
        }

        for (Map.Entry<String, FieldKind> field : FIELDS.entrySet()) {
            JsonNode value = node.get(field.getKey());
            if (value == null || value.isNull()) {
                violations.add(field.getKey() + ": missing");
                continue;
            }
            switch (field.getValue()) {
                case STRING -> {
                    if (!value.isTextual() || value.asText().isBlank()) {
                        violations.add(field.getKey() + ": expected non-empty string");
                    }
                }
                case STRING_LIST -> {
                    if (!value.isArray()) {
                        violations.add(field.getKey() + ": expected array of strings");
                    } else {
                        for (JsonNode item : value) {
                            if (!item.isTextual()) {
                                violations.add(field.getKey() + ": expected array of strings");
                                break;
                            }
                        }
                    }
                }
                case MOMENTUM -> {
                    if (!value.isTextual() || !MOMENTUM_VALUES.contains(value.asText())) {
                        violations.add(field.getKey() + ": expected one of " + MOMENTUM_VALUES);
                    }
                }
                case DEPTH -> {
                    if (!value.isTextual() || !DEPTH_VALUES.contains(value.asText())) {
                        violations.add(field.getKey() + ": expected one of " + DEPTH_VALUES);
                    }
                }
                case SCORE -> {
                    if (!value.isNumber() || value.asDouble() < 0 || value.asDouble() > 1) {
                        violations.add(field.getKey() + ": expected number in [0, 1]");
                    }
                }
            }
        }

        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!FIELDS.containsKey(name)) {
                violations.add(name + ": unexpected field");
            }
        }
        return violations;
    }

    private static JsonNode buildSchema(ObjectMapper objectMapper) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("$id", VERSION);
        root.put("title", NAME);
        root.put("type", "object");
        root.put("additionalProperties", false);

        ObjectNode properties = root.putObject("properties");
        ArrayNode required = root.putArray("required");
        for (Map.Entry<String, FieldKind> field : FIELDS.entrySet()) {
            required.add(field.getKey());
            ObjectNode property = properties.putObject(field.getKey());
            switch (field.getValue()) {
                case STRING -> property.put("type", "string");
                case STRING_LIST -> {
                    property.put("type", "array");
                    property.putObject("items").put("type", "string");
                }
                case MOMENTUM -> {
                    property.put("type", "string");
                    ArrayNode values = property.putArray("enum");
                    values.add("high").add("medium").add("low");
                }
                case DEPTH -> {
                    property.put("type", "string");
                    ArrayNode values = property.putArray("enum");
                    values.add("beginner").add("intermediate").add("advanced");
                }
                case SCORE -> {
                    property.put("type", "number");
                    property.put("minimum", 0);
                    property.put("maximum", 1);
                }
            }
        }
        return root;
    }
}
