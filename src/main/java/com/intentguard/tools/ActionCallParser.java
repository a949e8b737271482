package com.intentguard.tools;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Strict parser for an agent's action call: exactly one JSON object of the form
 * {@code {"action": "read_email", "params": {...}}}. Prose around the object is not a call.
 */
public class ActionCallParser {
    public static final String ERR_INVALID_FORMAT = "action_call_invalid_format";
    public static final String ERR_MULTIPLE = "action_call_multiple";
    public static final String ERR_INVALID_PARAMS = "action_call_invalid_params";

    // tool/args is the shape most agent frameworks emit for tool calls.
    private static final Map<String, String> FIELD_ALIASES = Map.of(
        "tool", "action",
        "args", "params"
    );
    private static final Set<String> FIELDS = Set.of("action", "params");
    private static final TypeReference<LinkedHashMap<String, Object>> PARAMS_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ActionCallParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
    }

    public ActionCallParseResult parseStrict(String content) {
        if (content == null) {
            return ActionCallParseResult.noCall();
        }
        String trimmed = content.trim();
        if (trimmed.isEmpty()) {
            return ActionCallParseResult.noCall();
        }
        trimmed = unwrapStrictJsonCodeFence(trimmed);
        trimmed = stripInvisibleEdgeChars(trimmed);
        if (!trimmed.startsWith("{") || !trimmed.endsWith("}")) {
            return ActionCallParseResult.noCall();
        }
        if (containsMultipleJsonObjects(trimmed)) {
            return ActionCallParseResult.error(ERR_MULTIPLE);
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(trimmed);
        } catch (Exception e) {
            return ActionCallParseResult.error(ERR_INVALID_FORMAT);
        }
        if (node == null || !node.isObject()) {
            return ActionCallParseResult.error(ERR_INVALID_FORMAT);
        }

        JsonNode actionNode = null;
        JsonNode paramsNode = null;
        Iterator<String> fields = node.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            String canonical = FIELD_ALIASES.getOrDefault(field, field);
            if (!FIELDS.contains(canonical)) {
                return ActionCallParseResult.error(ERR_INVALID_FORMAT, "unknown-field:" + field);
            }
            if ("action".equals(canonical)) {
                if (actionNode != null) {
                    return ActionCallParseResult.error(ERR_INVALID_FORMAT, "duplicate-field:" + field);
                }
                actionNode = node.get(field);
            } else {
                if (paramsNode != null) {
                    return ActionCallParseResult.error(ERR_INVALID_FORMAT, "duplicate-field:" + field);
                }
                paramsNode = node.get(field);
            }
        }

        if (actionNode == null || !actionNode.isTextual() || actionNode.asText().isBlank()) {
            return ActionCallParseResult.error(ERR_INVALID_FORMAT, "missing-action");
        }
        String action = actionNode.asText().trim();

        Map<String, Object> params;
        if (paramsNode == null || paramsNode.isNull()) {
            params = Collections.emptyMap();
        } else {
            String paramsError = validateParams(paramsNode);
            if (paramsError != null) {
                return ActionCallParseResult.error(ERR_INVALID_PARAMS, paramsError);
            }
            params = Collections.unmodifiableMap(objectMapper.convertValue(paramsNode, PARAMS_TYPE));
        }
        return ActionCallParseResult.call(new ActionCall(action, params, trimmed));
    }

    private String validateParams(JsonNode paramsNode) {
        if (!paramsNode.isObject()) {
            return "params-not-object";
        }
        Iterator<Map.Entry<String, JsonNode>> entries = paramsNode.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode value = entry.getValue();
            if (!value.isNull() && !value.isValueNode()) {
                return "invalid-type:" + entry.getKey();
            }
        }
        return null;
    }

    private String unwrapStrictJsonCodeFence(String trimmed) {
        String t = trimmed.trim();
        if (!t.startsWith("```")) return t;
        // Only a single object inside a single fence, no prose on either side.
        String[] lines = t.split("\n", -1);
        if (lines.length < 3) return t;
        String first = lines[0].trim();
        String last = lines[lines.length - 1].trim();
        if (!first.startsWith("```") || !"```".equals(last)) return t;
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i < lines.length - 1; i++) {
            sb.append(lines[i]);
            if (i < lines.length - 2) sb.append("\n");
        }
        return sb.toString().trim();
    }

    private String stripInvisibleEdgeChars(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isInvisible(value.charAt(start))) {
            start++;
        }
        while (end > start && isInvisible(value.charAt(end - 1))) {
            end--;
        }
        if (start == 0 && end == value.length()) return value;
        return value.substring(start, end).trim();
    }

    private static boolean isInvisible(char c) {
        return c == '\uFEFF' || c == '\u200B' || c == '\u200C' || c == '\u200D' || c == '\u2060';
    }

    private boolean containsMultipleJsonObjects(String trimmed) {
        int depth = 0;
        boolean seenObject = false;
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
                if (depth == 1 && seenObject) {
                    return true;
                }
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
                if (depth == 0) {
                    seenObject = true;
                }
            }
        }
        return false;
    }
}
