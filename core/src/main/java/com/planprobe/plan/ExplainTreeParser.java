package com.planprobe.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parses DuckDB's JSON plan rendering into {@link PlanNode} trees.
 *
 * <p>Expected format ({@code EXPLAIN (FORMAT JSON)}):
 * <pre>
 * [
 *   {
 *     "name": "PROJECTION",
 *     "children": [ { "name": "TABLE_SCAN", "children": [], "extra_info": {...} } ],
 *     "extra_info": { "Projections": "json_payload", "Estimated Cardinality": "1" }
 *   }
 * ]
 * </pre>
 *
 * <p>Detail values that the engine reports as arrays or multi-line strings are
 * joined with {@code ", "}. A document with several top-level operators is
 * wrapped in a synthetic {@value #SYNTHETIC_ROOT} node.
 */
public final class ExplainTreeParser {

    public static final String SYNTHETIC_ROOT = "PLAN";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private ExplainTreeParser() {}

    /**
     * Parses a JSON plan document.
     *
     * @param json the engine's JSON rendering
     * @return the root node
     * @throws IllegalArgumentException if the text is not a JSON plan
     */
    public static PlanNode parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Plan document cannot be null or empty");
        }
        JsonNode document;
        try {
            document = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse JSON plan: " + e.getOriginalMessage(), e);
        }

        if (document.isObject()) {
            return parseNode(document);
        }
        if (document.isArray()) {
            List<PlanNode> roots = new ArrayList<>();
            for (JsonNode element : document) {
                roots.add(parseNode(element));
            }
            if (roots.size() == 1) {
                return roots.get(0);
            }
            return new PlanNode(SYNTHETIC_ROOT, Map.of(), roots);
        }
        throw new IllegalArgumentException("Unexpected JSON plan document: " + document.getNodeType());
    }

    private static PlanNode parseNode(JsonNode node) {
        if (!node.isObject() || !node.has("name")) {
            throw new IllegalArgumentException("Plan node without a name: " + node);
        }
        String name = node.get("name").asText().trim();

        Map<String, String> details = new LinkedHashMap<>();
        JsonNode extraInfo = node.path("extra_info");
        if (extraInfo.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = extraInfo.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String value = detailText(field.getValue());
                if (!value.isEmpty()) {
                    details.put(field.getKey().trim(), value);
                }
            }
        } else if (extraInfo.isTextual() && !extraInfo.asText().isBlank()) {
            details.put("info", flatten(extraInfo.asText()));
        }

        List<PlanNode> children = new ArrayList<>();
        for (JsonNode child : node.path("children")) {
            children.add(parseNode(child));
        }
        return new PlanNode(name, details, children);
    }

    private static String detailText(JsonNode value) {
        if (value.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode element : value) {
                parts.add(detailText(element));
            }
            return parts.stream().filter(part -> !part.isEmpty()).collect(Collectors.joining(", "));
        }
        if (value.isValueNode()) {
            return flatten(value.asText());
        }
        return value.toString();
    }

    private static String flatten(String text) {
        return Arrays.stream(text.split("\\R"))
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .collect(Collectors.joining(", "));
    }
}
