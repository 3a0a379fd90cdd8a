package com.eainde.compliance.agent;

import com.eainde.compliance.model.EvidenceBundle;
import com.eainde.compliance.model.EvidenceSegment;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Shared parsing and formatting helpers for agent prompts and responses.
 */
final class AgentResponses {

    private AgentResponses() {
    }

    /**
     * Parses the first JSON object in a model response, tolerating code fences and chatter.
     *
     * @throws JsonProcessingException if no JSON object can be read
     */
    static JsonNode readObject(ObjectMapper objectMapper, String response) throws JsonProcessingException {
        if (response == null || response.isBlank()) {
            throw new IllegalArgumentException("empty model response");
        }
        String text = response.strip();
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("no JSON object in model response");
        }
        JsonNode node = objectMapper.readTree(text.substring(start, end + 1));
        if (!node.isObject()) {
            throw new IllegalArgumentException("model response is not a JSON object");
        }
        return node;
    }

    /** Text value of a field; null for missing, JSON null, blank or the literal "null". */
    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String text = value.asText();
        if (text.isBlank() || "null".equalsIgnoreCase(text.strip())) return null;
        return text;
    }

    static List<Integer> integers(JsonNode node, String field) {
        JsonNode value = node.get(field);
        List<Integer> result = new ArrayList<>();
        if (value != null && value.isArray()) {
            value.forEach(v -> {
                if (v.canConvertToInt()) result.add(v.asInt());
            });
        }
        return result;
    }

    static String formatEvidence(EvidenceBundle bundle) {
        List<EvidenceSegment> segments = bundle.segments();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            EvidenceSegment segment = segments.get(i);
            if (i > 0) sb.append("\n\n");
            sb.append("Document Chunk ").append(i + 1)
                    .append(" (pages ")
                    .append(segment.pages().stream().map(String::valueOf).collect(Collectors.joining(", ")))
                    .append("):\n")
                    .append(segment.text());
        }
        return sb.toString();
    }

    /** Collapses whitespace and lower-cases, for verbatim-quote matching. */
    static String normalize(String text) {
        return text.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
