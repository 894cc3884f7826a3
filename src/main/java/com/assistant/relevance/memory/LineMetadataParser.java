package com.assistant.relevance.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits the {@code | meta=<json>} trailer off a memory line and writes it back.
 * A trailer that is not a JSON object is dropped; the line text is always kept.
 */
public class LineMetadataParser {
    private static final Logger log = LoggerFactory.getLogger(LineMetadataParser.class);

    static final String MARKER = "| meta=";

    private final ObjectMapper mapper;

    public LineMetadataParser() {
        this(new ObjectMapper());
    }

    public LineMetadataParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Splits a raw line at the last metadata marker.
     */
    public ParsedLine parse(String rawLine) {
        if (rawLine == null) {
            return new ParsedLine("", LineMetadata.empty());
        }
        int idx = rawLine.lastIndexOf(MARKER);
        if (idx < 0) {
            return new ParsedLine(rawLine.trim(), LineMetadata.empty());
        }
        String content = rawLine.substring(0, idx).trim();
        String rawMeta = rawLine.substring(idx + MARKER.length()).trim();
        if (rawMeta.isEmpty()) {
            return new ParsedLine(content, LineMetadata.empty());
        }
        try {
            JsonNode node = mapper.readTree(rawMeta);
            if (node == null || !node.isObject()) {
                return new ParsedLine(content, LineMetadata.empty());
            }
            return new ParsedLine(content, toMetadata(node));
        } catch (JsonProcessingException e) {
            log.debug("memory.metadata.malformed reason={}", e.getOriginalMessage());
            return new ParsedLine(content, LineMetadata.empty());
        }
    }

    /**
     * Renders the trailer appended to new lines, or an empty string for empty metadata.
     */
    public String format(LineMetadata metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "";
        }
        try {
            return " " + MARKER + mapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize line metadata", e);
        }
    }

    private static LineMetadata toMetadata(JsonNode node) {
        return new LineMetadata(
                textOrNull(node.get("source")),
                textOrNull(node.get("role")),
                longOrNull(node.get("chatId")),
                longOrNull(node.get("userId")));
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private static Long longOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            double value = node.asDouble();
            return Double.isFinite(value) ? (long) Math.floor(value) : null;
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * A line split into content and metadata.
     */
    public record ParsedLine(String content, LineMetadata metadata) {
    }
}
