package com.assistant.relevance.router.calibration;

import com.assistant.relevance.router.LabeledSample;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the JSON Lines routing dataset.
 *
 * <p>Expected format: one JSON object per line.</p>
 * <pre>
 * {"text": "enviame un correo", "finalHandler": "gmail", "semantic": {"handler": "gmail", "score": 0.41}}
 * {"text": "ultimas noticias", "expectedRoute": "web"}
 * </pre>
 *
 * <p>Malformed rows and rows without text or label are skipped. A missing file reads as empty.</p>
 */
public class LabeledDatasetReader {
    private static final Logger log = LoggerFactory.getLogger(LabeledDatasetReader.class);

    static final int MAX_ROWS = 20_000;

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Reads up to the last {@code limit} rows of the dataset.
     */
    public List<DatasetEntry> readEntries(Path file, int limit) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dataset " + file, e);
        }
        List<String> rows = lines.stream().map(String::trim).filter(line -> !line.isEmpty()).toList();
        int bounded = Math.max(1, Math.min(MAX_ROWS, limit));
        List<String> selected = rows.subList(Math.max(0, rows.size() - bounded), rows.size());

        List<DatasetEntry> entries = new ArrayList<>(selected.size());
        int skipped = 0;
        for (String row : selected) {
            Optional<DatasetEntry> entry = parse(row);
            if (entry.isPresent()) {
                entries.add(entry.get());
            } else {
                skipped++;
            }
        }
        log.info("dataset.read file={} entries={} skipped={}", file, entries.size(), skipped);
        return entries;
    }

    public List<LabeledSample> readLabeledSamples(Path file, int limit) {
        return readEntries(file, limit).stream().map(DatasetEntry::toLabeledSample).toList();
    }

    Optional<DatasetEntry> parse(String row) {
        JsonNode node;
        try {
            node = objectMapper.readTree(row);
        } catch (JsonProcessingException e) {
            log.debug("dataset.row.skipped reason=malformed error={}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        String text = textOf(node.get("text"));
        String label = textOf(node.get("finalHandler"));
        if (label == null) {
            label = textOf(node.get("expectedRoute"));
        }
        if (text == null || text.isBlank() || label == null || label.isBlank()) {
            return Optional.empty();
        }
        String semanticHandler = null;
        Double semanticScore = null;
        JsonNode semantic = node.get("semantic");
        if (semantic != null && semantic.isObject()) {
            semanticHandler = textOf(semantic.get("handler"));
            JsonNode score = semantic.get("score");
            if (score != null && score.isNumber()) {
                semanticScore = score.asDouble();
            }
        }
        return Optional.of(new DatasetEntry(text, label.trim(), semanticHandler, semanticScore));
    }

    private static String textOf(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
