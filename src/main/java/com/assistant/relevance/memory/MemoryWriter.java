package com.assistant.relevance.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.text.Normalizer;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Appends notes and conversation turns to the memory workspace and maintains the
 * long-term fact section of {@code MEMORY.md}. All writes go through this class and are
 * serialized per instance.
 */
public class MemoryWriter {
    private static final Logger log = LoggerFactory.getLogger(MemoryWriter.class);

    public static final int TURN_MAX_CHARS = 1200;
    public static final String FACT_SECTION_TITLE = "## Perfil del usuario (auto)";

    private static final int FACT_KEY_MAX_CHARS = 64;
    private static final int FACT_VALUE_MAX_CHARS = 180;
    private static final int DEFAULT_READ_LINES = 40;
    private static final int MAX_READ_LINES = 400;
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern SECTION_HEADING = Pattern.compile("^##\\s+.*");

    private static final String LONG_TERM_TEMPLATE = String.join("\n",
            "# MEMORY.md - Memoria de largo plazo",
            "",
            "Este archivo guarda hechos durables: preferencias, decisiones y acuerdos.",
            "",
            "## Reglas",
            "- No guardar secretos salvo pedido explícito.",
            "- Usar entradas cortas y fechadas.");

    private final MemoryLayout layout;
    private final LineMetadataParser metadataParser;
    private final ContinuityBuilder continuity;
    private final Clock clock;

    public MemoryWriter(MemoryLayout layout, LineMetadataParser metadataParser, ContinuityBuilder continuity,
                        Clock clock) {
        this.layout = layout;
        this.metadataParser = metadataParser;
        this.continuity = continuity;
        this.clock = clock;
    }

    /**
     * Appends a note to today's global daily file.
     *
     * @return the daily file's workspace-relative path
     * @throws IllegalArgumentException when the note is blank
     */
    public synchronized String appendDailyNote(String note, LineMetadata metadata) {
        String text = note == null ? "" : note.trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Note is empty");
        }
        String relPath = layout.dailyRelPath(today());
        appendLine(relPath, text, metadata);
        return relPath;
    }

    /**
     * Records a conversation turn in the global daily file and the chat transcript, then
     * refreshes the chat's continuity snapshot when due.
     *
     * @return the global daily file's workspace-relative path
     * @throws IllegalArgumentException when the text is blank
     */
    public synchronized String appendConversationTurn(ConversationTurn turn) {
        String normalized = Snippets.collapseWhitespace(turn.text());
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Turn text is empty");
        }
        String note = turn.role().getTag() + ": " + Snippets.truncateInline(normalized, TURN_MAX_CHARS);
        Long userId = turn.userId() != null && turn.userId() > 0 ? turn.userId() : null;
        Long chatId = turn.chatId() > 0 ? turn.chatId() : null;
        LineMetadata metadata = new LineMetadata(turn.source(), turn.role().getId(), chatId, userId);

        String relPath = appendDailyNote(note, metadata);
        if (turn.chatId() > 0) {
            appendLine(layout.chatDailyRelPath(turn.chatId(), today()), note, metadata);
            continuity.refreshIfNeeded(turn.chatId());
        }
        return relPath;
    }

    /**
     * Inserts or replaces a {@code - key: value} line in the fact section of {@code MEMORY.md},
     * creating the file and the section when missing.
     *
     * @throws IllegalArgumentException when key or value normalize to nothing
     */
    public synchronized FactUpsert upsertLongTermFact(String key, String value, String source,
                                                      Long chatId, Long userId) {
        String normalizedKey = normalizeFactKey(key);
        String normalizedValue = Snippets.truncateInline(Snippets.collapseWhitespace(value), FACT_VALUE_MAX_CHARS);
        if (normalizedKey.isEmpty() || normalizedValue.isEmpty()) {
            throw new IllegalArgumentException("Fact key and value must not be empty");
        }

        Path file = layout.longTermFile();
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            content = LONG_TERM_TEMPLATE + "\n";
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + MemoryLayout.LONG_TERM_FILE, e);
        }

        List<String> lines = new ArrayList<>(Arrays.asList(content.split("\\r?\\n", -1)));
        int sectionStart = indexOfSection(lines);
        if (sectionStart < 0) {
            if (!lines.isEmpty() && !lines.get(lines.size() - 1).trim().isEmpty()) {
                lines.add("");
            }
            lines.add(FACT_SECTION_TITLE);
            lines.add("");
            sectionStart = lines.size() - 2;
        }
        int sectionEnd = lines.size();
        for (int idx = sectionStart + 1; idx < lines.size(); idx++) {
            if (SECTION_HEADING.matcher(lines.get(idx).trim()).matches()) {
                sectionEnd = idx;
                break;
            }
        }

        StringBuilder line = new StringBuilder("- ").append(normalizedKey).append(": ").append(normalizedValue)
                .append(" | updated=").append(clock.instant());
        if (source != null && !source.isBlank()) {
            line.append(" | source=").append(source.trim().replaceAll("\\s+", "_"));
        }
        if (chatId != null) {
            line.append(" | chat=").append(chatId);
        }
        if (userId != null) {
            line.append(" | user=").append(userId);
        }

        Pattern keyLine = Pattern.compile("^\\s*-\\s*" + Pattern.quote(normalizedKey) + "\\s*:",
                Pattern.CASE_INSENSITIVE);
        boolean updated = false;
        for (int idx = sectionStart + 1; idx < sectionEnd; idx++) {
            if (keyLine.matcher(lines.get(idx).trim()).find()) {
                lines.set(idx, line.toString());
                updated = true;
                break;
            }
        }
        if (!updated) {
            int insertAt = sectionEnd;
            while (insertAt > sectionStart + 1 && lines.get(insertAt - 1).trim().isEmpty()) {
                insertAt--;
            }
            lines.add(insertAt, line.toString());
        }

        String joined = String.join("\n", lines).replaceAll("\\n+$", "") + "\n";
        try {
            Files.createDirectories(layout.getRoot());
            Files.writeString(file, joined, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + MemoryLayout.LONG_TERM_FILE, e);
        }
        log.info("memory.fact.upserted key={} updated={}", normalizedKey, updated);
        return new FactUpsert(MemoryLayout.LONG_TERM_FILE, normalizedKey, normalizedValue, updated);
    }

    /**
     * Reads a line range of {@code MEMORY.md} or a file under {@code memory/}.
     *
     * @param relPath  workspace-relative path
     * @param fromLine first line, 1-based; defaults to 1
     * @param count    number of lines, clamped to 1..400; defaults to 40
     * @throws IllegalArgumentException for unsafe paths or paths outside memory files
     * @throws UncheckedIOException     when the file cannot be read
     */
    public MemoryExcerpt readMemoryFile(String relPath, Integer fromLine, Integer count) {
        String safePath = MemoryLayout.ensureSafeRelativePath(relPath);
        Path file = layout.resolve(safePath);
        if (!file.startsWith(layout.getRoot())) {
            throw new IllegalArgumentException("Path escapes the workspace: " + safePath);
        }
        String lower = safePath.toLowerCase(Locale.ROOT);
        if (!lower.equals("memory.md") && !lower.startsWith("memory/")) {
            throw new IllegalArgumentException("Only MEMORY.md and memory/ files can be read");
        }
        int from = Math.max(1, Math.min(1_000_000, fromLine != null ? fromLine : 1));
        int lineCount = Math.max(1, Math.min(MAX_READ_LINES, count != null ? count : DEFAULT_READ_LINES));

        List<String> all;
        try {
            all = Arrays.asList(Files.readString(file, StandardCharsets.UTF_8).split("\\r?\\n", -1));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + safePath, e);
        }
        int start = Math.min(all.size(), from - 1);
        int end = Math.min(all.size(), start + lineCount);
        return new MemoryExcerpt(safePath, from, end, String.join("\n", all.subList(start, end)));
    }

    private void appendLine(String relPath, String note, LineMetadata metadata) {
        Path file = layout.resolve(relPath);
        String time = LocalTime.now(clock.withZone(ZoneOffset.UTC)).format(TIME);
        String line = "- [" + time + "] " + note + metadataParser.format(metadata) + "\n";
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append to " + relPath, e);
        }
        log.debug("memory.appended path={} chars={}", relPath, line.length());
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }

    private static int indexOfSection(List<String> lines) {
        for (int idx = 0; idx < lines.size(); idx++) {
            if (lines.get(idx).trim().equalsIgnoreCase(FACT_SECTION_TITLE)) {
                return idx;
            }
        }
        return -1;
    }

    static String normalizeFactKey(String key) {
        if (key == null) {
            return "";
        }
        String folded = COMBINING_MARKS.matcher(Normalizer.normalize(key, Normalizer.Form.NFD)).replaceAll("")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
        return folded.length() > FACT_KEY_MAX_CHARS ? folded.substring(0, FACT_KEY_MAX_CHARS) : folded;
    }
}
