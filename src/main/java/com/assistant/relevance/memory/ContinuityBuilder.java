package com.assistant.relevance.memory;

import com.assistant.relevance.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maintains {@code CONTINUITY.md}, a per-chat digest of the recent conversation: active
 * topics, stated preferences, open loops and the last exchanges. The digest is rebuilt
 * when missing and then every few turns.
 */
public class ContinuityBuilder {
    private static final Logger log = LoggerFactory.getLogger(ContinuityBuilder.class);

    public static final int UPDATE_INTERVAL_TURNS = 4;
    public static final int RECENT_FILES = 6;
    public static final int RECENT_TURNS = 80;

    private static final int MAX_TOPICS = 8;
    private static final int MAX_HINTS = 6;
    private static final int LAST_EXCHANGES = 10;

    private static final Pattern TRANSCRIPT_LINE = Pattern.compile(
            "^-\\s*\\[(\\d{2}:\\d{2}:\\d{2})\\]\\s*(USER|ASSISTANT):\\s*(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern PREFERENCE = Pattern.compile(
            "\\b(prefiero|preferiria|me gusta|no me gusta|evita|no quiero|siempre|nunca|responde|por favor evita)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern OPEN_LOOP = Pattern.compile(
            "\\b(pendiente|falta|resta|despues|después|luego|siguiente|proximo|próximo|recorda|recordá|recordar"
                    + "|revisar|implementar|configurar|arreglar|resolver|continuar)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");

    // Conversational filler not covered by the tokenizer stopwords
    private static final Set<String> TOPIC_STOPWORDS = Set.of("como", "hoy", "mas");

    private final MemoryLayout layout;
    private final Tokenizer tokenizer;
    private final LineMetadataParser metadataParser;
    private final Clock clock;
    private final Map<Long, Integer> turnCounters = new ConcurrentHashMap<>();

    public ContinuityBuilder(MemoryLayout layout, Tokenizer tokenizer, LineMetadataParser metadataParser, Clock clock) {
        this.layout = layout;
        this.tokenizer = tokenizer;
        this.metadataParser = metadataParser;
        this.clock = clock;
    }

    /**
     * Counts a turn for the chat and rebuilds the snapshot when it is missing or the
     * turn count reaches the update interval.
     *
     * @return true when the snapshot was rewritten
     */
    public boolean refreshIfNeeded(long chatId) {
        if (chatId <= 0) {
            return false;
        }
        int count = turnCounters.merge(chatId, 1, Integer::sum);
        boolean exists = Files.isRegularFile(layout.resolve(layout.continuityRelPath(chatId)));
        if (exists && count % UPDATE_INTERVAL_TURNS != 0) {
            return false;
        }
        return rebuild(chatId).isPresent();
    }

    /**
     * Rewrites the snapshot from the recent transcripts.
     *
     * @return the snapshot path, or empty when the chat has no transcript turns
     */
    public Optional<String> rebuild(long chatId) {
        if (chatId <= 0) {
            return Optional.empty();
        }
        List<ConversationExcerpt> excerpts = collectRecentExcerpts(chatId, RECENT_TURNS);
        if (excerpts.isEmpty()) {
            return Optional.empty();
        }

        List<String> userTexts = textsOf(excerpts, ConversationRole.USER);
        List<String> assistantTexts = textsOf(excerpts, ConversationRole.ASSISTANT);
        List<String> allTexts = excerpts.stream().map(ConversationExcerpt::text).collect(Collectors.toList());

        List<String> lines = new ArrayList<>();
        lines.add("# CONTINUITY.md - chat-" + chatId);
        lines.add("");
        lines.add("Actualizado: " + clock.instant());
        lines.add("");
        lines.add("## Snapshot");
        lines.add("- Turnos considerados: " + excerpts.size());
        lines.add("- Último usuario: " + lastOrPlaceholder(userTexts));
        lines.add("- Último asistente: " + lastOrPlaceholder(assistantTexts));
        lines.add("");
        lines.add("## Temas Activos");
        appendItems(lines, topicKeywords(userTexts), "(sin temas detectados)");
        lines.add("");
        lines.add("## Preferencias del Usuario (heurística)");
        appendItems(lines, matching(userTexts, PREFERENCE), "(sin preferencias explícitas recientes)");
        lines.add("");
        lines.add("## Pendientes Abiertos (heurística)");
        List<String> newestFirst = new ArrayList<>(allTexts);
        Collections.reverse(newestFirst);
        appendItems(lines, matching(newestFirst, OPEN_LOOP), "(sin pendientes detectados)");
        lines.add("");
        lines.add("## Últimos Intercambios");
        for (ConversationExcerpt excerpt : excerpts.subList(Math.max(0, excerpts.size() - LAST_EXCHANGES),
                excerpts.size())) {
            lines.add("- " + excerpt.role().getTag() + ": " + cleanLine(excerpt.text(), 220));
        }

        String relPath = layout.continuityRelPath(chatId);
        Path file = layout.resolve(relPath);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write continuity snapshot " + relPath, e);
        }
        log.debug("memory.continuity.rebuilt chatId={} turns={}", chatId, excerpts.size());
        return Optional.of(relPath);
    }

    /**
     * Turns of the newest transcript files, oldest first, keeping at most the last
     * {@code maxTurns}.
     */
    List<ConversationExcerpt> collectRecentExcerpts(long chatId, int maxTurns) {
        List<String> relPaths = new ArrayList<>(layout.recentChatRelPaths(chatId, RECENT_FILES));
        Collections.reverse(relPaths);
        List<ConversationExcerpt> excerpts = new ArrayList<>();
        for (String relPath : relPaths) {
            List<String> fileLines;
            try {
                fileLines = Files.readAllLines(layout.resolve(relPath), StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.debug("memory.read.failed path={} reason={}", relPath, e.getMessage());
                continue;
            }
            for (String line : fileLines) {
                parseConversationLine(line, metadataParser).ifPresent(excerpts::add);
            }
        }
        if (excerpts.size() <= maxTurns) {
            return excerpts;
        }
        return new ArrayList<>(excerpts.subList(excerpts.size() - maxTurns, excerpts.size()));
    }

    /**
     * Recovers a turn from a transcript line. Lines written by {@link MemoryWriter} carry the
     * role after the timestamp; other lines need a {@code role} in their metadata.
     */
    static Optional<ConversationExcerpt> parseConversationLine(String line, LineMetadataParser parser) {
        LineMetadataParser.ParsedLine parsed = parser.parse(line);
        String content = parsed.content();
        if (content.isEmpty()) {
            return Optional.empty();
        }

        Matcher matcher = TRANSCRIPT_LINE.matcher(content);
        if (matcher.matches()) {
            ConversationRole role = "assistant".equalsIgnoreCase(matcher.group(2))
                    ? ConversationRole.ASSISTANT : ConversationRole.USER;
            String text = matcher.group(3).trim();
            return text.isEmpty() ? Optional.empty() : Optional.of(new ConversationExcerpt(role, text));
        }

        Optional<ConversationRole> fromMetadata = ConversationRole.fromId(parsed.metadata().role());
        if (fromMetadata.isEmpty()) {
            return Optional.empty();
        }
        String prefix = fromMetadata.get().getTag() + ":";
        int idx = content.toUpperCase(Locale.ROOT).indexOf(prefix);
        if (idx < 0) {
            return Optional.empty();
        }
        String text = content.substring(idx + prefix.length()).trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(new ConversationExcerpt(fromMetadata.get(), text));
    }

    List<String> topicKeywords(List<String> userTexts) {
        Map<String, Integer> frequency = new TreeMap<>();
        for (String message : userTexts) {
            for (String token : tokenizer.tokenSet(message)) {
                if (token.length() < 3 || TOPIC_STOPWORDS.contains(token) || DIGITS.matcher(token).matches()) {
                    continue;
                }
                frequency.merge(token, 1, Integer::sum);
            }
        }
        return frequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry::getKey))
                .limit(MAX_TOPICS)
                .map(entry -> entry.getKey() + " (" + entry.getValue() + ")")
                .collect(Collectors.toList());
    }

    private static List<String> matching(List<String> messages, Pattern pattern) {
        Set<String> unique = new LinkedHashSet<>();
        for (String message : messages) {
            if (!pattern.matcher(message).find()) {
                continue;
            }
            unique.add(cleanLine(message, 180));
            if (unique.size() >= MAX_HINTS) {
                break;
            }
        }
        return new ArrayList<>(unique);
    }

    private static List<String> textsOf(List<ConversationExcerpt> excerpts, ConversationRole role) {
        return excerpts.stream()
                .filter(excerpt -> excerpt.role() == role)
                .map(ConversationExcerpt::text)
                .collect(Collectors.toList());
    }

    private static String lastOrPlaceholder(List<String> texts) {
        return texts.isEmpty() ? "(sin dato)" : cleanLine(texts.get(texts.size() - 1), 180);
    }

    private static void appendItems(List<String> lines, List<String> items, String placeholder) {
        if (items.isEmpty()) {
            lines.add("- " + placeholder);
            return;
        }
        for (String item : items) {
            lines.add("- " + item);
        }
    }

    static String cleanLine(String text, int maxChars) {
        return Snippets.truncateInline(Snippets.collapseWhitespace(text), maxChars);
    }
}
