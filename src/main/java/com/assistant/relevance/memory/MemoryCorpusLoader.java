package com.assistant.relevance.memory;

import com.assistant.relevance.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Reads the memory files relevant to one search and indexes their lines.
 *
 * <p>Files are read concurrently on the supplied executor; the result keeps file order
 * and then line order, so two loads of an unchanged workspace are identical. A file
 * that cannot be read contributes no lines.</p>
 */
public class MemoryCorpusLoader {
    private static final Logger log = LoggerFactory.getLogger(MemoryCorpusLoader.class);

    public static final int DEFAULT_GLOBAL_FILES = 60;
    public static final int DEFAULT_CHAT_FILES = 40;

    private final MemoryLayout layout;
    private final Tokenizer tokenizer;
    private final LineMetadataParser metadataParser;
    private final PromptInjectionFilter injectionFilter;
    private final Executor executor;
    private final Clock clock;
    private final int globalFiles;
    private final int chatFiles;

    public MemoryCorpusLoader(MemoryLayout layout, Tokenizer tokenizer, Executor executor, Clock clock) {
        this(layout, tokenizer, new LineMetadataParser(), new PromptInjectionFilter(), executor, clock,
                DEFAULT_GLOBAL_FILES, DEFAULT_CHAT_FILES);
    }

    public MemoryCorpusLoader(MemoryLayout layout, Tokenizer tokenizer, LineMetadataParser metadataParser,
                              PromptInjectionFilter injectionFilter, Executor executor, Clock clock,
                              int globalFiles, int chatFiles) {
        this.layout = layout;
        this.tokenizer = tokenizer;
        this.metadataParser = metadataParser;
        this.injectionFilter = injectionFilter;
        this.executor = executor;
        this.clock = clock;
        this.globalFiles = globalFiles;
        this.chatFiles = chatFiles;
    }

    /**
     * Indexed lines of every file in scope for the chat.
     *
     * @param chatId chat scope, or null for global memory only
     */
    public List<MemoryLine> load(Long chatId) {
        List<Path> files = layout.searchFiles(chatId, globalFiles, chatFiles);
        Instant now = clock.instant();

        List<CompletableFuture<List<MemoryLine>>> reads = new ArrayList<>(files.size());
        for (Path file : files) {
            reads.add(CompletableFuture.supplyAsync(() -> readFile(file, now), executor));
        }

        List<MemoryLine> lines = new ArrayList<>();
        for (CompletableFuture<List<MemoryLine>> read : reads) {
            lines.addAll(read.join());
        }
        log.debug("memory.corpus.loaded files={} lines={}", files.size(), lines.size());
        return lines;
    }

    List<MemoryLine> readFile(Path file, Instant now) {
        String relPath = layout.relativize(file);
        List<String> rawLines;
        try {
            rawLines = readLines(file);
        } catch (IOException | RuntimeException e) {
            log.debug("memory.read.failed path={} reason={}", relPath, e.getMessage());
            return List.of();
        }

        double ageDays = ageOf(file, relPath, now);
        List<MemoryLine> lines = new ArrayList<>();
        for (int idx = 0; idx < rawLines.size(); idx++) {
            String raw = rawLines.get(idx).trim();
            if (raw.isEmpty()) {
                continue;
            }
            LineMetadataParser.ParsedLine parsed = metadataParser.parse(raw);
            if (parsed.content().isEmpty()) {
                continue;
            }
            if (injectionFilter.looksLikeInjection(parsed.content())) {
                log.debug("memory.line.skipped path={} line={} reason=injection", relPath, idx + 1);
                continue;
            }
            lines.add(index(relPath, idx + 1, parsed, ageDays));
        }
        return lines;
    }

    /**
     * Lines of a UTF-8 file; malformed bytes become U+FFFD instead of failing the read.
     */
    static List<String> readLines(Path file) throws IOException {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private MemoryLine index(String relPath, int lineNumber, LineMetadataParser.ParsedLine parsed, double ageDays) {
        String content = parsed.content();
        List<String> tokens = tokenizer.tokenize(content);
        Map<String, Integer> frequency = new HashMap<>();
        for (String token : tokens) {
            frequency.merge(token, 1, Integer::sum);
        }
        return new MemoryLine(relPath, lineNumber, content,
                tokenizer.getNormalizer().normalize(content),
                parsed.metadata(), ageDays, tokens, new LinkedHashSet<>(tokens), frequency);
    }

    /**
     * Age from the dated file name when it has one, else from the modification time.
     * Negative when neither is available.
     */
    private static double ageOf(Path file, String relPath, Instant now) {
        Optional<LocalDate> date = MemoryLayout.parseDateFromPath(relPath);
        if (date.isPresent()) {
            return TemporalDecay.ageDays(date.get().atStartOfDay(ZoneOffset.UTC).toInstant(), now);
        }
        try {
            return TemporalDecay.ageDays(Files.getLastModifiedTime(file).toInstant(), now);
        } catch (IOException e) {
            log.debug("memory.mtime.failed path={} reason={}", relPath, e.getMessage());
            return -1.0;
        }
    }
}
