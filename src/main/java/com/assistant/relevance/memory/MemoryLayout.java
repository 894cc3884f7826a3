package com.assistant.relevance.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File layout of a memory workspace.
 *
 * <pre>
 * MEMORY.md                                   long-term facts
 * memory/YYYY-MM-DD.md                        global daily notes
 * memory/chats/chat-&lt;id&gt;/YYYY-MM-DD.md        per-chat daily transcript
 * memory/chats/chat-&lt;id&gt;/CONTINUITY.md        per-chat continuity snapshot
 * </pre>
 */
public class MemoryLayout {
    private static final Logger log = LoggerFactory.getLogger(MemoryLayout.class);

    public static final String LONG_TERM_FILE = "MEMORY.md";
    public static final String CONTINUITY_FILE = "CONTINUITY.md";

    private static final Pattern DATE_PATH = Pattern.compile("(?:^|/)(\\d{4})-(\\d{2})-(\\d{2})\\.md$");
    private static final Pattern CHAT_PATH = Pattern.compile(
            "(?:^|/)memory/chats/chat-(\\d+)/\\d{4}-\\d{2}-\\d{2}\\.md$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DATED_FILE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}\\.md$", Pattern.CASE_INSENSITIVE);

    private final Path root;

    public MemoryLayout(Path root) {
        this.root = Objects.requireNonNull(root, "root is required").toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    public Path memoryDir() {
        return root.resolve("memory");
    }

    public Path chatDir(long chatId) {
        return memoryDir().resolve("chats").resolve("chat-" + chatId);
    }

    public Path longTermFile() {
        return root.resolve(LONG_TERM_FILE);
    }

    public String dailyRelPath(LocalDate date) {
        return "memory/" + date + ".md";
    }

    public String chatDailyRelPath(long chatId, LocalDate date) {
        return "memory/chats/chat-" + chatId + "/" + date + ".md";
    }

    public String continuityRelPath(long chatId) {
        return "memory/chats/chat-" + chatId + "/" + CONTINUITY_FILE;
    }

    public Path resolve(String relPath) {
        return root.resolve(relPath).normalize();
    }

    /**
     * Workspace-relative path with forward slashes.
     */
    public String relativize(Path file) {
        return root.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    /**
     * Files searched for a recall, in priority order: {@code MEMORY.md}, the chat continuity
     * snapshot, the newest chat transcripts and the newest global notes. Missing files are
     * left out.
     *
     * @param chatId      chat scope, ignored when null or not positive
     * @param globalFiles maximum number of {@code memory/*.md} files
     * @param chatFiles   maximum number of chat transcript files
     */
    public List<Path> searchFiles(Long chatId, int globalFiles, int chatFiles) {
        Set<Path> files = new LinkedHashSet<>();
        if (Files.isRegularFile(longTermFile())) {
            files.add(longTermFile());
        }
        if (chatId != null && chatId > 0) {
            Path continuity = resolve(continuityRelPath(chatId));
            if (Files.isRegularFile(continuity)) {
                files.add(continuity);
            }
            for (String relPath : recentChatRelPaths(chatId, chatFiles)) {
                files.add(resolve(relPath));
            }
        }
        files.addAll(listNewestFirst(memoryDir(), name -> name.endsWith(".md"), globalFiles));
        return new ArrayList<>(files);
    }

    /**
     * Newest dated transcript files of a chat, as workspace-relative paths.
     */
    public List<String> recentChatRelPaths(long chatId, int maxFiles) {
        if (chatId <= 0) {
            return List.of();
        }
        return listNewestFirst(chatDir(chatId), name -> DATED_FILE.matcher(name).matches(), Math.max(1, maxFiles))
                .stream()
                .map(this::relativize)
                .collect(Collectors.toList());
    }

    private List<Path> listNewestFirst(Path dir, Predicate<String> nameFilter, int limit) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(path -> nameFilter.test(path.getFileName().toString()))
                    .sorted(Comparator.comparing((Path path) -> path.getFileName().toString()).reversed())
                    .limit(limit)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.debug("memory.list.failed dir={} reason={}", dir, e.getMessage());
            return List.of();
        }
    }

    /**
     * Calendar date encoded in a {@code YYYY-MM-DD.md} file name, if it is a valid date.
     */
    public static Optional<LocalDate> parseDateFromPath(String relPath) {
        if (relPath == null) {
            return Optional.empty();
        }
        String normalized = relPath.replace('\\', '/');
        if (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        Matcher matcher = DATE_PATH.matcher(normalized);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.of(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3))));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    /**
     * Chat id of a per-chat transcript path.
     */
    public static Optional<Long> parseChatIdFromPath(String relPath) {
        if (relPath == null) {
            return Optional.empty();
        }
        Matcher matcher = CHAT_PATH.matcher(relPath.replace('\\', '/'));
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(matcher.group(1)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Normalizes a caller-supplied relative path, rejecting absolute and traversing paths.
     *
     * @throws IllegalArgumentException for empty, absolute or {@code ..} paths
     */
    public static String ensureSafeRelativePath(String relPath) {
        String normalized = relPath == null ? "" : relPath.replace('\\', '/').trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Path is empty");
        }
        if (normalized.startsWith("/") || normalized.contains("..")) {
            throw new IllegalArgumentException("Path is not a safe relative path: " + normalized);
        }
        return normalized;
    }
}
