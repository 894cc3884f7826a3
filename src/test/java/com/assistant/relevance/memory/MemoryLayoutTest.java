package com.assistant.relevance.memory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MemoryLayout Tests")
class MemoryLayoutTest {

    @TempDir
    Path workspace;

    private void touch(String relPath) throws IOException {
        Path file = workspace.resolve(relPath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "- nota\n");
    }

    @Nested
    @DisplayName("Paths")
    class PathTests {

        @Test
        @DisplayName("Should build workspace-relative paths")
        void testRelativePaths() {
            MemoryLayout layout = new MemoryLayout(workspace);
            LocalDate date = LocalDate.of(2026, 10, 19);

            assertEquals("memory/2026-10-19.md", layout.dailyRelPath(date));
            assertEquals("memory/chats/chat-42/2026-10-19.md", layout.chatDailyRelPath(42, date));
            assertEquals("memory/chats/chat-42/CONTINUITY.md", layout.continuityRelPath(42));
            assertEquals(workspace.toAbsolutePath().normalize().resolve("MEMORY.md"), layout.longTermFile());
            assertEquals("memory/2026-10-19.md", layout.relativize(layout.resolve("memory/2026-10-19.md")));
        }

        @Test
        @DisplayName("Should parse valid dates from file names only")
        void testParseDate() {
            assertEquals(Optional.of(LocalDate.of(2026, 10, 19)),
                    MemoryLayout.parseDateFromPath("memory/2026-10-19.md"));
            assertEquals(Optional.of(LocalDate.of(2026, 1, 2)),
                    MemoryLayout.parseDateFromPath("./memory/chats/chat-1/2026-01-02.md"));
            assertTrue(MemoryLayout.parseDateFromPath("memory/2026-02-30.md").isEmpty());
            assertTrue(MemoryLayout.parseDateFromPath("MEMORY.md").isEmpty());
            assertTrue(MemoryLayout.parseDateFromPath(null).isEmpty());
        }

        @Test
        @DisplayName("Should parse chat ids from transcript paths only")
        void testParseChatId() {
            assertEquals(Optional.of(42L), MemoryLayout.parseChatIdFromPath("memory/chats/chat-42/2026-10-19.md"));
            assertEquals(Optional.of(42L), MemoryLayout.parseChatIdFromPath("memory\\chats\\chat-42\\2026-10-19.md"));
            assertTrue(MemoryLayout.parseChatIdFromPath("memory/chats/chat-42/CONTINUITY.md").isEmpty());
            assertTrue(MemoryLayout.parseChatIdFromPath("memory/2026-10-19.md").isEmpty());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "/etc/passwd", "../secret.md", "memory/../../x.md"})
        @DisplayName("Should reject unsafe relative paths")
        void testUnsafePaths(String relPath) {
            assertThrows(IllegalArgumentException.class, () -> MemoryLayout.ensureSafeRelativePath(relPath));
        }

        @Test
        @DisplayName("Should normalize separators of safe paths")
        void testSafePath() {
            assertEquals("memory/2026-10-19.md", MemoryLayout.ensureSafeRelativePath(" memory\\2026-10-19.md "));
        }
    }

    @Nested
    @DisplayName("Search files")
    class SearchFileTests {

        @Test
        @DisplayName("Should list long-term, continuity, chat and global files in priority order")
        void testOrder() throws IOException {
            touch("MEMORY.md");
            touch("memory/2026-10-17.md");
            touch("memory/2026-10-19.md");
            touch("memory/notas.txt");
            touch("memory/chats/chat-5/CONTINUITY.md");
            touch("memory/chats/chat-5/2026-10-18.md");
            touch("memory/chats/chat-5/2026-10-19.md");
            touch("memory/chats/chat-6/2026-10-19.md");
            MemoryLayout layout = new MemoryLayout(workspace);

            List<String> files = layout.searchFiles(5L, 60, 40).stream()
                    .map(layout::relativize)
                    .collect(Collectors.toList());

            assertEquals(List.of(
                    "MEMORY.md",
                    "memory/chats/chat-5/CONTINUITY.md",
                    "memory/chats/chat-5/2026-10-19.md",
                    "memory/chats/chat-5/2026-10-18.md",
                    "memory/2026-10-19.md",
                    "memory/2026-10-17.md"), files);
        }

        @Test
        @DisplayName("Should leave chat files out without a chat scope and honor the limits")
        void testGlobalOnly() throws IOException {
            touch("memory/2026-10-17.md");
            touch("memory/2026-10-18.md");
            touch("memory/2026-10-19.md");
            touch("memory/chats/chat-5/2026-10-19.md");
            MemoryLayout layout = new MemoryLayout(workspace);

            List<String> files = layout.searchFiles(null, 2, 40).stream()
                    .map(layout::relativize)
                    .collect(Collectors.toList());

            assertEquals(List.of("memory/2026-10-19.md", "memory/2026-10-18.md"), files);
        }

        @Test
        @DisplayName("Should return nothing for an empty workspace")
        void testEmptyWorkspace() {
            assertTrue(new MemoryLayout(workspace).searchFiles(5L, 60, 40).isEmpty());
        }
    }
}
