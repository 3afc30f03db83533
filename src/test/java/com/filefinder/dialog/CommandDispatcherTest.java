package com.filefinder.dialog;

import com.filefinder.action.EntryOpener;
import com.filefinder.action.FileActionHandler;
import com.filefinder.catalog.EntryKind;
import com.filefinder.catalog.FileEntry;
import com.filefinder.config.Constants;
import com.filefinder.index.ExclusionRules;
import com.filefinder.index.FileIndexer;
import com.filefinder.query.RankingEngine;
import com.filefinder.session.SelectionSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandDispatcherTest {

    @TempDir
    Path tempDir;

    private final List<FileEntry> openedEntries = new ArrayList<>();
    private Path catalogPath;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() throws IOException {
        Path sourceDir = Files.createDirectories(tempDir.resolve("source"));
        for (String relativePath : List.of("projects/roadmap.md", "budget_2023.xlsx", "budget_2024.xlsx",
                "archive/notes.txt", "archive/summary.md")) {
            Path file = sourceDir.resolve(relativePath);
            Files.createDirectories(file.getParent());
            Files.writeString(file, relativePath);
        }
        catalogPath = tempDir.resolve("catalog.db");
        Clock clock = Clock.systemUTC();
        new FileIndexer(catalogPath, new ExclusionRules(Constants.EXCLUDED_DIRECTORIES,
            Constants.BLOCKED_EXTENSIONS, Constants.DEFAULT_ALLOWED_EXTENSIONS), clock)
            .ensureIndex(List.of(sourceDir));

        EntryOpener recordingOpener = entry -> {
            openedEntries.add(entry);
            return true;
        };
        SelectionSession session = new SelectionSession(recordingOpener);
        dispatcher = new CommandDispatcher(
            new FileActionHandler(new RankingEngine(catalogPath, clock), recordingOpener), session);
    }

    @Test
    void testOpenUniqueFile() {
        DispatchReply reply = dispatcher.handle("Open the file roadmap.");

        assertTrue(reply.handled());
        assertEquals("🟢 已打开 roadmap.md", reply.message());
        assertEquals(1, openedEntries.size());
    }

    @Test
    void testOpenFailureIsNotReportedAsSuccess() {
        EntryOpener failingOpener = entry -> false;
        CommandDispatcher failing = new CommandDispatcher(
            new FileActionHandler(new RankingEngine(catalogPath, Clock.systemUTC()), failingOpener),
            new SelectionSession(failingOpener));

        assertEquals("❌ 无法打开 roadmap.md", failing.handle("open the file roadmap").message());
    }

    @Test
    @DisplayName("多个匹配进入消歧，随后按序号打开")
    void testAmbiguousThenSelectByNumber() {
        DispatchReply options = dispatcher.handle("open file budget");

        assertEquals(2, options.options().size());
        assertTrue(options.message().contains("1. "));
        assertTrue(options.message().contains("请说: open number X"));
        assertTrue(dispatcher.session().hasPending());
        assertTrue(openedEntries.isEmpty());

        DispatchReply selected = dispatcher.handle("open number two");

        assertEquals("🟢 已打开 " + options.options().get(1).name(), selected.message());
        assertEquals(List.of(options.options().get(1)), openedEntries);
        assertFalse(dispatcher.session().hasPending());
    }

    @Test
    void testCancelRepeatAndInvalidChoice() {
        dispatcher.handle("open the file budget");

        assertEquals("❌ 无效的选择序号", dispatcher.handle("number seven").message());
        DispatchReply repeated = dispatcher.handle("repeat");
        assertEquals(2, repeated.options().size());
        assertTrue(repeated.message().startsWith("候选项:"));
        assertEquals("❌ 已取消选择", dispatcher.handle("cancel").message());
        assertFalse(dispatcher.session().hasPending());
        assertTrue(openedEntries.isEmpty());
    }

    @Test
    void testPendingSessionFallsThroughForNewCommand() {
        dispatcher.handle("open file budget");

        DispatchReply reply = dispatcher.handle("open the file roadmap");

        assertEquals("🟢 已打开 roadmap.md", reply.message());
        assertTrue(dispatcher.session().hasPending());
    }

    @Test
    void testListFolder() {
        DispatchReply reply = dispatcher.handle("what files are in the folder archive?");

        assertEquals(List.of("notes.txt", "summary.md"), reply.children());
        assertTrue(reply.message().startsWith("📂 archive"));
        assertTrue(reply.message().contains(" - notes.txt"));
    }

    @Test
    void testNotFoundAndMissingTarget() {
        assertEquals("❌ 未找到匹配的文件: zebra", dispatcher.handle("open file zebra").message());
        assertEquals("❌ 未找到匹配的文件夹: zebra", dispatcher.handle("list folder zebra").message());
        assertEquals("请说出要打开的文件夹名称", dispatcher.handle("open the folder").message());
    }

    @Test
    void testUnrelatedUtteranceIsUnhandled() {
        assertFalse(dispatcher.handle("what's the weather today").handled());
        assertFalse(dispatcher.handle("").handled());
        assertFalse(dispatcher.handle(null).handled());
    }

    @Test
    void testCleanTarget() {
        assertEquals("budget report", CommandDispatcher.cleanTarget("\"budget report!\""));
        assertEquals("q4 budget", CommandDispatcher.cleanTarget("  q4   budget. "));
        assertEquals("", CommandDispatcher.cleanTarget("?!"));
        assertEquals("", CommandDispatcher.cleanTarget(null));
    }

    @Test
    void testFormatOptions() {
        FileEntry first = new FileEntry(1L, "a.md", "/x/a.md", EntryKind.FILE, "md", "x", Instant.EPOCH, 0L);
        FileEntry second = new FileEntry(2L, "b.md", "/x/b.md", EntryKind.FILE, "md", "x", Instant.EPOCH, 0L);
        String separator = System.lineSeparator();

        assertEquals("找到:" + separator + "1. a.md" + separator + "2. b.md" + separator + "请说: open number X",
            CommandDispatcher.formatOptions("找到:", List.of(first, second)));
    }
}
