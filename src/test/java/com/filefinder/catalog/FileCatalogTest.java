package com.filefinder.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileCatalogTest {
    @TempDir
    Path tempDir;

    private static final Instant BASE_TIME = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void testInsertIfAbsentKeepsFirstRow() {
        String path = tempDir.resolve("docs").resolve("readme.md").toString();

        try (FileCatalog catalog = new FileCatalog(tempDir.resolve("catalog.db"))) {
            assertTrue(catalog.insertIfAbsent(file("readme.md", path, "md", BASE_TIME, 100)));
            assertFalse(catalog.insertIfAbsent(file("readme.md", path, "md", BASE_TIME.plusSeconds(60), 999)));

            FileEntry stored = catalog.findByPath(path).orElseThrow();
            assertEquals(100, stored.sizeBytes());
            assertEquals(BASE_TIME, stored.lastModified());
            assertTrue(stored.id() > 0);
            assertEquals(1, catalog.totalCount());
        }
    }

    @Test
    void testUpsertRefreshesOnlyTimestampAndSize() {
        String path = tempDir.resolve("docs").resolve("plan.docx").toString();

        try (FileCatalog catalog = new FileCatalog(tempDir.resolve("catalog.db"))) {
            catalog.upsert(file("plan.docx", path, "docx", BASE_TIME, 10));
            long originalId = catalog.findByPath(path).orElseThrow().id();

            catalog.upsert(file("renamed.docx", path, "txt", BASE_TIME.plusSeconds(3600), 20));

            FileEntry stored = catalog.findByPath(path).orElseThrow();
            assertEquals(originalId, stored.id());
            assertEquals("plan.docx", stored.name());
            assertEquals("docx", stored.extension());
            assertEquals(20, stored.sizeBytes());
            assertEquals(BASE_TIME.plusSeconds(3600), stored.lastModified());
        }
    }

    @Test
    void testEntriesWithPathPrefixRespectsSeparatorBoundary() {
        Path docs = tempDir.resolve("docs");
        Path docs2 = tempDir.resolve("docs2");

        try (FileCatalog catalog = new FileCatalog(tempDir.resolve("catalog.db"))) {
            catalog.insertIfAbsent(file("a.txt", docs.resolve("a.txt").toString(), "txt", BASE_TIME, 1));
            catalog.insertIfAbsent(folder("sub", docs.resolve("sub").toString(), BASE_TIME));
            catalog.insertIfAbsent(file("b.txt", docs2.resolve("b.txt").toString(), "txt", BASE_TIME, 1));

            Map<String, Long> underDocs = catalog.entriesWithPathPrefix(docs.toString());

            assertEquals(2, underDocs.size());
            assertEquals(BASE_TIME.toEpochMilli(), underDocs.get(docs.resolve("a.txt").toString()));
            assertFalse(underDocs.containsKey(docs2.resolve("b.txt").toString()));
        }
    }

    @Test
    void testQueryCandidatesRequiresEveryToken() {
        try (FileCatalog catalog = new FileCatalog(tempDir.resolve("catalog.db"))) {
            catalog.insertIfAbsent(file("Q4_Budget.xlsx", "/home/user/finance/Q4_Budget.xlsx", "xlsx", BASE_TIME, 1));
            catalog.insertIfAbsent(file("budget.txt", "/home/user/finance/budget.txt", "txt", BASE_TIME, 1));
            catalog.insertIfAbsent(file("q4_summary.md", "/home/user/reports/q4_summary.md", "md", BASE_TIME, 1));
            catalog.insertIfAbsent(file("notes.md", "/home/user/q4/budget/notes.md", "md", BASE_TIME, 1));

            List<String> names = catalog.queryCandidates(List.of("q4", "budget"), 300).stream()
                .map(FileEntry::name)
                .toList();

            assertEquals(List.of("Q4_Budget.xlsx", "notes.md"), names);
            assertEquals(1, catalog.queryCandidates(List.of("q4", "budget"), 1).size());
            assertTrue(catalog.queryCandidates(List.of(), 300).isEmpty());
            assertTrue(catalog.queryCandidates(List.of("zebra"), 300).isEmpty());
        }
    }

    @Test
    void testQueryCandidatesFoldsNonAsciiCase() {
        try (FileCatalog catalog = new FileCatalog(tempDir.resolve("catalog.db"))) {
            catalog.insertIfAbsent(file("Ärger_Bericht.txt", "/home/user/Übersicht/Ärger_Bericht.txt", "txt", BASE_TIME, 1));
            catalog.insertIfAbsent(file("Résumé.pdf", "/home/user/docs/Résumé.pdf", "pdf", BASE_TIME, 1));

            assertEquals(List.of("Ärger_Bericht.txt"), catalog.queryCandidates(List.of("ärger"), 300).stream()
                .map(FileEntry::name)
                .toList());
            assertEquals(1, catalog.queryCandidates(List.of("ÜBERSICHT"), 300).size());
            assertEquals(1, catalog.queryCandidates(List.of("résumé"), 300).size());
        }
    }

    @Test
    void testMetaAndStatistics() {
        try (FileCatalog catalog = new FileCatalog(tempDir.resolve("catalog.db"))) {
            assertTrue(catalog.getMeta("root::/data").isEmpty());

            catalog.setMeta("root::/data", "indexed");
            catalog.setMeta("last_index_time", "1");
            catalog.setMeta("last_index_time", "2");

            assertEquals("indexed", catalog.getMeta("root::/data").orElseThrow());
            assertEquals("2", catalog.getMeta("last_index_time").orElseThrow());

            catalog.insertIfAbsent(folder("data", "/data/data", BASE_TIME));
            catalog.insertIfAbsent(file("a.md", "/data/data/a.md", "md", BASE_TIME, 5));
            catalog.insertIfAbsent(file("b.md", "/data/data/b.md", "md", BASE_TIME, 5));
            assertEquals(2, catalog.countByKind(EntryKind.FILE));
            assertEquals(1, catalog.countByKind(EntryKind.FOLDER));

            assertTrue(catalog.deleteByPath("/data/data/a.md"));
            assertFalse(catalog.deleteByPath("/data/data/a.md"));
            assertEquals(2, catalog.totalCount());
        }
    }

    @Test
    void testCatalogSurvivesReopen() {
        Path dbPath = tempDir.resolve("nested").resolve("catalog.db");
        try (FileCatalog catalog = new FileCatalog(dbPath)) {
            catalog.insertIfAbsent(file("keep.txt", "/x/keep.txt", "txt", BASE_TIME, 3));
            catalog.setMeta("root::/x", "indexed");
        }
        try (FileCatalog reopened = new FileCatalog(dbPath)) {
            assertTrue(reopened.findByPath("/x/keep.txt").isPresent());
            assertEquals("indexed", reopened.getMeta("root::/x").orElseThrow());
        }
    }

    private static FileEntry file(String name, String path, String extension, Instant modified, long size) {
        return new FileEntry(FileEntry.UNASSIGNED_ID, name, path, EntryKind.FILE, extension, "parent", modified, size);
    }

    private static FileEntry folder(String name, String path, Instant modified) {
        return new FileEntry(FileEntry.UNASSIGNED_ID, name, path, EntryKind.FOLDER, "", "parent", modified, 0);
    }
}
