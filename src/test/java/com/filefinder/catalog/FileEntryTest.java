package com.filefinder.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FileEntryTest {
    @TempDir
    Path tempDir;

    @Test
    void testExtractExtension() {
        assertEquals("xlsx", FileEntry.extractExtension("Q4_Budget.XLSX"));
        assertEquals("gz", FileEntry.extractExtension("archive.tar.gz"));
        assertEquals("", FileEntry.extractExtension(".bashrc"));
        assertEquals("", FileEntry.extractExtension("Makefile"));
        assertEquals("", FileEntry.extractExtension("trailing."));
        assertEquals("", FileEntry.extractExtension(null));
    }

    @Test
    void testOfFileCapturesMetadata() throws IOException {
        Path folder = Files.createDirectories(tempDir.resolve("reports"));
        Path file = Files.writeString(folder.resolve("Plan.PDF"), "12345");
        Instant modified = Instant.parse("2026-03-01T10:15:30.123Z");
        Files.setLastModifiedTime(file, FileTime.from(modified));

        FileEntry entry = FileEntry.of(file, Files.readAttributes(file, BasicFileAttributes.class), EntryKind.FILE);

        assertEquals("Plan.PDF", entry.name());
        assertEquals(file.toAbsolutePath().normalize().toString(), entry.path());
        assertEquals("pdf", entry.extension());
        assertEquals("reports", entry.parentDirName());
        assertEquals(modified, entry.lastModified());
        assertEquals(5, entry.sizeBytes());
        assertEquals(FileEntry.UNASSIGNED_ID, entry.id());
    }

    @Test
    void testFolderHasNoExtension() throws IOException {
        Path folder = Files.createDirectories(tempDir.resolve("v1.2"));

        FileEntry entry = FileEntry.of(folder, Files.readAttributes(folder, BasicFileAttributes.class), EntryKind.FOLDER);

        assertEquals("", entry.extension());
        assertEquals(EntryKind.FOLDER, entry.kind());
    }

    @Test
    void testEntryKindParse() {
        assertEquals(EntryKind.FILE, EntryKind.parse("file"));
        assertEquals(EntryKind.FOLDER, EntryKind.parse(" Folder "));
        assertThrows(IllegalArgumentException.class, () -> EntryKind.parse("drive"));
        assertThrows(IllegalArgumentException.class, () -> EntryKind.parse(null));
    }
}
