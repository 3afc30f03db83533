package com.filefinder.session;

import com.filefinder.catalog.EntryKind;
import com.filefinder.catalog.FileEntry;

import java.util.List;

public record PendingSelection(
        List<FileEntry> options,
        EntryKind kind
) {
    public PendingSelection {
        options = List.copyOf(options);
    }

    public int size() {
        return options.size();
    }
}
