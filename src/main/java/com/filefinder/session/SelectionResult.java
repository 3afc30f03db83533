package com.filefinder.session;

import com.filefinder.catalog.FileEntry;

import java.util.List;
import java.util.Optional;

public record SelectionResult(
        SelectionOutcome outcome,
        List<FileEntry> options,
        FileEntry selected,
        boolean opened
) {
    public SelectionResult {
        options = List.copyOf(options);
    }

    static SelectionResult of(SelectionOutcome outcome) {
        return new SelectionResult(outcome, List.of(), null, false);
    }

    static SelectionResult repeated(List<FileEntry> options) {
        return new SelectionResult(SelectionOutcome.OPTIONS_REPEATED, options, null, false);
    }

    static SelectionResult selected(FileEntry entry, boolean opened) {
        return new SelectionResult(SelectionOutcome.SELECTED, List.of(), entry, opened);
    }

    public Optional<FileEntry> selectedEntry() {
        return Optional.ofNullable(selected);
    }

    public boolean handled() {
        return outcome != SelectionOutcome.IGNORED;
    }
}
