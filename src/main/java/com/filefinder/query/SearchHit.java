package com.filefinder.query;

import com.filefinder.catalog.FileEntry;
import com.filefinder.scoring.ScoreBreakdown;

public record SearchHit(
        FileEntry entry,
        double score,
        ScoreBreakdown breakdown
) {
}
