package com.filefinder.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import org.junit.jupiter.api.Test;

class ConstantsTest {

    @Test
    void testScoringConstants() {
        assertEquals(70.0, Constants.MIN_SCORE);
        assertEquals(40.0, Constants.EXACT_MATCH_BOOST);
        assertEquals(20.0, Constants.PARTIAL_MATCH_BOOST);
        assertEquals(15.0, Constants.NAME_OVER_PATH_BOOST);
        assertEquals(20.0, Constants.RECENCY_BOOST_DAY);
        assertEquals(10.0, Constants.RECENCY_BOOST_WEEK);
        assertEquals(5.0, Constants.RECENCY_BOOST_MONTH);
        assertEquals(25.0, Constants.EXTENSION_INTENT_BOOST);
        assertEquals(5.0, Constants.FOLDER_CONTEXT_BOOST);
        assertEquals(0.5, Constants.DEPTH_PENALTY_PER_LEVEL);
        assertEquals(300, Constants.CANDIDATE_CAP);
        assertEquals(5, Constants.DEFAULT_SEARCH_LIMIT);
    }

    @Test
    void testExtensionSetsHaveNoDotsAndDoNotOverlap() {
        for (String extension : Constants.BLOCKED_EXTENSIONS) {
            assertFalse(extension.startsWith("."));
        }
        for (String extension : Constants.DEFAULT_ALLOWED_EXTENSIONS) {
            assertFalse(extension.startsWith("."));
        }
        assertTrue(Collections.disjoint(Constants.BLOCKED_EXTENSIONS, Constants.DEFAULT_ALLOWED_EXTENSIONS));
        assertTrue(Constants.EXCLUDED_DIRECTORIES.contains("node_modules"));
        assertEquals("docx", Constants.EXTENSION_KEYWORDS.get("word"));
    }
}
