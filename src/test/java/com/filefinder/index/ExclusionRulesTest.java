package com.filefinder.index;

import com.filefinder.config.Constants;
import com.filefinder.config.FinderConfig;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExclusionRulesTest {

    private final ExclusionRules rules = new ExclusionRules(
        Constants.EXCLUDED_DIRECTORIES, Constants.BLOCKED_EXTENSIONS, Constants.DEFAULT_ALLOWED_EXTENSIONS);

    @Test
    void testExcludedDirectoriesAreNotDescended() {
        assertFalse(rules.shouldDescend("node_modules"));
        assertFalse(rules.shouldDescend(".git"));
        assertFalse(rules.shouldDescend("__pycache__"));
        assertTrue(rules.shouldDescend("projects"));
        // 目录名按原样比较
        assertTrue(rules.shouldDescend("Node_Modules"));
    }

    @Test
    void testBlockedExtensionsAlwaysRejected() {
        ExclusionRules permissive = new ExclusionRules(Set.of(), Constants.BLOCKED_EXTENSIONS, Set.of());

        assertFalse(permissive.acceptsFile("setup.exe"));
        assertFalse(permissive.acceptsFile("SYSTEM.DLL"));
        assertFalse(permissive.acceptsFile("debug.log"));
        assertTrue(permissive.acceptsFile("photo.xyz"));
        assertTrue(permissive.acceptsFile("Makefile"));
    }

    @Test
    void testWhitelistRestrictsAcceptedFiles() {
        assertTrue(rules.acceptsFile("report.pdf"));
        assertTrue(rules.acceptsFile("Budget.XLSX"));
        assertFalse(rules.acceptsFile("photo.png"));
        assertFalse(rules.acceptsFile("Makefile"));
        assertFalse(rules.acceptsFile(".bashrc"));
    }

    @Test
    void testFromConfigUsesConfiguredSets() {
        FinderConfig config = FinderConfig.defaults();
        config.setExcludedDirectories(Set.of("archive"));
        config.setAllowedExtensions(Set.of(".PNG"));

        ExclusionRules configured = ExclusionRules.from(config);

        assertFalse(configured.shouldDescend("archive"));
        assertTrue(configured.shouldDescend("node_modules"));
        assertTrue(configured.acceptsFile("photo.png"));
        assertFalse(configured.acceptsFile("report.pdf"));
    }
}
