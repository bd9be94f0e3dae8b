package com.synesis.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DebugFlagsTest extends SynesisLoggingConfig {

    @AfterEach
    void clearProperties() {
        System.clearProperty("synesis.debugTokens");
        System.clearProperty("synesis.debugParser");
        DebugFlags.drainCapturedTokens();
        DebugFlags.drainCapturedTrees();
    }

    @Test
    void capturesTokenDumpWhenEnabled() throws Exception {
        System.setProperty("synesis.debugTokens", "true");

        SynesisFixtures.parse("debug.syn", "SOURCE @a", "    title: t", "END SOURCE");

        List<String> tokens = DebugFlags.drainCapturedTokens();
        assertFalse(tokens.isEmpty());
        assertTrue(tokens.get(0).startsWith("KW_SOURCE"), tokens.get(0));
        assertTrue(DebugFlags.drainCapturedTokens().isEmpty());
    }

    @Test
    void capturesParseTreeWhenEnabled() throws Exception {
        System.setProperty("synesis.debugParser", "true");

        SynesisFixtures.parse("debug.syn", "SOURCE @a", "    title: t", "END SOURCE");

        List<String> trees = DebugFlags.drainCapturedTrees();
        assertEquals(1, trees.size());
        assertTrue(trees.get(0).startsWith("(file (block (sourceBlock SOURCE @a"), trees.get(0));
    }

    @Test
    void propertyOverridesEnvironment() {
        System.setProperty("synesis.debugTokens", "false");

        assertFalse(DebugFlags.isTokenDebugEnabled());
    }
}
