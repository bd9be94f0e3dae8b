package com.synesis.loader.semantic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MapBibliographyTest {
    @Test
    void normalizesKeysOnBothSides() {
        MapBibliography bibliography =
                MapBibliography.of(new BibEntry("@Silva2023", Map.of("Title", "Energia", "YEAR", "2023")));

        assertTrue(bibliography.contains("silva2023"));
        assertTrue(bibliography.contains("@SILVA2023 "));
        assertEquals(List.of("silva2023"), List.copyOf(bibliography.keys()));
        BibEntry entry = bibliography.lookup("silva2023").orElseThrow();
        assertEquals("Energia", entry.field("title").orElseThrow());
        assertEquals("2023", entry.field("Year").orElseThrow());
        assertTrue(entry.field("author").isEmpty());
    }

    @Test
    void emptyBibliographyHasNoKeys() {
        MapBibliography bibliography = MapBibliography.empty();

        assertEquals(0, bibliography.size());
        assertFalse(bibliography.contains("anything"));
    }
}
