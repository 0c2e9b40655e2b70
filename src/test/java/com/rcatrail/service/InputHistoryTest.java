package com.rcatrail.service;

import com.rcatrail.model.InputChangeRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InputHistoryTest {

    private InputHistory history;

    private static Instant at(String hhmm) {
        return Instant.parse("2026-02-11T" + hhmm + ":00Z");
    }

    private static InputChangeRecord change(String node, String hhmm, String previous, String next) {
        return InputChangeRecord.builder()
                .nodeId(node)
                .changedAt(at(hhmm))
                .previousHash(previous)
                .newHash(next)
                .build();
    }

    @BeforeEach
    void setUp() {
        history = new InputHistory(List.of(
                change("X", "10:40", "h2", "h3"),
                change("X", "10:15", "h1", "h2"),
                change("X", "09:00", null, "h1"),
                change("Y", "10:30", null, "y1")));
    }

    @Test
    @DisplayName("valueAt returns the version in effect, inclusive of the instant")
    void valueAt() {
        assertNull(history.valueAt("X", at("08:59")));
        assertEquals("h1", history.valueAt("X", at("09:00")));
        assertEquals("h2", history.valueAt("X", at("10:39")));
        assertEquals("h3", history.valueAt("X", at("11:00")));
        assertNull(history.valueAt("Z", at("11:00")));
    }

    @Test
    @DisplayName("windows are left-exclusive and right-inclusive")
    void changesIn_windowBounds() {
        List<InputChangeRecord> window = history.changesIn(at("10:15"), at("10:40"));

        assertEquals(2, window.size());
        assertEquals("y1", window.get(0).getNewHash());
        assertEquals("h3", window.get(1).getNewHash());
    }

    @Test
    @DisplayName("open lower bound means since the beginning")
    void changesIn_openLowerBound() {
        assertEquals(4, history.changesIn(null, at("12:00")).size());
        assertEquals(3, history.countIn("X", null, at("12:00")));
    }

    @Test
    @DisplayName("lastChangeIn only looks inside the window")
    void lastChangeIn() {
        assertEquals("h3", history.lastChangeIn("X", at("10:00"), at("11:00")).orElseThrow().getNewHash());
        assertTrue(history.lastChangeIn("X", at("10:40"), at("11:00")).isEmpty());
    }

    @Test
    @DisplayName("snapshot lists nodes that already had a value")
    void snapshotAt() {
        assertEquals(Map.of("X", "h2"), history.snapshotAt(at("10:20")));
        assertEquals(Map.of("X", "h3", "Y", "y1"), history.snapshotAt(at("10:45")));
    }
}
