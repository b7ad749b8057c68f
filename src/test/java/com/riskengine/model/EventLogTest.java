package com.riskengine.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventLogTest {

    @Test
    @DisplayName("readNew() should return only entries appended since the last read")
    void shouldReadIncrementally() {
        EventLog log = new EventLog();
        log.append("one");
        log.append("two");

        assertEquals(List.of("one", "two"), log.readNew());
        assertTrue(log.readNew().isEmpty());

        log.append("three");

        assertEquals(List.of("three"), log.readNew());
    }

    @Test
    @DisplayName("readAll() should return everything and move the cursor to the end")
    void shouldReadEverything() {
        EventLog log = new EventLog();
        log.append("one");
        log.readNew();
        log.append("two");

        assertEquals(List.of("one", "two"), log.readAll());
        assertTrue(log.readNew().isEmpty());
        assertEquals(2, log.size());
    }
}
