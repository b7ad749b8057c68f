package com.riskengine.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only transcript of game events. Readers either take the whole log or only what was
 * appended since the previous read; both move the read cursor to the end.
 */
public class EventLog {

    private final List<String> entries = new ArrayList<>();
    private int readIndex = 0;

    public void append(String entry) {
        entries.add(entry);
    }

    public List<String> readAll() {
        readIndex = entries.size();
        return List.copyOf(entries);
    }

    public List<String> readNew() {
        List<String> fresh = List.copyOf(entries.subList(readIndex, entries.size()));
        readIndex = entries.size();
        return fresh;
    }

    public int size() {
        return entries.size();
    }
}
