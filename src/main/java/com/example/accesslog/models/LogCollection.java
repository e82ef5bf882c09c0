package com.example.accesslog.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Search result keyed by log id, iterating in the order entries were added.
 */
public class LogCollection implements Iterable<LogEntry> {

    private final Map<Identifier, LogEntry> entries = new LinkedHashMap<>();

    public static LogCollection of(Iterable<LogEntry> logs) {
        LogCollection collection = new LogCollection();
        for (LogEntry log : logs) {
            collection.add(log);
        }
        return collection;
    }

    /**
     * Adds an entry; an entry with an id already present replaces it in place.
     */
    public void add(LogEntry log) {
        entries.put(log.getId(), log);
    }

    public Optional<LogEntry> get(Identifier id) {
        return Optional.ofNullable(entries.get(id));
    }

    public boolean contains(Identifier id) {
        return entries.containsKey(id);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Set<Identifier> ids() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public List<LogEntry> values() {
        return Collections.unmodifiableList(new ArrayList<>(entries.values()));
    }

    @Override
    public Iterator<LogEntry> iterator() {
        return Collections.unmodifiableCollection(entries.values()).iterator();
    }
}
