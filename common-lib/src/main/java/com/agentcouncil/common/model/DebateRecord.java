package com.agentcouncil.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only transcript of a debate. {@link #append} returns a new record; an existing record
 * is never modified.
 */
public record DebateRecord(
    @JsonProperty("entries") List<DebateEntry> entries
) {

    public DebateRecord {
        entries = List.copyOf(entries);
    }

    public static DebateRecord empty() {
        return new DebateRecord(List.of());
    }

    public DebateRecord append(String role, String argument) {
        List<DebateEntry> next = new ArrayList<>(entries);
        next.add(new DebateEntry(role, argument));
        return new DebateRecord(next);
    }

    @JsonIgnore
    public List<DebateEntry> byRole(String role) {
        return entries.stream().filter(e -> e.role().equals(role)).toList();
    }

    @JsonIgnore
    public int size() {
        return entries.size();
    }
}
