package com.hometown.happiness.service;

import com.hometown.happiness.dto.TeamReference;

import java.util.*;

/** Code-keyed lookup used by code-based leagues (MLB retro codes, NBA abbreviations). */
public class TeamReferenceTable {

    private final Map<String, TeamReference> byCode = new LinkedHashMap<>();

    public static TeamReferenceTable empty() {
        return new TeamReferenceTable();
    }

    /** Later entries for the same code replace earlier ones. */
    public void put(TeamReference reference) {
        byCode.put(reference.code(), reference);
    }

    public Optional<TeamReference> lookup(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(byCode.get(code.trim()));
    }

    public Collection<TeamReference> entries() {
        return Collections.unmodifiableCollection(byCode.values());
    }

    public int size() {
        return byCode.size();
    }

    public boolean isEmpty() {
        return byCode.isEmpty();
    }
}
