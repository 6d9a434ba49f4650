package com.skilldeck.skills;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/** Turn clock and active skills of one conversation. */
final class SessionState {

    private int turnCounter;
    private final Map<String, ActivationRecord> activeSkills = new LinkedHashMap<>();

    int turn() {
        return turnCounter;
    }

    int advance() {
        return ++turnCounter;
    }

    ActivationRecord get(String slug) {
        return activeSkills.get(slug);
    }

    void put(ActivationRecord record) {
        activeSkills.put(record.slug(), record);
    }

    ActivationRecord remove(String slug) {
        return activeSkills.remove(slug);
    }

    boolean isActive(String slug) {
        return activeSkills.containsKey(slug);
    }

    Collection<ActivationRecord> records() {
        return activeSkills.values();
    }
}
