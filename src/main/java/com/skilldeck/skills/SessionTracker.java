package com.skilldeck.skills;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-session activation state and the turn-driven eviction algorithm.
 *
 * <p>Holds no lock of its own. Every method expects the caller to already guard it, which in
 * practice means running inside a {@link SkillEngine} critical section.
 */
class SessionTracker {

    private static final Logger log = LoggerFactory.getLogger(SessionTracker.class);

    private final SkillRegistry registry;
    private final TriggerMatcher matcher;
    private final int defaultTtl;
    private final int manualTtl;
    private final Map<String, SessionState> sessions = new HashMap<>();

    SessionTracker(SkillRegistry registry, TriggerMatcher matcher, int defaultTtl, int manualTtl) {
        this.registry = registry;
        this.matcher = matcher;
        this.defaultTtl = defaultTtl;
        this.manualTtl = manualTtl;
    }

    enum RecordResult {
        CREATED, REFRESHED, UNKNOWN;

        boolean applied() {
            return this != UNKNOWN;
        }
    }

    private SessionState state(String sessionKey) {
        return sessions.computeIfAbsent(sessionKey, k -> new SessionState());
    }

    int effectiveTtl(SkillDefinition def, boolean manual) {
        if (def.ttlOverride() > 0) return def.ttlOverride();
        return manual ? manualTtl : defaultTtl;
    }

    /**
     * Creates or refreshes the record for {@code slug}. A refresh keeps the first snapshot and
     * TTL and only ever upgrades the manual flag.
     *
     * @return {@code UNKNOWN} when the skill is not registered
     */
    RecordResult record(String sessionKey, String slug, boolean manual) {
        var def = registry.get(slug);
        if (def == null) return RecordResult.UNKNOWN;
        var state = state(sessionKey);
        var existing = state.get(slug);
        if (existing != null) {
            existing.touch(state.turn(), manual);
            log.debug("Session {} refreshed skill '{}' at turn {}", sessionKey, slug, state.turn());
            return RecordResult.REFRESHED;
        }
        state.put(new ActivationRecord(def, state.turn(), effectiveTtl(def, manual), manual));
        log.debug("Session {} activated skill '{}' at turn {} (manual={})", sessionKey, slug, state.turn(), manual);
        return RecordResult.CREATED;
    }

    /**
     * Advances the session clock by one turn, then expires idle records, re-arms records the
     * message mentions, and collects hints for inactive skills it mentions.
     */
    TickOutcome tick(String sessionKey, String message, int maxHints) {
        var state = state(sessionKey);
        int turn = state.advance();

        var expired = new ArrayList<String>();
        for (var r : List.copyOf(state.records())) {
            if (r.expiredAt(turn)) {
                state.remove(r.slug());
                expired.add(r.slug());
            }
        }

        var refreshed = new ArrayList<String>();
        for (var r : state.records()) {
            var def = registry.get(r.slug());
            if (def != null && def.matches(message)) {
                r.touch(turn, false);
                refreshed.add(r.slug());
            }
        }

        var reactivated = new ArrayList<String>();
        var evicted = new ArrayList<String>();
        for (var slug : expired) {
            var def = registry.get(slug);
            if (def != null && def.matches(message)) {
                state.put(new ActivationRecord(def, turn, effectiveTtl(def, false), false));
                reactivated.add(slug);
            } else {
                evicted.add(slug);
            }
        }

        var hints = matcher.hints(message, state::isActive, maxHints);
        if (!evicted.isEmpty() || !reactivated.isEmpty()) {
            log.debug("Session {} turn {}: evicted={} reactivated={}", sessionKey, turn, evicted, reactivated);
        }
        return new TickOutcome(turn, evicted, refreshed, reactivated, hints);
    }

    boolean unload(String sessionKey, String slug) {
        var state = sessions.get(sessionKey);
        return state != null && state.remove(slug) != null;
    }

    boolean clear(String sessionKey) {
        return sessions.remove(sessionKey) != null;
    }

    int turn(String sessionKey) {
        var state = sessions.get(sessionKey);
        return state == null ? 0 : state.turn();
    }

    ActivationRecord get(String sessionKey, String slug) {
        var state = sessions.get(sessionKey);
        return state == null ? null : state.get(slug);
    }

    Collection<ActivationRecord> records(String sessionKey) {
        var state = sessions.get(sessionKey);
        return state == null ? List.of() : List.copyOf(state.records());
    }

    int sessionCount() {
        return sessions.size();
    }
}
