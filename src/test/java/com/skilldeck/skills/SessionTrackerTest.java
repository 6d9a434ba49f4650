package com.skilldeck.skills;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionTrackerTest {

    private SkillRegistry registry;
    private SessionTracker tracker;

    @BeforeEach
    void setUp() {
        registry = new SkillRegistry();
        tracker = new SessionTracker(registry, new TriggerMatcher(registry), 4, 6);
        registry.register(skill("calendar", List.of("meeting"), 0, 0));
        registry.register(skill("notes", List.of("notes"), 0, 0));
    }

    private static SkillDefinition skill(String slug, List<String> triggers, int priority, int ttl) {
        return new SkillDefinition(slug, slug, slug + " skill", "# " + slug, null,
                triggers, List.of(), priority, ttl);
    }

    private TickOutcome tick(String session, String message) {
        return tracker.tick(session, message, 3);
    }

    private void tickUntil(String session, int turn) {
        while (tracker.turn(session) < turn) tick(session, "hello there");
    }

    @Test
    void turnCounterCountsTicks() {
        assertEquals(0, tracker.turn("s1"));
        for (int i = 1; i <= 7; i++) {
            assertEquals(i, tick("s1", "msg " + i).turn());
        }
        assertEquals(7, tracker.turn("s1"));
        assertEquals(0, tracker.turn("s2"), "sessions are isolated");
    }

    @Test
    void invokedSkillSurvivesThroughTtlAndIsEvictedAfter() {
        tick("s1", "hi");
        assertEquals(SessionTracker.RecordResult.CREATED, tracker.record("s1", "calendar", false));

        tickUntil("s1", 5);
        assertNotNull(tracker.get("s1", "calendar"), "5 - 1 = 4 is not > 4");

        var outcome = tick("s1", "unrelated");
        assertEquals(6, outcome.turn());
        assertNull(tracker.get("s1", "calendar"));
        assertEquals(List.of("calendar"), outcome.evicted());
    }

    @Test
    void manualLoadUsesLongerTtl() {
        tick("s1", "hi");
        tracker.record("s1", "notes", true);
        assertEquals(6, tracker.get("s1", "notes").effectiveTtl());

        tickUntil("s1", 7);
        assertNotNull(tracker.get("s1", "notes"));
        tick("s1", "unrelated");
        assertNull(tracker.get("s1", "notes"));
    }

    @Test
    void ttlOverrideWinsOverDefaults() {
        registry.register(skill("short", List.of(), 0, 1));
        tick("s1", "hi");
        tracker.record("s1", "short", true);
        assertEquals(1, tracker.get("s1", "short").effectiveTtl());

        tick("s1", "x");
        assertNotNull(tracker.get("s1", "short"));
        tick("s1", "x");
        assertNull(tracker.get("s1", "short"));
    }

    @Test
    void reinvocationResetsDeadline() {
        tick("s1", "hi");
        tracker.record("s1", "calendar", false);
        tickUntil("s1", 4);
        assertEquals(SessionTracker.RecordResult.REFRESHED, tracker.record("s1", "calendar", false));
        assertEquals(4, tracker.get("s1", "calendar").lastActiveTurn());

        tickUntil("s1", 8);
        assertNotNull(tracker.get("s1", "calendar"));
        tick("s1", "x");
        assertNull(tracker.get("s1", "calendar"));
    }

    @Test
    void triggerMatchRefreshesActiveSkill() {
        tick("s1", "hi");
        tracker.record("s1", "calendar", false);
        tickUntil("s1", 3);

        var outcome = tick("s1", "Move the MEETING to Friday");
        assertEquals(List.of("calendar"), outcome.refreshed());
        assertEquals(4, tracker.get("s1", "calendar").lastActiveTurn());
        assertTrue(outcome.hints().isEmpty(), "active skills are not hinted");
    }

    @Test
    void expiredSkillRetriggeredInSameTickComesBackAsNewRecord() {
        tick("s1", "hi");
        tracker.record("s1", "notes", true);
        tickUntil("s1", 7);

        var outcome = tick("s1", "open my notes");
        var record = tracker.get("s1", "notes");
        assertNotNull(record);
        assertFalse(record.manual(), "re-created by a trigger, not a load");
        assertEquals(4, record.effectiveTtl());
        assertEquals(8, record.lastActiveTurn());
        assertEquals(List.of("notes"), outcome.reactivated());
        assertTrue(outcome.evicted().isEmpty());
    }

    @Test
    void triggerOnInactiveSkillOnlyHints() {
        tick("s1", "hi");
        var outcome = tick("s1", "schedule a meeting");
        assertNull(tracker.get("s1", "calendar"));
        assertEquals(List.of(new SkillHint("calendar", "calendar skill")), outcome.hints());
    }

    @Test
    void hintsAreOrderedByPriorityThenSlugAndCapped() {
        registry.register(skill("zeta", List.of("report"), 5, 0));
        registry.register(skill("alpha", List.of("report"), 5, 0));
        registry.register(skill("beta", List.of("report"), 9, 0));
        registry.register(skill("gamma", List.of("report"), 1, 0));

        var hints = tick("s1", "weekly report please").hints();
        assertEquals(List.of("beta", "alpha", "zeta"), hints.stream().map(SkillHint::slug).toList());
    }

    @Test
    void manualFlagOnlyUpgrades() {
        tick("s1", "hi");
        tracker.record("s1", "calendar", false);
        tracker.record("s1", "calendar", true);
        assertTrue(tracker.get("s1", "calendar").manual());
        assertEquals(4, tracker.get("s1", "calendar").effectiveTtl(), "ttl is fixed at creation");

        tracker.record("s1", "calendar", false);
        assertTrue(tracker.get("s1", "calendar").manual());
    }

    @Test
    void snapshotIgnoresLaterRegistryEdits() {
        tracker.record("s1", "calendar", false);
        registry.register(new SkillDefinition("calendar", "Calendar", "d", "# changed", null,
                List.of("meeting"), List.of("mail"), 0, 10));

        var record = tracker.get("s1", "calendar");
        assertEquals("# calendar", record.contentSnapshot());
        assertEquals(4, record.effectiveTtl());
        assertTrue(record.toolRestrictions().isEmpty());
    }

    @Test
    void unknownSkillIsNotRecorded() {
        assertEquals(SessionTracker.RecordResult.UNKNOWN, tracker.record("s1", "missing", false));
        assertTrue(tracker.records("s1").isEmpty());
    }

    @Test
    void unloadAndClear() {
        tick("s1", "hi");
        tracker.record("s1", "calendar", false);
        tracker.record("s1", "notes", true);

        assertTrue(tracker.unload("s1", "calendar"));
        assertFalse(tracker.unload("s1", "calendar"));
        assertEquals(1, tracker.records("s1").size());

        assertEquals(1, tracker.sessionCount());
        assertTrue(tracker.clear("s1"));
        assertEquals(0, tracker.sessionCount());
        assertEquals(0, tracker.turn("s1"));
        assertTrue(tracker.records("s1").isEmpty());
    }
}
