package com.skilldeck.skills;

import java.util.List;

/**
 * A skill that is active for one session. Content, restrictions and TTL are captured when the
 * record is created and do not follow later registry edits.
 */
public final class ActivationRecord {

    private final String slug;
    private final String displayName;
    private final String contentSnapshot;
    private final List<String> toolRestrictions;
    private final int effectiveTtl;
    private int lastActiveTurn;
    private boolean manual;

    ActivationRecord(SkillDefinition definition, int turn, int effectiveTtl, boolean manual) {
        this.slug = definition.slug();
        this.displayName = definition.displayName();
        this.contentSnapshot = definition.bodyOrStub();
        this.toolRestrictions = definition.toolRestrictions();
        this.effectiveTtl = effectiveTtl;
        this.lastActiveTurn = turn;
        this.manual = manual;
    }

    private ActivationRecord(ActivationRecord other) {
        this.slug = other.slug;
        this.displayName = other.displayName;
        this.contentSnapshot = other.contentSnapshot;
        this.toolRestrictions = other.toolRestrictions;
        this.effectiveTtl = other.effectiveTtl;
        this.lastActiveTurn = other.lastActiveTurn;
        this.manual = other.manual;
    }

    /** Detached copy; later refreshes of this record do not show through it. */
    ActivationRecord copy() {
        return new ActivationRecord(this);
    }

    void touch(int turn, boolean manualActivation) {
        lastActiveTurn = turn;
        if (manualActivation) manual = true;
    }

    boolean expiredAt(int turn) {
        return turn - lastActiveTurn > effectiveTtl;
    }

    public String slug() { return slug; }
    public String displayName() { return displayName; }
    public String contentSnapshot() { return contentSnapshot; }
    public List<String> toolRestrictions() { return toolRestrictions; }
    public int effectiveTtl() { return effectiveTtl; }
    public int lastActiveTurn() { return lastActiveTurn; }
    public boolean manual() { return manual; }

    @Override
    public String toString() {
        return "ActivationRecord[" + slug + ", lastActiveTurn=" + lastActiveTurn
                + ", ttl=" + effectiveTtl + ", manual=" + manual + "]";
    }
}
