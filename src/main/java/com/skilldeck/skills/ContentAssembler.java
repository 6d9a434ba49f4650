package com.skilldeck.skills;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Serializes active skills into one prompt block, most recently active first, under a
 * character budget. A skill that does not fit the remaining budget is left out whole.
 */
public class ContentAssembler {

    static final Comparator<ActivationRecord> RECENCY =
            Comparator.comparingInt(ActivationRecord::lastActiveTurn).reversed()
                    .thenComparing(ActivationRecord::slug);

    private static final String PREAMBLE = "## Active Skills\n\n"
            + "The following skills are loaded for this conversation. Follow their instructions.\n\n";

    private final int budget;

    public ContentAssembler(int budget) {
        this.budget = budget;
    }

    static List<ActivationRecord> ranked(Collection<ActivationRecord> records) {
        var sorted = new ArrayList<>(records);
        sorted.sort(RECENCY);
        return sorted;
    }

    /** Records that fit the budget, in output order. */
    List<ActivationRecord> select(Collection<ActivationRecord> records) {
        int remaining = budget;
        var selected = new ArrayList<ActivationRecord>();
        for (var r : ranked(records)) {
            int len = r.contentSnapshot().length();
            if (len > remaining) continue;
            selected.add(r);
            remaining -= len;
        }
        return selected;
    }

    public String assemble(Collection<ActivationRecord> records) {
        if (records.isEmpty()) return "";
        var selected = select(records);
        if (selected.isEmpty()) return "";
        var sb = new StringBuilder(PREAMBLE);
        for (var r : selected) {
            sb.append("### ").append(r.displayName()).append("\n\n");
            sb.append(r.contentSnapshot());
            sb.append("\n\n---\n\n");
        }
        return sb.toString();
    }
}
