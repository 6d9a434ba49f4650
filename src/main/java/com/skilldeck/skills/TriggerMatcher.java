package com.skilldeck.skills;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Matches user messages against skill trigger phrases and renders suggestion hints.
 */
public class TriggerMatcher {

    static final Comparator<SkillDefinition> HINT_ORDER =
            Comparator.comparingInt(SkillDefinition::priority).reversed()
                    .thenComparing(SkillDefinition::slug);

    private final SkillRegistry registry;

    public TriggerMatcher(SkillRegistry registry) {
        this.registry = registry;
    }

    /**
     * Skills whose triggers occur in {@code message}, skipping those {@code active} accepts.
     * Ordered by priority (highest first), then slug; at most {@code limit} entries.
     */
    public List<SkillHint> hints(String message, Predicate<String> active, int limit) {
        if (limit <= 0 || message == null || message.isBlank()) return List.of();
        var matched = new ArrayList<SkillDefinition>();
        for (var def : registry.list()) {
            if (active.test(def.slug())) continue;
            if (def.matches(message)) matched.add(def);
        }
        matched.sort(HINT_ORDER);
        return matched.stream()
                .limit(limit)
                .map(d -> new SkillHint(d.slug(), d.description()))
                .toList();
    }

    /** Markdown block for the system prompt; empty when there are no hints. */
    public static String format(List<SkillHint> hints) {
        if (hints == null || hints.isEmpty()) return "";
        var sb = new StringBuilder();
        sb.append("## Suggested Skills\n\n");
        sb.append("These skills look relevant to the latest message. ");
        sb.append("Use `skill(name: \"<name>\", action: \"load\")` to activate one.\n\n");
        for (var h : hints) {
            sb.append("- **").append(h.slug()).append("**: ").append(h.description()).append("\n");
        }
        return sb.toString();
    }
}
