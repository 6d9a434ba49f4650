package com.skilldeck.skills;

import java.util.List;
import java.util.Locale;

/**
 * A registered skill: instructions plus an optional executable capability.
 *
 * @param slug unique, URL-safe id
 * @param displayName human readable name
 * @param description one-liner shown in the catalog and in hints
 * @param body full instructional content (SKILL.md body)
 * @param capability executable handle; null for instruction-only skills
 * @param triggers phrases matched case-insensitively against user messages
 * @param toolRestrictions tools allowed while this skill is active; empty means unrestricted
 * @param priority higher wins when ordering hints
 * @param ttlOverride idle turns tolerated before eviction; 0 uses the engine defaults
 */
public record SkillDefinition(
    String slug,
    String displayName,
    String description,
    String body,
    Capability capability,
    List<String> triggers,
    List<String> toolRestrictions,
    int priority,
    int ttlOverride
) {
    public SkillDefinition {
        if (slug == null || slug.isBlank()) throw new IllegalArgumentException("slug is required");
        displayName = displayName == null || displayName.isBlank() ? slug : displayName;
        description = description == null ? "" : description;
        body = body == null ? "" : body;
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        toolRestrictions = toolRestrictions == null ? List.of() : List.copyOf(toolRestrictions);
        if (ttlOverride < 0) ttlOverride = 0;
    }

    /** Instruction-only skill without triggers or restrictions. */
    public static SkillDefinition of(String slug, String displayName, String description, String body) {
        return new SkillDefinition(slug, displayName, description, body, null, List.of(), List.of(), 0, 0);
    }

    public boolean hasCapability() {
        return capability != null;
    }

    /** True when any trigger phrase occurs in {@code message}, ignoring case. */
    public boolean matches(String message) {
        if (message == null || message.isEmpty()) return false;
        var lower = message.toLowerCase(Locale.ROOT);
        for (var trigger : triggers) {
            if (trigger == null || trigger.isBlank()) continue;
            if (lower.contains(trigger.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }

    /** Body, or a heading plus description when the body is empty. */
    public String bodyOrStub() {
        return body.isEmpty() ? "# " + displayName + "\n\n" + description : body;
    }

    public SkillDefinition withCapability(Capability capability) {
        return new SkillDefinition(slug, displayName, description, body, capability,
                triggers, toolRestrictions, priority, ttlOverride);
    }
}
