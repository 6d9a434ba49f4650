package com.skilldeck.shared.config;

import java.nio.file.Path;
import java.util.Set;

/**
 * Engine tunables.
 *
 * @param dir durable skill storage; null disables create/update/delete
 * @param contentBudget max characters of skill content injected per turn
 * @param defaultTtl idle turns tolerated for invoked or re-triggered skills
 * @param manualTtl idle turns tolerated for explicitly loaded skills
 * @param maxHints trigger hints surfaced per message
 * @param watch hot-reload {@code dir} on change
 * @param disabled slugs never registered from disk
 */
public record SkillsConfig(
    Path dir,
    int contentBudget,
    int defaultTtl,
    int manualTtl,
    int maxHints,
    boolean watch,
    Set<String> disabled
) {
    public SkillsConfig {
        if (contentBudget < 0) throw new IllegalArgumentException("content-budget must be >= 0");
        if (defaultTtl < 1 || manualTtl < 1) throw new IllegalArgumentException("ttl must be >= 1");
        if (maxHints < 0) throw new IllegalArgumentException("max-hints must be >= 0");
        disabled = disabled == null ? Set.of() : Set.copyOf(disabled);
    }

    public static SkillsConfig defaults() {
        return new SkillsConfig(null, 16_000, 4, 6, 3, true, Set.of());
    }
}
