package com.skilldeck.skills;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog of known skills keyed by slug.
 *
 * <p>Not thread-safe. A {@link SkillEngine} owns the instance and only touches it inside its
 * own critical sections; tests and single-threaded setup code may use it directly.
 */
public class SkillRegistry {

    private static final Logger log = LoggerFactory.getLogger(SkillRegistry.class);

    private final Map<String, SkillDefinition> entries = new HashMap<>();
    private long version;

    /** Adds or replaces the skill with the same slug. */
    public void register(SkillDefinition definition) {
        var previous = entries.put(definition.slug(), definition);
        version++;
        log.debug("{} skill '{}'", previous == null ? "Registered" : "Replaced", definition.slug());
    }

    public void unregister(String slug) {
        if (entries.remove(slug) != null) {
            log.debug("Unregistered skill '{}'", slug);
        }
        version++;
    }

    /** Drops every instruction-only skill; capability-backed skills stay. Returns the count removed. */
    public int unregisterAllWithoutCapability() {
        int before = entries.size();
        entries.values().removeIf(d -> !d.hasCapability());
        version++;
        return before - entries.size();
    }

    public SkillDefinition get(String slug) {
        return slug == null ? null : entries.get(slug);
    }

    /** All skills sorted by slug. */
    public List<SkillDefinition> list() {
        var all = new ArrayList<>(entries.values());
        all.sort(Comparator.comparing(SkillDefinition::slug));
        return all;
    }

    public int count() {
        return entries.size();
    }

    /** Incremented on every mutation; lets derived caches detect staleness. */
    public long version() {
        return version;
    }
}
