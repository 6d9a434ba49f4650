package com.skilldeck.skills;

import com.fasterxml.jackson.databind.JsonNode;
import com.skilldeck.observability.SkillMetrics;
import com.skilldeck.shared.config.SkillsConfig;
import com.skilldeck.skills.SkillSchemas.SkillSchema;
import com.skilldeck.tools.ToolContext;
import com.skilldeck.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe entry point over the skill registry and all session state.
 *
 * <p>One read/write lock guards the registry, every session and the schema cache. The
 * components behind it ({@link SkillRegistry}, {@link SessionTracker}) never lock, so nothing
 * here re-acquires the lock it already holds. Capability calls run after the lock is released.
 */
public class SkillEngine {

    private static final Logger log = LoggerFactory.getLogger(SkillEngine.class);

    static final String ORCHESTRATION_PREFIX =
            "This is an orchestration skill. Follow the guidance below, calling other skills as directed.\n\n";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final SkillRegistry registry;
    private final SessionTracker tracker;
    private final ContentAssembler assembler;
    private final PermissionAggregator permissions = new PermissionAggregator();
    private final SkillsConfig config;
    private final SkillMetrics metrics;

    private SkillSchema cachedSchema;
    private long cachedVersion = -1;
    private int schemaBuilds;

    public SkillEngine(SkillRegistry registry) {
        this(registry, SkillsConfig.defaults(), new SkillMetrics());
    }

    public SkillEngine(SkillRegistry registry, SkillsConfig config, SkillMetrics metrics) {
        this.registry = registry;
        this.config = config;
        this.metrics = metrics;
        this.tracker = new SessionTracker(registry, new TriggerMatcher(registry),
                config.defaultTtl(), config.manualTtl());
        this.assembler = new ContentAssembler(config.contentBudget());
    }

    // --- Registry ---

    public void register(SkillDefinition definition) {
        lock.writeLock().lock();
        try {
            registry.register(definition);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Registered skill '{}'{}", definition.slug(), definition.hasCapability() ? " (app)" : "");
    }

    public void unregister(String slug) {
        lock.writeLock().lock();
        try {
            registry.unregister(slug);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Unregistered skill '{}'", slug);
    }

    public int unregisterAllWithoutCapability() {
        lock.writeLock().lock();
        try {
            return registry.unregisterAllWithoutCapability();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Swaps every instruction-only skill for {@code definitions} in one critical section, so
     * readers never observe the half-synced registry. Capability-backed skills are kept.
     */
    public void replaceInstructionSkills(Collection<SkillDefinition> definitions) {
        int removed;
        lock.writeLock().lock();
        try {
            removed = registry.unregisterAllWithoutCapability();
            for (var def : definitions) {
                var current = registry.get(def.slug());
                if (current != null && current.hasCapability()) {
                    log.warn("Skill '{}' on disk shadows an app skill; keeping the app skill", def.slug());
                    continue;
                }
                registry.register(def);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Synced instruction skills: {} removed, {} on disk", removed, definitions.size());
    }

    public SkillDefinition get(String slug) {
        lock.readLock().lock();
        try {
            return registry.get(slug);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<SkillDefinition> list() {
        lock.readLock().lock();
        try {
            return registry.list();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int count() {
        lock.readLock().lock();
        try {
            return registry.count();
        } finally {
            lock.readLock().unlock();
        }
    }

    // --- Catalog / invocation ---

    public String catalog() {
        lock.readLock().lock();
        try {
            return renderCatalog(registry.list());
        } finally {
            lock.readLock().unlock();
        }
    }

    private static String renderCatalog(List<SkillDefinition> entries) {
        if (entries.isEmpty()) {
            return "No skills installed. Use skill(action: \"create\", content: \"...\") to create one.";
        }
        var sb = new StringBuilder("# Available Skills\n\n");
        var apps = entries.stream().filter(SkillDefinition::hasCapability).toList();
        var standalone = entries.stream().filter(d -> !d.hasCapability()).toList();
        if (!apps.isEmpty()) {
            sb.append("## App Skills\n");
            apps.forEach(e -> sb.append("- **").append(e.slug()).append("**: ").append(e.description()).append("\n"));
            sb.append("\n");
        }
        if (!standalone.isEmpty()) {
            sb.append("## Orchestration Skills\n");
            standalone.forEach(e -> sb.append("- **").append(e.slug()).append("**: ").append(e.description()).append("\n"));
            sb.append("\n");
        }
        sb.append("Use `skill(name: \"<name>\", action: \"load\")` to activate a skill for this conversation.\n");
        sb.append("Use `skill(name: \"<name>\", action: \"unload\")` when done. ");
        sb.append("Skills you stop using are unloaded after a few turns.");
        return sb.toString();
    }

    static ToolResult notFound(String name) {
        return ToolResult.error("Skill \"" + name + "\" not found. Use skill(action: \"catalog\") to see available skills.");
    }

    /**
     * Runs a named skill. The activation is recorded before the action runs, whatever its outcome.
     *
     * @param request the raw tool input, forwarded unchanged to app-backed skills
     */
    public ToolResult invoke(ToolContext ctx, String name, String action, JsonNode request) {
        SkillDefinition def;
        lock.writeLock().lock();
        try {
            def = registry.get(name);
            if (def == null) return notFound(name);
            if (ctx.hasSession()) {
                countActivation(tracker.record(ctx.sessionKey(), name, false));
            }
        } finally {
            lock.writeLock().unlock();
        }
        metrics.invocations().increment();

        if (action == null || action.isEmpty() || "help".equals(action)) {
            return ToolResult.ok(def.body().isEmpty()
                    ? def.bodyOrStub() + "\n\nNo detailed documentation available."
                    : def.body());
        }
        if (!def.hasCapability()) {
            return ToolResult.ok(ORCHESTRATION_PREFIX + def.bodyOrStub());
        }
        try {
            var result = def.capability().execute(ctx, request);
            return result != null ? result : ToolResult.error("Skill \"" + name + "\" returned no result");
        } catch (RuntimeException e) {
            log.warn("Skill '{}' failed on action '{}': {}", name, action, e.getMessage());
            return ToolResult.error("Skill \"" + name + "\" failed: " + e.getMessage());
        }
    }

    // --- Session activation ---

    /**
     * Creates or refreshes the activation of {@code slug} in {@code sessionKey}. Takes the write
     * lock itself; never call it from code that already holds the engine lock.
     *
     * @return false when the skill is not registered
     */
    public boolean recordActivation(String sessionKey, String slug, boolean manual) {
        lock.writeLock().lock();
        try {
            var result = tracker.record(sessionKey, slug, manual);
            countActivation(result);
            return result.applied();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Advances the session by one user message. */
    public TickOutcome tick(String sessionKey, String message) {
        TickOutcome outcome;
        lock.writeLock().lock();
        try {
            outcome = tracker.tick(sessionKey, message, config.maxHints());
        } finally {
            lock.writeLock().unlock();
        }
        metrics.evictions().increment(outcome.evicted().size());
        metrics.activations().increment(outcome.reactivated().size());
        metrics.hints().increment(outcome.hints().size());
        return outcome;
    }

    public ToolResult load(String sessionKey, String slug) {
        String name;
        String content;
        lock.writeLock().lock();
        try {
            var result = tracker.record(sessionKey, slug, true);
            if (!result.applied()) return notFound(slug);
            countActivation(result);
            var record = tracker.get(sessionKey, slug);
            name = record.displayName();
            content = record.contentSnapshot();
        } finally {
            lock.writeLock().unlock();
        }
        return ToolResult.ok("Skill \"" + name + "\" loaded for this conversation. Follow the instructions below:\n\n"
                + content);
    }

    // Refreshes are not activations.
    private void countActivation(SessionTracker.RecordResult result) {
        if (result == SessionTracker.RecordResult.CREATED) metrics.activations().increment();
    }

    /** Activates a skill without a model-issued call, e.g. for onboarding. */
    public boolean forceLoad(String sessionKey, String slug) {
        var applied = recordActivation(sessionKey, slug, true);
        if (!applied) log.warn("Cannot force-load unknown skill '{}' into session {}", slug, sessionKey);
        return applied;
    }

    public ToolResult unload(String sessionKey, String slug) {
        lock.writeLock().lock();
        try {
            tracker.unload(sessionKey, slug);
        } finally {
            lock.writeLock().unlock();
        }
        return ToolResult.ok("Skill \"" + slug + "\" unloaded from this conversation.");
    }

    /** Drops the turn counter and every activation of the session. */
    public void clearSession(String sessionKey) {
        lock.writeLock().lock();
        try {
            tracker.clear(sessionKey);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // --- Prompt inputs ---

    public String activeContent(String sessionKey) {
        lock.readLock().lock();
        try {
            return assembler.assemble(tracker.records(sessionKey));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Tools allowed by the active skills, or null when unrestricted. */
    public List<String> activeToolRestrictions(String sessionKey) {
        lock.readLock().lock();
        try {
            return permissions.aggregate(tracker.records(sessionKey));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int turn(String sessionKey) {
        lock.readLock().lock();
        try {
            return tracker.turn(sessionKey);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isActive(String sessionKey, String slug) {
        return activation(sessionKey, slug) != null;
    }

    /** Copy of the session's record for {@code slug}, or null when it is not active. */
    public ActivationRecord activation(String sessionKey, String slug) {
        lock.readLock().lock();
        try {
            var record = tracker.get(sessionKey, slug);
            return record == null ? null : record.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Active slugs of the session, most recently active first. */
    public List<String> activeSlugs(String sessionKey) {
        lock.readLock().lock();
        try {
            return ContentAssembler.ranked(tracker.records(sessionKey)).stream()
                    .map(ActivationRecord::slug)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    // --- Tool schema cache ---

    public SkillSchema schema() {
        lock.readLock().lock();
        try {
            if (cachedSchema != null && cachedVersion == registry.version()) return cachedSchema;
        } finally {
            lock.readLock().unlock();
        }
        lock.writeLock().lock();
        try {
            if (cachedSchema == null || cachedVersion != registry.version()) {
                cachedSchema = SkillSchemas.build(registry.list());
                cachedVersion = registry.version();
                schemaBuilds++;
                log.debug("Rebuilt skill tool schema for {} skills", registry.count());
            }
            return cachedSchema;
        } finally {
            lock.writeLock().unlock();
        }
    }

    int schemaBuilds() {
        lock.readLock().lock();
        try {
            return schemaBuilds;
        } finally {
            lock.readLock().unlock();
        }
    }
}
