package com.skilldeck.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class SkillMetrics {

    private final MeterRegistry registry;
    private final Counter activations;
    private final Counter evictions;
    private final Counter invocations;
    private final Counter hints;

    public SkillMetrics() {
        this(new SimpleMeterRegistry());
    }

    public SkillMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.activations = Counter.builder("skilldeck.skill.activations").register(registry);
        this.evictions = Counter.builder("skilldeck.skill.evictions").register(registry);
        this.invocations = Counter.builder("skilldeck.skill.invocations").register(registry);
        this.hints = Counter.builder("skilldeck.skill.hints").register(registry);
    }

    public MeterRegistry registry() { return registry; }

    public Counter activations() { return activations; }

    public Counter evictions() { return evictions; }

    public Counter invocations() { return invocations; }

    public Counter hints() { return hints; }
}
