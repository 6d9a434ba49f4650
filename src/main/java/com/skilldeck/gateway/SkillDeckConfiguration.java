package com.skilldeck.gateway;

import com.skilldeck.agent.PromptBuilder;
import com.skilldeck.agent.TurnPreparer;
import com.skilldeck.observability.SkillMetrics;
import com.skilldeck.shared.config.ConfigLoader;
import com.skilldeck.shared.config.SkillDeckConfig;
import com.skilldeck.skills.SkillDirectorySync;
import com.skilldeck.skills.SkillEngine;
import com.skilldeck.skills.SkillLifecycle;
import com.skilldeck.skills.SkillRegistry;
import com.skilldeck.skills.SkillTool;
import com.skilldeck.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SkillDeckConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SkillDeckConfiguration.class);

    @Bean
    public SkillDeckConfig skillDeckConfig() {
        return ConfigLoader.load();
    }

    @Bean
    public SkillEngine skillEngine(SkillDeckConfig config) {
        return new SkillEngine(new SkillRegistry(), config.skills(), new SkillMetrics());
    }

    @Bean
    public SkillLifecycle skillLifecycle(SkillEngine engine, SkillDeckConfig config) {
        var dir = config.skills().dir();
        if (dir == null) {
            log.warn("No skills directory configured; create/update/delete are disabled");
            return new SkillLifecycle(null);
        }
        var sync = new SkillDirectorySync(engine, dir, config.skills().disabled());
        log.info("Loaded {} skills from {}", sync.resync(), dir);
        return new SkillLifecycle(sync);
    }

    @Bean
    public ToolRegistry toolRegistry(SkillEngine engine, SkillLifecycle lifecycle) {
        var registry = new ToolRegistry();
        registry.register(new SkillTool(engine, lifecycle));
        return registry;
    }

    @Bean
    public TurnPreparer turnPreparer(SkillEngine engine, ToolRegistry toolRegistry) {
        return new TurnPreparer(engine, toolRegistry, new PromptBuilder());
    }
}
