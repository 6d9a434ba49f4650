package com.skilldeck.agent;

import com.skilldeck.skills.SkillEngine;
import com.skilldeck.skills.SkillTool;
import com.skilldeck.skills.TriggerMatcher;
import com.skilldeck.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the per-message skill bookkeeping and assembles the next model call: tick the session,
 * inject active skill content and hints into the system prompt, and narrow the tool list to
 * what the active skills allow. The skill tool itself always stays callable.
 */
public class TurnPreparer {

    private static final Logger log = LoggerFactory.getLogger(TurnPreparer.class);

    private final SkillEngine engine;
    private final ToolRegistry toolRegistry;
    private final PromptBuilder promptBuilder;

    public TurnPreparer(SkillEngine engine, ToolRegistry toolRegistry, PromptBuilder promptBuilder) {
        this.engine = engine;
        this.toolRegistry = toolRegistry;
        this.promptBuilder = promptBuilder;
    }

    /** @throws IllegalArgumentException on a blank message, before the session is touched */
    public PreparedTurn prepare(String sessionKey, String userMessage, List<Map<String, Object>> history) {
        if (userMessage == null || userMessage.isBlank()) {
            throw new IllegalArgumentException("userMessage must not be empty");
        }
        var outcome = engine.tick(sessionKey, userMessage);
        var systemPrompt = promptBuilder.systemPrompt(
                engine.activeContent(sessionKey), TriggerMatcher.format(outcome.hints()));
        var allowed = engine.activeToolRestrictions(sessionKey);
        var tools = toolRegistry.definitions(allowed, Set.of(SkillTool.NAME));
        log.debug("Session {} turn {}: active={} allowedTools={}", sessionKey, outcome.turn(),
                engine.activeSlugs(sessionKey), allowed == null ? "all" : allowed);
        return new PreparedTurn(
                outcome.turn(),
                promptBuilder.build(userMessage, history, systemPrompt),
                tools,
                allowed,
                outcome.hints());
    }
}
