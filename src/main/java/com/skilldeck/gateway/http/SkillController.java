package com.skilldeck.gateway.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.skilldeck.agent.PreparedTurn;
import com.skilldeck.agent.TurnPreparer;
import com.skilldeck.skills.SkillEngine;
import com.skilldeck.skills.SkillTool;
import com.skilldeck.skills.TriggerMatcher;
import com.skilldeck.tools.ToolContext;
import com.skilldeck.tools.ToolRegistry;
import com.skilldeck.tools.ToolResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class SkillController {

    private final SkillEngine engine;
    private final ToolRegistry toolRegistry;
    private final TurnPreparer turnPreparer;

    public SkillController(SkillEngine engine, ToolRegistry toolRegistry, TurnPreparer turnPreparer) {
        this.engine = engine;
        this.toolRegistry = toolRegistry;
        this.turnPreparer = turnPreparer;
    }

    @GetMapping("/v1/skills")
    public Map<String, Object> catalog() {
        return Map.of("count", engine.count(), "catalog", engine.catalog());
    }

    @PostMapping("/v1/sessions/{sessionKey}/skill")
    public ToolResult invoke(@PathVariable String sessionKey, @RequestBody JsonNode body) {
        return toolRegistry.get(SkillTool.NAME).execute(new ToolContext(sessionKey), body);
    }

    @PostMapping("/v1/sessions/{sessionKey}/tick")
    public Map<String, Object> tick(@PathVariable String sessionKey, @RequestBody Map<String, String> body) {
        var outcome = engine.tick(sessionKey, body.getOrDefault("message", ""));
        var result = new LinkedHashMap<String, Object>();
        result.put("turn", outcome.turn());
        result.put("hints", outcome.hints());
        result.put("prompt", TriggerMatcher.format(outcome.hints()));
        return result;
    }

    @PostMapping("/v1/sessions/{sessionKey}/prepare")
    public PreparedTurn prepare(@PathVariable String sessionKey, @RequestBody Map<String, String> body) {
        return turnPreparer.prepare(sessionKey, body.getOrDefault("message", ""), new ArrayList<>());
    }

    @GetMapping("/v1/sessions/{sessionKey}/context")
    public Map<String, Object> context(@PathVariable String sessionKey) {
        var result = new LinkedHashMap<String, Object>();
        result.put("turn", engine.turn(sessionKey));
        result.put("active", engine.activeSlugs(sessionKey));
        result.put("content", engine.activeContent(sessionKey));
        result.put("allowedTools", engine.activeToolRestrictions(sessionKey));
        return result;
    }

    @PostMapping("/v1/sessions/{sessionKey}/skills/{slug}/force-load")
    public Map<String, Object> forceLoad(@PathVariable String sessionKey, @PathVariable String slug) {
        return Map.of("slug", slug, "loaded", engine.forceLoad(sessionKey, slug));
    }

    @DeleteMapping("/v1/sessions/{sessionKey}")
    public Map<String, Object> clear(@PathVariable String sessionKey) {
        engine.clearSession(sessionKey);
        return Map.of("cleared", sessionKey);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return new ResponseEntity<>(Map.of("error", "bad_request", "details", e.getMessage()), HttpStatus.BAD_REQUEST);
    }
}
