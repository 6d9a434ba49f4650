package com.skilldeck.skills;

import com.fasterxml.jackson.databind.JsonNode;
import com.skilldeck.tools.Tool;
import com.skilldeck.tools.ToolContext;
import com.skilldeck.tools.ToolResult;

/**
 * The single {@code skill} tool the model sees. Every installed skill, app-backed or
 * instruction-only, is reached through it.
 */
public class SkillTool implements Tool {

    public static final String NAME = "skill";

    private final SkillEngine engine;
    private final SkillLifecycle lifecycle;

    public SkillTool(SkillEngine engine, SkillLifecycle lifecycle) {
        this.engine = engine;
        this.lifecycle = lifecycle;
    }

    @Override public String name() { return NAME; }

    @Override public String description() {
        return engine.schema().description();
    }

    @Override public JsonNode inputSchema() {
        return engine.schema().inputSchema();
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (input == null || !input.isObject()) {
            return ToolResult.error("Invalid input: expected a JSON object");
        }
        var name = input.path("name").asText("");
        var action = input.path("action").asText("");
        var content = input.path("content").asText("");

        try {
            switch (action) {
                case "catalog":
                    return ToolResult.ok(engine.catalog());
                case "create": {
                    var doc = lifecycle.create(content);
                    return ToolResult.ok("Skill \"" + doc.name() + "\" created and available in catalog. "
                            + "Use skill(name: \"" + doc.slug() + "\", action: \"load\") to activate it for this conversation.");
                }
                case "update": {
                    var doc = lifecycle.update(name, content);
                    return ToolResult.ok("Skill \"" + doc.name() + "\" updated. "
                            + "If it's loaded in this session, unload and reload it to pick up changes.");
                }
                case "delete":
                    lifecycle.delete(name);
                    return ToolResult.ok("Skill \"" + name + "\" deleted successfully. It will be unloaded automatically.");
                case "load":
                    if (name.isEmpty()) return ToolResult.error("Name is required for load.");
                    if (!ctx.hasSession()) return ToolResult.error("No session context available.");
                    return engine.load(ctx.sessionKey(), name);
                case "unload":
                    if (name.isEmpty()) return ToolResult.error("Name is required for unload.");
                    if (!ctx.hasSession()) return ToolResult.error("No session context available.");
                    return engine.unload(ctx.sessionKey(), name);
                default:
                    break;
            }
        } catch (SkillException e) {
            return ToolResult.error(errorPrefix(e.kind()) + e.getMessage());
        }

        if (name.isEmpty()) {
            return ToolResult.ok(engine.catalog());
        }
        return engine.invoke(ctx, name, action, input);
    }

    private static String errorPrefix(SkillException.ErrorKind kind) {
        return switch (kind) {
            case VALIDATION_FAILED -> "Validation failed: ";
            case STORAGE_FAILURE -> "Storage error: ";
            default -> "";
        };
    }
}
