package com.skilldeck.skills;

import com.fasterxml.jackson.databind.JsonNode;
import com.skilldeck.tools.ToolContext;
import com.skilldeck.tools.ToolResult;

/**
 * Executable handle behind an app-backed skill. Receives the skill tool input unchanged.
 */
@FunctionalInterface
public interface Capability {
    ToolResult execute(ToolContext ctx, JsonNode request);
}
