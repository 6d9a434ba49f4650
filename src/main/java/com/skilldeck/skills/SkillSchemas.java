package com.skilldeck.skills;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Builds the LLM-facing description and input schema of the {@code skill} tool from the
 * registered skills.
 */
public final class SkillSchemas {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Tool description and input schema for one registry snapshot. */
    public record SkillSchema(String description, JsonNode inputSchema) {}

    private SkillSchemas() {}

    /** @param entries skills sorted by slug */
    public static SkillSchema build(List<SkillDefinition> entries) {
        var desc = new StringBuilder();
        desc.append("Unified interface for skills and apps. Skills are activated per conversation: ")
            .append("by calling them, by loading them, or when the user keeps mentioning them.\n");
        desc.append("LIFECYCLE: create -> available in catalog. load -> active in THIS session ")
            .append("(injected into the system prompt). Idle skills are unloaded automatically after a few turns.\n");
        desc.append("Actions: catalog (browse), help (read instructions), load (activate for session), ")
            .append("unload (deactivate), create/update/delete (manage on disk).\n\n");
        desc.append("Available skills:\n");
        for (var e : entries) {
            desc.append("- ").append(e.slug()).append(": ").append(e.description()).append("\n");
        }

        var properties = MAPPER.createObjectNode();
        var name = properties.putObject("name")
                .put("type", "string")
                .put("description", "Skill name/slug (see list above)");
        if (!entries.isEmpty()) {
            var nameEnum = name.putArray("enum");
            entries.forEach(e -> nameEnum.add(e.slug()));
        }
        properties.putObject("action")
                .put("type", "string")
                .put("description", "Action: catalog (list), help (show instructions), load (activate for session), "
                        + "unload (deactivate), create (new skill), update (modify), delete (remove), or skill-specific");
        properties.putObject("resource")
                .put("type", "string")
                .put("description", "Resource type (skill-specific, e.g. events, email, contacts)");
        properties.putObject("content")
                .put("type", "string")
                .put("description", "Full SKILL.md content with YAML frontmatter for create/update actions");

        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.set("properties", properties);
        schema.put("additionalProperties", true);
        return new SkillSchema(desc.toString(), schema);
    }
}
