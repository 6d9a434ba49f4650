package com.skilldeck.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    record NamedTool(String name) implements Tool {
        @Override public String description() { return name + " tool"; }
        @Override public JsonNode inputSchema() { return MAPPER.createObjectNode().put("type", "object"); }
        @Override public ToolResult execute(ToolContext ctx, JsonNode input) { return ToolResult.ok(name); }
    }

    private ToolRegistry registry(String... names) {
        var registry = new ToolRegistry();
        for (var n : names) registry.register(new NamedTool(n));
        return registry;
    }

    @SuppressWarnings("unchecked")
    private static List<String> names(List<Map<String, Object>> defs) {
        return defs.stream()
                .map(d -> (String) ((Map<String, Object>) d.get("function")).get("name"))
                .toList();
    }

    @Test
    void rejectsDuplicates() {
        var registry = registry("file");
        assertThrows(IllegalArgumentException.class, () -> registry.register(new NamedTool("file")));
    }

    @Test
    void nullAllowListKeepsEverything() {
        var defs = registry("skill", "file", "shell").definitions(null, Set.of());
        assertEquals(List.of("skill", "file", "shell"), names(defs));
        assertEquals("function", defs.get(0).get("type"));
    }

    @Test
    void allowListFiltersButKeepsAlwaysAllowed() {
        var defs = registry("skill", "file", "shell").definitions(List.of("file"), Set.of("skill"));
        assertEquals(List.of("skill", "file"), names(defs));
    }

    @SuppressWarnings("unchecked")
    @Test
    void definitionCarriesSchemaAsMap() {
        var fn = (Map<String, Object>) registry("file").definitions(null, Set.of()).get(0).get("function");
        assertEquals("file tool", fn.get("description"));
        assertEquals(Map.of("type", "object"), fn.get("parameters"));
    }
}
