package com.skilldeck.tools;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class ToolRegistry {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public void register(Tool tool) {
        if (tools.containsKey(tool.name())) {
            throw new IllegalArgumentException("Duplicate tool: " + tool.name());
        }
        tools.put(tool.name(), tool);
    }

    public Tool get(String name) {
        return tools.get(name);
    }

    public Collection<Tool> all() {
        return tools.values();
    }

    /**
     * Function-calling definitions for the registered tools.
     *
     * @param allowedTools names to keep, or null for every tool
     * @param alwaysAllowed names kept even when {@code allowedTools} leaves them out
     */
    public List<Map<String, Object>> definitions(Collection<String> allowedTools, Set<String> alwaysAllowed) {
        var defs = new ArrayList<Map<String, Object>>();
        for (Tool t : tools.values()) {
            if (allowedTools != null && !allowedTools.contains(t.name())
                    && !alwaysAllowed.contains(t.name())) continue;
            var fn = new LinkedHashMap<String, Object>();
            fn.put("name", t.name());
            fn.put("description", t.description());
            fn.put("parameters", MAPPER.convertValue(t.inputSchema(), Map.class));
            defs.add(Map.of("type", "function", "function", fn));
        }
        return defs;
    }
}
