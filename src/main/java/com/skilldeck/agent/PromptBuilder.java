package com.skilldeck.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class PromptBuilder {

    private static final String SYSTEM_PROMPT = """
            You are an assistant with access to a catalog of skills. \
            Reply in the same language the user uses. \
            Use the skill tool to browse the catalog, read a skill's instructions, or run its actions. \
            When a skill is active, follow its instructions before improvising.""";

    private final String basePrompt;

    public PromptBuilder() {
        this(SYSTEM_PROMPT);
    }

    public PromptBuilder(String basePrompt) {
        this.basePrompt = basePrompt;
    }

    /** Base prompt followed by the active skill block and the hint block, each when non-empty. */
    public String systemPrompt(String activeContent, String hints) {
        var sb = new StringBuilder(basePrompt);
        if (activeContent != null && !activeContent.isEmpty()) sb.append("\n\n").append(activeContent.strip());
        if (hints != null && !hints.isEmpty()) sb.append("\n\n").append(hints.strip());
        return sb.toString();
    }

    public List<Map<String, Object>> build(String userMessage, List<Map<String, Object>> history, String systemPrompt) {
        if (userMessage == null || userMessage.isBlank()) {
            throw new IllegalArgumentException("userMessage must not be empty");
        }
        var messages = new ArrayList<Map<String, Object>>();
        messages.add(Map.of("role", "system", "content", systemPrompt != null ? systemPrompt : basePrompt));
        if (history != null) messages.addAll(history);
        messages.add(Map.of("role", "user", "content", userMessage));
        return messages;
    }
}
