package com.skilldeck.agent;

import com.skilldeck.skills.SkillHint;

import java.util.List;
import java.util.Map;

/**
 * Everything the host needs for the next model call of a session.
 *
 * @param turn session turn after the tick
 * @param messages chat messages, system prompt first
 * @param tools function definitions the model may call
 * @param allowedTools aggregated restrictions of the active skills, null when unrestricted
 * @param hints inactive skills the message mentions
 */
public record PreparedTurn(
    int turn,
    List<Map<String, Object>> messages,
    List<Map<String, Object>> tools,
    List<String> allowedTools,
    List<SkillHint> hints
) {}
