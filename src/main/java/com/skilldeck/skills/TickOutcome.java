package com.skilldeck.skills;

import java.util.List;

/**
 * What one turn advance did to a session.
 *
 * @param turn the session turn after advancing
 * @param evicted slugs whose TTL ran out this turn and stayed out
 * @param refreshed active slugs re-armed by a trigger match
 * @param reactivated slugs that expired this turn and were re-created by a trigger match
 * @param hints inactive skills the message mentions
 */
public record TickOutcome(
    int turn,
    List<String> evicted,
    List<String> refreshed,
    List<String> reactivated,
    List<SkillHint> hints
) {}
