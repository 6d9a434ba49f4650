package com.skilldeck.skills;

/** A skill the current message mentions but which is not active for the session. */
public record SkillHint(String slug, String description) {}
