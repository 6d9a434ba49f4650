package com.skilldeck.shared.config;

public record SkillDeckConfig(
    int serverPort,
    SkillsConfig skills
) {
    public static SkillDeckConfig defaults() {
        return new SkillDeckConfig(18790, SkillsConfig.defaults());
    }
}
