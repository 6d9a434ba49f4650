package com.skilldeck.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public class ConfigLoader {

    private static final Path HOME = Path.of(System.getProperty("user.home"), ".skilldeck");
    private static final Path DEFAULT_PATH = HOME.resolve("config.yaml");

    public static SkillDeckConfig load() {
        return load(DEFAULT_PATH, System.getenv());
    }

    public static SkillDeckConfig load(Path path) {
        return load(path, System.getenv());
    }

    @SuppressWarnings("unchecked")
    static SkillDeckConfig load(Path path, Map<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = (Map<String, Object>) raw.getOrDefault("server", Map.of());
        var skills = (Map<String, Object>) raw.getOrDefault("skills", Map.of());

        return new SkillDeckConfig(
            Integer.parseInt(envOrDefault(env, "SKILLDECK_PORT",
                String.valueOf(server.getOrDefault("port", SkillDeckConfig.defaults().serverPort())))),
            parseSkillsConfig(skills, env)
        );
    }

    private static SkillsConfig parseSkillsConfig(Map<String, Object> skills, Map<String, String> env) {
        var defaults = SkillsConfig.defaults();
        var dir = envOrDefault(env, "SKILLDECK_SKILLS_DIR",
            String.valueOf(skills.getOrDefault("dir", HOME.resolve("skills").toString())));
        Set<String> disabled = skills.containsKey("disabled")
                ? ((List<?>) skills.get("disabled")).stream()
                        .map(String::valueOf).collect(Collectors.toSet())
                : defaults.disabled();

        return new SkillsConfig(
            dir.isBlank() ? null : Path.of(expandHome(dir)),
            intValue(skills, "content-budget", defaults.contentBudget()),
            intValue(skills, "default-ttl", defaults.defaultTtl()),
            intValue(skills, "manual-ttl", defaults.manualTtl()),
            intValue(skills, "max-hints", defaults.maxHints()),
            Boolean.TRUE.equals(skills.getOrDefault("watch", defaults.watch())),
            disabled
        );
    }

    private static int intValue(Map<String, Object> section, String key, int fallback) {
        return Integer.parseInt(String.valueOf(section.getOrDefault(key, fallback)));
    }

    private static String expandHome(String path) {
        return path.startsWith("~/") ? System.getProperty("user.home") + path.substring(1) : path;
    }

    private static String envOrDefault(Map<String, String> env, String key, String fallback) {
        var val = env.get(key);
        return val != null ? val : fallback;
    }
}
