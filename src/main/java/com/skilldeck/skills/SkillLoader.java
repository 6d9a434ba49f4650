package com.skilldeck.skills;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Reads skill definitions from {@code <dir>/<slug>/SKILL.md} files.
 */
public class SkillLoader {

    private static final Logger log = LoggerFactory.getLogger(SkillLoader.class);

    public static List<SkillDefinition> loadFrom(Path dir) {
        return loadFrom(dir, Set.of());
    }

    /** Loads every valid SKILL.md under {@code dir}, skipping invalid files and {@code disabled} slugs. */
    public static List<SkillDefinition> loadFrom(Path dir, Set<String> disabled) {
        if (dir == null || !Files.isDirectory(dir)) return List.of();
        var bySlug = new LinkedHashMap<String, SkillDefinition>();
        try (var stream = Files.walk(dir)) {
            var files = stream
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().equalsIgnoreCase(SkillDocument.FILE_NAME))
                .sorted(Comparator.comparing(Path::toString))
                .toList();
            for (var file : files) {
                try {
                    var doc = SkillDocument.parse(Files.readString(file)).validate();
                    if (disabled.contains(doc.slug())) {
                        log.debug("Skipping disabled skill '{}'", doc.slug());
                        continue;
                    }
                    if (bySlug.put(doc.slug(), doc.toDefinition()) != null) {
                        log.warn("Duplicate skill '{}' in {}, later file wins", doc.slug(), file);
                    }
                } catch (SkillException | IOException e) {
                    log.warn("Failed to load skill from {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Failed to scan skills directory {}: {}", dir, e.getMessage());
            return List.of();
        }
        return new ArrayList<>(bySlug.values());
    }
}
