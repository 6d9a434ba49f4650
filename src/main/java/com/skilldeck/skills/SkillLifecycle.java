package com.skilldeck.skills;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

import static com.skilldeck.skills.SkillException.ErrorKind.ALREADY_EXISTS;
import static com.skilldeck.skills.SkillException.ErrorKind.NOT_FOUND;
import static com.skilldeck.skills.SkillException.ErrorKind.STORAGE_FAILURE;
import static com.skilldeck.skills.SkillException.ErrorKind.UNCONFIGURED;
import static com.skilldeck.skills.SkillException.ErrorKind.VALIDATION_FAILED;

/**
 * Creates, updates and deletes user skills on disk, then re-syncs the registry.
 *
 * <p>Content is validated before anything is written. Concurrent edits to the directory are
 * last-write-wins.
 */
public class SkillLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SkillLifecycle.class);

    private final SkillDirectorySync sync;

    /** @param sync null when no skills directory is configured */
    public SkillLifecycle(SkillDirectorySync sync) {
        this.sync = sync;
    }

    public boolean configured() {
        return sync != null && sync.dir() != null;
    }

    /** The directory sync behind this lifecycle; null when unconfigured. */
    public SkillDirectorySync sync() {
        return sync;
    }

    /** @return the validated document that was written */
    public SkillDocument create(String content) {
        var dir = requireDir("creation");
        var doc = parseAndValidate(content);
        var skillFile = dir.resolve(doc.slug()).resolve(SkillDocument.FILE_NAME);
        if (Files.exists(skillFile)) {
            throw new SkillException(ALREADY_EXISTS,
                "Skill \"" + doc.slug() + "\" already exists. Use action: \"update\" to modify it.");
        }
        try {
            Files.createDirectories(skillFile.getParent());
            Files.writeString(skillFile, content);
        } catch (IOException e) {
            throw new SkillException(STORAGE_FAILURE, "Failed to write SKILL.md: " + e.getMessage(), e);
        }
        log.info("Created skill '{}' at {}", doc.slug(), skillFile);
        sync.resync();
        return doc;
    }

    public SkillDocument update(String name, String content) {
        var dir = requireDir("update");
        requireName(name, "update");
        var doc = parseAndValidate(content);
        var slug = SkillDocument.slugify(name);
        var skillFile = dir.resolve(slug).resolve(SkillDocument.FILE_NAME);
        if (slug.isEmpty() || !Files.exists(skillFile)) {
            throw new SkillException(NOT_FOUND,
                "Skill \"" + slug + "\" not found in user skills. Only user-created skills can be updated.");
        }
        try {
            Files.writeString(skillFile, content);
        } catch (IOException e) {
            throw new SkillException(STORAGE_FAILURE, "Failed to write SKILL.md: " + e.getMessage(), e);
        }
        log.info("Updated skill '{}'", slug);
        sync.resync();
        return doc;
    }

    public void delete(String name) {
        var dir = requireDir("deletion");
        requireName(name, "delete");
        var slug = SkillDocument.slugify(name);
        var skillDir = dir.resolve(slug);
        if (slug.isEmpty() || !Files.exists(skillDir.resolve(SkillDocument.FILE_NAME))) {
            throw new SkillException(NOT_FOUND,
                "Skill \"" + slug + "\" not found in user skills. Only user-created skills can be deleted.");
        }
        try {
            deleteRecursively(skillDir);
        } catch (IOException e) {
            throw new SkillException(STORAGE_FAILURE, "Failed to delete skill: " + e.getMessage(), e);
        }
        log.info("Deleted skill '{}'", slug);
        sync.resync();
    }

    private Path requireDir(String operation) {
        if (!configured()) {
            throw new SkillException(UNCONFIGURED,
                "Skill " + operation + " not available (no skills directory configured).");
        }
        return sync.dir();
    }

    private static void requireName(String name, String action) {
        if (name == null || name.isBlank()) {
            throw new SkillException(VALIDATION_FAILED, "Name is required for " + action + ".");
        }
    }

    private static SkillDocument parseAndValidate(String content) {
        if (content == null || content.isBlank()) {
            throw new SkillException(VALIDATION_FAILED,
                "Content is required. Provide valid SKILL.md content with YAML frontmatter.");
        }
        return SkillDocument.parse(content).validate();
    }

    private static void deleteRecursively(Path root) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) throw exc;
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
