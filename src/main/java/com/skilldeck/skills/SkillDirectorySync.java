package com.skilldeck.skills;

import java.nio.file.Path;
import java.util.Set;

/**
 * Re-reads the skills directory into the engine. App-backed skills registered at runtime are
 * left alone.
 */
public class SkillDirectorySync {

    private final SkillEngine engine;
    private final Path dir;
    private final Set<String> disabled;

    public SkillDirectorySync(SkillEngine engine, Path dir, Set<String> disabled) {
        this.engine = engine;
        this.dir = dir;
        this.disabled = disabled;
    }

    public Path dir() {
        return dir;
    }

    /** @return the number of skills found on disk */
    public int resync() {
        var definitions = SkillLoader.loadFrom(dir, disabled);
        engine.replaceInstructionSkills(definitions);
        return definitions.size();
    }
}
