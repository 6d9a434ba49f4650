package com.skilldeck.skills;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SkillLoaderTest {

    @TempDir
    Path tempDir;

    private void writeSkill(String dir, String fileName, String content) throws IOException {
        var skillDir = Files.createDirectories(tempDir.resolve(dir));
        Files.writeString(skillDir.resolve(fileName), content);
    }

    @Test
    void loadsValidSkill() throws IOException {
        writeSkill("review", "SKILL.md",
                "---\nname: Review\ndescription: Reviews code\ntools:\n  - file_read\n---\nYou review code.\n");
        var skills = SkillLoader.loadFrom(tempDir);
        assertEquals(1, skills.size());
        assertEquals("review", skills.get(0).slug());
        assertEquals("You review code.", skills.get(0).body());
        assertEquals(1, skills.get(0).toolRestrictions().size());
    }

    @Test
    void fileNameMatchIsCaseInsensitive() throws IOException {
        writeSkill("lower", "skill.md", "---\nname: Lower\ndescription: d\n---\n");
        assertEquals(1, SkillLoader.loadFrom(tempDir).size());
    }

    @Test
    void ignoresOtherFiles() throws IOException {
        writeSkill("review", "README.md", "---\nname: Review\ndescription: d\n---\n");
        assertTrue(SkillLoader.loadFrom(tempDir).isEmpty());
    }

    @Test
    void skipsInvalidSkillButKeepsOthers() throws IOException {
        writeSkill("bad", "SKILL.md", "{{invalid");
        writeSkill("nodesc", "SKILL.md", "---\nname: Broken\n---\n");
        writeSkill("good", "SKILL.md", "---\nname: Good\ndescription: d\n---\n");
        var skills = SkillLoader.loadFrom(tempDir);
        assertEquals(1, skills.size());
        assertEquals("good", skills.get(0).slug());
    }

    @Test
    void skipsDisabledSlugs() throws IOException {
        writeSkill("a", "SKILL.md", "---\nname: Alpha\ndescription: d\n---\n");
        writeSkill("b", "SKILL.md", "---\nname: Beta\ndescription: d\n---\n");
        var skills = SkillLoader.loadFrom(tempDir, Set.of("alpha"));
        assertEquals(1, skills.size());
        assertEquals("beta", skills.get(0).slug());
    }

    @Test
    void returnsEmptyForNonexistentDir() {
        assertTrue(SkillLoader.loadFrom(Path.of("/nonexistent/path")).isEmpty());
        assertTrue(SkillLoader.loadFrom(null).isEmpty());
    }
}
