package com.skilldeck.skills;

import com.skilldeck.tools.ToolResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class SkillDirectoryWatcherTest {

    @TempDir
    Path skillsDir;

    private static boolean await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) return true;
            Thread.sleep(50);
        }
        return condition.getAsBoolean();
    }

    @Test
    void picksUpAddedAndRemovedSkills() throws Exception {
        var engine = new SkillEngine(new SkillRegistry());
        engine.register(SkillDefinition.of("mail", null, "Email", "").withCapability((ctx, req) -> ToolResult.ok("ok")));
        var sync = new SkillDirectorySync(engine, skillsDir, Set.of());

        try (var watcher = new SkillDirectoryWatcher(sync, 50)) {
            watcher.start();

            var dir = Files.createDirectories(skillsDir.resolve("weather"));
            Files.writeString(dir.resolve("SKILL.md"), "---\nname: Weather\ndescription: Forecasts\n---\nCheck the sky.");
            assertTrue(await(() -> engine.get("weather") != null), "new skill registered");

            Files.delete(dir.resolve("SKILL.md"));
            assertTrue(await(() -> engine.get("weather") == null), "removed skill unregistered");
            assertNotNull(engine.get("mail"), "app skills survive a resync");
        }
    }
}
