package com.skilldeck.gateway;

import com.skilldeck.shared.config.ConfigLoader;
import com.skilldeck.skills.SkillDirectoryWatcher;
import com.skilldeck.skills.SkillLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.io.IOException;
import java.util.Map;

@SpringBootApplication(scanBasePackages = "com.skilldeck")
public class SkillDeckApp {

    private static final Logger log = LoggerFactory.getLogger(SkillDeckApp.class);

    public static void main(String[] args) {
        var config = ConfigLoader.load();
        var app = new SpringApplication(SkillDeckApp.class);
        app.setDefaultProperties(Map.of("server.port", config.serverPort()));
        var ctx = app.run(args);

        // Hot reload of the skills directory
        var lifecycle = ctx.getBean(SkillLifecycle.class);
        if (config.skills().watch() && lifecycle.configured()) {
            var watcher = new SkillDirectoryWatcher(lifecycle.sync());
            try {
                watcher.start();
                Runtime.getRuntime().addShutdownHook(new Thread(watcher::close, "skill-watcher-close"));
            } catch (IOException e) {
                log.warn("Skill directory watch unavailable: {}", e.getMessage());
            }
        }
        log.info("SkillDeck listening on port {}", config.serverPort());
    }
}
