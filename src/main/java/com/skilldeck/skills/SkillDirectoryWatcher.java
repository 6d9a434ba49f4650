package com.skilldeck.skills;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.concurrent.TimeUnit;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Re-syncs the registry whenever something under the skills directory changes.
 *
 * <p>Events are coalesced: after the first event the watcher waits {@code debounceMillis} for
 * the burst to settle, drains what arrived, and re-syncs once.
 */
public class SkillDirectoryWatcher implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(SkillDirectoryWatcher.class);

    private final SkillDirectorySync sync;
    private final long debounceMillis;
    private WatchService watchService;
    private Thread thread;
    private volatile boolean running;

    public SkillDirectoryWatcher(SkillDirectorySync sync) {
        this(sync, 200);
    }

    public SkillDirectoryWatcher(SkillDirectorySync sync, long debounceMillis) {
        this.sync = sync;
        this.debounceMillis = debounceMillis;
    }

    public synchronized void start() throws IOException {
        if (running) return;
        Files.createDirectories(sync.dir());
        watchService = FileSystems.getDefault().newWatchService();
        registerTree(sync.dir());
        running = true;
        thread = new Thread(this::loop, "skill-watcher");
        thread.setDaemon(true);
        thread.start();
        log.info("Watching skills directory {}", sync.dir());
    }

    private void registerTree(Path root) throws IOException {
        try (var dirs = Files.walk(root)) {
            for (var dir : dirs.filter(Files::isDirectory).toList()) {
                dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
            }
        }
    }

    private void loop() {
        while (running) {
            try {
                var key = watchService.take();
                boolean newDirs = drain(key);
                Thread.sleep(debounceMillis);
                WatchKey more;
                while ((more = watchService.poll(0, TimeUnit.MILLISECONDS)) != null) {
                    newDirs |= drain(more);
                }
                if (newDirs) registerTree(sync.dir());
                int found = sync.resync();
                log.debug("Skills directory changed, {} skills on disk", found);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            } catch (IOException | RuntimeException e) {
                log.warn("Skill directory sync failed: {}", e.getMessage());
            }
        }
    }

    /** @return true when a directory was created and needs registering */
    private boolean drain(WatchKey key) {
        boolean newDirs = false;
        var parent = (Path) key.watchable();
        for (var event : key.pollEvents()) {
            if (event.kind() == OVERFLOW) continue;
            if (event.kind() == ENTRY_CREATE && Files.isDirectory(parent.resolve((Path) event.context()))) {
                newDirs = true;
            }
        }
        key.reset();
        return newDirs;
    }

    @Override
    public synchronized void close() {
        running = false;
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Failed to close skill watcher: {}", e.getMessage());
            }
        }
        if (thread != null) thread.interrupt();
    }
}
