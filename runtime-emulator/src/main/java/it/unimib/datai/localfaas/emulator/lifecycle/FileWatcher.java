package it.unimib.datai.localfaas.emulator.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Watches the code directories and asks for a worker restart once a burst of changes settles.
 */
public final class FileWatcher implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(FileWatcher.class);
    public static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(500);
    private static final long POLL_MS = 100;

    private final List<Path> roots;
    private final RestartRequests restarts;
    private final Duration debounce;
    private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();

    private WatchService watchService;
    private Thread thread;
    private volatile boolean running;

    public FileWatcher(List<Path> roots, RestartRequests restarts, Duration debounce) {
        this.roots = List.copyOf(roots);
        this.restarts = restarts;
        this.debounce = debounce;
    }

    public void start() throws IOException {
        watchService = FileSystems.getDefault().newWatchService();
        for (Path root : roots) {
            if (Files.isDirectory(root)) {
                registerTree(root);
            } else {
                log.debug("Not watching {}: not a directory", root);
            }
        }
        running = true;
        thread = new Thread(this::loop, "localfaas-file-watcher");
        thread.setDaemon(true);
        thread.start();
        log.info("Watching {} director(ies) under {} for changes", keys.size(), roots);
    }

    private void registerTree(Path root) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                WatchKey key = dir.register(watchService, StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_DELETE);
                keys.put(key, dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.debug("Skipping {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void loop() {
        long lastChangeNanos = 0;
        boolean pending = false;
        while (running) {
            WatchKey key;
            try {
                key = watchService.poll(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            if (key != null) {
                if (handle(key)) {
                    pending = true;
                    lastChangeNanos = System.nanoTime();
                }
            }
            if (pending && System.nanoTime() - lastChangeNanos >= debounce.toNanos()) {
                pending = false;
                log.info("Code change detected, requesting worker restart");
                restarts.request(RestartReason.FILE_CHANGE);
            }
        }
    }

    private boolean handle(WatchKey key) {
        Path dir = keys.get(key);
        boolean changed = false;
        for (WatchEvent<?> event : key.pollEvents()) {
            if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                changed = true;
                continue;
            }
            changed = true;
            Path child = dir == null ? null : dir.resolve((Path) event.context());
            log.debug("{} {}", event.kind().name(), child);
            if (child != null && event.kind() == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(child)) {
                try {
                    registerTree(child);
                } catch (IOException e) {
                    log.warn("Cannot watch new directory {}: {}", child, e.getMessage());
                }
            }
        }
        if (!key.reset()) {
            keys.remove(key);
        }
        return changed;
    }

    @Override
    public void close() throws IOException {
        running = false;
        if (watchService != null) {
            watchService.close();
        }
        if (thread != null) {
            thread.interrupt();
        }
    }
}
