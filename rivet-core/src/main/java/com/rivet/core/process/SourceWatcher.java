package com.rivet.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Watches source directories recursively for changes, for {@code serve --reload}.
 */
public class SourceWatcher implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(SourceWatcher.class);
    private static final Duration SETTLE_TIME = Duration.ofMillis(300);

    private final WatchService watchService;

    public SourceWatcher(List<Path> roots) throws IOException {
        this.watchService = FileSystems.getDefault().newWatchService();
        for (Path root : roots) {
            if (Files.isDirectory(root)) {
                registerTree(root);
            }
        }
    }

    /**
     * Waits for the next change under the watched roots.
     *
     * <p>Bursts of events (an editor writing several files) are collapsed into one change.
     *
     * @param timeout how long to wait
     * @return true if something changed, false on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitChange(Duration timeout) throws InterruptedException {
        WatchKey key = watchService.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (key == null) {
            return false;
        }
        while (key != null) {
            handle(key);
            key = watchService.poll(SETTLE_TIME.toMillis(), TimeUnit.MILLISECONDS);
        }
        return true;
    }

    @Override
    public void close() throws IOException {
        watchService.close();
    }

    private void handle(WatchKey key) {
        Path directory = (Path) key.watchable();
        for (WatchEvent<?> event : key.pollEvents()) {
            if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE) {
                Path created = directory.resolve((Path) event.context());
                if (Files.isDirectory(created)) {
                    try {
                        registerTree(created);
                    } catch (IOException e) {
                        log.warn("Cannot watch new directory {}: {}", created, e.getMessage());
                    }
                }
            }
            log.debug("Change detected: {} {}", event.kind().name(), event.context());
        }
        key.reset();
    }

    private void registerTree(Path root) throws IOException {
        try (Stream<Path> directories = Files.walk(root)) {
            for (Path directory : (Iterable<Path>) directories.filter(Files::isDirectory)::iterator) {
                directory.register(watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_DELETE);
            }
        }
    }
}
