package me.golemcore.gaplens.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.gaplens.infrastructure.config.GapLensProperties;
import me.golemcore.gaplens.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Stores all data in a local workspace directory:
 * <ul>
 * <li>sessions/ - one JSON record per workflow session
 * <li>long-term/ - long-term knowledge, one file per category/key
 * <li>traces/ - append-only JSONL audit trail
 * </ul>
 *
 * <p>
 * Base path configured via {@code gaplens.storage.base-path}, defaults to
 * {@code ${user.home}/.gaplens/workspace}. Every path is resolved against the
 * base path and rejected if it would escape it.
 *
 * <p>
 * File I/O runs on a dedicated pool, never on the common fork-join pool that
 * other work in the JVM shares.
 *
 * @see me.golemcore.gaplens.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    static final List<String> TIER_DIRECTORIES = List.of("sessions", "long-term", "traces");

    private static final String TEMP_SUFFIX = ".tmp";

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private static final ExecutorService STORAGE_EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "gaplens-storage-" + THREAD_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final GapLensProperties properties;

    // Appends to the same file from different threads must not interleave.
    private final Map<Path, Object> appendLocks = new ConcurrentHashMap<>();

    private Path basePath;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getBasePath();
        this.basePath = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            for (String directory : TIER_DIRECTORIES) {
                Files.createDirectories(basePath.resolve(directory));
            }
            log.info("[Storage] Workspace ready at {}", basePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create workspace at " + basePath, e);
        }
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return async("read " + directory + "/" + path, () -> {
            Path file = resolvePath(directory, path);
            return Files.exists(file) ? Files.readString(file, StandardCharsets.UTF_8) : null;
        });
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return async("delete " + directory + "/" + path, () -> {
            Files.deleteIfExists(resolvePath(directory, path));
            return null;
        });
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        return async("list " + directory + "/" + prefix, () -> {
            Path root = resolvePath(directory, "");
            Path start = prefix == null || prefix.isEmpty() ? root : resolvePath(directory, prefix);
            if (!Files.exists(start)) {
                return List.of();
            }
            try (Stream<Path> files = Files.walk(start)) {
                return files.filter(Files::isRegularFile)
                        .filter(file -> !file.getFileName().toString().endsWith(TEMP_SUFFIX))
                        .map(file -> root.relativize(file).toString().replace('\\', '/'))
                        .sorted()
                        .toList();
            }
        });
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        return async("append to " + directory + "/" + path, () -> {
            Path file = resolvePath(directory, path);
            synchronized (appendLocks.computeIfAbsent(file, key -> new Object())) {
                createParent(file);
                Files.writeString(file, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
                        StandardOpenOption.APPEND);
            }
            return null;
        });
    }

    /**
     * Writes to a sibling temp file, forces it to disk and renames it over the
     * target.
     */
    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content) {
        return async("write " + directory + "/" + path, () -> {
            Path target = resolvePath(directory, path);
            // One temp file per write, never shared between concurrent writers.
            Path temp = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
            createParent(target);
            try {
                try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE_NEW,
                        StandardOpenOption.WRITE)) {
                    ByteBuffer buffer = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                    channel.force(true);
                }
                moveIntoPlace(temp, target);
            } catch (IOException e) {
                deleteQuietly(temp);
                throw e;
            }
            log.debug("[Storage] Atomic write completed: {}/{}", directory, path);
            return null;
        });
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic move not supported for {}, using regular move", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
            log.warn("[Storage] Failed to clean up temp file {}: {}", temp, cleanup.getMessage());
        }
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }

    private static <T> CompletableFuture<T> async(String operation, IoCall<T> call) {
        Supplier<T> task = () -> {
            try {
                return call.run();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to " + operation, e);
            }
        };
        return CompletableFuture.supplyAsync(task, STORAGE_EXECUTOR);
    }

    @FunctionalInterface
    private interface IoCall<T> {
        T run() throws IOException;
    }
}
