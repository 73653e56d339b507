package me.golemcore.middleware.adapter.outbound.storage;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.middleware.infrastructure.config.MiddlewareProperties;
import me.golemcore.middleware.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Stores data in a local workspace directory; the event log keeps its JSONL
 * files under {@code events/}.
 *
 * <p>
 * Base path configured via {@code middleware.storage.local.base-path},
 * defaults to {@code ${user.home}/.golemcore/middleware}.
 *
 * @see me.golemcore.middleware.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private final MiddlewareProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath);
            log.info("Local storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("Failed to create storage directory", e);
        }
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path filePath = resolvePath(directory, path);
                if (!Files.exists(filePath)) {
                    return null;
                }
                return Files.readString(filePath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path dirPath = resolveDirectory(directory);
                if (!Files.exists(dirPath)) {
                    return Collections.emptyList();
                }

                Path prefixPath = prefix != null && !prefix.isEmpty()
                        ? dirPath.resolve(prefix)
                        : dirPath;

                if (!Files.exists(prefixPath)) {
                    return Collections.emptyList();
                }

                try (Stream<Path> paths = Files.walk(prefixPath)) {
                    return paths
                            .filter(Files::isRegularFile)
                            .map(p -> dirPath.relativize(p).toString())
                            .toList();
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list files: " + directory + "/" + prefix, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            try {
                Path filePath = resolvePath(directory, path);
                Path parent = filePath.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(filePath, content,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append to file: " + directory + "/" + path, e);
            }
        });
    }

    private Path resolveDirectory(String directory) {
        Path dirPath = basePath.resolve(directory).normalize();
        if (!dirPath.startsWith(basePath)) {
            throw new IllegalArgumentException("Directory escapes storage root: " + directory);
        }
        return dirPath;
    }

    private Path resolvePath(String directory, String path) {
        Path dirPath = resolveDirectory(directory);
        Path filePath = dirPath.resolve(path).normalize();
        if (!filePath.startsWith(dirPath)) {
            throw new IllegalArgumentException("Path escapes storage directory: " + directory + "/" + path);
        }
        return filePath;
    }
}
