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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.middleware.domain.exception.StorageUnavailableException;
import me.golemcore.middleware.domain.model.EventQuery;
import me.golemcore.middleware.domain.model.LogEntry;
import me.golemcore.middleware.infrastructure.config.MiddlewareProperties;
import me.golemcore.middleware.port.outbound.EventStoragePort;
import me.golemcore.middleware.port.outbound.StoragePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Event storage backed by daily JSONL files in the local workspace.
 *
 * <p>
 * Each entry is one line in {@code <events-dir>/<yyyy-MM-dd>.jsonl}, dated by
 * the entry's UTC timestamp. Queries scan files newest first and stop once the
 * limit is reached. Malformed lines are skipped.
 *
 * <p>
 * Selected with {@code middleware.events.backend=jsonl} (the default).
 */
@Component
@ConditionalOnProperty(prefix = "middleware.events", name = "backend", havingValue = "jsonl", matchIfMissing = true)
@Slf4j
public class JsonlEventStorageAdapter implements EventStoragePort {

    private static final String LOG_PREFIX = "[Events]";
    private static final String JSONL_EXTENSION = ".jsonl";
    private static final String NEWLINE = "\n";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String directory;

    public JsonlEventStorageAdapter(StoragePort storagePort, ObjectMapper objectMapper,
            MiddlewareProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.directory = properties.getEvents().getDirectory();
    }

    @Override
    public String getBackendId() {
        return "jsonl";
    }

    @Override
    public void append(LogEntry entry) {
        String line;
        try {
            line = objectMapper.writeValueAsString(entry) + NEWLINE;
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException("Event is not serializable: " + e.getOriginalMessage(), e);
        }

        try {
            storagePort.appendText(directory, fileNameFor(entry.getTimestamp()), line).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StorageUnavailableException("Failed to append event: " + cause.getMessage(), cause);
        }
    }

    @Override
    public List<LogEntry> query(EventQuery query, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        List<String> files = listEventFiles();
        List<LogEntry> result = new ArrayList<>();
        for (String file : files) {
            List<LogEntry> entries = readFile(file);
            for (int i = entries.size() - 1; i >= 0 && result.size() < limit; i--) {
                LogEntry entry = entries.get(i);
                if (query.matches(entry)) {
                    result.add(entry);
                }
            }
            if (result.size() >= limit) {
                break;
            }
        }
        return result;
    }

    private List<String> listEventFiles() {
        try {
            List<String> files = storagePort.listObjects(directory, "").join();
            if (files == null) {
                return List.of();
            }
            return files.stream()
                    .filter(f -> f.endsWith(JSONL_EXTENSION))
                    .sorted(Comparator.reverseOrder())
                    .toList();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StorageUnavailableException("Failed to list event files: " + cause.getMessage(), cause);
        }
    }

    private List<LogEntry> readFile(String file) {
        String content;
        try {
            content = storagePort.getText(directory, file).join();
        } catch (CompletionException e) {
            log.warn("{} Failed to read file {}: {}", LOG_PREFIX, file, e.getMessage());
            return List.of();
        }
        if (content == null || content.isBlank()) {
            return List.of();
        }

        List<LogEntry> entries = new ArrayList<>();
        for (String line : content.split(NEWLINE)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, LogEntry.class));
            } catch (JsonProcessingException e) {
                log.debug("{} Skipping malformed line in {}: {}", LOG_PREFIX, file, e.getMessage());
            }
        }
        return entries;
    }

    private static String fileNameFor(Instant timestamp) {
        Instant safeTimestamp = timestamp != null ? timestamp : Instant.now();
        return LocalDate.ofInstant(safeTimestamp, ZoneOffset.UTC) + JSONL_EXTENSION;
    }
}
