package me.golemcore.middleware.domain.service;

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
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.middleware.domain.exception.StorageUnavailableException;
import me.golemcore.middleware.domain.model.EventQuery;
import me.golemcore.middleware.domain.model.LogEntry;
import me.golemcore.middleware.infrastructure.config.MiddlewareProperties;
import me.golemcore.middleware.port.outbound.EventStoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Records routing events and serves filtered queries over them.
 *
 * <p>
 * Features:
 * <ul>
 * <li>{@link #record} never throws and never waits on storage: entries are
 * handed to a single writer thread. When the write queue is full it waits up to
 * {@code middleware.events.enqueue-timeout} for space</li>
 * <li>Entries reach the backend in the order they were recorded, so entries
 * of one agent are observed in recording order</li>
 * <li>If the backend is unavailable, or the queue is still full after the
 * enqueue timeout, the entry is written to the application log instead. Such
 * an entry never reaches the backend and is not returned by {@link #query}</li>
 * <li>{@link #query} waits for pending writes first, so a caller sees its own
 * events</li>
 * </ul>
 *
 * <p>
 * Constructed once per application context and injected where needed; there is
 * no static access.
 */
@Service
@Slf4j
public class EventLogService {

    private static final String LOG_PREFIX = "[Events]";
    private static final Duration QUERY_FLUSH_TIMEOUT = Duration.ofSeconds(5);

    private final EventStoragePort storage;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Duration shutdownFlushTimeout;
    private final Duration enqueueTimeout;
    private final ThreadPoolExecutor writer;

    public EventLogService(EventStoragePort storage, Clock clock, ObjectMapper objectMapper,
            MiddlewareProperties properties) {
        this.storage = storage;
        this.clock = clock;
        this.objectMapper = objectMapper;
        MiddlewareProperties.EventsProperties events = properties.getEvents();
        this.shutdownFlushTimeout = events.getShutdownFlushTimeout();
        this.enqueueTimeout = events.getEnqueueTimeout() != null ? events.getEnqueueTimeout() : Duration.ZERO;
        this.writer = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(Math.max(1, events.getQueueCapacity())), r -> {
                    Thread t = new Thread(r, "event-log-writer");
                    t.setDaemon(true);
                    return t;
                });
        log.info("{} Event log backend: {}", LOG_PREFIX, storage.getBackendId());
    }

    @PreDestroy
    void destroy() {
        if (!flush(shutdownFlushTimeout)) {
            log.warn("{} Pending events not written within {} ms", LOG_PREFIX, shutdownFlushTimeout.toMillis());
        }
        writer.shutdown();
    }

    /**
     * Records an event. Always returns normally.
     *
     * <p>
     * Blocks for at most the enqueue timeout when the write queue is full. An
     * entry that still finds no space is logged at WARN and is lost to queries.
     */
    public void record(String activityType, String agentName, Map<String, Object> details,
            Map<String, Object> metadata) {
        LogEntry entry;
        try {
            entry = LogEntry.builder()
                    .timestamp(Instant.now(clock))
                    .activityType(activityType)
                    .agentName(agentName)
                    .details(details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>())
                    .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                    .build();
        } catch (RuntimeException e) {
            log.warn("{} Failed to build event {}: {}", LOG_PREFIX, activityType, e.getMessage());
            return;
        }

        Runnable task = () -> write(entry);
        try {
            writer.execute(task);
        } catch (RejectedExecutionException e) {
            if (!enqueueWithTimeout(task)) {
                writeToFallbackSink(entry, "write queue full or closed");
            }
        }
    }

    private boolean enqueueWithTimeout(Runnable task) {
        if (writer.isShutdown() || enqueueTimeout.isZero() || enqueueTimeout.isNegative()) {
            return false;
        }
        try {
            return writer.getQueue().offer(task, enqueueTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Returns entries matching {@code query}, newest first, at most
     * {@code limit}.
     *
     * @throws StorageUnavailableException
     *             if the backend cannot be read
     */
    public List<LogEntry> query(EventQuery query, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        if (!flush(QUERY_FLUSH_TIMEOUT)) {
            log.debug("{} Querying before all pending events were written", LOG_PREFIX);
        }
        EventQuery safeQuery = query != null ? query : EventQuery.any();
        List<LogEntry> entries = storage.query(safeQuery, limit);
        return entries.size() > limit ? entries.subList(0, limit) : entries;
    }

    /**
     * Waits until every event recorded before this call has been handed to the
     * backend (or to the fallback sink).
     *
     * @return {@code false} if the timeout elapsed first
     */
    public boolean flush(Duration timeout) {
        Future<?> barrier;
        try {
            barrier = writer.submit(() -> {
            });
        } catch (RejectedExecutionException e) {
            return writer.getQueue().isEmpty();
        }
        try {
            barrier.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void write(LogEntry entry) {
        try {
            storage.append(entry);
        } catch (StorageUnavailableException e) {
            writeToFallbackSink(entry, e.getMessage());
        } catch (RuntimeException e) { // NOSONAR - event logging must never fail the caller
            writeToFallbackSink(entry, e.toString());
        }
    }

    private void writeToFallbackSink(LogEntry entry, String reason) {
        log.warn("{} Storage unavailable ({}), fallback entry: {}", LOG_PREFIX, reason, toJson(entry));
    }

    private String toJson(LogEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            return entry.toString();
        }
    }
}
