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

import me.golemcore.middleware.domain.model.EventQuery;
import me.golemcore.middleware.domain.model.LogEntry;
import me.golemcore.middleware.infrastructure.config.MiddlewareProperties;
import me.golemcore.middleware.port.outbound.EventStoragePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded in-memory event storage. The oldest entries are evicted once
 * {@code middleware.events.memory-capacity} is reached.
 *
 * <p>
 * Selected with {@code middleware.events.backend=memory}.
 */
@Component
@ConditionalOnProperty(prefix = "middleware.events", name = "backend", havingValue = "memory")
public class InMemoryEventStorageAdapter implements EventStoragePort {

    private final int capacity;
    private final Deque<LogEntry> entries = new ArrayDeque<>();

    public InMemoryEventStorageAdapter(MiddlewareProperties properties) {
        this.capacity = Math.max(1, properties.getEvents().getMemoryCapacity());
    }

    @Override
    public String getBackendId() {
        return "memory";
    }

    @Override
    public synchronized void append(LogEntry entry) {
        if (entries.size() >= capacity) {
            entries.removeFirst();
        }
        entries.addLast(entry);
    }

    @Override
    public synchronized List<LogEntry> query(EventQuery query, int limit) {
        List<LogEntry> result = new ArrayList<>();
        Iterator<LogEntry> newestFirst = entries.descendingIterator();
        while (newestFirst.hasNext() && result.size() < limit) {
            LogEntry entry = newestFirst.next();
            if (query.matches(entry)) {
                result.add(entry);
            }
        }
        return result;
    }

    public synchronized int size() {
        return entries.size();
    }
}
