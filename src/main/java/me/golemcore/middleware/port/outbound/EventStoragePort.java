package me.golemcore.middleware.port.outbound;

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

import java.util.List;

/**
 * Port for the backend that stores routing events. The contract is
 * deliberately minimal: append one entry, query by filter.
 */
public interface EventStoragePort {

    /**
     * Appends an entry. Ownership of the entry passes to the backend.
     *
     * @param entry
     *            entry to store
     * @throws me.golemcore.middleware.domain.exception.StorageUnavailableException
     *             if the backend cannot accept the entry
     */
    void append(LogEntry entry);

    /**
     * Returns matching entries, newest first.
     *
     * @param query
     *            conjunctive filter
     * @param limit
     *            maximum number of entries, positive
     * @return at most {@code limit} entries
     * @throws me.golemcore.middleware.domain.exception.StorageUnavailableException
     *             if the backend cannot be read
     */
    List<LogEntry> query(EventQuery query, int limit);

    /**
     * Short backend identifier for diagnostics.
     */
    String getBackendId();
}
