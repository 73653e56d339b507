package me.golemcore.middleware.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the middleware, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code middleware.*} prefix:
 * <ul>
 * <li>{@link DispatchProperties} - deadlines and the handler worker pool</li>
 * <li>{@link EventsProperties} - event log backend and write queue</li>
 * <li>{@link StorageProperties} - local workspace location</li>
 * <li>{@link ToolsProperties} - built-in tool enablement</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "middleware")
@Data
public class MiddlewareProperties {

    /**
     * Agent name recorded on events when the caller does not supply one.
     */
    private String agentName = "middleware";

    private DispatchProperties dispatch = new DispatchProperties();
    private EventsProperties events = new EventsProperties();
    private StorageProperties storage = new StorageProperties();
    private ToolsProperties tools = new ToolsProperties();

    @Data
    public static class DispatchProperties {
        private Duration defaultTimeout = Duration.ofSeconds(10);
        /**
         * Worker threads for handler invocations; {@code 0} means an unbounded
         * cached pool.
         */
        private int workerThreads = 0;
    }

    @Data
    public static class EventsProperties {
        /**
         * Storage backend: {@code jsonl} or {@code memory}.
         */
        private String backend = "jsonl";
        private String directory = "events";
        private int queueCapacity = 10_000;
        /**
         * How long {@code record} waits for queue space before an entry is
         * spilled to the application log.
         */
        private Duration enqueueTimeout = Duration.ofMillis(100);
        private int memoryCapacity = 10_000;
        private Duration shutdownFlushTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/middleware";
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private DateTimeToolProperties datetime = new DateTimeToolProperties();
    }

    @Data
    public static class DateTimeToolProperties {
        private boolean enabled = true;
    }
}
