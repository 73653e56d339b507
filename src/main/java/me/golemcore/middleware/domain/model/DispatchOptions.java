package me.golemcore.middleware.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-call overrides for a dispatch. Unset values fall back to
 * {@code middleware.*} configuration.
 */
@Value
@Builder
public class DispatchOptions {

    /**
     * Deadline for the handler invocation; {@code null} uses the configured
     * default.
     */
    Duration timeout;

    /**
     * Agent name recorded on log entries; {@code null} uses the configured name.
     */
    String agentName;

    @Builder.Default
    CancellationToken cancellationToken = CancellationToken.none();

    public static DispatchOptions defaults() {
        return DispatchOptions.builder().build();
    }
}
