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

/**
 * Machine-readable classification of routing faults.
 *
 * <p>
 * Only the first five can appear on a {@link DispatchOutcome}. The last two
 * surface as exceptions at their own boundaries (registration and storage) and
 * never reach the caller of a dispatch.
 */
public enum FaultKind {

    /**
     * Input carried a recognized action prefix but the rest was malformed.
     */
    PARSE_FAULT,

    /**
     * No handler registered under the requested name.
     */
    NOT_FOUND,

    /**
     * Handler did not produce a result before the deadline. Its own state is
     * unknown.
     */
    TIMED_OUT,

    /**
     * Handler (or the conversational fallback) threw during execution.
     */
    HANDLER_FAULT,

    /**
     * Dispatch was cancelled through its cancellation token.
     */
    CANCELLED,

    DUPLICATE_HANDLER,

    STORAGE_UNAVAILABLE
}
