package me.golemcore.middleware.domain.component;

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

import java.util.Map;

/**
 * Invocable body of a tool or capability.
 *
 * <p>
 * Runs on a worker thread owned by the bounded executor. Implementations that
 * loop or block should honour thread interruption: once the deadline passes
 * the result is discarded and the worker is interrupted, but nothing forces a
 * non-cooperative handler to stop.
 */
@FunctionalInterface
public interface ActionHandler {

    /**
     * Invokes the handler.
     *
     * @param params
     *            parsed JSON parameters, never {@code null}
     * @return text result handed back to the caller
     * @throws Exception
     *             any failure; reported as a handler fault
     */
    String invoke(Map<String, Object> params) throws Exception; // NOSONAR - handlers may throw anything
}
