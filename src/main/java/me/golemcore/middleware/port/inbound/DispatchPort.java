package me.golemcore.middleware.port.inbound;

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

import me.golemcore.middleware.domain.model.DispatchOptions;
import me.golemcore.middleware.domain.model.DispatchOutcome;

/**
 * Port for routing agent input. Input of the form
 * {@code use tool: <name> {json}} or {@code use capability: <name> {json}}
 * invokes a registered handler; anything else goes to the conversational
 * fallback.
 */
public interface DispatchPort {

    /**
     * Dispatches input with configured defaults.
     */
    default DispatchOutcome dispatch(String input) {
        return dispatch(input, DispatchOptions.defaults());
    }

    /**
     * Dispatches input. Never throws: every fault is reported on the returned
     * outcome.
     *
     * @param input
     *            raw agent input
     * @param options
     *            per-call deadline, agent name and cancellation token
     * @return the dispatch outcome
     */
    DispatchOutcome dispatch(String input, DispatchOptions options);
}
