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

import java.time.Duration;
import java.util.Optional;

/**
 * Result of a single dispatch. Owned by the caller; the dispatcher keeps no
 * reference to it.
 *
 * @param result
 *            text returned to the caller (handler output, fallback response or
 *            an error message)
 * @param source
 *            handler namespace that produced the result
 * @param elapsed
 *            wall-clock time spent in the handler or fallback
 * @param fault
 *            fault classification, {@code null} on success
 */
public record DispatchOutcome(String result, DispatchSource source, Duration elapsed, FaultKind fault) {

    public static DispatchOutcome success(String result, DispatchSource source, Duration elapsed) {
        return new DispatchOutcome(result, source, elapsed, null);
    }

    public static DispatchOutcome failure(String result, DispatchSource source, Duration elapsed, FaultKind fault) {
        return new DispatchOutcome(result, source, elapsed, fault);
    }

    public Optional<FaultKind> faultKind() {
        return Optional.ofNullable(fault);
    }

    public boolean isSuccess() {
        return fault == null;
    }
}
