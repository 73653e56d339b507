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
 * Outcome of running one handler under a deadline. Exactly one of
 * {@code output} (for {@link Status#OK}) or {@code cause} (for
 * {@link Status#FAILED}) is meaningful.
 */
@Value
@Builder
public class HandlerExecutionResult {

    public enum Status {
        OK, TIMED_OUT, FAILED, CANCELLED
    }

    Status status;
    String output;
    Throwable cause;
    Duration elapsed;

    public static HandlerExecutionResult ok(String output, Duration elapsed) {
        return HandlerExecutionResult.builder()
                .status(Status.OK)
                .output(output)
                .elapsed(elapsed)
                .build();
    }

    public static HandlerExecutionResult timedOut(Duration elapsed) {
        return HandlerExecutionResult.builder()
                .status(Status.TIMED_OUT)
                .elapsed(elapsed)
                .build();
    }

    public static HandlerExecutionResult failed(Throwable cause, Duration elapsed) {
        return HandlerExecutionResult.builder()
                .status(Status.FAILED)
                .cause(cause)
                .elapsed(elapsed)
                .build();
    }

    public static HandlerExecutionResult cancelled(Duration elapsed) {
        return HandlerExecutionResult.builder()
                .status(Status.CANCELLED)
                .elapsed(elapsed)
                .build();
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
