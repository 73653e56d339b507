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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of parsing agent input: an {@link Action}, plain conversational input,
 * or a parse fault for input that looked like an action but was malformed.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ParseResult {

    private static final ParseResult NONE = new ParseResult(Type.NONE, null, null, null);

    public enum Type {
        ACTION, NONE, FAULT
    }

    private final Type type;
    private final Action action;
    private final ActionKind attemptedKind;
    private final String faultReason;

    public static ParseResult action(Action action) {
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        return new ParseResult(Type.ACTION, action, action.kind(), null);
    }

    public static ParseResult none() {
        return NONE;
    }

    /**
     * Creates a fault result for input whose prefix matched {@code kind} but whose
     * remainder could not be parsed.
     */
    public static ParseResult fault(ActionKind kind, String reason) {
        return new ParseResult(Type.FAULT, null, kind, reason);
    }

    public boolean isAction() {
        return type == Type.ACTION;
    }

    public boolean isFault() {
        return type == Type.FAULT;
    }
}
