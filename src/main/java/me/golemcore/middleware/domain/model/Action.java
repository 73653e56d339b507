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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured request to invoke a named tool or capability, extracted from free
 * text by the action parser.
 *
 * <p>
 * Parameters are an unmodifiable copy of the parsed JSON object. Values are
 * plain JSON types (String, Number, Boolean, null, List, Map).
 */
public record Action(ActionKind kind, String name, Map<String, Object> params) {

    public Action {
        Objects.requireNonNull(kind, "kind must not be null");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Action name must not be blank");
        }
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
}
