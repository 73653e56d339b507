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

import me.golemcore.middleware.domain.model.ActionKind;

/**
 * Handler contributed as a Spring bean. Every bean of this type is registered
 * with the {@code HandlerRegistry} at startup under its kind and name.
 * Examples include {@code DateTimeTool}.
 */
public interface HandlerComponent extends ActionHandler {

    /**
     * Returns the namespace this handler is registered in.
     *
     * @return the handler kind
     */
    ActionKind getKind();

    /**
     * Returns the name used in {@code use tool: <name>} or
     * {@code use capability: <name>} commands.
     *
     * @return the handler name, unique within its kind
     */
    String getName();

    /**
     * Returns whether this handler should be registered. Disabled handlers are
     * skipped at startup.
     */
    default boolean isEnabled() {
        return true;
    }
}
