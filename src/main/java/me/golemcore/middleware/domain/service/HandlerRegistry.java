package me.golemcore.middleware.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.middleware.domain.component.ActionHandler;
import me.golemcore.middleware.domain.component.HandlerComponent;
import me.golemcore.middleware.domain.exception.DuplicateHandlerException;
import me.golemcore.middleware.domain.model.ActionKind;
import me.golemcore.middleware.domain.model.HandlerRecord;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Name to handler lookup, split into the tool and capability namespaces.
 *
 * <p>
 * Registration rejects duplicates rather than replacing them. Lookups are
 * lock-free and safe to run concurrently with each other and with late
 * registration.
 */
@Component
@Slf4j
public class HandlerRegistry {

    // Identifier class accepted by ActionParser
    private static final Pattern NAME_PATTERN = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private final Map<ActionKind, Map<String, HandlerRecord>> namespaces = new EnumMap<>(ActionKind.class);

    public HandlerRegistry(List<HandlerComponent> handlerComponents) {
        for (ActionKind kind : ActionKind.values()) {
            namespaces.put(kind, new ConcurrentHashMap<>());
        }
        registerComponents(handlerComponents);
    }

    /**
     * Registers a handler.
     *
     * @throws DuplicateHandlerException
     *             if {@code name} is already registered under {@code kind}
     * @throws IllegalArgumentException
     *             if the name is not a word-character identifier or the handler
     *             is {@code null}
     */
    public HandlerRecord register(ActionKind kind, String name, ActionHandler handler) {
        if (kind == null) {
            throw new IllegalArgumentException("Handler kind must not be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Handler name must not be blank");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException(
                    "Handler name must consist of letters, digits or underscores: " + name);
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler must not be null: " + name);
        }

        HandlerRecord entry = new HandlerRecord(kind, name, handler);
        HandlerRecord existing = namespaces.get(kind).putIfAbsent(name, entry);
        if (existing != null) {
            log.warn("[Handlers] Rejected duplicate {} registration: {}", kind.getKeyword(), name);
            throw new DuplicateHandlerException(kind, name);
        }
        log.debug("[Handlers] Registered {}: {}", kind.getKeyword(), name);
        return entry;
    }

    /**
     * Removes a handler.
     *
     * @return {@code true} if a handler was registered under the name
     */
    public boolean unregister(ActionKind kind, String name) {
        if (kind == null || name == null) {
            return false;
        }
        boolean removed = namespaces.get(kind).remove(name) != null;
        if (removed) {
            log.debug("[Handlers] Unregistered {}: {}", kind.getKeyword(), name);
        }
        return removed;
    }

    public Optional<HandlerRecord> resolve(ActionKind kind, String name) {
        if (kind == null || name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(namespaces.get(kind).get(name));
    }

    /**
     * Returns the registered names of one namespace, sorted.
     */
    public List<String> listNames(ActionKind kind) {
        return namespaces.get(kind).keySet().stream()
                .sorted()
                .toList();
    }

    private void registerComponents(List<HandlerComponent> handlerComponents) {
        if (handlerComponents == null) {
            return;
        }
        for (HandlerComponent component : handlerComponents) {
            if (!component.isEnabled()) {
                log.debug("[Handlers] Skipping disabled {}: {}", component.getKind().getKeyword(),
                        component.getName());
                continue;
            }
            register(component.getKind(), component.getName(), component);
        }
        log.info("[Handlers] Registered {} tools and {} capabilities",
                namespaces.get(ActionKind.TOOL).size(), namespaces.get(ActionKind.CAPABILITY).size());
    }
}
