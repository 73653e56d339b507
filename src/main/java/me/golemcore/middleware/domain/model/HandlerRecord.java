package me.golemcore.middleware.domain.model;

import me.golemcore.middleware.domain.component.ActionHandler;

/** Registry entry: a handler bound to a name within one namespace. */
public record HandlerRecord(ActionKind kind, String name, ActionHandler handler) {
}
