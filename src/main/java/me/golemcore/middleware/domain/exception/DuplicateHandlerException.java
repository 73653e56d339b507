package me.golemcore.middleware.domain.exception;

import lombok.Getter;
import me.golemcore.middleware.domain.model.ActionKind;
import me.golemcore.middleware.domain.model.FaultKind;

/**
 * Thrown when a handler is registered under a (kind, name) pair that is already
 * taken. The existing registration is left in place.
 */
@Getter
public class DuplicateHandlerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ActionKind kind;
    private final String handlerName;

    public DuplicateHandlerException(ActionKind kind, String handlerName) {
        super(kind.getDisplayName() + " '" + handlerName + "' is already registered");
        this.kind = kind;
        this.handlerName = handlerName;
    }

    public FaultKind getFaultKind() {
        return FaultKind.DUPLICATE_HANDLER;
    }
}
