package me.golemcore.middleware.domain.model;

/**
 * Which handler produced the result of a dispatch.
 */
public enum DispatchSource {
    TOOL, CAPABILITY, FALLBACK
}
