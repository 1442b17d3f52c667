package io.paramsetconfig.core.model;

/**
 * Old/new pair for one parameter within a change diff.
 *
 * @param oldValue previous value, or {@code null} if the parameter was absent
 * @param newValue new value
 */
public record ValueChange(Object oldValue, Object newValue) {}
