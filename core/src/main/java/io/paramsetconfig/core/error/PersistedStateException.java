package io.paramsetconfig.core.error;

/**
 * Abstract parent for errors raised while restoring state a caller persisted earlier. A version or
 * shape mismatch is surfaced here instead of being coerced silently.
 */
public abstract class PersistedStateException extends ParamConfigException {

    private static final long serialVersionUID = 1L;

    protected PersistedStateException(String message, String source) {
        super(message, source, Kind.PERSISTED_STATE);
    }

    protected PersistedStateException(String message, Throwable cause, String source) {
        super(message, cause, source, Kind.PERSISTED_STATE);
    }
}
