package io.paramsetconfig.core.error;

/** Thrown when serialized change-log entries do not have the expected shape. */
public final class ChangeLogLoadException extends PersistedStateException {

    private static final long serialVersionUID = 1L;

    public ChangeLogLoadException(String message) {
        super(message, null);
    }

    public ChangeLogLoadException(String message, Throwable cause) {
        super(message, cause, null);
    }
}
