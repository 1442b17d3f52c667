package io.paramsetconfig.core.error;

/**
 * Abstract base for all paramset-config exceptions. Never thrown directly; use the concrete
 * subclasses {@link CatalogLoadException} or those under {@link PersistedStateException}.
 *
 * <p>Validation failures of parameter values are not exceptions. Sessions return them as a
 * collecting result keyed by parameter id.
 */
public abstract class ParamConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Category of the failure. */
    public enum Kind {
        /** Malformed static definition data, detected at load time. */
        STRUCTURAL,
        /** Stale, foreign or malformed persisted state handed back by a caller. */
        PERSISTED_STATE
    }

    private final String source;
    private final Kind kind;

    protected ParamConfigException(String message, String source, Kind kind) {
        super(message);
        this.source = source;
        this.kind = kind;
    }

    protected ParamConfigException(String message, Throwable cause, String source, Kind kind) {
        super(message, cause);
        this.source = source;
        this.kind = kind;
    }

    /** The file path or resource identifier that caused the error, or {@code null} if unknown. */
    public String source() {
        return source;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The failure category. */
    public Kind kind() {
        return kind;
    }
}
