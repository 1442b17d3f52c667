package io.paramsetconfig.core.error;

/**
 * Thrown when a profile catalog is malformed: unreadable document, schema violation, reserved or
 * duplicate profile id, a list default outside its values, or a range with {@code min > max}.
 * Always raised at load time, never while matching.
 */
public final class CatalogLoadException extends ParamConfigException {

    private static final long serialVersionUID = 1L;

    public CatalogLoadException(String message, String source) {
        super(message, source, Kind.STRUCTURAL);
    }

    public CatalogLoadException(String message, Throwable cause, String source) {
        super(message, cause, source, Kind.STRUCTURAL);
    }
}
