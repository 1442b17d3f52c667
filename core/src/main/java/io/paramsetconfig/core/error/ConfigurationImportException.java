package io.paramsetconfig.core.error;

/** Thrown when an exported configuration document is not JSON, has an unsupported version, or is incomplete. */
public final class ConfigurationImportException extends PersistedStateException {

    private static final long serialVersionUID = 1L;

    public ConfigurationImportException(String message) {
        super(message, null);
    }

    public ConfigurationImportException(String message, Throwable cause) {
        super(message, cause, null);
    }
}
