package io.paramsetconfig.core.config;

/**
 * Thrown when settings loading fails: missing file, invalid YAML or a value
 * of the wrong type. The message is suitable for startup error output.
 */
public class SettingsLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SettingsLoadException(String message) {
        super(message);
    }

    public SettingsLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
