package io.paramsetconfig.core.session;

import java.util.Objects;

/**
 * One recorded edit. Undo restores {@code oldValue}, redo re-applies
 * {@code newValue}.
 *
 * @param parameter the edited parameter
 * @param oldValue  value before the edit, {@code null} if the parameter was
 *                  absent
 * @param newValue  value after the edit
 */
public record UndoEntry(String parameter, Object oldValue, Object newValue) {

    public UndoEntry {
        Objects.requireNonNull(parameter, "parameter must not be null");
    }
}
