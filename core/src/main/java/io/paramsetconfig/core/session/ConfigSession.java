package io.paramsetconfig.core.session;

import io.paramsetconfig.core.diff.ChangeDiffs;
import io.paramsetconfig.core.model.ParameterDescriptor;
import io.paramsetconfig.core.model.ParameterValues;
import io.paramsetconfig.core.model.ValidationResult;
import io.paramsetconfig.core.model.ValueChange;
import io.paramsetconfig.core.spi.ParameterValidator;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the edits made to one paramset during an editing session.
 *
 * <p>
 * Holds the initial values (never mutated), the current values and two
 * history stacks. Every effective {@link #set} records an {@link UndoEntry}
 * and clears the redo stack: redo is only valid along the most recent forward
 * path. With unbounded history, replaying the undo stack's new values in order
 * onto the initial values reproduces the current values, and undoing until
 * {@link #undo} returns {@code false} restores the initial values. A bounded
 * history (see {@link #ConfigSession(Map, Map, ParameterValidator, int)})
 * gives up both: once the oldest entries are dropped, the earliest edits can
 * no longer be undone and the session may stay dirty.
 *
 * <p>
 * Parameters that are not part of the initial values are accepted by
 * {@link #set}; validation and diffing surface them. The session does not own
 * the parameter catalog, only the value state.
 *
 * <p>
 * Not thread-safe. One logical editing context uses a session at a time;
 * callers serialize concurrent access.
 */
public final class ConfigSession {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigSession.class);

    /** Reason reported for values whose parameter has no descriptor. */
    public static final String UNKNOWN_PARAMETER = "unknown parameter";

    /** Reason reported for changes to parameters the device will not accept writes for. */
    public static final String READ_ONLY_PARAMETER = "parameter is not writable";

    private final Map<String, ParameterDescriptor> descriptors;
    private final Map<String, Object> initialValues;
    private final ParameterValidator validator;
    private final int undoHistoryLimit;

    private Map<String, Object> currentValues;
    private final Deque<UndoEntry> undoStack = new ArrayDeque<>();
    private final Deque<UndoEntry> redoStack = new ArrayDeque<>();

    /**
     * Creates a session with unbounded undo history.
     *
     * @param descriptors   parameter descriptors keyed by parameter id
     * @param initialValues values read from the device; copied
     * @param validator     descriptor-driven value checks
     */
    public ConfigSession(
            Map<String, ParameterDescriptor> descriptors,
            Map<String, Object> initialValues,
            ParameterValidator validator) {
        this(descriptors, initialValues, validator, 0);
    }

    /**
     * Creates a session.
     *
     * @param descriptors      parameter descriptors keyed by parameter id
     * @param initialValues    values read from the device; copied
     * @param validator        descriptor-driven value checks
     * @param undoHistoryLimit maximum undo depth; {@code 0} means unbounded.
     *                         When exceeded the oldest entry is dropped and
     *                         can no longer be undone; use {@link #discard}
     *                         to return to the initial values.
     */
    public ConfigSession(
            Map<String, ParameterDescriptor> descriptors,
            Map<String, Object> initialValues,
            ParameterValidator validator,
            int undoHistoryLimit) {
        Objects.requireNonNull(descriptors, "descriptors must not be null");
        Objects.requireNonNull(initialValues, "initialValues must not be null");
        if (undoHistoryLimit < 0) {
            throw new IllegalArgumentException("undoHistoryLimit must not be negative: " + undoHistoryLimit);
        }
        this.descriptors = Collections.unmodifiableMap(new LinkedHashMap<>(descriptors));
        this.initialValues = Collections.unmodifiableMap(new LinkedHashMap<>(initialValues));
        this.currentValues = new LinkedHashMap<>(initialValues);
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.undoHistoryLimit = undoHistoryLimit;
    }

    // --- Editing ---

    /**
     * Sets a parameter value, recording the change for undo. A value equal to
     * the current one is a no-op and leaves both stacks untouched.
     *
     * @param parameter the parameter id
     * @param value     the new value
     */
    public void set(String parameter, Object value) {
        Objects.requireNonNull(parameter, "parameter must not be null");
        Object oldValue = currentValues.get(parameter);
        if (ParameterValues.valuesEqual(oldValue, value)) {
            return;
        }
        undoStack.addLast(new UndoEntry(parameter, oldValue, value));
        if (undoHistoryLimit > 0 && undoStack.size() > undoHistoryLimit) {
            undoStack.removeFirst();
        }
        redoStack.clear();
        currentValues.put(parameter, value);
        LOG.debug("session.set parameter={} undo_depth={}", parameter, undoStack.size());
    }

    /**
     * Undoes the most recent edit.
     *
     * @return {@code true} if an edit was undone, {@code false} if there was
     *         nothing to undo
     */
    public boolean undo() {
        UndoEntry entry = undoStack.pollLast();
        if (entry == null) {
            return false;
        }
        redoStack.addLast(entry);
        restore(entry.parameter(), entry.oldValue());
        LOG.debug("session.undo parameter={} undo_depth={}", entry.parameter(), undoStack.size());
        return true;
    }

    /**
     * Re-applies the most recently undone edit.
     *
     * @return {@code true} if an edit was redone, {@code false} if there was
     *         nothing to redo
     */
    public boolean redo() {
        UndoEntry entry = redoStack.pollLast();
        if (entry == null) {
            return false;
        }
        undoStack.addLast(entry);
        currentValues.put(entry.parameter(), entry.newValue());
        LOG.debug("session.redo parameter={} redo_depth={}", entry.parameter(), redoStack.size());
        return true;
    }

    /**
     * Sets every parameter that has a default in its descriptor and is present
     * in the current values back to that default. Each reset goes through
     * {@link #set} and can be undone.
     */
    public void resetToDefaults() {
        for (ParameterDescriptor descriptor : descriptors.values()) {
            Object defaultValue = descriptor.defaultValue();
            if (defaultValue != null && currentValues.containsKey(descriptor.id())) {
                set(descriptor.id(), defaultValue);
            }
        }
    }

    /**
     * Reverts to the initial values and clears both stacks. Irreversible.
     */
    public void discard() {
        currentValues = new LinkedHashMap<>(initialValues);
        undoStack.clear();
        redoStack.clear();
        LOG.debug("session.discard");
    }

    // --- State ---

    /** Whether any value differs from its initial value. */
    public boolean isDirty() {
        return !ParameterValues.mapsEqual(currentValues, initialValues);
    }

    /** Whether {@link #undo} would do anything. */
    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    /** Whether {@link #redo} would do anything. */
    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    /** Current undo depth. */
    public int undoDepth() {
        return undoStack.size();
    }

    /** Current redo depth. */
    public int redoDepth() {
        return redoStack.size();
    }

    /**
     * Current value of a parameter.
     *
     * @return the value, or {@code null} if absent
     */
    public Object getCurrentValue(String parameter) {
        return currentValues.get(parameter);
    }

    /** Unmodifiable snapshot of the current values. */
    public Map<String, Object> currentValues() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(currentValues));
    }

    /** The values the session started from. */
    public Map<String, Object> initialValues() {
        return initialValues;
    }

    /** The descriptors this session validates against. */
    public Map<String, ParameterDescriptor> descriptors() {
        return descriptors;
    }

    /** Unmodifiable copy of the undo stack, oldest first. */
    public List<UndoEntry> undoHistory() {
        return List.copyOf(undoStack);
    }

    // --- Changes ---

    /**
     * The parameters whose current value differs from the initial value, with
     * their current values. Suitable as a partial paramset write.
     */
    public Map<String, Object> getChanges() {
        Map<String, Object> changes = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : currentValues.entrySet()) {
            String parameter = entry.getKey();
            if (!initialValues.containsKey(parameter)
                    || !ParameterValues.valuesEqual(initialValues.get(parameter), entry.getValue())) {
                changes.put(parameter, entry.getValue());
            }
        }
        return changes;
    }

    /**
     * Detailed diff between initial and current values, restricted to
     * parameters with a descriptor. Old and new values are converted through
     * {@link ParameterValidator#coerce}; a change that vanishes after
     * conversion is dropped.
     */
    public Map<String, ValueChange> getChangedParameters() {
        Map<String, ValueChange> result = new LinkedHashMap<>();
        ChangeDiffs.buildChangeDiff(initialValues, currentValues).forEach((parameter, change) -> {
            ParameterDescriptor descriptor = descriptors.get(parameter);
            if (descriptor == null) {
                return;
            }
            Object oldValue = validator.coerce(descriptor, change.oldValue());
            Object newValue = validator.coerce(descriptor, change.newValue());
            if (!ParameterValues.valuesEqual(oldValue, newValue)) {
                result.put(parameter, new ValueChange(oldValue, newValue));
            }
        });
        return result;
    }

    // --- Validation ---

    /**
     * Validates every current value.
     *
     * @return failures keyed by parameter id; empty if all values are valid
     */
    public Map<String, ValidationResult> validate() {
        return validateValues(currentValues, false);
    }

    /**
     * Validates only the changed values. Changes to parameters that are not
     * writable are reported as failures too.
     *
     * @return failures keyed by parameter id; empty if all changes are valid
     */
    public Map<String, ValidationResult> validateChanges() {
        Map<String, Object> changes = getChanges();
        if (changes.isEmpty()) {
            return Map.of();
        }
        return validateValues(changes, true);
    }

    private Map<String, ValidationResult> validateValues(Map<String, Object> values, boolean requireWritable) {
        Map<String, ValidationResult> failures = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String parameter = entry.getKey();
            ParameterDescriptor descriptor = descriptors.get(parameter);
            if (descriptor == null) {
                failures.put(parameter, new ValidationResult(parameter, entry.getValue(), UNKNOWN_PARAMETER));
                continue;
            }
            if (requireWritable && !descriptor.writable()) {
                failures.put(parameter, new ValidationResult(parameter, entry.getValue(), READ_ONLY_PARAMETER));
                continue;
            }
            Optional<ValidationResult> failure = validator.validateValue(descriptor, entry.getValue());
            failure.ifPresent(f -> failures.put(parameter, f));
        }
        if (!failures.isEmpty()) {
            LOG.debug("session.validate failures={}", failures.keySet());
        }
        return failures;
    }

    private void restore(String parameter, Object oldValue) {
        if (oldValue == null && !initialValues.containsKey(parameter) && wasAbsentBefore(parameter)) {
            currentValues.remove(parameter);
        } else {
            currentValues.put(parameter, oldValue);
        }
    }

    /**
     * True if no remaining undo entry touched {@code parameter}, i.e. undoing
     * returned it to its pre-session absence.
     */
    private boolean wasAbsentBefore(String parameter) {
        for (UndoEntry entry : undoStack) {
            if (entry.parameter().equals(parameter)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "ConfigSession[parameters=" + currentValues.size() + ", changed=" + getChanges().keySet() + ", undo="
                + undoStack.size() + ", redo=" + redoStack.size() + "]";
    }
}
