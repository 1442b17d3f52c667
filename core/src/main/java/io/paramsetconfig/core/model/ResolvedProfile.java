package io.paramsetconfig.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@link ProfileDef} projected for one locale, ready for rendering.
 *
 * @param id             profile id ({@code 0} for the expert fallback)
 * @param name           localized name
 * @param description    localized description
 * @param editableParams parameters constrained by a list or range, in
 *                       definition order
 * @param fixedParams    parameters constrained to a fixed value, with that
 *                       value
 * @param defaultValues  suggested values of the editable parameters that
 *                       declare one
 */
public record ResolvedProfile(
        int id,
        String name,
        String description,
        List<String> editableParams,
        Map<String, Object> fixedParams,
        Map<String, Object> defaultValues) {

    public ResolvedProfile {
        editableParams = editableParams != null ? List.copyOf(editableParams) : List.of();
        fixedParams = fixedParams != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fixedParams)) : Map.of();
        defaultValues =
                defaultValues != null ? Collections.unmodifiableMap(new LinkedHashMap<>(defaultValues)) : Map.of();
    }
}
