package io.paramsetconfig.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named, pre-canned combination of parameter constraints for one channel
 * type pair.
 *
 * <p>
 * Immutable, thread-safe. Created at catalog load time. Id {@code 0} is
 * reserved for the expert fallback and is rejected by
 * {@code ProfileCatalog}.
 *
 * @param id          profile id, unique within its channel type pair
 * @param name        localized names keyed by locale (e.g. "en", "de")
 * @param description localized descriptions keyed by locale
 * @param params      constraints keyed by parameter id, definition order kept
 */
public record ProfileDef(
        int id, Map<String, String> name, Map<String, String> description, Map<String, ParamConstraint> params) {

    /** Copies the maps, keeping their iteration order. */
    public ProfileDef {
        name = name != null ? Collections.unmodifiableMap(new LinkedHashMap<>(name)) : Map.of();
        description = description != null ? Collections.unmodifiableMap(new LinkedHashMap<>(description)) : Map.of();
        params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
        for (Map.Entry<String, ParamConstraint> entry : params.entrySet()) {
            Objects.requireNonNull(entry.getKey(), "parameter id must not be null");
            Objects.requireNonNull(entry.getValue(), "constraint for '" + entry.getKey() + "' must not be null");
        }
    }

    /** Number of constrained parameters. */
    public int constraintCount() {
        return params.size();
    }
}
