package io.paramsetconfig.core.profile;

import io.paramsetconfig.core.model.ParamConstraint;
import io.paramsetconfig.core.model.ProfileDef;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches current parameter values against profile definitions.
 * Implements "first-match-wins" resolution: profiles are tested in catalog
 * order and the first one whose every constraint is satisfied is selected,
 * even if a later profile constrains more parameters.
 *
 * <p>
 * A profile matches when each of its constrained parameters is present in the
 * values and satisfies its constraint. Values of parameters the profile does
 * not constrain are ignored. A profile without constraints never matches.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class ProfileMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ProfileMatcher.class);

    private ProfileMatcher() {}

    /**
     * Finds the first matching profile.
     *
     * @param profiles      candidate profiles in priority order
     * @param currentValues the values to test
     * @return the first matching profile, or null if none matches
     */
    public static ProfileDef findFirstMatch(List<ProfileDef> profiles, Map<String, ?> currentValues) {
        for (ProfileDef profile : profiles) {
            if (matches(profile, currentValues)) {
                return profile;
            }
        }
        return null;
    }

    /**
     * Finds all matching profiles, in priority order.
     *
     * @param profiles      candidate profiles in priority order
     * @param currentValues the values to test
     * @return matching profiles, empty if none match
     */
    public static List<ProfileDef> findMatches(List<ProfileDef> profiles, Map<String, ?> currentValues) {
        List<ProfileDef> matches = new ArrayList<>();
        for (ProfileDef profile : profiles) {
            if (matches(profile, currentValues)) {
                matches.add(profile);
            }
        }
        return matches;
    }

    /**
     * Tests whether every constraint of a single profile is satisfied.
     */
    static boolean matches(ProfileDef profile, Map<String, ?> currentValues) {
        if (profile.params().isEmpty()) {
            return false;
        }
        for (Map.Entry<String, ParamConstraint> entry : profile.params().entrySet()) {
            String parameter = entry.getKey();
            Object current = currentValues.get(parameter);
            if (!entry.getValue().isSatisfiedBy(current)) {
                LOG.trace(
                        "Profile {} rejected: parameter '{}' fails {} constraint",
                        profile.id(),
                        parameter,
                        entry.getValue().kind().wireName());
                return false;
            }
        }
        return true;
    }
}
