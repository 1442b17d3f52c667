package io.paramsetconfig.core.profile;

import io.paramsetconfig.core.error.CatalogLoadException;
import io.paramsetconfig.core.model.ChannelTypePair;
import io.paramsetconfig.core.model.ProfileDef;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of profile definitions per (sender, receiver) channel type
 * pair.
 *
 * <p>
 * Profile order within a pair is the definition order and acts as match
 * priority. A pair mapped to an empty list is "known, no profiles"; a pair not
 * in the catalog is "no data".
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable. Build
 * one at startup and share it.
 */
public final class ProfileCatalog {

    private static final ProfileCatalog EMPTY = new ProfileCatalog(Map.of(), null);

    private final Map<ChannelTypePair, List<ProfileDef>> profiles;
    private final String source;

    private ProfileCatalog(Map<ChannelTypePair, List<ProfileDef>> profiles, String source) {
        this.profiles = profiles;
        this.source = source;
    }

    /** A catalog without any channel type pair. */
    public static ProfileCatalog empty() {
        return EMPTY;
    }

    /**
     * Returns a new {@link Builder}.
     *
     * @param source identifier of the definition source, used in error
     *               messages; may be {@code null}
     */
    public static Builder builder(String source) {
        return new Builder(source);
    }

    /**
     * Profiles for a channel type pair.
     *
     * @return the profiles in priority order, or empty if the pair is unknown
     */
    public Optional<List<ProfileDef>> profiles(ChannelTypePair pair) {
        return Optional.ofNullable(profiles.get(pair));
    }

    /** Profiles for a pair given as (receiver, sender) channel types. */
    public Optional<List<ProfileDef>> profiles(String receiverChannelType, String senderChannelType) {
        return profiles(new ChannelTypePair(senderChannelType, receiverChannelType));
    }

    /** All channel type pairs, in definition order. */
    public Set<ChannelTypePair> pairs() {
        return profiles.keySet();
    }

    /** Number of channel type pairs. */
    public int pairCount() {
        return profiles.size();
    }

    /** Number of profile definitions across all pairs. */
    public int profileCount() {
        return profiles.values().stream().mapToInt(List::size).sum();
    }

    /** Where this catalog was loaded from, or {@code null}. */
    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return "ProfileCatalog[pairs=" + pairCount() + ", profiles=" + profileCount() + ", source=" + source + "]";
    }

    /**
     * Builder for a {@link ProfileCatalog}. {@link #build()} performs the
     * catalog-level structural checks; constraint-level checks happen when the
     * constraints are constructed.
     */
    public static final class Builder {

        private final String source;
        private final Map<ChannelTypePair, List<ProfileDef>> profiles = new LinkedHashMap<>();

        Builder(String source) {
            this.source = source;
        }

        /**
         * Registers the profiles of one channel type pair, in priority order.
         *
         * @throws CatalogLoadException if the pair was already registered
         */
        public Builder add(ChannelTypePair pair, List<ProfileDef> pairProfiles) {
            if (profiles.containsKey(pair)) {
                throw new CatalogLoadException("Duplicate channel type pair " + pair, source);
            }
            profiles.put(pair, List.copyOf(pairProfiles));
            return this;
        }

        /** Registers profiles for (receiver, sender) channel types. */
        public Builder add(String receiverChannelType, String senderChannelType, List<ProfileDef> pairProfiles) {
            return add(new ChannelTypePair(senderChannelType, receiverChannelType), pairProfiles);
        }

        /**
         * Validates and builds the catalog.
         *
         * @throws CatalogLoadException if a profile uses the reserved id
         *                              {@code 0} or an id is repeated within a
         *                              pair
         */
        public ProfileCatalog build() {
            for (Map.Entry<ChannelTypePair, List<ProfileDef>> entry : profiles.entrySet()) {
                Set<Integer> seen = new HashSet<>();
                for (ProfileDef profile : entry.getValue()) {
                    if (profile.id() == ProfileResolver.EXPERT_PROFILE_ID) {
                        throw new CatalogLoadException(
                                "Profile id 0 is reserved for the expert fallback (pair " + entry.getKey() + ")",
                                source);
                    }
                    if (profile.id() < 0) {
                        throw new CatalogLoadException(
                                "Profile id must be positive, got " + profile.id() + " (pair " + entry.getKey() + ")",
                                source);
                    }
                    if (!seen.add(profile.id())) {
                        throw new CatalogLoadException(
                                "Duplicate profile id " + profile.id() + " (pair " + entry.getKey() + ")", source);
                    }
                }
            }
            return new ProfileCatalog(Collections.unmodifiableMap(new LinkedHashMap<>(profiles)), source);
        }
    }
}
