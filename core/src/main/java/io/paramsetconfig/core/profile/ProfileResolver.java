package io.paramsetconfig.core.profile;

import io.paramsetconfig.core.model.ParamConstraint;
import io.paramsetconfig.core.model.ProfileDef;
import io.paramsetconfig.core.model.ResolvedProfile;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers profile questions against one immutable {@link ProfileCatalog}:
 * which profiles exist for a channel type pair, and which of them the current
 * values match.
 *
 * <p>
 * The expert profile (id {@value #EXPERT_PROFILE_ID}) is never stored in the
 * catalog and never part of {@link #getProfiles}. {@link #matchActiveProfile}
 * returns its id when nothing else matches; {@link #expertProfile} projects it
 * for callers that render it next to the catalog profiles.
 *
 * <p>
 * Thread-safe: immutable after construction.
 */
public final class ProfileResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ProfileResolver.class);

    /** Id of the synthesized "expert / no predefined profile" entry. */
    public static final int EXPERT_PROFILE_ID = 0;

    /** Locale used when none is configured. */
    public static final String DEFAULT_LOCALE = "en";

    private static final Map<String, String> EXPERT_NAMES = Map.of("en", "Expert", "de", "Experte");
    private static final Map<String, String> EXPERT_DESCRIPTIONS = Map.of(
            "en", "Individual settings of all link parameters",
            "de", "Individuelle Einstellung aller Verknüpfungsparameter");

    private final ProfileCatalog catalog;
    private final String defaultLocale;

    /** Creates a resolver that falls back to {@link #DEFAULT_LOCALE}. */
    public ProfileResolver(ProfileCatalog catalog) {
        this(catalog, DEFAULT_LOCALE);
    }

    /**
     * Creates a resolver.
     *
     * @param catalog       the catalog to resolve against
     * @param defaultLocale locale used when a profile lacks the requested one
     */
    public ProfileResolver(ProfileCatalog catalog, String defaultLocale) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.defaultLocale = Objects.requireNonNull(defaultLocale, "defaultLocale must not be null");
    }

    /** The catalog this resolver answers from. */
    public ProfileCatalog catalog() {
        return catalog;
    }

    /** Resolves profiles for the default locale. */
    public Optional<List<ResolvedProfile>> getProfiles(String receiverChannelType, String senderChannelType) {
        return getProfiles(receiverChannelType, senderChannelType, defaultLocale);
    }

    /**
     * Resolves the profiles of a channel type pair for a locale.
     *
     * @param receiverChannelType receiving channel type
     * @param senderChannelType   sending channel type
     * @param locale              requested locale, e.g. "de"
     * @return empty if the pair is not in the catalog ("no data"); otherwise
     *         the catalog profiles in order, an empty list if the pair is
     *         known but has none
     */
    public Optional<List<ResolvedProfile>> getProfiles(
            String receiverChannelType, String senderChannelType, String locale) {
        Optional<List<ProfileDef>> profiles = catalog.profiles(receiverChannelType, senderChannelType);
        if (profiles.isEmpty()) {
            LOG.debug("No profiles defined for receiver={} sender={}", receiverChannelType, senderChannelType);
            return Optional.empty();
        }
        String effectiveLocale = locale != null ? locale : defaultLocale;
        List<ResolvedProfile> resolved = new ArrayList<>();
        for (ProfileDef profile : profiles.get()) {
            resolved.add(resolve(profile, effectiveLocale));
        }
        return Optional.of(List.copyOf(resolved));
    }

    /**
     * Determines which profile the current values correspond to.
     *
     * @param receiverChannelType receiving channel type
     * @param senderChannelType   sending channel type
     * @param currentValues       current link paramset values
     * @return the id of the first matching profile, or
     *         {@link #EXPERT_PROFILE_ID} if none matches or the pair is unknown
     */
    public int matchActiveProfile(
            String receiverChannelType, String senderChannelType, Map<String, ?> currentValues) {
        Objects.requireNonNull(currentValues, "currentValues must not be null");
        Optional<List<ProfileDef>> profiles = catalog.profiles(receiverChannelType, senderChannelType);
        if (profiles.isEmpty()) {
            return EXPERT_PROFILE_ID;
        }
        ProfileDef match = ProfileMatcher.findFirstMatch(profiles.get(), currentValues);
        int id = match != null ? match.id() : EXPERT_PROFILE_ID;
        LOG.debug(
                "profile.match receiver={} sender={} profile_id={}", receiverChannelType, senderChannelType, id);
        return id;
    }

    /**
     * Ids of every profile the current values satisfy, in catalog order. Useful
     * to spot overlapping profile definitions.
     */
    public List<Integer> matchingProfiles(
            String receiverChannelType, String senderChannelType, Map<String, ?> currentValues) {
        Objects.requireNonNull(currentValues, "currentValues must not be null");
        List<Integer> ids = new ArrayList<>();
        catalog.profiles(receiverChannelType, senderChannelType)
                .ifPresent(profiles -> ProfileMatcher.findMatches(profiles, currentValues)
                        .forEach(p -> ids.add(p.id())));
        return ids;
    }

    /**
     * Projects one profile definition for a locale.
     */
    ResolvedProfile resolve(ProfileDef profile, String locale) {
        List<String> editable = new ArrayList<>();
        Map<String, Object> fixed = new LinkedHashMap<>();
        Map<String, Object> defaults = new LinkedHashMap<>();

        for (Map.Entry<String, ParamConstraint> entry : profile.params().entrySet()) {
            ParamConstraint constraint = entry.getValue();
            switch (constraint.kind()) {
                case FIXED -> fixed.put(entry.getKey(), ((ParamConstraint.Fixed) constraint).value());
                case LIST, RANGE -> {
                    editable.add(entry.getKey());
                    if (constraint.defaultValue() != null) {
                        defaults.put(entry.getKey(), constraint.defaultValue());
                    }
                }
            }
        }

        String name = localized(profile.name(), locale, "Profile " + profile.id());
        String description = localized(profile.description(), locale, "");
        return new ResolvedProfile(profile.id(), name, description, editable, fixed, defaults);
    }

    /**
     * The expert profile (id {@value #EXPERT_PROFILE_ID}, no constraints)
     * projected for a locale.
     *
     * @param locale requested locale, or {@code null} for the default locale
     */
    public ResolvedProfile expertProfile(String locale) {
        String effectiveLocale = locale != null ? locale : defaultLocale;
        return new ResolvedProfile(
                EXPERT_PROFILE_ID,
                localized(EXPERT_NAMES, effectiveLocale, "Expert"),
                localized(EXPERT_DESCRIPTIONS, effectiveLocale, ""),
                List.of(),
                Map.of(),
                Map.of());
    }

    private String localized(Map<String, String> texts, String locale, String fallback) {
        String text = texts.get(locale);
        if (text == null || text.isBlank()) {
            text = texts.get(defaultLocale);
        }
        return text == null || text.isBlank() ? fallback : text;
    }
}
