package io.paramsetconfig.core.engine;

import io.paramsetconfig.core.changelog.ChangeLogEntry;
import io.paramsetconfig.core.changelog.ConfigChangeLog;
import io.paramsetconfig.core.config.StoreSettings;
import io.paramsetconfig.core.model.ParameterDescriptor;
import io.paramsetconfig.core.model.ValueChange;
import io.paramsetconfig.core.profile.ProfileCatalog;
import io.paramsetconfig.core.profile.ProfileResolver;
import io.paramsetconfig.core.session.ConfigSession;
import io.paramsetconfig.core.spec.ProfileCatalogParser;
import io.paramsetconfig.core.spi.ParameterValidator;
import io.paramsetconfig.core.validation.DescriptorValidator;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point tying the configuration state together: opens editing sessions,
 * owns the change log, and resolves profiles against the current catalog.
 *
 * <p>
 * The store never talks to a device. {@link #commit} records what a session
 * changed after the caller has written it.
 *
 * <p>
 * Thread-safe: the resolver (and with it the immutable catalog) is held in an
 * {@link AtomicReference}; {@link #reloadCatalog} swaps it atomically so
 * in-flight lookups finish against the old catalog. The change log
 * synchronizes internally. Sessions handed out are single-writer objects.
 */
public final class ConfigStore {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigStore.class);

    private final StoreSettings settings;
    private final ParameterValidator validator;
    private final ConfigChangeLog changeLog;
    private final AtomicReference<ProfileResolver> resolverRef;

    /**
     * Creates a store with the given settings, loading the catalog resource
     * they name (if any) and validating with {@link DescriptorValidator}.
     *
     * @throws io.paramsetconfig.core.error.CatalogLoadException if the catalog
     *                                                           resource is
     *                                                           missing or
     *                                                           malformed
     */
    public ConfigStore(StoreSettings settings) {
        this(settings, loadCatalog(settings), DescriptorValidator.INSTANCE, Clock.systemUTC());
    }

    /**
     * Creates a store.
     *
     * @param settings  store settings
     * @param catalog   initial profile catalog
     * @param validator validator handed to every session
     * @param clock     clock for change log timestamps
     */
    public ConfigStore(StoreSettings settings, ProfileCatalog catalog, ParameterValidator validator, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.changeLog = new ConfigChangeLog(settings.changeLogMaxEntries(), clock);
        this.resolverRef = new AtomicReference<>(new ProfileResolver(
                Objects.requireNonNull(catalog, "catalog must not be null"), settings.defaultLocale()));
        LOG.info(
                "Config store ready: change_log_max_entries={}, undo_history_limit={}, catalog_pairs={}",
                settings.changeLogMaxEntries(),
                settings.undoHistoryLimit(),
                catalog.pairCount());
    }

    private static ProfileCatalog loadCatalog(StoreSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        if (settings.catalogResource() == null) {
            return ProfileCatalog.empty();
        }
        return new ProfileCatalogParser().parseResource(settings.catalogResource());
    }

    /** The settings this store was created with. */
    public StoreSettings settings() {
        return settings;
    }

    /**
     * Opens an editing session.
     *
     * @param descriptors   parameter descriptors of the paramset
     * @param initialValues values read from the device
     */
    public ConfigSession openSession(Map<String, ParameterDescriptor> descriptors, Map<String, Object> initialValues) {
        return new ConfigSession(descriptors, initialValues, validator, settings.undoHistoryLimit());
    }

    /** The change log. */
    public ConfigChangeLog changeLog() {
        return changeLog;
    }

    /** Current resolver snapshot. */
    public ProfileResolver resolver() {
        return resolverRef.get();
    }

    /**
     * Atomically replaces the profile catalog.
     */
    public void reloadCatalog(ProfileCatalog catalog) {
        ProfileResolver next = new ProfileResolver(
                Objects.requireNonNull(catalog, "catalog must not be null"), settings.defaultLocale());
        resolverRef.set(next);
        LOG.info(
                "Profile catalog reloaded: pairs={}, profiles={}, source={}",
                catalog.pairCount(),
                catalog.profileCount(),
                catalog.source());
    }

    /**
     * Records a session's changes in the change log. Call after the device
     * write succeeded.
     *
     * @return the recorded entry, or empty if the session had no changes
     */
    public Optional<ChangeLogEntry> commit(ConfigSession session, CommitContext context) {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Map<String, ValueChange> changes = session.getChangedParameters();
        if (changes.isEmpty()) {
            LOG.debug("Nothing to commit for channel={}", context.channelAddress());
            return Optional.empty();
        }
        return Optional.of(changeLog.add(
                context.entryId(),
                context.interfaceId(),
                context.channelAddress(),
                context.deviceName(),
                context.deviceModel(),
                context.paramsetKey(),
                changes,
                context.source()));
    }

    /**
     * Matches a session's current values against the catalog.
     *
     * @return the active profile id, {@link ProfileResolver#EXPERT_PROFILE_ID}
     *         if none matches
     */
    public int matchActiveProfile(String receiverChannelType, String senderChannelType, ConfigSession session) {
        return resolver().matchActiveProfile(receiverChannelType, senderChannelType, session.currentValues());
    }
}
