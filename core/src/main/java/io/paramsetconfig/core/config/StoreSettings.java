package io.paramsetconfig.core.config;

import io.paramsetconfig.core.changelog.ConfigChangeLog;
import io.paramsetconfig.core.profile.ProfileResolver;
import java.util.Objects;

/**
 * Settings of a {@code ConfigStore}.
 *
 * @param changeLogMaxEntries capacity of the change log
 * @param undoHistoryLimit    maximum undo depth per session; {@code 0} means
 *                            unbounded. A positive limit drops the oldest
 *                            edits, which then cannot be undone
 * @param defaultLocale       locale used when a profile lacks the requested
 *                            one
 * @param catalogResource     classpath resource holding the profile catalog,
 *                            or {@code null} to start with an empty catalog
 */
public record StoreSettings(
        int changeLogMaxEntries, int undoHistoryLimit, String defaultLocale, String catalogResource) {

    /** Default settings. */
    public static final StoreSettings DEFAULT = builder().build();

    public StoreSettings {
        if (changeLogMaxEntries < 1) {
            throw new IllegalArgumentException("changeLogMaxEntries must be at least 1: " + changeLogMaxEntries);
        }
        if (undoHistoryLimit < 0) {
            throw new IllegalArgumentException("undoHistoryLimit must not be negative: " + undoHistoryLimit);
        }
        Objects.requireNonNull(defaultLocale, "defaultLocale must not be null");
    }

    /** Returns a builder pre-populated with the defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Fluent builder for {@link StoreSettings}. */
    public static final class Builder {

        private int changeLogMaxEntries = ConfigChangeLog.DEFAULT_MAX_ENTRIES;
        private int undoHistoryLimit = 0;
        private String defaultLocale = ProfileResolver.DEFAULT_LOCALE;
        private String catalogResource;

        Builder() {}

        public Builder changeLogMaxEntries(int changeLogMaxEntries) {
            this.changeLogMaxEntries = changeLogMaxEntries;
            return this;
        }

        public Builder undoHistoryLimit(int undoHistoryLimit) {
            this.undoHistoryLimit = undoHistoryLimit;
            return this;
        }

        public Builder defaultLocale(String defaultLocale) {
            this.defaultLocale = defaultLocale;
            return this;
        }

        public Builder catalogResource(String catalogResource) {
            this.catalogResource = catalogResource;
            return this;
        }

        public StoreSettings build() {
            return new StoreSettings(changeLogMaxEntries, undoHistoryLimit, defaultLocale, catalogResource);
        }
    }
}
