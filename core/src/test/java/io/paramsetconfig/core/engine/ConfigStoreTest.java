package io.paramsetconfig.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.paramsetconfig.core.changelog.ChangeLogEntry;
import io.paramsetconfig.core.config.StoreSettings;
import io.paramsetconfig.core.error.CatalogLoadException;
import io.paramsetconfig.core.model.ChannelTypePair;
import io.paramsetconfig.core.model.ParamConstraint;
import io.paramsetconfig.core.model.ProfileDef;
import io.paramsetconfig.core.model.ValueChange;
import io.paramsetconfig.core.profile.ProfileCatalog;
import io.paramsetconfig.core.profile.ProfileResolver;
import io.paramsetconfig.core.session.ConfigSession;
import io.paramsetconfig.core.testkit.TestDescriptors;
import io.paramsetconfig.core.validation.DescriptorValidator;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Tests for {@link ConfigStore}.
 */
@DisplayName("ConfigStore")
class ConfigStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-04-01T12:00:00Z"), ZoneOffset.UTC);
    private static final CommitContext CONTEXT = new CommitContext(
            "entry-1", "BidCos-RF", "VCU0000001:1", "Thermostat", "HM-CC-RT-DN", "MASTER", "panel");

    private ListAppender<ILoggingEvent> logAppender;
    private Logger storeLogger;

    @BeforeEach
    void attachAppender() {
        storeLogger = (Logger) LoggerFactory.getLogger(ConfigStore.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        storeLogger.addAppender(logAppender);
    }

    @AfterEach
    void detachAppender() {
        storeLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private static ConfigStore store(StoreSettings settings) {
        return new ConfigStore(settings, ProfileCatalog.empty(), DescriptorValidator.INSTANCE, CLOCK);
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("settings constructor loads the named catalog resource")
        void loadsCatalogResource() {
            ConfigStore store = new ConfigStore(StoreSettings.builder()
                    .catalogResource("/catalogs/dimmer-profiles.yaml")
                    .build());

            assertThat(store.resolver().catalog().pairCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("no catalog resource starts with an empty catalog")
        void emptyCatalog() {
            ConfigStore store = new ConfigStore(StoreSettings.DEFAULT);

            assertThat(store.resolver().catalog().pairCount()).isZero();
            assertThat(store.changeLog().maxEntries()).isEqualTo(500);
        }

        @Test
        @DisplayName("missing catalog resource fails at construction")
        void missingCatalogResource() {
            StoreSettings settings =
                    StoreSettings.builder().catalogResource("/catalogs/missing.yaml").build();

            assertThatThrownBy(() -> new ConfigStore(settings)).isInstanceOf(CatalogLoadException.class);
        }

        @Test
        @DisplayName("startup is logged at INFO with the effective settings")
        void logsStartup() {
            store(StoreSettings.builder().changeLogMaxEntries(42).build());

            assertThat(logAppender.list)
                    .filteredOn(e -> e.getLevel() == Level.INFO)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .anySatisfy(msg -> assertThat(msg).contains("change_log_max_entries=42"));
        }
    }

    @Nested
    @DisplayName("Sessions and commit")
    class SessionsAndCommit {

        @Test
        @DisplayName("sessions inherit the configured undo limit")
        void undoLimit() {
            ConfigStore store = store(StoreSettings.builder().undoHistoryLimit(1).build());
            ConfigSession session =
                    store.openSession(TestDescriptors.thermostatDescriptors(), TestDescriptors.thermostatValues());

            session.set("BOOST_TIME_PERIOD", 6);
            session.set("BOOST_TIME_PERIOD", 7);

            assertThat(session.undoDepth()).isEqualTo(1);
        }

        @Test
        @DisplayName("commit records the coerced diff in the change log")
        void commitRecordsChanges() {
            ConfigStore store = store(StoreSettings.DEFAULT);
            ConfigSession session =
                    store.openSession(TestDescriptors.thermostatDescriptors(), TestDescriptors.thermostatValues());
            session.set("SHOW_WEEKDAY", "DATE");
            session.set("TEMPERATURE_OFFSET", 2.0);

            Optional<ChangeLogEntry> entry = store.commit(session, CONTEXT);

            assertThat(entry).isPresent();
            assertThat(entry.get().changes())
                    .containsEntry("SHOW_WEEKDAY", new ValueChange(1, 2))
                    .containsEntry("TEMPERATURE_OFFSET", new ValueChange(1.5, 2.0));
            assertThat(entry.get().timestamp()).isEqualTo("2026-04-01T12:00:00Z");
            assertThat(store.changeLog().getEntries("entry-1", null).total()).isEqualTo(1);
        }

        @Test
        @DisplayName("clean session commits nothing")
        void cleanSession() {
            ConfigStore store = store(StoreSettings.DEFAULT);
            ConfigSession session =
                    store.openSession(TestDescriptors.thermostatDescriptors(), TestDescriptors.thermostatValues());

            assertThat(store.commit(session, CONTEXT)).isEmpty();
            assertThat(store.changeLog().size()).isZero();
        }
    }

    @Nested
    @DisplayName("Profiles")
    class Profiles {

        private final ProfileCatalog catalog = ProfileCatalog.builder("inline")
                .add(
                        new ChannelTypePair("SWITCH_TRANSCEIVER", "SWITCH_VIRTUAL_RECEIVER"),
                        List.of(new ProfileDef(
                                1,
                                Map.of("en", "Switch - on"),
                                Map.of(),
                                Map.of("SHORT_PROFILE_ACTION_TYPE", ParamConstraint.fixed(1)))))
                .build();

        @Test
        @DisplayName("active profile follows the session's current values")
        void matchesSessionValues() {
            ConfigStore store = store(StoreSettings.DEFAULT);
            store.reloadCatalog(catalog);
            ConfigSession session = store.openSession(
                    Map.of("SHORT_PROFILE_ACTION_TYPE",
                            TestDescriptors.integerParam("SHORT_PROFILE_ACTION_TYPE", 0, 5, 0)),
                    Map.of("SHORT_PROFILE_ACTION_TYPE", 0));

            assertThat(store.matchActiveProfile("SWITCH_VIRTUAL_RECEIVER", "SWITCH_TRANSCEIVER", session))
                    .isEqualTo(ProfileResolver.EXPERT_PROFILE_ID);

            session.set("SHORT_PROFILE_ACTION_TYPE", 1);

            assertThat(store.matchActiveProfile("SWITCH_VIRTUAL_RECEIVER", "SWITCH_TRANSCEIVER", session))
                    .isEqualTo(1);
        }

        @Test
        @DisplayName("reload swaps the resolver atomically; old snapshots stay usable")
        void reloadSwapsResolver() {
            ConfigStore store = store(StoreSettings.DEFAULT);
            ProfileResolver before = store.resolver();

            store.reloadCatalog(catalog);

            assertThat(store.resolver()).isNotSameAs(before);
            assertThat(before.getProfiles("SWITCH_VIRTUAL_RECEIVER", "SWITCH_TRANSCEIVER")).isEmpty();
            assertThat(store.resolver().getProfiles("SWITCH_VIRTUAL_RECEIVER", "SWITCH_TRANSCEIVER"))
                    .get()
                    .satisfies(list -> assertThat(list).hasSize(1));
            assertThat(logAppender.list)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .anySatisfy(msg -> assertThat(msg).startsWith("Profile catalog reloaded: pairs=1"));
        }

        @Test
        @DisplayName("configured default locale reaches the resolver")
        void defaultLocale() {
            ConfigStore store = store(StoreSettings.builder().defaultLocale("de").build());
            store.reloadCatalog(catalog);

            assertThat(store.resolver().expertProfile(null).name()).isEqualTo("Experte");
            assertThat(store.resolver()
                            .getProfiles("SWITCH_VIRTUAL_RECEIVER", "SWITCH_TRANSCEIVER")
                            .orElseThrow()
                            .get(0)
                            .name())
                    .isEqualTo("Switch - on");
        }
    }
}
