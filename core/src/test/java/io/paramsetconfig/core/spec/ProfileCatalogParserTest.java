package io.paramsetconfig.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.paramsetconfig.core.error.CatalogLoadException;
import io.paramsetconfig.core.error.ParamConfigException;
import io.paramsetconfig.core.model.ParamConstraint;
import io.paramsetconfig.core.model.ProfileDef;
import io.paramsetconfig.core.profile.ProfileCatalog;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ProfileCatalogParser}.
 */
@DisplayName("ProfileCatalogParser")
class ProfileCatalogParserTest {

    private ProfileCatalogParser parser;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        parser = new ProfileCatalogParser();
    }

    private Path writeCatalog(String yaml) throws IOException {
        Path file = tempDir.resolve("catalog.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Nested
    @DisplayName("Valid catalogs")
    class ValidCatalogs {

        @Test
        @DisplayName("fixture loads all pairs and profiles in order")
        void loadsFixture() {
            ProfileCatalog catalog = parser.parseResource("/catalogs/dimmer-profiles.yaml");

            assertThat(catalog.pairCount()).isEqualTo(3);
            assertThat(catalog.profileCount()).isEqualTo(4);
            assertThat(catalog.source()).isEqualTo("/catalogs/dimmer-profiles.yaml");
            assertThat(catalog.profiles("DIMMER_VIRTUAL_RECEIVER", "SWITCH_TRANSCEIVER").orElseThrow())
                    .extracting(ProfileDef::id)
                    .containsExactly(1, 2, 3);
            assertThat(catalog.profiles("DIMMER_VIRTUAL_RECEIVER", "KEY_TRANSCEIVER")).contains(List.of());
        }

        @Test
        @DisplayName("constraints keep their kind, values and defaults")
        void constraintShapes() {
            ProfileCatalog catalog = parser.parseResource("/catalogs/dimmer-profiles.yaml");
            List<ProfileDef> profiles =
                    catalog.profiles("DIMMER_VIRTUAL_RECEIVER", "SWITCH_TRANSCEIVER").orElseThrow();

            assertThat(profiles.get(0).params().get("SHORT_JT_ON")).isEqualTo(new ParamConstraint.Fixed(3));
            assertThat(profiles.get(0).params().get("SHORT_ON_LEVEL"))
                    .isEqualTo(new ParamConstraint.Range(0.0, 1.0, 1.0));
            assertThat(profiles.get(1).params().get("SHORT_OFF_TIME_BASE"))
                    .isEqualTo(new ParamConstraint.OneOf(List.of(0, 1, 2, 3, 4, 5, 6, 7), 7));
            assertThat(profiles.get(0).name()).containsEntry("de", "Dimmer - ein");
        }

        @Test
        @DisplayName("JSON documents are accepted too")
        void jsonDocument() throws IOException {
            Path file = writeCatalog("{\"R\": {\"S\": {\"profiles\": [{\"id\": 4, \"params\": "
                    + "{\"MODE\": {\"constraint_type\": \"fixed\", \"value\": \"ON\"}}}]}}}");

            ProfileCatalog catalog = parser.parse(file);

            assertThat(catalog.profiles("R", "S").orElseThrow().get(0).params())
                    .containsEntry("MODE", new ParamConstraint.Fixed("ON"));
        }

        @Test
        @DisplayName("HTML entities in names and descriptions are decoded")
        void decodesEntities() throws IOException {
            Path file = writeCatalog("""
                    R:
                      S:
                        profiles:
                          - id: 1
                            name: {de: "Dimmer &uuml;ber Taster", en: "On &amp; off"}
                            description: {de: "Helligkeit &gt; 50&#37;"}
                    """);

            ProfileDef profile = parser.parse(file).profiles("R", "S").orElseThrow().get(0);

            assertThat(profile.name())
                    .containsEntry("de", "Dimmer \u00fcber Taster")
                    .containsEntry("en", "On & off");
            assertThat(profile.description()).containsEntry("de", "Helligkeit > 50%");
        }

        @Test
        @DisplayName("empty mapping is an empty catalog")
        void emptyMapping() throws IOException {
            assertThat(parser.parse(writeCatalog("{}")).pairCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Rejected catalogs")
    class RejectedCatalogs {

        @Test
        @DisplayName("profile without id violates the schema")
        void missingId() throws IOException {
            Path file = writeCatalog("""
                    R:
                      S:
                        profiles:
                          - name: {en: "No id"}
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(CatalogLoadException.class)
                    .hasMessageContaining("violates schema")
                    .satisfies(e -> assertThat(((ParamConfigException) e).source()).isEqualTo(file.toString()));
        }

        @Test
        @DisplayName("unknown constraint type violates the schema")
        void unknownConstraintType() throws IOException {
            Path file = writeCatalog("""
                    R:
                      S:
                        profiles:
                          - id: 1
                            params:
                              MODE: {constraint_type: between, value: 1}
                    """);

            assertThatThrownBy(() -> parser.parse(file)).isInstanceOf(CatalogLoadException.class);
        }

        @Test
        @DisplayName("list default outside the values names the pair, profile and parameter")
        void listDefaultOutsideValues() throws IOException {
            Path file = writeCatalog("""
                    R:
                      S:
                        profiles:
                          - id: 2
                            params:
                              BASE: {constraint_type: list, values: [0, 1], default: 5}
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(CatalogLoadException.class)
                    .hasMessageContaining("S->R")
                    .hasMessageContaining("profile 2")
                    .hasMessageContaining("'BASE'");
        }

        @Test
        @DisplayName("range with min above max is rejected")
        void invertedRange() throws IOException {
            Path file = writeCatalog("""
                    R:
                      S:
                        profiles:
                          - id: 1
                            params:
                              LEVEL: {constraint_type: range, min_value: 1.0, max_value: 0.0}
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(CatalogLoadException.class)
                    .hasMessageContaining("greater than max");
        }

        @Test
        @DisplayName("constraint without its value field is rejected")
        void missingValueField() throws IOException {
            Path file = writeCatalog("""
                    R:
                      S:
                        profiles:
                          - id: 1
                            params:
                              MODE: {constraint_type: fixed}
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(CatalogLoadException.class)
                    .hasMessageContaining("requires 'value'");
        }

        @Test
        @DisplayName("profile id beyond the int range is rejected instead of truncated")
        void idOutOfRange() throws IOException {
            Path file = writeCatalog("""
                    R:
                      S:
                        profiles:
                          - id: 3000000000
                            params:
                              MODE: {constraint_type: fixed, value: 1}
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(CatalogLoadException.class)
                    .hasMessageContaining("out of range")
                    .hasMessageContaining("3000000000");
        }

        @Test
        @DisplayName("reserved profile id 0 is rejected")
        void reservedId() throws IOException {
            Path file = writeCatalog("""
                    R:
                      S:
                        profiles:
                          - id: 0
                            params:
                              MODE: {constraint_type: fixed, value: 1}
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(CatalogLoadException.class)
                    .hasMessageContaining("reserved");
        }

        @Test
        @DisplayName("malformed YAML, empty document and missing resources")
        void unreadableInput() throws IOException {
            Path broken = writeCatalog("R: [unclosed");
            assertThatThrownBy(() -> parser.parse(broken)).isInstanceOf(CatalogLoadException.class);

            Path empty = tempDir.resolve("empty.yaml");
            Files.writeString(empty, "");
            assertThatThrownBy(() -> parser.parse(empty))
                    .isInstanceOf(CatalogLoadException.class)
                    .hasMessageContaining("empty");

            assertThatThrownBy(() -> parser.parse(tempDir.resolve("missing.yaml")))
                    .isInstanceOf(CatalogLoadException.class);
            assertThatThrownBy(() -> parser.parseResource("/catalogs/does-not-exist.yaml"))
                    .isInstanceOf(CatalogLoadException.class)
                    .hasMessageContaining("not found");
        }
    }
}
