package io.paramsetconfig.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Exception hierarchy")
class ExceptionHierarchyTest {

    @Test
    @DisplayName("catalog errors are structural and carry their source")
    void catalogLoadException() {
        IOException cause = new IOException("disk");
        CatalogLoadException e = new CatalogLoadException("bad catalog", cause, "/catalogs/x.yaml");

        assertThat(e).isInstanceOf(ParamConfigException.class).isInstanceOf(RuntimeException.class);
        assertThat(e.kind()).isEqualTo(ParamConfigException.Kind.STRUCTURAL);
        assertThat(e.source()).isEqualTo("/catalogs/x.yaml");
        assertThat(e.detail()).isEqualTo("bad catalog");
        assertThat(e.getCause()).isSameAs(cause);
    }

    @Test
    @DisplayName("change log and import errors are persisted-state errors")
    void persistedStateErrors() {
        ParamConfigException changeLog = new ChangeLogLoadException("bad entry");
        ParamConfigException imported = new ConfigurationImportException("bad version");

        assertThat(changeLog).isInstanceOf(PersistedStateException.class);
        assertThat(imported).isInstanceOf(PersistedStateException.class);
        assertThat(changeLog.kind()).isEqualTo(ParamConfigException.Kind.PERSISTED_STATE);
        assertThat(imported.kind()).isEqualTo(ParamConfigException.Kind.PERSISTED_STATE);
        assertThat(imported.source()).isNull();
    }
}
