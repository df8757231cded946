package patcher.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import patcher.config.EditCatalog.CallEdit;
import patcher.config.EditCatalog.ConstructorEdit;
import patcher.config.EditCatalog.FieldEdit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class PatchConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearOverrides() {
        System.clearProperty("patch.write.mode");
    }

    @Test
    void loadFromPropertiesFile() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                patch.files.pattern=services/*/cmd/*/main.go
                patch.write.mode=STAGED
                patch.match.mode=SUBSTRING
                patch.report.unchanged=false
                patch.dry.run=true
                patch.alert.level=ERROR
                patch.call.functions=NewFXHandler, NewCardHandler
                patch.call.argument=logger
                patch.call.suppress=logger,log
                """);

        PatchConfig c = PatchConfigLoader.loadFromFile(f);

        assertEquals("services/*/cmd/*/main.go", c.filePattern());
        assertEquals(WriteMode.STAGED, c.writeMode());
        assertEquals(MatchMode.SUBSTRING, c.matchMode());
        assertFalse(c.reportUnchanged());
        assertTrue(c.dryRun());
        assertEquals(AlertLevel.ERROR, c.alertLevel());

        CallEdit call = c.catalog().callEdit().orElseThrow();
        assertEquals(List.of("NewFXHandler", "NewCardHandler"), call.functions());
        assertEquals("logger", call.argument());
        assertEquals(List.of("logger", "log"), call.suppressKeywords());
        assertTrue(c.catalog().fieldEdit().isEmpty());
    }

    @Test
    void loadFromYamlFile() throws IOException {
        Path f = tempDir.resolve("test.yml");
        Files.writeString(f, """
                patch:
                  files:
                    pattern: "services/*/internal/presentation/grpc/handler.go"
                  import:
                    anchor: '"context"'
                    entry: '"log/slog"'
                  field:
                    types: [FXHandler, CardHandler]
                    declaration: "logger *slog.Logger"
                  constructor:
                    types:
                      - FXHandler
                      - CardHandler
                    parameter: "logger *slog.Logger"
                    assignment: "logger: logger"
                  document:
                    path: docker-compose.yml
                    anchor: 'interval: 10s'
                    line: "start_period: 30s"
                """);

        PatchConfig c = PatchConfigLoader.loadFromFile(f);

        assertEquals("services/*/internal/presentation/grpc/handler.go", c.filePattern());
        assertEquals(MatchMode.STRICT, c.matchMode());
        assertEquals("\"context\"", c.catalog().importEdit().orElseThrow().anchor());

        FieldEdit field = c.catalog().fieldEdit().orElseThrow();
        assertEquals(List.of("FXHandler", "CardHandler"), field.types());
        assertEquals("logger", field.fieldName());

        ConstructorEdit ctor = c.catalog().constructorEdit().orElseThrow();
        assertEquals("New", ctor.prefix());
        assertEquals("logger", ctor.parameterName());
        assertEquals("logger", ctor.assignmentKey());

        assertThat(c.documentEdit()).map(PatchConfig.DocumentEdit::line).contains("start_period: 30s");
    }

    @Test
    void defaultsWhenKeysMissing() throws IOException {
        Path f = tempDir.resolve("empty.properties");
        Files.writeString(f, "");

        PatchConfig c = PatchConfigLoader.loadFromFile(f);

        assertEquals("**/*.go", c.filePattern());
        assertEquals(WriteMode.INCREMENTAL, c.writeMode());
        assertEquals(MatchMode.STRICT, c.matchMode());
        assertTrue(c.reportUnchanged());
        assertFalse(c.dryRun());
        assertTrue(c.catalog().isEmpty());
        assertTrue(c.documentEdit().isEmpty());
    }

    @Test
    void invalidEnumAndBooleanValuesAreIgnored() throws IOException {
        Path f = tempDir.resolve("bad.properties");
        Files.writeString(f, """
                patch.write.mode=SOMETIMES
                patch.alert.level=LOUD
                patch.dry.run=maybe
                """);

        PatchConfig c = PatchConfigLoader.loadFromFile(f);

        assertEquals(WriteMode.INCREMENTAL, c.writeMode());
        assertEquals(AlertLevel.WARNING, c.alertLevel());
        assertFalse(c.dryRun());
    }

    @Test
    void missingRequiredKeyFails() throws IOException {
        Path f = tempDir.resolve("partial.properties");
        Files.writeString(f, "patch.field.types=FXHandler\n");

        assertThatThrownBy(() -> PatchConfigLoader.loadFromFile(f))
                .isInstanceOf(PatchConfigException.class)
                .hasMessage("Missing required property: patch.field.declaration");
    }

    @Test
    void systemPropertyOverridesFile() throws IOException {
        Path f = tempDir.resolve("override.properties");
        Files.writeString(f, "patch.write.mode=INCREMENTAL\n");
        System.setProperty("patch.write.mode", "STAGED");

        assertEquals(WriteMode.STAGED, PatchConfigLoader.loadFromFile(f).writeMode());
    }

    @Test
    void loadFromClasspath() {
        PatchConfig c = PatchConfigLoader.load();

        assertEquals("fixtures/*.go", c.filePattern());
        assertTrue(c.catalog().callEdit().isPresent());
    }

    @Test
    void missingResourceFails() {
        assertThatThrownBy(() -> PatchConfigLoader.loadResource("nope.yml"))
                .isInstanceOf(PatchConfigException.class)
                .hasMessageContaining("nope.yml");
    }
}
