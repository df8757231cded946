package patcher.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PatchMain")
class PatchMainTest {

    @TempDir
    Path root;

    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() throws Exception {
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        Files.createDirectories(root.resolve("fixtures"));
        Files.writeString(root.resolve("fixtures/main.go"), "package main\n\nvar h = NewFoo(svc)\n");
    }

    @Test
    @DisplayName("should use the classpath configuration without --config")
    void classpathConfig() throws Exception {
        int changed = PatchMain.run(new String[]{root.toString()}, out);

        assertThat(changed).isEqualTo(1);
        assertThat(Files.readString(root.resolve("fixtures/main.go"))).contains("NewFoo(svc, logger)");
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("✓ Updated fixtures/main.go");
    }

    @Test
    @DisplayName("should leave files untouched with --dry-run")
    void dryRun() throws Exception {
        int changed = PatchMain.run(new String[]{"--dry-run", root.toString()}, out);

        assertThat(changed).isEqualTo(1);
        assertThat(Files.readString(root.resolve("fixtures/main.go"))).contains("NewFoo(svc)\n");
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("Total: 1 files would be updated");
    }

    @Test
    @DisplayName("should run a document-only configuration given with --config")
    void documentOnly() throws Exception {
        Path config = root.resolve("compose.properties");
        Files.writeString(config, """
                patch.document.path=docker-compose.yml
                patch.document.anchor=interval: 10s
                patch.document.line=start_period: 30s
                """);
        Files.writeString(root.resolve("docker-compose.yml"), "x:\n  interval: 10s\n");

        int changed = PatchMain.run(new String[]{"--config", config.toString(), root.toString()}, out);

        assertThat(changed).isEqualTo(1);
        assertThat(Files.readString(root.resolve("docker-compose.yml")))
                .isEqualTo("x:\n  interval: 10s\n  start_period: 30s\n");
        assertThat(buffer.toString(StandardCharsets.UTF_8)).doesNotContain("Total:");
    }

    @Test
    @DisplayName("should reject missing roots and unknown options")
    void usage() {
        assertThatThrownBy(() -> PatchMain.run(new String[]{}, out))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Usage");
        assertThatThrownBy(() -> PatchMain.run(new String[]{"--force", root.toString()}, out))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown option: --force");
        assertThatThrownBy(() -> PatchMain.run(new String[]{"--config"}, out))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
