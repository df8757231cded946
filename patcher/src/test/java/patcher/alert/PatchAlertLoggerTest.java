package patcher.alert;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import patcher.config.AlertLevel;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PatchAlertLogger")
class PatchAlertLoggerTest {

    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private PrintStream originalErr;

    @BeforeEach
    void redirect() {
        originalErr = System.err;
        System.setErr(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restore() {
        System.setErr(originalErr);
        PatchAlertLogger.setAlertLevel(AlertLevel.WARNING);
    }

    private String logged() {
        return captured.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("should print absent spans at DEBUG alert level")
    void spanAbsentAtDebug() {
        PatchAlertLogger.setAlertLevel(AlertLevel.DEBUG);

        PatchAlertLogger.spanAbsent("field:Foo");

        assertThat(logged()).contains("SPAN_ABSENT rule=field:Foo");
    }

    @Test
    @DisplayName("should keep absent spans quiet at WARNING alert level")
    void spanAbsentAtWarning() {
        PatchAlertLogger.spanAbsent("field:Foo");

        assertThat(logged()).doesNotContain("SPAN_ABSENT");
    }

    @Test
    @DisplayName("should print unbalanced spans at WARNING but not at ERROR")
    void spanUnbalanced() {
        PatchAlertLogger.spanUnbalanced("call:NewFoo", 12);
        PatchAlertLogger.setAlertLevel(AlertLevel.ERROR);
        PatchAlertLogger.spanUnbalanced("call:NewBar", 40);

        assertThat(logged())
                .contains("SPAN_UNBALANCED rule=call:NewFoo offset=12")
                .doesNotContain("NewBar");
    }
}
