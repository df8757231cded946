package patcher.rule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import patcher.config.MatchMode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("FieldRule")
class FieldRuleTest {

    private final FieldRule rule = new FieldRule("Foo", "logger", "logger *slog.Logger", MatchMode.STRICT);

    @Test
    @DisplayName("should add the field to a single-line struct and keep existing fields")
    void singleLineStruct() {
        RuleOutcome outcome = rule.apply("type Foo struct { Bar int }\n");

        assertTrue(outcome.changed());
        assertThat(outcome.content())
                .contains("Bar int")
                .contains("\tlogger *slog.Logger")
                .endsWith("}\n");
    }

    @Test
    @DisplayName("should be a no-op on its own output")
    void idempotent() {
        String once = rule.apply("type Foo struct { Bar int }\n").content();

        RuleOutcome twice = rule.apply(once);

        assertFalse(twice.changed());
        assertEquals(once, twice.content());
    }

    @Test
    @DisplayName("should append before the closing brace with the body's indentation")
    void multiLineStruct() {
        String content = "type Foo struct {\n\tsvc  *app.Service\n\tdeps map[string]struct{ n int }\n}\n";

        String result = rule.apply(content).content();

        assertEquals("type Foo struct {\n\tsvc  *app.Service\n\tdeps map[string]struct{ n int }\n"
                + "\tlogger *slog.Logger\n}\n", result);
    }

    @Test
    @DisplayName("should leave files without the struct alone")
    void absent() {
        String content = "type Bar struct { x int }\n";

        RuleOutcome outcome = rule.apply(content);

        assertFalse(outcome.changed());
        assertEquals(content, outcome.content());
    }

    @Test
    @DisplayName("should only edit the named struct")
    void otherStructsUntouched() {
        String content = "type Foo struct {\n\tx int\n}\n\ntype FooBar struct {\n\ty int\n}\n";

        String result = rule.apply(content).content();

        assertThat(result).endsWith("type FooBar struct {\n\ty int\n}\n");
        assertThat(result).contains("\tx int\n\tlogger *slog.Logger\n}");
    }

    @Nested
    @DisplayName("match modes")
    class MatchModes {

        private static final String SIMILAR = "type Foo struct {\n\tloggerName string\n}\n";

        @Test
        @DisplayName("STRICT recognises fields in grouped declarations")
        void strictGrouped() {
            String content = "type Foo struct {\n\tname, logger string\n}\n";

            assertFalse(rule.apply(content).changed());
        }

        @Test
        @DisplayName("STRICT ignores a same-named field of a nested struct")
        void strictNestedStruct() {
            String content = "type Foo struct {\n\topts struct {\n\t\tlogger int\n\t}\n}\n";

            RuleOutcome outcome = rule.apply(content);

            assertTrue(outcome.changed());
            assertEquals("type Foo struct {\n\topts struct {\n\t\tlogger int\n\t}\n\tlogger *slog.Logger\n}\n",
                    outcome.content());
        }

        @Test
        @DisplayName("STRICT still adds the field when only a similar name exists")
        void strictSimilarName() {
            assertTrue(rule.apply(SIMILAR).changed());
        }

        @Test
        @DisplayName("SUBSTRING treats a similar name as present")
        void substringSimilarName() {
            FieldRule loose = new FieldRule("Foo", "logger", "logger *slog.Logger", MatchMode.SUBSTRING);

            assertFalse(loose.apply(SIMILAR).changed());
        }
    }

    @Test
    @DisplayName("should report kind and id")
    void identity() {
        assertEquals(TargetKind.STRUCT_BODY, rule.kind());
        assertEquals("field:Foo", rule.id());
    }
}
