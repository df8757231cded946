package patcher.rule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("ListAppender")
class ListAppenderTest {

    @Nested
    @DisplayName("appendElement")
    class AppendElement {

        @Test
        @DisplayName("single line list gets a comma and a space")
        void singleLine() {
            assertEquals("a, b, c", ListAppender.appendElement("a, b", "c"));
        }

        @Test
        @DisplayName("single line trailing comma is not doubled")
        void singleLineTrailingComma() {
            assertEquals("a, b, c", ListAppender.appendElement("a, b,", "c"));
        }

        @Test
        @DisplayName("empty list gets the bare element")
        void empty() {
            assertEquals("c", ListAppender.appendElement("", "c"));
        }

        @Test
        @DisplayName("multi line trailing comma style is kept")
        void multiLineTrailingComma() {
            String inner = "\n\tsvc *app.Service,\n";

            assertEquals("\n\tsvc *app.Service,\n\tlogger *slog.Logger,\n",
                    ListAppender.appendElement(inner, "logger *slog.Logger"));
        }

        @Test
        @DisplayName("multi line without trailing comma gets exactly one comma")
        void multiLineNoTrailingComma() {
            String inner = "\n\t\tsvc,\n\t\trepo\n\t";

            assertEquals("\n\t\tsvc,\n\t\trepo,\n\t\tlogger\n\t",
                    ListAppender.appendElement(inner, "logger"));
        }

        @Test
        @DisplayName("trailing comment after a trailing comma stays on its line")
        void commentAfterTrailingComma() {
            String inner = "\n\tsvc,\n\trepo, // storage\n";

            assertEquals("\n\tsvc,\n\trepo, // storage\n\tlogger,\n",
                    ListAppender.appendElement(inner, "logger"));
        }

        @Test
        @DisplayName("comma goes before a trailing comment")
        void commentWithoutTrailingComma() {
            String inner = "\n\t\tsvc,\n\t\trepo // storage, see repo.go\n\t";

            assertEquals("\n\t\tsvc,\n\t\trepo, // storage, see repo.go\n\t\tlogger\n\t",
                    ListAppender.appendElement(inner, "logger"));
        }

        @Test
        @DisplayName("comment-only last line does not hide the trailing comma")
        void commentOnlyLastLine() {
            String inner = "\n\tsvc,\n\t// more later\n";

            assertEquals("\n\tsvc,\n\t// more later\n\tlogger,\n",
                    ListAppender.appendElement(inner, "logger"));
        }

        @Test
        @DisplayName("slashes inside a string are not a comment")
        void slashesInString() {
            String inner = "\n\tsvc,\n\t\"http://x\"\n";

            assertEquals("\n\tsvc,\n\t\"http://x\",\n\tlogger\n",
                    ListAppender.appendElement(inner, "logger"));
        }
    }

    @Nested
    @DisplayName("appendLine")
    class AppendLine {

        @Test
        @DisplayName("uses the indentation of the last line")
        void lastLineIndent() {
            String body = "\n    svc *app.Service\n";

            assertEquals("\n    svc *app.Service\n    logger *slog.Logger\n",
                    ListAppender.appendLine(body, "logger *slog.Logger"));
        }

        @Test
        @DisplayName("empty body gets a tab-indented line")
        void emptyBody() {
            assertEquals("\n\tlogger *slog.Logger\n", ListAppender.appendLine("", "logger *slog.Logger"));
        }
    }

    @Test
    @DisplayName("splitTopLevel ignores nested commas, strings and comments")
    void splitTopLevel() {
        String inner = "a, f(b, c), \"x,y\", // note, aside\n d,";

        assertThat(ListAppender.splitTopLevel(inner)).containsExactly("a", "f(b, c)", "\"x,y\"", "d");
    }

    @Test
    @DisplayName("firstToken returns the leading word")
    void firstToken() {
        assertEquals("logger", ListAppender.firstToken("  logger *slog.Logger"));
    }
}
