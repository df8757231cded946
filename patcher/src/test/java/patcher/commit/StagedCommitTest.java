package patcher.commit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import patcher.engine.FileRewriter;
import patcher.engine.Rewrite;
import patcher.exceptions.PatchException;
import patcher.files.ContentStore;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@DisplayName("StagedCommit")
class StagedCommitTest {

    @Mock
    private ContentStore store;

    private StagedCommit commit;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        commit = new StagedCommit(new FileRewriter(store));
    }

    private static Rewrite changed(String name) {
        return new Rewrite(Path.of(name), "old", "new", List.of("field:Foo"));
    }

    @Test
    @DisplayName("should require a rewriter")
    void requiresRewriter() {
        assertThatThrownBy(() -> new StagedCommit(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("should stage only changed rewrites and write nothing before commit")
    void stagesChanged() throws Exception {
        commit.stage(changed("a.go"));
        commit.stage(new Rewrite(Path.of("b.go"), "same", "same", List.of()));

        assertThat(commit.pending()).extracting(Rewrite::path).containsExactly(Path.of("a.go"));
        verify(store, never()).write(eq(Path.of("a.go")), anyString());
    }

    @Test
    @DisplayName("should write every staged rewrite on commit")
    void commitsAll() throws Exception {
        commit.stage(changed("a.go"));
        commit.stage(changed("b.go"));

        assertThat(commit.commit()).isEqualTo(2);
        verify(store).write(Path.of("a.go"), "new");
        verify(store).write(Path.of("b.go"), "new");
    }

    @Test
    @DisplayName("should stop at the first failed write")
    void stopsOnFailure() throws Exception {
        doThrow(new IOException("full")).when(store).write(eq(Path.of("b.go")), anyString());
        commit.stage(changed("a.go"));
        commit.stage(changed("b.go"));
        commit.stage(changed("c.go"));

        assertThatThrownBy(() -> commit.commit())
                .isInstanceOf(PatchException.class)
                .hasMessageContaining("Commit aborted after 1 of 3 files")
                .satisfies(e -> assertThat(((PatchException) e).getStage()).isEqualTo("commit"));
        verify(store, never()).write(eq(Path.of("c.go")), anyString());
    }

    @Test
    @DisplayName("should refuse to stage or commit twice after commit")
    void singleUse() throws Exception {
        commit.commit();

        assertThatThrownBy(() -> commit.stage(changed("a.go"))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> commit.commit()).isInstanceOf(IllegalStateException.class);
    }
}
