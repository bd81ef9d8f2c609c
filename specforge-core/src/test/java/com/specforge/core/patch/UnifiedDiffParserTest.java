package com.specforge.core.patch;

import com.specforge.core.error.ErrorCode;
import com.specforge.core.error.PatchRejectedException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link UnifiedDiffParser}.
 */
class UnifiedDiffParserTest {

    private final UnifiedDiffParser parser = new UnifiedDiffParser();

    @Test
    void parse_singleFile_readsHeadersAndHunk() {
        PatchOperation operation = parser.parse("""
            diff --git a/src/app.txt b/src/app.txt
            --- a/src/app.txt
            +++ b/src/app.txt
            @@ -1,3 +1,3 @@
             alpha
            -beta
            +BETA
             gamma
            """);

        assertThat(operation.files()).singleElement().satisfies(file -> {
            assertThat(file.oldPath()).isEqualTo("src/app.txt");
            assertThat(file.targetPath()).isEqualTo("src/app.txt");
            assertThat(file.hunks()).singleElement().satisfies(hunk -> {
                assertThat(hunk.oldStart()).isEqualTo(1);
                assertThat(hunk.lines()).extracting(HunkLine::kind).containsExactly(
                    HunkLine.Kind.CONTEXT, HunkLine.Kind.REMOVE, HunkLine.Kind.ADD, HunkLine.Kind.CONTEXT);
            });
        });
    }

    @Test
    void parse_newAndDeletedFiles_areRecognized() {
        PatchOperation operation = parser.parse("""
            --- /dev/null
            +++ b/notes.txt
            @@ -0,0 +1,1 @@
            +hello
            --- a/old.txt
            +++ /dev/null
            @@ -1,1 +0,0 @@
            -bye
            """);

        assertThat(operation.files()).hasSize(2);
        assertThat(operation.files().get(0).isNewFile()).isTrue();
        assertThat(operation.files().get(0).targetPath()).isEqualTo("notes.txt");
        assertThat(operation.files().get(1).isDeletion()).isTrue();
        assertThat(operation.files().get(1).targetPath()).isEqualTo("old.txt");
    }

    @Test
    void parse_wrongHunkCounts_stopsAtNextHeader() {
        PatchOperation operation = parser.parse("""
            --- a/a.txt
            +++ b/a.txt
            @@ -1,9 +1,9 @@
            -one
            +ONE
            @@ -5,1 +5,1 @@
            -five
            +FIVE
            """);

        assertThat(operation.files().get(0).hunks()).hasSize(2);
        assertThat(operation.files().get(0).hunks().get(0).lines()).hasSize(2);
    }

    @Test
    void parse_escapedNewlines_areUnescaped() {
        PatchOperation operation = parser.parse("--- a/a.txt\\n+++ b/a.txt\\n@@ -1 +1 @@\\n-x\\n+y\\n");

        assertThat(operation.files()).singleElement()
            .satisfies(file -> assertThat(file.hunks().get(0).lines()).hasSize(2));
    }

    @Test
    void parse_missingPlusHeader_reusesOldPath() {
        PatchOperation operation = parser.parse("""
            --- a/a.txt
            @@ -1 +1 @@
            -x
            +y
            """);

        assertThat(operation.files().get(0).newPath()).isEqualTo("a.txt");
    }

    @Test
    void parse_blankInput_returnsEmptyOperation() {
        assertThat(parser.parse("  \n").isEmpty()).isTrue();
    }

    @Test
    void parse_noFileHeaders_throwsMalformed() {
        assertThatThrownBy(() -> parser.parse("just some text\n"))
            .isInstanceOf(PatchRejectedException.class)
            .satisfies(e -> assertThat(((PatchRejectedException) e).getErrorCode()).isEqualTo(ErrorCode.PATCH_MALFORMED));
    }

    @Test
    void parse_invalidHunkHeader_throwsMalformed() {
        assertThatThrownBy(() -> parser.parse("--- a/a.txt\n+++ b/a.txt\n@@ nonsense @@\n-x\n"))
            .isInstanceOf(PatchRejectedException.class)
            .hasMessageContaining("Invalid hunk header");
    }

    @Test
    void parse_hunkLongerThanItsCounts_throwsMalformed() {
        assertThatThrownBy(() -> parser.parse("""
            --- a/a.txt
            +++ b/a.txt
            @@ -1,1 +1,1 @@
             a
            -b
            +c
            """))
            .isInstanceOf(PatchRejectedException.class)
            .hasMessageContaining("more lines than its header declares")
            .satisfies(e -> assertThat(((PatchRejectedException) e).getErrorCode()).isEqualTo(ErrorCode.PATCH_MALFORMED));
    }

    @Test
    void parse_formatPatchSignatureAfterLastHunk_isIgnored() {
        PatchOperation operation = parser.parse("""
            --- a/a.txt
            +++ b/a.txt
            @@ -1 +1 @@
            -x
            +y
            --\s
            2.43.0
            """);

        assertThat(operation.files().get(0).hunks().get(0).lines()).hasSize(2);
    }

    @Test
    void parse_hunkRangeBeyondIntRange_throwsMalformed() {
        assertThatThrownBy(() -> parser.parse("--- a/a.txt\n+++ b/a.txt\n@@ -99999999999,1 +1,1 @@\n-x\n+y\n"))
            .isInstanceOf(PatchRejectedException.class)
            .hasMessageContaining("out of bounds");
    }
}
