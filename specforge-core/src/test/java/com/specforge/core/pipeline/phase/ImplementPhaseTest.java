package com.specforge.core.pipeline.phase;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ImplementPhase#extractDiff(String)}.
 */
class ImplementPhaseTest {

    private static final String DIFF = """
        --- a/app.txt
        +++ b/app.txt
        @@ -1,1 +1,1 @@
        -old
        +new
        """;

    @Test
    void extractDiff_fencedBlock_returnsBlockContent() {
        String response = "Sure.\n\n```diff\n" + DIFF + "```\nDone.";

        assertThat(ImplementPhase.extractDiff(response)).isEqualTo(DIFF);
    }

    @Test
    void extractDiff_bareDiff_returnsWholeResponse() {
        assertThat(ImplementPhase.extractDiff(DIFF)).isEqualTo(DIFF);
    }

    @Test
    void extractDiff_skipsNonDiffFences() {
        String response = "```java\nclass A {}\n```\n\n```\n" + DIFF + "```";

        assertThat(ImplementPhase.extractDiff(response)).isEqualTo(DIFF);
    }

    @Test
    void extractDiff_proseOnly_returnsNull() {
        assertThat(ImplementPhase.extractDiff("I could not produce a change.")).isNull();
    }
}
