package com.specforge.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Slugs}.
 */
class SlugsTest {

    @Test
    void slugify_collapsesPunctuationAndCase() {
        assertThat(Slugs.slugify("Example Name")).isEqualTo("example-name");
        assertThat(Slugs.slugify("  CSV Export: v2!  ")).isEqualTo("csv-export-v2");
        assertThat(Slugs.slugify("???")).isEmpty();
        assertThat(Slugs.slugify(null)).isEmpty();
    }

    @Test
    void sectionKey_normalizesHeadings() {
        assertThat(Slugs.sectionKey("Functional Requirements")).isEqualTo("functional_requirements");
        assertThat(Slugs.sectionKey("Risks & Mitigations")).isEqualTo("risks_and_mitigations");
        assertThat(Slugs.sectionKey("## Level 3: Technical Context ##")).isEqualTo("level_3_technical_context");
    }
}
