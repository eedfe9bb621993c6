package com.treegen.codegen.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DocFormatterTest {

    @Test
    void testJavadoc() {
        assertThat(DocFormatter.javadoc("First line.\n\nSecond line.", "    ")).isEqualTo("""
                    /**
                     * First line.
                     *
                     * Second line.
                     */
                """);
    }

    @Test
    void testBlankDocumentation() {
        assertThat(DocFormatter.javadoc("  ", "")).isEmpty();
        assertThat(DocFormatter.blockComment(null)).isEmpty();
        assertThat(DocFormatter.summary("")).isEmpty();
    }

    @Test
    void testCommentEndIsEscaped() {
        assertThat(DocFormatter.javadoc("Matches */ in text.", "")).doesNotContain("Matches */");
    }

    @Test
    void testBlockComment() {
        assertThat(DocFormatter.blockComment("Header.")).isEqualTo("/*\n * Header.\n */\n");
    }

    @Test
    void testSummary() {
        assertThat(DocFormatter.summary("A directory. Holds entries.")).isEqualTo("A directory.");
        assertThat(DocFormatter.summary("A   directory\nof files")).isEqualTo("A directory of files");
    }
}
