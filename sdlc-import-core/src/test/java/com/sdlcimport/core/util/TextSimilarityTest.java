package com.sdlcimport.core.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link TextSimilarity}.
 */
class TextSimilarityTest {

    @Test
    void firstParagraph_stopsAtBlankLine() {
        assertThat(TextSimilarity.firstParagraph("first line\nsecond line\n\nnarrative"))
            .isEqualTo("first line\nsecond line");
        assertThat(TextSimilarity.firstParagraph(null)).isEmpty();
    }

    @Test
    void similarity_ignoresTemplateVocabularyAndNarrative() {
        String left = "**PostgreSQL** was detected as the database solution based on evidence in 1 file(s): "
            + "docker-compose.yml.\n\nPostgreSQL is the system of record.";
        String right = "**PostgreSQL** was detected as the database solution based on evidence in 1 file(s): "
            + "docker-compose.yml.";

        assertThat(TextSimilarity.similarity(left, right, List.of("database"))).isEqualTo(1.0);
    }

    @Test
    void similarity_differentEvidence_isLow() {
        String left = "Detected in docker-compose.yml and application.properties";
        String right = "Detected in settings.py";

        assertThat(TextSimilarity.similarity(left, right, List.of())).isLessThan(0.5);
    }

    @Test
    void similarity_extraStopWordsRemoveTechnologyNames() {
        String left = "postgresql config/db.yml";
        String right = "postgres config/db.yml";

        assertThat(TextSimilarity.similarity(left, right, List.of("postgresql", "postgres")))
            .isCloseTo(1.0, within(1e-9));
    }

    @Test
    void similarity_bothEmpty_isIdentical() {
        assertThat(TextSimilarity.similarity("", "  ", List.of())).isEqualTo(1.0);
    }
}
