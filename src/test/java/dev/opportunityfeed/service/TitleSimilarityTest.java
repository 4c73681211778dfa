package dev.opportunityfeed.service;

import dev.opportunityfeed.entity.Opportunity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TitleSimilarityTest {

    private static Opportunity stored(long id, String title) {
        return Opportunity.builder().id(id).title(title).build();
    }

    @Nested
    @DisplayName("Levenshtein ratio")
    class Levenshtein {

        private final TitleSimilarity similarity = new TitleSimilarity(TitleSimilarity.LEVENSHTEIN, 0.85);

        @Test
        void identicalTitlesIgnoringCaseAndSpacing() {
            assertThat(similarity.score("Backend  Engineer", "backend engineer")).isEqualTo(1.0);
        }

        @Test
        void nearDuplicatesAreSimilar() {
            assertThat(similarity.isSimilar("Software Engineering Intern", "Software Engineer Intern")).isTrue();
        }

        @Test
        void differentRolesAreNot() {
            assertThat(similarity.isSimilar("Backend Engineer", "Product Designer")).isFalse();
        }

        @Test
        void ratioIsOneMinusDistanceOverLongest() {
            assertThat(TitleSimilarity.levenshteinRatio("abcd", "abcx")).isCloseTo(0.75, within(0.0001));
        }

        @Test
        void blankTitlesScoreZero() {
            assertThat(similarity.score("", "Backend Engineer")).isZero();
            assertThat(similarity.score(null, null)).isZero();
        }

        @Test
        @DisplayName("Should pick the most similar record above the threshold")
        void bestMatch() {
            List<Opportunity> records = List.of(
                    stored(1, "Data Analyst"),
                    stored(2, "Software Engineer Intern"),
                    stored(3, "Software Engineer"));

            assertThat(similarity.bestMatch("Software Engineering Intern", records))
                    .get()
                    .extracting(Opportunity::getId)
                    .isEqualTo(2L);
            assertThat(similarity.bestMatch("Chef", records)).isEmpty();
            assertThat(similarity.bestMatch("Chef", List.of())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Token overlap")
    class TokenOverlap {

        private final TitleSimilarity similarity = new TitleSimilarity(TitleSimilarity.TOKEN_OVERLAP, 0.8);

        @Test
        void containmentCountsAsMatch() {
            assertThat(similarity.score("Backend Engineer", "Senior Backend Engineer")).isEqualTo(1.0);
        }

        @Test
        void partialOverlap() {
            assertThat(TitleSimilarity.tokenOverlap("java backend engineer", "python backend engineer"))
                    .isCloseTo(2.0 / 3.0, within(0.0001));
            assertThat(similarity.isSimilar("java backend engineer", "python backend engineer")).isFalse();
        }
    }
}
