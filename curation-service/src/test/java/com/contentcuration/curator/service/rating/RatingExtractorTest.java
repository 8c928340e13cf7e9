package com.contentcuration.curator.service.rating;

import com.contentcuration.curator.dto.RatingResult;
import com.contentcuration.curator.entity.Rating;
import com.contentcuration.curator.exception.RatingParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RatingExtractorTest {

    private final RatingExtractor extractor = new RatingExtractor(500);

    @Test
    @DisplayName("Tier label with bulleted explanation")
    void primaryPatternWithBulletedExplanation() {
        // given
        String output = "B Tier: (Consume Original When Time Allows)\n\nExplanation:\n- point one\n- point two";

        // when
        RatingResult result = extractor.extract(output);

        // then
        assertThat(result.rating()).isEqualTo(Rating.B);
        assertThat(result.reasoning()).isEqualTo("point one point two");
    }

    @Test
    @DisplayName("Explanation ends at the next section label")
    void explanationStopsAtSectionLabel() {
        // given
        String output = String.join("\n",
                "ONE-SENTENCE-SUMMARY: A talk about compilers.",
                "",
                "S Tier: (Must Consume Original Content Immediately)",
                "",
                "Explanation:",
                "- Deep dive into parsing",
                "* Practical examples",
                "",
                "CONTENT SCORE: 92",
                "LABELS: compilers, parsing");

        // when
        RatingResult result = extractor.extract(output);

        // then
        assertThat(result.rating()).isEqualTo(Rating.S);
        assertThat(result.reasoning()).isEqualTo("Deep dive into parsing Practical examples");
    }

    @Test
    @DisplayName("Explicit RATING label is used when no tier label exists")
    void fallbackPattern() {
        // given
        String output = "Explanation:\nSolid but not essential.\n\nRATING: A";

        // when
        RatingResult result = extractor.extract(output);

        // then
        assertThat(result.rating()).isEqualTo(Rating.A);
        assertThat(result.reasoning()).isEqualTo("Solid but not essential.");
    }

    @Test
    @DisplayName("Tier label wins over RATING label")
    void primaryTakesPrecedence() {
        String output = "RATING: D\nC Tier: (Maybe Skip It)";

        assertThat(extractor.extract(output).rating()).isEqualTo(Rating.C);
    }

    @Test
    @DisplayName("Tier description is the reasoning when there is no explanation")
    void tierDescriptionFallback() {
        RatingResult result = extractor.extract("A Tier: (Should Consume Original Content)");

        assertThat(result.rating()).isEqualTo(Rating.A);
        assertThat(result.reasoning()).isEqualTo("Should Consume Original Content");
    }

    @Test
    @DisplayName("Placeholder reasoning when neither explanation nor description exists")
    void placeholderReasoning() {
        RatingResult result = extractor.extract("RATING: D");

        assertThat(result.rating()).isEqualTo(Rating.D);
        assertThat(result.reasoning()).isEqualTo(RatingExtractor.NO_EXPLANATION);
    }

    @Test
    @DisplayName("Reasoning is bounded regardless of output length")
    void truncatesReasoning() {
        // given
        RatingExtractor shortExtractor = new RatingExtractor(10);
        String output = "S Tier:\n\nExplanation:\n" + "x".repeat(50);

        // when
        RatingResult result = shortExtractor.extract(output);

        // then
        assertThat(result.reasoning()).hasSize(10);
    }

    @Test
    @DisplayName("Output without a rating fails with a parse error, never a default")
    void noPatternFails() {
        // given
        String output = "I could not evaluate this content. " + "z".repeat(300);

        // when / then
        assertThatThrownBy(() -> extractor.extract(output))
                .isInstanceOf(RatingParseException.class)
                .satisfies(e -> {
                    RatingParseException parseError = (RatingParseException) e;
                    assertThat(parseError.getErrorCode()).isEqualTo("RATING_PARSE_ERROR");
                    assertThat(parseError.getExcerpt()).hasSize(203).endsWith("...");
                });
    }

    @Test
    @DisplayName("Lowercase or unknown letters are not ratings")
    void rejectsInvalidLetters() {
        assertThatThrownBy(() -> extractor.extract("e Tier: great\nrating: s"))
                .isInstanceOf(RatingParseException.class);
    }

    @Test
    @DisplayName("Blank output is a parse error")
    void blankOutput() {
        assertThatThrownBy(() -> extractor.extract("  "))
                .isInstanceOf(RatingParseException.class);
    }
}
