package com.contentcuration.curator.service.transcript;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptNormalizerTest {

    @Test
    @DisplayName("Only immediately adjacent repeated tokens collapse")
    void collapsesAdjacentRepeatsOnly() {
        assertThat(TranscriptNormalizer.normalize(List.of("a a b a"), 100)).isEqualTo("a b a");
        assertThat(TranscriptNormalizer.normalize(List.of("Hello Hello world world world"), 100))
                .isEqualTo("Hello world");
    }

    @Test
    @DisplayName("Repeated phrases are not detected")
    void keepsRepeatedPhrases() {
        assertThat(TranscriptNormalizer.normalize(List.of("so we go so we go"), 100))
                .isEqualTo("so we go so we go");
    }

    @Test
    @DisplayName("Header, timing and metadata lines are dropped")
    void dropsCaptionScaffolding() {
        // given
        List<String> vtt = List.of(
                "WEBVTT",
                "Kind: captions",
                "Language: en",
                "",
                "00:00:00.000 --> 00:00:02.000",
                "welcome to the",
                "00:00:02.000 --> 00:00:04.000",
                "the show",
                "");

        // when
        String result = TranscriptNormalizer.normalize(vtt, 1000);

        // then
        assertThat(result).isEqualTo("welcome to the show");
    }

    @Test
    @DisplayName("Text over the budget is cut to the budget plus the marker")
    void truncatesToBudget() {
        // given
        String text = "alpha beta gamma delta";

        // when
        String result = TranscriptNormalizer.normalize(List.of(text), 10);

        // then
        assertThat(result).isEqualTo("alpha beta" + TranscriptNormalizer.TRUNCATION_MARKER);
        assertThat(result).hasSize(10 + TranscriptNormalizer.TRUNCATION_MARKER.length());
    }

    @Test
    @DisplayName("Text exactly at the budget is left alone")
    void keepsTextAtBudget() {
        assertThat(TranscriptNormalizer.normalize(List.of("abcde"), 5)).isEqualTo("abcde");
    }

    @Test
    @DisplayName("Empty or missing input yields an empty string")
    void emptyInput() {
        assertThat(TranscriptNormalizer.normalize(List.of(), 10)).isEmpty();
        assertThat(TranscriptNormalizer.normalize((List<String>) null, 10)).isEmpty();
        assertThat(TranscriptNormalizer.normalize(List.of("WEBVTT", ""), 10)).isEmpty();
        assertThat(TranscriptNormalizer.normalize("", 10)).isEmpty();
    }

    @Test
    @DisplayName("Whole caption file overload splits lines")
    void normalizesCaptionText() {
        String vtt = "WEBVTT\n\n00:00:01.000 --> 00:00:02.000\nhi hi there\n";

        assertThat(TranscriptNormalizer.normalize(vtt, 100)).isEqualTo("hi there");
    }

    @Test
    @DisplayName("Negative budget is rejected")
    void rejectsNegativeBudget() {
        assertThatThrownBy(() -> TranscriptNormalizer.normalize(List.of("x"), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
