package net.agentcharter.application.generation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ArtifactTextNormalizerTest {

    @Test
    void should_UnquoteAndFlatten_When_ShortDescriptionSpansLines() {
        assertThat(ArtifactTextNormalizer.shortDescription("\"Closes  deals\nfast.\""))
            .isEqualTo("Closes deals fast.");
    }

    @Test
    void should_TruncateAtWordBoundary_When_ShortDescriptionTooLong() {
        String longText = "Qualifies inbound leads ".repeat(20);

        String result = ArtifactTextNormalizer.shortDescription(longText);

        assertThat(result).hasSizeLessThanOrEqualTo(ArtifactTextNormalizer.SHORT_DESCRIPTION_MAX_CHARS);
        assertThat(result).endsWith("…");
        assertThat(result).doesNotContain("  ");
    }

    @Test
    void should_LimitWordsAndDropTrailingPunctuation_When_MiniDescriptionVerbose() {
        assertThat(ArtifactTextNormalizer.miniDescription("Sales assistant for enterprise B2B teams worldwide."))
            .isEqualTo("Sales assistant for enterprise B2B");
        assertThat(ArtifactTextNormalizer.miniDescription("'Recruiter.'")).isEqualTo("Recruiter");
    }

    @Test
    void should_DropWholeWords_When_MiniDescriptionExceedsCharacterLimit() {
        assertThat(ArtifactTextNormalizer.miniDescription("Supercalifragilisticexpialidocious extraordinarily"))
            .isEqualTo("Supercalifragilisticexpialidocious");
    }

    @Test
    void should_ReturnEmpty_When_OutputBlank() {
        assertThat(ArtifactTextNormalizer.miniDescription("  ")).isEmpty();
        assertThat(ArtifactTextNormalizer.visualDescription(null)).isEmpty();
    }

    @Test
    void should_KeepSingleParagraph_When_VisualDescriptionHasLineBreaks() {
        assertThat(ArtifactTextNormalizer.visualDescription("Warm brown eyes.\n\nShort silver hair."))
            .isEqualTo("Warm brown eyes. Short silver hair.");
    }
}
