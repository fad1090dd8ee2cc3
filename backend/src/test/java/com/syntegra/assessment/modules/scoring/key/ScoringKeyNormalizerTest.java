package com.syntegra.assessment.modules.scoring.key;

import com.syntegra.assessment.modules.catalog.QuestionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.ResourceLock;
import org.junit.jupiter.api.parallel.Resources;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ScoringKeyNormalizer")
class ScoringKeyNormalizerTest {

    @Test
    @DisplayName("trait keys are recognised for any type and lower-cased")
    void traitKey() {
        assertThat(ScoringKeyNormalizer.normalize(QuestionType.RATING_SCALE, Map.of("trait", " Dominance ")))
                .isEqualTo(new TraitScoringKey("dominance"));
        assertThat(ScoringKeyNormalizer.normalize(QuestionType.MULTIPLE_CHOICE, Map.of("trait", "openness")))
                .isEqualTo(new TraitScoringKey("openness"));
    }

    @Test
    @DisplayName("expected key defaults to one point")
    void expectedKey() {
        ScoringKey key = ScoringKeyNormalizer.normalize(QuestionType.TEXT, Map.of("expected", "42"));

        assertThat(key).isInstanceOf(ExpectedValueScoringKey.class);
        assertThat(((ExpectedValueScoringKey) key).points()).isEqualByComparingTo("1");
    }

    @Test
    @DisplayName("expected key honours an explicit score")
    void expectedKeyWithScore() {
        ScoringKey key = ScoringKeyNormalizer.normalize(QuestionType.SEQUENCE,
                Map.of("expected", java.util.List.of(1, 2, 3), "score", 4));

        assertThat(((ExpectedValueScoringKey) key).points()).isEqualByComparingTo("4");
    }

    @Test
    @DisplayName("all-numeric map becomes a points key")
    void pointsKey() {
        ScoringKey key = ScoringKeyNormalizer.normalize(QuestionType.TEXT, Map.of("yes", 2, "no", 0.5));

        assertThat(key).isInstanceOf(PointsScoringKey.class);
        assertThat(((PointsScoringKey) key).points())
                .containsEntry("yes", new BigDecimal("2"))
                .containsEntry("no", new BigDecimal("0.5"));
    }

    @Test
    @DisplayName("unknown shapes and choice types normalize to no key")
    void unknownShapes() {
        assertThat(ScoringKeyNormalizer.normalize(QuestionType.TEXT, Map.of("yes", "lots")))
                .isEqualTo(NoScoringKey.INSTANCE);
        assertThat(ScoringKeyNormalizer.normalize(QuestionType.MULTIPLE_CHOICE, Map.of("A", 1)))
                .isEqualTo(NoScoringKey.INSTANCE);
        assertThat(ScoringKeyNormalizer.normalize(QuestionType.TEXT, null))
                .isEqualTo(NoScoringKey.INSTANCE);
    }

    @Test
    @ResourceLock(Resources.LOCALE)
    @DisplayName("trait names lower-case the same way under a Turkish default locale")
    void traitKeyIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(ScoringKeyNormalizer.normalize(QuestionType.RATING_SCALE, Map.of("trait", "INTROVERSION")))
                    .isEqualTo(new TraitScoringKey("introversion"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
