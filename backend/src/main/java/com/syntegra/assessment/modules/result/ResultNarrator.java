package com.syntegra.assessment.modules.result;

import com.syntegra.assessment.modules.catalog.ModuleType;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Deterministic result text. The same inputs always yield the same strings,
 * so recomputing an unchanged attempt leaves the stored result untouched.
 */
final class ResultNarrator {

    private ResultNarrator() {
    }

    static String describeCognitive(BigDecimal completion, BigDecimal scaledScore, Grade grade) {
        return "Test completed with " + whole(completion) + "% completion rate. "
                + "Scored " + whole(scaledScore) + " out of 100 (" + (grade != null ? grade.name() : "N/A") + ").";
    }

    static String describePersonality(BigDecimal completion, RatingDistribution distribution) {
        int share = distribution.total() == 0
                ? 0
                : Math.round(distribution.dominantCount() * 100f / distribution.total());
        return "Test completed with " + whole(completion) + "% completion rate. "
                + "Most responses in rating " + distribution.dominantRating() + " (" + share + "% of answers).";
    }

    static String recommendCognitive(BigDecimal scaledScore, boolean passed, ModuleType moduleType) {
        StringBuilder text = new StringBuilder();
        if (!passed) {
            text.append("Performance below the passing threshold. A retest after skill development is "
                    + "recommended, or consider alternative positions.");
        } else if (scaledScore.compareTo(BigDecimal.valueOf(90)) >= 0) {
            text.append("Excellent performance! Consider advanced roles and leadership positions.");
        } else if (scaledScore.compareTo(BigDecimal.valueOf(80)) >= 0) {
            text.append("Good performance. Suitable for the target position with some skill development.");
        } else {
            text.append("Average performance. Additional training is recommended to improve ability.");
        }

        if (moduleType == ModuleType.INTELLIGENCE) {
            text.append(" Consider cognitive training and building problem-solving skills.");
        } else if (moduleType == ModuleType.APTITUDE) {
            text.append(" Focus on skill-specific training and practice in the relevant areas.");
        }
        return text.toString();
    }

    static String recommendPersonality(RatingDistribution distribution) {
        int dominant = distribution.dominantRating();
        String profile;
        if (dominant >= 4) {
            profile = "Strong personality profile detected. Consider leadership roles or positions with high "
                    + "responsibility that use these strengths.";
        } else if (dominant == 3) {
            profile = "Balanced personality profile. Suited to collaborative roles and team-based positions.";
        } else {
            profile = "Introspective personality profile. Consider roles requiring careful analysis and "
                    + "independent work.";
        }
        return profile + " Focus on personality development and self-awareness training to build on strengths.";
    }

    private static String whole(BigDecimal value) {
        return value.setScale(0, RoundingMode.HALF_UP).toPlainString();
    }
}
