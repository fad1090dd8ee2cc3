package com.syntegra.assessment.modules.scoring;

import com.syntegra.assessment.modules.catalog.AssessmentTest;
import com.syntegra.assessment.modules.catalog.Question;
import com.syntegra.assessment.modules.catalog.QuestionType;
import com.syntegra.assessment.modules.scoring.key.ScoringKey;
import com.syntegra.assessment.modules.scoring.key.ScoringKeyNormalizer;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Question metadata needed to score a response, detached from persistence.
 */
public record ScoringContext(
        QuestionType type,
        String correctAnswer,
        List<Question.QuestionOption> options,
        ScoringKey scoringKey,
        boolean personalityClass) {

    public ScoringContext {
        options = options == null ? List.of() : List.copyOf(options);
    }

    public static ScoringContext of(Question question, AssessmentTest test) {
        return new ScoringContext(
                question.getType(),
                question.getCorrectAnswer(),
                question.getOptions(),
                ScoringKeyNormalizer.normalize(question.getType(), question.getScoringKey()),
                test.isPersonalityClass());
    }

    public Optional<Question.QuestionOption> findOption(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return options.stream()
                .filter(option -> value.equals(option.getValue()))
                .findFirst();
    }

    public Optional<BigDecimal> optionScore(String value) {
        return findOption(value).map(Question.QuestionOption::getScore);
    }
}
