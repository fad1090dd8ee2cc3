package com.syntegra.assessment.modules.result;

import com.syntegra.assessment.modules.answer.Answer;
import com.syntegra.assessment.modules.attempt.AttemptMetrics;
import com.syntegra.assessment.modules.attempt.TestAttempt;
import com.syntegra.assessment.modules.catalog.AssessmentTest;
import com.syntegra.assessment.modules.catalog.Question;
import com.syntegra.assessment.modules.scoring.ScoringContext;
import com.syntegra.assessment.modules.scoring.ScoringEngine;
import com.syntegra.assessment.modules.scoring.key.TraitScoringKey;
import com.syntegra.assessment.modules.scoring.payload.AnswerPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns an attempt's answers into result figures. Every answer is parsed
 * and scored again from its stored content; stored per-answer scores are
 * ignored. Performs no I/O.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final String TRAIT_CATEGORY = "personality";

    private final ScoringEngine scoringEngine;

    public record Computation(
            BigDecimal rawScore,
            BigDecimal scaledScore,
            Integer percentile,
            Grade grade,
            List<TestResult.TraitScore> traits,
            List<String> traitNames,
            String description,
            String recommendations,
            Boolean isPassed,
            BigDecimal completionPercentage) {
    }

    public Computation calculate(TestAttempt attempt, AssessmentTest test, Map<UUID, Question> questions,
            List<Answer> answers, BigDecimal passingScore, boolean includeRecommendations) {
        int total = attempt.getTotalQuestions() == null ? 0 : attempt.getTotalQuestions();
        BigDecimal completion = AttemptMetrics.completionPercentage(
                attempt.getQuestionsAnswered() == null ? 0 : attempt.getQuestionsAnswered(), total);

        if (test.isPersonalityClass() || test.isRatingScale()) {
            return calculateProfile(test, questions, answers, completion, includeRecommendations);
        }
        return calculateCognitive(test, questions, answers, total, completion, passingScore, includeRecommendations);
    }

    /** Maps a 1..5 average onto 0..100. */
    static int traitScore(double average) {
        long score = Math.round(((average - 1) / 4) * 100);
        return (int) Math.max(0, Math.min(100, score));
    }

    private Computation calculateCognitive(AssessmentTest test, Map<UUID, Question> questions, List<Answer> answers,
            int total, BigDecimal completion, BigDecimal passingScore, boolean includeRecommendations) {
        BigDecimal raw = BigDecimal.ZERO;
        for (Answer answer : answers) {
            Question question = questions.get(answer.getQuestionId());
            if (question == null) {
                log.warn("Answer {} refers to question {} outside test {}", answer.getId(),
                        answer.getQuestionId(), test.getId());
                continue;
            }
            ScoringContext context = ScoringContext.of(question, test);
            AnswerPayload payload = scoringEngine.parseStored(context, answer.getAnswer(), answer.getAnswerData());
            if (payload.isEmpty()) {
                continue;
            }
            raw = raw.add(scoringEngine.score(payload, context).score());
        }
        raw = raw.setScale(2, RoundingMode.HALF_UP);

        BigDecimal scaled = total > 0
                ? raw.multiply(HUNDRED).divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO.setScale(2);
        Grade grade = Grade.of(scaled, passingScore);
        boolean passed = scaled.compareTo(passingScore) >= 0;
        int percentile = scaled.min(HUNDRED).setScale(0, RoundingMode.HALF_UP).intValue();

        return new Computation(
                raw,
                scaled,
                percentile,
                grade,
                null,
                null,
                ResultNarrator.describeCognitive(completion, scaled, grade),
                includeRecommendations ? ResultNarrator.recommendCognitive(scaled, passed, test.getModuleType()) : null,
                passed,
                completion);
    }

    private Computation calculateProfile(AssessmentTest test, Map<UUID, Question> questions, List<Answer> answers,
            BigDecimal completion, boolean includeRecommendations) {
        RatingDistribution distribution = new RatingDistribution();
        Map<String, List<Integer>> ratingsByTrait = new HashMap<>();

        for (Answer answer : answers) {
            Question question = questions.get(answer.getQuestionId());
            if (question == null) {
                log.warn("Answer {} refers to question {} outside test {}", answer.getId(),
                        answer.getQuestionId(), test.getId());
                continue;
            }
            ScoringContext context = ScoringContext.of(question, test);
            Integer rating = ScoringEngine.ratingOf(
                    scoringEngine.parseStored(context, answer.getAnswer(), answer.getAnswerData()));
            if (!RatingDistribution.isValid(rating)) {
                continue;
            }
            distribution.add(rating);
            if (context.scoringKey() instanceof TraitScoringKey key) {
                ratingsByTrait.computeIfAbsent(key.trait(), k -> new ArrayList<>()).add(rating);
            }
        }

        List<TestResult.TraitScore> traits = buildTraits(test, ratingsByTrait);
        List<String> traitNames = traits.stream()
                .filter(trait -> trait.getQuestionCount() > 0)
                .sorted(Comparator.comparing(TestResult.TraitScore::getScore).reversed())
                .map(TestResult.TraitScore::getName)
                .toList();

        return new Computation(
                BigDecimal.valueOf(distribution.total()).setScale(2),
                completion,
                null,
                null,
                traits.isEmpty() ? null : traits,
                traits.isEmpty() ? null : traitNames,
                ResultNarrator.describePersonality(completion, distribution),
                includeRecommendations ? ResultNarrator.recommendPersonality(distribution) : null,
                null,
                completion);
    }

    private List<TestResult.TraitScore> buildTraits(AssessmentTest test, Map<String, List<Integer>> ratingsByTrait) {
        List<TestResult.TraitScore> traits = new ArrayList<>();
        for (TraitTaxonomy.TraitDefinition definition : TraitTaxonomy.traitsOf(test.getCategory())) {
            List<Integer> ratings = ratingsByTrait.getOrDefault(definition.key(), List.of());
            double average = ratings.stream().mapToInt(Integer::intValue).average().orElse(0);
            traits.add(TestResult.TraitScore.builder()
                    .name(definition.name())
                    .key(definition.key())
                    .score(ratings.isEmpty() ? 0 : traitScore(average))
                    .description(definition.description())
                    .category(TRAIT_CATEGORY)
                    .rawAverage(Math.round(average * 10) / 10.0)
                    .questionCount(ratings.size())
                    .build());
        }
        return traits;
    }
}
