package com.syntegra.assessment.modules.stats;

import com.syntegra.assessment.modules.attempt.AttemptStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Builds the ranked per-user snapshot from every attempt. Score figures only
 * consider completed attempts that have a result.
 */
final class PerformanceStatsCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private PerformanceStatsCalculator() {
    }

    static List<UserPerformanceStats> calculate(List<AttemptOutcome> outcomes, Instant calculatedAt) {
        Map<UUID, List<AttemptOutcome>> byUser = new LinkedHashMap<>();
        for (AttemptOutcome outcome : outcomes) {
            byUser.computeIfAbsent(outcome.userId(), id -> new ArrayList<>()).add(outcome);
        }

        List<UserPerformanceStats> rows = new ArrayList<>(byUser.size());
        byUser.forEach((userId, attempts) -> rows.add(summarize(userId, attempts, calculatedAt)));
        rank(rows);
        return rows;
    }

    /** Higher average raw score ranks first; users without scores rank last; ties go by user id. */
    static void rank(List<UserPerformanceStats> rows) {
        rows.sort(Comparator
                .comparing(UserPerformanceStats::getAverageRawScore,
                        Comparator.nullsLast(Comparator.<BigDecimal>reverseOrder()))
                .thenComparing(stats -> stats.getUserId().toString()));
        int n = rows.size();
        for (int i = 0; i < n; i++) {
            int rank = i + 1;
            rows.get(i).setPerformanceRank(rank);
            rows.get(i).setPerformancePercentile(BigDecimal.valueOf(n - rank)
                    .multiply(HUNDRED)
                    .divide(BigDecimal.valueOf(n), 2, RoundingMode.HALF_UP));
        }
    }

    private static UserPerformanceStats summarize(UUID userId, List<AttemptOutcome> attempts, Instant calculatedAt) {
        int completed = 0;
        List<AttemptOutcome> scored = new ArrayList<>();
        long totalTime = 0;
        int timed = 0;
        Instant lastTest = null;

        for (AttemptOutcome attempt : attempts) {
            if (attempt.status() == AttemptStatus.COMPLETED) {
                completed++;
                if (attempt.rawScore() != null && attempt.scaledScore() != null) {
                    scored.add(attempt);
                }
            }
            if (attempt.timeSpent() != null) {
                totalTime += attempt.timeSpent();
                timed++;
            }
            if (attempt.startTime() != null && (lastTest == null || attempt.startTime().isAfter(lastTest))) {
                lastTest = attempt.startTime();
            }
        }

        BigDecimal highest = scored.stream().map(AttemptOutcome::scaledScore)
                .max(Comparator.naturalOrder()).orElse(null);
        BigDecimal lowest = scored.stream().map(AttemptOutcome::scaledScore)
                .min(Comparator.naturalOrder()).orElse(null);

        return UserPerformanceStats.builder()
                .userId(userId)
                .totalTestsTaken(attempts.size())
                .totalTestsCompleted(completed)
                .averageRawScore(average(scored.stream().map(AttemptOutcome::rawScore).toList()))
                .averageScaledScore(average(scored.stream().map(AttemptOutcome::scaledScore).toList()))
                .highestScaledScore(highest)
                .lowestScaledScore(lowest)
                .totalTimeSpent(totalTime)
                .averageTimePerTest(timed == 0 ? null : (int) Math.round((double) totalTime / timed))
                .completionRate(BigDecimal.valueOf(completed)
                        .multiply(HUNDRED)
                        .divide(BigDecimal.valueOf(attempts.size()), 2, RoundingMode.HALF_UP))
                .consistencyScore(consistency(highest, lowest))
                .lastTestDate(lastTest)
                .lastCalculatedAt(calculatedAt)
                .build();
    }

    static BigDecimal consistency(BigDecimal highest, BigDecimal lowest) {
        if (highest == null || lowest == null) {
            return null;
        }
        BigDecimal score = HUNDRED.subtract(highest.subtract(lowest));
        return score.max(BigDecimal.ZERO).min(HUNDRED).setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal average(List<BigDecimal> values) {
        List<BigDecimal> present = values.stream().filter(Objects::nonNull).toList();
        if (present.isEmpty()) {
            return null;
        }
        return present.stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(present.size()), 2, RoundingMode.HALF_UP);
    }
}
