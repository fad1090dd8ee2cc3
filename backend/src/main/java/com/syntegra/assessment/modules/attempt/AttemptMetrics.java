package com.syntegra.assessment.modules.attempt;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Derived timing and progress figures for an attempt at a given instant.
 */
public final class AttemptMetrics {

    static final long NEARLY_EXPIRED_SECONDS = 300;

    private AttemptMetrics() {
    }

    public static long timeRemainingSeconds(TestAttempt attempt, Instant now) {
        long millis = Duration.between(now, attempt.getEndTime()).toMillis();
        return Math.max(0, Math.floorDiv(millis, 1000));
    }

    public static int progressPercentage(TestAttempt attempt) {
        int total = attempt.getTotalQuestions() == null ? 0 : attempt.getTotalQuestions();
        if (total == 0) {
            return 0;
        }
        return (int) Math.round(answered(attempt) * 100.0 / total);
    }

    public static boolean canContinue(TestAttempt attempt, Instant now) {
        return attempt.isOpen() && !attempt.isOverdue(now);
    }

    public static boolean isExpired(TestAttempt attempt, Instant now) {
        return attempt.getStatus() == AttemptStatus.EXPIRED || (attempt.isOpen() && attempt.isOverdue(now));
    }

    public static boolean isNearlyExpired(TestAttempt attempt, Instant now) {
        long remaining = timeRemainingSeconds(attempt, now);
        return remaining > 0 && remaining <= NEARLY_EXPIRED_SECONDS;
    }

    /** 100 at the start of the window, falling linearly to 0 at the limit. */
    public static int timeEfficiency(TestAttempt attempt, int timeLimitMinutes, Instant now) {
        if (timeLimitMinutes <= 0) {
            return 100;
        }
        double elapsedMinutes = elapsedMinutes(attempt, now);
        return (int) Math.round(Math.max(0, 100 - (elapsedMinutes / timeLimitMinutes) * 100));
    }

    /** Minutes to finish at the current pace, or {@code null} before the first answer. */
    public static Integer estimatedCompletionMinutes(TestAttempt attempt, Instant now) {
        int answered = answered(attempt);
        int total = attempt.getTotalQuestions() == null ? 0 : attempt.getTotalQuestions();
        if (answered == 0 || total == 0) {
            return null;
        }
        double perQuestion = elapsedMinutes(attempt, now) / answered;
        return (int) Math.round(Math.max(0, total - answered) * perQuestion);
    }

    public static BigDecimal completionPercentage(int answered, int total) {
        if (total <= 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        int capped = Math.min(answered, total);
        return BigDecimal.valueOf(capped * 100.0 / total).setScale(2, RoundingMode.HALF_UP);
    }

    private static int answered(TestAttempt attempt) {
        return attempt.getQuestionsAnswered() == null ? 0 : attempt.getQuestionsAnswered();
    }

    private static double elapsedMinutes(TestAttempt attempt, Instant now) {
        return Duration.between(attempt.getStartTime(), now).toMillis() / 60_000.0;
    }
}
