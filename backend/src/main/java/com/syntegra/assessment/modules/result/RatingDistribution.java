package com.syntegra.assessment.modules.result;

/**
 * Counts of 1..5 ratings across an attempt. With no ratings the dominant
 * rating is the neutral 3.
 */
final class RatingDistribution {

    static final int MIN_RATING = 1;
    static final int MAX_RATING = 5;
    private static final int NEUTRAL_RATING = 3;

    private final int[] counts = new int[MAX_RATING + 1];
    private int total;

    static boolean isValid(Integer rating) {
        return rating != null && rating >= MIN_RATING && rating <= MAX_RATING;
    }

    void add(int rating) {
        counts[rating]++;
        total++;
    }

    int total() {
        return total;
    }

    /** Most frequent rating; ties go to the lower rating. */
    int dominantRating() {
        int best = NEUTRAL_RATING;
        int bestCount = 0;
        for (int rating = MIN_RATING; rating <= MAX_RATING; rating++) {
            if (counts[rating] > bestCount) {
                best = rating;
                bestCount = counts[rating];
            }
        }
        return best;
    }

    int dominantCount() {
        return counts[dominantRating()];
    }
}
