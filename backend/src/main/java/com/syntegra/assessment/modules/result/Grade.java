package com.syntegra.assessment.modules.result;

import java.math.BigDecimal;

/**
 * Letter bands for objectively scored tests. A, B and C have fixed cut-offs;
 * D starts at the test's passing score.
 */
public enum Grade {
    A, B, C, D, E;

    private static final BigDecimal A_CUTOFF = BigDecimal.valueOf(90);
    private static final BigDecimal B_CUTOFF = BigDecimal.valueOf(80);
    private static final BigDecimal C_CUTOFF = BigDecimal.valueOf(70);

    public static Grade of(BigDecimal scaledScore, BigDecimal passingScore) {
        if (scaledScore.compareTo(A_CUTOFF) >= 0) {
            return A;
        }
        if (scaledScore.compareTo(B_CUTOFF) >= 0) {
            return B;
        }
        if (scaledScore.compareTo(C_CUTOFF) >= 0) {
            return C;
        }
        if (scaledScore.compareTo(passingScore) >= 0) {
            return D;
        }
        return E;
    }
}
