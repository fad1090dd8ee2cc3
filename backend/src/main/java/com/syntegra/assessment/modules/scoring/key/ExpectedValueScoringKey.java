package com.syntegra.assessment.modules.scoring.key;

import java.math.BigDecimal;

/** Exact-match key for open response types; a match earns {@code points}. */
public record ExpectedValueScoringKey(Object expected, BigDecimal points) implements ScoringKey {
}
