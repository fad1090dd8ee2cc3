package com.syntegra.assessment.modules.scoring.key;

/**
 * Normalized form of a question's authored scoring key.
 *
 * @see ScoringKeyNormalizer
 */
public interface ScoringKey {
}
