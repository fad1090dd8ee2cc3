package com.syntegra.assessment.modules.scoring.key;

/** Attributes the question's rating to one personality trait. */
public record TraitScoringKey(String trait) implements ScoringKey {
}
