package com.syntegra.assessment.modules.scoring.key;

public record NoScoringKey() implements ScoringKey {

    public static final NoScoringKey INSTANCE = new NoScoringKey();
}
