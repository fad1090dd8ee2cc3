package com.syntegra.assessment.modules.catalog;

public enum ModuleType {
    INTELLIGENCE, PERSONALITY, APTITUDE, INTEREST, PROJECTIVE, COGNITIVE
}
