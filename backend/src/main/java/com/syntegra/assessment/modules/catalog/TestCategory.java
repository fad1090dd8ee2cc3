package com.syntegra.assessment.modules.catalog;

public enum TestCategory {
    WAIS, MBTI, WARTEGG, RIASEC, KRAEPELIN, PAULI, BIG_FIVE, PAPI_KOSTICK, DAP, RAVEN, EPPS,
    ARMY_ALPHA, HTP, DISC, IQ, EQ;

    /** Categories scored as trait profiles rather than right/wrong. */
    public boolean isPersonalityInventory() {
        return this == MBTI || this == BIG_FIVE || this == DISC || this == EPPS;
    }
}
