package com.syntegra.assessment.modules.attempt;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum AttemptStatus {
    STARTED, IN_PROGRESS, COMPLETED, ABANDONED, EXPIRED;

    private static final Map<AttemptStatus, Set<AttemptStatus>> TRANSITIONS = new EnumMap<>(AttemptStatus.class);

    static {
        TRANSITIONS.put(STARTED, EnumSet.of(IN_PROGRESS, ABANDONED, EXPIRED));
        TRANSITIONS.put(IN_PROGRESS, EnumSet.of(COMPLETED, ABANDONED, EXPIRED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(AttemptStatus.class));
        TRANSITIONS.put(ABANDONED, EnumSet.noneOf(AttemptStatus.class));
        TRANSITIONS.put(EXPIRED, EnumSet.noneOf(AttemptStatus.class));
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    public boolean canTransitionTo(AttemptStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public Set<AttemptStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public static Set<AttemptStatus> openStatuses() {
        return EnumSet.of(STARTED, IN_PROGRESS);
    }
}
