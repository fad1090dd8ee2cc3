package com.syntegra.assessment.modules.session;

public enum SessionStatus {
    DRAFT, ACTIVE, EXPIRED, COMPLETED, CANCELLED
}
