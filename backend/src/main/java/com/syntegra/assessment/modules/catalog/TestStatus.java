package com.syntegra.assessment.modules.catalog;

public enum TestStatus {
    ACTIVE, INACTIVE, ARCHIVED
}
