package com.syntegra.assessment.modules.attempt.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class StartAttemptResponse {
    private AttemptDto attempt;
    /** True when an unexpired open attempt was returned instead of a new one. */
    private boolean resumed;
}
