package com.syntegra.assessment.modules.attempt.dto;

import com.syntegra.assessment.modules.attempt.AttemptStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class AttemptProgressDto {
    private UUID attemptId;
    private AttemptStatus status;
    private Instant startTime;
    private Integer timeSpent;
    /** Seconds. */
    private Long timeRemaining;
    /** Minutes. */
    private Integer timeLimit;
    private Integer questionsAnswered;
    private Integer totalQuestions;
    private Integer progressPercentage;
    private Integer completionRate;
    private Integer timeEfficiency;
    private Boolean canContinue;
    private Boolean isExpired;
    private Boolean isNearlyExpired;
    /** Minutes, or null before the first answer. */
    private Integer estimatedCompletionTime;
}
