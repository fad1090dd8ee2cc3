package com.syntegra.assessment.modules.attempt.dto;

import com.syntegra.assessment.modules.attempt.AttemptStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class AttemptDto {
    private UUID id;
    private UUID userId;
    private UUID testId;
    private String testName;
    private UUID sessionId;
    private AttemptStatus status;
    private Instant startTime;
    private Instant endTime;
    private Instant actualEndTime;
    private Integer questionsAnswered;
    private Integer totalQuestions;
    private Integer attemptNumber;
    private Integer timeSpent;
    private Long timeRemaining;
    private Integer progressPercentage;
    private Boolean canContinue;
    private Boolean isExpired;
    private Instant createdAt;
    private Instant updatedAt;
}
