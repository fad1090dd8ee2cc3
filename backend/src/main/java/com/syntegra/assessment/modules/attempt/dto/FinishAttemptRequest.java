package com.syntegra.assessment.modules.attempt.dto;

import com.syntegra.assessment.modules.attempt.AttemptStatus;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.Map;

@Data
public class FinishAttemptRequest {

    @NotNull(message = "Completion type is required")
    private AttemptStatus completionType;

    @NotNull
    @Min(0)
    private Integer questionsAnswered;

    @NotNull
    @Min(0)
    private Integer timeSpent;

    private Map<String, Object> browserInfo;
}
