package com.syntegra.assessment.modules.attempt.dto;

import com.syntegra.assessment.modules.attempt.AttemptStatus;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.Map;

@Data
public class UpdateAttemptRequest {

    private AttemptStatus status;

    @Min(0)
    private Integer questionsAnswered;

    @Min(0)
    private Integer timeSpent;

    private Map<String, Object> browserInfo;
}
