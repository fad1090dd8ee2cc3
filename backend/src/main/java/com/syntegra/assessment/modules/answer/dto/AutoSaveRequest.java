package com.syntegra.assessment.modules.answer.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.Map;
import java.util.UUID;

@Data
public class AutoSaveRequest {

    @NotNull
    private UUID questionId;

    private String answer;

    private Map<String, Object> answerData;

    @Min(0)
    private Integer timeTaken;

    @Min(1)
    @Max(5)
    private Integer confidenceLevel;
}
