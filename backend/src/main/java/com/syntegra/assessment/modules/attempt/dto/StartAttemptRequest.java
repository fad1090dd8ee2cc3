package com.syntegra.assessment.modules.attempt.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.Map;
import java.util.UUID;

@Data
public class StartAttemptRequest {

    @NotNull(message = "Test id is required")
    private UUID testId;

    @Size(max = 50)
    private String sessionCode;

    private Map<String, Object> browserInfo;
}
