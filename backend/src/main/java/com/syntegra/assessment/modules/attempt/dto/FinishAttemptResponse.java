package com.syntegra.assessment.modules.attempt.dto;

import com.syntegra.assessment.modules.catalog.ModuleType;
import com.syntegra.assessment.modules.catalog.TestCategory;
import com.syntegra.assessment.modules.result.TestResultService;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
public class FinishAttemptResponse {
    private AttemptDto attempt;
    private BigDecimal completionPercentage;
    private TestResultService.ResultDto result;
    private NextTest nextTest;

    @Data
    @Builder
    public static class NextTest {
        private UUID id;
        private String name;
        private TestCategory category;
        private ModuleType moduleType;
        private Integer sequence;
    }
}
