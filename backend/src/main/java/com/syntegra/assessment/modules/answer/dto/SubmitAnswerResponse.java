package com.syntegra.assessment.modules.answer.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
public class SubmitAnswerResponse {
    private AnswerDto answer;
    private Boolean isNew;
    private BigDecimal progressPercentage;
    /** Seconds. */
    private long timeRemaining;
    private NextQuestion nextQuestion;

    @Data
    @Builder
    public static class NextQuestion {
        private UUID id;
        private Integer sequence;
    }
}
