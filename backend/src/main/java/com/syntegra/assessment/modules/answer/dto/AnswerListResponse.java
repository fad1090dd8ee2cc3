package com.syntegra.assessment.modules.answer.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
public class AnswerListResponse {
    private List<AnswerDto> answers;
    private int page;
    private int size;
    private long totalElements;
    private int totalPages;
    private Summary summary;

    /** Aggregates over every answer of the attempt, ignoring filters. */
    @Data
    @Builder
    public static class Summary {
        private int totalAnswers;
        private int answeredCount;
        private BigDecimal averageTimeTaken;
        private long totalTimeTaken;
        private BigDecimal averageConfidence;
    }
}
