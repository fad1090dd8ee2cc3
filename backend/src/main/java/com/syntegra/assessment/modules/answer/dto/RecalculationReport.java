package com.syntegra.assessment.modules.answer.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class RecalculationReport {
    private UUID attemptId;
    private int totalAnswers;
    private int rescoredAnswers;
    private int updatedAnswers;
    private BigDecimal totalScore;
    private List<Entry> entries;

    @Data
    @Builder
    public static class Entry {
        private UUID questionId;
        private BigDecimal previousScore;
        private BigDecimal newScore;
        private Boolean previousIsCorrect;
        private Boolean newIsCorrect;
        private boolean changed;
    }
}
