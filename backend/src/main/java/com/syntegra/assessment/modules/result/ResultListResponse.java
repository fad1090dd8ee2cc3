package com.syntegra.assessment.modules.result;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class ResultListResponse {
    private List<TestResultService.ResultDto> results;
    private int page;
    private int size;
    private long totalElements;
    private int totalPages;
    private Summary summary;

    /** Aggregates over every result of the user or test, ignoring filters. */
    @Data
    @Builder
    public static class Summary {
        private int totalResults;
        private int passedCount;
        private int failedCount;
        private int uniqueParticipants;
        /** Scaled score where present, raw score otherwise. */
        private BigDecimal averageScore;
        private BigDecimal highestScore;
        private BigDecimal lowestScore;
        private BigDecimal averageCompletion;
        private Map<String, Long> byGrade;
        private Map<String, Long> percentileRanges;
    }
}
