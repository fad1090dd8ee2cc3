package com.syntegra.assessment.modules.stats;

import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserPerformanceStatsService {

    private final UserPerformanceStatsRepository statsRepository;
    private final Clock clock;

    @Value("${assessment.scheduler.stats-batch-size:500}")
    private int batchSize;

    /**
     * Replaces the whole snapshot in one transaction: readers see either the
     * previous ranking or the new one.
     */
    @Transactional
    public int recalculateAll() {
        Instant now = Instant.now(clock);
        List<UserPerformanceStats> rows = PerformanceStatsCalculator.calculate(
                statsRepository.findAllAttemptOutcomes(), now);

        statsRepository.deleteAllInBatch();
        for (int from = 0; from < rows.size(); from += Math.max(1, batchSize)) {
            statsRepository.saveAll(rows.subList(from, Math.min(from + Math.max(1, batchSize), rows.size())));
            statsRepository.flush();
        }
        log.info("Performance stats rebuilt for {} users", rows.size());
        return rows.size();
    }

    @Transactional(readOnly = true)
    public Page<PerformanceStatsDto> getRanking(Pageable pageable) {
        return statsRepository.findAllByOrderByPerformanceRankAsc(pageable).map(this::toDto);
    }

    private PerformanceStatsDto toDto(UserPerformanceStats s) {
        return PerformanceStatsDto.builder()
                .userId(s.getUserId())
                .totalTestsTaken(s.getTotalTestsTaken())
                .totalTestsCompleted(s.getTotalTestsCompleted())
                .averageRawScore(s.getAverageRawScore())
                .averageScaledScore(s.getAverageScaledScore())
                .highestScaledScore(s.getHighestScaledScore())
                .lowestScaledScore(s.getLowestScaledScore())
                .totalTimeSpent(s.getTotalTimeSpent())
                .averageTimePerTest(s.getAverageTimePerTest())
                .completionRate(s.getCompletionRate())
                .consistencyScore(s.getConsistencyScore())
                .performanceRank(s.getPerformanceRank())
                .performancePercentile(s.getPerformancePercentile())
                .lastTestDate(s.getLastTestDate())
                .lastCalculatedAt(s.getLastCalculatedAt())
                .build();
    }

    @Data
    @Builder
    public static class PerformanceStatsDto {
        private UUID userId;
        private Integer totalTestsTaken;
        private Integer totalTestsCompleted;
        private BigDecimal averageRawScore;
        private BigDecimal averageScaledScore;
        private BigDecimal highestScaledScore;
        private BigDecimal lowestScaledScore;
        private Long totalTimeSpent;
        private Integer averageTimePerTest;
        private BigDecimal completionRate;
        private BigDecimal consistencyScore;
        private Integer performanceRank;
        private BigDecimal performancePercentile;
        private Instant lastTestDate;
        private Instant lastCalculatedAt;
    }
}
