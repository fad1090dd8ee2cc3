package com.syntegra.assessment.modules.stats;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface UserPerformanceStatsRepository extends JpaRepository<UserPerformanceStats, UUID> {

    @Query("SELECT new com.syntegra.assessment.modules.stats.AttemptOutcome("
            + "a.userId, a.status, a.timeSpent, a.startTime, r.rawScore, r.scaledScore) "
            + "FROM TestAttempt a LEFT JOIN TestResult r ON r.attemptId = a.id")
    List<AttemptOutcome> findAllAttemptOutcomes();

    Page<UserPerformanceStats> findAllByOrderByPerformanceRankAsc(Pageable pageable);
}
