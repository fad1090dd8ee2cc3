package com.syntegra.assessment.modules.attempt;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Every state-changing query re-asserts the status it expects in its WHERE
 * clause and bumps the version; a caller that lost a race sees zero rows.
 */
@Repository
public interface TestAttemptRepository extends JpaRepository<TestAttempt, UUID>,
        JpaSpecificationExecutor<TestAttempt> {

    List<TestAttempt> findByUserIdAndTestIdAndSessionIdAndStatusInOrderByStartTimeDesc(
            UUID userId, UUID testId, UUID sessionId, Collection<AttemptStatus> statuses);

    List<TestAttempt> findByUserIdAndTestIdAndSessionIdIsNullAndStatusInOrderByStartTimeDesc(
            UUID userId, UUID testId, Collection<AttemptStatus> statuses);

    @Query("SELECT COALESCE(MAX(a.attemptNumber), 0) FROM TestAttempt a " +
            "WHERE a.userId = :userId AND a.testId = :testId AND a.sessionId = :sessionId")
    int findMaxAttemptNumber(@Param("userId") UUID userId, @Param("testId") UUID testId,
            @Param("sessionId") UUID sessionId);

    @Query("SELECT COALESCE(MAX(a.attemptNumber), 0) FROM TestAttempt a " +
            "WHERE a.userId = :userId AND a.testId = :testId AND a.sessionId IS NULL")
    int findMaxAttemptNumberWithoutSession(@Param("userId") UUID userId, @Param("testId") UUID testId);

    @Query("SELECT a.status, COUNT(a) FROM TestAttempt a WHERE a.userId = :userId GROUP BY a.status")
    List<Object[]> countByStatusForUser(@Param("userId") UUID userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TestAttempt a SET a.status = :expired, a.actualEndTime = :now, a.updatedAt = :now, " +
            "a.version = a.version + 1 " +
            "WHERE a.id = :id AND a.status IN :open AND a.endTime < :now")
    int expireIfOverdue(@Param("id") UUID id,
            @Param("now") Instant now,
            @Param("open") Collection<AttemptStatus> open,
            @Param("expired") AttemptStatus expired);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TestAttempt a SET a.status = :expired, a.actualEndTime = :now, a.updatedAt = :now, " +
            "a.version = a.version + 1 " +
            "WHERE a.userId = :userId AND a.status IN :open AND a.endTime < :now")
    int expireOverdueForUser(@Param("userId") UUID userId,
            @Param("now") Instant now,
            @Param("open") Collection<AttemptStatus> open,
            @Param("expired") AttemptStatus expired);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TestAttempt a SET a.status = :expired, a.actualEndTime = :now, a.updatedAt = :now, " +
            "a.version = a.version + 1 " +
            "WHERE a.sessionId = :sessionId AND a.status IN :open AND a.endTime < :now")
    int expireOverdueForSession(@Param("sessionId") UUID sessionId,
            @Param("now") Instant now,
            @Param("open") Collection<AttemptStatus> open,
            @Param("expired") AttemptStatus expired);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TestAttempt a SET a.status = :next, a.questionsAnswered = :answered, " +
            "a.timeSpent = :timeSpent, a.actualEndTime = :actualEndTime, a.updatedAt = :now, " +
            "a.version = a.version + 1 " +
            "WHERE a.id = :id AND a.status = :expected AND a.endTime >= :now")
    int applyUpdate(@Param("id") UUID id,
            @Param("expected") AttemptStatus expected,
            @Param("next") AttemptStatus next,
            @Param("answered") int answered,
            @Param("timeSpent") Integer timeSpent,
            @Param("actualEndTime") Instant actualEndTime,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TestAttempt a SET a.status = :next, a.questionsAnswered = :answered, " +
            "a.timeSpent = :timeSpent, a.actualEndTime = :now, a.updatedAt = :now, " +
            "a.version = a.version + 1 " +
            "WHERE a.id = :id AND a.status = :expected")
    int applyFinish(@Param("id") UUID id,
            @Param("expected") AttemptStatus expected,
            @Param("next") AttemptStatus next,
            @Param("answered") int answered,
            @Param("timeSpent") Integer timeSpent,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TestAttempt a SET a.questionsAnswered = :answered, a.updatedAt = :now, " +
            "a.version = a.version + 1 " +
            "WHERE a.id = :id AND a.status IN :open")
    int updateAnsweredCount(@Param("id") UUID id,
            @Param("answered") int answered,
            @Param("open") Collection<AttemptStatus> open,
            @Param("now") Instant now);
}
