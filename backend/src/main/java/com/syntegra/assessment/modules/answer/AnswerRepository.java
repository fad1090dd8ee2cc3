package com.syntegra.assessment.modules.answer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AnswerRepository extends JpaRepository<Answer, UUID>, JpaSpecificationExecutor<Answer> {

    List<Answer> findByAttemptId(UUID attemptId);

    Optional<Answer> findByAttemptIdAndQuestionId(UUID attemptId, UUID questionId);

    Optional<Answer> findByUserIdAndQuestionIdAndAttemptId(UUID userId, UUID questionId, UUID attemptId);

    @Query("SELECT COUNT(a) FROM Answer a WHERE a.attemptId = :attemptId "
            + "AND (a.answer IS NOT NULL OR a.answerData IS NOT NULL)")
    long countAnswered(@Param("attemptId") UUID attemptId);
}
