package com.syntegra.assessment.modules.answer;

import com.syntegra.assessment.modules.scoring.ScoreResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Upserts one answer row per (user, question, attempt) in its own
 * transaction. A unique-key clash from a concurrent first insert surfaces
 * as {@link org.springframework.dao.DataIntegrityViolationException} and
 * leaves the caller's transaction usable for a retry.
 */
@Component
@RequiredArgsConstructor
public class AnswerWriter {

    private final AnswerRepository answerRepository;

    /** {@code score} is null for drafts. */
    public record AnswerWrite(
            UUID userId,
            UUID attemptId,
            UUID questionId,
            String answer,
            Map<String, Object> answerData,
            ScoreResult score,
            Integer timeTaken,
            Integer confidenceLevel,
            Instant writtenAt) {
    }

    public record Outcome(Answer answer, boolean created) {
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Outcome upsert(AnswerWrite write) {
        Answer existing = answerRepository
                .findByUserIdAndQuestionIdAndAttemptId(write.userId(), write.questionId(), write.attemptId())
                .orElse(null);
        Answer answer = existing != null ? existing : Answer.builder()
                .userId(write.userId())
                .questionId(write.questionId())
                .attemptId(write.attemptId())
                .build();

        // Last write wins: every mutable column is replaced
        answer.setAnswer(write.answer());
        answer.setAnswerData(write.answerData());
        answer.setScore(write.score() != null ? write.score().score() : null);
        answer.setIsCorrect(write.score() != null ? write.score().isCorrect() : null);
        answer.setTimeTaken(write.timeTaken());
        answer.setConfidenceLevel(write.confidenceLevel());
        answer.setAnsweredAt(write.writtenAt());
        answer.setUpdatedAt(write.writtenAt());

        return new Outcome(answerRepository.saveAndFlush(answer), existing == null);
    }
}
