package com.syntegra.assessment.modules.answer;

import com.syntegra.assessment.exception.BusinessException;
import com.syntegra.assessment.exception.ResourceNotFoundException;
import com.syntegra.assessment.modules.answer.dto.*;
import com.syntegra.assessment.modules.attempt.AttemptMetrics;
import com.syntegra.assessment.modules.attempt.TestAttempt;
import com.syntegra.assessment.modules.attempt.TestAttemptService;
import com.syntegra.assessment.modules.catalog.AssessmentTest;
import com.syntegra.assessment.modules.catalog.Question;
import com.syntegra.assessment.modules.catalog.TestCatalogService;
import com.syntegra.assessment.modules.scoring.ScoreResult;
import com.syntegra.assessment.modules.scoring.ScoringContext;
import com.syntegra.assessment.modules.scoring.ScoringEngine;
import com.syntegra.assessment.modules.scoring.payload.AnswerPayload;
import com.syntegra.assessment.security.SecurityUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerService {

    public enum SortField {
        ANSWERED_AT("answeredAt"),
        SEQUENCE("question.sequence");

        private final String property;

        SortField(String property) {
            this.property = property;
        }

        /** Ascending on the field, then on id so pages are stable. */
        public Sort sort() {
            return Sort.by(property).and(Sort.by("id"));
        }
    }

    private final AnswerRepository answerRepository;
    private final AnswerWriter answerWriter;
    private final TestAttemptService attemptService;
    private final TestCatalogService catalogService;
    private final ScoringEngine scoringEngine;
    private final SecurityUtils securityUtils;
    private final Clock clock;

    /**
     * Stores the participant's response. Final submissions are validated
     * against the question type and scored; drafts are stored as given.
     */
    @Transactional
    public SubmitAnswerResponse submit(UUID attemptId, SubmitAnswerRequest request) {
        Instant now = Instant.now(clock);
        TestAttempt attempt = attemptService.loadForAnswering(attemptId, now);
        AssessmentTest test = catalogService.getReferencedTest(attempt.getTestId());
        Question question = catalogService.getQuestionOfTest(request.getQuestionId(), test.getId());

        boolean draft = Boolean.TRUE.equals(request.getIsDraft());
        String answer = blankToNull(request.getAnswer());
        Map<String, Object> answerData = emptyToNull(request.getAnswerData());

        ScoreResult score = null;
        if (!draft) {
            ScoringContext context = ScoringContext.of(question, test);
            AnswerPayload payload = scoringEngine.parse(context, answer, answerData);
            score = scoringEngine.score(payload, context);
        }

        AnswerWriter.Outcome outcome = upsertWithRetry(new AnswerWriter.AnswerWrite(
                attempt.getUserId(), attemptId, question.getId(), answer, answerData, score,
                request.getTimeTaken(), request.getConfidenceLevel(), now));

        int total = attempt.getTotalQuestions() == null ? 0 : attempt.getTotalQuestions();
        int answeredCount = attempt.getQuestionsAnswered() == null ? 0 : attempt.getQuestionsAnswered();
        if (!draft) {
            long answered = answerRepository.countAnswered(attemptId);
            attemptService.recordAnsweredCount(attempt, answered, now);
            answeredCount = (int) answered;
        }
        log.debug("Answer {} for question {} in attempt {} stored (draft={}, new={})",
                outcome.answer().getId(), question.getId(), attemptId, draft, outcome.created());

        List<Question> questions = catalogService.getQuestions(test.getId());
        return SubmitAnswerResponse.builder()
                .answer(toDto(outcome.answer(), question, false))
                .isNew(outcome.created())
                .progressPercentage(AttemptMetrics.completionPercentage(answeredCount, total))
                .timeRemaining(AttemptMetrics.timeRemainingSeconds(attempt, now))
                .nextQuestion(nextUnanswered(questions, answerRepository.findByAttemptId(attemptId)))
                .build();
    }

    /**
     * Stores whatever the client has so far. Content that would fail a final
     * submission is kept anyway and only logged.
     */
    @Transactional
    public AutoSaveResponse autoSave(UUID attemptId, AutoSaveRequest request) {
        Instant now = Instant.now(clock);
        TestAttempt attempt = attemptService.loadForAnswering(attemptId, now);
        AssessmentTest test = catalogService.getReferencedTest(attempt.getTestId());
        Question question = catalogService.getQuestionOfTest(request.getQuestionId(), test.getId());

        String answer = blankToNull(request.getAnswer());
        Map<String, Object> answerData = emptyToNull(request.getAnswerData());
        if (ScoringEngine.hasContent(answer, answerData)) {
            try {
                scoringEngine.parse(ScoringContext.of(question, test), answer, answerData);
            } catch (BusinessException e) {
                log.warn("Auto-save for attempt {} question {} kept content that fails validation: {}",
                        attemptId, question.getId(), e.getMessage());
            }
        }

        AnswerWriter.Outcome outcome = upsertWithRetry(new AnswerWriter.AnswerWrite(
                attempt.getUserId(), attemptId, question.getId(), answer, answerData, null,
                request.getTimeTaken(), request.getConfidenceLevel(), now));

        return AutoSaveResponse.builder()
                .answerId(outcome.answer().getId())
                .isNew(outcome.created())
                .autoSavedAt(now)
                .build();
    }

    @Transactional(readOnly = true)
    public AnswerListResponse getAnswers(UUID attemptId, UUID questionId, Boolean isAnswered,
            Integer confidenceLevel, Pageable pageable) {
        TestAttempt attempt = attemptService.loadForReading(attemptId, Instant.now(clock));
        Map<UUID, Question> questions = catalogService.getQuestionsById(attempt.getTestId());
        boolean admin = securityUtils.isAdmin();

        Page<Answer> page = answerRepository.findAll(
                AnswerSpecifications.matching(attemptId, questionId, isAnswered, confidenceLevel), pageable);

        return AnswerListResponse.builder()
                .answers(page.getContent().stream()
                        .map(a -> toDto(a, questions.get(a.getQuestionId()), admin))
                        .toList())
                .page(page.getNumber())
                .size(page.getSize())
                .totalElements(page.getTotalElements())
                .totalPages(page.getTotalPages())
                .summary(summarize(answerRepository.findByAttemptId(attemptId)))
                .build();
    }

    @Transactional(readOnly = true)
    public AnswerDto getAnswer(UUID attemptId, UUID questionId) {
        TestAttempt attempt = attemptService.loadForReading(attemptId, Instant.now(clock));
        Answer answer = answerRepository.findByAttemptIdAndQuestionId(attemptId, questionId)
                .orElseThrow(() -> new ResourceNotFoundException("Answer for question", questionId.toString()));
        Question question = catalogService.getQuestionsById(attempt.getTestId()).get(questionId);
        return toDto(answer, question, securityUtils.isAdmin());
    }

    /**
     * Re-scores every final answer of an attempt from its stored content and
     * writes back the rows whose score or correctness changed. Drafts stay
     * unscored.
     */
    @Transactional
    public RecalculationReport recalculateScores(UUID attemptId) {
        TestAttempt attempt = attemptService.loadForReading(attemptId, Instant.now(clock));
        AssessmentTest test = catalogService.getReferencedTest(attempt.getTestId());
        Map<UUID, Question> questions = catalogService.getQuestionsById(test.getId());
        List<Answer> answers = answerRepository.findByAttemptId(attemptId);

        List<RecalculationReport.Entry> entries = new ArrayList<>();
        List<Answer> changed = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;

        for (Answer answer : answers) {
            Question question = questions.get(answer.getQuestionId());
            if (question == null || answer.getScore() == null || !answer.hasContent()) {
                continue;
            }
            ScoringContext context = ScoringContext.of(question, test);
            ScoreResult rescored = scoringEngine.score(
                    scoringEngine.parseStored(context, answer.getAnswer(), answer.getAnswerData()), context);
            boolean differs = answer.getScore().compareTo(rescored.score()) != 0
                    || !Objects.equals(answer.getIsCorrect(), rescored.isCorrect());

            entries.add(RecalculationReport.Entry.builder()
                    .questionId(answer.getQuestionId())
                    .previousScore(answer.getScore())
                    .newScore(rescored.score())
                    .previousIsCorrect(answer.getIsCorrect())
                    .newIsCorrect(rescored.isCorrect())
                    .changed(differs)
                    .build());
            total = total.add(rescored.score());

            if (differs) {
                answer.setScore(rescored.score());
                answer.setIsCorrect(rescored.isCorrect());
                answer.setUpdatedAt(Instant.now(clock));
                changed.add(answer);
            }
        }
        answerRepository.saveAll(changed);

        log.info("Re-scored attempt {}: {} answers checked, {} updated", attemptId, entries.size(), changed.size());
        return RecalculationReport.builder()
                .attemptId(attemptId)
                .totalAnswers(answers.size())
                .rescoredAnswers(entries.size())
                .updatedAnswers(changed.size())
                .totalScore(total.setScale(2, RoundingMode.HALF_UP))
                .entries(entries)
                .build();
    }

    private AnswerWriter.Outcome upsertWithRetry(AnswerWriter.AnswerWrite write) {
        try {
            return answerWriter.upsert(write);
        } catch (DataIntegrityViolationException e) {
            // A concurrent request inserted the row first; the retry finds it and updates
            log.info("Concurrent first write for question {} in attempt {}; retrying as update",
                    write.questionId(), write.attemptId());
            return answerWriter.upsert(write);
        }
    }

    private SubmitAnswerResponse.NextQuestion nextUnanswered(List<Question> questions, List<Answer> answers) {
        Set<UUID> answered = answers.stream()
                .filter(Answer::hasContent)
                .map(Answer::getQuestionId)
                .collect(Collectors.toSet());
        return questions.stream()
                .filter(q -> !answered.contains(q.getId()))
                .findFirst()
                .map(q -> SubmitAnswerResponse.NextQuestion.builder()
                        .id(q.getId())
                        .sequence(q.getSequence())
                        .build())
                .orElse(null);
    }

    private AnswerListResponse.Summary summarize(List<Answer> answers) {
        List<Answer> answered = answers.stream().filter(Answer::hasContent).toList();
        List<Integer> times = answers.stream()
                .map(Answer::getTimeTaken)
                .filter(Objects::nonNull)
                .toList();
        List<Integer> confidences = answers.stream()
                .map(Answer::getConfidenceLevel)
                .filter(Objects::nonNull)
                .toList();
        long totalTime = times.stream().mapToLong(Integer::longValue).sum();

        return AnswerListResponse.Summary.builder()
                .totalAnswers(answers.size())
                .answeredCount(answered.size())
                .totalTimeTaken(totalTime)
                .averageTimeTaken(average(totalTime, times.size()))
                .averageConfidence(average(confidences.stream().mapToLong(Integer::longValue).sum(),
                        confidences.size()))
                .build();
    }

    private static BigDecimal average(long sum, int count) {
        if (count == 0) {
            return null;
        }
        return BigDecimal.valueOf(sum).divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static Map<String, Object> emptyToNull(Map<String, Object> value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private AnswerDto toDto(Answer a, Question question, boolean includeCorrectAnswer) {
        return AnswerDto.builder()
                .id(a.getId())
                .attemptId(a.getAttemptId())
                .questionId(a.getQuestionId())
                .questionSequence(question != null ? question.getSequence() : null)
                .questionType(question != null ? question.getType() : null)
                .answer(a.getAnswer())
                .answerData(a.getAnswerData())
                .score(a.getScore())
                .isCorrect(a.getIsCorrect())
                .timeTaken(a.getTimeTaken())
                .confidenceLevel(a.getConfidenceLevel())
                .answeredAt(a.getAnsweredAt())
                .isAnswered(a.hasContent())
                .correctAnswer(includeCorrectAnswer && question != null ? question.getCorrectAnswer() : null)
                .build();
    }
}
