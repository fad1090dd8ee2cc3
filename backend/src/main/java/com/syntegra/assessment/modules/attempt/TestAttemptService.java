package com.syntegra.assessment.modules.attempt;

import com.syntegra.assessment.exception.BusinessException;
import com.syntegra.assessment.exception.ErrorKind;
import com.syntegra.assessment.exception.ResourceNotFoundException;
import com.syntegra.assessment.exception.UnauthorizedAccessException;
import com.syntegra.assessment.modules.attempt.dto.*;
import com.syntegra.assessment.modules.catalog.AssessmentTest;
import com.syntegra.assessment.modules.catalog.TestCatalogService;
import com.syntegra.assessment.modules.catalog.TestStatus;
import com.syntegra.assessment.modules.result.TestResultService;
import com.syntegra.assessment.modules.session.SessionModule;
import com.syntegra.assessment.modules.session.TestSessionService;
import com.syntegra.assessment.security.SecurityUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class TestAttemptService {

    private static final Set<AttemptStatus> FINISH_TYPES =
            EnumSet.of(AttemptStatus.COMPLETED, AttemptStatus.ABANDONED, AttemptStatus.EXPIRED);

    private final TestAttemptRepository attemptRepository;
    private final AttemptStateWriter stateWriter;
    private final TestCatalogService catalogService;
    private final TestSessionService sessionService;
    private final TestResultService resultService;
    private final SecurityUtils securityUtils;
    private final Clock clock;

    /**
     * Starts a new attempt, or returns the caller's unexpired open attempt for
     * the same test and session unchanged. A stale open attempt is expired
     * first.
     */
    @Transactional
    public StartAttemptResponse start(StartAttemptRequest request, String ipAddress, String userAgent) {
        UUID userId = securityUtils.getCurrentUserId();
        Instant now = Instant.now(clock);

        AssessmentTest test = catalogService.getTest(request.getTestId());
        if (test.getStatus() != TestStatus.ACTIVE) {
            throw new BusinessException(ErrorKind.TEST_NOT_AVAILABLE, "testId",
                    "Test " + test.getId() + " is not available");
        }

        UUID sessionId = null;
        if (StringUtils.hasText(request.getSessionCode())) {
            sessionId = sessionService.resolveOpenSession(request.getSessionCode().trim(), test.getId(), now).getId();
        }

        Optional<TestAttempt> resumable = resolveOpenAttempt(userId, test.getId(), sessionId, now);
        if (resumable.isPresent()) {
            log.info("Resuming attempt {} for user {} on test {}", resumable.get().getId(), userId, test.getId());
            return StartAttemptResponse.builder()
                    .attempt(toDto(resumable.get(), test, now))
                    .resumed(true)
                    .build();
        }

        int attemptNumber = (sessionId == null
                ? attemptRepository.findMaxAttemptNumberWithoutSession(userId, test.getId())
                : attemptRepository.findMaxAttemptNumber(userId, test.getId(), sessionId)) + 1;

        TestAttempt attempt = TestAttempt.builder()
                .userId(userId)
                .testId(test.getId())
                .sessionId(sessionId)
                .startTime(now)
                .endTime(now.plus(Duration.ofMinutes(test.getTimeLimit())))
                .status(AttemptStatus.STARTED)
                .questionsAnswered(0)
                .totalQuestions(test.getTotalQuestions())
                .attemptNumber(attemptNumber)
                .ipAddress(ipAddress)
                .userAgent(userAgent)
                .browserInfo(request.getBrowserInfo())
                .updatedAt(now)
                .build();

        try {
            attempt = stateWriter.insert(attempt);
        } catch (DataIntegrityViolationException e) {
            // Another request created the open attempt first; hand that one back
            log.info("Concurrent start for user {} on test {}; resuming the winner", userId, test.getId());
            TestAttempt winner = resolveOpenAttempt(userId, test.getId(), sessionId, now)
                    .orElseThrow(() -> e);
            return StartAttemptResponse.builder()
                    .attempt(toDto(winner, test, now))
                    .resumed(true)
                    .build();
        }

        log.info("Attempt {} started: user={} test={} session={} number={}",
                attempt.getId(), userId, test.getId(), sessionId, attemptNumber);
        return StartAttemptResponse.builder()
                .attempt(toDto(attempt, test, now))
                .resumed(false)
                .build();
    }

    @Transactional(readOnly = true)
    public AttemptDto getAttempt(UUID attemptId) {
        Instant now = Instant.now(clock);
        TestAttempt attempt = loadWithLazyExpiry(attemptId, now);
        validateReadAccess(attempt);
        return toDto(attempt, catalogService.getReferencedTest(attempt.getTestId()), now);
    }

    /**
     * Applies a client progress update. Every check runs before the single
     * guarded write, so a rejected request leaves the row untouched.
     */
    @Transactional
    public AttemptDto updateAttempt(UUID attemptId, UpdateAttemptRequest request) {
        Instant now = Instant.now(clock);
        TestAttempt attempt = loadWithLazyExpiry(attemptId, now);
        validateOwner(attempt);
        requireActive(attempt, now);

        AttemptStatus current = attempt.getStatus();
        AttemptStatus next = request.getStatus() != null ? request.getStatus() : current;
        if (request.getStatus() != null && !current.canTransitionTo(next)) {
            throw new BusinessException(ErrorKind.INVALID_STATUS_TRANSITION, "status",
                    "Cannot change attempt status from " + current + " to " + next
                            + "; allowed: " + current.allowedTransitions());
        }
        validateProgress(request.getQuestionsAnswered(), attempt);

        int answered = request.getQuestionsAnswered() != null
                ? request.getQuestionsAnswered()
                : attempt.getQuestionsAnswered();
        Integer timeSpent = request.getTimeSpent() != null ? request.getTimeSpent() : attempt.getTimeSpent();
        Instant actualEnd = next.isTerminal() ? now : attempt.getActualEndTime();

        int updated = attemptRepository.applyUpdate(attemptId, current, next, answered, timeSpent, actualEnd, now);
        if (updated == 0) {
            throw new BusinessException(ErrorKind.ATTEMPT_NOT_ACTIVE,
                    "Attempt " + attemptId + " changed concurrently or its time limit passed");
        }

        TestAttempt saved = findAttempt(attemptId);
        if (request.getBrowserInfo() != null) {
            saved.setBrowserInfo(request.getBrowserInfo());
            saved = attemptRepository.save(saved);
        }
        if (current != next) {
            log.info("Attempt {} moved {} -> {}", attemptId, current, next);
        }
        AssessmentTest test = catalogService.getReferencedTest(saved.getTestId());
        if (next == AttemptStatus.COMPLETED) {
            resultService.calculateOnCompletion(saved, test);
        }
        return toDto(saved, test, now);
    }

    /**
     * Terminates an attempt. An attempt past its end time always finishes as
     * EXPIRED whatever the caller asked for. A COMPLETED attempt without a
     * result gets one calculated before returning.
     */
    @Transactional
    public FinishAttemptResponse finishAttempt(UUID attemptId, FinishAttemptRequest request) {
        Instant now = Instant.now(clock);
        TestAttempt attempt = findAttempt(attemptId);
        validateOwner(attempt);

        if (attempt.getStatus().isTerminal()) {
            throw new BusinessException(ErrorKind.ATTEMPT_NOT_ACTIVE, "status",
                    "Attempt is already " + attempt.getStatus());
        }
        if (!FINISH_TYPES.contains(request.getCompletionType())) {
            throw new BusinessException(ErrorKind.INVALID_STATUS_TRANSITION, "completionType",
                    "Completion type must be one of " + FINISH_TYPES);
        }
        validateProgress(request.getQuestionsAnswered(), attempt);

        AttemptStatus finalStatus = attempt.isOverdue(now) ? AttemptStatus.EXPIRED : request.getCompletionType();
        if (finalStatus != request.getCompletionType()) {
            log.info("Attempt {} finished after its end time; recording EXPIRED instead of {}",
                    attemptId, request.getCompletionType());
        }

        int updated = attemptRepository.applyFinish(attemptId, attempt.getStatus(), finalStatus,
                request.getQuestionsAnswered(), request.getTimeSpent(), now);
        if (updated == 0) {
            throw new BusinessException(ErrorKind.ATTEMPT_NOT_ACTIVE,
                    "Attempt " + attemptId + " was finished concurrently");
        }

        TestAttempt finished = findAttempt(attemptId);
        if (request.getBrowserInfo() != null) {
            finished.setBrowserInfo(request.getBrowserInfo());
            finished = attemptRepository.save(finished);
        }
        AssessmentTest test = catalogService.getReferencedTest(finished.getTestId());

        TestResultService.ResultDto result = null;
        if (finalStatus == AttemptStatus.COMPLETED) {
            result = resultService.calculateOnCompletion(finished, test);
        }
        log.info("Attempt {} finished as {} ({}/{} answered)", attemptId, finalStatus,
                finished.getQuestionsAnswered(), finished.getTotalQuestions());

        return FinishAttemptResponse.builder()
                .attempt(toDto(finished, test, now))
                .completionPercentage(finalCompletion(finished))
                .result(result)
                .nextTest(resolveNextTest(finished))
                .build();
    }

    @Transactional(readOnly = true)
    public AttemptProgressDto getProgress(UUID attemptId) {
        Instant now = Instant.now(clock);
        TestAttempt attempt = loadWithLazyExpiry(attemptId, now);
        validateReadAccess(attempt);
        AssessmentTest test = catalogService.getReferencedTest(attempt.getTestId());

        return AttemptProgressDto.builder()
                .attemptId(attempt.getId())
                .status(attempt.getStatus())
                .startTime(attempt.getStartTime())
                .timeSpent(attempt.getTimeSpent())
                .timeRemaining(AttemptMetrics.timeRemainingSeconds(attempt, now))
                .timeLimit(test.getTimeLimit())
                .questionsAnswered(attempt.getQuestionsAnswered())
                .totalQuestions(attempt.getTotalQuestions())
                .progressPercentage(AttemptMetrics.progressPercentage(attempt))
                .completionRate(AttemptMetrics.progressPercentage(attempt))
                .timeEfficiency(AttemptMetrics.timeEfficiency(attempt, test.getTimeLimit(), now))
                .canContinue(AttemptMetrics.canContinue(attempt, now))
                .isExpired(AttemptMetrics.isExpired(attempt, now))
                .isNearlyExpired(AttemptMetrics.isNearlyExpired(attempt, now))
                .estimatedCompletionTime(AttemptMetrics.estimatedCompletionMinutes(attempt, now))
                .build();
    }

    /** Participants may list their own attempts; admins may list anyone's. */
    @Transactional(readOnly = true)
    public AttemptListResponse getUserAttempts(UUID userId, AttemptStatus status, UUID testId, UUID sessionId,
            Pageable pageable) {
        if (!securityUtils.isAdmin() && !securityUtils.getCurrentUserId().equals(userId)) {
            throw new UnauthorizedAccessException("You can only view your own attempts");
        }
        stateWriter.expireOverdueForUser(userId, Instant.now(clock));
        Page<TestAttempt> page = attemptRepository.findAll(
                AttemptSpecifications.matching(userId, sessionId, testId, status), pageable);

        Map<AttemptStatus, Long> counts = new EnumMap<>(AttemptStatus.class);
        for (AttemptStatus s : AttemptStatus.values()) {
            counts.put(s, 0L);
        }
        for (Object[] row : attemptRepository.countByStatusForUser(userId)) {
            counts.put((AttemptStatus) row[0], (Long) row[1]);
        }

        return toListResponse(page)
                .statusCounts(counts)
                .build();
    }

    @Transactional(readOnly = true)
    public AttemptListResponse getSessionAttempts(UUID sessionId, AttemptStatus status, UUID testId,
            Pageable pageable) {
        stateWriter.expireOverdueForSession(sessionId, Instant.now(clock));
        Page<TestAttempt> page = attemptRepository.findAll(
                AttemptSpecifications.matching(null, sessionId, testId, status), pageable);
        return toListResponse(page)
                .sessionResults(sessionService.getSessionResults(sessionId))
                .build();
    }

    /**
     * Loads an attempt for an answer write by its owner. Terminal and
     * timed-out attempts are rejected with ATTEMPT_NOT_ACTIVE.
     */
    public TestAttempt loadForAnswering(UUID attemptId, Instant now) {
        TestAttempt attempt = loadWithLazyExpiry(attemptId, now);
        validateOwner(attempt);
        requireActive(attempt, now);
        return attempt;
    }

    public TestAttempt loadForReading(UUID attemptId, Instant now) {
        TestAttempt attempt = loadWithLazyExpiry(attemptId, now);
        validateReadAccess(attempt);
        return attempt;
    }

    /** Writes back the recounted number of answered questions while the attempt is still open. */
    @Transactional
    public void recordAnsweredCount(TestAttempt attempt, long answered, Instant now) {
        int total = attempt.getTotalQuestions() == null ? 0 : attempt.getTotalQuestions();
        int count = (int) (total > 0 ? Math.min(answered, total) : answered);
        int updated = attemptRepository.updateAnsweredCount(attempt.getId(), count,
                AttemptStatus.openStatuses(), now);
        if (updated == 0) {
            log.debug("Attempt {} closed before its answered count could be updated", attempt.getId());
        }
    }

    /**
     * Loads an attempt after giving the lazy expiry a chance to run. The
     * expiry commits on its own, so the row read here already reflects it.
     */
    TestAttempt loadWithLazyExpiry(UUID attemptId, Instant now) {
        stateWriter.expireIfOverdue(attemptId, now);
        return findAttempt(attemptId);
    }

    private Optional<TestAttempt> resolveOpenAttempt(UUID userId, UUID testId, UUID sessionId, Instant now) {
        List<TestAttempt> open = sessionId == null
                ? attemptRepository.findByUserIdAndTestIdAndSessionIdIsNullAndStatusInOrderByStartTimeDesc(
                        userId, testId, AttemptStatus.openStatuses())
                : attemptRepository.findByUserIdAndTestIdAndSessionIdAndStatusInOrderByStartTimeDesc(
                        userId, testId, sessionId, AttemptStatus.openStatuses());

        Optional<TestAttempt> live = Optional.empty();
        for (TestAttempt candidate : open) {
            if (candidate.isOverdue(now)) {
                stateWriter.expireIfOverdue(candidate.getId(), now);
            } else if (live.isEmpty()) {
                live = Optional.of(candidate);
            }
        }
        return live;
    }

    private FinishAttemptResponse.NextTest resolveNextTest(TestAttempt attempt) {
        if (attempt.getSessionId() == null) {
            return null;
        }
        Optional<SessionModule> next = sessionService.findNextModule(attempt.getSessionId(), attempt.getTestId());
        if (next.isEmpty()) {
            return null;
        }
        AssessmentTest nextTest = catalogService.getReferencedTest(next.get().getTestId());
        return FinishAttemptResponse.NextTest.builder()
                .id(nextTest.getId())
                .name(nextTest.getName())
                .category(nextTest.getCategory())
                .moduleType(nextTest.getModuleType())
                .sequence(next.get().getSequence())
                .build();
    }

    private BigDecimal finalCompletion(TestAttempt attempt) {
        int answered = attempt.getQuestionsAnswered() == null ? 0 : attempt.getQuestionsAnswered();
        int total = attempt.getTotalQuestions() == null ? 0 : attempt.getTotalQuestions();
        return AttemptMetrics.completionPercentage(answered, total);
    }

    private void requireActive(TestAttempt attempt, Instant now) {
        if (attempt.getStatus().isTerminal()) {
            throw new BusinessException(ErrorKind.ATTEMPT_NOT_ACTIVE, "status",
                    "Attempt is " + attempt.getStatus() + " and can no longer be modified");
        }
        if (attempt.isOverdue(now)) {
            throw new BusinessException(ErrorKind.ATTEMPT_NOT_ACTIVE, "endTime",
                    "Attempt time limit has passed");
        }
    }

    private void validateProgress(Integer questionsAnswered, TestAttempt attempt) {
        if (questionsAnswered != null && questionsAnswered > attempt.getTotalQuestions()) {
            throw new BusinessException(ErrorKind.INVALID_PROGRESS, "questionsAnswered",
                    "Questions answered (" + questionsAnswered + ") exceeds total questions ("
                            + attempt.getTotalQuestions() + ")");
        }
    }

    private void validateReadAccess(TestAttempt attempt) {
        if (!securityUtils.isAdmin() && !securityUtils.getCurrentUserId().equals(attempt.getUserId())) {
            throw new UnauthorizedAccessException("You can only access your own attempts");
        }
    }

    private void validateOwner(TestAttempt attempt) {
        if (!securityUtils.getCurrentUserId().equals(attempt.getUserId())) {
            throw new UnauthorizedAccessException("Only the participant can modify this attempt");
        }
    }

    private TestAttempt findAttempt(UUID attemptId) {
        return attemptRepository.findById(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt", attemptId.toString()));
    }

    private AttemptListResponse.AttemptListResponseBuilder toListResponse(Page<TestAttempt> page) {
        Instant now = Instant.now(clock);
        return AttemptListResponse.builder()
                .attempts(page.getContent().stream().map(a -> toDto(a, null, now)).toList())
                .page(page.getNumber())
                .size(page.getSize())
                .totalElements(page.getTotalElements())
                .totalPages(page.getTotalPages());
    }

    public AttemptDto toDto(TestAttempt a, AssessmentTest test, Instant now) {
        return AttemptDto.builder()
                .id(a.getId())
                .userId(a.getUserId())
                .testId(a.getTestId())
                .testName(test != null ? test.getName() : null)
                .sessionId(a.getSessionId())
                .status(a.getStatus())
                .startTime(a.getStartTime())
                .endTime(a.getEndTime())
                .actualEndTime(a.getActualEndTime())
                .questionsAnswered(a.getQuestionsAnswered())
                .totalQuestions(a.getTotalQuestions())
                .attemptNumber(a.getAttemptNumber())
                .timeSpent(a.getTimeSpent())
                .timeRemaining(AttemptMetrics.timeRemainingSeconds(a, now))
                .progressPercentage(AttemptMetrics.progressPercentage(a))
                .canContinue(AttemptMetrics.canContinue(a, now))
                .isExpired(AttemptMetrics.isExpired(a, now))
                .createdAt(a.getCreatedAt())
                .updatedAt(a.getUpdatedAt())
                .build();
    }
}
