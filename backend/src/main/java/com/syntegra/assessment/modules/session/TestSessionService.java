package com.syntegra.assessment.modules.session;

import com.syntegra.assessment.exception.BusinessException;
import com.syntegra.assessment.exception.ErrorKind;
import com.syntegra.assessment.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class TestSessionService {

    private final TestSessionRepository sessionRepository;
    private final SessionModuleRepository moduleRepository;
    private final SessionResultRepository sessionResultRepository;

    /**
     * Resolves the session a participant is starting a test under. The session
     * must be active, inside its time window, and list the test as a module.
     */
    @Transactional(readOnly = true)
    public TestSession resolveOpenSession(String sessionCode, UUID testId, Instant now) {
        TestSession session = sessionRepository.findBySessionCode(sessionCode)
                .orElseThrow(() -> new ResourceNotFoundException("Session", sessionCode));

        if (!session.isOpenAt(now)) {
            throw new BusinessException(ErrorKind.SESSION_NOT_ACTIVE, "sessionCode",
                    "Session " + sessionCode + " is not currently active");
        }
        moduleRepository.findBySessionIdAndTestId(session.getId(), testId)
                .orElseThrow(() -> new ResourceNotFoundException("Session module",
                        sessionCode + "/" + testId));
        return session;
    }

    /** Next module after {@code testId} by sequence, if any. */
    @Transactional(readOnly = true)
    public Optional<SessionModule> findNextModule(UUID sessionId, UUID testId) {
        List<SessionModule> modules = moduleRepository.findBySessionIdOrderBySequenceAsc(sessionId);
        for (int i = 0; i < modules.size() - 1; i++) {
            if (modules.get(i).getTestId().equals(testId)) {
                return Optional.of(modules.get(i + 1));
            }
        }
        return Optional.empty();
    }

    @Transactional(readOnly = true)
    public List<SessionResult> getSessionResults(UUID sessionId) {
        return sessionResultRepository.findBySessionId(sessionId);
    }

    @Transactional
    public int expireSessions(Instant now) {
        int count = sessionRepository.expireOverdue(now, SessionStatus.ACTIVE, SessionStatus.EXPIRED);
        if (count > 0) {
            log.info("Expired {} session(s) past their end time", count);
        }
        return count;
    }

    @Transactional
    public int activateSessions(Instant now) {
        int count = sessionRepository.activateDue(now, SessionStatus.DRAFT, SessionStatus.ACTIVE);
        if (count > 0) {
            log.info("Activated {} session(s) whose window opened", count);
        }
        return count;
    }
}
