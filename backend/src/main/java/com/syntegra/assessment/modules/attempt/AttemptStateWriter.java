package com.syntegra.assessment.modules.attempt;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Attempt writes that must commit independently of the calling request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttemptStateWriter {

    private final TestAttemptRepository attemptRepository;

    /**
     * Lazily expires an attempt whose window has closed. Runs in its own
     * transaction (REQUIRES_NEW) so the expiry is kept even when the request
     * that observed it is then rejected and rolled back.
     *
     * @return {@code true} if this call flipped the attempt to EXPIRED
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean expireIfOverdue(UUID attemptId, Instant now) {
        int updated = attemptRepository.expireIfOverdue(attemptId, now, AttemptStatus.openStatuses(),
                AttemptStatus.EXPIRED);
        if (updated > 0) {
            log.info("Attempt {} expired lazily at {}", attemptId, now);
        }
        return updated > 0;
    }

    /** Expires every overdue open attempt of one participant before a listing. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int expireOverdueForUser(UUID userId, Instant now) {
        int updated = attemptRepository.expireOverdueForUser(userId, now, AttemptStatus.openStatuses(),
                AttemptStatus.EXPIRED);
        if (updated > 0) {
            log.info("Expired {} overdue attempts of user {} at {}", updated, userId, now);
        }
        return updated;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int expireOverdueForSession(UUID sessionId, Instant now) {
        int updated = attemptRepository.expireOverdueForSession(sessionId, now, AttemptStatus.openStatuses(),
                AttemptStatus.EXPIRED);
        if (updated > 0) {
            log.info("Expired {} overdue attempts in session {} at {}", updated, sessionId, now);
        }
        return updated;
    }

    /**
     * Inserts a new attempt in its own transaction. A concurrent start for the
     * same (user, test, session) surfaces as a DataIntegrityViolationException
     * without poisoning the caller's transaction.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public TestAttempt insert(TestAttempt attempt) {
        return attemptRepository.saveAndFlush(attempt);
    }
}
