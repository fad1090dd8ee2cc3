package com.syntegra.assessment.modules.auth;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthSessionService {

    private final AuthSessionRepository authSessionRepository;
    private final Clock clock;

    @Value("${assessment.auth-sessions.inactive-retention:P30D}")
    private Duration inactiveRetention;

    @Transactional(readOnly = true)
    public boolean isUsable(UUID sessionId, UUID userId) {
        return authSessionRepository.isUsable(sessionId, userId, Instant.now(clock));
    }

    /**
     * Deletes expired login sessions, then sessions unused for longer than the
     * retention window.
     *
     * @return total number of rows removed
     */
    @Transactional
    public int cleanup() {
        Instant now = Instant.now(clock);
        int expired = authSessionRepository.deleteExpired(now);
        int inactive = authSessionRepository.deleteInactiveBefore(now.minus(inactiveRetention));
        log.info("Auth session cleanup: {} expired, {} inactive removed", expired, inactive);
        return expired + inactive;
    }
}
