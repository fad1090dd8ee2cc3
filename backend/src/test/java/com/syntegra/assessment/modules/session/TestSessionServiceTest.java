package com.syntegra.assessment.modules.session;

import com.syntegra.assessment.BaseUnitTest;
import com.syntegra.assessment.exception.BusinessException;
import com.syntegra.assessment.exception.ErrorKind;
import com.syntegra.assessment.exception.ResourceNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@DisplayName("TestSessionService")
class TestSessionServiceTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock private TestSessionRepository sessionRepository;
    @Mock private SessionModuleRepository moduleRepository;
    @Mock private SessionResultRepository sessionResultRepository;

    @InjectMocks private TestSessionService service;

    private TestSession session(SessionStatus status) {
        return TestSession.builder()
                .id(UUID.randomUUID())
                .sessionCode("HIRE-2025")
                .sessionName("Graduate intake")
                .startTime(NOW.minus(Duration.ofHours(1)))
                .endTime(NOW.plus(Duration.ofHours(1)))
                .status(status)
                .build();
    }

    private SessionModule module(UUID sessionId, UUID testId, int sequence) {
        return SessionModule.builder().sessionId(sessionId).testId(testId).sequence(sequence).build();
    }

    @Test
    @DisplayName("active session that lists the test is resolved")
    void resolvesOpenSession() {
        TestSession active = session(SessionStatus.ACTIVE);
        UUID testId = UUID.randomUUID();
        when(sessionRepository.findBySessionCode("HIRE-2025")).thenReturn(Optional.of(active));
        when(moduleRepository.findBySessionIdAndTestId(active.getId(), testId))
                .thenReturn(Optional.of(module(active.getId(), testId, 1)));

        assertThat(service.resolveOpenSession("HIRE-2025", testId, NOW)).isSameAs(active);
    }

    @Test
    @DisplayName("session still in draft is SESSION_NOT_ACTIVE")
    void draftSession() {
        when(sessionRepository.findBySessionCode("HIRE-2025")).thenReturn(Optional.of(session(SessionStatus.DRAFT)));

        assertThatThrownBy(() -> service.resolveOpenSession("HIRE-2025", UUID.randomUUID(), NOW))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getKind()).isEqualTo(ErrorKind.SESSION_NOT_ACTIVE));
        verifyNoInteractions(moduleRepository);
    }

    @Test
    @DisplayName("test outside the session's modules is NOT_FOUND")
    void testNotInSession() {
        TestSession active = session(SessionStatus.ACTIVE);
        UUID testId = UUID.randomUUID();
        when(sessionRepository.findBySessionCode("HIRE-2025")).thenReturn(Optional.of(active));
        when(moduleRepository.findBySessionIdAndTestId(active.getId(), testId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.resolveOpenSession("HIRE-2025", testId, NOW))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("next module follows the current one by sequence; the last has none")
    void nextModule() {
        UUID sessionId = UUID.randomUUID();
        UUID iq = UUID.randomUUID();
        UUID disc = UUID.randomUUID();
        when(moduleRepository.findBySessionIdOrderBySequenceAsc(sessionId)).thenReturn(List.of(
                module(sessionId, iq, 1), module(sessionId, disc, 2)));

        assertThat(service.findNextModule(sessionId, iq)).get()
                .extracting(SessionModule::getTestId).isEqualTo(disc);
        assertThat(service.findNextModule(sessionId, disc)).isEmpty();
    }

    @Test
    @DisplayName("housekeeping updates re-assert the source status")
    void housekeeping() {
        when(sessionRepository.expireOverdue(NOW, SessionStatus.ACTIVE, SessionStatus.EXPIRED)).thenReturn(2);
        when(sessionRepository.activateDue(NOW, SessionStatus.DRAFT, SessionStatus.ACTIVE)).thenReturn(0);

        assertThat(service.expireSessions(NOW)).isEqualTo(2);
        assertThat(service.activateSessions(NOW)).isZero();
    }
}
