package com.syntegra.assessment.scheduler;

import com.syntegra.assessment.BaseUnitTest;
import com.syntegra.assessment.modules.auth.AuthSessionService;
import com.syntegra.assessment.modules.session.TestSessionService;
import com.syntegra.assessment.modules.stats.UserPerformanceStatsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("SessionStatisticsScheduler")
class SessionStatisticsSchedulerTest extends BaseUnitTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    @Mock private TestSessionService sessionService;
    @Mock private UserPerformanceStatsService statsService;
    @Mock private AuthSessionService authSessionService;
    @Mock private TaskScheduler taskScheduler;
    @Mock private Clock clock;

    private SessionStatisticsScheduler scheduler(boolean enabled) {
        return new SessionStatisticsScheduler(sessionService, statsService, authSessionService, taskScheduler,
                clock, enabled, Duration.ofMinutes(3), Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("runs every job and reports their counts")
    void runsAllJobs() {
        when(clock.instant()).thenReturn(T0);
        when(sessionService.expireSessions(T0)).thenReturn(2);
        when(sessionService.activateSessions(T0)).thenReturn(1);
        when(statsService.recalculateAll()).thenReturn(40);
        when(authSessionService.cleanup()).thenReturn(7);

        SchedulerRunReport report = scheduler(true).run(SchedulerRunReport.RunTrigger.SCHEDULED);

        assertThat(report.isSkipped()).isFalse();
        assertThat(report.getSessionsExpired()).isEqualTo(2);
        assertThat(report.getSessionsActivated()).isEqualTo(1);
        assertThat(report.getStatsRowsUpdated()).isEqualTo(40);
        assertThat(report.getAuthSessionsRemoved()).isEqualTo(7);
        assertThat(report.getFailedJobs()).isEmpty();
        assertThat(report.getStartedAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("a failing job is reported and the remaining jobs still run")
    void isolatesFailures() {
        when(clock.instant()).thenReturn(T0);
        when(sessionService.expireSessions(T0)).thenThrow(new IllegalStateException("database unavailable"));
        when(sessionService.activateSessions(T0)).thenReturn(3);
        when(statsService.recalculateAll()).thenThrow(new IllegalStateException("stats failed"));
        when(authSessionService.cleanup()).thenReturn(1);

        SchedulerRunReport report = scheduler(true).run(SchedulerRunReport.RunTrigger.MANUAL);

        assertThat(report.getFailedJobs()).containsExactly(
                SessionStatisticsScheduler.EXPIRE_SESSIONS, SessionStatisticsScheduler.PERFORMANCE_STATS);
        assertThat(report.getSessionsExpired()).isNull();
        assertThat(report.getSessionsActivated()).isEqualTo(3);
        assertThat(report.getStatsRowsUpdated()).isNull();
        assertThat(report.getAuthSessionsRemoved()).isEqualTo(1);
    }

    @Test
    @DisplayName("a timed run inside the minimum interval is skipped")
    void skipsTooFrequentRuns() {
        when(clock.instant()).thenReturn(T0, T0, T0.plus(Duration.ofMinutes(3)));
        SessionStatisticsScheduler scheduler = scheduler(true);

        scheduler.run(SchedulerRunReport.RunTrigger.SCHEDULED);
        SchedulerRunReport second = scheduler.run(SchedulerRunReport.RunTrigger.SCHEDULED);

        assertThat(second.isSkipped()).isTrue();
        verify(sessionService, times(1)).expireSessions(any());
        verify(statsService, times(1)).recalculateAll();
    }

    @Test
    @DisplayName("manual runs ignore the minimum interval")
    void manualRunBypassesGuard() {
        when(clock.instant()).thenReturn(T0, T0, T0.plus(Duration.ofMinutes(1)));
        SessionStatisticsScheduler scheduler = scheduler(true);

        scheduler.run(SchedulerRunReport.RunTrigger.SCHEDULED);
        SchedulerRunReport manual = scheduler.run(SchedulerRunReport.RunTrigger.MANUAL);

        assertThat(manual.isSkipped()).isFalse();
        verify(sessionService, times(2)).expireSessions(any());
        verify(authSessionService, times(2)).cleanup();
    }

    @Test
    @DisplayName("start registers a fixed-rate task and stop cancels it")
    @SuppressWarnings("unchecked")
    void lifecycle() {
        ScheduledFuture<Object> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofMinutes(3)));
        SessionStatisticsScheduler scheduler = scheduler(true);

        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();

        scheduler.stop();
        assertThat(scheduler.isRunning()).isFalse();
        verify(future).cancel(false);
    }

    @Test
    @DisplayName("a disabled scheduler never registers a task")
    void disabled() {
        SessionStatisticsScheduler scheduler = scheduler(false);

        scheduler.start();

        assertThat(scheduler.isRunning()).isFalse();
        verifyNoInteractions(taskScheduler);
    }
}
