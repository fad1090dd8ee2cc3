package com.syntegra.assessment.scheduler;

import com.syntegra.assessment.modules.auth.AuthSessionService;
import com.syntegra.assessment.modules.session.TestSessionService;
import com.syntegra.assessment.modules.stats.UserPerformanceStatsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.function.IntSupplier;

/**
 * Periodic housekeeping for test sessions: expires and activates sessions,
 * rebuilds participant performance stats and prunes login sessions.
 * <p>
 * Each job runs in its own transaction; one failing job is logged and
 * reported while the rest still run. Timed runs closer together than the
 * minimum interval are skipped; manual runs always execute. Runs never
 * overlap.
 */
@Slf4j
@Component
public class SessionStatisticsScheduler implements SmartLifecycle {

    static final String EXPIRE_SESSIONS = "expire-sessions";
    static final String ACTIVATE_SESSIONS = "activate-sessions";
    static final String PERFORMANCE_STATS = "performance-stats";
    static final String AUTH_SESSION_CLEANUP = "auth-session-cleanup";

    private final TestSessionService sessionService;
    private final UserPerformanceStatsService statsService;
    private final AuthSessionService authSessionService;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final boolean enabled;
    private final Duration interval;
    private final Duration minimumInterval;

    private final Object runLock = new Object();
    private volatile ScheduledFuture<?> scheduledRun;
    private Instant lastRunStartedAt;

    public SessionStatisticsScheduler(
            TestSessionService sessionService,
            UserPerformanceStatsService statsService,
            AuthSessionService authSessionService,
            @Qualifier("statisticsTaskScheduler") TaskScheduler taskScheduler,
            Clock clock,
            @Value("${assessment.scheduler.enabled:true}") boolean enabled,
            @Value("${assessment.scheduler.interval:PT3M}") Duration interval,
            @Value("${assessment.scheduler.minimum-interval:PT5M}") Duration minimumInterval) {
        this.sessionService = sessionService;
        this.statsService = statsService;
        this.authSessionService = authSessionService;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.enabled = enabled;
        this.interval = interval;
        this.minimumInterval = minimumInterval;
    }

    @Override
    public void start() {
        if (!enabled) {
            log.info("Session statistics scheduler disabled");
            return;
        }
        scheduledRun = taskScheduler.scheduleAtFixedRate(
                () -> run(SchedulerRunReport.RunTrigger.SCHEDULED), interval);
        log.info("Session statistics scheduler started: interval={}, minimum interval={}", interval, minimumInterval);
    }

    @Override
    public void stop() {
        ScheduledFuture<?> current = scheduledRun;
        if (current != null) {
            current.cancel(false);
            scheduledRun = null;
            log.info("Session statistics scheduler stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return scheduledRun != null;
    }

    public SchedulerRunReport run(SchedulerRunReport.RunTrigger trigger) {
        synchronized (runLock) {
            Instant startedAt = Instant.now(clock);
            if (trigger == SchedulerRunReport.RunTrigger.SCHEDULED && lastRunStartedAt != null
                    && Duration.between(lastRunStartedAt, startedAt).compareTo(minimumInterval) < 0) {
                log.debug("Skipping scheduled run; last run started at {}", lastRunStartedAt);
                return SchedulerRunReport.builder()
                        .trigger(trigger)
                        .skipped(true)
                        .startedAt(startedAt)
                        .finishedAt(startedAt)
                        .build();
            }
            lastRunStartedAt = startedAt;

            List<String> failed = new ArrayList<>();
            SchedulerRunReport report = SchedulerRunReport.builder()
                    .trigger(trigger)
                    .startedAt(startedAt)
                    .sessionsExpired(runJob(EXPIRE_SESSIONS, failed, () -> sessionService.expireSessions(startedAt)))
                    .sessionsActivated(runJob(ACTIVATE_SESSIONS, failed,
                            () -> sessionService.activateSessions(startedAt)))
                    .statsRowsUpdated(runJob(PERFORMANCE_STATS, failed, statsService::recalculateAll))
                    .authSessionsRemoved(runJob(AUTH_SESSION_CLEANUP, failed, authSessionService::cleanup))
                    .failedJobs(List.copyOf(failed))
                    .finishedAt(Instant.now(clock))
                    .build();

            log.info("Scheduler run ({}) finished: expired={} activated={} statsRows={} authSessions={} failed={}",
                    trigger, report.getSessionsExpired(), report.getSessionsActivated(),
                    report.getStatsRowsUpdated(), report.getAuthSessionsRemoved(), failed);
            return report;
        }
    }

    private Integer runJob(String name, List<String> failed, IntSupplier job) {
        try {
            return job.getAsInt();
        } catch (RuntimeException e) {
            log.error("Scheduler job {} failed", name, e);
            failed.add(name);
            return null;
        }
    }
}
