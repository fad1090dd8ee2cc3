package com.syntegra.assessment.scheduler;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/** Outcome of one scheduler run. Counts are null for jobs that failed or did not run. */
@Data
@Builder
public class SchedulerRunReport {

    public enum RunTrigger { SCHEDULED, MANUAL }

    private RunTrigger trigger;
    private boolean skipped;
    private Instant startedAt;
    private Instant finishedAt;
    private Integer sessionsExpired;
    private Integer sessionsActivated;
    private Integer statsRowsUpdated;
    private Integer authSessionsRemoved;
    @Builder.Default
    private List<String> failedJobs = List.of();
}
