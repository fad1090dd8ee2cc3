package com.syntegra.assessment.scheduler;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/scheduler")
@RequiredArgsConstructor
@Tag(name = "Scheduler", description = "On-demand maintenance runs")
public class SchedulerController {

    private final SessionStatisticsScheduler scheduler;

    @PostMapping("/run")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Run all session and statistics jobs now (Admin)")
    public ResponseEntity<SchedulerRunReport> run() {
        return ResponseEntity.ok(scheduler.run(SchedulerRunReport.RunTrigger.MANUAL));
    }
}
