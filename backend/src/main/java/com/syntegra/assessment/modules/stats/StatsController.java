package com.syntegra.assessment.modules.stats;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/stats")
@RequiredArgsConstructor
@Tag(name = "Statistics", description = "Participant performance ranking")
public class StatsController {

    private final UserPerformanceStatsService statsService;

    @GetMapping("/performance")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Ranked performance snapshot of all participants (Admin)")
    public ResponseEntity<Page<UserPerformanceStatsService.PerformanceStatsDto>> getPerformance(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        return ResponseEntity.ok(statsService.getRanking(PageRequest.of(page, size)));
    }
}
