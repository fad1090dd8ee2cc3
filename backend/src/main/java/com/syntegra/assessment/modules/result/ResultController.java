package com.syntegra.assessment.modules.result;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/results")
@RequiredArgsConstructor
@Tag(name = "Results", description = "Test result calculation and retrieval")
public class ResultController {

    static final int MAX_PAGE_SIZE = 100;

    private final TestResultService resultService;

    @PostMapping("/calculate")
    @Operation(summary = "Calculate the result of a completed attempt, optionally overwriting an existing one")
    public ResponseEntity<TestResultService.ResultDto> calculate(
            @Valid @RequestBody TestResultService.CalculateResultRequest request) {
        return ResponseEntity.ok(resultService.calculate(
                request.getAttemptId(),
                request.isForceRecalculate(),
                !Boolean.FALSE.equals(request.getIncludeRecommendations())));
    }

    @GetMapping("/attempt/{attemptId}")
    @Operation(summary = "Get the stored result of an attempt")
    public ResponseEntity<TestResultService.ResultDto> getByAttempt(@PathVariable UUID attemptId) {
        return ResponseEntity.ok(resultService.getByAttempt(attemptId));
    }

    @GetMapping("/user/{userId}")
    @Operation(summary = "List a participant's results with filters")
    public ResponseEntity<ResultListResponse> getUserResults(
            @PathVariable UUID userId,
            @Valid ResultFilter filter,
            @RequestParam(defaultValue = "CALCULATED_AT") TestResultService.SortField sortBy,
            @RequestParam(defaultValue = "DESC") Sort.Direction sortOrder,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(MAX_PAGE_SIZE) int size) {
        Pageable pageable = PageRequest.of(page, size, sortBy.sort(sortOrder));
        return ResponseEntity.ok(resultService.getUserResults(userId, filter, pageable));
    }

    @GetMapping("/test/{testId}")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "List every result of a test with filters (Admin)")
    public ResponseEntity<ResultListResponse> getTestResults(
            @PathVariable UUID testId,
            @Valid ResultFilter filter,
            @RequestParam(defaultValue = "CALCULATED_AT") TestResultService.SortField sortBy,
            @RequestParam(defaultValue = "DESC") Sort.Direction sortOrder,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(MAX_PAGE_SIZE) int size) {
        Pageable pageable = PageRequest.of(page, size, sortBy.sort(sortOrder));
        return ResponseEntity.ok(resultService.getTestResults(testId, filter, pageable));
    }
}
