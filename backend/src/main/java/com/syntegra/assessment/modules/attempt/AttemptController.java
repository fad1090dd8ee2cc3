package com.syntegra.assessment.modules.attempt;

import com.syntegra.assessment.modules.attempt.dto.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/attempts")
@RequiredArgsConstructor
@Tag(name = "Attempts", description = "Test attempt lifecycle")
public class AttemptController {

    static final int MAX_PAGE_SIZE = 100;

    private final TestAttemptService attemptService;

    @PostMapping("/start")
    @Operation(summary = "Start a test attempt, or resume the open one")
    public ResponseEntity<StartAttemptResponse> start(
            @Valid @RequestBody StartAttemptRequest body,
            HttpServletRequest request) {
        StartAttemptResponse response = attemptService.start(body, request.getRemoteAddr(),
                request.getHeader("User-Agent"));
        return ResponseEntity.status(response.isResumed() ? HttpStatus.OK : HttpStatus.CREATED)
                .body(response);
    }

    @GetMapping("/{attemptId}")
    @Operation(summary = "Get attempt details")
    public ResponseEntity<AttemptDto> getAttempt(@PathVariable UUID attemptId) {
        return ResponseEntity.ok(attemptService.getAttempt(attemptId));
    }

    @PutMapping("/{attemptId}")
    @Operation(summary = "Update attempt status or progress")
    public ResponseEntity<AttemptDto> updateAttempt(
            @PathVariable UUID attemptId,
            @Valid @RequestBody UpdateAttemptRequest body) {
        return ResponseEntity.ok(attemptService.updateAttempt(attemptId, body));
    }

    @PostMapping("/{attemptId}/finish")
    @Operation(summary = "Finish an attempt as completed, abandoned or expired")
    public ResponseEntity<FinishAttemptResponse> finishAttempt(
            @PathVariable UUID attemptId,
            @Valid @RequestBody FinishAttemptRequest body) {
        return ResponseEntity.ok(attemptService.finishAttempt(attemptId, body));
    }

    @GetMapping("/{attemptId}/progress")
    @Operation(summary = "Get timing and progress of an attempt")
    public ResponseEntity<AttemptProgressDto> getProgress(@PathVariable UUID attemptId) {
        return ResponseEntity.ok(attemptService.getProgress(attemptId));
    }

    @GetMapping("/user/{userId}")
    @Operation(summary = "List a participant's attempts")
    public ResponseEntity<AttemptListResponse> getUserAttempts(
            @PathVariable UUID userId,
            @RequestParam(required = false) AttemptStatus status,
            @RequestParam(required = false) UUID testId,
            @RequestParam(required = false) UUID sessionId,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(MAX_PAGE_SIZE) int size) {
        Pageable pageable = PageRequest.of(page, size, Sort.by("startTime").descending());
        return ResponseEntity.ok(attemptService.getUserAttempts(userId, status, testId, sessionId, pageable));
    }

    @GetMapping("/session/{sessionId}")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "List all attempts of a test session (Admin)")
    public ResponseEntity<AttemptListResponse> getSessionAttempts(
            @PathVariable UUID sessionId,
            @RequestParam(required = false) AttemptStatus status,
            @RequestParam(required = false) UUID testId,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "50") @Min(1) @Max(MAX_PAGE_SIZE) int size) {
        Pageable pageable = PageRequest.of(page, size, Sort.by("startTime").descending());
        return ResponseEntity.ok(attemptService.getSessionAttempts(sessionId, status, testId, pageable));
    }
}
