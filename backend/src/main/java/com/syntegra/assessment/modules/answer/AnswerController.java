package com.syntegra.assessment.modules.answer;

import com.syntegra.assessment.modules.answer.dto.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/attempts/{attemptId}/answers")
@RequiredArgsConstructor
@Tag(name = "Answers", description = "Answer submission and review")
public class AnswerController {

    static final int MAX_PAGE_SIZE = 200;

    private final AnswerService answerService;

    @PostMapping
    @Operation(summary = "Submit or overwrite the answer to a question")
    public ResponseEntity<SubmitAnswerResponse> submit(
            @PathVariable UUID attemptId,
            @Valid @RequestBody SubmitAnswerRequest request) {
        return ResponseEntity.ok(answerService.submit(attemptId, request));
    }

    @PostMapping("/auto-save")
    @Operation(summary = "Auto-save a partial answer as a draft")
    public ResponseEntity<AutoSaveResponse> autoSave(
            @PathVariable UUID attemptId,
            @Valid @RequestBody AutoSaveRequest request) {
        return ResponseEntity.ok(answerService.autoSave(attemptId, request));
    }

    @GetMapping
    @Operation(summary = "List the answers of an attempt")
    public ResponseEntity<AnswerListResponse> getAnswers(
            @PathVariable UUID attemptId,
            @RequestParam(required = false) UUID questionId,
            @RequestParam(required = false) Boolean isAnswered,
            @RequestParam(required = false) Integer confidenceLevel,
            @RequestParam(defaultValue = "SEQUENCE") AnswerService.SortField sortBy,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "50") @Min(1) @Max(MAX_PAGE_SIZE) int size) {
        Pageable pageable = PageRequest.of(page, size, sortBy.sort());
        return ResponseEntity.ok(answerService.getAnswers(attemptId, questionId, isAnswered, confidenceLevel,
                pageable));
    }

    @GetMapping("/{questionId}")
    @Operation(summary = "Get the answer to one question")
    public ResponseEntity<AnswerDto> getAnswer(@PathVariable UUID attemptId, @PathVariable UUID questionId) {
        return ResponseEntity.ok(answerService.getAnswer(attemptId, questionId));
    }

    @PostMapping("/recalculate-scores")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Re-score all final answers of an attempt (Admin)")
    public ResponseEntity<RecalculationReport> recalculateScores(@PathVariable UUID attemptId) {
        return ResponseEntity.ok(answerService.recalculateScores(attemptId));
    }
}
