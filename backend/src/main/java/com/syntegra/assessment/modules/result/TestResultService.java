package com.syntegra.assessment.modules.result;

import com.syntegra.assessment.exception.BusinessException;
import com.syntegra.assessment.exception.ErrorKind;
import com.syntegra.assessment.exception.ResourceNotFoundException;
import com.syntegra.assessment.exception.UnauthorizedAccessException;
import com.syntegra.assessment.modules.answer.AnswerRepository;
import com.syntegra.assessment.modules.attempt.AttemptStatus;
import com.syntegra.assessment.modules.attempt.TestAttempt;
import com.syntegra.assessment.modules.attempt.TestAttemptRepository;
import com.syntegra.assessment.modules.catalog.AssessmentTest;
import com.syntegra.assessment.modules.catalog.TestCatalogService;
import com.syntegra.assessment.security.SecurityUtils;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class TestResultService {

    private final TestResultRepository resultRepository;
    private final TestAttemptRepository attemptRepository;
    private final AnswerRepository answerRepository;
    private final TestCatalogService catalogService;
    private final ResultCalculator resultCalculator;
    private final SecurityUtils securityUtils;
    private final Clock clock;

    @Value("${assessment.scoring.default-passing-score:60}")
    private BigDecimal defaultPassingScore;

    /**
     * Called when an attempt reaches COMPLETED. An existing result is kept
     * as is.
     */
    @Transactional
    public ResultDto calculateOnCompletion(TestAttempt attempt, AssessmentTest test) {
        Optional<TestResult> existing = resultRepository.findByAttemptId(attempt.getId());
        if (existing.isPresent()) {
            return toDto(existing.get(), test);
        }
        return toDto(store(attempt, test, null, true), test);
    }

    @Transactional
    public ResultDto calculate(UUID attemptId, boolean forceRecalculate, boolean includeRecommendations) {
        TestAttempt attempt = attemptRepository.findById(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt", attemptId.toString()));
        validateAccess(attempt);
        if (attempt.getStatus() != AttemptStatus.COMPLETED) {
            throw new BusinessException(ErrorKind.ATTEMPT_NOT_COMPLETED, "attemptId",
                    "Results are only calculated for completed attempts; attempt is " + attempt.getStatus());
        }

        AssessmentTest test = catalogService.getReferencedTest(attempt.getTestId());
        Optional<TestResult> existing = resultRepository.findByAttemptId(attemptId);
        if (existing.isPresent() && !forceRecalculate) {
            return toDto(existing.get(), test);
        }
        return toDto(store(attempt, test, existing.orElse(null), includeRecommendations), test);
    }

    @Transactional(readOnly = true)
    public ResultDto getByAttempt(UUID attemptId) {
        TestAttempt attempt = attemptRepository.findById(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt", attemptId.toString()));
        validateAccess(attempt);
        TestResult result = resultRepository.findByAttemptId(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Result for attempt", attemptId.toString()));
        return toDto(result, catalogService.getReferencedTest(attempt.getTestId()));
    }

    public enum SortField {
        CALCULATED_AT("calculatedAt"),
        RAW_SCORE("rawScore"),
        SCALED_SCORE("scaledScore"),
        PERCENTILE("percentile"),
        GRADE("grade"),
        COMPLETION_PERCENTAGE("completionPercentage");

        private final String property;

        SortField(String property) {
            this.property = property;
        }

        public Sort sort(Sort.Direction direction) {
            return Sort.by(direction, property).and(Sort.by("id"));
        }
    }

    /** Participants may list their own results; admins may list anyone's. */
    @Transactional(readOnly = true)
    public ResultListResponse getUserResults(UUID userId, ResultFilter filter, Pageable pageable) {
        if (!securityUtils.isAdmin() && !securityUtils.getCurrentUserId().equals(userId)) {
            throw new UnauthorizedAccessException("You can only view your own results");
        }
        filter.setUserId(userId);
        Page<TestResult> page = resultRepository.findAll(ResultSpecifications.matching(filter), pageable);

        Map<UUID, AssessmentTest> tests = new HashMap<>();
        List<ResultDto> results = page.getContent().stream()
                .map(r -> toListDto(r, tests.computeIfAbsent(r.getTestId(), catalogService::getReferencedTest),
                        filter.isIncludeRecommendations()))
                .toList();
        return toListResponse(page, results, resultRepository.findByUserId(userId));
    }

    @Transactional(readOnly = true)
    public ResultListResponse getTestResults(UUID testId, ResultFilter filter, Pageable pageable) {
        AssessmentTest test = catalogService.getTest(testId);
        filter.setTestId(testId);
        Page<TestResult> page = resultRepository.findAll(ResultSpecifications.matching(filter), pageable);

        List<ResultDto> results = page.getContent().stream()
                .map(r -> toListDto(r, test, filter.isIncludeRecommendations()))
                .toList();
        return toListResponse(page, results, resultRepository.findByTestId(testId));
    }

    private ResultListResponse toListResponse(Page<TestResult> page, List<ResultDto> results,
            List<TestResult> all) {
        return ResultListResponse.builder()
                .results(results)
                .page(page.getNumber())
                .size(page.getSize())
                .totalElements(page.getTotalElements())
                .totalPages(page.getTotalPages())
                .summary(summarize(all))
                .build();
    }

    static ResultListResponse.Summary summarize(List<TestResult> results) {
        List<BigDecimal> scores = results.stream()
                .map(r -> r.getScaledScore() != null ? r.getScaledScore() : r.getRawScore())
                .filter(Objects::nonNull)
                .toList();
        List<BigDecimal> completions = results.stream()
                .map(r -> r.getCompletionPercentage() != null ? r.getCompletionPercentage() : BigDecimal.ZERO)
                .toList();

        Map<String, Long> byGrade = new TreeMap<>();
        for (TestResult r : results) {
            if (r.getGrade() != null) {
                byGrade.merge(r.getGrade(), 1L, Long::sum);
            }
        }
        Map<String, Long> percentileRanges = new LinkedHashMap<>();
        percentileRanges.put("0-25", 0L);
        percentileRanges.put("26-50", 0L);
        percentileRanges.put("51-75", 0L);
        percentileRanges.put("76-100", 0L);
        for (TestResult r : results) {
            Integer p = r.getPercentile();
            if (p != null) {
                percentileRanges.merge(p <= 25 ? "0-25" : p <= 50 ? "26-50" : p <= 75 ? "51-75" : "76-100",
                        1L, Long::sum);
            }
        }

        return ResultListResponse.Summary.builder()
                .totalResults(results.size())
                .passedCount((int) results.stream().filter(r -> Boolean.TRUE.equals(r.getIsPassed())).count())
                .failedCount((int) results.stream().filter(r -> Boolean.FALSE.equals(r.getIsPassed())).count())
                .uniqueParticipants((int) results.stream().map(TestResult::getUserId).distinct().count())
                .averageScore(mean(scores))
                .highestScore(scores.stream().max(Comparator.naturalOrder()).orElse(null))
                .lowestScore(scores.stream().min(Comparator.naturalOrder()).orElse(null))
                .averageCompletion(mean(completions))
                .byGrade(byGrade)
                .percentileRanges(percentileRanges)
                .build();
    }

    private static BigDecimal mean(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return null;
        }
        return values.stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(values.size()), 2, RoundingMode.HALF_UP);
    }

    private ResultDto toListDto(TestResult r, AssessmentTest test, boolean includeRecommendations) {
        ResultDto dto = toDto(r, test);
        if (!includeRecommendations) {
            dto.setRecommendations(null);
        }
        return dto;
    }

    private TestResult store(TestAttempt attempt, AssessmentTest test, TestResult existing,
            boolean includeRecommendations) {
        BigDecimal passingScore = test.getPassingScore() != null ? test.getPassingScore() : defaultPassingScore;
        ResultCalculator.Computation computed = resultCalculator.calculate(
                attempt,
                test,
                catalogService.getQuestionsById(test.getId()),
                answerRepository.findByAttemptId(attempt.getId()),
                passingScore,
                includeRecommendations);

        if (existing != null && matches(existing, computed)) {
            log.debug("Result for attempt {} unchanged; keeping calculation of {}", attempt.getId(),
                    existing.getCalculatedAt());
            return existing;
        }

        TestResult result = existing != null ? existing : TestResult.builder()
                .attemptId(attempt.getId())
                .userId(attempt.getUserId())
                .testId(attempt.getTestId())
                .build();
        result.setRawScore(computed.rawScore());
        result.setScaledScore(computed.scaledScore());
        result.setPercentile(computed.percentile());
        result.setGrade(computed.grade() != null ? computed.grade().name() : null);
        result.setTraits(computed.traits());
        result.setTraitNames(computed.traitNames());
        result.setDescription(computed.description());
        result.setRecommendations(computed.recommendations());
        result.setIsPassed(computed.isPassed());
        result.setCompletionPercentage(computed.completionPercentage());
        result.setCalculatedAt(Instant.now(clock));

        TestResult saved = resultRepository.save(result);
        log.info("Result {} for attempt {}: raw={} scaled={} grade={}", existing != null ? "recalculated" : "calculated",
                attempt.getId(), saved.getRawScore(), saved.getScaledScore(), saved.getGrade());
        return saved;
    }

    private static boolean matches(TestResult stored, ResultCalculator.Computation computed) {
        return sameNumber(stored.getRawScore(), computed.rawScore())
                && sameNumber(stored.getScaledScore(), computed.scaledScore())
                && sameNumber(stored.getCompletionPercentage(), computed.completionPercentage())
                && Objects.equals(stored.getPercentile(), computed.percentile())
                && Objects.equals(stored.getGrade(), computed.grade() != null ? computed.grade().name() : null)
                && Objects.equals(stored.getTraits(), computed.traits())
                && Objects.equals(stored.getTraitNames(), computed.traitNames())
                && Objects.equals(stored.getDescription(), computed.description())
                && Objects.equals(stored.getRecommendations(), computed.recommendations())
                && Objects.equals(stored.getIsPassed(), computed.isPassed());
    }

    private static boolean sameNumber(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }

    private void validateAccess(TestAttempt attempt) {
        if (!securityUtils.isAdmin() && !securityUtils.getCurrentUserId().equals(attempt.getUserId())) {
            throw new UnauthorizedAccessException("You can only access results of your own attempts");
        }
    }

    private ResultDto toDto(TestResult r, AssessmentTest test) {
        return ResultDto.builder()
                .id(r.getId())
                .attemptId(r.getAttemptId())
                .userId(r.getUserId())
                .testId(r.getTestId())
                .testName(test != null ? test.getName() : null)
                .rawScore(r.getRawScore())
                .scaledScore(r.getScaledScore())
                .percentile(r.getPercentile())
                .grade(r.getGrade())
                .traits(r.getTraits())
                .traitNames(r.getTraitNames())
                .description(r.getDescription())
                .recommendations(r.getRecommendations())
                .isPassed(r.getIsPassed())
                .completionPercentage(r.getCompletionPercentage())
                .calculatedAt(r.getCalculatedAt())
                .build();
    }

    @Data
    @Builder
    public static class ResultDto {
        private UUID id;
        private UUID attemptId;
        private UUID userId;
        private UUID testId;
        private String testName;
        private BigDecimal rawScore;
        private BigDecimal scaledScore;
        private Integer percentile;
        private String grade;
        private List<TestResult.TraitScore> traits;
        private List<String> traitNames;
        private String description;
        private String recommendations;
        private Boolean isPassed;
        private BigDecimal completionPercentage;
        private Instant calculatedAt;
    }

    @Data
    public static class CalculateResultRequest {
        @NotNull
        private UUID attemptId;
        private boolean forceRecalculate;
        private Boolean includeRecommendations = Boolean.TRUE;
    }
}
