package com.syntegra.assessment.modules.result;

import com.syntegra.assessment.BaseUnitTest;
import com.syntegra.assessment.exception.BusinessException;
import com.syntegra.assessment.exception.ErrorKind;
import com.syntegra.assessment.exception.UnauthorizedAccessException;
import com.syntegra.assessment.modules.answer.AnswerRepository;
import com.syntegra.assessment.modules.attempt.AttemptStatus;
import com.syntegra.assessment.modules.attempt.TestAttempt;
import com.syntegra.assessment.modules.attempt.TestAttemptRepository;
import com.syntegra.assessment.modules.catalog.AssessmentTest;
import com.syntegra.assessment.modules.catalog.ModuleType;
import com.syntegra.assessment.modules.catalog.TestCatalogService;
import com.syntegra.assessment.modules.catalog.TestCategory;
import com.syntegra.assessment.security.SecurityUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("TestResultService")
class TestResultServiceTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock private TestResultRepository resultRepository;
    @Mock private TestAttemptRepository attemptRepository;
    @Mock private AnswerRepository answerRepository;
    @Mock private TestCatalogService catalogService;
    @Mock private ResultCalculator resultCalculator;
    @Mock private SecurityUtils securityUtils;

    private TestResultService service;

    private final UUID userId = UUID.randomUUID();
    private final AssessmentTest test = AssessmentTest.builder()
            .id(UUID.randomUUID())
            .name("Numerical reasoning")
            .moduleType(ModuleType.APTITUDE)
            .category(TestCategory.IQ)
            .timeLimit(30)
            .build();

    private final ResultCalculator.Computation computation = new ResultCalculator.Computation(
            new BigDecimal("8.00"), new BigDecimal("80.00"), 80, Grade.B, null, null,
            "Test completed with 100% completion rate. Scored 80 out of 100 (B).", null, true,
            new BigDecimal("100.00"));

    @BeforeEach
    void setUp() {
        service = new TestResultService(resultRepository, attemptRepository, answerRepository, catalogService,
                resultCalculator, securityUtils, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(service, "defaultPassingScore", BigDecimal.valueOf(60));
    }

    private TestAttempt attempt(AttemptStatus status) {
        return TestAttempt.builder()
                .id(UUID.randomUUID())
                .userId(userId)
                .testId(test.getId())
                .status(status)
                .startTime(NOW.minusSeconds(1800))
                .endTime(NOW.plusSeconds(600))
                .questionsAnswered(10)
                .totalQuestions(10)
                .build();
    }

    private TestResult stored(TestAttempt attempt) {
        return TestResult.builder()
                .id(UUID.randomUUID())
                .attemptId(attempt.getId())
                .userId(userId)
                .testId(test.getId())
                .rawScore(new BigDecimal("8.00"))
                .scaledScore(new BigDecimal("80.00"))
                .percentile(80)
                .grade("B")
                .description("Test completed with 100% completion rate. Scored 80 out of 100 (B).")
                .isPassed(true)
                .completionPercentage(new BigDecimal("100.00"))
                .calculatedAt(Instant.parse("2025-02-01T00:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("calculate: non-completed attempt is rejected with ATTEMPT_NOT_COMPLETED")
    void calculate_notCompleted() {
        TestAttempt attempt = attempt(AttemptStatus.IN_PROGRESS);
        when(attemptRepository.findById(attempt.getId())).thenReturn(Optional.of(attempt));
        when(securityUtils.isAdmin()).thenReturn(true);

        assertThatThrownBy(() -> service.calculate(attempt.getId(), false, true))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getKind())
                        .isEqualTo(ErrorKind.ATTEMPT_NOT_COMPLETED));
        verifyNoInteractions(resultCalculator);
    }

    @Test
    @DisplayName("calculate: another participant's attempt is forbidden")
    void calculate_otherUser() {
        TestAttempt attempt = attempt(AttemptStatus.COMPLETED);
        when(attemptRepository.findById(attempt.getId())).thenReturn(Optional.of(attempt));
        when(securityUtils.isAdmin()).thenReturn(false);
        when(securityUtils.getCurrentUserId()).thenReturn(UUID.randomUUID());

        assertThatThrownBy(() -> service.calculate(attempt.getId(), true, true))
                .isInstanceOf(UnauthorizedAccessException.class);
    }

    @Test
    @DisplayName("calculate: existing result is returned unchanged without force")
    void calculate_existingWithoutForce() {
        TestAttempt attempt = attempt(AttemptStatus.COMPLETED);
        TestResult existing = stored(attempt);
        when(attemptRepository.findById(attempt.getId())).thenReturn(Optional.of(attempt));
        when(securityUtils.isAdmin()).thenReturn(true);
        when(catalogService.getReferencedTest(test.getId())).thenReturn(test);
        when(resultRepository.findByAttemptId(attempt.getId())).thenReturn(Optional.of(existing));

        TestResultService.ResultDto dto = service.calculate(attempt.getId(), false, true);

        assertThat(dto.getId()).isEqualTo(existing.getId());
        assertThat(dto.getTestName()).isEqualTo("Numerical reasoning");
        verifyNoInteractions(resultCalculator);
        verify(resultRepository, never()).save(any());
    }

    @Test
    @DisplayName("calculate: forced recompute with identical figures leaves the row untouched")
    void calculate_forcedIdentical() {
        TestAttempt attempt = attempt(AttemptStatus.COMPLETED);
        TestResult existing = stored(attempt);
        when(attemptRepository.findById(attempt.getId())).thenReturn(Optional.of(attempt));
        when(securityUtils.isAdmin()).thenReturn(true);
        when(catalogService.getReferencedTest(test.getId())).thenReturn(test);
        when(catalogService.getQuestionsById(test.getId())).thenReturn(Map.of());
        when(answerRepository.findByAttemptId(attempt.getId())).thenReturn(List.of());
        when(resultRepository.findByAttemptId(attempt.getId())).thenReturn(Optional.of(existing));
        when(resultCalculator.calculate(eq(attempt), eq(test), any(), any(), any(), anyBoolean()))
                .thenReturn(computation);

        TestResultService.ResultDto dto = service.calculate(attempt.getId(), true, false);

        assertThat(dto.getCalculatedAt()).isEqualTo(Instant.parse("2025-02-01T00:00:00Z"));
        verify(resultRepository, never()).save(any());
    }

    @Test
    @DisplayName("calculate: forced recompute with new figures overwrites in place")
    void calculate_forcedChanged() {
        TestAttempt attempt = attempt(AttemptStatus.COMPLETED);
        TestResult existing = stored(attempt);
        existing.setRawScore(new BigDecimal("6.00"));
        when(attemptRepository.findById(attempt.getId())).thenReturn(Optional.of(attempt));
        when(securityUtils.isAdmin()).thenReturn(true);
        when(catalogService.getReferencedTest(test.getId())).thenReturn(test);
        when(catalogService.getQuestionsById(test.getId())).thenReturn(Map.of());
        when(answerRepository.findByAttemptId(attempt.getId())).thenReturn(List.of());
        when(resultRepository.findByAttemptId(attempt.getId())).thenReturn(Optional.of(existing));
        when(resultCalculator.calculate(eq(attempt), eq(test), any(), any(), any(), anyBoolean()))
                .thenReturn(computation);
        when(resultRepository.save(any(TestResult.class))).thenAnswer(inv -> inv.getArgument(0));

        TestResultService.ResultDto dto = service.calculate(attempt.getId(), true, false);

        assertThat(dto.getId()).isEqualTo(existing.getId());
        assertThat(dto.getRawScore()).isEqualByComparingTo("8");
        assertThat(dto.getCalculatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("calculateOnCompletion: creates the result with the default passing score")
    void calculateOnCompletion_creates() {
        TestAttempt attempt = attempt(AttemptStatus.COMPLETED);
        when(resultRepository.findByAttemptId(attempt.getId())).thenReturn(Optional.empty());
        when(catalogService.getQuestionsById(test.getId())).thenReturn(Map.of());
        when(answerRepository.findByAttemptId(attempt.getId())).thenReturn(List.of());
        when(resultCalculator.calculate(eq(attempt), eq(test), any(), any(), eq(BigDecimal.valueOf(60)), eq(true)))
                .thenReturn(computation);
        when(resultRepository.save(any(TestResult.class))).thenAnswer(inv -> inv.getArgument(0));

        service.calculateOnCompletion(attempt, test);

        ArgumentCaptor<TestResult> captor = ArgumentCaptor.forClass(TestResult.class);
        verify(resultRepository).save(captor.capture());
        TestResult saved = captor.getValue();
        assertThat(saved.getAttemptId()).isEqualTo(attempt.getId());
        assertThat(saved.getUserId()).isEqualTo(userId);
        assertThat(saved.getGrade()).isEqualTo("B");
        assertThat(saved.getCalculatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("calculateOnCompletion: an existing result is kept")
    void calculateOnCompletion_existing() {
        TestAttempt attempt = attempt(AttemptStatus.COMPLETED);
        when(resultRepository.findByAttemptId(attempt.getId())).thenReturn(Optional.of(stored(attempt)));

        service.calculateOnCompletion(attempt, test);

        verifyNoInteractions(resultCalculator);
        verify(resultRepository, never()).save(any());
    }

    private TestResult listed(UUID owner, String scaled, Integer percentile, String grade, Boolean passed) {
        return TestResult.builder()
                .id(UUID.randomUUID())
                .attemptId(UUID.randomUUID())
                .userId(owner)
                .testId(test.getId())
                .rawScore(new BigDecimal("5.00"))
                .scaledScore(scaled != null ? new BigDecimal(scaled) : null)
                .percentile(percentile)
                .grade(grade)
                .isPassed(passed)
                .recommendations("Practise timed sets")
                .completionPercentage(new BigDecimal("100.00"))
                .calculatedAt(NOW)
                .build();
    }

    @Nested
    @DisplayName("result listings")
    class Listings {

        private final PageRequest pageable = PageRequest.of(0, 10,
                TestResultService.SortField.CALCULATED_AT.sort(Sort.Direction.DESC));

        @Test
        @DisplayName("user listing scopes the filter to the path user and hides recommendations unless asked")
        void userListing() {
            TestResult own = listed(userId, "80.00", 80, "B", true);
            when(securityUtils.isAdmin()).thenReturn(false);
            when(securityUtils.getCurrentUserId()).thenReturn(userId);
            when(resultRepository.findAll(ArgumentMatchers.<Specification<TestResult>>any(), eq(pageable)))
                    .thenReturn(new PageImpl<>(List.of(own), pageable, 1));
            when(resultRepository.findByUserId(userId)).thenReturn(List.of(own));
            when(catalogService.getReferencedTest(test.getId())).thenReturn(test);
            ResultFilter filter = ResultFilter.builder().userId(UUID.randomUUID()).grade(Grade.B).build();

            ResultListResponse response = service.getUserResults(userId, filter, pageable);

            assertThat(filter.getUserId()).isEqualTo(userId);
            assertThat(response.getResults()).singleElement().satisfies(dto -> {
                assertThat(dto.getTestName()).isEqualTo("Numerical reasoning");
                assertThat(dto.getRecommendations()).isNull();
            });
            assertThat(response.getTotalElements()).isEqualTo(1);
            assertThat(response.getSummary().getTotalResults()).isEqualTo(1);
        }

        @Test
        @DisplayName("participants cannot list another user's results")
        void otherUser() {
            when(securityUtils.isAdmin()).thenReturn(false);
            when(securityUtils.getCurrentUserId()).thenReturn(userId);

            assertThatThrownBy(() -> service.getUserResults(UUID.randomUUID(), new ResultFilter(), pageable))
                    .isInstanceOf(UnauthorizedAccessException.class);
            verifyNoInteractions(resultRepository);
        }

        @Test
        @DisplayName("test listing keeps recommendations when asked and summarises every result of the test")
        void testListing() {
            UUID other = UUID.randomUUID();
            TestResult top = listed(userId, "92.00", 95, "A", true);
            TestResult low = listed(other, "40.00", 20, "E", false);
            TestResult unscaled = listed(other, null, null, null, null);
            when(catalogService.getTest(test.getId())).thenReturn(test);
            when(resultRepository.findAll(ArgumentMatchers.<Specification<TestResult>>any(), eq(pageable)))
                    .thenReturn(new PageImpl<>(List.of(top), pageable, 3));
            when(resultRepository.findByTestId(test.getId())).thenReturn(List.of(top, low, unscaled));
            ResultFilter filter = ResultFilter.builder().includeRecommendations(true).build();

            ResultListResponse response = service.getTestResults(test.getId(), filter, pageable);

            assertThat(filter.getTestId()).isEqualTo(test.getId());
            assertThat(response.getResults()).singleElement()
                    .satisfies(dto -> assertThat(dto.getRecommendations()).isEqualTo("Practise timed sets"));
            ResultListResponse.Summary summary = response.getSummary();
            assertThat(summary.getTotalResults()).isEqualTo(3);
            assertThat(summary.getPassedCount()).isEqualTo(1);
            assertThat(summary.getFailedCount()).isEqualTo(1);
            assertThat(summary.getUniqueParticipants()).isEqualTo(2);
            // the unscaled result contributes its raw score
            assertThat(summary.getAverageScore()).isEqualByComparingTo("45.67");
            assertThat(summary.getHighestScore()).isEqualByComparingTo("92");
            assertThat(summary.getLowestScore()).isEqualByComparingTo("5");
            assertThat(summary.getByGrade()).containsExactly(Map.entry("A", 1L), Map.entry("E", 1L));
            assertThat(summary.getPercentileRanges())
                    .containsExactly(Map.entry("0-25", 1L), Map.entry("26-50", 0L),
                            Map.entry("51-75", 0L), Map.entry("76-100", 1L));
        }
    }

    @Test
    @DisplayName("summary of no results has no averages")
    void emptySummary() {
        ResultListResponse.Summary summary = TestResultService.summarize(List.of());

        assertThat(summary.getTotalResults()).isZero();
        assertThat(summary.getAverageScore()).isNull();
        assertThat(summary.getAverageCompletion()).isNull();
        assertThat(summary.getPercentileRanges()).containsValues(0L);
    }
}
