package com.syntegra.assessment.modules.catalog;

import com.syntegra.assessment.exception.BusinessException;
import com.syntegra.assessment.exception.ErrorKind;
import com.syntegra.assessment.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read access to authored tests and questions.
 */
@Service
@RequiredArgsConstructor
public class TestCatalogService {

    private final AssessmentTestRepository testRepository;
    private final QuestionRepository questionRepository;

    @Transactional(readOnly = true)
    public AssessmentTest getTest(UUID testId) {
        return testRepository.findById(testId)
                .orElseThrow(() -> new ResourceNotFoundException("Test", testId.toString()));
    }

    /** Loads the test behind an existing attempt; absence means the catalog lost a referenced row. */
    @Transactional(readOnly = true)
    public AssessmentTest getReferencedTest(UUID testId) {
        return testRepository.findById(testId)
                .orElseThrow(() -> new BusinessException(ErrorKind.DATA_INTEGRITY_ERROR,
                        "Test " + testId + " referenced by attempt is missing"));
    }

    @Transactional(readOnly = true)
    public Question getQuestionOfTest(UUID questionId, UUID testId) {
        return questionRepository.findByIdAndTestId(questionId, testId)
                .orElseThrow(() -> new ResourceNotFoundException("Question", questionId.toString()));
    }

    @Transactional(readOnly = true)
    public List<Question> getQuestions(UUID testId) {
        return questionRepository.findByTestIdOrderBySequenceAsc(testId);
    }

    @Transactional(readOnly = true)
    public Map<UUID, Question> getQuestionsById(UUID testId) {
        return getQuestions(testId).stream()
                .collect(Collectors.toMap(Question::getId, Function.identity()));
    }
}
