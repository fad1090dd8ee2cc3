package com.syntegra.assessment.modules.result;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TestResultRepository extends JpaRepository<TestResult, UUID>, JpaSpecificationExecutor<TestResult> {

    Optional<TestResult> findByAttemptId(UUID attemptId);

    List<TestResult> findByUserId(UUID userId);

    List<TestResult> findByTestId(UUID testId);
}
