package com.syntegra.assessment.modules.result;

import com.syntegra.assessment.modules.attempt.TestAttempt;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Filters for the result listing endpoints. Null criteria are ignored.
 */
public final class ResultSpecifications {

    private ResultSpecifications() {
    }

    public static Specification<TestResult> matching(ResultFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.getUserId() != null) {
                predicates.add(cb.equal(root.get("userId"), filter.getUserId()));
            }
            if (filter.getTestId() != null) {
                predicates.add(cb.equal(root.get("testId"), filter.getTestId()));
            }
            if (filter.getSessionId() != null) {
                // results do not carry the session; it lives on the attempt
                Subquery<UUID> attempts = query.subquery(UUID.class);
                Root<TestAttempt> attempt = attempts.from(TestAttempt.class);
                attempts.select(attempt.get("id"))
                        .where(cb.equal(attempt.get("sessionId"), filter.getSessionId()));
                predicates.add(root.get("attemptId").in(attempts));
            }
            if (filter.getIsPassed() != null) {
                predicates.add(cb.equal(root.get("isPassed"), filter.getIsPassed()));
            }
            if (filter.getGrade() != null) {
                predicates.add(cb.equal(root.get("grade"), filter.getGrade().name()));
            }
            if (filter.getCalculatedFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("calculatedAt"), filter.getCalculatedFrom()));
            }
            if (filter.getCalculatedTo() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("calculatedAt"), filter.getCalculatedTo()));
            }
            if (filter.getMinScore() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("scaledScore"), filter.getMinScore()));
            }
            if (filter.getMaxScore() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("scaledScore"), filter.getMaxScore()));
            }
            if (filter.getMinPercentile() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("percentile"), filter.getMinPercentile()));
            }
            if (filter.getMaxPercentile() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("percentile"), filter.getMaxPercentile()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
