package com.syntegra.assessment.modules.attempt;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Filters for the attempt listing endpoints. Null criteria are ignored.
 */
public final class AttemptSpecifications {

    private AttemptSpecifications() {
    }

    public static Specification<TestAttempt> matching(UUID userId, UUID sessionId, UUID testId,
            AttemptStatus status) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (userId != null) {
                predicates.add(cb.equal(root.get("userId"), userId));
            }
            if (sessionId != null) {
                predicates.add(cb.equal(root.get("sessionId"), sessionId));
            }
            if (testId != null) {
                predicates.add(cb.equal(root.get("testId"), testId));
            }
            if (status != null) {
                predicates.add(cb.equal(root.get("status"), status));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
