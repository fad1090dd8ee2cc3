package com.syntegra.assessment.modules.answer;

import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Filters for the answer listing of one attempt. Null criteria are ignored.
 */
public final class AnswerSpecifications {

    private AnswerSpecifications() {
    }

    public static Specification<Answer> matching(UUID attemptId, UUID questionId, Boolean isAnswered,
            Integer confidenceLevel) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("attemptId"), attemptId));
            if (questionId != null) {
                predicates.add(cb.equal(root.get("questionId"), questionId));
            }
            if (isAnswered != null) {
                Predicate hasContent = cb.or(cb.isNotNull(root.get("answer")), cb.isNotNull(root.get("answerData")));
                predicates.add(isAnswered ? hasContent : cb.not(hasContent));
            }
            if (confidenceLevel != null) {
                predicates.add(cb.equal(root.get("confidenceLevel"), confidenceLevel));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
