package com.syntegra.assessment.modules.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface QuestionRepository extends JpaRepository<Question, UUID> {

    Optional<Question> findByIdAndTestId(UUID id, UUID testId);

    List<Question> findByTestIdOrderBySequenceAsc(UUID testId);
}
