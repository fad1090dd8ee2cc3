package com.syntegra.assessment.modules.catalog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface AssessmentTestRepository extends JpaRepository<AssessmentTest, UUID> {
}
