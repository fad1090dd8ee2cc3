package com.syntegra.assessment.modules.session;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SessionModuleRepository extends JpaRepository<SessionModule, UUID> {

    Optional<SessionModule> findBySessionIdAndTestId(UUID sessionId, UUID testId);

    List<SessionModule> findBySessionIdOrderBySequenceAsc(UUID sessionId);
}
