package com.syntegra.assessment.modules.session;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SessionResultRepository extends JpaRepository<SessionResult, UUID> {

    List<SessionResult> findBySessionId(UUID sessionId);
}
