package com.syntegra.assessment.modules.session;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TestSessionRepository extends JpaRepository<TestSession, UUID> {

    Optional<TestSession> findBySessionCode(String sessionCode);

    // The WHERE clause re-asserts the prior status so a concurrent manual transition wins.
    @Modifying
    @Query("UPDATE TestSession s SET s.status = :expired, s.updatedAt = :now " +
            "WHERE s.status = :active AND s.autoExpire = true AND s.endTime < :now")
    int expireOverdue(@Param("now") Instant now,
            @Param("active") SessionStatus active,
            @Param("expired") SessionStatus expired);

    @Modifying
    @Query("UPDATE TestSession s SET s.status = :active, s.updatedAt = :now " +
            "WHERE s.status = :draft AND s.startTime < :now AND s.endTime > :now")
    int activateDue(@Param("now") Instant now,
            @Param("draft") SessionStatus draft,
            @Param("active") SessionStatus active);
}
