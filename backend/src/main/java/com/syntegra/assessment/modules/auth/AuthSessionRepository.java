package com.syntegra.assessment.modules.auth;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface AuthSessionRepository extends JpaRepository<AuthSession, UUID> {

    @Query("SELECT COUNT(s) > 0 FROM AuthSession s WHERE s.id = :id AND s.userId = :userId " +
            "AND s.isActive = true AND s.expiresAt > :now")
    boolean isUsable(@Param("id") UUID id, @Param("userId") UUID userId, @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM AuthSession s WHERE s.expiresAt < :now")
    int deleteExpired(@Param("now") Instant now);

    // Rows without last_used are left alone; they have never been touched by a request.
    @Modifying
    @Query("DELETE FROM AuthSession s WHERE s.lastUsed < :cutoff")
    int deleteInactiveBefore(@Param("cutoff") Instant cutoff);
}
