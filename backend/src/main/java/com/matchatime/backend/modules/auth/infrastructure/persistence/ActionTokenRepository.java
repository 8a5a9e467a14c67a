package com.matchatime.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.matchatime.backend.modules.auth.domain.ActionToken;
import com.matchatime.backend.modules.auth.domain.ActionTokenPurpose;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ActionTokenRepository extends JpaRepository<ActionToken, UUID> {

    @Modifying
    @Query("""
            update ActionToken t
               set t.usedAt = :now
             where t.userId = :userId
               and t.purpose = :purpose
               and t.usedAt is null
            """)
    int markUnusedAsUsed(@Param("userId") UUID userId,
                         @Param("purpose") ActionTokenPurpose purpose,
                         @Param("now") OffsetDateTime now);

    /**
     * Conditional single-statement consume: at most one caller sees an update count of 1 for a given hash.
     */
    @Modifying
    @Query("""
            update ActionToken t
               set t.usedAt = :now
             where t.tokenHash = :tokenHash
               and t.purpose = :purpose
               and t.usedAt is null
               and t.expiresAt > :now
            """)
    int consume(@Param("tokenHash") String tokenHash,
                @Param("purpose") ActionTokenPurpose purpose,
                @Param("now") OffsetDateTime now);

    @Query("select t.userId from ActionToken t where t.tokenHash = :tokenHash")
    Optional<UUID> findUserIdByTokenHash(@Param("tokenHash") String tokenHash);

    @Modifying
    @Query("delete from ActionToken t where t.expiresAt <= :now or t.usedAt is not null")
    int deleteExpiredOrUsed(@Param("now") OffsetDateTime now);

    long countByUserIdAndPurposeAndUsedAtIsNull(UUID userId, ActionTokenPurpose purpose);
}
