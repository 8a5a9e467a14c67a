package com.matchatime.backend.modules.user.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.matchatime.backend.modules.user.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    Optional<AppUser> findByEmail(String email);

    Optional<AppUser> findByGoogleId(String googleId);

    boolean existsByUsername(String username);

    boolean existsByEmail(String email);

    /**
     * Bulk delete; dependent token and stats rows go with the users through the foreign-key cascade.
     */
    @Modifying
    @Query("""
            delete from AppUser u
             where u.emailVerified = false
               and u.createdAt < :cutoff
            """)
    int deleteUnverifiedCreatedBefore(@Param("cutoff") OffsetDateTime cutoff);
}
