package com.matchatime.backend.modules.user.infrastructure.persistence;

import java.util.UUID;

import com.matchatime.backend.modules.user.domain.UserStats;

import org.springframework.data.jpa.repository.JpaRepository;

public interface UserStatsRepository extends JpaRepository<UserStats, UUID> {
}
