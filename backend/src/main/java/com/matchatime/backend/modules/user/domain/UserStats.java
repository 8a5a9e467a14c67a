package com.matchatime.backend.modules.user.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Per-user study counters, created together with the account and removed with it.
 */
@Entity
@Table(name = "user_stats")
public class UserStats {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "total_reviews", nullable = false)
    private int totalReviews;

    @Column(name = "streak_days", nullable = false)
    private int streakDays;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected UserStats() {
    }

    public UserStats(UUID userId, OffsetDateTime createdAt) {
        this.userId = userId;
        this.createdAt = createdAt;
    }

    public UUID getUserId() {
        return userId;
    }

    public int getTotalReviews() {
        return totalReviews;
    }

    public int getStreakDays() {
        return streakDays;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
