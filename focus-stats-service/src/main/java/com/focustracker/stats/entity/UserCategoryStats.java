package com.focustracker.stats.entity;

import com.focustracker.stats.model.GoalCategory;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Entity tracking a user's session statistics and leaderboard score within one goal category
 */
@Entity
@Table(name = "user_stats",
        uniqueConstraints = @UniqueConstraint(name = "uk_user_stats_user_category",
                columnNames = {"user_id", "category"}),
        indexes = {
                @Index(name = "idx_user_stats_score", columnList = "leaderboard_score"),
                @Index(name = "idx_user_stats_last_score_update", columnList = "last_score_update")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserCategoryStats {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.VARCHAR)
    @Column(name = "category", nullable = false, length = 20)
    private GoalCategory category;

    @Column(name = "total_sessions", nullable = false)
    private int totalSessions;

    @Column(name = "completed_sessions", nullable = false)
    private int completedSessions;

    @Column(name = "total_duration", nullable = false)
    private int totalDurationMinutes;

    @Column(name = "streak_days", nullable = false)
    private int streakDays;

    @Column(name = "last_activity")
    private Instant lastActivity;

    @Column(name = "leaderboard_score", nullable = false)
    private double leaderboardScore;

    @Column(name = "last_score_update", nullable = false)
    private Instant lastScoreUpdate;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // Set when a writer stamped updatedAt with its own time; consumed by onUpdate
    @Transient
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private boolean updatedAtAssigned;

    /**
     * Single entry point for score changes. Completions and decay both go through here so the
     * score never drops below zero and the decay clock always moves with it.
     */
    public void applyScore(double newScore, Instant at) {
        this.leaderboardScore = Math.max(0.0, newScore);
        this.lastScoreUpdate = at;
        this.updatedAt = at;
        this.updatedAtAssigned = true;
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
        if (lastScoreUpdate == null) {
            lastScoreUpdate = now;
        }
        updatedAtAssigned = false;
    }

    @PreUpdate
    protected void onUpdate() {
        if (!updatedAtAssigned || updatedAt == null) {
            updatedAt = Instant.now();
        }
        updatedAtAssigned = false;
    }
}
