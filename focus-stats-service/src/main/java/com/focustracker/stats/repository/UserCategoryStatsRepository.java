package com.focustracker.stats.repository;

import com.focustracker.stats.entity.UserCategoryStats;
import com.focustracker.stats.model.GoalCategory;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface UserCategoryStatsRepository extends JpaRepository<UserCategoryStats, Long> {

    Optional<UserCategoryStats> findByUserIdAndCategory(Long userId, GoalCategory category);

    List<UserCategoryStats> findByUserIdOrderByCategoryDesc(Long userId);

    /**
     * Row-locking read used by the completion path before recomputing counters and score
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM UserCategoryStats s WHERE s.userId = :userId AND s.category = :category")
    Optional<UserCategoryStats> findForUpdate(@Param("userId") Long userId,
                                              @Param("category") GoalCategory category);

    /**
     * Rows whose score is positive and has not moved since {@code cutoff}, locked for the sweep
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM UserCategoryStats s WHERE s.lastScoreUpdate < :cutoff AND s.leaderboardScore > 0 " +
           "ORDER BY s.id ASC")
    List<UserCategoryStats> findDecayCandidatesForUpdate(@Param("cutoff") Instant cutoff);

    @Query("SELECT s FROM UserCategoryStats s " +
           "ORDER BY s.leaderboardScore DESC, s.userId ASC, s.category ASC")
    List<UserCategoryStats> findLeaderboard(Pageable pageable);

    @Query("SELECT s FROM UserCategoryStats s WHERE s.category = :category " +
           "ORDER BY s.leaderboardScore DESC, s.userId ASC")
    List<UserCategoryStats> findLeaderboardByCategory(@Param("category") GoalCategory category, Pageable pageable);

    /**
     * Zero the streak of one row if its last activity is still at or before {@code cutoff}.
     * Only streak and bookkeeping columns are written.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE UserCategoryStats s SET s.streakDays = 0, s.updatedAt = :now " +
           "WHERE s.id = :id AND s.streakDays > 0 AND s.lastActivity <= :cutoff")
    int resetStaleStreak(@Param("id") Long id, @Param("cutoff") Instant cutoff, @Param("now") Instant now);
}
