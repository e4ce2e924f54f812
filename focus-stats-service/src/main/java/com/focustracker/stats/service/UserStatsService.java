package com.focustracker.stats.service;

import com.focustracker.stats.config.StatsProperties;
import com.focustracker.stats.entity.UserCategoryStats;
import com.focustracker.stats.model.GoalCategory;
import com.focustracker.stats.model.SessionStatus;
import com.focustracker.stats.repository.FocusSessionRepository;
import com.focustracker.stats.repository.UserCategoryStatsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Per-user statistics, one row per category the user has completed sessions in
 */
@Service
@Slf4j
public class UserStatsService {

    private final UserCategoryStatsRepository statsRepository;
    private final FocusSessionRepository sessionRepository;
    private final Clock clock;
    private final Duration staleAfter;

    public UserStatsService(UserCategoryStatsRepository statsRepository,
                            FocusSessionRepository sessionRepository,
                            StatsProperties properties,
                            Clock clock) {
        this.statsRepository = statsRepository;
        this.sessionRepository = sessionRepository;
        this.clock = clock;
        this.staleAfter = properties.getStreak().getStaleAfter();
    }

    /**
     * Get a user's statistics, ordered by category descending.
     * <p>
     * This read has a side effect: stale streaks are zeroed first via
     * {@link #reconcileStaleStreaks}. Use {@link #findUserStats} for a pure read.
     *
     * @param category category filter, or {@code null} for all categories
     */
    @Transactional
    public List<UserCategoryStats> getUserStats(Long userId, GoalCategory category) {
        int reset = reconcileStaleStreaks(userId, category, clock.instant());
        if (reset > 0) {
            log.debug("Reset {} stale streak(s) for user {}", reset, userId);
        }
        return findUserStats(userId, category);
    }

    @Transactional(readOnly = true)
    public List<UserCategoryStats> findUserStats(Long userId, GoalCategory category) {
        if (category == null) {
            return statsRepository.findByUserIdOrderByCategoryDesc(userId);
        }
        return statsRepository.findByUserIdAndCategory(userId, category)
                .map(List::of)
                .orElse(List.of());
    }

    /**
     * Zero the streak of every row whose last activity is at least the stale window old and
     * which has no completed session in its category inside that window.
     * With the default 48h window this agrees with {@link StreakCalculator}: a streak is only
     * zeroed once the next completion would have restarted it.
     *
     * @return number of rows reset
     */
    @Transactional
    public int reconcileStaleStreaks(Long userId, GoalCategory category, Instant now) {
        Instant cutoff = now.minus(staleAfter);
        // Same lock order as the decay sweep
        List<UserCategoryStats> rows = new ArrayList<>(findUserStats(userId, category));
        rows.sort(Comparator.comparing(UserCategoryStats::getId));

        int reset = 0;
        for (UserCategoryStats stats : rows) {
            if (stats.getStreakDays() == 0 || stats.getLastActivity() == null
                    || stats.getLastActivity().isAfter(cutoff)) {
                continue;
            }
            long recent = sessionRepository.countByUserAndCategoryAndStatusSince(
                    userId, stats.getCategory(), SessionStatus.COMPLETED, cutoff);
            if (recent == 0) {
                reset += statsRepository.resetStaleStreak(stats.getId(), cutoff, now);
            }
        }
        return reset;
    }
}
