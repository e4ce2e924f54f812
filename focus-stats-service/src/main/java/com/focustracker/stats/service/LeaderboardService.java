package com.focustracker.stats.service;

import com.focustracker.stats.config.StatsProperties;
import com.focustracker.stats.dto.LeaderboardEntry;
import com.focustracker.stats.entity.UserCategoryStats;
import com.focustracker.stats.model.GoalCategory;
import com.focustracker.stats.repository.UserCategoryStatsRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Read side of the leaderboard. Scores are returned as last written; decay only happens in the sweep.
 */
@Service
public class LeaderboardService {

    private final UserCategoryStatsRepository statsRepository;
    private final int defaultLimit;
    private final int maxLimit;

    public LeaderboardService(UserCategoryStatsRepository statsRepository, StatsProperties properties) {
        this.statsRepository = statsRepository;
        this.defaultLimit = properties.getLeaderboard().getDefaultLimit();
        this.maxLimit = properties.getLeaderboard().getMaxLimit();
    }

    /**
     * Get the highest scoring statistics rows, optionally within one category.
     * Ties are ordered by user id.
     *
     * @param category category filter, or {@code null} for all categories
     * @param limit    number of rows, or {@code null} for the default
     */
    @Transactional(readOnly = true)
    public List<UserCategoryStats> getLeaderboard(GoalCategory category, Integer limit) {
        PageRequest page = PageRequest.of(0, resolveLimit(limit));
        if (category == null) {
            return statsRepository.findLeaderboard(page);
        }
        return statsRepository.findLeaderboardByCategory(category, page);
    }

    /**
     * Same ordering as {@link #getLeaderboard}, with ranks attached
     */
    @Transactional(readOnly = true)
    public List<LeaderboardEntry> getLeaderboardEntries(GoalCategory category, Integer limit) {
        List<UserCategoryStats> rows = getLeaderboard(category, limit);
        List<LeaderboardEntry> entries = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            UserCategoryStats s = rows.get(i);
            entries.add(LeaderboardEntry.builder()
                    .rank(i + 1)
                    .userId(s.getUserId())
                    .category(s.getCategory())
                    .leaderboardScore(s.getLeaderboardScore())
                    .completedSessions(s.getCompletedSessions())
                    .totalDurationMinutes(s.getTotalDurationMinutes())
                    .streakDays(s.getStreakDays())
                    .lastActivity(s.getLastActivity())
                    .build());
        }
        return entries;
    }

    private int resolveLimit(Integer limit) {
        if (limit == null) {
            return defaultLimit;
        }
        if (limit <= 0 || limit > maxLimit) {
            throw new IllegalArgumentException("Leaderboard limit must be between 1 and " + maxLimit + ": " + limit);
        }
        return limit;
    }
}
