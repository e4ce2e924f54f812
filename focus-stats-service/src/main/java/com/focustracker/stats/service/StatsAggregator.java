package com.focustracker.stats.service;

import com.focustracker.stats.entity.UserCategoryStats;
import com.focustracker.stats.model.GoalCategory;
import com.focustracker.stats.model.SessionCompletionEvent;
import com.focustracker.stats.repository.UserCategoryStatsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Objects;

/**
 * Folds completed sessions into the per-user, per-category statistics row
 */
@Service
@Slf4j
public class StatsAggregator {

    private final UserCategoryStatsRepository statsRepository;
    private final ScorePolicy scorePolicy;
    private final StreakCalculator streakCalculator;
    private final TransactionTemplate transactionTemplate;

    public StatsAggregator(UserCategoryStatsRepository statsRepository,
                           ScorePolicy scorePolicy,
                           StreakCalculator streakCalculator,
                           TransactionTemplate transactionTemplate) {
        this.statsRepository = statsRepository;
        this.scorePolicy = scorePolicy;
        this.streakCalculator = streakCalculator;
        this.transactionTemplate = transactionTemplate;
    }

    public UserCategoryStats recordCompletion(SessionCompletionEvent event) {
        return recordCompletion(event.getUserId(), event.getCategory(),
                event.getActualDurationMinutes(), event.getCompletionTimestamp());
    }

    /**
     * Record one completed session. The row is locked while counters, streak and score are
     * recomputed, so a concurrent decay sweep cannot overwrite the result.
     * <p>
     * Two first completions for the same user and category can both try to insert the row; the
     * loser is retried once in a new transaction, where the locking read finds the winner's row.
     * The retry only happens when no outer transaction is active.
     */
    public UserCategoryStats recordCompletion(Long userId, GoalCategory category,
                                              int actualDurationMinutes, Instant now) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(now, "now");
        if (actualDurationMinutes < 0) {
            throw new IllegalArgumentException("Session duration cannot be negative: " + actualDurationMinutes);
        }

        try {
            return transactionTemplate.execute(status -> apply(userId, category, actualDurationMinutes, now));
        } catch (DataIntegrityViolationException e) {
            if (TransactionSynchronizationManager.isActualTransactionActive()) {
                throw e;
            }
            log.debug("Concurrent first completion for user {} in {}, retrying", userId, category.getValue());
            return transactionTemplate.execute(status -> apply(userId, category, actualDurationMinutes, now));
        }
    }

    private UserCategoryStats apply(Long userId, GoalCategory category, int actualDurationMinutes, Instant now) {
        UserCategoryStats stats = statsRepository.findForUpdate(userId, category)
                .orElse(null);

        if (stats == null) {
            stats = UserCategoryStats.builder()
                    .userId(userId)
                    .category(category)
                    .totalSessions(1)
                    .completedSessions(1)
                    .totalDurationMinutes(actualDurationMinutes)
                    .streakDays(streakCalculator.nextStreak(0, null, now))
                    .lastActivity(now)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            log.debug("Creating {} stats for user {}", category.getValue(), userId);
        } else {
            stats.setTotalSessions(stats.getTotalSessions() + 1);
            stats.setCompletedSessions(stats.getCompletedSessions() + 1);
            stats.setTotalDurationMinutes(stats.getTotalDurationMinutes() + actualDurationMinutes);
            stats.setStreakDays(streakCalculator.nextStreak(stats.getStreakDays(), stats.getLastActivity(), now));
            stats.setLastActivity(now);
        }

        stats.applyScore(scorePolicy.score(stats.getCompletedSessions(),
                stats.getTotalDurationMinutes(), stats.getStreakDays()), now);

        UserCategoryStats saved = statsRepository.save(stats);
        log.debug("User {} {} stats: completed={}, minutes={}, streak={}, score={}",
                userId, category.getValue(), saved.getCompletedSessions(),
                saved.getTotalDurationMinutes(), saved.getStreakDays(), saved.getLeaderboardScore());
        return saved;
    }
}
