package com.focustracker.stats.service;

import com.focustracker.stats.config.StatsProperties;
import org.springframework.stereotype.Service;

/**
 * Rewards frequency, volume and consistency:
 * {@code completed * 10 + floor(minutes / 10) + min(streak * 5, 100)} with the default weights.
 */
@Service
public class StandardScorePolicy implements ScorePolicy {

    private final StatsProperties.Score weights;

    public StandardScorePolicy(StatsProperties properties) {
        this.weights = properties.getScore();
    }

    @Override
    public double score(int completedSessions, int totalDurationMinutes, int streakDays) {
        long sessionPoints = (long) Math.max(0, completedSessions) * weights.getSessionWeight();
        long durationPoints = Math.max(0, totalDurationMinutes) / weights.getMinutesPerPoint();
        long streakBonus = Math.min((long) Math.max(0, streakDays) * weights.getStreakWeight(),
                weights.getStreakBonusCap());
        return sessionPoints + durationPoints + streakBonus;
    }
}
