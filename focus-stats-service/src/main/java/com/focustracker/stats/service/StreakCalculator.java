package com.focustracker.stats.service;

import com.focustracker.stats.config.StatsProperties;
import com.focustracker.stats.model.StreakPolicy;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Computes the streak that results from a new completion.
 * Days are whole 24 hour periods since the previous activity, not calendar dates.
 */
@Component
public class StreakCalculator {

    private final StreakPolicy policy;

    public StreakCalculator(StatsProperties properties) {
        this.policy = properties.getStreak().getPolicy();
    }

    public int nextStreak(int currentStreak, Instant lastActivity, Instant now) {
        if (lastActivity == null) {
            return 1;
        }

        // Duration.toDays truncates; a clock running backwards lands in the same-day branch
        long daysSinceLastActivity = Duration.between(lastActivity, now).toDays();

        if (daysSinceLastActivity > 1) {
            // Streak broken, this completion starts a new one
            return 1;
        }
        if (daysSinceLastActivity <= 0 && policy == StreakPolicy.ONCE_PER_DAY) {
            return Math.max(currentStreak, 1);
        }
        return currentStreak + 1;
    }
}
