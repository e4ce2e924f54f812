package com.focustracker.stats.service;

import com.focustracker.stats.config.StatsProperties;
import com.focustracker.stats.dto.DecaySweepResult;
import com.focustracker.stats.entity.UserCategoryStats;
import com.focustracker.stats.repository.UserCategoryStatsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Applies time decay to leaderboard scores that have not moved within the grace period.
 * Failures propagate to the caller; a later sweep picks up whatever was left.
 */
@Service
@Slf4j
public class ScoreDecayService {

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final UserCategoryStatsRepository statsRepository;
    private final double dailyRate;
    private final Duration gracePeriod;

    public ScoreDecayService(UserCategoryStatsRepository statsRepository, StatsProperties properties) {
        this.statsRepository = statsRepository;
        this.dailyRate = properties.getDecay().getDailyRate();
        this.gracePeriod = properties.getDecay().getGracePeriod();
    }

    @Transactional
    public DecaySweepResult sweepAndDecay(Instant now) {
        Objects.requireNonNull(now, "now");
        Instant cutoff = now.minus(gracePeriod);

        List<UserCategoryStats> candidates = statsRepository.findDecayCandidatesForUpdate(cutoff);
        for (UserCategoryStats stats : candidates) {
            stats.applyScore(decayedScore(stats.getLeaderboardScore(), stats.getLastScoreUpdate(), now), now);
        }
        statsRepository.saveAll(candidates);

        log.info("Score decay sweep at {} updated {} records", now, candidates.size());
        return new DecaySweepResult(candidates.size());
    }

    /**
     * {@code score * rate^days}, with days counted fractionally
     */
    double decayedScore(double score, Instant lastScoreUpdate, Instant now) {
        double elapsedDays = Duration.between(lastScoreUpdate, now).toMillis() / MILLIS_PER_DAY;
        return score * Math.pow(dailyRate, elapsedDays);
    }
}
