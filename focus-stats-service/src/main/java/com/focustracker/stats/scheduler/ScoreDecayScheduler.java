package com.focustracker.stats.scheduler;

import com.focustracker.stats.dto.DecaySweepResult;
import com.focustracker.stats.service.ScoreDecayService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Runs the leaderboard score decay sweep on a schedule.
 * A failed sweep is logged and retried on the next run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "focus.stats.decay", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScoreDecayScheduler {

    private final ScoreDecayService decayService;
    private final Clock clock;

    @Scheduled(cron = "${focus.stats.decay.cron:0 0 * * * *}")
    public void decayScores() {
        log.debug("Running scheduled leaderboard score decay");
        try {
            DecaySweepResult result = decayService.sweepAndDecay(clock.instant());
            log.debug("Scheduled decay touched {} records", result.getUpdatedCount());
        } catch (Exception e) {
            log.error("Scheduled leaderboard score decay failed", e);
        }
    }
}
