package com.focustracker.stats.config;

import com.focustracker.stats.model.StreakPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for statistics aggregation, leaderboard scoring and score decay
 */
@ConfigurationProperties(prefix = "focus.stats")
@Validated
@Data
public class StatsProperties {

    @Valid
    private Score score = new Score();

    @Valid
    private Streak streak = new Streak();

    @Valid
    private Decay decay = new Decay();

    @Valid
    private Leaderboard leaderboard = new Leaderboard();

    @Data
    public static class Score {

        /**
         * Points per completed session
         */
        @Min(0)
        private int sessionWeight = 10;

        /**
         * Minutes of focus time worth one point
         */
        @Min(1)
        private int minutesPerPoint = 10;

        /**
         * Points per streak day, before the cap
         */
        @Min(0)
        private int streakWeight = 5;

        /**
         * Upper bound of the streak bonus
         */
        @Min(0)
        private int streakBonusCap = 100;
    }

    @Data
    public static class Streak {

        @NotNull
        private StreakPolicy policy = StreakPolicy.INCREMENT_ALWAYS;

        /**
         * Inactivity after which a read of the user's stats zeroes the streak.
         * Matches the point where the next completion would start a new streak anyway.
         */
        @NotNull
        private Duration staleAfter = Duration.ofHours(48);
    }

    @Data
    public static class Decay {

        private boolean enabled = true;

        /**
         * Multiplier applied per elapsed day
         */
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double dailyRate = 0.98;

        /**
         * Rows whose score changed within this window are left alone by a sweep
         */
        @NotNull
        private Duration gracePeriod = Duration.ofHours(24);

        @NotNull
        private String cron = "0 0 * * * *";
    }

    @Data
    public static class Leaderboard {

        @Min(1)
        private int defaultLimit = 10;

        @Min(1)
        @Max(1000)
        private int maxLimit = 100;
    }
}
