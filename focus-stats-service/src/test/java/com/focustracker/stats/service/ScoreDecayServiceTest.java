package com.focustracker.stats.service;

import com.focustracker.stats.config.StatsProperties;
import com.focustracker.stats.dto.DecaySweepResult;
import com.focustracker.stats.entity.UserCategoryStats;
import com.focustracker.stats.model.GoalCategory;
import com.focustracker.stats.repository.UserCategoryStatsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@DisplayName("ScoreDecayService Tests")
class ScoreDecayServiceTest {

    private static final Instant T = Instant.parse("2025-03-10T12:00:00Z");

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private UserCategoryStatsRepository statsRepository;

    private ScoreDecayService decayService;

    @BeforeEach
    void setUp() {
        decayService = new ScoreDecayService(statsRepository, new StatsProperties());
    }

    @Test
    @DisplayName("sweepAndDecay: score idle for two days decays by 0.98^2")
    void sweepAndDecay_TwoDaysIdle_Decays() {
        // Given
        Long id = persist(1L, GoalCategory.PHYSICAL, 100.0, T.minus(Duration.ofDays(2)));

        // When
        DecaySweepResult result = decayService.sweepAndDecay(T);
        entityManager.flush();
        entityManager.clear();

        // Then
        assertEquals(1, result.getUpdatedCount());
        UserCategoryStats stats = statsRepository.findById(id).orElseThrow();
        assertEquals(100.0 * 0.98 * 0.98, stats.getLeaderboardScore(), 1e-9);
        assertTrue(stats.getLeaderboardScore() < 100.0);
        assertEquals(T, stats.getLastScoreUpdate());
        assertEquals(T, stats.getUpdatedAt());
    }

    @Test
    @DisplayName("sweepAndDecay: elapsed time counts in fractional days")
    void sweepAndDecay_FractionalDays_UsesExactElapsedTime() {
        // Given
        Long id = persist(1L, GoalCategory.MENTAL, 80.0, T.minus(Duration.ofHours(36)));

        // When
        decayService.sweepAndDecay(T);
        entityManager.flush();
        entityManager.clear();

        // Then
        UserCategoryStats stats = statsRepository.findById(id).orElseThrow();
        assertEquals(80.0 * Math.pow(0.98, 1.5), stats.getLeaderboardScore(), 1e-9);
    }

    @Test
    @DisplayName("sweepAndDecay: recently updated and zero scores are left alone")
    void sweepAndDecay_RecentOrZero_Excluded() {
        // Given
        Long recent = persist(1L, GoalCategory.PHYSICAL, 50.0, T.minus(Duration.ofHours(12)));
        Long zero = persist(2L, GoalCategory.PHYSICAL, 0.0, T.minus(Duration.ofDays(5)));
        Long boundary = persist(3L, GoalCategory.PHYSICAL, 70.0, T.minus(Duration.ofHours(24)));
        Long stale = persist(4L, GoalCategory.PHYSICAL, 30.0, T.minus(Duration.ofDays(3)));

        // When
        DecaySweepResult result = decayService.sweepAndDecay(T);
        entityManager.flush();
        entityManager.clear();

        // Then
        assertEquals(1, result.getUpdatedCount());
        assertEquals(50.0, statsRepository.findById(recent).orElseThrow().getLeaderboardScore());
        assertEquals(T.minus(Duration.ofHours(12)), statsRepository.findById(recent).orElseThrow().getLastScoreUpdate());
        assertEquals(0.0, statsRepository.findById(zero).orElseThrow().getLeaderboardScore());
        assertEquals(T.minus(Duration.ofDays(5)), statsRepository.findById(zero).orElseThrow().getLastScoreUpdate());
        assertEquals(70.0, statsRepository.findById(boundary).orElseThrow().getLeaderboardScore());
        assertTrue(statsRepository.findById(stale).orElseThrow().getLeaderboardScore() < 30.0);
    }

    @Test
    @DisplayName("sweepAndDecay: second sweep at the same instant updates nothing")
    void sweepAndDecay_RunTwice_SecondIsNoOp() {
        // Given
        Long id = persist(1L, GoalCategory.SKILL, 245.75, T.minus(Duration.ofDays(2)));
        persist(2L, GoalCategory.SOCIAL, 150.5, T.minus(Duration.ofDays(4)));

        // When
        DecaySweepResult first = decayService.sweepAndDecay(T);
        entityManager.flush();
        double afterFirst = statsRepository.findById(id).orElseThrow().getLeaderboardScore();
        DecaySweepResult second = decayService.sweepAndDecay(T);
        entityManager.flush();
        entityManager.clear();

        // Then
        assertEquals(2, first.getUpdatedCount());
        assertEquals(0, second.getUpdatedCount());
        assertEquals(afterFirst, statsRepository.findById(id).orElseThrow().getLeaderboardScore());
    }

    @Test
    @DisplayName("sweepAndDecay: empty table reports zero updates")
    void sweepAndDecay_EmptyTable_ReturnsZero() {
        assertEquals(0, decayService.sweepAndDecay(T).getUpdatedCount());
    }

    @Test
    @DisplayName("sweepAndDecay: decay does not touch counters or streak")
    void sweepAndDecay_LeavesCountersAlone() {
        // Given
        Long id = persist(1L, GoalCategory.CREATIVE, 60.0, T.minus(Duration.ofDays(10)));

        // When
        decayService.sweepAndDecay(T);
        entityManager.flush();
        entityManager.clear();

        // Then
        UserCategoryStats stats = statsRepository.findById(id).orElseThrow();
        assertEquals(4, stats.getCompletedSessions());
        assertEquals(4, stats.getTotalSessions());
        assertEquals(120, stats.getTotalDurationMinutes());
        assertEquals(2, stats.getStreakDays());
        assertEquals(60.0 * Math.pow(0.98, 10), stats.getLeaderboardScore(), 1e-9);
    }

    @Test
    @DisplayName("sweepAndDecay: configured rate and grace period are honoured")
    void sweepAndDecay_CustomConfiguration() {
        // Given
        StatsProperties properties = new StatsProperties();
        properties.getDecay().setDailyRate(0.5);
        properties.getDecay().setGracePeriod(Duration.ofHours(6));
        ScoreDecayService customService = new ScoreDecayService(statsRepository, properties);
        Long id = persist(1L, GoalCategory.HABIT, 40.0, T.minus(Duration.ofHours(12)));

        // When
        DecaySweepResult result = customService.sweepAndDecay(T);

        // Then
        assertEquals(1, result.getUpdatedCount());
        assertEquals(40.0 * Math.pow(0.5, 0.5), statsRepository.findById(id).orElseThrow().getLeaderboardScore(), 1e-9);
    }

    private Long persist(Long userId, GoalCategory category, double score, Instant lastScoreUpdate) {
        UserCategoryStats stats = UserCategoryStats.builder()
                .userId(userId)
                .category(category)
                .totalSessions(4)
                .completedSessions(4)
                .totalDurationMinutes(120)
                .streakDays(2)
                .lastActivity(lastScoreUpdate)
                .leaderboardScore(score)
                .lastScoreUpdate(lastScoreUpdate)
                .build();
        return entityManager.persistAndFlush(stats).getId();
    }
}
