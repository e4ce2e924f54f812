package com.focustracker.stats.dto;

import com.focustracker.stats.model.GoalCategory;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class LeaderboardEntry {
    private int rank;
    private Long userId;
    private GoalCategory category;
    private double leaderboardScore;
    private int completedSessions;
    private int totalDurationMinutes;
    private int streakDays;
    private Instant lastActivity;
}
