package com.focustracker.stats.service;

/**
 * Turns a statistics row's counters into a leaderboard score.
 * Implementations must be non-decreasing in each argument and never negative.
 */
public interface ScorePolicy {

    double score(int completedSessions, int totalDurationMinutes, int streakDays);
}
