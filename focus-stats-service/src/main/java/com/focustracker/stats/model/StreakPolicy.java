package com.focustracker.stats.model;

/**
 * How completions on the same day affect a running streak
 */
public enum StreakPolicy {
    /**
     * Every completion within the streak window adds one, including repeats on the same day
     */
    INCREMENT_ALWAYS,

    /**
     * Repeat completions within the same day leave the streak unchanged
     */
    ONCE_PER_DAY
}
