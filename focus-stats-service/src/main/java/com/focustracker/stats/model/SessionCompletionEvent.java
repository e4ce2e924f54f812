package com.focustracker.stats.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A finished focus session, as seen by the statistics aggregator
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionCompletionEvent {
    private Long userId;
    private GoalCategory category;
    private int actualDurationMinutes;
    private Instant completionTimestamp;
}
