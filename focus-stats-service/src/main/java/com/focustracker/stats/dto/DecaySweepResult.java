package com.focustracker.stats.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one decay sweep
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecaySweepResult {
    private int updatedCount;
}
