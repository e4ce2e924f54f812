package com.focustracker.stats.model;

import java.util.Locale;

/**
 * Categories a goal (and therefore every session and statistics row) belongs to
 */
public enum GoalCategory {
    PHYSICAL("physical"),
    MENTAL("mental"),
    SKILL("skill"),
    HABIT("habit"),
    CREATIVE("creative"),
    SOCIAL("social"),
    SPIRITUAL("spiritual"),
    PROFESSIONAL("professional");

    private final String value;

    GoalCategory(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolve a category from its external value, ignoring case
     */
    public static GoalCategory fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Category must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (GoalCategory category : values()) {
            if (category.value.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown goal category: " + value);
    }
}
