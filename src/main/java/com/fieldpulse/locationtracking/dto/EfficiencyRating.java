package com.fieldpulse.locationtracking.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EfficiencyRating {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String label;

    EfficiencyRating(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /** 80+ is High, 60+ is Medium. */
    public static EfficiencyRating fromScore(int score) {
        if (score >= 80) {
            return HIGH;
        }
        return score >= 60 ? MEDIUM : LOW;
    }
}
