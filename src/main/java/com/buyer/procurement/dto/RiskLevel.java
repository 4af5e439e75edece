package com.buyer.procurement.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/** Graded level of a risk category or of a whole assessment. Declaration order is ascending. */
public enum RiskLevel {
    LOW(25),
    MEDIUM(50),
    HIGH(75),
    CRITICAL(100);

    private final int score;

    RiskLevel(int score) {
        this.score = score;
    }

    /** Weight of the level when a category contributes to the overall score. */
    public int getScore() {
        return score;
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }

    public static RiskLevel forScore(int score) {
        if (score >= 75) {
            return CRITICAL;
        }
        if (score >= 50) {
            return HIGH;
        }
        return score >= 25 ? MEDIUM : LOW;
    }
}
