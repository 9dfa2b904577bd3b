package com.aera.backend.modules.readiness.application;

/**
 * @param score {@code null} when the calculator does not score the household
 */
public record ReadinessResult(Integer score, String tier) {

    public static final String UNSCORED_TIER = "UNSCORED";

    public static ReadinessResult unscored() {
        return new ReadinessResult(null, UNSCORED_TIER);
    }
}
