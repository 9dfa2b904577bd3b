package com.aera.backend.modules.readiness.application;

/**
 * Pure scoring function for household preparedness. Implementations must not touch the
 * database; recalculation stores whatever they return.
 */
@FunctionalInterface
public interface ReadinessCalculator {

    ReadinessResult calculate(ReadinessInput input);
}
