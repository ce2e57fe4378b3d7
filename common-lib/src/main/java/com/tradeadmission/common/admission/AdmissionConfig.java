package com.tradeadmission.common.admission;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeadmission.common.exception.AdmissionConfigException;

import java.time.Duration;

/**
 * Fixed per-cycle admission limits. Loaded by the host once per cycle (or on change),
 * never mutated by the controller.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code capacity}                   — maximum open positions</li>
 *   <li>{@code maxNewPositionsPerCycle}    — admissions (incl. displacements) per cycle</li>
 *   <li>{@code scoreFloor}                 — minimum final score</li>
 *   <li>{@code evFloor}                    — minimum EV estimate, when one is supplied</li>
 *   <li>{@code cooldownDuration}           — cooldown placed on a displaced symbol</li>
 *   <li>{@code displacementMargin}         — candidate must beat the weakest entry score by more than this</li>
 *   <li>{@code displacementEnabled}        — master switch for displacement</li>
 *   <li>{@code displacementMinHold}        — incumbent age below which it cannot be displaced</li>
 *   <li>{@code displacementEmergencyScore} — incumbents scoring below this bypass the min hold</li>
 * </ul>
 *
 * @throws AdmissionConfigException from the constructor when a limit is out of range
 */
public record AdmissionConfig(
    @JsonProperty("capacity")                   int capacity,
    @JsonProperty("maxNewPositionsPerCycle")    int maxNewPositionsPerCycle,
    @JsonProperty("scoreFloor")                 double scoreFloor,
    @JsonProperty("evFloor")                    double evFloor,
    @JsonProperty("cooldownDuration")           Duration cooldownDuration,
    @JsonProperty("displacementMargin")         double displacementMargin,
    @JsonProperty("displacementEnabled")        boolean displacementEnabled,
    @JsonProperty("displacementMinHold")        Duration displacementMinHold,
    @JsonProperty("displacementEmergencyScore") double displacementEmergencyScore
) {

    public AdmissionConfig {
        if (capacity < 1) {
            throw new AdmissionConfigException("capacity", "must be at least 1, was " + capacity);
        }
        if (maxNewPositionsPerCycle < 0) {
            throw new AdmissionConfigException("maxNewPositionsPerCycle",
                "must not be negative, was " + maxNewPositionsPerCycle);
        }
        requireFinite("scoreFloor", scoreFloor);
        requireFinite("evFloor", evFloor);
        requireFinite("displacementEmergencyScore", displacementEmergencyScore);
        requireFinite("displacementMargin", displacementMargin);
        if (displacementMargin < 0.0) {
            throw new AdmissionConfigException("displacementMargin",
                "must not be negative, was " + displacementMargin);
        }
        requireNonNegative("cooldownDuration", cooldownDuration);
        requireNonNegative("displacementMinHold", displacementMinHold);
    }

    /** Core limits only; displacement supplements take the permissive defaults. */
    public static AdmissionConfig of(int capacity, int maxNewPositionsPerCycle,
                                     double scoreFloor, double evFloor,
                                     Duration cooldownDuration, double displacementMargin) {
        return new AdmissionConfig(capacity, maxNewPositionsPerCycle, scoreFloor, evFloor,
            cooldownDuration, displacementMargin, true, Duration.ZERO,
            AdmissionProfile.DEFAULT_EMERGENCY_SCORE);
    }

    public AdmissionConfig withCapacity(int newCapacity) {
        return new AdmissionConfig(newCapacity, maxNewPositionsPerCycle, scoreFloor, evFloor,
            cooldownDuration, displacementMargin, displacementEnabled, displacementMinHold,
            displacementEmergencyScore);
    }

    public AdmissionConfig withMaxNewPositionsPerCycle(int newBudget) {
        return new AdmissionConfig(capacity, newBudget, scoreFloor, evFloor,
            cooldownDuration, displacementMargin, displacementEnabled, displacementMinHold,
            displacementEmergencyScore);
    }

    public AdmissionConfig withDisplacement(boolean enabled, Duration minHold, double emergencyScore) {
        return new AdmissionConfig(capacity, maxNewPositionsPerCycle, scoreFloor, evFloor,
            cooldownDuration, displacementMargin, enabled, minHold, emergencyScore);
    }

    private static void requireFinite(String setting, double value) {
        if (!Double.isFinite(value)) {
            throw new AdmissionConfigException(setting, "must be finite, was " + value);
        }
    }

    private static void requireNonNegative(String setting, Duration value) {
        if (value == null || value.isNegative()) {
            throw new AdmissionConfigException(setting, "must be a non-negative duration, was " + value);
        }
    }
}
