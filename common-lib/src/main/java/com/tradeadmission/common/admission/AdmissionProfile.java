package com.tradeadmission.common.admission;

import java.time.Duration;
import java.util.Locale;

/**
 * Named expectancy profiles.
 *
 * <ul>
 *   <li>{@link #BOOTSTRAP}    — EV floor {@code -0.02}: loose, so the system keeps trading
 *                               (and learning) while its EV estimates are immature.</li>
 *   <li>{@link #STEADY_STATE} — EV floor {@code 0.10}.</li>
 * </ul>
 *
 * <p>Shared limits: capacity 16, 6 new positions per cycle, score floor 1.5,
 * 6h displacement cooldown, any strictly positive displacement margin,
 * no displacement min hold.
 */
public enum AdmissionProfile {
    BOOTSTRAP(-0.02),
    STEADY_STATE(0.10);

    public static final int      DEFAULT_CAPACITY                    = 16;
    public static final int      DEFAULT_MAX_NEW_POSITIONS_PER_CYCLE = 6;
    public static final double   DEFAULT_SCORE_FLOOR                 = 1.5;
    public static final Duration DEFAULT_COOLDOWN                    = Duration.ofHours(6);
    public static final double   DEFAULT_DISPLACEMENT_MARGIN         = 0.0;
    public static final double   DEFAULT_EMERGENCY_SCORE             = 3.0;

    private final double evFloor;

    AdmissionProfile(double evFloor) {
        this.evFloor = evFloor;
    }

    public double evFloor() {
        return evFloor;
    }

    public AdmissionConfig toConfig() {
        return new AdmissionConfig(
            DEFAULT_CAPACITY,
            DEFAULT_MAX_NEW_POSITIONS_PER_CYCLE,
            DEFAULT_SCORE_FLOOR,
            evFloor,
            DEFAULT_COOLDOWN,
            DEFAULT_DISPLACEMENT_MARGIN,
            true,
            Duration.ZERO,
            DEFAULT_EMERGENCY_SCORE);
    }

    /**
     * Resolves a configuration value such as {@code bootstrap} or {@code steady-state}.
     * Unrecognised or blank names resolve to {@link #BOOTSTRAP}.
     */
    public static AdmissionProfile fromName(String name) {
        if (name == null || name.isBlank()) {
            return BOOTSTRAP;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (AdmissionProfile profile : values()) {
            if (profile.name().equals(normalized)) {
                return profile;
            }
        }
        return BOOTSTRAP;
    }
}
