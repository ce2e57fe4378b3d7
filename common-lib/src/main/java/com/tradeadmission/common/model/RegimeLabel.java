package com.tradeadmission.common.model;

import java.util.Locale;

/**
 * Coarse market-state label supplied by the upstream regime detector.
 * {@link #UNKNOWN} is the safe default when the detector has no opinion.
 */
public enum RegimeLabel {
    BULL,
    BEAR,
    RANGE,
    UNKNOWN;

    /**
     * Lenient parse of an upstream label. Case-insensitive and whitespace-tolerant;
     * {@code null}, blank or unrecognised labels resolve to {@link #UNKNOWN}.
     */
    public static RegimeLabel fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException unrecognised) {
            return UNKNOWN;
        }
    }
}
