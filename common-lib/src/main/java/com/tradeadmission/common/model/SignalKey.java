package com.tradeadmission.common.model;

/**
 * The eight directional signal components every candidate carries.
 * Shared key set for {@link RawSignalVector} and {@link WeightVector}.
 */
public enum SignalKey {
    TREND,
    MOMENTUM,
    VOLATILITY,
    REGIME,
    SECTOR,
    REVERSAL,
    BREAKOUT,
    MEAN_REVERSION
}
