package com.tradeadmission.common.weighting;

import com.tradeadmission.common.model.RegimeLabel;
import com.tradeadmission.common.model.SignalKey;
import com.tradeadmission.common.model.WeightVector;

import java.util.EnumSet;
import java.util.Set;

/**
 * Maps a {@link RegimeLabel} to the per-signal {@link WeightVector} used by the
 * weighted delta calculation.
 *
 * <p><b>Base vector</b> ({@link #standard()}):
 * <pre>
 *   trend 0.050  momentum 0.045  volatility 0.020  regime        0.025
 *   sector 0.030 reversal 0.025  breakout   0.035  meanReversion 0.015
 * </pre>
 *
 * <p><b>Regime multipliers</b> (boost ×{@value #DEFAULT_BOOST}, damp ×{@value #DEFAULT_DAMP}):
 * <pre>
 *   BULL    → boost trend, momentum, breakout;  damp reversal, meanReversion
 *   BEAR    → boost trend, momentum, reversal;  damp meanReversion
 *   RANGE   → boost reversal, meanReversion;    damp trend, breakout
 *   UNKNOWN → base vector unmodified
 * </pre>
 *
 * <p>Both multipliers must be non-negative, so every resulting weight stays non-negative.
 * Immutable; {@link #weightsFor(RegimeLabel)} is a pure lookup.
 */
public final class RegimeWeightTable {

    static final double DEFAULT_BOOST = 1.5;
    static final double DEFAULT_DAMP  = 0.5;

    public static final WeightVector BASE_WEIGHTS = new WeightVector(
        0.050,  // trend
        0.045,  // momentum
        0.020,  // volatility
        0.025,  // regime
        0.030,  // sector
        0.025,  // reversal
        0.035,  // breakout
        0.015   // meanReversion
    );

    private static final Set<SignalKey> BULL_BOOST  = EnumSet.of(SignalKey.TREND, SignalKey.MOMENTUM, SignalKey.BREAKOUT);
    private static final Set<SignalKey> BULL_DAMP   = EnumSet.of(SignalKey.REVERSAL, SignalKey.MEAN_REVERSION);
    private static final Set<SignalKey> BEAR_BOOST  = EnumSet.of(SignalKey.TREND, SignalKey.MOMENTUM, SignalKey.REVERSAL);
    private static final Set<SignalKey> BEAR_DAMP   = EnumSet.of(SignalKey.MEAN_REVERSION);
    private static final Set<SignalKey> RANGE_BOOST = EnumSet.of(SignalKey.REVERSAL, SignalKey.MEAN_REVERSION);
    private static final Set<SignalKey> RANGE_DAMP  = EnumSet.of(SignalKey.TREND, SignalKey.BREAKOUT);

    private final WeightVector base;
    private final WeightVector bull;
    private final WeightVector bear;
    private final WeightVector range;

    public RegimeWeightTable(WeightVector base, double boost, double damp) {
        if (base == null) {
            throw new IllegalArgumentException("base weight vector is required");
        }
        if (!Double.isFinite(boost) || boost < 0.0 || !Double.isFinite(damp) || damp < 0.0) {
            throw new IllegalArgumentException(
                "regime multipliers must be finite and non-negative. boost=" + boost + " damp=" + damp);
        }
        this.base  = base;
        this.bull  = apply(base, BULL_BOOST, BULL_DAMP, boost, damp);
        this.bear  = apply(base, BEAR_BOOST, BEAR_DAMP, boost, damp);
        this.range = apply(base, RANGE_BOOST, RANGE_DAMP, boost, damp);
    }

    /** Table built from {@link #BASE_WEIGHTS} and the default multipliers. */
    public static RegimeWeightTable standard() {
        return new RegimeWeightTable(BASE_WEIGHTS, DEFAULT_BOOST, DEFAULT_DAMP);
    }

    /**
     * @param regime the candidate's regime; {@code null} is treated as {@link RegimeLabel#UNKNOWN}
     * @return the regime-adjusted weights — never {@code null}
     */
    public WeightVector weightsFor(RegimeLabel regime) {
        if (regime == null) {
            return base;
        }
        return switch (regime) {
            case BULL    -> bull;
            case BEAR    -> bear;
            case RANGE   -> range;
            case UNKNOWN -> base;
        };
    }

    public WeightVector base() {
        return base;
    }

    private static WeightVector apply(WeightVector start, Set<SignalKey> boosted, Set<SignalKey> damped,
                                      double boost, double damp) {
        WeightVector result = start;
        for (SignalKey key : boosted) {
            result = result.scaled(key, boost);
        }
        for (SignalKey key : damped) {
            result = result.scaled(key, damp);
        }
        return result;
    }
}
