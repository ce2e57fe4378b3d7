package com.tradeadmission.common.gate;

import com.tradeadmission.common.model.Candidate;
import com.tradeadmission.common.model.GateBreakdown;
import com.tradeadmission.common.model.RawSignalVector;
import com.tradeadmission.common.model.RegimeLabel;

/**
 * Three independent multiplicative gates combined into one bounded composite.
 *
 * <h3>Volatility gate</h3>
 * <pre>
 *   volatility &lt; 0    → 0.25  (chop / chaos)
 *   volatility &gt; 0.7  → 0.5   (excessive)
 *   otherwise          → 1.0
 * </pre>
 *
 * <h3>Regime-consistency gate</h3>
 * <pre>
 *   BULL and trend &lt; 0 and momentum &lt; 0  → 0.5
 *   BEAR and trend &gt; 0 and momentum &gt; 0  → 0.5
 *   otherwise (incl. RANGE / UNKNOWN)       → 1.0
 * </pre>
 *
 * <h3>Sector-alignment multiplier</h3>
 * <pre>
 *   sectorMomentum or trend == 0  → 1.0
 *   same sign                     → 1.2
 *   opposite sign                 → 0.5
 * </pre>
 *
 * <h3>Composite</h3>
 * <pre>
 *   min(1.0, max(GATE_MIN, vol × regime × sector))
 * </pre>
 * The upper cap keeps the sector boost from exceeding full strength; the floor keeps
 * every signal combination damped rather than silenced.
 *
 * <p>No logging. No side-effects. Thread-safe.
 */
public final class GateStack {

    public static final double GATE_MIN = 0.1;
    public static final double GATE_MAX = 1.0;

    static final double CHOP_VOLATILITY_GATE      = 0.25;
    static final double EXCESSIVE_VOLATILITY_GATE = 0.5;
    static final double EXCESSIVE_VOLATILITY      = 0.7;

    static final double REGIME_CONFLICT_GATE = 0.5;

    static final double SECTOR_ALIGNED_MULT    = 1.2;
    static final double SECTOR_OPPOSED_MULT    = 0.5;

    private GateStack() {}

    public static double volatilityGate(double volatilitySignal) {
        if (volatilitySignal < 0.0) return CHOP_VOLATILITY_GATE;
        if (volatilitySignal > EXCESSIVE_VOLATILITY) return EXCESSIVE_VOLATILITY_GATE;
        return 1.0;
    }

    public static double regimeGate(RegimeLabel regime, double trendSignal, double momentumSignal) {
        if (regime == RegimeLabel.BULL && trendSignal < 0.0 && momentumSignal < 0.0) {
            return REGIME_CONFLICT_GATE;
        }
        if (regime == RegimeLabel.BEAR && trendSignal > 0.0 && momentumSignal > 0.0) {
            return REGIME_CONFLICT_GATE;
        }
        return 1.0;
    }

    public static double sectorMultiplier(double sectorMomentum, double trendSignal) {
        if (sectorMomentum == 0.0 || trendSignal == 0.0) {
            return 1.0;
        }
        return (sectorMomentum > 0.0) == (trendSignal > 0.0) ? SECTOR_ALIGNED_MULT : SECTOR_OPPOSED_MULT;
    }

    /**
     * Clamps a raw gate product into [{@value #GATE_MIN}, {@value #GATE_MAX}].
     * A non-finite product resolves to {@value #GATE_MIN}.
     */
    public static double composite(double volGate, double regimeGate, double sectorMult) {
        double product = volGate * regimeGate * sectorMult;
        if (!Double.isFinite(product)) {
            return GATE_MIN;
        }
        return Math.min(GATE_MAX, Math.max(GATE_MIN, product));
    }

    /**
     * Evaluates all three sub-gates for a candidate.
     *
     * @param candidate normalised candidate (signals and regime never null)
     * @return the full {@link GateBreakdown} — never {@code null}
     */
    public static GateBreakdown evaluate(Candidate candidate) {
        RawSignalVector signals = candidate.signals();
        double vol    = volatilityGate(signals.volatility());
        double regime = regimeGate(candidate.regime(), signals.trend(), signals.momentum());
        double sector = sectorMultiplier(candidate.sectorMomentum(), signals.trend());
        return new GateBreakdown(vol, regime, sector, composite(vol, regime, sector));
    }
}
