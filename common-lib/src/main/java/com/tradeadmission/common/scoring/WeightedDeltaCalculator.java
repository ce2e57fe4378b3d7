package com.tradeadmission.common.scoring;

import com.tradeadmission.common.gate.GateStack;
import com.tradeadmission.common.model.RawSignalVector;
import com.tradeadmission.common.model.SignalKey;
import com.tradeadmission.common.model.WeightVector;

/**
 * Combines a signal vector, its regime weights and the composite gate into one
 * bounded score adjustment:
 * <pre>
 *   delta = clamp(gate × Σ signals[k] × weights[k], −0.25, +0.25)
 * </pre>
 * The clamp keeps this layer's influence on ranking strictly secondary to the base score.
 *
 * <p>Pure and deterministic; the same inputs always produce the same delta.
 */
public final class WeightedDeltaCalculator {

    public static final double MAX_ABS_DELTA = 0.25;

    private WeightedDeltaCalculator() {}

    public static double delta(RawSignalVector signals, WeightVector weights, double gate) {
        if (signals == null || weights == null) {
            return 0.0;
        }
        double safeGate = Double.isFinite(gate) ? gate : GateStack.GATE_MIN;

        double dot = 0.0;
        for (SignalKey key : SignalKey.values()) {
            dot += signals.get(key) * weights.get(key);
        }

        double raw = safeGate * dot;
        if (!Double.isFinite(raw)) {
            return 0.0;
        }
        return Math.max(-MAX_ABS_DELTA, Math.min(MAX_ABS_DELTA, raw));
    }
}
