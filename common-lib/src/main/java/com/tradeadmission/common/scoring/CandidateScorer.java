package com.tradeadmission.common.scoring;

import com.tradeadmission.common.gate.GateStack;
import com.tradeadmission.common.model.Candidate;
import com.tradeadmission.common.model.GateBreakdown;
import com.tradeadmission.common.model.ScoredCandidate;
import com.tradeadmission.common.model.WeightVector;
import com.tradeadmission.common.weighting.RegimeWeightTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the scoring chain for one candidate:
 * <ol>
 *   <li>{@link RegimeWeightTable#weightsFor} — regime-adjusted weights</li>
 *   <li>{@link GateStack#evaluate} — composite gate</li>
 *   <li>{@link WeightedDeltaCalculator#delta} — bounded adjustment</li>
 *   <li>{@link ScoreIntegrator#finalScore} — base + delta</li>
 * </ol>
 *
 * <p>Holds only the immutable weight table, so it is stateless in practice and thread-safe.
 */
public class CandidateScorer {

    private final RegimeWeightTable weightTable;

    public CandidateScorer(RegimeWeightTable weightTable) {
        this.weightTable = weightTable;
    }

    public ScoredCandidate score(Candidate candidate) {
        WeightVector  weights = weightTable.weightsFor(candidate.regime());
        GateBreakdown gate    = GateStack.evaluate(candidate);
        double delta          = WeightedDeltaCalculator.delta(candidate.signals(), weights, gate.composite());
        double finalScore     = ScoreIntegrator.finalScore(candidate.baseEntryScore(), delta);
        return new ScoredCandidate(candidate, weights, gate, delta, finalScore);
    }

    public List<ScoredCandidate> scoreAll(List<Candidate> candidates) {
        List<ScoredCandidate> scored = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            scored.add(score(candidate));
        }
        return scored;
    }
}
