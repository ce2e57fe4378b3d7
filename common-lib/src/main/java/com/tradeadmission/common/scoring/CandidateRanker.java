package com.tradeadmission.common.scoring;

import com.tradeadmission.common.model.ScoredCandidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Explicit, deterministic cycle ordering: final score descending, ties broken by
 * symbol ascending. Candidates with a non-finite score or no symbol sort last so
 * they cannot crowd out well-formed ones (they are rejected on validation anyway).
 */
public final class CandidateRanker {

    public static final Comparator<ScoredCandidate> ORDER =
        Comparator.comparing((ScoredCandidate sc) -> !Double.isFinite(sc.finalScore()))
                  .thenComparing(ScoredCandidate::finalScore, Comparator.reverseOrder())
                  .thenComparing(ScoredCandidate::symbol, Comparator.nullsLast(Comparator.naturalOrder()));

    private CandidateRanker() {}

    /**
     * @param scored candidates in any order (may be {@code null})
     * @return a new unmodifiable list in admission order
     */
    public static List<ScoredCandidate> rank(List<ScoredCandidate> scored) {
        if (scored == null || scored.isEmpty()) {
            return List.of();
        }
        List<ScoredCandidate> ranked = new ArrayList<>();
        for (ScoredCandidate sc : scored) {
            if (sc != null) {
                ranked.add(sc);
            }
        }
        ranked.sort(ORDER);
        return List.copyOf(ranked);
    }
}
