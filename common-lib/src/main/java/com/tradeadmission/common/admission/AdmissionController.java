package com.tradeadmission.common.admission;

import com.tradeadmission.common.model.AdmissionDecision;
import com.tradeadmission.common.model.AdmissionOutcome;
import com.tradeadmission.common.model.BlockReason;
import com.tradeadmission.common.model.BlockRecord;
import com.tradeadmission.common.model.Candidate;
import com.tradeadmission.common.model.OpenPosition;
import com.tradeadmission.common.model.ScoredCandidate;
import com.tradeadmission.common.scoring.CandidateRanker;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Per-cycle admission state machine: decides admit / reject / displace for every
 * ranked candidate against the open portfolio and the cooldown registry.
 *
 * <h3>Check order (per candidate, highest score first)</h3>
 * <ol>
 *   <li>Validation      — missing symbol or non-finite score → {@code order_validation_failed}</li>
 *   <li>Cooldown        — unexpired entry → {@code symbol_on_cooldown}</li>
 *   <li>Already held    — symbol open or admitted earlier this cycle → {@code already_positioned}</li>
 *   <li>Score floor     — {@code finalScore < scoreFloor} → {@code expectancy_blocked:score_floor_breach}</li>
 *   <li>EV floor        — estimate present and {@code < evFloor} → {@code expectancy_blocked:ev_below_floor}</li>
 *   <li>Cycle budget    — admitted this cycle ≥ budget → {@code max_new_positions_per_cycle}</li>
 *   <li>Capacity        — room left → ADMIT</li>
 *   <li>Displacement    — full: {@link DisplacementPolicy} against the weakest position
 *                         → DISPLACE, else {@code max_positions_reached}</li>
 * </ol>
 *
 * <p>Each admission or displacement is applied to {@link PortfolioState} before the next
 * candidate is evaluated, so later candidates see earlier outcomes. Every rejection yields
 * exactly one {@link BlockRecord}.
 *
 * <p>Never throws for bad candidate data. Performs no I/O and no logging; the caller owns
 * serialisation of access to the portfolio and registry.
 */
public class AdmissionController {

    static final String MISSING_SYMBOL         = "missing_symbol";
    static final String NON_FINITE_BASE_SCORE  = "non_finite_base_score";
    static final String NON_FINITE_FINAL_SCORE = "non_finite_final_score";
    static final String DUPLICATE_IN_CYCLE     = "duplicate_in_cycle";

    private final AdmissionConfig config;

    public AdmissionController(AdmissionConfig config) {
        this.config = config;
    }

    public AdmissionConfig config() {
        return config;
    }

    /**
     * Runs one complete admission cycle.
     *
     * @param cycleId    identifier echoed into the result (trace id of the calling cycle)
     * @param candidates scored candidates in any order; re-ranked here
     * @param portfolio  open positions — mutated in place
     * @param cooldowns  cooldown registry — mutated in place (pruned, displacement entries added)
     * @param now        cycle clock; used for cooldown expiry and new position timestamps
     * @return the cycle's decisions and block records — never {@code null}
     */
    public AdmissionCycleResult runCycle(String cycleId, List<ScoredCandidate> candidates,
                                         PortfolioState portfolio, CooldownRegistry cooldowns,
                                         Instant now) {
        cooldowns.prune(now);

        List<ScoredCandidate>   ranked       = CandidateRanker.rank(candidates);
        List<AdmissionDecision> decisions    = new ArrayList<>(ranked.size());
        List<BlockRecord>       blockRecords = new ArrayList<>();
        Set<String>             admittedNow  = new HashSet<>();
        int effectiveCapacity = Math.min(config.capacity(), portfolio.capacity());
        int displaced = 0;

        for (ScoredCandidate sc : ranked) {
            AdmissionDecision decision = evaluate(sc, portfolio, cooldowns, admittedNow,
                                                  effectiveCapacity, now);
            decisions.add(decision);

            if (decision.outcome() == AdmissionOutcome.REJECT) {
                blockRecords.add(new BlockRecord(decision.symbol(), decision.reason(),
                    decision.finalScore(), now, decision.detail()));
            } else {
                admittedNow.add(decision.symbol());
                if (decision.outcome() == AdmissionOutcome.DISPLACE) {
                    displaced++;
                }
            }
        }

        return new AdmissionCycleResult(
            cycleId,
            now,
            List.copyOf(decisions),
            List.copyOf(blockRecords),
            admittedNow.size(),
            displaced,
            blockRecords.size(),
            portfolio.size());
    }

    private AdmissionDecision evaluate(ScoredCandidate sc, PortfolioState portfolio,
                                       CooldownRegistry cooldowns, Set<String> admittedNow,
                                       int effectiveCapacity, Instant now) {
        Candidate candidate = sc.candidate();
        String    symbol    = sc.symbol();
        double    score     = sc.finalScore();

        // ── validation ───────────────────────────────────────────────────────
        if (symbol == null || symbol.isBlank()) {
            return AdmissionDecision.reject(symbol, score, BlockReason.ORDER_VALIDATION_FAILED, MISSING_SYMBOL);
        }
        if (!Double.isFinite(candidate.baseEntryScore())) {
            return AdmissionDecision.reject(symbol, score, BlockReason.ORDER_VALIDATION_FAILED, NON_FINITE_BASE_SCORE);
        }
        if (!Double.isFinite(score)) {
            return AdmissionDecision.reject(symbol, score, BlockReason.ORDER_VALIDATION_FAILED, NON_FINITE_FINAL_SCORE);
        }

        // ── cooldown ─────────────────────────────────────────────────────────
        if (cooldowns.isOnCooldown(symbol, now)) {
            String until = cooldowns.expiryOf(symbol).map(Instant::toString).orElse(null);
            return AdmissionDecision.reject(symbol, score, BlockReason.SYMBOL_ON_COOLDOWN,
                until != null ? "until=" + until : null);
        }

        // ── already positioned ───────────────────────────────────────────────
        if (admittedNow.contains(symbol)) {
            return AdmissionDecision.reject(symbol, score, BlockReason.ALREADY_POSITIONED, DUPLICATE_IN_CYCLE);
        }
        if (portfolio.contains(symbol)) {
            return AdmissionDecision.reject(symbol, score, BlockReason.ALREADY_POSITIONED, null);
        }

        // ── expectancy floors ────────────────────────────────────────────────
        if (score < config.scoreFloor()) {
            return AdmissionDecision.reject(symbol, score, BlockReason.SCORE_FLOOR_BREACH,
                String.format("score=%.4f floor=%.4f", score, config.scoreFloor()));
        }
        if (candidate.hasEstimatedEv() && candidate.estimatedEv() < config.evFloor()) {
            return AdmissionDecision.reject(symbol, score, BlockReason.EV_BELOW_FLOOR,
                String.format("ev=%.4f floor=%.4f", candidate.estimatedEv(), config.evFloor()));
        }

        // ── per-cycle budget ─────────────────────────────────────────────────
        if (admittedNow.size() >= config.maxNewPositionsPerCycle()) {
            return AdmissionDecision.reject(symbol, score, BlockReason.MAX_NEW_POSITIONS_PER_CYCLE, null);
        }

        // ── capacity ─────────────────────────────────────────────────────────
        if (portfolio.size() < effectiveCapacity) {
            portfolio.open(new OpenPosition(symbol, score, now));
            return AdmissionDecision.admit(symbol, score);
        }

        // ── displacement ─────────────────────────────────────────────────────
        Optional<OpenPosition> weakest = portfolio.weakest();
        if (weakest.isEmpty()) {
            return AdmissionDecision.reject(symbol, score, BlockReason.MAX_POSITIONS_REACHED, null);
        }
        OpenPosition incumbent = weakest.get();
        DisplacementPolicy.Verdict verdict = DisplacementPolicy.evaluate(incumbent, score, config, now);
        if (!verdict.allowed()) {
            return AdmissionDecision.reject(symbol, score, BlockReason.MAX_POSITIONS_REACHED, verdict.reason());
        }

        portfolio.close(incumbent.symbol());
        cooldowns.place(incumbent.symbol(), now.plus(config.cooldownDuration()));
        portfolio.open(new OpenPosition(symbol, score, now));
        return AdmissionDecision.displace(symbol, score, incumbent.symbol(),
            String.format("delta=%.4f incumbentScore=%.4f", verdict.delta(), incumbent.scoreAtEntry()));
    }
}
