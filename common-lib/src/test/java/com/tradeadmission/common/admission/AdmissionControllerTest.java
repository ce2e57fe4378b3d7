package com.tradeadmission.common.admission;

import com.tradeadmission.common.model.AdmissionDecision;
import com.tradeadmission.common.model.AdmissionOutcome;
import com.tradeadmission.common.model.BlockReason;
import com.tradeadmission.common.model.BlockRecord;
import com.tradeadmission.common.model.Candidate;
import com.tradeadmission.common.model.OpenPosition;
import com.tradeadmission.common.model.ScoredCandidate;
import com.tradeadmission.common.weighting.RegimeWeightTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T15:30:00Z");

    private AdmissionController controller;
    private CooldownRegistry cooldowns;

    @BeforeEach
    void setUp() {
        controller = new AdmissionController(AdmissionProfile.BOOTSTRAP.toConfig());
        cooldowns  = new CooldownRegistry();
    }

    @Nested
    @DisplayName("capacity and displacement")
    class Displacement {

        @Test
        @DisplayName("full portfolio: 3.73 displaces the 3.50 incumbent, which goes on cooldown")
        void strongerCandidateDisplacesWeakest() {
            PortfolioState portfolio = fullPortfolio(16, 3.50, "W");

            AdmissionCycleResult result = controller.runCycle("c-1",
                List.of(scored("F", 3.73)), portfolio, cooldowns, NOW);

            AdmissionDecision d = result.decisions().get(0);
            assertEquals(AdmissionOutcome.DISPLACE, d.outcome());
            assertEquals("W", d.evictedSymbol());
            assertTrue(portfolio.contains("F"));
            assertFalse(portfolio.contains("W"));
            assertEquals(16, portfolio.size());
            assertTrue(cooldowns.isOnCooldown("W", NOW));
            assertEquals(NOW.plus(Duration.ofHours(6)), cooldowns.expiryOf("W").orElseThrow());
            assertTrue(result.blockRecords().isEmpty());
            assertEquals(1, result.displacedCount());
        }

        @Test
        @DisplayName("equal score does not displace")
        void equalScoreRejected() {
            PortfolioState portfolio = fullPortfolio(16, 3.50, "W");

            AdmissionCycleResult result = controller.runCycle("c-2",
                List.of(scored("F", 3.50)), portfolio, cooldowns, NOW);

            BlockRecord block = result.blockRecords().get(0);
            assertEquals(BlockReason.MAX_POSITIONS_REACHED, block.reason());
            assertEquals(DisplacementPolicy.DELTA_TOO_SMALL, block.detail());
            assertTrue(portfolio.contains("W"));
            assertFalse(portfolio.contains("F"));
            assertEquals(0, cooldowns.size());
        }

        @Test
        @DisplayName("an evicted symbol cannot come back in the same cycle")
        void evictedSymbolBlockedSameCycle() {
            PortfolioState portfolio = fullPortfolio(16, 3.50, "W");

            AdmissionCycleResult result = controller.runCycle("c-3",
                List.of(scored("F", 3.73), scored("W", 3.60)), portfolio, cooldowns, NOW);

            assertEquals(AdmissionOutcome.DISPLACE, result.decisions().get(0).outcome());
            assertEquals(BlockReason.SYMBOL_ON_COOLDOWN, result.decisions().get(1).reason());
        }

        @Test
        @DisplayName("capacity below the portfolio's own limit is respected")
        void configCapacityWins() {
            AdmissionController tight = new AdmissionController(
                AdmissionProfile.BOOTSTRAP.toConfig().withCapacity(2));
            PortfolioState portfolio = new PortfolioState(16);

            AdmissionCycleResult result = tight.runCycle("c-4",
                List.of(scored("A", 4.0), scored("B", 3.0), scored("C", 2.0)), portfolio, cooldowns, NOW);

            assertEquals(2, portfolio.size());
            assertEquals(BlockReason.MAX_POSITIONS_REACHED, result.decisions().get(2).reason());
        }
    }

    @Nested
    @DisplayName("expectancy floors")
    class Floors {

        @Test
        @DisplayName("1.2 against floor 1.5 → score_floor_breach, portfolio untouched")
        void scoreFloor() {
            PortfolioState portfolio = new PortfolioState(16);

            AdmissionCycleResult result = controller.runCycle("c-5",
                List.of(scored("LOW", 1.2)), portfolio, cooldowns, NOW);

            assertEquals(0, portfolio.size());
            assertEquals(1, result.blockRecords().size());
            BlockRecord block = result.blockRecords().get(0);
            assertEquals("LOW", block.symbol());
            assertEquals("expectancy_blocked:score_floor_breach", block.reason().code());
            assertEquals(1.2, block.candidateScore());
            assertEquals(NOW, block.timestamp());
        }

        @Test
        @DisplayName("score exactly at the floor is admitted")
        void floorInclusive() {
            PortfolioState portfolio = new PortfolioState(16);
            controller.runCycle("c-6", List.of(scored("EDGE", 1.5)), portfolio, cooldowns, NOW);
            assertTrue(portfolio.contains("EDGE"));
        }

        @Test
        @DisplayName("EV below the profile floor is rejected; absent EV is not checked")
        void evFloor() {
            AdmissionController steady = new AdmissionController(AdmissionProfile.STEADY_STATE.toConfig());
            PortfolioState portfolio = new PortfolioState(16);

            AdmissionCycleResult result = steady.runCycle("c-7", List.of(
                scored("POOR", 3.0, 0.05),
                scored("GOOD", 2.9, 0.12),
                scored("NONE", 2.8, null)), portfolio, cooldowns, NOW);

            assertEquals(BlockReason.EV_BELOW_FLOOR, result.decisions().get(0).reason());
            assertTrue(portfolio.contains("GOOD"));
            assertTrue(portfolio.contains("NONE"));
            assertFalse(portfolio.contains("POOR"));
        }

        @Test
        @DisplayName("bootstrap profile tolerates slightly negative EV")
        void bootstrapEv() {
            PortfolioState portfolio = new PortfolioState(16);
            AdmissionCycleResult result = controller.runCycle("c-8", List.of(
                scored("OK", 2.0, -0.01),
                scored("BAD", 2.0, -0.05)), portfolio, cooldowns, NOW);

            assertTrue(portfolio.contains("OK"));
            assertEquals(BlockReason.EV_BELOW_FLOOR, result.blockRecords().get(0).reason());
        }
    }

    @Nested
    @DisplayName("per-cycle budget")
    class Budget {

        @Test
        @DisplayName("20 candidates, budget 5 → five best admitted, fifteen blocked")
        void budgetCapsAdmissions() {
            AdmissionController budgeted = new AdmissionController(
                AdmissionProfile.BOOTSTRAP.toConfig().withMaxNewPositionsPerCycle(5));
            PortfolioState portfolio = new PortfolioState(16);
            List<ScoredCandidate> candidates = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                candidates.add(scored(String.format("S%02d", i), 2.0 + i * 0.1));
            }

            AdmissionCycleResult result = budgeted.runCycle("c-9", candidates, portfolio, cooldowns, NOW);

            assertEquals(5, result.admittedCount());
            assertEquals(15, result.rejectedCount());
            assertEquals(Set.of("S19", "S18", "S17", "S16", "S15"),
                new HashSet<>(portfolio.snapshot().stream().map(OpenPosition::symbol).toList()));
            assertTrue(result.blockRecords().stream()
                .allMatch(b -> b.reason() == BlockReason.MAX_NEW_POSITIONS_PER_CYCLE));
            assertEquals(15L, result.reasonCounts().get(BlockReason.MAX_NEW_POSITIONS_PER_CYCLE));
        }

        @Test
        @DisplayName("displacements consume budget")
        void displacementCountsAgainstBudget() {
            AdmissionController budgeted = new AdmissionController(
                AdmissionProfile.BOOTSTRAP.toConfig().withMaxNewPositionsPerCycle(1));
            PortfolioState portfolio = fullPortfolio(16, 2.0, "W");

            AdmissionCycleResult result = budgeted.runCycle("c-10",
                List.of(scored("A", 4.0), scored("B", 3.9)), portfolio, cooldowns, NOW);

            assertEquals(AdmissionOutcome.DISPLACE, result.decisions().get(0).outcome());
            assertEquals(BlockReason.MAX_NEW_POSITIONS_PER_CYCLE, result.decisions().get(1).reason());
        }

        @Test
        @DisplayName("zero budget admits nothing")
        void zeroBudget() {
            AdmissionController none = new AdmissionController(
                AdmissionProfile.BOOTSTRAP.toConfig().withMaxNewPositionsPerCycle(0));
            PortfolioState portfolio = new PortfolioState(16);

            AdmissionCycleResult result = none.runCycle("c-11",
                List.of(scored("A", 4.0)), portfolio, cooldowns, NOW);

            assertEquals(0, portfolio.size());
            assertEquals(BlockReason.MAX_NEW_POSITIONS_PER_CYCLE, result.blockRecords().get(0).reason());
        }
    }

    @Nested
    @DisplayName("cooldown and validation")
    class Gatekeeping {

        @Test
        @DisplayName("cooldown beats the best score in the cycle")
        void cooldownOverridesScore() {
            cooldowns.place("TOP", NOW.plus(Duration.ofHours(2)));
            PortfolioState portfolio = new PortfolioState(16);

            AdmissionCycleResult result = controller.runCycle("c-12",
                List.of(scored("TOP", 9.9), scored("MID", 2.0)), portfolio, cooldowns, NOW);

            assertEquals(BlockReason.SYMBOL_ON_COOLDOWN, result.decisions().get(0).reason());
            assertFalse(portfolio.contains("TOP"));
            assertTrue(portfolio.contains("MID"));
        }

        @Test
        @DisplayName("expired cooldown no longer blocks")
        void expiredCooldown() {
            cooldowns.place("BACK", NOW.minusSeconds(1));
            PortfolioState portfolio = new PortfolioState(16);
            controller.runCycle("c-13", List.of(scored("BACK", 2.0)), portfolio, cooldowns, NOW);
            assertTrue(portfolio.contains("BACK"));
        }

        @Test
        @DisplayName("malformed candidates are rejected without affecting the rest")
        void validationIsolated() {
            PortfolioState portfolio = new PortfolioState(16);
            Candidate nanBase = new Candidate("NAN", null, null, 0.0, Double.NaN, null, NOW);

            AdmissionCycleResult result = controller.runCycle("c-14", List.of(
                scored(null, 5.0),
                scored("  ", 4.0),
                new ScoredCandidate(nanBase, RegimeWeightTable.BASE_WEIGHTS, null, 0.0, Double.NaN),
                scored("OK", 2.0)), portfolio, cooldowns, NOW);

            assertEquals(List.of("OK"), portfolio.snapshot().stream().map(OpenPosition::symbol).toList());
            assertEquals(3L, result.reasonCounts().get(BlockReason.ORDER_VALIDATION_FAILED));
        }

        @Test
        @DisplayName("held symbol and in-cycle duplicate → already_positioned")
        void alreadyPositioned() {
            PortfolioState portfolio = PortfolioState.of(16, List.of(new OpenPosition("HELD", 2.0, NOW)));

            AdmissionCycleResult result = controller.runCycle("c-15", List.of(
                scored("HELD", 3.0), scored("DUP", 2.5), scored("DUP", 2.4)), portfolio, cooldowns, NOW);

            assertEquals(BlockReason.ALREADY_POSITIONED, result.decisions().get(0).reason());
            assertEquals(AdmissionOutcome.ADMIT, result.decisions().get(1).outcome());
            assertEquals(BlockReason.ALREADY_POSITIONED, result.decisions().get(2).reason());
            assertEquals(AdmissionController.DUPLICATE_IN_CYCLE, result.decisions().get(2).detail());
        }

        @Test
        @DisplayName("empty candidate list → empty result")
        void emptyCycle() {
            PortfolioState portfolio = new PortfolioState(16);
            AdmissionCycleResult result = controller.runCycle("c-16", List.of(), portfolio, cooldowns, NOW);
            assertTrue(result.decisions().isEmpty());
            assertTrue(result.blockRecords().isEmpty());
            assertEquals("c-16", result.cycleId());
        }
    }

    @Test
    @DisplayName("randomised cycles keep capacity, budget, cooldown exclusivity and record accounting consistent")
    void invariantsHoldUnderRandomInput() {
        Random random = new Random(17);
        AdmissionController budgeted = new AdmissionController(
            AdmissionProfile.STEADY_STATE.toConfig().withCapacity(8).withMaxNewPositionsPerCycle(3));
        PortfolioState portfolio = new PortfolioState(8);
        Instant clock = NOW;

        for (int cycle = 0; cycle < 200; cycle++) {
            List<ScoredCandidate> candidates = new ArrayList<>();
            int n = random.nextInt(12);
            for (int i = 0; i < n; i++) {
                double score = random.nextInt(20) == 0 ? Double.NaN : random.nextDouble() * 5.0;
                Double ev = random.nextBoolean() ? null : random.nextDouble() * 0.4 - 0.1;
                candidates.add(scored("S" + random.nextInt(30), score, ev));
            }
            Set<String> before = new HashSet<>(
                portfolio.snapshot().stream().map(OpenPosition::symbol).toList());

            AdmissionCycleResult result = budgeted.runCycle("r-" + cycle, candidates, portfolio, cooldowns, clock);

            assertTrue(portfolio.size() <= 8);
            assertTrue(result.admittedCount() <= 3);
            assertEquals(candidates.size(), result.decisions().size());
            assertEquals(result.rejectedCount(), result.blockRecords().size());
            assertEquals(candidates.size(), result.admittedCount() + result.rejectedCount());
            for (AdmissionDecision d : result.decisions()) {
                if (d.outcome() == AdmissionOutcome.DISPLACE) {
                    assertTrue(before.contains(d.evictedSymbol()));
                    assertFalse(portfolio.contains(d.evictedSymbol()));
                }
                if (d.admitted()) {
                    assertTrue(d.finalScore() >= 1.5);
                }
            }
            final Instant at = clock;
            portfolio.snapshot().forEach(p -> assertFalse(cooldowns.isOnCooldown(p.symbol(), at)));
            clock = clock.plus(Duration.ofMinutes(45));
        }
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static PortfolioState fullPortfolio(int size, double weakestScore, String weakestSymbol) {
        List<OpenPosition> positions = new ArrayList<>();
        positions.add(new OpenPosition(weakestSymbol, weakestScore, NOW.minus(Duration.ofHours(3))));
        for (int i = 1; i < size; i++) {
            positions.add(new OpenPosition("P" + i, weakestScore + 0.5 + i * 0.01, NOW.minus(Duration.ofHours(2))));
        }
        return PortfolioState.of(size, positions);
    }

    private static ScoredCandidate scored(String symbol, double finalScore) {
        return scored(symbol, finalScore, null);
    }

    private static ScoredCandidate scored(String symbol, double finalScore, Double ev) {
        Candidate c = new Candidate(symbol, null, null, 0.0, finalScore, ev, NOW);
        return new ScoredCandidate(c, RegimeWeightTable.BASE_WEIGHTS, null, 0.0, finalScore);
    }
}
