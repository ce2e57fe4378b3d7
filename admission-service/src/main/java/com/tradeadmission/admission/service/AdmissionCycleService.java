package com.tradeadmission.admission.service;

import com.tradeadmission.admission.audit.BlockRecordLog;
import com.tradeadmission.admission.dto.CandidateRequest;
import com.tradeadmission.admission.dto.CycleRequest;
import com.tradeadmission.admission.dto.ExitRequest;
import com.tradeadmission.admission.dto.ExitResponse;
import com.tradeadmission.admission.dto.PortfolioResponse;
import com.tradeadmission.admission.logger.AdmissionFlowLogger;
import com.tradeadmission.common.admission.AdmissionConfig;
import com.tradeadmission.common.admission.AdmissionController;
import com.tradeadmission.common.admission.AdmissionCycleResult;
import com.tradeadmission.common.admission.CooldownRegistry;
import com.tradeadmission.common.admission.PortfolioState;
import com.tradeadmission.common.decision.AdmissionEventPublisher;
import com.tradeadmission.common.model.BlockRecord;
import com.tradeadmission.common.model.Candidate;
import com.tradeadmission.common.model.OpenPosition;
import com.tradeadmission.common.model.ScoredCandidate;
import com.tradeadmission.common.scoring.CandidateScorer;
import com.tradeadmission.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the live portfolio and cooldown registry and runs admission cycles against them.
 *
 * <p>Every read or write of that state happens under one lock, so cycles, exits and
 * portfolio syncs are serialised. Scoring is pure and runs outside the lock.
 */
@Service
public class AdmissionCycleService {

    private static final Logger log = LoggerFactory.getLogger(AdmissionCycleService.class);

    private final CandidateScorer candidateScorer;
    private final AdmissionController admissionController;
    private final BlockRecordLog blockRecordLog;
    private final AdmissionEventPublisher eventPublisher;
    private final AdmissionFlowLogger flowLogger;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final PortfolioState portfolio;
    private final CooldownRegistry cooldowns = new CooldownRegistry();

    public AdmissionCycleService(
            CandidateScorer candidateScorer,
            AdmissionController admissionController,
            BlockRecordLog blockRecordLog,
            AdmissionEventPublisher eventPublisher,
            AdmissionFlowLogger flowLogger,
            Clock clock) {
        this.candidateScorer     = candidateScorer;
        this.admissionController = admissionController;
        this.blockRecordLog      = blockRecordLog;
        this.eventPublisher      = eventPublisher;
        this.flowLogger          = flowLogger;
        this.clock               = clock;
        this.portfolio           = new PortfolioState(admissionController.config().capacity());
    }

    public Mono<AdmissionCycleResult> runCycle(CycleRequest request) {
        String traceId = TraceContextUtil.resolveCycleId(request.traceId());

        Mono<AdmissionCycleResult> pipeline = Mono.fromCallable(() -> toCandidates(request.candidates()))
            .doOnEach(flowLogger.stage(AdmissionFlowLogger.CYCLE_RECEIVED))
            .map(candidateScorer::scoreAll)
            .doOnEach(flowLogger.stage(AdmissionFlowLogger.CANDIDATES_SCORED))
            .map(scored -> admit(traceId, scored))
            .doOnEach(flowLogger.stage(AdmissionFlowLogger.ADMISSION_COMPLETED))
            .doOnNext(result -> dispatch(result, traceId))
            .doOnEach(flowLogger.stage(AdmissionFlowLogger.EVENTS_DISPATCHED))
            .doOnError(e -> TraceContextUtil.withMdc(traceId, () ->
                log.error("Admission cycle failed. traceId={}", traceId, e)));

        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    public Mono<PortfolioResponse> portfolio() {
        return Mono.fromCallable(() -> locked(this::portfolioView));
    }

    /**
     * Replaces the open positions with a broker snapshot. Cooldowns on synced symbols are
     * cleared: an open position and an active cooldown cannot coexist.
     */
    public Mono<PortfolioResponse> syncPortfolio(List<OpenPosition> positions) {
        return Mono.fromCallable(() -> locked(() -> {
            Instant now = clock.instant();
            List<OpenPosition> stamped = new ArrayList<>();
            if (positions != null) {
                for (OpenPosition p : positions) {
                    if (p == null) continue;
                    stamped.add(p.openedAt() != null ? p : new OpenPosition(p.symbol(), p.scoreAtEntry(), now));
                }
            }
            portfolio.replaceAll(stamped);
            for (OpenPosition p : portfolio.snapshot()) {
                if (cooldowns.isOnCooldown(p.symbol(), now)) {
                    log.warn("Portfolio sync overrides active cooldown. symbol={} until={}",
                             p.symbol(), cooldowns.expiryOf(p.symbol()).orElse(null));
                    cooldowns.clear(p.symbol());
                }
            }
            log.info("Portfolio synced. openPositions={} capacity={}", portfolio.size(), portfolio.capacity());
            return portfolioView();
        }));
    }

    /** Records an exit made outside the admission cycle: closes the position and starts its cooldown. */
    public Mono<ExitResponse> registerExit(ExitRequest request) {
        return Mono.fromCallable(() -> {
            if (request.symbol() == null || request.symbol().isBlank()) {
                throw new IllegalArgumentException("exit symbol must not be blank");
            }
            if (request.cooldownMinutes() != null && request.cooldownMinutes() < 0) {
                throw new IllegalArgumentException("cooldownMinutes must not be negative");
            }
            String symbol = request.symbol().trim();
            AdmissionConfig config = admissionController.config();
            Instant exitedAt = request.exitedAt() != null ? request.exitedAt() : clock.instant();
            Instant cooldownEnd;
            try {
                Duration cooldown = request.cooldownMinutes() != null
                    ? Duration.ofMinutes(request.cooldownMinutes())
                    : config.cooldownDuration();
                cooldownEnd = exitedAt.plus(cooldown);
            } catch (ArithmeticException | DateTimeException e) {
                throw new IllegalArgumentException(
                    "cooldownMinutes out of range: " + request.cooldownMinutes(), e);
            }

            return locked(() -> {
                boolean closed = portfolio.close(symbol).isPresent();
                cooldowns.place(symbol, cooldownEnd);
                Instant until = cooldowns.expiryOf(symbol).orElse(null);
                log.info("Exit registered. symbol={} positionClosed={} cooldownUntil={}", symbol, closed, until);
                return new ExitResponse(symbol, closed, until);
            });
        });
    }

    public Mono<Map<String, Instant>> activeCooldowns() {
        return Mono.fromCallable(() -> locked(() -> cooldowns.active(clock.instant())));
    }

    // ── internals ────────────────────────────────────────────────────────────

    private List<Candidate> toCandidates(List<CandidateRequest> requests) {
        if (requests == null) {
            return List.of();
        }
        Instant receivedAt = clock.instant();
        List<Candidate> candidates = new ArrayList<>(requests.size());
        for (CandidateRequest request : requests) {
            if (request != null) {
                candidates.add(request.toCandidate(receivedAt));
            }
        }
        return candidates;
    }

    private AdmissionCycleResult admit(String traceId, List<ScoredCandidate> scored) {
        AdmissionCycleResult result = locked(() ->
            admissionController.runCycle(traceId, scored, portfolio, cooldowns, clock.instant()));
        blockRecordLog.appendAll(result.blockRecords());
        flowLogger.logCycleSummary(result, traceId);
        return result;
    }

    private void dispatch(AdmissionCycleResult result, String traceId) {
        try {
            eventPublisher.publishCycle(result);
            for (BlockRecord record : result.blockRecords()) {
                flowLogger.logBlocked(record.symbol(), record.reason(), record.candidateScore(), traceId);
                eventPublisher.publishBlock(record, traceId);
            }
        } catch (RuntimeException e) {
            TraceContextUtil.withMdc(traceId, () ->
                log.warn("Admission event publish failed (non-critical). cycleId={} traceId={}",
                         result.cycleId(), traceId, e));
        }
    }

    private PortfolioResponse portfolioView() {
        return new PortfolioResponse(portfolio.capacity(), portfolio.size(), portfolio.snapshot());
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
