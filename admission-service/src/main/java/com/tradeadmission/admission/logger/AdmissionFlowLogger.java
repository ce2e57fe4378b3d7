package com.tradeadmission.admission.logger;

import com.tradeadmission.common.admission.AdmissionCycleResult;
import com.tradeadmission.common.model.BlockReason;
import com.tradeadmission.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Logs the lifecycle stages of one admission cycle inside the reactive pipeline.
 * Pure side effects; never alters the pipeline.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #CYCLE_RECEIVED}      — request converted to candidates</li>
 *   <li>{@link #CANDIDATES_SCORED}   — weights, gates and deltas applied</li>
 *   <li>{@link #ADMISSION_COMPLETED} — controller decided every candidate</li>
 *   <li>{@link #EVENTS_DISPATCHED}   — decisions and block records handed to the publisher</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(AdmissionFlowLogger.CANDIDATES_SCORED))
 * </pre>
 */
@Component
public class AdmissionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AdmissionFlowLogger.class);

    public static final String CYCLE_RECEIVED      = "CYCLE_RECEIVED";
    public static final String CANDIDATES_SCORED   = "CANDIDATES_SCORED";
    public static final String ADMISSION_COMPLETED = "ADMISSION_COMPLETED";
    public static final String EVENTS_DISPATCHED   = "EVENTS_DISPATCHED";

    /**
     * Returns a {@code doOnEach} consumer logging {@code stageName} on {@code onNext}.
     * The trace id is read from the Reactor Context carried by the signal.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[AdmissionFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /**
     * One INFO line per cycle: outcome counts, open positions and the rejection histogram
     * keyed by wire code.
     */
    public void logCycleSummary(AdmissionCycleResult result, String traceId) {
        Map<String, Long> histogram = result.reasonCounts().entrySet().stream()
            .collect(Collectors.toMap(e -> e.getKey().code(), Map.Entry::getValue,
                                      Long::sum, TreeMap::new));
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[AdmissionFlow] cycle summary. cycleId={} candidates={} admitted={} displaced={} "
                     + "rejected={} openPositions={} reasons={} traceId={}",
                     result.cycleId(), result.decisions().size(), result.admittedCount(),
                     result.displacedCount(), result.rejectedCount(), result.openPositionCount(),
                     histogram, traceId)
        );
    }

    /** Per-rejection DEBUG line; the full record is published separately. */
    public void logBlocked(String symbol, BlockReason reason, double score, String traceId) {
        if (!log.isDebugEnabled()) return;
        TraceContextUtil.withMdc(traceId, () ->
            log.debug("[AdmissionFlow] blocked. symbol={} reason={} score={} traceId={}",
                      symbol, reason.code(), score, traceId)
        );
    }
}
