package com.tradeadmission.admission.publisher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeadmission.common.admission.AdmissionCycleResult;
import com.tradeadmission.common.decision.AdmissionEventPublisher;
import com.tradeadmission.common.model.AdmissionDecision;
import com.tradeadmission.common.model.BlockRecord;
import com.tradeadmission.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Log-backed implementation of {@link AdmissionEventPublisher}.
 *
 * <p>Writes admitted / displaced decisions and every block record as single-line JSON
 * to dedicated loggers ({@code admission.decisions}, {@code admission.blocks}) so they
 * can be routed to their own appenders. Serialisation failures are logged at WARN and
 * dropped; the cycle result stands.
 *
 * <p>TODO: broker-facing publisher for order placement, registered as {@code @Primary}
 * once the order gateway contract is fixed.
 */
@Component
public class LoggingAdmissionEventPublisher implements AdmissionEventPublisher {

    private static final Logger log       = LoggerFactory.getLogger(LoggingAdmissionEventPublisher.class);
    private static final Logger decisions = LoggerFactory.getLogger("admission.decisions");
    private static final Logger blocks    = LoggerFactory.getLogger("admission.blocks");

    private final ObjectMapper objectMapper;

    public LoggingAdmissionEventPublisher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void publishCycle(AdmissionCycleResult result) {
        for (AdmissionDecision decision : result.decisions()) {
            if (!decision.admitted()) continue;
            String json = toJson(decision, result.cycleId());
            if (json != null) {
                TraceContextUtil.withMdc(result.cycleId(), () -> decisions.info(json));
            }
        }
    }

    @Override
    public void publishBlock(BlockRecord record, String traceId) {
        String json = toJson(record, traceId);
        if (json != null) {
            TraceContextUtil.withMdc(traceId, () -> blocks.info(json));
        }
    }

    private String toJson(Object payload, String traceId) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Admission event serialisation failed (non-critical). type={} traceId={}",
                     payload.getClass().getSimpleName(), traceId, e);
            return null;
        }
    }
}
