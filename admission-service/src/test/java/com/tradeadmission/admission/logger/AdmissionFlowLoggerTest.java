package com.tradeadmission.admission.logger;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.tradeadmission.common.admission.AdmissionCycleResult;
import com.tradeadmission.common.model.AdmissionDecision;
import com.tradeadmission.common.model.BlockReason;
import com.tradeadmission.common.model.BlockRecord;
import com.tradeadmission.common.trace.TraceContextUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionFlowLoggerTest {

    private static final Instant T = Instant.parse("2026-03-02T15:30:00Z");

    private final AdmissionFlowLogger flowLogger = new AdmissionFlowLogger();
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private Logger logger;

    @BeforeEach
    void attach() {
        logger = (Logger) LoggerFactory.getLogger(AdmissionFlowLogger.class);
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
    }

    @Test
    @DisplayName("stage line carries the trace id from the Reactor Context")
    void stageFromContext() {
        Mono<String> traced = TraceContextUtil.withTraceId(
            Mono.just("x").doOnEach(flowLogger.stage(AdmissionFlowLogger.CANDIDATES_SCORED)), "cycle-9");

        StepVerifier.create(traced).expectNext("x").verifyComplete();

        assertEquals(1, appender.list.size());
        ILoggingEvent event = appender.list.get(0);
        assertTrue(event.getFormattedMessage().contains("stage=CANDIDATES_SCORED"));
        assertEquals("cycle-9", event.getMDCPropertyMap().get(TraceContextUtil.TRACE_ID_KEY));
    }

    @Test
    @DisplayName("cycle summary lists counts and a reason histogram keyed by wire code")
    void cycleSummary() {
        BlockRecord low = new BlockRecord("LOW", BlockReason.SCORE_FLOOR_BREACH, 1.2, T, "");
        BlockRecord low2 = new BlockRecord("LOW2", BlockReason.SCORE_FLOOR_BREACH, 1.1, T, "");
        AdmissionCycleResult result = new AdmissionCycleResult("c-3", T,
            List.of(AdmissionDecision.admit("AAPL", 2.4)), List.of(low, low2), 1, 0, 2, 1);

        flowLogger.logCycleSummary(result, "c-3");

        String line = appender.list.get(0).getFormattedMessage();
        assertTrue(line.contains("admitted=1"), line);
        assertTrue(line.contains("rejected=2"), line);
        assertTrue(line.contains("expectancy_blocked:score_floor_breach=2"), line);
    }
}
