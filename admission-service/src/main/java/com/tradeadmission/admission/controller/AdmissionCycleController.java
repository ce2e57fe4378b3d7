package com.tradeadmission.admission.controller;

import com.tradeadmission.admission.audit.BlockRecordLog;
import com.tradeadmission.admission.dto.ConfigResponse;
import com.tradeadmission.admission.dto.CycleRequest;
import com.tradeadmission.admission.dto.ErrorResponse;
import com.tradeadmission.admission.dto.ExitRequest;
import com.tradeadmission.admission.dto.ExitResponse;
import com.tradeadmission.admission.dto.PortfolioResponse;
import com.tradeadmission.admission.dto.PortfolioSyncRequest;
import com.tradeadmission.admission.service.AdmissionCycleService;
import com.tradeadmission.common.admission.AdmissionConfig;
import com.tradeadmission.common.admission.AdmissionCycleResult;
import com.tradeadmission.common.admission.AdmissionProfile;
import com.tradeadmission.common.exception.AdmissionConfigException;
import com.tradeadmission.common.model.BlockRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * REST surface of the admission engine: cycle execution, portfolio and cooldown
 * maintenance, audit reads.
 */
@RestController
@RequestMapping("/api/v1/admission")
public class AdmissionCycleController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionCycleController.class);

    private final AdmissionCycleService cycleService;
    private final BlockRecordLog blockRecordLog;
    private final AdmissionProfile profile;
    private final AdmissionConfig config;

    public AdmissionCycleController(AdmissionCycleService cycleService,
                                    BlockRecordLog blockRecordLog,
                                    AdmissionProfile profile,
                                    AdmissionConfig config) {
        this.cycleService   = cycleService;
        this.blockRecordLog = blockRecordLog;
        this.profile        = profile;
        this.config         = config;
    }

    @PostMapping("/cycle")
    public Mono<ResponseEntity<AdmissionCycleResult>> runCycle(
            @RequestBody CycleRequest request,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceHeader) {
        CycleRequest effective = traceHeader != null && !traceHeader.isBlank()
            ? new CycleRequest(traceHeader, request.candidates())
            : request;
        log.info("Admission cycle requested. candidates={} traceId={}",
                 effective.candidates() != null ? effective.candidates().size() : 0, effective.traceId());
        return cycleService.runCycle(effective)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Cycle endpoint error. traceId={}", effective.traceId(), e));
    }

    @GetMapping("/portfolio")
    public Mono<ResponseEntity<PortfolioResponse>> portfolio() {
        return cycleService.portfolio().map(ResponseEntity::ok);
    }

    @PutMapping("/portfolio")
    public Mono<ResponseEntity<PortfolioResponse>> syncPortfolio(@RequestBody PortfolioSyncRequest request) {
        log.info("Portfolio sync requested. positions={}",
                 request.positions() != null ? request.positions().size() : 0);
        return cycleService.syncPortfolio(request.positions()).map(ResponseEntity::ok);
    }

    @PostMapping("/exits")
    public Mono<ResponseEntity<ExitResponse>> registerExit(@RequestBody ExitRequest request) {
        log.info("Exit registration requested. symbol={}", request.symbol());
        return cycleService.registerExit(request).map(ResponseEntity::ok);
    }

    @GetMapping("/cooldowns")
    public Mono<ResponseEntity<Map<String, Instant>>> cooldowns() {
        return cycleService.activeCooldowns().map(ResponseEntity::ok);
    }

    @GetMapping("/blocks")
    public Flux<BlockRecord> blocks(@RequestParam(value = "limit", defaultValue = "100") int limit) {
        return Flux.fromIterable(blockRecordLog.recent(limit));
    }

    @GetMapping("/blocks/summary")
    public Mono<ResponseEntity<Map<String, Long>>> blockSummary() {
        Map<String, Long> byCode = new LinkedHashMap<>();
        blockRecordLog.countsByReason().forEach((reason, count) -> byCode.put(reason.code(), count));
        return Mono.just(ResponseEntity.ok(byCode));
    }

    @GetMapping("/config")
    public Mono<ResponseEntity<ConfigResponse>> config() {
        String name = profile.name().toLowerCase(Locale.ROOT).replace('_', '-');
        return Mono.just(ResponseEntity.ok(new ConfigResponse(name, config)));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }

    @ExceptionHandler(AdmissionConfigException.class)
    public ResponseEntity<ErrorResponse> onConfigError(AdmissionConfigException e) {
        log.warn("Admission request rejected. setting={} reason={}", e.getSetting(), e.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("invalid_admission_state", e.getSetting(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> onBadRequest(IllegalArgumentException e) {
        log.warn("Admission request rejected. reason={}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("bad_request", null, e.getMessage()));
    }
}
