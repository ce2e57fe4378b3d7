package com.tradeadmission.common.admission;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeadmission.common.model.AdmissionDecision;
import com.tradeadmission.common.model.BlockReason;
import com.tradeadmission.common.model.BlockRecord;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable output of one {@link AdmissionController} cycle.
 *
 * <p>{@code decisions} are in evaluation (rank) order, one per candidate;
 * {@code blockRecords} hold exactly one entry per rejection.
 */
public record AdmissionCycleResult(
    @JsonProperty("cycleId")           String cycleId,
    @JsonProperty("evaluatedAt")       Instant evaluatedAt,
    @JsonProperty("decisions")         List<AdmissionDecision> decisions,
    @JsonProperty("blockRecords")      List<BlockRecord> blockRecords,
    @JsonProperty("admittedCount")     int admittedCount,
    @JsonProperty("displacedCount")    int displacedCount,
    @JsonProperty("rejectedCount")     int rejectedCount,
    @JsonProperty("openPositionCount") int openPositionCount
) {

    /** Rejections per reason code, for cycle summaries. */
    public Map<BlockReason, Long> reasonCounts() {
        Map<BlockReason, Long> counts = new EnumMap<>(BlockReason.class);
        for (BlockRecord record : blockRecords) {
            counts.merge(record.reason(), 1L, Long::sum);
        }
        return counts;
    }
}
