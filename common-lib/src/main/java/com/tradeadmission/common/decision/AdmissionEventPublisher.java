package com.tradeadmission.common.decision;

import com.tradeadmission.common.admission.AdmissionCycleResult;
import com.tradeadmission.common.model.BlockRecord;

/**
 * Outbound seam for admission outcomes: per-cycle decisions for order placement and
 * the append-only block record stream for audit.
 *
 * <p>Implementations MUST NOT throw back into the cycle and MUST NOT block; a failed
 * publish is logged by the implementation and the cycle result stands.
 */
public interface AdmissionEventPublisher {

    /** Publishes the decisions of a completed cycle. */
    void publishCycle(AdmissionCycleResult result);

    /** Publishes one rejection record. Called once per record, in cycle order. */
    void publishBlock(BlockRecord record, String traceId);
}
