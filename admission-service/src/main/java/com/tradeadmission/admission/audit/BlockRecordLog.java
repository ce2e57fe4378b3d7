package com.tradeadmission.admission.audit;

import com.tradeadmission.common.model.BlockReason;
import com.tradeadmission.common.model.BlockRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Append-only in-memory stream of {@link BlockRecord}s, the audit trail of every
 * rejected candidate.
 *
 * <p>Only the newest {@code retention} records are kept for reads; per-reason counts
 * cover everything ever appended. Thread-safe.
 */
@Component
public class BlockRecordLog {

    private final int retention;
    private final Deque<BlockRecord> records = new ArrayDeque<>();
    private final Map<BlockReason, Long> totals = new EnumMap<>(BlockReason.class);
    private long appended;

    public BlockRecordLog(@Value("${admission.audit.retention:10000}") int retention) {
        if (retention < 1) {
            throw new IllegalArgumentException("admission.audit.retention must be at least 1, was " + retention);
        }
        this.retention = retention;
    }

    public synchronized void append(BlockRecord record) {
        records.addLast(record);
        if (records.size() > retention) {
            records.removeFirst();
        }
        totals.merge(record.reason(), 1L, Long::sum);
        appended++;
    }

    public synchronized void appendAll(Collection<BlockRecord> batch) {
        for (BlockRecord record : batch) {
            append(record);
        }
    }

    /**
     * @param limit maximum records to return; {@code <= 0} returns every retained record
     * @return the newest records, oldest first
     */
    public synchronized List<BlockRecord> recent(int limit) {
        int size = records.size();
        int take = limit <= 0 ? size : Math.min(limit, size);
        List<BlockRecord> out = new ArrayList<>(take);
        Iterator<BlockRecord> it = records.iterator();
        for (int skip = size - take; skip > 0; skip--) {
            it.next();
        }
        while (it.hasNext()) {
            out.add(it.next());
        }
        return out;
    }

    public synchronized Map<BlockReason, Long> countsByReason() {
        return new EnumMap<>(totals);
    }

    public synchronized long totalAppended() {
        return appended;
    }

    public synchronized int retained() {
        return records.size();
    }
}
