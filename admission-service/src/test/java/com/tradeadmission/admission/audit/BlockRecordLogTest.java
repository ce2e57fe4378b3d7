package com.tradeadmission.admission.audit;

import com.tradeadmission.common.model.BlockReason;
import com.tradeadmission.common.model.BlockRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BlockRecordLogTest {

    private static final Instant T = Instant.parse("2026-03-02T15:30:00Z");

    @Test
    @DisplayName("recent(limit) returns the newest records, oldest first")
    void recentOrdering() {
        BlockRecordLog log = new BlockRecordLog(10);
        log.appendAll(List.of(record("A"), record("B"), record("C")));

        assertEquals(List.of("B", "C"), log.recent(2).stream().map(BlockRecord::symbol).toList());
        assertEquals(3, log.recent(0).size());
        assertEquals(3, log.recent(50).size());
    }

    @Test
    @DisplayName("retention evicts oldest; counts keep the full history")
    void retention() {
        BlockRecordLog log = new BlockRecordLog(2);
        log.append(record("A"));
        log.append(record("B"));
        log.append(new BlockRecord("C", BlockReason.SYMBOL_ON_COOLDOWN, 3.0, T, null));

        assertEquals(2, log.retained());
        assertEquals(3, log.totalAppended());
        assertEquals(List.of("B", "C"), log.recent(0).stream().map(BlockRecord::symbol).toList());

        Map<BlockReason, Long> counts = log.countsByReason();
        assertEquals(2L, counts.get(BlockReason.SCORE_FLOOR_BREACH));
        assertEquals(1L, counts.get(BlockReason.SYMBOL_ON_COOLDOWN));
    }

    @Test
    @DisplayName("empty log → empty counts")
    void emptyCounts() {
        assertTrue(new BlockRecordLog(5).countsByReason().isEmpty());
    }

    @Test
    @DisplayName("retention below 1 is refused")
    void invalidRetention() {
        assertThrows(IllegalArgumentException.class, () -> new BlockRecordLog(0));
    }

    private static BlockRecord record(String symbol) {
        return new BlockRecord(symbol, BlockReason.SCORE_FLOOR_BREACH, 1.2, T, null);
    }
}
