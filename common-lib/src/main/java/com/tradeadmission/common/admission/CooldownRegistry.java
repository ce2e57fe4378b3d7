package com.tradeadmission.common.admission;

import java.time.Instant;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Symbol → cooldown expiry. A symbol with an unexpired entry cannot be admitted,
 * whatever its score.
 *
 * <p>Entries come from two places: external exits (registered by the host) and
 * displacements (placed by {@link AdmissionController}). Expired entries are pruned
 * lazily on lookup and in bulk by {@link #prune(Instant)}.
 *
 * <p>Mutable and NOT thread-safe; same ownership rules as {@link PortfolioState}.
 */
public class CooldownRegistry {

    private final Map<String, Instant> expiries = new LinkedHashMap<>();

    /**
     * Starts (or extends) a cooldown. An existing later expiry is kept, so a shorter
     * cooldown never cuts a longer one short.
     */
    public void place(String symbol, Instant until) {
        if (symbol == null || until == null) {
            return;
        }
        expiries.merge(symbol, until, (current, proposed) -> proposed.isAfter(current) ? proposed : current);
    }

    /** True when the symbol has an entry expiring strictly after {@code now}. */
    public boolean isOnCooldown(String symbol, Instant now) {
        if (symbol == null) {
            return false;
        }
        Instant expiry = expiries.get(symbol);
        if (expiry == null) {
            return false;
        }
        if (!expiry.isAfter(now)) {
            expiries.remove(symbol);
            return false;
        }
        return true;
    }

    public Optional<Instant> expiryOf(String symbol) {
        return Optional.ofNullable(symbol != null ? expiries.get(symbol) : null);
    }

    public boolean clear(String symbol) {
        return symbol != null && expiries.remove(symbol) != null;
    }

    /** @return number of expired entries removed */
    public int prune(Instant now) {
        int removed = 0;
        Iterator<Map.Entry<String, Instant>> it = expiries.entrySet().iterator();
        while (it.hasNext()) {
            if (!it.next().getValue().isAfter(now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return expiries.size();
    }

    /** Unexpired entries as of {@code now}, sorted by symbol. */
    public Map<String, Instant> active(Instant now) {
        Map<String, Instant> active = new TreeMap<>();
        expiries.forEach((symbol, expiry) -> {
            if (expiry.isAfter(now)) {
                active.put(symbol, expiry);
            }
        });
        return Collections.unmodifiableMap(active);
    }
}
