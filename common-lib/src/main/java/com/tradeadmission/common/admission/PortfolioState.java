package com.tradeadmission.common.admission;

import com.tradeadmission.common.exception.AdmissionConfigException;
import com.tradeadmission.common.model.OpenPosition;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The set of currently open positions, keyed by symbol, bounded by a fixed capacity.
 *
 * <p>Mutable and NOT thread-safe: within a cycle it is written only by
 * {@link AdmissionController}; the host serialises access across cycles.
 */
public class PortfolioState {

    /** Displacement target order: lowest entry score, then oldest, then symbol. */
    static final Comparator<OpenPosition> WEAKEST_FIRST =
        Comparator.comparingDouble(OpenPosition::scoreAtEntry)
                  .thenComparing(OpenPosition::openedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                  .thenComparing(OpenPosition::symbol);

    private final int capacity;
    private final Map<String, OpenPosition> positions = new LinkedHashMap<>();

    public PortfolioState(int capacity) {
        if (capacity < 1) {
            throw new AdmissionConfigException("capacity", "must be at least 1, was " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Builds a portfolio pre-populated from a broker snapshot.
     *
     * @throws AdmissionConfigException when the snapshot exceeds {@code capacity}
     */
    public static PortfolioState of(int capacity, Collection<OpenPosition> snapshot) {
        PortfolioState state = new PortfolioState(capacity);
        state.replaceAll(snapshot);
        return state;
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        return positions.size();
    }

    public boolean isFull() {
        return positions.size() >= capacity;
    }

    public boolean contains(String symbol) {
        return symbol != null && positions.containsKey(symbol);
    }

    public Optional<OpenPosition> get(String symbol) {
        return Optional.ofNullable(symbol != null ? positions.get(symbol) : null);
    }

    /** The open position with the lowest entry score, if any. O(capacity). */
    public Optional<OpenPosition> weakest() {
        return positions.values().stream().min(WEAKEST_FIRST);
    }

    /**
     * @throws IllegalStateException if full or the symbol is already open
     */
    public void open(OpenPosition position) {
        if (positions.containsKey(position.symbol())) {
            throw new IllegalStateException("symbol already open: " + position.symbol());
        }
        if (isFull()) {
            throw new IllegalStateException("portfolio at capacity " + capacity + ", cannot open " + position.symbol());
        }
        positions.put(position.symbol(), position);
    }

    /** @return the closed position, or empty if the symbol was not open */
    public Optional<OpenPosition> close(String symbol) {
        return Optional.ofNullable(symbol != null ? positions.remove(symbol) : null);
    }

    /**
     * Replaces every open position with the given snapshot.
     *
     * @throws AdmissionConfigException when the snapshot exceeds capacity; state is unchanged
     */
    public void replaceAll(Collection<OpenPosition> snapshot) {
        Map<String, OpenPosition> next = new LinkedHashMap<>();
        if (snapshot != null) {
            for (OpenPosition p : snapshot) {
                if (p != null && p.symbol() != null && !p.symbol().isBlank()) {
                    next.put(p.symbol(), p);
                }
            }
        }
        if (next.size() > capacity) {
            throw new AdmissionConfigException("capacity",
                "snapshot holds " + next.size() + " positions, capacity is " + capacity);
        }
        positions.clear();
        positions.putAll(next);
    }

    /** Immutable copy in insertion order. */
    public List<OpenPosition> snapshot() {
        return List.copyOf(positions.values());
    }
}
