package com.tradeadmission.common.model;

/**
 * <ul>
 *   <li>{@link #ADMIT}    — new position opened into free capacity.</li>
 *   <li>{@link #DISPLACE} — weakest open position evicted and replaced by the candidate.</li>
 *   <li>{@link #REJECT}   — not admitted; a {@link BlockRecord} carries the reason.</li>
 * </ul>
 */
public enum AdmissionOutcome {
    ADMIT,
    DISPLACE,
    REJECT
}
