package com.tradeadmission.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable reason codes for rejected candidates. The wire code (not the enum name)
 * is what audit consumers and dashboards key on, so codes never change.
 */
public enum BlockReason {
    ORDER_VALIDATION_FAILED("order_validation_failed"),
    SYMBOL_ON_COOLDOWN("symbol_on_cooldown"),
    ALREADY_POSITIONED("already_positioned"),
    SCORE_FLOOR_BREACH("expectancy_blocked:score_floor_breach"),
    EV_BELOW_FLOOR("expectancy_blocked:ev_below_floor"),
    MAX_NEW_POSITIONS_PER_CYCLE("max_new_positions_per_cycle"),
    MAX_POSITIONS_REACHED("max_positions_reached");

    private final String code;

    BlockReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
