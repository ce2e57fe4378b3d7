package com.tradeadmission.common.admission;

import com.tradeadmission.common.model.OpenPosition;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a challenger may evict the weakest open position.
 *
 * <p>Rules, in order:
 * <ol>
 *   <li>displacement disabled                                  → {@value #DISABLED}</li>
 *   <li>incumbent younger than min hold, and its entry score is
 *       not below the emergency score                          → {@value #MIN_HOLD}</li>
 *   <li>{@code challengerScore − scoreAtEntry ≤ margin}         → {@value #DELTA_TOO_SMALL}</li>
 *   <li>otherwise                                              → {@value #ALLOWED}</li>
 * </ol>
 * With the default margin of {@code 0.0} the challenger must score strictly higher.
 * An incumbent with no recorded entry time counts as just opened.
 *
 * <p>Pure and thread-safe.
 */
public final class DisplacementPolicy {

    public static final String ALLOWED         = "displacement_allowed";
    public static final String DISABLED        = "displacement_disabled";
    public static final String MIN_HOLD        = "displacement_min_hold";
    public static final String DELTA_TOO_SMALL = "displacement_delta_too_small";

    private DisplacementPolicy() {}

    public static Verdict evaluate(OpenPosition incumbent, double challengerScore,
                                   AdmissionConfig config, Instant now) {
        double delta       = challengerScore - incumbent.scoreAtEntry();
        long   ageSeconds  = incumbent.openedAt() != null
            ? Math.max(0L, Duration.between(incumbent.openedAt(), now).getSeconds())
            : 0L;

        if (!config.displacementEnabled()) {
            return new Verdict(false, DISABLED, delta, ageSeconds);
        }

        boolean emergency = incumbent.scoreAtEntry() < config.displacementEmergencyScore();
        if (!emergency && ageSeconds < config.displacementMinHold().getSeconds()) {
            return new Verdict(false, MIN_HOLD, delta, ageSeconds);
        }

        if (!(delta > config.displacementMargin())) {
            return new Verdict(false, DELTA_TOO_SMALL, delta, ageSeconds);
        }

        return new Verdict(true, ALLOWED, delta, ageSeconds);
    }

    public record Verdict(
        boolean allowed,
        String  reason,
        double  delta,
        long    incumbentAgeSeconds
    ) {}
}
