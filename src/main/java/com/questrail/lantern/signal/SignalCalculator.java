package com.questrail.lantern.signal;

import com.questrail.lantern.config.SignalPolicy;

import java.util.Objects;

/**
 * SignalCalculator
 * -----------------------------------------------------------------------------
 * Pure arithmetic of the bounded signal adjustment and of one decay step.
 *
 * <h2>Adjustment</h2>
 * With current value {@code v}, default {@code D}, threshold {@code T}:
 * <pre>
 *   baseChange = (T - |v - D|) * coefficient
 *   effective  = maxChange   when moving back toward D
 *              = baseChange  otherwise
 *   candidate  = ceil(v + effective)          when boosting
 *              = ceil(v - |effective|)        when suppressing
 *   result     = clamp(candidate, D - T, D + T)
 * </pre>
 *
 * <p>No I/O, no state. Given the same policy and input the result is always
 * the same.</p>
 */
public final class SignalCalculator
{
    private final SignalPolicy policy;

    public SignalCalculator(SignalPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Value after a player adjustment in the given direction.
     */
    public int adjust(int value, boolean boosting) {
        int defaultValue = policy.defaultValue();
        int difference = Math.abs(value - defaultValue);
        double change = (policy.threshold() - difference) * policy.changeCoefficient();

        if ((boosting && value < defaultValue) || (!boosting && value > defaultValue)) {
            change = policy.maxChange();
        }

        double candidate = boosting ? value + change : value - Math.abs(change);
        return clamp((int) Math.ceil(candidate));
    }

    /**
     * Value after one decay step: one unit toward the default, or unchanged
     * when already there.
     */
    public int decay(int value) {
        int defaultValue = policy.defaultValue();
        if (value > defaultValue) {
            return value - 1;
        }
        if (value < defaultValue) {
            return value + 1;
        }
        return value;
    }

    private int clamp(int value) {
        return Math.max(policy.minValue(), Math.min(policy.maxValue(), value));
    }
}
