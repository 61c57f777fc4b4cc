package com.questrail.lantern.config;

/**
 * SignalPolicy
 * -----------------------------------------------------------------------------
 * Numeric parameters of the bounded signal adjustment.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>defaultValue</b>: value the decay loop pulls every station toward.</li>
 *   <li><b>threshold</b>: maximum distance from the default; the legal range is
 *       {@code [defaultValue - threshold, defaultValue + threshold]}.</li>
 *   <li><b>maxChange</b>: fixed step used when an adjustment moves the value
 *       back toward the default.</li>
 *   <li><b>changeCoefficient</b>: proportional factor applied to the remaining
 *       headroom when moving away from the default.</li>
 * </ul>
 */
public record SignalPolicy(
        int defaultValue,
        int threshold,
        int maxChange,
        double changeCoefficient
) {
    public SignalPolicy {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be non-negative");
        }
        if (maxChange < 0) {
            throw new IllegalArgumentException("maxChange must be non-negative");
        }
        if (changeCoefficient < 0 || Double.isNaN(changeCoefficient)) {
            throw new IllegalArgumentException("changeCoefficient must be non-negative");
        }
    }

    /**
     * Default 100, threshold 50, max change 10, coefficient 0.2.
     */
    public static SignalPolicy defaults() {
        return new SignalPolicy(100, 50, 10, 0.2);
    }

    public int minValue() {
        return defaultValue - threshold;
    }

    public int maxValue() {
        return defaultValue + threshold;
    }
}
