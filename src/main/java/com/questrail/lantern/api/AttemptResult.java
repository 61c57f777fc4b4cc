package com.questrail.lantern.api;

import java.util.OptionalInt;

/**
 * Outcome of a single guess against a hack session.
 *
 * <ul>
 *   <li>success: {@code success=true}, {@code boostingSignal} echoes the direction</li>
 *   <li>wrong guess, tries left: {@code matches} holds the positional match count</li>
 *   <li>wrong guess, exhausted: {@code triesLeft=0}, no {@code matches}</li>
 * </ul>
 */
public record AttemptResult(
        boolean success,
        boolean boostingSignal,
        int triesLeft,
        OptionalInt matches
) {
    public static AttemptResult succeeded(boolean boostingSignal, int triesLeft) {
        return new AttemptResult(true, boostingSignal, triesLeft, OptionalInt.empty());
    }

    public static AttemptResult failed(boolean boostingSignal, int triesLeft, int matches) {
        return new AttemptResult(false, boostingSignal, triesLeft, OptionalInt.of(matches));
    }

    public static AttemptResult exhausted(boolean boostingSignal) {
        return new AttemptResult(false, boostingSignal, 0, OptionalInt.empty());
    }
}
