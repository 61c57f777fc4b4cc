package com.questrail.lantern.signal;

import com.questrail.lantern.config.SignalPolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SignalCalculatorTest {

    private final SignalCalculator calculator = new SignalCalculator(SignalPolicy.defaults());

    @Test
    void boostFromDefaultMovesByFullHeadroomShare() {
        assertEquals(110, calculator.adjust(100, true));
    }

    @Test
    void suppressFromDefaultMovesByFullHeadroomShare() {
        assertEquals(90, calculator.adjust(100, false));
    }

    @Test
    void movingBackTowardDefaultUsesMaxChange() {
        assertEquals(100, calculator.adjust(110, false));
        assertEquals(100, calculator.adjust(90, true));
        assertEquals(140, calculator.adjust(150, false));
        assertEquals(60, calculator.adjust(50, true));
    }

    @Test
    void boostNearUpperBoundRoundsUp() {
        // headroom 2 * 0.2 = 0.4, ceil(148.4)
        assertEquals(149, calculator.adjust(148, true));
    }

    @Test
    void boundsAreStable() {
        assertEquals(150, calculator.adjust(150, true));
        assertEquals(50, calculator.adjust(50, false));
    }

    @Test
    void resultAlwaysWithinRangeAndMonotoneInDirection() {
        for (int v = 50; v <= 150; v++) {
            int up = calculator.adjust(v, true);
            int down = calculator.adjust(v, false);

            assertTrue(up >= 50 && up <= 150, "boost from " + v + " gave " + up);
            assertTrue(down >= 50 && down <= 150, "suppress from " + v + " gave " + down);
            assertTrue(up >= v, "boost from " + v + " went down to " + up);
        }
    }

    @Test
    void outOfRangeInputIsClamped() {
        assertEquals(150, calculator.adjust(400, true));
        assertEquals(50, calculator.adjust(-20, false));
    }

    @Test
    void decayStepsOneTowardDefault() {
        assertEquals(119, calculator.decay(120));
        assertEquals(81, calculator.decay(80));
        assertEquals(100, calculator.decay(100));
        assertEquals(100, calculator.decay(101));
        assertEquals(100, calculator.decay(99));
    }

    @Test
    void customPolicyShiftsRange() {
        SignalCalculator narrow = new SignalCalculator(new SignalPolicy(0, 10, 5, 0.5));

        assertEquals(5, narrow.adjust(0, true));
        assertEquals(-5, narrow.adjust(0, false));
        assertEquals(10, narrow.adjust(9, true));
        assertEquals(-10, narrow.adjust(-10, false));
    }
}
