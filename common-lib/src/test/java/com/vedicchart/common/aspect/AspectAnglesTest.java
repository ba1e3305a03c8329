package com.vedicchart.common.aspect;

import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.catalog.Sign;
import com.vedicchart.common.position.PositionDeriver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AspectAnglesTest {

    @Nested
    @DisplayName("retrograde substitution")
    class RetrogradeTests {

        @Test
        @DisplayName("Mars in Aries: {90,180,210} direct, {270,180,150} retrograde")
        void mars() {
            assertEquals(List.of(90, 180, 210), AspectAngles.effective(Body.MARS, Sign.ARIES, false));
            assertEquals(List.of(270, 180, 150), AspectAngles.effective(Body.MARS, Sign.ARIES, true));
        }

        @Test
        @DisplayName("Saturn swaps 60→300 and 270→90")
        void saturn() {
            assertEquals(List.of(300, 180, 90), AspectAngles.effective(Body.SATURN, Sign.LIBRA, true));
        }

        @Test
        @DisplayName("bodies without a swap table are unchanged")
        void noSwap() {
            assertEquals(List.of(120, 180, 240), AspectAngles.effective(Body.JUPITER, Sign.CANCER, true));
            assertEquals(List.of(180), AspectAngles.effective(Body.VENUS, Sign.PISCES, true));
        }

        @Test
        @DisplayName("read from a derived position, speed sign decides")
        void fromPosition() {
            assertEquals(List.of(270, 180, 150),
                AspectAngles.effective(PositionDeriver.derive(Body.MARS, 5.0, 0.0, -0.3)));
        }
    }

    @Nested
    @DisplayName("node parity")
    class NodeTests {

        @Test
        @DisplayName("Rahu in Taurus (index 1) adds 30; in Aries (index 0) adds 330")
        void rahu() {
            assertEquals(List.of(120, 240, 30), AspectAngles.effective(Body.RAHU, Sign.TAURUS, false));
            assertEquals(List.of(120, 240, 330), AspectAngles.effective(Body.RAHU, Sign.ARIES, false));
        }

        @Test
        @DisplayName("Ketu follows the same rule on its own sign")
        void ketu() {
            assertEquals(List.of(120, 240, 30), AspectAngles.effective(Body.KETU, Sign.SCORPIO, true));
        }
    }

    @Test
    @DisplayName("ordinal names are display only")
    void displayNames() {
        assertEquals("7th Aspect", AspectAngles.displayName(180));
        assertEquals("2nd Aspect", AspectAngles.displayName(30));
        assertEquals("4th Aspect", AspectAngles.displayName(90));
        assertEquals("12th Aspect", AspectAngles.displayName(330));
        assertEquals(6, AspectAngles.signOffset(180));
    }
}
