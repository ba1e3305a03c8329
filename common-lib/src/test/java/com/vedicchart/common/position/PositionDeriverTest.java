package com.vedicchart.common.position;

import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.catalog.Nakshatra;
import com.vedicchart.common.catalog.Sign;
import com.vedicchart.common.model.BodyPosition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PositionDeriverTest {

    @Test
    @DisplayName("95° → Cancer, 5° into the sign")
    void signAndDegrees() {
        assertEquals(Sign.CANCER, PositionDeriver.signOf(95.0));
        assertEquals(5.0, PositionDeriver.degreesInSign(95.0), 1e-12);
    }

    @Test
    @DisplayName("derive() normalizes the longitude and fills every field")
    void derive() {
        BodyPosition moon = PositionDeriver.derive(Body.MOON, 455.0, 1.5, -0.2);
        assertEquals(95.0, moon.longitude(), 1e-12);
        assertEquals(Sign.CANCER, moon.sign());
        assertEquals(5.0, moon.degreesInSign(), 1e-12);
        assertEquals(Nakshatra.PUSHYA, moon.nakshatra());
        assertEquals(1.5, moon.latitude());
        assertTrue(moon.retrograde());
    }

    @Test
    @DisplayName("zero speed is direct motion")
    void zeroSpeedIsDirect() {
        assertFalse(PositionDeriver.derive(Body.SUN, 10.0, 0.0, 0.0).retrograde());
    }

    @Test
    @DisplayName("pada counts quarters of 3°20′ inside the mansion")
    void pada() {
        assertEquals(1, PositionDeriver.padaOf(0.0));
        assertEquals(2, PositionDeriver.padaOf(5.0));
        assertEquals(4, PositionDeriver.padaOf(11.0));
        assertEquals(1, PositionDeriver.padaOf(13.5));
        for (double lon = 0.0; lon < 360.0; lon += 0.37) {
            int pada = PositionDeriver.padaOf(lon);
            assertTrue(pada >= 1 && pada <= 4, "pada " + pada + " at " + lon);
        }
    }

    @Test
    @DisplayName("degrees already travelled through the mansion")
    void degreesInNakshatra() {
        assertEquals(1.0, PositionDeriver.degreesInNakshatra(Nakshatra.SPAN + 1.0), 1e-9);
    }
}
