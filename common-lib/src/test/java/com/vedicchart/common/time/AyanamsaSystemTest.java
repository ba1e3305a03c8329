package com.vedicchart.common.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AyanamsaSystemTest {

    @Nested
    @DisplayName("valueAt()")
    class ValueTests {

        @Test
        @DisplayName("base constants at J2000")
        void baseAtEpoch() {
            assertEquals(23.85, AyanamsaSystem.LAHIRI.valueAt(JulianDay.J2000), 1e-12);
            assertEquals(22.50, AyanamsaSystem.RAMAN.valueAt(JulianDay.J2000), 1e-12);
            assertEquals(23.77, AyanamsaSystem.KRISHNAMURTI.valueAt(JulianDay.J2000), 1e-12);
            assertEquals(24.04, AyanamsaSystem.FAGAN_BRADLEY.valueAt(JulianDay.J2000), 1e-12);
        }

        @Test
        @DisplayName("linear precession of 50.29″ per year")
        void linearPrecession() {
            double century = JulianDay.J2000 + JulianDay.DAYS_PER_JULIAN_CENTURY;
            assertEquals(23.85 + 5029.0 / 3600.0, AyanamsaSystem.LAHIRI.valueAt(century), 1e-9);
        }
    }

    @Nested
    @DisplayName("fromName()")
    class LookupTests {

        @Test
        @DisplayName("display names, constant names and separators all resolve")
        void resolves() {
            assertEquals(AyanamsaSystem.RAMAN, AyanamsaSystem.fromName("raman"));
            assertEquals(AyanamsaSystem.FAGAN_BRADLEY, AyanamsaSystem.fromName("Fagan-Bradley"));
            assertEquals(AyanamsaSystem.FAGAN_BRADLEY, AyanamsaSystem.fromName("fagan bradley"));
            assertEquals(AyanamsaSystem.KRISHNAMURTI, AyanamsaSystem.fromName(" KRISHNAMURTI "));
        }

        @Test
        @DisplayName("unknown, blank and null fall back to Lahiri")
        void fallsBack() {
            assertEquals(AyanamsaSystem.LAHIRI, AyanamsaSystem.fromName("Yukteshwar"));
            assertEquals(AyanamsaSystem.LAHIRI, AyanamsaSystem.fromName("  "));
            assertEquals(AyanamsaSystem.LAHIRI, AyanamsaSystem.fromName(null));
        }
    }
}
