package com.vedicchart.common.house;

import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.catalog.Sign;
import com.vedicchart.common.exception.CatalogLookupException;
import com.vedicchart.common.model.BodyPosition;
import com.vedicchart.common.model.House;
import com.vedicchart.common.position.PositionDeriver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HouseBuilderTest {

    private static BodyPosition at(Body body, double longitude) {
        return PositionDeriver.derive(body, longitude, 0.0, 1.0);
    }

    // ── construction ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("build(): equal houses")
    class BuildTests {

        @Test
        @DisplayName("ascendant 100° → house 1 at 100°, house 7 at 280°, body at 285° in house 7")
        void ascendantHundred() {
            List<House> houses = HouseBuilder.build(100.0, List.of(at(Body.SATURN, 285.0)));

            assertEquals(12, houses.size());
            assertEquals(100.0, houses.get(0).cusp(), 1e-12);
            assertEquals(280.0, houses.get(6).cusp(), 1e-12);
            assertEquals(7, HouseBuilder.houseOf(285.0, houses));
            assertEquals(7, HouseBuilder.houseOf(285.0, 100.0));
            assertEquals(List.of(Body.SATURN), HouseBuilder.house(houses, 7).occupants());
        }

        @Test
        @DisplayName("cusps wrap through 0°")
        void wraparound() {
            List<House> houses = HouseBuilder.build(350.0, List.of());
            assertEquals(20.0, houses.get(1).cusp(), 1e-12);
            assertEquals(1, HouseBuilder.houseOf(5.0, houses));
            assertEquals(12, HouseBuilder.houseOf(349.9, houses));
            assertEquals(1, HouseBuilder.houseOf(5.0, 350.0));
        }

        @Test
        @DisplayName("sign and lord come from the cusp")
        void signAndLord() {
            House first = HouseBuilder.build(100.0, List.of()).get(0);
            assertEquals(Sign.CANCER, first.sign());
            assertEquals(Body.MOON, first.lord());
        }

        @Test
        @DisplayName("occupants are listed in catalog order")
        void occupantOrder() {
            List<House> houses = HouseBuilder.build(0.0,
                List.of(at(Body.VENUS, 12.0), at(Body.SUN, 20.0), at(Body.MERCURY, 5.0)));
            assertEquals(List.of(Body.SUN, Body.MERCURY, Body.VENUS), houses.get(0).occupants());
            assertFalse(houses.get(1).isOccupied());
        }

        @Test
        @DisplayName("madhya is the midpoint of the span")
        void madhya() {
            House first = HouseBuilder.build(100.0, List.of()).get(0);
            assertEquals(115.0, first.madhya(), 1e-12);
            assertEquals(30.0, first.span(), 1e-12);
            House twelfth = HouseBuilder.build(100.0, List.of()).get(11);
            assertEquals(85.0, twelfth.madhya(), 1e-12);
        }

        @Test
        @DisplayName("HouseSystem extension point reports its name")
        void systemName() {
            assertEquals("Equal", EqualHouseSystem.INSTANCE.name());
            assertEquals(12, EqualHouseSystem.INSTANCE.cusps(0.0).size());
        }
    }

    @Nested
    @DisplayName("sandhi")
    class SandhiTests {

        @Test
        @DisplayName("within 2° of a cusp, inclusive")
        void nearCusp() {
            List<House> houses = HouseBuilder.build(100.0, List.of());
            assertTrue(HouseBuilder.isInSandhi(101.5, houses));
            assertTrue(HouseBuilder.isInSandhi(98.0, houses));
            assertTrue(HouseBuilder.isInSandhi(128.5, 100.0));
            assertFalse(HouseBuilder.isInSandhi(115.0, houses));
        }

        @Test
        @DisplayName("the flag never changes placement")
        void placementUnchanged() {
            List<House> houses = HouseBuilder.build(100.0, List.of());
            assertEquals(12, HouseBuilder.houseOf(99.0, houses));
            assertEquals(1, HouseBuilder.houseOf(101.0, houses));
        }
    }

    @Nested
    @DisplayName("HouseNature")
    class NatureTests {

        @Test
        @DisplayName("flags depend only on the number")
        void flags() {
            assertTrue(HouseNature.isKendra(10));
            assertTrue(HouseNature.isUpachaya(10));
            assertTrue(HouseNature.isTrikona(1) && HouseNature.isKendra(1));
            assertTrue(HouseNature.isDusthana(8));
            assertTrue(HouseNature.isMaraka(2));
            assertEquals(List.of("Upachaya", "Dusthana"), HouseNature.labels(6));
        }

        @Test
        @DisplayName("opposite and forward count")
        void counting() {
            assertEquals(7, HouseNature.opposite(1));
            assertEquals(1, HouseNature.opposite(7));
            assertEquals(6, HouseNature.opposite(12));
            assertEquals(12, HouseNature.countFrom(1, 1));
            assertEquals(4, HouseNature.countFrom(10, 2));
        }

        @Test
        @DisplayName("house numbers outside 1..12 raise")
        void invalidNumber() {
            CatalogLookupException ex = assertThrows(CatalogLookupException.class, () -> HouseNature.isKendra(13));
            assertEquals("House", ex.getCatalog());
            assertThrows(CatalogLookupException.class, () -> Bhava.of(0));
            assertThrows(CatalogLookupException.class,
                () -> HouseBuilder.house(HouseBuilder.build(0.0, List.of()), 13));
        }

        @Test
        @DisplayName("bhava names and karakas")
        void bhava() {
            assertEquals(Bhava.KARMA, Bhava.of(10));
            assertTrue(Bhava.of(10).karakas().contains(Body.SATURN));
        }
    }
}
