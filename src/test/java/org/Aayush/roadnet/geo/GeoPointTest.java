package org.Aayush.roadnet.geo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeoPointTest {

    @Test
    @DisplayName("Validation: out-of-range and non-finite coordinates are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> GeoPoint.of(90.5, 0.0));
        assertThrows(IllegalArgumentException.class, () -> GeoPoint.of(0.0, -180.5));
        assertThrows(IllegalArgumentException.class, () -> GeoPoint.of(Double.NaN, 0.0));
        assertTrue(GeoPoint.isValid(-90.0, 180.0));
    }

    @Test
    @DisplayName("Midpoint and GeoJSON order")
    void testMidpointAndGeoJson() {
        GeoPoint mid = GeoPoint.of(37.0, -122.0).midpoint(GeoPoint.of(38.0, -121.0));
        assertEquals(37.5, mid.getLatitude(), 1e-12);
        assertEquals(-121.5, mid.getLongitude(), 1e-12);
        assertArrayEquals(new double[]{-121.5, 37.5}, mid.toGeoJson(), 1e-12);
    }
}
