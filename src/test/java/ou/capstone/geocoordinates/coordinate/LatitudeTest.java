package ou.capstone.geocoordinates.coordinate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import ou.capstone.geocoordinates.config.CoordinateSettings;
import ou.capstone.geocoordinates.exceptions.InvalidArgumentException;
import ou.capstone.geocoordinates.exceptions.InvalidSignException;
import ou.capstone.geocoordinates.exceptions.OutOfRangeException;

class LatitudeTest {

    private static final double TOLERANCE = 0.000001;

    @BeforeEach
    void resetSettings() {
        CoordinateSettings.get().reset();
    }

    @AfterEach
    void restoreSettings() {
        CoordinateSettings.get().reset();
    }

    @Test
    void testBounds() {
        Latitude northPole = Latitude.of(90, 0, 0, Latitude.NORTH);
        assertEquals(90.0, northPole.toDecimalDegrees(), TOLERANCE);

        Latitude southPole = Latitude.of(90, 0, 0, Latitude.SOUTH);
        assertEquals(-90.0, southPole.toDecimalDegrees(), TOLERANCE);

        OutOfRangeException e = assertThrows(OutOfRangeException.class, () -> Latitude.of(90, 0, 1, "N"));
        assertEquals(90, e.getBound());
        assertTrue(e.getMessage().contains("Latitude"), "Expected Latitude range exception");

        assertThrows(OutOfRangeException.class, () -> Latitude.of(90, 1, 0, "S"));
        assertThrows(OutOfRangeException.class, () -> Latitude.of(91, 0, 0, "N"));
    }

    @Test
    void testInvalidSign() {
        InvalidSignException e = assertThrows(InvalidSignException.class, () -> Latitude.of(10, 0, 0, "E"));
        assertEquals("E", e.getSign());
        assertEquals(List.of("N", "S", "Equator"), e.getPermittedSigns());

        assertThrows(InvalidSignException.class, () -> Latitude.of(10, 0, 0, "n"));
        assertThrows(InvalidSignException.class, () -> Latitude.of(10, 0, 0, null));
    }

    @Test
    void testSignConsistency() {
        assertThrows(InvalidArgumentException.class, () -> Latitude.of(0, 0, 0, "N"));
        assertThrows(InvalidArgumentException.class, () -> Latitude.of(0, 0, 0, "S"));
        assertThrows(InvalidArgumentException.class, () -> Latitude.of(1, 0, 0, "Equator"));
        assertThrows(InvalidArgumentException.class, () -> Latitude.of(1, 0, 0));

        Latitude equator = Latitude.of(0, 0, 0);
        assertEquals(Latitude.EQUATOR, equator.getSign());
        assertFalse(equator.isNegative());
    }

    @Test
    void testBaseRulesStillApply() {
        assertThrows(InvalidArgumentException.class, () -> Latitude.of(-1, 0, 0, "N"));
        assertThrows(InvalidArgumentException.class, () -> Latitude.of(1, 60, 0, "N"));
        assertThrows(InvalidArgumentException.class, () -> Latitude.ofComponents(1.5, 0, 0, "N"));
    }

    @Test
    void testSouthIsNegative() {
        Latitude lat = Latitude.of(33, 52, 7.68, Latitude.SOUTH);
        assertTrue(lat.isNegative());
        assertEquals(-1, lat.getSignFactor());
        assertEquals(-33.8688, lat.toDecimalDegrees(), TOLERANCE);
    }

    @Test
    void testCast_DerivesSign() {
        Latitude south = Latitude.cast(-33.8688);
        assertEquals(33, south.getDegrees());
        assertEquals(52, south.getMinutes());
        assertEquals(7.68, south.getSeconds(), TOLERANCE);
        assertEquals("S", south.getSign());

        assertEquals("N", Latitude.cast(35.3931).getSign());
        assertEquals("Equator", Latitude.cast(0.0).getSign());
        assertEquals("Equator", Latitude.cast(-0.0).getSign());
    }

    @Test
    void testCast_OutOfRange() {
        assertThrows(OutOfRangeException.class, () -> Latitude.cast(90.5));
        assertThrows(OutOfRangeException.class, () -> Latitude.cast(-91));
        assertInstanceOf(OutOfRangeException.class, Latitude.tryCast(100).error().orElseThrow());
    }

    @Test
    void testCast_RoundTrip() {
        double[] values = {-90.0, -45.25, -0.5, 0.0, 12.3456789, 35.3931, 89.99999, 90.0};
        for (double value : values) {
            assertEquals(value, Latitude.cast(value).toDecimalDegrees(), TOLERANCE, "Round trip of " + value);
        }
    }

    @Test
    void testArithmetic_PreservesType() {
        Latitude one = Latitude.of(1, 0, 0, Latitude.NORTH);

        Latitude zero = one.subtract(one);
        assertInstanceOf(Latitude.class, zero);
        assertEquals(Latitude.EQUATOR, zero.getSign());
        assertTrue(zero.isZero());
        assertTrue(zero.isEqualTo(Latitude.of(0, 0, 0)));

        Latitude south = one.subtract(Latitude.of(2, 0, 0, Latitude.NORTH));
        assertEquals(Latitude.SOUTH, south.getSign());
        assertEquals(1, south.getDegrees());

        Latitude fromPlain = one.add(GeoCoordinate.of(0, 30, 0));
        assertEquals(1.5, fromPlain.toDecimalDegrees(), TOLERANCE);
    }

    @Test
    void testArithmetic_DoesNotClamp() {
        Latitude lat = Latitude.of(89, 0, 0, Latitude.NORTH);
        assertEquals(90.0, lat.add(1).toDecimalDegrees(), TOLERANCE);
        assertThrows(OutOfRangeException.class, () -> lat.add(1.5));
        assertThrows(OutOfRangeException.class, () -> lat.multiply(2));
        assertThrows(ArithmeticException.class, () -> lat.divide(Latitude.of(0, 0, 0)));
    }

    @Test
    void testLatitudeValidationIndependentOfBase() {
        Latitude.disableLatitudeValidation();
        assertFalse(Latitude.latitudeValidationStatus());
        assertTrue(GeoCoordinate.validationStatus());

        // Hemisphere rules off, structural rules still on
        Latitude beyond = Latitude.of(95, 0, 0, "N");
        assertEquals(95, beyond.getDegrees());
        assertThrows(InvalidArgumentException.class, () -> Latitude.of(95, 75, 0, "N"));

        Latitude.enableLatitudeValidation();
        assertThrows(OutOfRangeException.class, () -> Latitude.of(95, 0, 0, "N"));
    }

    @Test
    void testBaseValidationDisabledKeepsLatitudeRules() {
        GeoCoordinate.disableValidation();
        assertTrue(Latitude.latitudeValidationStatus());
        assertThrows(OutOfRangeException.class, () -> Latitude.of(91, 0, 0, "N"));
    }

    @Test
    void testTryOf() {
        assertTrue(Latitude.tryOf(45, 0, 0, "N").isOk());

        var result = Latitude.tryOf(45, 0, 0, "X");
        assertFalse(result.isOk());
        assertInstanceOf(InvalidSignException.class, result.error().orElseThrow());
    }

    @Test
    void testToString() {
        assertEquals("07° 05' 03.250\" N", Latitude.of(7, 5, 3.25, "N").toString());
        assertEquals("33° 52' 07.680\" S", Latitude.cast(-33.8688).toString());
        assertEquals("00° 00' 00.000\" Equator", Latitude.of(0, 0, 0).toString());
    }

    @Test
    void testDescribe() {
        assertEquals("Latitude.of(1, 2, 3.0, \"N\")", Latitude.of(1, 2, 3, "N").describe());
        assertEquals("Latitude.of(0, 0, 0.0, \"Equator\")", Latitude.of(0, 0, 0).describe());
    }
}
