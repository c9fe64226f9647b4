package ou.capstone.geocoordinates.validation;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import ou.capstone.geocoordinates.exceptions.InvalidArgumentException;
import ou.capstone.geocoordinates.exceptions.InvalidSignException;
import ou.capstone.geocoordinates.exceptions.OutOfRangeException;

class ValidationRulesTest {

    @Test
    void baseAcceptsValidTuples() {
        assertDoesNotThrow(() -> ValidationRules.validateBase(0, 0, 0, false));
        assertDoesNotThrow(() -> ValidationRules.validateBase(359, 59, 59.999, true));
        assertDoesNotThrow(() -> ValidationRules.validateBase(1000, 0, 0.5, false));
    }

    @Test
    void baseRejectsNonIntegralTypes() {
        assertThrows(InvalidArgumentException.class, () -> ValidationRules.validateBase(1.0, 0, 0, false));
        assertThrows(InvalidArgumentException.class, () -> ValidationRules.validateBase(1, 0.0f, 0, false));
        assertThrows(InvalidArgumentException.class,
                () -> ValidationRules.validateBase(BigDecimal.ONE, 0, 0, false));
        assertThrows(InvalidArgumentException.class,
                () -> ValidationRules.validateBase(Long.MAX_VALUE, 0, 0, false));
    }

    @Test
    void baseRejectsDegreesWithoutRoomForCarry() {
        assertThrows(InvalidArgumentException.class,
                () -> ValidationRules.validateBase(Integer.MAX_VALUE, 0, 0, false));
        ValidationRules.validateBase(Integer.MAX_VALUE - 1, 59, 59.9, false);
    }

    @Test
    void integralTypes() {
        assertTrue(ValidationRules.isIntegral(1));
        assertTrue(ValidationRules.isIntegral(1L));
        assertTrue(ValidationRules.isIntegral((byte) 1));
        assertTrue(ValidationRules.isIntegral(BigInteger.TEN));
        assertFalse(ValidationRules.isIntegral(BigInteger.ONE.shiftLeft(40)));
        assertFalse(ValidationRules.isIntegral(2.0));
    }

    @Test
    void baseRejectsNegativeAndOversizedComponents() {
        assertThrows(InvalidArgumentException.class, () -> ValidationRules.validateBase(0, 0, -0.1, false));
        assertThrows(InvalidArgumentException.class, () -> ValidationRules.validateBase(0, 60, 0, false));
        assertThrows(InvalidArgumentException.class, () -> ValidationRules.validateBase(0, 0, 60.0, false));
        assertThrows(InvalidArgumentException.class, () -> ValidationRules.validateBase(0, 0, 0, true));
        assertThrows(InvalidArgumentException.class, () -> ValidationRules.validateBase(null, 0, 0, false));
    }

    @Test
    void hemisphereRuleOrder() {
        // sign is checked before range
        assertThrows(InvalidSignException.class,
                () -> ValidationRules.validateHemisphere(HemisphereRules.LATITUDE, 200, 0, 0, "X"));
        // range before sign consistency
        assertThrows(OutOfRangeException.class,
                () -> ValidationRules.validateHemisphere(HemisphereRules.LATITUDE, 200, 0, 0, "Equator"));
        assertThrows(InvalidArgumentException.class,
                () -> ValidationRules.validateHemisphere(HemisphereRules.LATITUDE, 20, 0, 0, "Equator"));
    }

    @Test
    void hemisphereBoundaries() {
        assertDoesNotThrow(() -> ValidationRules.validateHemisphere(HemisphereRules.LONGITUDE, 180, 0, 0, "W"));
        assertDoesNotThrow(() -> ValidationRules.validateHemisphere(HemisphereRules.LONGITUDE, 179, 59, 59.9, "E"));
        OutOfRangeException e = assertThrows(OutOfRangeException.class,
                () -> ValidationRules.validateHemisphere(HemisphereRules.LONGITUDE, 180, 0, 0.001, "E"));
        assertEquals(180, e.getBound());
    }

    @Test
    void hemisphereSigns() {
        assertEquals("Equator", HemisphereRules.LATITUDE.signFor(true, true));
        assertEquals("S", HemisphereRules.LATITUDE.signFor(false, true));
        assertEquals("E", HemisphereRules.LONGITUDE.signFor(false, false));
        assertTrue(HemisphereRules.LONGITUDE.isNegative("W"));
        assertFalse(HemisphereRules.LONGITUDE.isNegative("GM"));
    }
}
