package ou.capstone.geocoordinates.validation;

import java.math.BigInteger;

import ou.capstone.geocoordinates.exceptions.InvalidArgumentException;
import ou.capstone.geocoordinates.exceptions.InvalidSignException;
import ou.capstone.geocoordinates.exceptions.OutOfRangeException;

/**
 * Pure checks of a degrees/minutes/seconds tuple. Nothing here corrects or stores anything;
 * a check either returns normally or throws.
 */
public final class ValidationRules {

    /** Exclusive upper limit of whole degrees; the carry in correction must still fit an int. */
    public static final int MAX_DEGREES = Integer.MAX_VALUE;

    private ValidationRules() {
        // Prevent instantiation
    }

    /**
     * Structural rules every coordinate obeys:
     * <ol>
     *   <li>degrees and minutes are of an integral type that fits an {@code int};</li>
     *   <li>seconds is a finite number;</li>
     *   <li>no magnitude is negative (the hemisphere goes in {@code negative});</li>
     *   <li>minutes and seconds are below 60;</li>
     *   <li>degrees leave room for a carry from minutes, so stay below {@link Integer#MAX_VALUE};</li>
     *   <li>a zero coordinate is not negative.</li>
     * </ol>
     *
     * @throws InvalidArgumentException on the first rule broken
     */
    public static void validateBase(final Number degrees, final Number minutes, final Number seconds,
                                    final boolean negative) {
        requireComponents(degrees, minutes, seconds);
        if (!isIntegral(degrees) || !isIntegral(minutes)) {
            throw new InvalidArgumentException(
                    "Accepts only integer values as argument for degrees and minutes.");
        }
        if (!Double.isFinite(seconds.doubleValue())) {
            throw new InvalidArgumentException("Seconds must be a finite number, got: " + seconds);
        }
        if (degrees.longValue() < 0 || minutes.longValue() < 0 || seconds.doubleValue() < 0) {
            throw new InvalidArgumentException(
                    "Degrees, minutes and seconds can only be positive numbers. "
                            + "Express a negative coordinate through its sign instead.");
        }
        if (minutes.longValue() >= 60 || seconds.doubleValue() >= 60) {
            throw new InvalidArgumentException(
                    "Values for minutes and seconds must not be greater than or equal to 60.");
        }
        if (degrees.longValue() >= MAX_DEGREES) {
            throw new InvalidArgumentException("Degrees must be less than " + MAX_DEGREES + ", got: " + degrees);
        }
        if (isZero(degrees, minutes, seconds) && negative) {
            throw new InvalidArgumentException("Coordinates at zero must not be negative.");
        }
    }

    /**
     * Rules of a coordinate measured from a reference line, applied in addition to
     * {@link #validateBase}: the sign belongs to the vocabulary, the magnitude stays within
     * the bound, and the zero token is used exactly when the magnitude is zero.
     *
     * @throws InvalidSignException      if the sign is not one of {@link HemisphereRules#signs()}
     * @throws OutOfRangeException       if the magnitude exceeds {@link HemisphereRules#bound()}
     * @throws InvalidArgumentException  if the sign disagrees with the magnitude
     */
    public static void validateHemisphere(final HemisphereRules rules, final Number degrees,
                                          final Number minutes, final Number seconds, final String sign) {
        requireComponents(degrees, minutes, seconds);
        if (sign == null || !rules.signs().contains(sign)) {
            throw new InvalidSignException(sign, rules.signs());
        }
        final double deg = degrees.doubleValue();
        if (deg > rules.bound()
                || (deg == rules.bound() && (minutes.doubleValue() != 0 || seconds.doubleValue() != 0))) {
            throw new OutOfRangeException(rules.bound(),
                    rules.typeName() + " cannot be more than " + rules.bound() + " degrees.");
        }
        final boolean zero = isZero(degrees, minutes, seconds);
        if (!zero && rules.zeroSign().equals(sign)) {
            throw new InvalidArgumentException(
                    "Please indicate explicitly the hemisphere sign " + rules.positiveSign()
                            + " or " + rules.negativeSign() + " for a nonzero " + rules.typeName() + ".");
        }
        if (zero && !rules.zeroSign().equals(sign)) {
            throw new InvalidArgumentException(
                    "A " + rules.typeName() + " of zero must use the sign '" + rules.zeroSign() + "'.");
        }
    }

    static boolean isIntegral(final Number value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return true;
        }
        if (value instanceof Long) {
            final long l = value.longValue();
            return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE;
        }
        if (value instanceof BigInteger) {
            return ((BigInteger) value).bitLength() < Integer.SIZE;
        }
        return false;
    }

    private static boolean isZero(final Number degrees, final Number minutes, final Number seconds) {
        return degrees.doubleValue() == 0 && minutes.doubleValue() == 0 && seconds.doubleValue() == 0;
    }

    private static void requireComponents(final Number degrees, final Number minutes, final Number seconds) {
        if (degrees == null || minutes == null || seconds == null) {
            throw new InvalidArgumentException("Degrees, minutes and seconds must all be provided.");
        }
    }
}
