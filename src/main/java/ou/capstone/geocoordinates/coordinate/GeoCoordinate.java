package ou.capstone.geocoordinates.coordinate;

import java.math.BigDecimal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.geocoordinates.config.CoordinateFamily;
import ou.capstone.geocoordinates.config.CoordinateSettings;
import ou.capstone.geocoordinates.config.Tolerance;
import ou.capstone.geocoordinates.exceptions.GeoCoordinateException;
import ou.capstone.geocoordinates.exceptions.InvalidArgumentException;
import ou.capstone.geocoordinates.validation.CoordinateResult;

/**
 * Coordinate in Earth's coordinate system without a fixed reference line: the hemisphere is
 * only a {@code negative} flag and the magnitude has no upper bound.
 */
public final class GeoCoordinate extends DmsCoordinate<GeoCoordinate> {
    private static final Logger logger = LoggerFactory.getLogger(GeoCoordinate.class);

    public static final CoordinateVariant<GeoCoordinate> VARIANT =
            new CoordinateVariant<>("GeoCoordinate", CoordinateFamily.BASE, GeoCoordinate::cast);

    private GeoCoordinate(final Dms dms, final boolean negative) {
        super(VARIANT, dms, negative);
    }

    public static GeoCoordinate of(final int degrees, final int minutes, final double seconds) {
        return of(degrees, minutes, seconds, false);
    }

    /**
     * @param degrees  any non-negative integer
     * @param minutes  non-negative, below 60
     * @param seconds  non-negative, below 60
     * @param negative the hemisphere
     * @throws InvalidArgumentException if validation is enabled and a rule is broken
     */
    public static GeoCoordinate of(final int degrees, final int minutes, final double seconds,
                                   final boolean negative) {
        return ofComponents(degrees, minutes, seconds, negative);
    }

    /**
     * Like {@link #of(int, int, double, boolean)}, but accepts any numeric type so that
     * fractional degrees or minutes are rejected instead of silently truncated.
     */
    public static GeoCoordinate ofComponents(final Number degrees, final Number minutes, final Number seconds,
                                             final boolean negative) {
        return new GeoCoordinate(normalize(degrees, minutes, seconds, negative), negative);
    }

    public static CoordinateResult<GeoCoordinate> tryOf(final int degrees, final int minutes,
                                                        final double seconds, final boolean negative) {
        return tryOfComponents(degrees, minutes, seconds, negative);
    }

    public static CoordinateResult<GeoCoordinate> tryOfComponents(final Number degrees, final Number minutes,
                                                                  final Number seconds, final boolean negative) {
        try {
            return CoordinateResult.success(ofComponents(degrees, minutes, seconds, negative));
        } catch (final GeoCoordinateException e) {
            logger.debug("Rejected GeoCoordinate({}, {}, {}, negative={}): {}",
                    degrees, minutes, seconds, negative, e.getMessage());
            return CoordinateResult.failure(e);
        }
    }

    /**
     * Converts signed decimal degrees to DMS form. Degrees, minutes and seconds are taken by
     * truncation toward zero, and the result goes through the validated factory.
     *
     * @throws InvalidArgumentException if the value is not finite or the result breaks a rule
     */
    public static GeoCoordinate cast(final double decimalDegrees) {
        final Dms dms = decompose(decimalDegrees);
        return of(dms.degrees(), dms.minutes(), dms.seconds(), decimalDegrees < 0);
    }

    public static CoordinateResult<GeoCoordinate> tryCast(final double decimalDegrees) {
        try {
            return CoordinateResult.success(cast(decimalDegrees));
        } catch (final GeoCoordinateException e) {
            logger.debug("Rejected cast of {} to GeoCoordinate: {}", decimalDegrees, e.getMessage());
            return CoordinateResult.failure(e);
        }
    }

    /** @return {@code "-"} for a negative coordinate, empty otherwise */
    @Override
    public String getSign() {
        return isNegative() ? "-" : "";
    }

    // ---------- Process-wide settings ----------

    /** @return whether the structural rules run for every coordinate type */
    public static boolean validationStatus() {
        return CoordinateSettings.get().isValidationEnabled(CoordinateFamily.BASE);
    }

    public static void enableValidation() {
        CoordinateSettings.get().enableValidation(CoordinateFamily.BASE);
    }

    public static void disableValidation() {
        CoordinateSettings.get().disableValidation(CoordinateFamily.BASE);
    }

    public static Tolerance getComparisonTolerance() {
        return CoordinateSettings.get().getComparisonTolerance();
    }

    /**
     * Changes the tolerance of every comparison in the process, including those between
     * coordinates that already exist. The relative tolerance returns to its default.
     */
    public static void setComparisonTolerance(final double absTol) {
        CoordinateSettings.get().setComparisonTolerance(absTol);
    }

    public static void setComparisonTolerance(final double absTol, final double relTol) {
        CoordinateSettings.get().setComparisonTolerance(absTol, relTol);
    }

    // ---------- Presentation ----------

    @Override
    public String describe() {
        return "GeoCoordinate.of(" + getDegrees() + ", " + getMinutes() + ", " + getSeconds()
                + ", " + isNegative() + ")";
    }

    /**
     * Conventional display, e.g. {@code -1° 2' 3.5"}.
     */
    @Override
    public String toString() {
        return getSign() + getDegrees() + "° " + getMinutes() + "' " + formatSeconds(getSeconds()) + "\"";
    }

    private static String formatSeconds(final double seconds) {
        if (!Double.isFinite(seconds)) {
            return Double.toString(seconds);
        }
        final BigDecimal plain = BigDecimal.valueOf(seconds).stripTrailingZeros();
        return plain.scale() < 0 ? plain.setScale(0).toPlainString() : plain.toPlainString();
    }
}
