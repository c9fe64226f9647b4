package ou.capstone.geocoordinates.coordinate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.geocoordinates.config.CoordinateFamily;
import ou.capstone.geocoordinates.config.CoordinateSettings;
import ou.capstone.geocoordinates.exceptions.GeoCoordinateException;
import ou.capstone.geocoordinates.validation.CoordinateResult;
import ou.capstone.geocoordinates.validation.HemisphereRules;

/**
 * Latitude, which is the angular distance from the equator.
 * Accepts at most 90 degrees and the signs {@value #NORTH} (north), {@value #SOUTH} (south)
 * and {@value #EQUATOR} (on the equator).
 */
public final class Latitude extends HemisphereCoordinate<Latitude> {
    private static final Logger logger = LoggerFactory.getLogger(Latitude.class);

    public static final String NORTH = "N";
    public static final String SOUTH = "S";
    public static final String EQUATOR = "Equator";

    public static final HemisphereRules RULES = HemisphereRules.LATITUDE;

    public static final CoordinateVariant<Latitude> VARIANT =
            new CoordinateVariant<>("Latitude", CoordinateFamily.LATITUDE, Latitude::cast);

    private Latitude(final Dms dms, final String sign) {
        super(VARIANT, dms, sign, RULES);
    }

    /**
     * Latitude with the default sign {@value #EQUATOR}, which only a zero magnitude accepts.
     */
    public static Latitude of(final int degrees, final int minutes, final double seconds) {
        return of(degrees, minutes, seconds, EQUATOR);
    }

    /**
     * @param degrees any non-negative integer up to 90
     * @param minutes non-negative, below 60
     * @param seconds non-negative, below 60
     * @param sign    one of {@link HemisphereRules#signs()} of {@link #RULES}
     */
    public static Latitude of(final int degrees, final int minutes, final double seconds, final String sign) {
        return ofComponents(degrees, minutes, seconds, sign);
    }

    public static Latitude ofComponents(final Number degrees, final Number minutes, final Number seconds,
                                     final String sign) {
        return new Latitude(normalize(VARIANT, RULES, degrees, minutes, seconds, sign), sign);
    }

    public static CoordinateResult<Latitude> tryOf(final int degrees, final int minutes, final double seconds,
                                                final String sign) {
        return tryOfComponents(degrees, minutes, seconds, sign);
    }

    public static CoordinateResult<Latitude> tryOfComponents(final Number degrees, final Number minutes,
                                                          final Number seconds, final String sign) {
        try {
            return CoordinateResult.success(ofComponents(degrees, minutes, seconds, sign));
        } catch (final GeoCoordinateException e) {
            logger.debug("Rejected Latitude({}, {}, {}, {}): {}", degrees, minutes, seconds, sign, e.getMessage());
            return CoordinateResult.failure(e);
        }
    }

    /**
     * Converts signed decimal degrees to a Latitude, deriving the sign from the result.
     */
    public static Latitude cast(final double decimalDegrees) {
        final GeoCoordinate geo = GeoCoordinate.cast(decimalDegrees);
        return of(geo.getDegrees(), geo.getMinutes(), geo.getSeconds(), signOf(RULES, geo));
    }

    public static CoordinateResult<Latitude> tryCast(final double decimalDegrees) {
        try {
            return CoordinateResult.success(cast(decimalDegrees));
        } catch (final GeoCoordinateException e) {
            logger.debug("Rejected cast of {} to Latitude: {}", decimalDegrees, e.getMessage());
            return CoordinateResult.failure(e);
        }
    }

    public static boolean latitudeValidationStatus() {
        return CoordinateSettings.get().isValidationEnabled(CoordinateFamily.LATITUDE);
    }

    public static void enableLatitudeValidation() {
        CoordinateSettings.get().enableValidation(CoordinateFamily.LATITUDE);
    }

    public static void disableLatitudeValidation() {
        CoordinateSettings.get().disableValidation(CoordinateFamily.LATITUDE);
    }
}
