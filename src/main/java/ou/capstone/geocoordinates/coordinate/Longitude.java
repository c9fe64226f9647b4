package ou.capstone.geocoordinates.coordinate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.geocoordinates.config.CoordinateFamily;
import ou.capstone.geocoordinates.config.CoordinateSettings;
import ou.capstone.geocoordinates.exceptions.GeoCoordinateException;
import ou.capstone.geocoordinates.validation.CoordinateResult;
import ou.capstone.geocoordinates.validation.HemisphereRules;

/**
 * Longitude: angular distance east or west of the prime meridian (Greenwich).
 * Accepts at most 180 degrees and the signs {@value #EAST} (east), {@value #WEST} (west)
 * and {@value #PRIME_MERIDIAN} (on the prime meridian).
 */
public final class Longitude extends HemisphereCoordinate<Longitude> {
    private static final Logger logger = LoggerFactory.getLogger(Longitude.class);

    public static final String EAST = "E";
    public static final String WEST = "W";
    public static final String PRIME_MERIDIAN = "GM";

    public static final HemisphereRules RULES = HemisphereRules.LONGITUDE;

    public static final CoordinateVariant<Longitude> VARIANT =
            new CoordinateVariant<>("Longitude", CoordinateFamily.LONGITUDE, Longitude::cast);

    private Longitude(final Dms dms, final String sign) {
        super(VARIANT, dms, sign, RULES);
    }

    /**
     * Longitude with the default sign {@value #PRIME_MERIDIAN}, which only a zero magnitude accepts.
     */
    public static Longitude of(final int degrees, final int minutes, final double seconds) {
        return of(degrees, minutes, seconds, PRIME_MERIDIAN);
    }

    public static Longitude of(final int degrees, final int minutes, final double seconds, final String sign) {
        return ofComponents(degrees, minutes, seconds, sign);
    }

    public static Longitude ofComponents(final Number degrees, final Number minutes, final Number seconds,
                                      final String sign) {
        return new Longitude(normalize(VARIANT, RULES, degrees, minutes, seconds, sign), sign);
    }

    public static CoordinateResult<Longitude> tryOf(final int degrees, final int minutes, final double seconds,
                                                 final String sign) {
        return tryOfComponents(degrees, minutes, seconds, sign);
    }

    public static CoordinateResult<Longitude> tryOfComponents(final Number degrees, final Number minutes,
                                                           final Number seconds, final String sign) {
        try {
            return CoordinateResult.success(ofComponents(degrees, minutes, seconds, sign));
        } catch (final GeoCoordinateException e) {
            logger.debug("Rejected Longitude({}, {}, {}, {}): {}", degrees, minutes, seconds, sign, e.getMessage());
            return CoordinateResult.failure(e);
        }
    }

    /** Sign follows the decimal value: W below zero, E above, GM at zero. */
    public static Longitude cast(final double decimalDegrees) {
        final GeoCoordinate geo = GeoCoordinate.cast(decimalDegrees);
        return of(geo.getDegrees(), geo.getMinutes(), geo.getSeconds(), signOf(RULES, geo));
    }

    public static CoordinateResult<Longitude> tryCast(final double decimalDegrees) {
        try {
            return CoordinateResult.success(cast(decimalDegrees));
        } catch (final GeoCoordinateException e) {
            logger.debug("Rejected cast of {} to Longitude: {}", decimalDegrees, e.getMessage());
            return CoordinateResult.failure(e);
        }
    }

    public static boolean longitudeValidationStatus() {
        return CoordinateSettings.get().isValidationEnabled(CoordinateFamily.LONGITUDE);
    }

    public static void enableLongitudeValidation() {
        CoordinateSettings.get().enableValidation(CoordinateFamily.LONGITUDE);
    }

    public static void disableLongitudeValidation() {
        CoordinateSettings.get().disableValidation(CoordinateFamily.LONGITUDE);
    }
}
