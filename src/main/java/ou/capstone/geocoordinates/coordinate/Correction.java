package ou.capstone.geocoordinates.coordinate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.geocoordinates.config.CoordinateSettings;
import ou.capstone.geocoordinates.config.Tolerance;

/**
 * Carries seconds that round up to 60 into minutes, and minutes that reach 60 into degrees,
 * so that no stored component sits at its modulus.
 */
public final class Correction {
    private static final Logger logger = LoggerFactory.getLogger(Correction.class);

    /** Seconds per degree; scales the degree-level tolerance down to seconds. */
    static final double SECONDS_PER_DEGREE = 3600.0;

    private Correction() {
        // Prevent instantiation
    }

    /**
     * Corrects using the current comparison tolerance of {@link CoordinateSettings}.
     */
    public static Dms correct(final int degrees, final int minutes, final double seconds) {
        return correct(degrees, minutes, seconds, CoordinateSettings.get().getComparisonTolerance());
    }

    /**
     * Seconds within {@code absTol * 3600} of 60 become a whole minute; minutes at or above 60
     * become a whole degree. Never throws for a triple that passed base validation.
     *
     * @throws ArithmeticException if carrying into degrees would overflow an {@code int}
     */
    public static Dms correct(int degrees, int minutes, double seconds, final Tolerance tolerance) {
        final Tolerance secondsTolerance =
                new Tolerance(tolerance.absTol() * SECONDS_PER_DEGREE, Tolerance.DEFAULT_REL_TOL);
        if (secondsTolerance.isClose(seconds, 60.0)) {
            logger.debug("Carrying {} seconds into minutes of {}d {}m", seconds, degrees, minutes);
            minutes += 1;
            seconds = 0;
        }
        if (minutes >= 60) {
            logger.debug("Carrying {} minutes into degrees of {}d", minutes, degrees);
            minutes = 0;
            degrees = Math.addExact(degrees, 1);
        }
        return new Dms(degrees, minutes, seconds);
    }
}
