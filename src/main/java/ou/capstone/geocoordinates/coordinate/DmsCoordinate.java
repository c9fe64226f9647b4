package ou.capstone.geocoordinates.coordinate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.geocoordinates.config.CoordinateFamily;
import ou.capstone.geocoordinates.config.CoordinateSettings;
import ou.capstone.geocoordinates.config.Tolerance;
import ou.capstone.geocoordinates.exceptions.InvalidArgumentException;
import ou.capstone.geocoordinates.validation.ValidationRules;

/**
 * Immutable angular value in degrees/minutes/seconds form.
 *
 * <p>The stored triple is always the corrected one: seconds in [0, 60), minutes in [0, 59],
 * degrees non-negative, with the hemisphere carried only by {@link #isNegative()}.
 *
 * <p>Arithmetic works on decimal degrees and rebuilds the result through the receiver's
 * {@link CoordinateVariant}, so a {@code Latitude} minus anything is again a {@code Latitude},
 * validated like any other. Comparisons also work on decimal degrees, using the process-wide
 * {@link Tolerance} of {@link CoordinateSettings}.
 *
 * <p>Coordinates make poor hash keys: equality is tolerance-based, so every coordinate of one
 * type shares a hash code and a {@code HashSet} or {@code HashMap} of them degrades to a linear
 * scan. Keep them in a list or a {@code TreeMap} ordered by {@link #compareTo} instead.
 *
 * @param <T> the concrete coordinate type
 */
public abstract class DmsCoordinate<T extends DmsCoordinate<T>> implements Comparable<DmsCoordinate<?>> {
    private static final Logger logger = LoggerFactory.getLogger(DmsCoordinate.class);

    /** Fractional digits kept by {@link #toDecimalDegrees()}; below a centimetre anywhere on Earth. */
    public static final int DECIMAL_PLACES = 8;

    private final CoordinateVariant<T> variant;
    private final int degrees;
    private final int minutes;
    private final double seconds;
    private final boolean negative;
    private final int signFactor;
    private final double decimalDegrees;

    protected DmsCoordinate(final CoordinateVariant<T> variant, final Dms dms, final boolean negative) {
        this.variant = variant;
        this.degrees = dms.degrees();
        this.minutes = dms.minutes();
        this.seconds = dms.seconds();
        this.negative = negative;
        this.signFactor = negative ? -1 : 1;
        this.decimalDegrees = round(dms.magnitude() * signFactor);
    }

    /**
     * Applies the structural rules (when {@link CoordinateFamily#BASE} validation is enabled),
     * then the carry correction, which always runs.
     */
    protected static Dms normalize(final Number degrees, final Number minutes, final Number seconds,
                                   final boolean negative) {
        if (CoordinateSettings.get().isValidationEnabled(CoordinateFamily.BASE)) {
            ValidationRules.validateBase(degrees, minutes, seconds, negative);
        }
        Objects.requireNonNull(degrees, "degrees");
        Objects.requireNonNull(minutes, "minutes");
        Objects.requireNonNull(seconds, "seconds");
        return Correction.correct(degrees.intValue(), minutes.intValue(), seconds.doubleValue());
    }

    /**
     * Splits signed decimal degrees into an unsigned DMS magnitude by repeated truncation.
     *
     * @throws InvalidArgumentException if the value is not finite or too large for whole degrees
     */
    protected static Dms decompose(final double decimalDegrees) {
        if (!Double.isFinite(decimalDegrees)) {
            throw new InvalidArgumentException("Cannot cast a non-finite value: " + decimalDegrees);
        }
        if (Math.abs(decimalDegrees) >= ValidationRules.MAX_DEGREES) {
            throw new InvalidArgumentException("Cannot cast a value this large: " + decimalDegrees);
        }
        final double wholeDegrees = truncate(decimalDegrees);
        final double minutes = (decimalDegrees - wholeDegrees) * 60;
        final double seconds = (minutes - truncate(minutes)) * 60;
        return new Dms((int) Math.abs(wholeDegrees), (int) Math.abs(truncate(minutes)), Math.abs(seconds));
    }

    private static double truncate(final double value) {
        return value < 0 ? Math.ceil(value) : Math.floor(value);
    }

    private static double round(final double value) {
        if (!Double.isFinite(value)) {
            // only reachable with base validation disabled
            return value;
        }
        return new BigDecimal(value).setScale(DECIMAL_PLACES, RoundingMode.HALF_EVEN).doubleValue();
    }

    public int getDegrees() {
        return degrees;
    }

    public int getMinutes() {
        return minutes;
    }

    public double getSeconds() {
        return seconds;
    }

    public boolean isNegative() {
        return negative;
    }

    /** @return -1 for a negative coordinate, 1 otherwise */
    public int getSignFactor() {
        return signFactor;
    }

    /** @return true if degrees, minutes and seconds are all zero */
    public boolean isZero() {
        return degrees == 0 && minutes == 0 && seconds == 0;
    }

    /** @return the display token of the hemisphere */
    public abstract String getSign();

    /** @return the variant this coordinate is rebuilt through */
    public CoordinateVariant<T> getVariant() {
        return variant;
    }

    /**
     * @return {@code signFactor * (degrees + minutes / 60 + seconds / 3600)},
     *         rounded half-even to {@value #DECIMAL_PLACES} fractional digits
     */
    public double toDecimalDegrees() {
        return decimalDegrees;
    }

    // ---------- Arithmetic ----------

    public T add(final DmsCoordinate<?> other) {
        return add(decimalOf(other));
    }

    public T add(final double value) {
        return variant.cast(decimalDegrees + value);
    }

    /** @return {@code this - other} */
    public T subtract(final DmsCoordinate<?> other) {
        return subtract(decimalOf(other));
    }

    /** @return {@code this - value} */
    public T subtract(final double value) {
        return variant.cast(decimalDegrees - value);
    }

    /** @return {@code value - this} */
    public T reverseSubtract(final double value) {
        return variant.cast(value - decimalDegrees);
    }

    public T multiply(final DmsCoordinate<?> other) {
        return multiply(decimalOf(other));
    }

    public T multiply(final double factor) {
        return variant.cast(decimalDegrees * factor);
    }

    /**
     * @return {@code this / other}
     * @throws ArithmeticException if {@code other} is zero
     */
    public T divide(final DmsCoordinate<?> other) {
        return divide(decimalOf(other));
    }

    /**
     * @return {@code this / divisor}
     * @throws ArithmeticException if {@code divisor} is zero
     */
    public T divide(final double divisor) {
        if (divisor == 0) {
            logger.debug("Rejected division of {} by zero", this);
            throw new ArithmeticException("Division by zero");
        }
        return variant.cast(decimalDegrees / divisor);
    }

    /**
     * @return {@code dividend / this}
     * @throws ArithmeticException if this coordinate is zero
     */
    public T reverseDivide(final double dividend) {
        if (decimalDegrees == 0) {
            logger.debug("Rejected division of {} by zero coordinate {}", dividend, this);
            throw new ArithmeticException("Division by zero");
        }
        return variant.cast(dividend / decimalDegrees);
    }

    private static double decimalOf(final DmsCoordinate<?> other) {
        return Objects.requireNonNull(other, "other").toDecimalDegrees();
    }

    // ---------- Comparison ----------

    private static Tolerance tolerance() {
        return CoordinateSettings.get().getComparisonTolerance();
    }

    /** @return true if both decimal-degree values are within the comparison tolerance */
    public boolean isEqualTo(final DmsCoordinate<?> other) {
        return isEqualTo(decimalOf(other));
    }

    public boolean isEqualTo(final double value) {
        return tolerance().isClose(decimalDegrees, value);
    }

    /** @return true if not within tolerance and numerically greater */
    public boolean isGreaterThan(final DmsCoordinate<?> other) {
        return isGreaterThan(decimalOf(other));
    }

    public boolean isGreaterThan(final double value) {
        return !tolerance().isClose(decimalDegrees, value) && decimalDegrees > value;
    }

    /** @return true if not within tolerance and numerically smaller */
    public boolean isLessThan(final DmsCoordinate<?> other) {
        return isLessThan(decimalOf(other));
    }

    public boolean isLessThan(final double value) {
        return !tolerance().isClose(decimalDegrees, value) && decimalDegrees < value;
    }

    public boolean isGreaterThanOrEqualTo(final DmsCoordinate<?> other) {
        return isGreaterThanOrEqualTo(decimalOf(other));
    }

    public boolean isGreaterThanOrEqualTo(final double value) {
        return isEqualTo(value) || isGreaterThan(value);
    }

    public boolean isLessThanOrEqualTo(final DmsCoordinate<?> other) {
        return isLessThanOrEqualTo(decimalOf(other));
    }

    public boolean isLessThanOrEqualTo(final double value) {
        return isEqualTo(value) || isLessThan(value);
    }

    /**
     * Orders by decimal degrees; values within the comparison tolerance compare as 0.
     * Tolerance makes this ordering non-transitive near the tolerance boundary.
     */
    @Override
    public int compareTo(final DmsCoordinate<?> other) {
        final double value = decimalOf(other);
        if (tolerance().isClose(decimalDegrees, value)) {
            return 0;
        }
        return Double.compare(decimalDegrees, value);
    }

    /**
     * Tolerance equality between coordinates of the same type. Use {@link #isEqualTo} to
     * compare across types or against plain decimal degrees.
     */
    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return isEqualTo((DmsCoordinate<?>) o);
    }

    /**
     * Tolerance equality cannot be bucketed, so all coordinates of one type share a hash.
     */
    @Override
    public int hashCode() {
        return variant.name().hashCode();
    }

    /**
     * @return a Java expression that recreates an equal coordinate
     */
    public abstract String describe();
}
