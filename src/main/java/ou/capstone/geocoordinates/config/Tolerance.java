package ou.capstone.geocoordinates.config;

/**
 * Absolute and relative slack within which two decimal-degree values are considered equal.
 *
 * @param absTol absolute tolerance, in decimal degrees
 * @param relTol relative tolerance, as a fraction of the larger magnitude
 */
public record Tolerance(double absTol, double relTol) {

    public static final double DEFAULT_ABS_TOL = 0.000001;
    public static final double DEFAULT_REL_TOL = 1e-9;

    public Tolerance {
        if (!Double.isFinite(absTol) || absTol < 0.0) {
            throw new IllegalArgumentException("Absolute tolerance must be a finite non-negative number, got: " + absTol);
        }
        if (!Double.isFinite(relTol) || relTol < 0.0) {
            throw new IllegalArgumentException("Relative tolerance must be a finite non-negative number, got: " + relTol);
        }
    }

    public static Tolerance defaults() {
        return new Tolerance(DEFAULT_ABS_TOL, DEFAULT_REL_TOL);
    }

    /**
     * @return true if {@code |a - b| <= max(relTol * max(|a|, |b|), absTol)}
     */
    public boolean isClose(final double a, final double b) {
        if (a == b) {
            return true;
        }
        if (!Double.isFinite(a) || !Double.isFinite(b)) {
            return false;
        }
        final double diff = Math.abs(a - b);
        return diff <= Math.max(relTol * Math.max(Math.abs(a), Math.abs(b)), absTol);
    }
}
