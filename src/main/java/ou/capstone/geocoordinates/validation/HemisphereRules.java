package ou.capstone.geocoordinates.validation;

import java.util.List;

/**
 * Domain bound and hemisphere vocabulary of a coordinate type measured from a reference
 * line: the equator for latitudes, the prime meridian for longitudes.
 *
 * @param typeName     name used in error messages
 * @param bound        largest accepted number of degrees
 * @param positiveSign token of the positive side (N, E)
 * @param negativeSign token of the negative side (S, W)
 * @param zeroSign     token of the reference line itself (Equator, GM)
 */
public record HemisphereRules(String typeName, int bound,
                              String positiveSign, String negativeSign, String zeroSign) {

    public static final HemisphereRules LATITUDE = new HemisphereRules("Latitude", 90, "N", "S", "Equator");
    public static final HemisphereRules LONGITUDE = new HemisphereRules("Longitude", 180, "E", "W", "GM");

    /** @return every accepted token, positive side first */
    public List<String> signs() {
        return List.of(positiveSign, negativeSign, zeroSign);
    }

    public boolean isNegative(final String sign) {
        return negativeSign.equals(sign);
    }

    /**
     * @param zero     whether the magnitude is exactly zero
     * @param negative whether the coordinate lies on the negative side
     * @return the token describing that position
     */
    public String signFor(final boolean zero, final boolean negative) {
        if (zero) {
            return zeroSign;
        }
        return negative ? negativeSign : positiveSign;
    }
}
