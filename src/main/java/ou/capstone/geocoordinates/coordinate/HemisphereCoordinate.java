package ou.capstone.geocoordinates.coordinate;

import java.util.Locale;

import ou.capstone.geocoordinates.validation.HemisphereRules;
import ou.capstone.geocoordinates.validation.ValidationRules;

/**
 * Coordinate measured from a reference line, labelled with a hemisphere token instead of
 * a bare minus sign.
 *
 * @param <T> the concrete coordinate type
 */
public abstract class HemisphereCoordinate<T extends HemisphereCoordinate<T>> extends DmsCoordinate<T> {

    private final String sign;

    protected HemisphereCoordinate(final CoordinateVariant<T> variant, final Dms dms, final String sign,
                                   final HemisphereRules rules) {
        super(variant, dms, rules.isNegative(sign));
        this.sign = sign;
    }

    /**
     * Runs the hemisphere rules when the variant's validation is enabled, then the structural
     * rules and correction shared by every coordinate.
     */
    protected static Dms normalize(final CoordinateVariant<?> variant, final HemisphereRules rules,
                                   final Number degrees, final Number minutes, final Number seconds,
                                   final String sign) {
        if (variant.isValidationEnabled()) {
            ValidationRules.validateHemisphere(rules, degrees, minutes, seconds, sign);
        }
        return normalize(degrees, minutes, seconds, rules.isNegative(sign));
    }

    /**
     * @return the hemisphere token of a decimal-degree value: the zero token for an exact
     *         zero magnitude, otherwise the negative or positive token
     */
    protected static String signOf(final HemisphereRules rules, final GeoCoordinate geo) {
        return rules.signFor(geo.isZero(), geo.isNegative());
    }

    @Override
    public String getSign() {
        return sign;
    }

    @Override
    public String describe() {
        return getVariant().name() + ".of(" + getDegrees() + ", " + getMinutes() + ", " + getSeconds()
                + ", \"" + sign + "\")";
    }

    /**
     * Conventional display, e.g. {@code 07° 05' 03.250" N}.
     */
    @Override
    public String toString() {
        return String.format(Locale.US, "%02d° %02d' %06.3f\" %s", getDegrees(), getMinutes(), getSeconds(), sign);
    }
}
