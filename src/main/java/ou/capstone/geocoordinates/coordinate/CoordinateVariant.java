package ou.capstone.geocoordinates.coordinate;

import java.util.function.DoubleFunction;

import ou.capstone.geocoordinates.config.CoordinateFamily;
import ou.capstone.geocoordinates.config.CoordinateSettings;

/**
 * Identity of one coordinate type: its name, the validation switch governing its own rules,
 * and the factory that rebuilds a value of that type from decimal degrees.
 * Arithmetic results are always rebuilt through the receiver's variant.
 */
public record CoordinateVariant<T extends DmsCoordinate<T>>(String name, CoordinateFamily family,
                                                            DoubleFunction<T> caster) {

    public T cast(final double decimalDegrees) {
        return caster.apply(decimalDegrees);
    }

    public boolean isValidationEnabled() {
        return CoordinateSettings.get().isValidationEnabled(family);
    }
}
