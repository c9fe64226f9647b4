package ou.capstone.geocoordinates.config;

import java.util.EnumMap;
import java.util.Map;

/**
 * Initial values the process-wide settings start from and return to on reset.
 */
public record SettingsDefaults(Tolerance tolerance, Map<CoordinateFamily, Boolean> validation) {

    public SettingsDefaults {
        final Map<CoordinateFamily, Boolean> complete = new EnumMap<>(CoordinateFamily.class);
        for (final CoordinateFamily family : CoordinateFamily.values()) {
            complete.put(family, validation == null ? Boolean.TRUE : validation.getOrDefault(family, Boolean.TRUE));
        }
        tolerance = (tolerance == null) ? Tolerance.defaults() : tolerance;
        validation = Map.copyOf(complete);
    }

    /**
     * Built-in defaults: absolute tolerance 1e-6, relative tolerance 1e-9, every validation enabled.
     */
    public static SettingsDefaults builtIn() {
        return new SettingsDefaults(Tolerance.defaults(), Map.of());
    }

    public boolean isValidationEnabled(final CoordinateFamily family) {
        return validation.get(family);
    }
}
