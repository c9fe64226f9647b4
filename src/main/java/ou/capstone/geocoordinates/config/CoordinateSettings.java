package ou.capstone.geocoordinates.config;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide configuration consulted by every coordinate construction and comparison:
 * the comparison tolerance and one validation switch per {@link CoordinateFamily}.
 *
 * <p>Lifecycle: the singleton is created on first use from {@link SettingsLoader#loadDefaults()}.
 * Changes made through the setters apply to every subsequent operation in the process,
 * including comparisons of coordinates built earlier. Each value is read atomically, but
 * there is no ordering guarantee against operations already in flight; callers that need
 * a consistent view must serialize configuration changes against coordinate work themselves.
 * {@link #reset()} returns everything to the loaded defaults.
 */
public final class CoordinateSettings {
    private static final Logger logger = LoggerFactory.getLogger(CoordinateSettings.class);

    private static final CoordinateSettings INSTANCE =
            new CoordinateSettings(new SettingsLoader().loadDefaults());

    private final SettingsDefaults defaults;
    private final AtomicReference<Tolerance> tolerance;
    private final Map<CoordinateFamily, AtomicBoolean> validation = new EnumMap<>(CoordinateFamily.class);

    CoordinateSettings(final SettingsDefaults defaults) {
        this.defaults = defaults;
        this.tolerance = new AtomicReference<>(defaults.tolerance());
        for (final CoordinateFamily family : CoordinateFamily.values()) {
            validation.put(family, new AtomicBoolean(defaults.isValidationEnabled(family)));
        }
    }

    public static CoordinateSettings get() {
        return INSTANCE;
    }

    public Tolerance getComparisonTolerance() {
        return tolerance.get();
    }

    /**
     * Sets the absolute tolerance and restores the default relative tolerance.
     */
    public void setComparisonTolerance(final double absTol) {
        setComparisonTolerance(absTol, Tolerance.DEFAULT_REL_TOL);
    }

    /**
     * @throws IllegalArgumentException if either value is negative or not finite
     */
    public void setComparisonTolerance(final double absTol, final double relTol) {
        final Tolerance updated = new Tolerance(absTol, relTol);
        final Tolerance previous = tolerance.getAndSet(updated);
        logger.info("Comparison tolerance changed from {} to {}", previous, updated);
    }

    public boolean isValidationEnabled(final CoordinateFamily family) {
        return validation.get(family).get();
    }

    public void enableValidation(final CoordinateFamily family) {
        setValidation(family, true);
    }

    public void disableValidation(final CoordinateFamily family) {
        setValidation(family, false);
    }

    private void setValidation(final CoordinateFamily family, final boolean enabled) {
        if (validation.get(family).getAndSet(enabled) != enabled) {
            logger.info("{} validation {}", family, enabled ? "enabled" : "disabled");
        }
    }

    /**
     * Restores the tolerance and every validation switch to the loaded defaults.
     */
    public void reset() {
        tolerance.set(defaults.tolerance());
        for (final CoordinateFamily family : CoordinateFamily.values()) {
            validation.get(family).set(defaults.isValidationEnabled(family));
        }
        logger.debug("Coordinate settings reset to {}", defaults);
    }

    public SettingsDefaults getDefaults() {
        return defaults;
    }
}
