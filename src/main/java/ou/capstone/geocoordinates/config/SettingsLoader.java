package ou.capstone.geocoordinates.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Reads {@link SettingsDefaults} from a JSON classpath resource.
 *
 * <pre>
 * {
 *   "comparison": { "absTol": 0.000001, "relTol": 1e-9 },
 *   "validation": { "base": true, "latitude": true, "longitude": true }
 * }
 * </pre>
 *
 * Missing keys keep the built-in value; unknown keys are logged and ignored.
 */
public final class SettingsLoader {
    private static final Logger logger = LoggerFactory.getLogger(SettingsLoader.class);

    public static final String RESOURCE_PATH = "/geocoordinates.json";

    private static final String FIELD_COMPARISON = "comparison";
    private static final String FIELD_ABS_TOL = "absTol";
    private static final String FIELD_REL_TOL = "relTol";
    private static final String FIELD_VALIDATION = "validation";

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Loads {@value #RESOURCE_PATH}, falling back to the built-in defaults when it is absent.
     *
     * @throws IllegalStateException if the resource exists but cannot be read or parsed
     */
    public SettingsDefaults loadDefaults() {
        return load(RESOURCE_PATH);
    }

    public SettingsDefaults load(final String resourcePath) {
        final InputStream is = SettingsLoader.class.getResourceAsStream(resourcePath);
        if (is == null) {
            logger.debug("No settings resource at {}, using built-in defaults", resourcePath);
            return SettingsDefaults.builtIn();
        }
        try (InputStream in = is) {
            final SettingsDefaults defaults = parse(mapper.readTree(in));
            logger.info("Loaded coordinate settings from {}: {}", resourcePath, defaults);
            return defaults;
        } catch (final IOException e) {
            throw new IllegalStateException("Failed to load coordinate settings: " + resourcePath, e);
        }
    }

    /**
     * Parses settings from a JSON document.
     *
     * @throws IOException if the text is not well-formed JSON
     */
    public SettingsDefaults parse(final String json) throws IOException {
        return parse(mapper.readTree(json));
    }

    private SettingsDefaults parse(final JsonNode root) {
        if (root == null || !root.isObject()) {
            logger.warn("Coordinate settings must be a JSON object, using built-in defaults");
            return SettingsDefaults.builtIn();
        }

        double absTol = Tolerance.DEFAULT_ABS_TOL;
        double relTol = Tolerance.DEFAULT_REL_TOL;
        final JsonNode comparison = root.get(FIELD_COMPARISON);
        if (comparison != null && comparison.isObject()) {
            absTol = readDouble(comparison, FIELD_ABS_TOL, absTol);
            relTol = readDouble(comparison, FIELD_REL_TOL, relTol);
        }

        final Map<CoordinateFamily, Boolean> validation = new EnumMap<>(CoordinateFamily.class);
        final JsonNode flags = root.get(FIELD_VALIDATION);
        if (flags != null && flags.isObject()) {
            final Iterator<Map.Entry<String, JsonNode>> fields = flags.fields();
            while (fields.hasNext()) {
                final Map.Entry<String, JsonNode> field = fields.next();
                final CoordinateFamily family = familyOf(field.getKey());
                if (family == null) {
                    logger.warn("Ignoring unknown validation family '{}'", field.getKey());
                } else if (!field.getValue().isBoolean()) {
                    logger.warn("Ignoring non-boolean validation flag '{}': {}", field.getKey(), field.getValue());
                } else {
                    validation.put(family, field.getValue().booleanValue());
                }
            }
        }

        return new SettingsDefaults(new Tolerance(absTol, relTol), validation);
    }

    private static double readDouble(final JsonNode parent, final String field, final double fallback) {
        final JsonNode node = parent.get(field);
        if (node == null) {
            return fallback;
        }
        if (!node.isNumber()) {
            logger.warn("Ignoring non-numeric '{}': {}", field, node);
            return fallback;
        }
        return node.doubleValue();
    }

    private static CoordinateFamily familyOf(final String key) {
        for (final CoordinateFamily family : CoordinateFamily.values()) {
            if (family.name().equals(key.toUpperCase(Locale.ROOT))) {
                return family;
            }
        }
        return null;
    }
}
