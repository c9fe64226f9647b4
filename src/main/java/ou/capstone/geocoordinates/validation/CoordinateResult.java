package ou.capstone.geocoordinates.validation;

import java.util.Optional;

import ou.capstone.geocoordinates.exceptions.GeoCoordinateException;

/**
 * Outcome of a fallible coordinate factory: either the coordinate or the reason it was rejected.
 */
public final class CoordinateResult<T> {
    private final T value;
    private final GeoCoordinateException error;

    private CoordinateResult(T value, GeoCoordinateException error) {
        this.value = value;
        this.error = error;
    }

    public static <T> CoordinateResult<T> success(T value) {
        return new CoordinateResult<>(value, null);
    }

    public static <T> CoordinateResult<T> failure(GeoCoordinateException error) {
        return new CoordinateResult<>(null, error);
    }

    public boolean isOk() {
        return error == null;
    }

    public String message() {
        return isOk() ? "OK" : error.getMessage();
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public Optional<GeoCoordinateException> error() {
        return Optional.ofNullable(error);
    }

    /**
     * @return the coordinate
     * @throws GeoCoordinateException the rejection, if the factory failed
     */
    public T orElseThrow() {
        if (error != null) {
            throw error;
        }
        return value;
    }

    @Override
    public String toString() {
        return isOk() ? "CoordinateResult{ok, " + value + "}" : "CoordinateResult{error, " + message() + "}";
    }
}
