package ou.capstone.geocoordinates.coordinate;

/**
 * Unsigned degrees/minutes/seconds magnitude.
 */
public record Dms(int degrees, int minutes, double seconds) {

    public boolean isZero() {
        return degrees == 0 && minutes == 0 && seconds == 0;
    }

    /** @return {@code degrees + minutes / 60 + seconds / 3600} */
    public double magnitude() {
        return degrees + minutes / 60.0 + seconds / 3600.0;
    }
}
