package ou.capstone.geocoordinates.config;

/**
 * Groups of coordinate types whose validation can be switched on and off independently.
 */
public enum CoordinateFamily {
    /** Structural DMS rules shared by every coordinate type. */
    BASE,
    /** Bound and hemisphere rules of latitudes. */
    LATITUDE,
    /** Bound and hemisphere rules of longitudes. */
    LONGITUDE
}
