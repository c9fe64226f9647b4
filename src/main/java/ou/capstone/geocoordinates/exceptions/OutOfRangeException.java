package ou.capstone.geocoordinates.exceptions;

/**
 * Magnitude exceeds the domain of the coordinate type (90 degrees for a latitude,
 * 180 degrees for a longitude), including the bound itself with nonzero minutes or seconds.
 */
public class OutOfRangeException extends GeoCoordinateException
{
    private final int bound;

    public OutOfRangeException( final int bound, final String msg )
    {
        super( msg );
        this.bound = bound;
    }

    /** @return the largest accepted number of degrees */
    public int getBound()
    {
        return bound;
    }
}
