package ou.capstone.geocoordinates.exceptions;

/**
 * Base type for every validation failure raised while building a coordinate.
 * Unchecked: a rejected coordinate is a caller error, like any other bad argument.
 */
public class GeoCoordinateException extends IllegalArgumentException
{
    public GeoCoordinateException( final String msg )
    {
        super( msg );
    }
}
