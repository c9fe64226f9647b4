package ou.capstone.geocoordinates.exceptions;

/**
 * Structural violation of a DMS tuple: non-integral degrees/minutes, negative
 * magnitude, minutes or seconds at or above 60, a negative zero, or a hemisphere
 * sign that does not agree with the magnitude.
 */
public class InvalidArgumentException extends GeoCoordinateException
{
    public InvalidArgumentException( final String msg )
    {
        super( msg );
    }
}
