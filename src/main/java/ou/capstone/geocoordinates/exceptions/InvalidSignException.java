package ou.capstone.geocoordinates.exceptions;

import java.util.List;

/**
 * The hemisphere token is not one of the signs accepted by the coordinate type.
 */
public class InvalidSignException extends GeoCoordinateException
{
    private final String sign;
    private final List<String> permittedSigns;

    public InvalidSignException( final String sign, final List<String> permittedSigns )
    {
        this( sign, permittedSigns,
                "Only the following signs are accepted: " + permittedSigns );
    }

    public InvalidSignException( final String sign, final List<String> permittedSigns,
                                 final String msg )
    {
        super( msg );
        this.sign = sign;
        this.permittedSigns = List.copyOf( permittedSigns );
    }

    /** @return the rejected token, possibly {@code null} */
    public String getSign()
    {
        return sign;
    }

    /** @return the tokens the coordinate type accepts, in declaration order */
    public List<String> getPermittedSigns()
    {
        return permittedSigns;
    }
}
