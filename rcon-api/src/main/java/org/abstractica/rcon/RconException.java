package org.abstractica.rcon;

import java.io.IOException;

/**
 * Base class for failures raised by the RCON client itself.
 *
 * <p>Plain transport failures (refused connections, broken pipes, premature
 * end of stream) are not wrapped; they reach the caller as the
 * {@link IOException} the socket produced.</p>
 */
public class RconException extends IOException
{
    public RconException(String message)
    {
        super(message);
    }
}
