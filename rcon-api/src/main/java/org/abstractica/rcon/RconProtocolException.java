package org.abstractica.rcon;

/**
 * Thrown when the server sends a frame that does not follow the wire format.
 */
public class RconProtocolException extends RconException
{
    public RconProtocolException(String message)
    {
        super(message);
    }
}
