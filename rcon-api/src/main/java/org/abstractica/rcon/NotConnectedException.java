package org.abstractica.rcon;

/**
 * Thrown when an operation needs a live connection but the client has none.
 *
 * <p>Either {@link RconClient#connect(String)} was never called or
 * {@link RconClient#close()} has been called since.</p>
 */
public class NotConnectedException extends RconException
{
    public NotConnectedException()
    {
        super("Client is not connected");
    }
}
