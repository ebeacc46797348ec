package org.abstractica.rcon;

/**
 * Thrown when a packet body is too large for the 32-bit length field.
 *
 * <p>Always raised while building the packet, before any byte reaches the
 * connection.</p>
 */
public class PacketTooLargeException extends RconException
{
    private final long bodyLength;

    public PacketTooLargeException(long bodyLength)
    {
        super("Packet body of " + bodyLength + " bytes overflows the 32-bit length field");
        this.bodyLength = bodyLength;
    }

    /**
     * Returns the length of the rejected body.
     *
     * @return body length in bytes
     */
    public long getBodyLength()
    {
        return bodyLength;
    }
}
