package org.abstractica.rcon.impl.protocol;

/**
 * Types of the packets a client sends.
 *
 * <p>The protocol reuses {@code 2} for both an outgoing command and the
 * server's reply to an authentication request, so replies keep their raw
 * type value rather than being mapped onto this enum.</p>
 */
public enum PacketType
{
    COMMAND(2),
    AUTH(3);

    private final int id;

    PacketType(int id)
    {
        this.id = id;
    }

    /**
     * Returns the wire protocol identifier for this packet type.
     *
     * @return the packet type ID (int32)
     */
    public int getId()
    {
        return id;
    }
}
