package org.abstractica.rcon.impl.protocol;

/**
 * Fixed twelve byte prefix of every packet.
 *
 * <p>Wire format (little-endian):</p>
 * <pre>
 * [size: 4 bytes]       byte count of everything after this field
 * [requestId: 4 bytes]
 * [type: 4 bytes]
 * </pre>
 *
 * @param size      packet size, excluding the size field itself
 * @param requestId echoed request ID, or -1 on authentication failure
 * @param type      raw packet type
 */
public record PacketHeader(
        int size,
        int requestId,
        int type
)
{
    /**
     * Encoded length of a header.
     */
    public static final int BYTES = 12;

    /**
     * Returns the number of bytes that follow the header on the wire.
     *
     * @return body plus padding length
     */
    public int payloadLength()
    {
        return size - 8;
    }
}
