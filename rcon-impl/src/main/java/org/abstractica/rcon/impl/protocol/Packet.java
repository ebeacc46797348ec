package org.abstractica.rcon.impl.protocol;

import java.util.Objects;

/**
 * A decoded packet.
 *
 * <p>Wire format (little-endian):</p>
 * <pre>
 * [size: 4 bytes = body length + 10]
 * [requestId: 4 bytes]
 * [type: 4 bytes]
 * [body: variable]
 * [padding: 2 bytes = 0x00 0x00]
 * </pre>
 *
 * @param requestId request ID echoed by the server
 * @param type      raw packet type
 * @param body      body text without padding
 */
public record Packet(
        int requestId,
        int type,
        String body
)
{
    /**
     * Request ID the server sends back when it rejects a password.
     */
    public static final int AUTH_FAILURE_ID = -1;

    public Packet
    {
        Objects.requireNonNull(body, "body");
    }

    /**
     * Returns whether this packet reports a rejected password.
     *
     * @return true if the request ID is {@link #AUTH_FAILURE_ID}
     */
    public boolean isAuthFailure()
    {
        return requestId == AUTH_FAILURE_ID;
    }
}
