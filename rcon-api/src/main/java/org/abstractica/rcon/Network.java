package org.abstractica.rcon;

import java.io.IOException;
import java.time.Duration;

/**
 * Dials transports to RCON servers.
 *
 * <p>Implementations provide different backends for production and
 * testing scenarios.</p>
 */
public interface Network
{
    /**
     * Opens a transport to the given server.
     *
     * @param host    the server hostname or IP address
     * @param port    the server port
     * @param timeout how long to wait for the connection to be established
     * @return an open transport
     * @throws IOException if the server cannot be reached in time
     */
    Transport connect(String host, int port, Duration timeout) throws IOException;
}
