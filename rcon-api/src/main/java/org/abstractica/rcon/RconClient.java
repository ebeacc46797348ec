package org.abstractica.rcon;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * A client for the Source RCON remote console protocol.
 *
 * <p>The client owns one TCP connection and a request ID counter. Every
 * operation is a blocking, strictly sequential exchange: one packet out,
 * then (except for {@link #commandNoResponse}) one packet back. The client
 * does no internal locking; callers that share an instance between threads
 * must serialize access themselves.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * try (RconClient client = new DefaultRconClientFactory().builder()
 *         .serverAddress("mc.example.com", 25575)
 *         .build())
 * {
 *     client.connect("secret");
 *     String players = client.command("list");
 * }
 * }</pre>
 */
public interface RconClient extends Closeable
{
    /**
     * First request ID of a fresh or closed client.
     */
    int RESET_ID = 1;

    /**
     * Connects to the server and authenticates.
     *
     * <p>Dials the server unless a transport is already attached, in which
     * case the existing one is reused. Authentication is always sent.</p>
     *
     * @param password the RCON password
     * @throws AuthenticationFailedException if the server rejects the password;
     *                                       the connection stays open
     * @throws PacketTooLargeException       if the password cannot be framed
     * @throws IOException                   if dialing, writing or reading fails
     */
    void connect(String password) throws IOException;

    /**
     * Sends a command and waits for the server's reply.
     *
     * @param command the command text, e.g. {@code "list"}
     * @return the reply body with the padding removed
     * @throws NotConnectedException   if there is no connection
     * @throws PacketTooLargeException if the command cannot be framed
     * @throws IOException             if writing or reading fails
     */
    String command(String command) throws IOException;

    /**
     * Sends a command without reading the reply.
     *
     * <p>Failures the server only reports in its reply are not seen. If the
     * server does reply, that reply stays unread on the connection and the
     * next {@link #command} returns it instead of the reply to its own
     * request.</p>
     *
     * @param command the command text
     * @throws NotConnectedException   if there is no connection
     * @throws PacketTooLargeException if the command cannot be framed
     * @throws IOException             if writing fails
     */
    void commandNoResponse(String command) throws IOException;

    /**
     * Closes the connection and resets the request ID to {@link #RESET_ID}.
     *
     * <p>Closing a client that is not connected does nothing. A closed
     * client can be connected again.</p>
     *
     * @throws IOException if closing the transport fails
     */
    @Override
    void close() throws IOException;

    /**
     * Returns whether a transport is attached.
     *
     * @return true between a successful dial and {@link #close()}
     */
    boolean isConnected();

    /**
     * Returns the attached transport.
     *
     * @return the transport, or empty if not connected
     */
    Optional<Transport> getTransport();

    /**
     * Returns the configured server address.
     *
     * @return host name or IP address
     */
    String getAddress();

    /**
     * Returns the configured server port.
     *
     * @return the port
     */
    int getPort();

    /**
     * Returns the configured connect timeout.
     *
     * @return the dial timeout
     */
    Duration getTimeout();

    /**
     * Returns the highest request ID before the counter wraps.
     *
     * @return the request ID cap
     */
    int getRequestIdCap();

    /**
     * Returns the request ID the next packet will carry.
     *
     * @return the current request ID
     */
    int getRequestId();
}
