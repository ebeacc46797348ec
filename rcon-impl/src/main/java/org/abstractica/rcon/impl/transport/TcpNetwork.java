package org.abstractica.rcon.impl.transport;

import org.abstractica.rcon.Network;
import org.abstractica.rcon.Transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;

/**
 * Dials real TCP connections.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * Network network = new TcpNetwork();
 * Transport transport = network.connect("127.0.0.1", 25575, Duration.ofSeconds(5));
 * }</pre>
 */
public class TcpNetwork implements Network
{
    private static final Duration MAX_CONNECT_TIMEOUT = Duration.ofMillis(Integer.MAX_VALUE);

    /**
     * Creates a new TCP network.
     */
    public TcpNetwork()
    {
    }

    @Override
    public Transport connect(String host, int port, Duration timeout) throws IOException
    {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(timeout, "timeout");

        Socket socket = new Socket();
        try
        {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(host, port), toConnectTimeout(timeout));
        }
        catch (IOException e)
        {
            socket.close();
            throw e;
        }
        return new TcpTransport(socket);
    }

    /**
     * Converts a duration to the millisecond timeout {@link Socket#connect} takes,
     * where zero means wait forever.
     */
    static int toConnectTimeout(Duration timeout)
    {
        if (timeout.isZero())
        {
            return 0;
        }
        if (timeout.compareTo(MAX_CONNECT_TIMEOUT) > 0)
        {
            return Integer.MAX_VALUE;
        }
        return (int) Math.max(1, timeout.toMillis());
    }
}
