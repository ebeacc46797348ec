package org.abstractica.rcon.impl.transport;

import org.abstractica.rcon.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * Transport over a connected TCP socket.
 *
 * <p>Reads are buffered; writes go straight to the socket.</p>
 */
public class TcpTransport implements Transport
{
    private static final Logger LOG = LoggerFactory.getLogger(TcpTransport.class);

    private final Socket socket;
    private final InputStream input;
    private final OutputStream output;

    /**
     * Wraps a connected socket.
     *
     * @param socket the connected socket
     * @throws IOException if the socket streams cannot be opened
     */
    public TcpTransport(Socket socket) throws IOException
    {
        this.socket = Objects.requireNonNull(socket, "socket");
        this.input = new BufferedInputStream(socket.getInputStream());
        this.output = socket.getOutputStream();

        LOG.debug("TCP transport open {} -> {}", socket.getLocalSocketAddress(), socket.getRemoteSocketAddress());
    }

    @Override
    public InputStream getInputStream()
    {
        return input;
    }

    @Override
    public OutputStream getOutputStream()
    {
        return output;
    }

    @Override
    public void close() throws IOException
    {
        if (socket.isClosed())
        {
            return;
        }
        LOG.debug("TCP transport closing {}", socket.getRemoteSocketAddress());
        socket.close();
    }

    /**
     * Returns the address of the server end.
     *
     * @return the remote socket address
     */
    public SocketAddress getRemoteAddress()
    {
        return socket.getRemoteSocketAddress();
    }
}
