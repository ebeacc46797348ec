package org.abstractica.rcon.impl.client;

import org.abstractica.rcon.AuthenticationFailedException;
import org.abstractica.rcon.Network;
import org.abstractica.rcon.NotConnectedException;
import org.abstractica.rcon.RconClient;
import org.abstractica.rcon.Transport;
import org.abstractica.rcon.impl.protocol.Packet;
import org.abstractica.rcon.impl.protocol.PacketCodec;
import org.abstractica.rcon.impl.protocol.PacketType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Default implementation of the RconClient interface.
 *
 * <p>Owns the transport and the request ID counter. All framing is left to
 * {@link PacketCodec}; this class only decides what to send and when.</p>
 *
 * <p>A request ID is consumed as soon as its packet has been written, even if
 * reading the reply fails afterwards.</p>
 */
public class DefaultRconClient implements RconClient
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultRconClient.class);

    private final ClientConfig config;
    private final Network network;
    private final RequestIdCounter requestIds;

    // null while disconnected
    private Transport transport;

    /**
     * Creates a new client.
     *
     * @param config    client settings
     * @param network   used to dial when no transport is attached
     * @param transport pre-supplied transport, or null to dial on connect
     */
    DefaultRconClient(ClientConfig config, Network network, Transport transport)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.network = Objects.requireNonNull(network, "network");
        this.requestIds = new RequestIdCounter(config.requestIdCap());
        this.transport = transport;
    }

    // ========== RconClient Interface ==========

    @Override
    public void connect(String password) throws IOException
    {
        Objects.requireNonNull(password, "password");

        if (transport == null)
        {
            LOG.info("Connecting to {}:{}", config.host(), config.port());
            transport = network.connect(config.host(), config.port(), config.timeout());
        }
        else
        {
            LOG.debug("Reusing attached transport for {}:{}", config.host(), config.port());
        }

        authenticate(password);
    }

    @Override
    public String command(String command) throws IOException
    {
        Objects.requireNonNull(command, "command");
        requireConnected();

        return exchange(PacketType.COMMAND, command).body();
    }

    @Override
    public void commandNoResponse(String command) throws IOException
    {
        Objects.requireNonNull(command, "command");
        requireConnected();

        send(PacketType.COMMAND, command);
    }

    @Override
    public void close() throws IOException
    {
        requestIds.reset();

        if (transport == null)
        {
            return;
        }

        LOG.info("Closing connection to {}:{}", config.host(), config.port());
        Transport closing = transport;
        transport = null;
        closing.close();
    }

    @Override
    public boolean isConnected()
    {
        return transport != null;
    }

    @Override
    public Optional<Transport> getTransport()
    {
        return Optional.ofNullable(transport);
    }

    @Override
    public String getAddress()
    {
        return config.host();
    }

    @Override
    public int getPort()
    {
        return config.port();
    }

    @Override
    public Duration getTimeout()
    {
        return config.timeout();
    }

    @Override
    public int getRequestIdCap()
    {
        return requestIds.cap();
    }

    @Override
    public int getRequestId()
    {
        return requestIds.current();
    }

    // ========== Authentication ==========

    private void authenticate(String password) throws IOException
    {
        Packet reply = exchange(PacketType.AUTH, password);

        if (reply.isAuthFailure())
        {
            LOG.warn("Authentication rejected by {}:{}", config.host(), config.port());
            throw new AuthenticationFailedException();
        }

        LOG.info("Authenticated with {}:{}", config.host(), config.port());
    }

    // ========== Packet Exchange ==========

    private void requireConnected() throws NotConnectedException
    {
        if (transport == null)
        {
            throw new NotConnectedException();
        }
    }

    /**
     * Sends one packet and reads one reply.
     */
    private Packet exchange(PacketType type, String body) throws IOException
    {
        send(type, body);

        Packet reply = PacketCodec.decode(transport.getInputStream());
        LOG.debug("Received packet id={} type={} ({} chars)",
                reply.requestId(), reply.type(), reply.body().length());
        return reply;
    }

    private void send(PacketType type, String body) throws IOException
    {
        int requestId = requestIds.current();
        ByteBuffer packet = PacketCodec.encode(body, type, requestId);

        OutputStream out = transport.getOutputStream();
        out.write(packet.array(), packet.arrayOffset() + packet.position(), packet.remaining());
        out.flush();

        LOG.debug("Sent {} packet id={} ({} bytes)", type, requestId, packet.remaining());
        requestIds.increment();
    }
}
