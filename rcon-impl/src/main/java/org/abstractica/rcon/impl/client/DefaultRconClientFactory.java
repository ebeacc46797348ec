package org.abstractica.rcon.impl.client;

import org.abstractica.rcon.Network;
import org.abstractica.rcon.RconClient;
import org.abstractica.rcon.RconClientFactory;
import org.abstractica.rcon.Transport;
import org.abstractica.rcon.impl.transport.TcpNetwork;

import java.time.Duration;
import java.util.Objects;

/**
 * Default implementation of RconClientFactory.
 */
public class DefaultRconClientFactory implements RconClientFactory
{
    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private String host;
        private int port = ClientConfig.DEFAULT_PORT;
        private Duration timeout = ClientConfig.DEFAULT_TIMEOUT;
        private int requestIdCap = ClientConfig.DEFAULT_REQUEST_ID_CAP;
        private Transport transport;
        private Network network; // Optional custom network (defaults to TcpNetwork)

        @Override
        public Builder serverAddress(String host)
        {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        @Override
        public Builder serverAddress(String host, int port)
        {
            serverAddress(host);
            return port(port);
        }

        @Override
        public Builder port(int port)
        {
            this.port = ClientConfig.checkPort(port);
            return this;
        }

        @Override
        public Builder timeout(Duration timeout)
        {
            this.timeout = ClientConfig.checkTimeout(timeout);
            return this;
        }

        @Override
        public Builder requestIdCap(int cap)
        {
            this.requestIdCap = ClientConfig.checkRequestIdCap(cap);
            return this;
        }

        @Override
        public Builder transport(Transport transport)
        {
            this.transport = Objects.requireNonNull(transport, "transport");
            return this;
        }

        /**
         * Sets the network used to dial the server.
         *
         * <p>If not set, {@link TcpNetwork} is used. Ignored when a transport
         * has been supplied.</p>
         *
         * @param network the network to use
         * @return this builder
         */
        @Override
        public Builder network(Network network)
        {
            this.network = Objects.requireNonNull(network, "network");
            return this;
        }

        @Override
        public RconClient build()
        {
            if (host == null)
            {
                throw new IllegalStateException("Server address must be specified");
            }

            ClientConfig config = new ClientConfig(host, port, timeout, requestIdCap);
            Network net = (network != null) ? network : new TcpNetwork();

            return new DefaultRconClient(config, net, transport);
        }
    }
}
