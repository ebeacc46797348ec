package org.abstractica.rcon;

import java.time.Duration;

/**
 * Factory for creating RconClient instances.
 *
 * <p>Use the builder to configure the client before creation:</p>
 * <pre>{@code
 * RconClientFactory factory = new DefaultRconClientFactory();
 * RconClient client = factory.builder()
 *     .serverAddress("mc.example.com", 25575)
 *     .timeout(Duration.ofSeconds(5))
 *     .build();
 * }</pre>
 */
public interface RconClientFactory
{
    /**
     * Creates a new client builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating an RconClient.
     *
     * <p>Configuration is fixed once {@link #build()} returns.</p>
     */
    interface Builder
    {
        /**
         * Sets the server address, keeping the configured port.
         *
         * @param host the server hostname or IP address
         * @return this builder
         */
        Builder serverAddress(String host);

        /**
         * Sets the server address and port.
         *
         * @param host the server hostname or IP address
         * @param port the server port
         * @return this builder
         */
        Builder serverAddress(String host, int port);

        /**
         * Sets the server port.
         *
         * <p>Optional. Defaults to 61695.</p>
         *
         * @param port the server port
         * @return this builder
         */
        Builder port(int port);

        /**
         * Sets how long dialing may take.
         *
         * <p>Optional. Defaults to 10 seconds.</p>
         *
         * @param timeout the connect timeout
         * @return this builder
         */
        Builder timeout(Duration timeout);

        /**
         * Sets the highest request ID before the counter wraps back to
         * {@link RconClient#RESET_ID}.
         *
         * <p>Optional. Defaults to 100.</p>
         *
         * @param cap the request ID cap
         * @return this builder
         */
        Builder requestIdCap(int cap);

        /**
         * Supplies an already open transport.
         *
         * <p>Optional. When set, the client never dials; the connect timeout
         * is not used.</p>
         *
         * @param transport the transport to use
         * @return this builder
         */
        Builder transport(Transport transport);

        /**
         * Sets the network used to dial the server.
         *
         * <p>Optional. Defaults to plain TCP.</p>
         *
         * @param network the network to use
         * @return this builder
         */
        Builder network(Network network);

        /**
         * Builds the client.
         *
         * @return the configured client, not yet connected
         * @throws IllegalStateException if no server address was set
         */
        RconClient build();
    }
}
