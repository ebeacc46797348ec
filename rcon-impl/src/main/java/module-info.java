/**
 * RCON client library implementation module.
 *
 * <p>Provides the default implementation of the RCON client API.</p>
 */
module rcon.impl
{
    requires rcon.api;
    requires org.slf4j;

    // Export factory implementations for external use
    exports org.abstractica.rcon.impl.client;
    exports org.abstractica.rcon.impl.transport;

    // Export the codec for tools that speak the wire format directly
    exports org.abstractica.rcon.impl.protocol;
}
