/**
 * RCON client library API module.
 *
 * <p>Provides the interfaces for talking to a Source RCON server over a
 * single TCP connection.</p>
 */
module rcon.api
{
    exports org.abstractica.rcon;
}
