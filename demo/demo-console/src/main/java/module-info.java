/**
 * Demo console module.
 *
 * <p>Interactive RCON console built on the client library.</p>
 */
module demo.console
{
    requires rcon.api;
    requires rcon.impl;
    requires org.slf4j;
}
