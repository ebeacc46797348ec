package org.abstractica.rcon;

/**
 * Thrown when the server rejects the supplied password.
 *
 * <p>The connection is left open. Retrying with the same password will fail
 * again; retrying with a different one needs no redial.</p>
 */
public class AuthenticationFailedException extends RconException
{
    public AuthenticationFailedException()
    {
        super("Authentication failed");
    }
}
