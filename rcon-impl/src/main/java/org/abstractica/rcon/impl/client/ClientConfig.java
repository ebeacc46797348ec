package org.abstractica.rcon.impl.client;

import org.abstractica.rcon.RconClient;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable client settings captured when the client is built.
 *
 * @param host         server hostname or IP address
 * @param port         server port
 * @param timeout      dial timeout
 * @param requestIdCap highest request ID before wrapping
 */
public record ClientConfig(
        String host,
        int port,
        Duration timeout,
        int requestIdCap
)
{
    public static final int DEFAULT_PORT = 61695;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_REQUEST_ID_CAP = 100;

    public ClientConfig
    {
        Objects.requireNonNull(host, "host");
        checkPort(port);
        checkTimeout(timeout);
        checkRequestIdCap(requestIdCap);
    }

    // ========== Validation ==========

    static int checkPort(int port)
    {
        if (port < 1 || port > 65535)
        {
            throw new IllegalArgumentException("Port must be 1-65535: " + port);
        }
        return port;
    }

    static Duration checkTimeout(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative())
        {
            throw new IllegalArgumentException("Timeout must not be negative: " + timeout);
        }
        return timeout;
    }

    static int checkRequestIdCap(int cap)
    {
        if (cap < RconClient.RESET_ID)
        {
            throw new IllegalArgumentException(
                    "Request ID cap must be at least " + RconClient.RESET_ID + ": " + cap);
        }
        return cap;
    }
}
