package org.abstractica.rcon.impl.client;

import org.abstractica.rcon.RconClient;

/**
 * Request ID source for one client.
 *
 * <p>IDs run from {@link RconClient#RESET_ID} up to the cap and then start
 * over. Since only one request is ever in flight, repeating IDs cannot be
 * confused with each other.</p>
 *
 * <p>Not thread-safe.</p>
 */
public class RequestIdCounter
{
    private final int cap;
    private int current;

    /**
     * Creates a counter starting at {@link RconClient#RESET_ID}.
     *
     * @param cap the highest ID handed out
     */
    public RequestIdCounter(int cap)
    {
        this.cap = ClientConfig.checkRequestIdCap(cap);
        this.current = RconClient.RESET_ID;
    }

    /**
     * Returns the ID the next packet carries.
     *
     * @return current ID
     */
    public int current()
    {
        return current;
    }

    /**
     * Returns the highest ID handed out before wrapping.
     *
     * @return the cap
     */
    public int cap()
    {
        return cap;
    }

    /**
     * Advances to the next ID, wrapping past the cap.
     */
    public void increment()
    {
        current++;
        if (current > cap)
        {
            current = RconClient.RESET_ID;
        }
    }

    /**
     * Starts over at {@link RconClient#RESET_ID}.
     */
    public void reset()
    {
        current = RconClient.RESET_ID;
    }
}
