package org.abstractica.rcon;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * A bidirectional byte stream to an RCON server.
 *
 * <p>Transport only moves bytes. It knows nothing of packet framing,
 * request IDs or authentication.</p>
 *
 * <p>A transport can be handed to the client builder directly, which is how
 * tests and custom dialers plug in.</p>
 */
public interface Transport extends Closeable
{
    /**
     * Returns the stream that receives bytes from the server.
     *
     * @return the input stream
     * @throws IOException if the stream cannot be obtained
     */
    InputStream getInputStream() throws IOException;

    /**
     * Returns the stream that sends bytes to the server.
     *
     * @return the output stream
     * @throws IOException if the stream cannot be obtained
     */
    OutputStream getOutputStream() throws IOException;

    /**
     * Closes the transport. A blocked read on another thread fails with an
     * I/O error once this returns.
     *
     * @throws IOException if closing fails
     */
    @Override
    void close() throws IOException;
}
