package org.abstractica.rcon.impl.protocol;

import org.abstractica.rcon.PacketTooLargeException;
import org.abstractica.rcon.RconProtocolException;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Encodes and decodes RCON packets.
 *
 * <p>All integers are little-endian. The codec never touches a socket:
 * encoding is pure, decoding reads from whatever stream it is given.</p>
 */
public final class PacketCodec
{
    /**
     * Bytes counted by the size field besides the body: request ID and type.
     */
    public static final int HEADER_REMAINDER = 8;

    /**
     * Zero bytes terminating every body.
     */
    public static final int PADDING_LENGTH = 2;

    /**
     * Smallest legal size field: an empty body.
     */
    public static final int MIN_SIZE = HEADER_REMAINDER + PADDING_LENGTH;

    /**
     * Largest body a server sends in one packet.
     */
    public static final int MAX_RESPONSE_BODY = 4096;

    /**
     * Largest size field accepted when decoding.
     */
    public static final int MAX_SIZE = MAX_RESPONSE_BODY + MIN_SIZE;

    private static final byte[] PADDING = new byte[PADDING_LENGTH];

    private PacketCodec() {}

    // ========== Encoding ==========

    /**
     * Encodes a packet.
     *
     * @param body      the body bytes, without terminator
     * @param type      the packet type
     * @param requestId the request ID to send
     * @return encoded bytes, ready to write
     * @throws PacketTooLargeException if the body overflows the size field
     */
    public static ByteBuffer encode(byte[] body, PacketType type, int requestId) throws PacketTooLargeException
    {
        Objects.requireNonNull(type, "type");
        return encode(body, type.getId(), requestId);
    }

    /**
     * Encodes a packet with a raw type value.
     *
     * @param body      the body bytes, without terminator
     * @param type      the raw packet type
     * @param requestId the request ID to send
     * @return encoded bytes, ready to write
     * @throws PacketTooLargeException if the body overflows the size field
     */
    public static ByteBuffer encode(byte[] body, int type, int requestId) throws PacketTooLargeException
    {
        Objects.requireNonNull(body, "body");
        int size = sizeFor(body.length);

        ByteBuffer buffer = ByteBuffer.allocate(Integer.BYTES + size).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(size);
        buffer.putInt(requestId);
        buffer.putInt(type);
        buffer.put(body);
        buffer.put(PADDING);
        return buffer.flip();
    }

    /**
     * Encodes a packet whose body is text.
     *
     * @param body      the body text
     * @param type      the packet type
     * @param requestId the request ID to send
     * @return encoded bytes, ready to write
     * @throws PacketTooLargeException if the body overflows the size field
     */
    public static ByteBuffer encode(String body, PacketType type, int requestId) throws PacketTooLargeException
    {
        Objects.requireNonNull(body, "body");
        return encode(body.getBytes(StandardCharsets.UTF_8), type, requestId);
    }

    /**
     * Computes the size field for a body length.
     *
     * <p>Both the size field and the whole frame (size field included) must
     * fit in a signed 32-bit integer.</p>
     *
     * @param bodyLength body length in bytes
     * @return the size field value
     * @throws PacketTooLargeException if either value overflows
     */
    static int sizeFor(long bodyLength) throws PacketTooLargeException
    {
        if (bodyLength < 0 || bodyLength > Integer.MAX_VALUE)
        {
            throw new PacketTooLargeException(bodyLength);
        }
        long size = bodyLength + MIN_SIZE;
        if (size + Integer.BYTES > Integer.MAX_VALUE)
        {
            throw new PacketTooLargeException(bodyLength);
        }
        return (int) size;
    }

    // ========== Decoding ==========

    /**
     * Decodes a packet header.
     *
     * @param header exactly {@link PacketHeader#BYTES} bytes
     * @return decoded header
     */
    public static PacketHeader decodeHeader(byte[] header)
    {
        Objects.requireNonNull(header, "header");
        if (header.length != PacketHeader.BYTES)
        {
            throw new IllegalArgumentException(
                    "Header must be " + PacketHeader.BYTES + " bytes, got: " + header.length);
        }

        ByteBuffer buffer = ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN);
        int size = buffer.getInt();
        int requestId = buffer.getInt();
        int type = buffer.getInt();

        return new PacketHeader(size, requestId, type);
    }

    /**
     * Reads one complete packet from a stream.
     *
     * <p>Blocks until the header and the whole payload have arrived. The
     * stream is not closed.</p>
     *
     * @param in the stream to read from
     * @return decoded packet
     * @throws RconProtocolException if the size field is outside
     *                               {@link #MIN_SIZE}..{@link #MAX_SIZE}
     * @throws java.io.EOFException  if the stream ends mid-packet
     * @throws IOException           if reading fails
     */
    public static Packet decode(InputStream in) throws IOException
    {
        DataInputStream data = new DataInputStream(Objects.requireNonNull(in, "in"));

        byte[] headerBytes = new byte[PacketHeader.BYTES];
        data.readFully(headerBytes);

        return decode(decodeHeader(headerBytes), data);
    }

    /**
     * Reads the payload that follows an already decoded header.
     *
     * @param header the decoded header
     * @param in     the stream positioned at the start of the body
     * @return decoded packet
     * @throws RconProtocolException if the size field is outside
     *                               {@link #MIN_SIZE}..{@link #MAX_SIZE}
     * @throws java.io.EOFException  if the stream ends mid-packet
     * @throws IOException           if reading fails
     */
    public static Packet decode(PacketHeader header, InputStream in) throws IOException
    {
        Objects.requireNonNull(header, "header");
        if (header.size() < MIN_SIZE)
        {
            throw new RconProtocolException(
                    "Packet size " + header.size() + " is below the minimum of " + MIN_SIZE);
        }
        // checked before the payload buffer is allocated
        if (header.size() > MAX_SIZE)
        {
            throw new RconProtocolException(
                    "Packet size " + header.size() + " exceeds the maximum of " + MAX_SIZE);
        }

        byte[] payload = new byte[header.payloadLength()];
        new DataInputStream(Objects.requireNonNull(in, "in")).readFully(payload);

        String body = new String(payload, 0, payload.length - PADDING_LENGTH, StandardCharsets.UTF_8);
        return new Packet(header.requestId(), header.type(), body);
    }
}
