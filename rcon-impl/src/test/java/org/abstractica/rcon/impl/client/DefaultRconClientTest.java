package org.abstractica.rcon.impl.client;

import org.abstractica.rcon.AuthenticationFailedException;
import org.abstractica.rcon.NotConnectedException;
import org.abstractica.rcon.RconClient;
import org.abstractica.rcon.RconProtocolException;
import org.abstractica.rcon.impl.protocol.PacketCodec;
import org.abstractica.rcon.impl.protocol.PacketType;
import org.abstractica.rcon.impl.transport.RecordingNetwork;
import org.abstractica.rcon.impl.transport.ScriptedTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DefaultRconClient} against scripted transports.
 */
class DefaultRconClientTest
{
    private static final int AUTH_RESPONSE = 2;
    private static final int RESPONSE_VALUE = 0;

    private ScriptedTransport transport;
    private RecordingNetwork network;

    @BeforeEach
    void setUp()
    {
        transport = new ScriptedTransport();
        network = new RecordingNetwork().willReturn(transport);
    }

    // ========== Not Connected ==========

    @Test
    void command_beforeConnect_throwsWithoutIo()
    {
        RconClient client = dialingClient();

        assertThrows(NotConnectedException.class, () -> client.command("list"));

        assertTrue(network.dials().isEmpty());
        assertEquals(0, transport.streamRequests());
        assertEquals(RconClient.RESET_ID, client.getRequestId());
    }

    @Test
    void commandNoResponse_beforeConnect_throwsWithoutIo()
    {
        RconClient client = dialingClient();

        assertThrows(NotConnectedException.class, () -> client.commandNoResponse("list"));

        assertTrue(network.dials().isEmpty());
        assertEquals(0, transport.streamRequests());
    }

    @Test
    void command_afterClose_throws() throws IOException
    {
        transport.reply(1, AUTH_RESPONSE, "");
        RconClient client = dialingClient();
        client.connect("secret");
        client.close();

        assertThrows(NotConnectedException.class, () -> client.command("list"));
    }

    // ========== Connect ==========

    @Test
    void connect_dialsConfiguredServer() throws IOException
    {
        transport.reply(1, AUTH_RESPONSE, "");
        RconClient client = new DefaultRconClientFactory().builder()
                .serverAddress("mc.example.com", 25575)
                .timeout(Duration.ofSeconds(3))
                .network(network)
                .build();

        client.connect("secret");

        assertEquals(1, network.dials().size());
        RecordingNetwork.Dial dial = network.dials().get(0);
        assertEquals("mc.example.com", dial.host());
        assertEquals(25575, dial.port());
        assertEquals(Duration.ofSeconds(3), dial.timeout());
        assertTrue(client.isConnected());
        assertSame(transport, client.getTransport().orElseThrow());
    }

    @Test
    void connect_sendsAuthPacketAndConsumesId() throws IOException
    {
        transport.reply(1, AUTH_RESPONSE, "");
        RconClient client = dialingClient();

        client.connect("secret");

        assertArrayEquals(packet("secret", PacketType.AUTH, 1), transport.written());
        assertEquals(2, client.getRequestId());
        assertEquals(0, transport.unreadBytes());
    }

    @Test
    void connect_dialFailure_surfacesUnmodified()
    {
        ConnectException refused = new ConnectException("Connection refused");
        RconClient client = new DefaultRconClientFactory().builder()
                .serverAddress("testing")
                .network(new RecordingNetwork().willFail(refused))
                .build();

        ConnectException thrown = assertThrows(ConnectException.class, () -> client.connect("secret"));

        assertSame(refused, thrown);
        assertFalse(client.isConnected());
        assertEquals(RconClient.RESET_ID, client.getRequestId());
    }

    @Test
    void connect_authFailure_leavesTransportOpen() throws IOException
    {
        transport.reply(-1, AUTH_RESPONSE, "");
        RconClient client = dialingClient();

        assertThrows(AuthenticationFailedException.class, () -> client.connect("wrong"));

        assertTrue(client.isConnected());
        assertFalse(transport.isClosed());
        assertEquals(2, client.getRequestId());
    }

    @Test
    void connect_retryAfterAuthFailure_reusesTransport() throws IOException
    {
        transport.reply(-1, AUTH_RESPONSE, "").reply(2, AUTH_RESPONSE, "");
        RconClient client = dialingClient();
        assertThrows(AuthenticationFailedException.class, () -> client.connect("wrong"));

        client.connect("secret");

        assertEquals(1, network.dials().size());
        assertEquals(3, client.getRequestId());
    }

    @Test
    void connect_presuppliedTransport_neverDials() throws IOException
    {
        transport.reply(1, AUTH_RESPONSE, "");
        RconClient client = new DefaultRconClientFactory().builder()
                .serverAddress("testing")
                .transport(transport)
                .network(network)
                .build();

        assertTrue(client.isConnected());
        client.connect("secret");

        assertTrue(network.dials().isEmpty());
        assertEquals(2, client.getRequestId());
    }

    @Test
    void connect_readFailure_stillConsumesId()
    {
        // no reply scripted: the read hits end of stream
        RconClient client = dialingClient();

        assertThrows(EOFException.class, () -> client.connect("secret"));

        assertEquals(2, client.getRequestId());
        assertTrue(client.isConnected());
    }

    @Test
    void connect_nonRconPeer_failsWithProtocolError()
    {
        transport.replyRaw("HTTP/1.1 400 Bad Request\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
        RconClient client = dialingClient();

        assertThrows(RconProtocolException.class, () -> client.connect("secret"));

        assertEquals(2, client.getRequestId());
        assertTrue(client.isConnected());
    }

    // ========== Command ==========

    @Test
    void command_returnsReplyBody() throws IOException
    {
        transport.reply(1, AUTH_RESPONSE, "")
                .reply(2, RESPONSE_VALUE, "There are 0 of a max of 20 players online: ");
        RconClient client = connectedClient();

        String reply = client.command("list");

        assertEquals("There are 0 of a max of 20 players online: ", reply);
        assertEquals(3, client.getRequestId());
    }

    @Test
    void command_writesCommandPacket() throws IOException
    {
        transport.reply(1, AUTH_RESPONSE, "").reply(2, RESPONSE_VALUE, "");
        RconClient client = connectedClient();

        client.command("list");

        ByteArrayOutputStream expected = new ByteArrayOutputStream();
        expected.write(packet("secret", PacketType.AUTH, 1));
        expected.write(packet("list", PacketType.COMMAND, 2));
        assertArrayEquals(expected.toByteArray(), transport.written());
    }

    @Test
    void command_readFailure_stillConsumesId() throws IOException
    {
        transport.reply(1, AUTH_RESPONSE, "");
        RconClient client = connectedClient();

        assertThrows(EOFException.class, () -> client.command("list"));

        assertEquals(3, client.getRequestId());
    }

    @Test
    void command_writeFailure_keepsId() throws IOException
    {
        transport.reply(1, AUTH_RESPONSE, "");
        RconClient client = connectedClient();
        transport.failWrites();

        IOException e = assertThrows(IOException.class, () -> client.command("list"));

        assertEquals("Broken pipe", e.getMessage());
        assertEquals(2, client.getRequestId());
    }

    @Test
    void command_idsWrapAtCap() throws IOException
    {
        transport.reply(1, AUTH_RESPONSE, "")
                .reply(2, RESPONSE_VALUE, "a")
                .reply(1, RESPONSE_VALUE, "b");
        RconClient client = new DefaultRconClientFactory().builder()
                .serverAddress("testing")
                .requestIdCap(2)
                .transport(transport)
                .build();
        client.connect("secret");

        client.command("first");
        assertEquals(1, client.getRequestId());
        client.command("second");

        assertEquals(2, client.getRequestId());
        ByteArrayOutputStream expected = new ByteArrayOutputStream();
        expected.write(packet("secret", PacketType.AUTH, 1));
        expected.write(packet("first", PacketType.COMMAND, 2));
        expected.write(packet("second", PacketType.COMMAND, 1));
        assertArrayEquals(expected.toByteArray(), transport.written());
    }

    // ========== Command Without Response ==========

    @Test
    void commandNoResponse_writesWithoutReading() throws IOException
    {
        transport.reply(1, AUTH_RESPONSE, "").reply(2, RESPONSE_VALUE, "unread");
        RconClient client = connectedClient();
        int unreadBefore = transport.unreadBytes();

        client.commandNoResponse("save-all");

        assertEquals(unreadBefore, transport.unreadBytes());
        assertEquals(3, client.getRequestId());
    }

    @Test
    void commandNoResponse_replyIsReadByNextCommand() throws IOException
    {
        transport.reply(1, AUTH_RESPONSE, "")
                .reply(2, RESPONSE_VALUE, "Saved the game")
                .reply(3, RESPONSE_VALUE, "There are 0 players online");
        RconClient client = connectedClient();

        client.commandNoResponse("save-all");

        assertEquals("Saved the game", client.command("list"));
    }

    @Test
    void commandNoResponse_writeFailure_keepsId() throws IOException
    {
        transport.reply(1, AUTH_RESPONSE, "");
        RconClient client = connectedClient();
        transport.failWrites();

        assertThrows(IOException.class, () -> client.commandNoResponse("save-all"));

        assertEquals(2, client.getRequestId());
    }

    // ========== Close ==========

    @Test
    void close_resetsIdAndClosesTransport() throws IOException
    {
        transport.reply(1, AUTH_RESPONSE, "").reply(2, RESPONSE_VALUE, "");
        RconClient client = connectedClient();
        client.command("list");

        client.close();

        assertEquals(RconClient.RESET_ID, client.getRequestId());
        assertTrue(transport.isClosed());
        assertFalse(client.isConnected());
        assertTrue(client.getTransport().isEmpty());
    }

    @Test
    void close_whenDisconnected_isNoOp()
    {
        RconClient client = dialingClient();

        assertDoesNotThrow(client::close);
        assertDoesNotThrow(client::close);
        assertEquals(RconClient.RESET_ID, client.getRequestId());
    }

    @Test
    void close_thenConnect_dialsAgain() throws IOException
    {
        ScriptedTransport second = new ScriptedTransport().reply(1, AUTH_RESPONSE, "");
        network.willReturn(second);
        transport.reply(1, AUTH_RESPONSE, "");
        RconClient client = dialingClient();
        client.connect("secret");
        client.close();

        client.connect("secret");

        assertEquals(2, network.dials().size());
        assertSame(second, client.getTransport().orElseThrow());
        assertArrayEquals(packet("secret", PacketType.AUTH, 1), second.written());
    }

    @Test
    void close_transportFailure_stillDisconnects() throws IOException
    {
        RconClient client = new DefaultRconClientFactory().builder()
                .serverAddress("testing")
                .transport(new ScriptedTransport()
                {
                    @Override
                    public void close() throws IOException
                    {
                        throw new IOException("close failed");
                    }
                })
                .build();

        IOException e = assertThrows(IOException.class, client::close);

        assertEquals("close failed", e.getMessage());

        assertFalse(client.isConnected());
    }

    // ========== Helpers ==========

    private RconClient dialingClient()
    {
        return new DefaultRconClientFactory().builder()
                .serverAddress("testing")
                .network(network)
                .build();
    }

    private RconClient connectedClient() throws IOException
    {
        RconClient client = dialingClient();
        client.connect("secret");
        return client;
    }

    private static byte[] packet(String body, PacketType type, int requestId) throws IOException
    {
        ByteBuffer encoded = PacketCodec.encode(body, type, requestId);
        byte[] bytes = new byte[encoded.remaining()];
        encoded.get(bytes);
        return bytes;
    }
}
