package org.abstractica.rcon.demo.console;

import org.abstractica.rcon.AuthenticationFailedException;
import org.abstractica.rcon.RconClient;
import org.abstractica.rcon.impl.client.ClientConfig;
import org.abstractica.rcon.impl.client.DefaultRconClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Interactive remote console.
 *
 * <p>Connects to a server, authenticates, then sends every line typed on
 * standard input as a command and prints the reply. A line starting with
 * {@code !} is sent without waiting for a reply.</p>
 */
public class RconConsole
{
    private static final Logger LOG = LoggerFactory.getLogger(RconConsole.class);
    private static final String DEFAULT_HOST = "localhost";
    private static final String PASSWORD_ENV = "RCON_PASSWORD";
    private static final String FIRE_AND_FORGET_PREFIX = "!";

    private final RconClient client;
    private final PrintStream out;

    public RconConsole(RconClient client, PrintStream out)
    {
        this.client = client;
        this.out = out;
    }

    /**
     * Connects and authenticates.
     *
     * @param password the RCON password
     * @return true if the server accepted the password
     * @throws IOException if the server cannot be reached
     */
    public boolean connect(String password) throws IOException
    {
        out.printf("Connecting to %s:%d...%n", client.getAddress(), client.getPort());
        try
        {
            client.connect(password);
        }
        catch (AuthenticationFailedException e)
        {
            out.println("Authentication failed: wrong password");
            return false;
        }
        out.println("Authenticated. Type 'quit' to exit.");
        return true;
    }

    /**
     * Reads commands until end of input or a quit command.
     *
     * @param reader the command source
     * @throws IOException if the connection fails
     */
    public void runCommandLoop(BufferedReader reader) throws IOException
    {
        String line;
        while ((line = reader.readLine()) != null)
        {
            String command = line.trim();

            switch (command)
            {
                case "quit", "exit", "q" ->
                {
                    out.println("Disconnecting...");
                    return;
                }
                case "" ->
                {
                    // Ignore empty input
                }
                default -> execute(command);
            }
        }
    }

    private void execute(String command) throws IOException
    {
        if (command.startsWith(FIRE_AND_FORGET_PREFIX))
        {
            String body = command.substring(FIRE_AND_FORGET_PREFIX.length()).trim();
            client.commandNoResponse(body);
            out.println("Sent (no reply requested)");
            return;
        }

        String reply = client.command(command);
        out.println(reply.isEmpty() ? "(empty reply)" : reply);
    }

    public void disconnect() throws IOException
    {
        client.close();
    }

    public static void main(String[] args)
    {
        String host = DEFAULT_HOST;
        int port = ClientConfig.DEFAULT_PORT;
        Duration timeout = ClientConfig.DEFAULT_TIMEOUT;
        String password = System.getenv(PASSWORD_ENV);

        // Parse arguments
        for (int i = 0; i < args.length; i++)
        {
            switch (args[i])
            {
                case "-h", "--host" ->
                {
                    if (i + 1 < args.length)
                    {
                        host = args[++i];
                    }
                }
                case "-p", "--port" ->
                {
                    if (i + 1 < args.length)
                    {
                        port = parseNumber(args[++i], "port");
                    }
                }
                case "-t", "--timeout" ->
                {
                    if (i + 1 < args.length)
                    {
                        timeout = Duration.ofSeconds(parseNumber(args[++i], "timeout"));
                    }
                }
                case "-P", "--password" ->
                {
                    if (i + 1 < args.length)
                    {
                        password = args[++i];
                    }
                }
                case "--help" ->
                {
                    printUsage(System.out);
                    System.exit(0);
                }
                default ->
                {
                    System.err.println("Unknown option: " + args[i]);
                    printUsage(System.err);
                    System.exit(1);
                }
            }
        }

        if (password == null)
        {
            System.err.println("No password given. Use -P <password> or set " + PASSWORD_ENV + ".");
            System.exit(1);
        }

        RconClient client;
        try
        {
            client = new DefaultRconClientFactory().builder()
                    .serverAddress(host, port)
                    .timeout(timeout)
                    .build();
        }
        catch (IllegalArgumentException e)
        {
            System.err.println(e.getMessage());
            System.exit(1);
            return;
        }

        RconConsole console = new RconConsole(client, System.out);
        int exitCode = 0;
        try
        {
            if (console.connect(password))
            {
                BufferedReader reader = new BufferedReader(
                        new InputStreamReader(System.in, StandardCharsets.UTF_8));
                console.runCommandLoop(reader);
            }
            else
            {
                exitCode = 1;
            }
        }
        catch (IOException e)
        {
            LOG.error("Connection to {}:{} failed", host, port, e);
            System.err.println("Connection failed: " + e.getMessage());
            exitCode = 1;
        }
        finally
        {
            try
            {
                console.disconnect();
            }
            catch (IOException e)
            {
                LOG.warn("Error closing connection", e);
            }
        }
        System.exit(exitCode);
    }

    private static int parseNumber(String value, String name)
    {
        try
        {
            return Integer.parseInt(value);
        }
        catch (NumberFormatException e)
        {
            System.err.println("Invalid " + name + ": " + value);
            System.exit(1);
            return 0;
        }
    }

    static void printUsage(PrintStream out)
    {
        out.println("Usage: demo-console [options]");
        out.println("Options:");
        out.println("  -h, --host <host>        Server host (default: " + DEFAULT_HOST + ")");
        out.println("  -p, --port <port>        Server port (default: " + ClientConfig.DEFAULT_PORT + ")");
        out.println("  -P, --password <secret>  RCON password (default: $" + PASSWORD_ENV + ")");
        out.println("  -t, --timeout <seconds>  Connect timeout (default: "
                + ClientConfig.DEFAULT_TIMEOUT.toSeconds() + ")");
        out.println("  --help                   Show this help");
        out.println("Prefix a command with '!' to send it without waiting for the reply.");
    }
}
