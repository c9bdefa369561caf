package org.abstractica.tictactoe.app;

import org.abstractica.tictactoe.GameServer;
import org.abstractica.tictactoe.ServerStats;
import org.abstractica.tictactoe.impl.server.DefaultGameServerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.util.Collection;

/**
 * Command line entry point for the tic-tac-toe server.
 *
 * <p>Usage: {@code TicTacToeServerApp [port]}. Once started, the operator can
 * type {@code rooms}, {@code stats} or {@code quit} on standard input.</p>
 */
public class TicTacToeServerApp
{
    private static final Logger LOG = LoggerFactory.getLogger(TicTacToeServerApp.class);

    private final GameServer server;
    private final int port;

    public TicTacToeServerApp(int port)
    {
        this.port = port;
        this.server = new DefaultGameServerFactory().builder()
                .port(port)
                .build();

        registerCallbacks();
    }

    private void registerCallbacks()
    {
        server.onGameStarted(code -> LOG.info("[{}] Both players seated", code));

        server.onGameFinished((code, outcome) ->
                LOG.info("[{}] {}", code, outcome.resultLine()));

        server.onError((code, exception) ->
                LOG.error("[{}] Game failed", code, exception));
    }

    public void start()
    {
        server.start();
        LOG.info("Tic Tac Toe server running on port {}", port);
    }

    public void stop()
    {
        server.close();
        LOG.info("Tic Tac Toe server stopped");
    }

    public void runCommandLoop()
    {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in));
        System.out.println("Server commands: rooms, stats, quit");

        try
        {
            String line;
            while ((line = reader.readLine()) != null)
            {
                String command = line.trim().toLowerCase();

                switch (command)
                {
                    case "rooms" -> listRooms();
                    case "stats" -> printStats();
                    case "quit", "exit", "q" ->
                    {
                        System.out.println("Shutting down...");
                        return;
                    }
                    case "" ->
                    {
                        // Ignore empty input
                    }
                    default -> System.out.println("Unknown command: " + command);
                }
            }
        }
        catch (IOException e)
        {
            LOG.error("Error reading console input", e);
        }
    }

    private void listRooms()
    {
        Collection<String> codes = server.getRoomCodes();
        if (codes.isEmpty())
        {
            System.out.println("No active rooms");
        }
        else
        {
            System.out.println("Active rooms:");
            for (String code : codes)
            {
                System.out.println("  " + code);
            }
        }
    }

    private void printStats()
    {
        ServerStats stats = server.getStats();
        System.out.printf("  rooms: %d, in progress: %d, completed: %d, connections: %d, rejected: %d%n",
                stats.getActiveRooms(),
                stats.getGamesInProgress(),
                stats.getGamesCompleted(),
                stats.getOpenConnections(),
                stats.getRejectedConnections());
    }

    public static void main(String[] args)
    {
        int port = DefaultGameServerFactory.DEFAULT_PORT;
        if (args.length > 0)
        {
            try
            {
                port = Integer.parseInt(args[0]);
            }
            catch (NumberFormatException e)
            {
                System.err.println("Invalid port number: " + args[0]);
                System.exit(1);
            }
        }

        TicTacToeServerApp app = new TicTacToeServerApp(port);
        app.start();

        app.runCommandLoop();

        app.stop();
    }
}
