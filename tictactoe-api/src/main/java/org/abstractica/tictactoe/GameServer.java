package org.abstractica.tictactoe;

import org.abstractica.tictactoe.handlers.ErrorHandler;
import org.abstractica.tictactoe.handlers.GameFinishedHandler;

import java.net.InetSocketAddress;
import java.util.Collection;
import java.util.function.Consumer;

/**
 * A server that pairs TCP clients into tic-tac-toe rooms.
 *
 * <p>Clients open a connection and send a single handshake,
 * {@code ROOM <code>} or {@code SPECTATE <code>}. The first two players of a
 * room play a game driven by a dedicated thread for that room; spectators
 * receive every board update and may chat.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * GameServer server = serverFactory.builder()
 *     .port(9999)
 *     .disconnectPolicy(DisconnectPolicy.FORFEIT)
 *     .build();
 *
 * server.onGameFinished((code, outcome) -> {
 *     // Record the result
 * });
 *
 * server.start();
 * }</pre>
 */
public interface GameServer extends AutoCloseable
{
    /**
     * Binds the listening socket and starts accepting connections.
     *
     * <p>This method returns immediately; the server runs on background threads.</p>
     *
     * @throws IllegalStateException        if the server was already started
     * @throws java.io.UncheckedIOException if the socket cannot be bound
     */
    void start();

    /**
     * Stops accepting new connections.
     *
     * <p>Games in progress continue until they finish.</p>
     */
    void stop();

    /**
     * Closes the server, every room and every connection.
     */
    @Override
    void close();

    /**
     * Registers a callback invoked when a room's game starts.
     *
     * @param handler called with the room code
     */
    void onGameStarted(Consumer<String> handler);

    /**
     * Registers a callback invoked after a room's game has ended and its
     * connections have been closed.
     *
     * @param handler called with the room code and the outcome
     */
    void onGameFinished(GameFinishedHandler handler);

    /**
     * Registers a handler for unexpected failures inside a room.
     *
     * @param handler called with the room code and the exception
     */
    void onError(ErrorHandler handler);

    /**
     * Returns the codes of all rooms currently known to the server.
     *
     * @return unmodifiable snapshot of room codes
     */
    Collection<String> getRoomCodes();

    /**
     * Returns the address the server is bound to.
     *
     * @return the bound address, or null if not started
     */
    InetSocketAddress getLocalAddress();

    /**
     * Returns server statistics.
     *
     * @return current statistics snapshot
     */
    ServerStats getStats();
}
