package org.abstractica.tictactoe.impl.server;

import org.abstractica.tictactoe.impl.protocol.Handshake;
import org.abstractica.tictactoe.impl.protocol.MessageCodec;
import org.abstractica.tictactoe.impl.protocol.Tokens;
import org.abstractica.tictactoe.impl.relay.Relay;
import org.abstractica.tictactoe.impl.room.PlayerJoin;
import org.abstractica.tictactoe.impl.room.Room;
import org.abstractica.tictactoe.impl.room.RoomDirectory;
import org.abstractica.tictactoe.impl.transport.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.function.Consumer;

/**
 * Handles the handshake of a newly accepted connection.
 *
 * <p>Reads exactly one message, {@code ROOM <code>} or {@code SPECTATE <code>},
 * and routes the connection into the directory. Malformed handshakes are
 * answered with {@code Protocol Error} and closed without retry.</p>
 *
 * <p>A spectator's greeting, {@code Matrix} and board are written under the
 * room's delivery lock before it joins the audience.</p>
 */
public class ConnectionIntake
{
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionIntake.class);

    private final RoomDirectory directory;
    private final Relay relay;
    private final Duration handshakeTimeout;
    private final Consumer<Room> gameStarter;
    private final Runnable rejectionRecorder;

    /**
     * Creates an intake.
     *
     * @param directory         the room directory
     * @param relay             used to send the spectator greeting and board sync
     * @param handshakeTimeout  how long to wait for the handshake line
     * @param gameStarter       starts the engine of a room whose second player joined
     * @param rejectionRecorder counts rejected connections
     */
    public ConnectionIntake(
            RoomDirectory directory,
            Relay relay,
            Duration handshakeTimeout,
            Consumer<Room> gameStarter,
            Runnable rejectionRecorder
    )
    {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.relay = Objects.requireNonNull(relay, "relay");
        this.handshakeTimeout = Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
        this.gameStarter = Objects.requireNonNull(gameStarter, "gameStarter");
        this.rejectionRecorder = Objects.requireNonNull(rejectionRecorder, "rejectionRecorder");
    }

    /**
     * Performs the handshake and joins the connection to its room.
     *
     * @param connection a freshly accepted connection
     */
    public void handle(Connection connection)
    {
        String text;
        try
        {
            text = connection.receive(handshakeTimeout);
        }
        catch (IOException e)
        {
            LOG.info("Handshake error from {}: {}", connection.getRemoteAddress(), e.getMessage());
            reject(connection, Tokens.PROTOCOL_ERROR);
            return;
        }

        Optional<Handshake> handshake = MessageCodec.decodeHandshake(text);
        if (handshake.isEmpty())
        {
            LOG.info("Malformed handshake from {}: '{}'", connection.getRemoteAddress(), text.strip());
            reject(connection, Tokens.PROTOCOL_ERROR);
            return;
        }

        switch (handshake.get().verb())
        {
            case ROOM -> joinAsPlayer(connection, handshake.get().roomCode());
            case SPECTATE -> joinAsSpectator(connection, handshake.get().roomCode());
        }
    }

    private void joinAsPlayer(Connection connection, String code)
    {
        PlayerJoin join = directory.joinAsPlayer(connection, code);

        if (join instanceof PlayerJoin.SeatedFirst first)
        {
            greetPlayer(first.room(), connection, Tokens.YOU_ARE_PLAYER_ONE);
        }
        else if (join instanceof PlayerJoin.SeatedSecond second)
        {
            greetPlayer(second.room(), connection, Tokens.YOU_ARE_PLAYER_TWO);
            gameStarter.accept(second.room());
        }
        else
        {
            reject(connection, Tokens.ROOM_FULL);
        }
    }

    private void greetPlayer(Room room, Connection connection, String greeting)
    {
        if (!connection.trySend(greeting))
        {
            LOG.warn("[{}] Could not send role to {}", room.getCode(), connection.getRemoteAddress());
        }
        room.playerGreeted();
    }

    private void joinAsSpectator(Connection connection, String code)
    {
        Room room = directory.joinAsSpectator(connection, code);

        Lock delivery = room.getDeliveryLock();
        delivery.lock();
        try
        {
            relay.sendInOrder(connection,
                    Tokens.YOU_ARE_SPECTATOR,
                    Tokens.MATRIX,
                    room.getBoard().serialize());
            if (!directory.admitSpectator(room, connection))
            {
                LOG.debug("[{}] Spectator {} left during sync", room.getCode(), connection.getRemoteAddress());
            }
        }
        catch (IOException e)
        {
            LOG.info("[{}] Dropping spectator {}: {}", room.getCode(), connection.getRemoteAddress(), e.getMessage());
            directory.removeSpectator(room, connection);
            connection.close();
        }
        finally
        {
            delivery.unlock();
        }
    }

    private void reject(Connection connection, String reason)
    {
        rejectionRecorder.run();
        connection.trySend(reason);
        connection.close();
    }
}
