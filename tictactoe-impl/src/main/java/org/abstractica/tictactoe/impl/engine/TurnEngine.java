package org.abstractica.tictactoe.impl.engine;

import org.abstractica.tictactoe.GameOutcome;
import org.abstractica.tictactoe.Mark;
import org.abstractica.tictactoe.impl.board.Board;
import org.abstractica.tictactoe.impl.board.WinEvaluator;
import org.abstractica.tictactoe.impl.protocol.ClientMessage;
import org.abstractica.tictactoe.impl.protocol.MessageCodec;
import org.abstractica.tictactoe.impl.protocol.Tokens;
import org.abstractica.tictactoe.impl.relay.Relay;
import org.abstractica.tictactoe.impl.room.Room;
import org.abstractica.tictactoe.impl.room.RoomDirectory;
import org.abstractica.tictactoe.impl.room.RoomEvent;
import org.abstractica.tictactoe.impl.transport.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * Drives one room's game from the first turn to the final result.
 *
 * <p>Runs on a dedicated thread per room and is the only writer of that
 * room's board. The player to move is fixed by ply parity. While waiting for
 * the mover, the engine multiplexes reads over every connection of the room
 * so chat from anyone is relayed immediately. Spectator additions and
 * removals reach the engine through the room's inbox.</p>
 */
public class TurnEngine implements Runnable
{
    private static final Logger LOG = LoggerFactory.getLogger(TurnEngine.class);
    public static final int MAX_PLIES = Board.SIZE * Board.SIZE;

    private final Room room;
    private final RoomDirectory directory;
    private final Relay relay;
    private final EngineSettings settings;
    private final EngineCallback callback;

    private Selector selector;
    private int ply;

    public TurnEngine(
            Room room,
            RoomDirectory directory,
            Relay relay,
            EngineSettings settings,
            EngineCallback callback
    )
    {
        this.room = Objects.requireNonNull(room, "room");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.relay = Objects.requireNonNull(relay, "relay");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.callback = Objects.requireNonNull(callback, "callback");
    }

    @Override
    public void run()
    {
        String code = room.getCode();
        LOG.info("[{}] Starting game", code);

        GameOutcome outcome;
        try
        {
            selector = Selector.open();
            room.setWakeup(selector::wakeup);

            if (!room.awaitPlayerGreetings(settings.greetingTimeout()))
            {
                LOG.warn("[{}] Role replies not confirmed within {} ms, starting anyway",
                        code, settings.greetingTimeout().toMillis());
            }

            outcome = play();
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            outcome = new GameOutcome.Abandoned("Interrupted");
        }
        catch (Exception e)
        {
            LOG.error("[{}] Engine failure", code, e);
            callback.onEngineError(room, e);
            outcome = new GameOutcome.Abandoned(String.valueOf(e.getMessage()));
        }
        finally
        {
            room.setWakeup(() -> {});
            closeSelector();
        }

        finish(outcome);
    }

    // ========== Game Loop ==========

    private GameOutcome play() throws IOException, InterruptedException
    {
        registerAll();

        ply = 0;
        while (ply < MAX_PLIES)
        {
            Mark mover = Mark.forPly(ply);
            String announcement = MessageCodec.turnAnnouncement(mover);
            LOG.info("[{}] {}", room.getCode(), announcement);
            relay.sendToAll(room, announcement);

            Optional<Connection> moverConnection = room.getPlayer(mover).filter(Connection::isOpen);
            if (moverConnection.isEmpty())
            {
                return new GameOutcome.Abandoned(mover + " is gone");
            }

            try
            {
                moverConnection.get().send(Tokens.INPUT);
            }
            catch (IOException e)
            {
                LOG.warn("[{}] Could not prompt {}: {}", room.getCode(), mover, e.getMessage());
                return new GameOutcome.Abandoned("Could not prompt " + mover);
            }

            Optional<GameOutcome> interrupted = awaitMove(mover, moverConnection.get());
            if (interrupted.isPresent())
            {
                return interrupted.get();
            }
            ply++;

            Mark winner = WinEvaluator.evaluate(room.getBoard());
            if (winner != Mark.EMPTY)
            {
                return new GameOutcome.Winner(winner);
            }
        }
        return new GameOutcome.Draw();
    }

    /**
     * Waits until the mover commits a valid move.
     *
     * @return empty once a move is committed, or the outcome if the game ended early
     */
    private Optional<GameOutcome> awaitMove(Mark mover, Connection moverConnection)
            throws IOException, InterruptedException
    {
        long pollMs = settings.pollInterval().toMillis();

        while (true)
        {
            if (Thread.interrupted())
            {
                throw new InterruptedException();
            }

            drainInbox();
            Optional<GameOutcome> lost = dropClosedConnections();
            if (lost.isPresent())
            {
                return lost;
            }
            if (selector.keys().isEmpty())
            {
                Thread.sleep(pollMs);
                continue;
            }
            selector.select(pollMs);

            Iterator<SelectionKey> it = selector.selectedKeys().iterator();
            while (it.hasNext())
            {
                SelectionKey key = it.next();
                it.remove();
                if (!key.isValid())
                {
                    continue;
                }

                Connection connection = (Connection) key.attachment();
                String text;
                try
                {
                    text = connection.receive();
                }
                catch (IOException e)
                {
                    key.cancel();
                    Optional<GameOutcome> outcome = dropConnection(connection);
                    if (outcome.isPresent())
                    {
                        return outcome;
                    }
                    continue;
                }

                if (text.isEmpty())
                {
                    continue;
                }

                ClientMessage message = MessageCodec.decode(text);
                if (message instanceof ClientMessage.Move move && connection == moverConnection)
                {
                    if (commit(mover, move))
                    {
                        return Optional.empty();
                    }
                }
                else if (message instanceof ClientMessage.Chat chat)
                {
                    relay.broadcastChat(room, connection, chat.text());
                }
                else
                {
                    LOG.trace("[{}] Ignoring '{}' from {}", room.getCode(), text, connection);
                }
            }
        }
    }

    private boolean commit(Mark mover, ClientMessage.Move move)
    {
        Board board = room.getBoard();
        if (!board.canPlace(move.row(), move.column()))
        {
            LOG.debug("[{}] Ignoring invalid move {},{} from {}",
                    room.getCode(), move.row(), move.column(), mover);
            return false;
        }

        Lock delivery = room.getDeliveryLock();
        delivery.lock();
        try
        {
            board.place(move.row(), move.column(), mover);
            LOG.info("[{}] {} played {},{}", room.getCode(), mover, move.row(), move.column());
            relay.sendPairToAll(room, Tokens.MATRIX, board.serialize());
        }
        finally
        {
            delivery.unlock();
        }
        return true;
    }

    private Optional<GameOutcome> dropConnection(Connection connection)
    {
        if (directory.removeSpectator(room, connection))
        {
            connection.close();
            return Optional.empty();
        }

        Optional<Mark> leaver = room.markOf(connection);
        connection.close();
        if (leaver.isEmpty())
        {
            return Optional.empty();
        }

        GameOutcome outcome = settings.disconnectPolicy().outcomeFor(leaver.get());
        LOG.info("[{}] {} disconnected, ending game as {}", room.getCode(), leaver.get(), outcome);
        return Optional.of(outcome);
    }

    /**
     * Handles members whose connection was closed by a failed write rather
     * than seen closing by a read.
     */
    private Optional<GameOutcome> dropClosedConnections()
    {
        for (Connection connection : room.getAudience())
        {
            if (connection.isOpen())
            {
                continue;
            }
            SelectionKey key = connection.keyFor(selector);
            if (key != null)
            {
                key.cancel();
            }
            Optional<GameOutcome> outcome = dropConnection(connection);
            if (outcome.isPresent())
            {
                return outcome;
            }
        }
        return Optional.empty();
    }

    // ========== Connection Set ==========

    private void registerAll()
    {
        for (Connection connection : room.getAudience())
        {
            register(connection);
        }
    }

    private void drainInbox()
    {
        RoomEvent event;
        while ((event = room.pollEvent()) != null)
        {
            if (event instanceof RoomEvent.SpectatorJoined joined)
            {
                register(joined.connection());
            }
            else if (event instanceof RoomEvent.SpectatorLeft left)
            {
                SelectionKey key = left.connection().keyFor(selector);
                if (key != null)
                {
                    key.cancel();
                }
            }
        }
    }

    private void register(Connection connection)
    {
        if (!connection.isOpen() || connection.keyFor(selector) != null)
        {
            return;
        }
        try
        {
            connection.register(selector);
        }
        catch (ClosedChannelException e)
        {
            LOG.debug("[{}] Not registering closed {}", room.getCode(), connection);
        }
    }

    private void closeSelector()
    {
        if (selector == null)
        {
            return;
        }
        try
        {
            selector.close();
        }
        catch (IOException e)
        {
            LOG.warn("[{}] Error closing selector", room.getCode(), e);
        }
    }

    // ========== Terminal ==========

    private void finish(GameOutcome outcome)
    {
        String code = room.getCode();
        LOG.info("[{}] Game over after {} moves: {}", code, ply, outcome);

        relay.sendToAll(room, Tokens.OVER);
        relay.sendToAll(room, outcome.resultLine());

        try
        {
            Thread.sleep(settings.drainDelay().toMillis());
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }

        directory.retire(room);
        for (Connection connection : room.getAllConnections())
        {
            connection.close();
        }
        LOG.info("[{}] Game finished. Room cleaned up.", code);

        callback.onGameFinished(room, outcome);
    }
}
