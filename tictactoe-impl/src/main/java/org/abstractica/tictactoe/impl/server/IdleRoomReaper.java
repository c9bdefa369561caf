package org.abstractica.tictactoe.impl.server;

import org.abstractica.tictactoe.impl.protocol.Tokens;
import org.abstractica.tictactoe.impl.room.Room;
import org.abstractica.tictactoe.impl.room.RoomDirectory;
import org.abstractica.tictactoe.impl.transport.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;

/**
 * Periodic task that retires rooms which never started a game.
 *
 * <p>A room with only spectators, or with a single player nobody joined, has
 * no engine to clean it up. Once such a room has been idle for the timeout it
 * is removed from the directory and its connections are told
 * {@code Room Expired} and closed.</p>
 */
public class IdleRoomReaper implements Runnable
{
    private static final Logger LOG = LoggerFactory.getLogger(IdleRoomReaper.class);

    private final RoomDirectory directory;
    private final Duration idleTimeout;

    public IdleRoomReaper(RoomDirectory directory, Duration idleTimeout)
    {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
    }

    @Override
    public void run()
    {
        try
        {
            reap();
        }
        catch (Exception e)
        {
            LOG.error("Error reaping idle rooms", e);
        }
    }

    /**
     * Retires idle rooms and closes their connections.
     *
     * @return number of rooms retired
     */
    public int reap()
    {
        List<Room> idle = directory.retireIdle(idleTimeout);
        for (Room room : idle)
        {
            LOG.info("[{}] Reaping idle room ({} connections)", room.getCode(), room.getAllConnections().size());
            Lock delivery = room.getDeliveryLock();
            delivery.lock();
            try
            {
                for (Connection connection : room.getAllConnections())
                {
                    connection.trySend(Tokens.ROOM_EXPIRED);
                    connection.close();
                }
            }
            finally
            {
                delivery.unlock();
            }
        }
        return idle.size();
    }
}
