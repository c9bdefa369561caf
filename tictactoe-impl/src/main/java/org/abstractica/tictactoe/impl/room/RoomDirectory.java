package org.abstractica.tictactoe.impl.room;

import org.abstractica.tictactoe.impl.protocol.Handshake;
import org.abstractica.tictactoe.impl.transport.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Process-wide map from room code to room.
 *
 * <p>Every structural change (create, seat, add or remove a spectator,
 * retire) happens under one exclusive lock that is held only for the map and
 * list update itself, never across network I/O. Callers send replies after
 * the call returns.</p>
 */
public class RoomDirectory
{
    private static final Logger LOG = LoggerFactory.getLogger(RoomDirectory.class);

    private final Map<String, Room> rooms;
    private final ReentrantLock lock;
    private final LongSupplier clock;

    public RoomDirectory()
    {
        this(System::currentTimeMillis);
    }

    /**
     * Creates a directory with a custom clock, for testing idle reaping.
     *
     * @param clock supplies the current time in milliseconds
     */
    public RoomDirectory(LongSupplier clock)
    {
        this.rooms = new HashMap<>();
        this.lock = new ReentrantLock();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ========== Joining ==========

    /**
     * Seats a connection as a player in the room with the given code,
     * creating the room if it does not exist.
     *
     * @param connection the joining connection
     * @param roomCode   the requested room code, any case
     * @return which seat was taken, or {@link PlayerJoin.RoomFull}
     */
    public PlayerJoin joinAsPlayer(Connection connection, String roomCode)
    {
        Objects.requireNonNull(connection, "connection");
        String code = Handshake.normalizeCode(roomCode);

        lock.lock();
        try
        {
            long nowMs = clock.getAsLong();
            Room room = rooms.computeIfAbsent(code, c -> createRoom(c, nowMs));

            switch (room.playerCount())
            {
                case 0:
                    room.addPlayer(connection, nowMs);
                    LOG.info("[{}] Player 1 - {} (waiting for Player 2)", code, connection.getRemoteAddress());
                    return new PlayerJoin.SeatedFirst(room);
                case 1:
                    room.addPlayer(connection, nowMs);
                    room.setState(RoomState.PLAYING);
                    LOG.info("[{}] Player 2 - {} (room ready)", code, connection.getRemoteAddress());
                    return new PlayerJoin.SeatedSecond(room);
                default:
                    LOG.info("[{}] Connection refused (room full): {}", code, connection.getRemoteAddress());
                    return new PlayerJoin.RoomFull(room);
            }
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Adds a connection as a spectator of the room with the given code,
     * creating an empty room if it does not exist.
     *
     * <p>The spectator counts as a member at once but receives no broadcasts
     * until {@link #admitSpectator} is called after its board sync.</p>
     *
     * @param connection the joining connection
     * @param roomCode   the requested room code, any case
     * @return the room joined
     */
    public Room joinAsSpectator(Connection connection, String roomCode)
    {
        Objects.requireNonNull(connection, "connection");
        String code = Handshake.normalizeCode(roomCode);

        lock.lock();
        try
        {
            long nowMs = clock.getAsLong();
            Room room = rooms.computeIfAbsent(code, c -> createRoom(c, nowMs));
            room.addSpectator(connection, nowMs);
            LOG.info("[{}] Spectator {} joined ({} total)",
                    code, connection.getRemoteAddress(), room.getSpectators().size());
            return room;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Adds a synced spectator to the room's audience and hands it to the engine.
     *
     * <p>Call while holding the room's delivery lock, right after the
     * spectator's greeting and board were written.</p>
     *
     * @param room       the room
     * @param connection the spectator
     * @return false if the spectator was removed in the meantime
     */
    public boolean admitSpectator(Room room, Connection connection)
    {
        Objects.requireNonNull(room, "room");
        Objects.requireNonNull(connection, "connection");

        lock.lock();
        try
        {
            if (!room.markSynced(connection))
            {
                return false;
            }
            room.post(new RoomEvent.SpectatorJoined(connection));
            return true;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Removes a spectator from a room.
     *
     * @param room       the room
     * @param connection the spectator
     * @return true if it was a spectator of the room
     */
    public boolean removeSpectator(Room room, Connection connection)
    {
        Objects.requireNonNull(room, "room");
        Objects.requireNonNull(connection, "connection");

        lock.lock();
        try
        {
            boolean removed = room.removeSpectator(connection);
            if (removed)
            {
                room.post(new RoomEvent.SpectatorLeft(connection));
                LOG.debug("[{}] Spectator {} removed", room.getCode(), connection.getRemoteAddress());
            }
            return removed;
        }
        finally
        {
            lock.unlock();
        }
    }

    // ========== Removal ==========

    /**
     * Removes a room from the directory and marks it finished.
     *
     * <p>After this returns no new connection can join the room; a later
     * handshake with the same code creates a fresh room.</p>
     *
     * @param room the room to retire
     * @return true if the room was still in the directory
     */
    public boolean retire(Room room)
    {
        Objects.requireNonNull(room, "room");

        lock.lock();
        try
        {
            room.setState(RoomState.FINISHED);
            return rooms.remove(room.getCode(), room);
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Retires every room that never started a game and has been idle longer
     * than the given timeout.
     *
     * @param idleTimeout how long a pending room may stay idle
     * @return the retired rooms; the caller closes their connections
     */
    public List<Room> retireIdle(Duration idleTimeout)
    {
        Objects.requireNonNull(idleTimeout, "idleTimeout");

        lock.lock();
        try
        {
            long nowMs = clock.getAsLong();
            List<Room> idle = new ArrayList<>();
            Iterator<Room> it = rooms.values().iterator();
            while (it.hasNext())
            {
                Room room = it.next();
                if (room.getState() == RoomState.PENDING
                        && nowMs - room.getLastActivityMs() >= idleTimeout.toMillis())
                {
                    it.remove();
                    room.setState(RoomState.FINISHED);
                    idle.add(room);
                }
            }
            return idle;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Retires every room, for server shutdown.
     *
     * @return the retired rooms; the caller closes their connections
     */
    public List<Room> retireAll()
    {
        lock.lock();
        try
        {
            List<Room> all = new ArrayList<>(rooms.values());
            for (Room room : all)
            {
                room.setState(RoomState.FINISHED);
            }
            rooms.clear();
            return all;
        }
        finally
        {
            lock.unlock();
        }
    }

    // ========== Lookup ==========

    /**
     * Finds a room by code.
     *
     * @param roomCode the code, any case
     * @return the room, or empty if unknown
     */
    public Optional<Room> find(String roomCode)
    {
        String code = Handshake.normalizeCode(roomCode);
        lock.lock();
        try
        {
            return Optional.ofNullable(rooms.get(code));
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Returns a snapshot of all rooms.
     *
     * @return rooms in no particular order
     */
    public List<Room> snapshot()
    {
        lock.lock();
        try
        {
            return List.copyOf(rooms.values());
        }
        finally
        {
            lock.unlock();
        }
    }

    public int size()
    {
        lock.lock();
        try
        {
            return rooms.size();
        }
        finally
        {
            lock.unlock();
        }
    }

    private static Room createRoom(String code, long nowMs)
    {
        LOG.debug("[{}] Room created", code);
        return new Room(code, nowMs);
    }
}
