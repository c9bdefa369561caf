package org.abstractica.tictactoe.impl.server;

import org.abstractica.tictactoe.ServerStats;
import org.abstractica.tictactoe.impl.room.Room;
import org.abstractica.tictactoe.impl.room.RoomDirectory;
import org.abstractica.tictactoe.impl.room.RoomState;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

/**
 * Default implementation of ServerStats.
 *
 * <p>Room figures are read from the directory on demand; counters are
 * updated by the server as games finish and connections are rejected.</p>
 */
public class DefaultServerStats implements ServerStats
{
    private final RoomDirectory directory;
    private final IntSupplier openConnections;
    private final AtomicLong gamesCompleted = new AtomicLong();
    private final AtomicLong rejectedConnections = new AtomicLong();

    /**
     * Creates stats backed by the given directory.
     *
     * @param directory       the room directory
     * @param openConnections supplies the current number of open connections
     */
    public DefaultServerStats(RoomDirectory directory, IntSupplier openConnections)
    {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.openConnections = Objects.requireNonNull(openConnections, "openConnections");
    }

    void recordGameCompleted()
    {
        gamesCompleted.incrementAndGet();
    }

    void recordRejectedConnection()
    {
        rejectedConnections.incrementAndGet();
    }

    @Override
    public int getActiveRooms()
    {
        return directory.size();
    }

    @Override
    public int getGamesInProgress()
    {
        int playing = 0;
        for (Room room : directory.snapshot())
        {
            if (room.getState() == RoomState.PLAYING)
            {
                playing++;
            }
        }
        return playing;
    }

    @Override
    public long getGamesCompleted()
    {
        return gamesCompleted.get();
    }

    @Override
    public int getOpenConnections()
    {
        return openConnections.getAsInt();
    }

    @Override
    public long getRejectedConnections()
    {
        return rejectedConnections.get();
    }

    @Override
    public String toString()
    {
        return "ServerStats{rooms=" + getActiveRooms()
                + ", playing=" + getGamesInProgress()
                + ", completed=" + getGamesCompleted()
                + ", connections=" + getOpenConnections()
                + ", rejected=" + getRejectedConnections() + "}";
    }
}
