package org.abstractica.tictactoe;

/**
 * Server statistics for monitoring.
 *
 * <p>Statistics are pollable snapshots. The application can query these
 * values and push to a monitoring system of choice.</p>
 */
public interface ServerStats
{
    /**
     * Returns the number of rooms in the directory, started or not.
     *
     * @return active room count
     */
    int getActiveRooms();

    /**
     * Returns the number of rooms whose game is being played.
     *
     * @return games in progress
     */
    int getGamesInProgress();

    /**
     * Returns the number of games that reached a terminal state.
     *
     * @return completed game count
     */
    long getGamesCompleted();

    /**
     * Returns the number of connections currently open.
     *
     * @return open connection count
     */
    int getOpenConnections();

    /**
     * Returns the number of connections rejected during handshake
     * (protocol error, room full or server full).
     *
     * @return rejected connection count
     */
    long getRejectedConnections();
}
