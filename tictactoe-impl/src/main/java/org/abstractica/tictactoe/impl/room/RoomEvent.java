package org.abstractica.tictactoe.impl.room;

import org.abstractica.tictactoe.impl.transport.Connection;

import java.util.Objects;

/**
 * Membership changes posted to a room's inbox for its engine.
 *
 * <p>The engine owns the set of connections it multiplexes; other threads
 * never touch that set directly and post one of these events instead.</p>
 */
public sealed interface RoomEvent
{
    /**
     * A spectator was added to the room.
     *
     * @param connection the new spectator
     */
    record SpectatorJoined(Connection connection) implements RoomEvent
    {
        public SpectatorJoined
        {
            Objects.requireNonNull(connection, "connection");
        }
    }

    /**
     * A spectator was removed from the room.
     *
     * @param connection the removed spectator
     */
    record SpectatorLeft(Connection connection) implements RoomEvent
    {
        public SpectatorLeft
        {
            Objects.requireNonNull(connection, "connection");
        }
    }
}
