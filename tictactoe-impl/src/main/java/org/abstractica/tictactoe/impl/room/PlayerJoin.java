package org.abstractica.tictactoe.impl.room;

import java.util.Objects;

/**
 * Result of asking the directory to seat a player.
 *
 * <p>Sealed interface enabling exhaustive handling of every reachable case.</p>
 */
public sealed interface PlayerJoin
{
    /**
     * The room the connection asked for.
     *
     * @return the room
     */
    Room room();

    /**
     * Seated as player one; the room waits for a second player.
     *
     * @param room the room
     */
    record SeatedFirst(Room room) implements PlayerJoin
    {
        public SeatedFirst
        {
            Objects.requireNonNull(room, "room");
        }
    }

    /**
     * Seated as player two. The caller must start the room's engine; this
     * result is produced exactly once per room.
     *
     * @param room the room, already in {@link RoomState#PLAYING}
     */
    record SeatedSecond(Room room) implements PlayerJoin
    {
        public SeatedSecond
        {
            Objects.requireNonNull(room, "room");
        }
    }

    /**
     * Both seats were taken. Nothing was changed.
     *
     * @param room the full room
     */
    record RoomFull(Room room) implements PlayerJoin
    {
        public RoomFull
        {
            Objects.requireNonNull(room, "room");
        }
    }
}
