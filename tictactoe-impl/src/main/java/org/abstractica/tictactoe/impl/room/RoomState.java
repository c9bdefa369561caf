package org.abstractica.tictactoe.impl.room;

/**
 * Lifecycle state of a room.
 */
public enum RoomState
{
    /**
     * Fewer than two players have joined; no engine is running.
     */
    PENDING,

    /**
     * Both players joined and the room's engine is driving the game.
     */
    PLAYING,

    /**
     * Game over or reaped. The room is no longer in the directory.
     */
    FINISHED
}
