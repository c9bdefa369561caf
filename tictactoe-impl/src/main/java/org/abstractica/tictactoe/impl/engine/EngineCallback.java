package org.abstractica.tictactoe.impl.engine;

import org.abstractica.tictactoe.GameOutcome;
import org.abstractica.tictactoe.impl.room.Room;

/**
 * Callback from a room's engine to the server.
 */
public interface EngineCallback
{
    /**
     * Called after the room has been retired and its connections closed.
     *
     * @param room    the finished room
     * @param outcome how the game ended
     */
    void onGameFinished(Room room, GameOutcome outcome);

    /**
     * Called when the engine fails unexpectedly. The room is abandoned
     * and {@link #onGameFinished} follows.
     *
     * @param room      the failing room
     * @param exception what was thrown
     */
    void onEngineError(Room room, Exception exception);
}
