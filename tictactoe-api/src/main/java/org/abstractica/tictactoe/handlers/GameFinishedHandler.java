package org.abstractica.tictactoe.handlers;

import org.abstractica.tictactoe.GameOutcome;

/**
 * Receives the result of each finished game.
 *
 * <p>Called from the room's own thread after every connection of the room
 * has been closed and the room has left the directory.</p>
 */
@FunctionalInterface
public interface GameFinishedHandler
{
    /**
     * Handles a finished game.
     *
     * @param roomCode the room's code
     * @param outcome  how the game ended
     */
    void handle(String roomCode, GameOutcome outcome);
}
