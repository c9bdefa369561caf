package org.abstractica.tictactoe.handlers;

/**
 * Handles unexpected exceptions thrown while driving a room.
 *
 * <p>When a room's thread fails, the server catches the exception, logs it,
 * invokes this handler and abandons that room. Other rooms keep running;
 * one broken room should not take the server down.</p>
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Handles an exception raised inside a room.
     *
     * @param roomCode  the room where the error occurred
     * @param exception the exception thrown
     */
    void handle(String roomCode, Exception exception);
}
