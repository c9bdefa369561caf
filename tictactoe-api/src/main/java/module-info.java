/**
 * Tic-tac-toe server API module.
 *
 * <p>Provides interfaces for running a room-based tic-tac-toe server
 * with spectators and chat over plain TCP.</p>
 */
module tictactoe.api
{
    exports org.abstractica.tictactoe;
    exports org.abstractica.tictactoe.handlers;
}
