/**
 * Tic-tac-toe server implementation module.
 *
 * <p>Provides the default implementation of the game server API.</p>
 */
module tictactoe.impl
{
    requires tictactoe.api;
    requires org.slf4j;

    // Export the factory implementation for external use
    exports org.abstractica.tictactoe.impl.server;

    // Export board and wire helpers for clients and tools speaking the protocol
    exports org.abstractica.tictactoe.impl.board;
    exports org.abstractica.tictactoe.impl.protocol;
}
