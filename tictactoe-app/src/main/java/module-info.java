/**
 * Tic-tac-toe server application module.
 *
 * <p>Runs the game server from the command line with an operator console.</p>
 */
module tictactoe.app
{
    requires tictactoe.api;
    requires tictactoe.impl;
    requires org.slf4j;
}
