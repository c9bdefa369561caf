package org.abstractica.tictactoe;

/**
 * What a room does when one of its players disconnects before the game ends.
 */
public enum DisconnectPolicy
{
    /**
     * The remaining player is declared the winner.
     */
    FORFEIT,

    /**
     * The game ends as a draw.
     */
    DRAW;

    /**
     * Returns the outcome of a game whose given player left.
     *
     * @param leaver the mark of the player who disconnected
     * @return the outcome under this policy
     */
    public GameOutcome outcomeFor(Mark leaver)
    {
        if (this == FORFEIT)
        {
            return new GameOutcome.Winner(leaver.opponent());
        }
        return new GameOutcome.Draw();
    }
}
