package org.abstractica.tictactoe;

import java.util.Objects;

/**
 * Terminal result of a room's game.
 *
 * <p>Sealed interface enabling exhaustive handling of how a game ended.</p>
 */
public sealed interface GameOutcome
{
    /**
     * Returns the human-readable line announced to the room after {@code Over}.
     *
     * @return result line
     */
    String resultLine();

    /**
     * A player completed a line.
     *
     * @param mark the winning mark, never EMPTY
     */
    record Winner(Mark mark) implements GameOutcome
    {
        public Winner
        {
            Objects.requireNonNull(mark, "mark");
            if (mark == Mark.EMPTY)
            {
                throw new IllegalArgumentException("Winner mark cannot be EMPTY");
            }
        }

        @Override
        public String resultLine()
        {
            return mark == Mark.PLAYER_ONE ? "Player One is the winner!!" : "Player Two is the winner!!";
        }
    }

    /**
     * Board filled with no winning line, or a player left under the draw policy.
     */
    record Draw() implements GameOutcome
    {
        @Override
        public String resultLine()
        {
            return "Draw game!! Try again later!";
        }
    }

    /**
     * The game could not continue.
     *
     * @param reason description of what went wrong
     */
    record Abandoned(String reason) implements GameOutcome
    {
        public Abandoned
        {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public String resultLine()
        {
            return "Game abandoned!!";
        }
    }
}
