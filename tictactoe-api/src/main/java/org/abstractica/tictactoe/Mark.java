package org.abstractica.tictactoe;

/**
 * Content of a board cell.
 *
 * <p>The numeric value is what appears in serialized board snapshots.</p>
 */
public enum Mark
{
    EMPTY(0),
    PLAYER_ONE(1),
    PLAYER_TWO(2);

    private final int wireValue;

    Mark(int wireValue)
    {
        this.wireValue = wireValue;
    }

    public int wireValue()
    {
        return wireValue;
    }

    /**
     * Returns the mark placed by the player moving at the given ply.
     *
     * @param ply zero-based ply number
     * @return PLAYER_ONE for even plies, PLAYER_TWO for odd plies
     */
    public static Mark forPly(int ply)
    {
        if (ply < 0)
        {
            throw new IllegalArgumentException("ply must be >= 0: " + ply);
        }
        return ply % 2 == 0 ? PLAYER_ONE : PLAYER_TWO;
    }

    /**
     * Returns the other player's mark.
     *
     * @return PLAYER_TWO for PLAYER_ONE and vice versa
     * @throws IllegalStateException if called on EMPTY
     */
    public Mark opponent()
    {
        return switch (this)
        {
            case PLAYER_ONE -> PLAYER_TWO;
            case PLAYER_TWO -> PLAYER_ONE;
            case EMPTY -> throw new IllegalStateException("EMPTY has no opponent");
        };
    }
}
