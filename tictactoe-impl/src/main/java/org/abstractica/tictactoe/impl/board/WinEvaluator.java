package org.abstractica.tictactoe.impl.board;

import org.abstractica.tictactoe.Mark;

import java.util.Objects;

/**
 * Finds a completed line on a board.
 *
 * <p>Lines are checked rows first (top to bottom), then columns (left to
 * right), then the main diagonal, then the anti-diagonal. When one move
 * completes several lines the first in that order wins the tie.</p>
 */
public final class WinEvaluator
{
    private WinEvaluator()
    {
    }

    /**
     * Evaluates the board.
     *
     * @param board the board to inspect
     * @return the mark owning the first completed line, or EMPTY if none
     */
    public static Mark evaluate(Board board)
    {
        Objects.requireNonNull(board, "board");
        Mark[][] g = board.snapshot();

        for (int r = 0; r < Board.SIZE; r++)
        {
            if (sameMark(g[r][0], g[r][1], g[r][2]))
            {
                return g[r][0];
            }
        }

        for (int c = 0; c < Board.SIZE; c++)
        {
            if (sameMark(g[0][c], g[1][c], g[2][c]))
            {
                return g[0][c];
            }
        }

        if (sameMark(g[0][0], g[1][1], g[2][2]))
        {
            return g[0][0];
        }
        if (sameMark(g[0][2], g[1][1], g[2][0]))
        {
            return g[0][2];
        }
        return Mark.EMPTY;
    }

    private static boolean sameMark(Mark a, Mark b, Mark c)
    {
        return a != Mark.EMPTY && a == b && b == c;
    }
}
