package org.abstractica.tictactoe.impl.board;

import org.abstractica.tictactoe.Mark;
import org.junit.jupiter.api.Test;

import static org.abstractica.tictactoe.Mark.EMPTY;
import static org.abstractica.tictactoe.Mark.PLAYER_ONE;
import static org.abstractica.tictactoe.Mark.PLAYER_TWO;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WinEvaluator}.
 */
class WinEvaluatorTest
{
    private static final Mark X = PLAYER_ONE;
    private static final Mark O = PLAYER_TWO;
    private static final Mark E = EMPTY;

    // ========== No Winner ==========

    @Test
    void emptyBoard_noWinner()
    {
        assertEquals(EMPTY, WinEvaluator.evaluate(new Board()));
    }

    @Test
    void fullBoardWithoutLine_noWinner()
    {
        Board board = Board.of(
                row(X, O, X),
                row(X, O, O),
                row(O, X, X));

        assertTrue(board.isFull());
        assertEquals(EMPTY, WinEvaluator.evaluate(board));
    }

    @Test
    void twoInARow_noWinner()
    {
        Board board = Board.of(
                row(X, X, E),
                row(O, O, E),
                row(E, E, E));

        assertEquals(EMPTY, WinEvaluator.evaluate(board));
    }

    // ========== Lines ==========

    @Test
    void eachRow_isDetected()
    {
        for (int r = 0; r < Board.SIZE; r++)
        {
            Board board = new Board();
            for (int c = 0; c < Board.SIZE; c++)
            {
                board.place(r, c, O);
            }
            assertEquals(O, WinEvaluator.evaluate(board), "row " + r);
        }
    }

    @Test
    void eachColumn_isDetected()
    {
        for (int c = 0; c < Board.SIZE; c++)
        {
            Board board = new Board();
            for (int r = 0; r < Board.SIZE; r++)
            {
                board.place(r, c, X);
            }
            assertEquals(X, WinEvaluator.evaluate(board), "column " + c);
        }
    }

    @Test
    void mainDiagonal_isDetected()
    {
        Board board = Board.of(
                row(O, X, X),
                row(E, O, E),
                row(X, E, O));

        assertEquals(O, WinEvaluator.evaluate(board));
    }

    @Test
    void antiDiagonal_isDetected()
    {
        Board board = Board.of(
                row(O, O, X),
                row(E, X, E),
                row(X, E, O));

        assertEquals(X, WinEvaluator.evaluate(board));
    }

    @Test
    void winOnLastCell_beatsDraw()
    {
        Board board = Board.of(
                row(X, O, X),
                row(O, X, O),
                row(O, X, X));

        assertTrue(board.isFull());
        assertEquals(X, WinEvaluator.evaluate(board));
    }

    // ========== Tie-break ==========

    @Test
    void twoRowsComplete_topRowReported()
    {
        // Unreachable in real play, but the scan order must be stable
        Board board = Board.of(
                row(O, O, O),
                row(X, E, X),
                row(X, X, X));

        assertEquals(O, WinEvaluator.evaluate(board));
    }

    @Test
    void twoColumnsComplete_leftColumnReported()
    {
        Board board = Board.of(
                row(X, E, O),
                row(X, E, O),
                row(X, E, O));

        assertEquals(X, WinEvaluator.evaluate(board));
    }

    private static Mark[] row(Mark a, Mark b, Mark c)
    {
        return new Mark[]{a, b, c};
    }
}
