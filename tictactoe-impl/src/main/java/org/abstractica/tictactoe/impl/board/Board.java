package org.abstractica.tictactoe.impl.board;

import org.abstractica.tictactoe.Mark;

import java.util.Arrays;
import java.util.Objects;

/**
 * A 3x3 tic-tac-toe grid.
 *
 * <p>Only a room's engine thread writes to its board. Every method is
 * synchronized so that other threads (spectator sync, tests) always read a
 * consistent snapshot.</p>
 */
public class Board
{
    public static final int SIZE = 3;

    private final Mark[][] cells;

    public Board()
    {
        this.cells = new Mark[SIZE][SIZE];
        for (Mark[] row : cells)
        {
            Arrays.fill(row, Mark.EMPTY);
        }
    }

    /**
     * Creates a board from rows of marks, mainly for tests.
     *
     * @param rows exactly three rows of three marks
     * @return a new board holding a copy of the rows
     */
    public static Board of(Mark[]... rows)
    {
        Objects.requireNonNull(rows, "rows");
        if (rows.length != SIZE)
        {
            throw new IllegalArgumentException("Expected " + SIZE + " rows, got " + rows.length);
        }

        Board board = new Board();
        for (int r = 0; r < SIZE; r++)
        {
            if (rows[r].length != SIZE)
            {
                throw new IllegalArgumentException("Row " + r + " must have " + SIZE + " cells");
            }
            for (int c = 0; c < SIZE; c++)
            {
                board.cells[r][c] = Objects.requireNonNull(rows[r][c], "cell");
            }
        }
        return board;
    }

    /**
     * Checks whether a coordinate lies on the board.
     *
     * @param row    row index
     * @param column column index
     * @return true if both are in 0..2
     */
    public static boolean inBounds(int row, int column)
    {
        return row >= 0 && row < SIZE && column >= 0 && column < SIZE;
    }

    public synchronized Mark get(int row, int column)
    {
        checkBounds(row, column);
        return cells[row][column];
    }

    /**
     * Checks whether a mark may be placed at the given cell.
     *
     * @param row    row index, any value
     * @param column column index, any value
     * @return true if the cell exists and is empty
     */
    public synchronized boolean canPlace(int row, int column)
    {
        return inBounds(row, column) && cells[row][column] == Mark.EMPTY;
    }

    /**
     * Places a mark.
     *
     * @param row    row index
     * @param column column index
     * @param mark   PLAYER_ONE or PLAYER_TWO
     * @throws IllegalArgumentException if the cell is out of bounds or occupied
     */
    public synchronized void place(int row, int column, Mark mark)
    {
        Objects.requireNonNull(mark, "mark");
        if (mark == Mark.EMPTY)
        {
            throw new IllegalArgumentException("Cannot place EMPTY");
        }
        checkBounds(row, column);
        if (cells[row][column] != Mark.EMPTY)
        {
            throw new IllegalArgumentException("Cell occupied: " + row + "," + column);
        }
        cells[row][column] = mark;
    }

    public synchronized boolean isFull()
    {
        for (Mark[] row : cells)
        {
            for (Mark cell : row)
            {
                if (cell == Mark.EMPTY)
                {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Returns a copy of the grid.
     *
     * @return rows of marks, row-major
     */
    public synchronized Mark[][] snapshot()
    {
        Mark[][] copy = new Mark[SIZE][];
        for (int r = 0; r < SIZE; r++)
        {
            copy[r] = cells[r].clone();
        }
        return copy;
    }

    /**
     * Serializes the grid in the nested-list text form sent after {@code Matrix},
     * for example {@code [[1, 0, 0], [0, 2, 0], [0, 0, 0]]}.
     *
     * @return the wire form of the board
     */
    public synchronized String serialize()
    {
        StringBuilder sb = new StringBuilder("[");
        for (int r = 0; r < SIZE; r++)
        {
            if (r > 0)
            {
                sb.append(", ");
            }
            sb.append('[');
            for (int c = 0; c < SIZE; c++)
            {
                if (c > 0)
                {
                    sb.append(", ");
                }
                sb.append(cells[r][c].wireValue());
            }
            sb.append(']');
        }
        return sb.append(']').toString();
    }

    @Override
    public String toString()
    {
        return serialize();
    }

    private static void checkBounds(int row, int column)
    {
        if (!inBounds(row, column))
        {
            throw new IllegalArgumentException("Cell out of bounds: " + row + "," + column);
        }
    }
}
