package ai.colosseum.game;

/**
 * An immutable (row, column) cell coordinate on the board.
 * <p>
 * Positions carry no knowledge of the board size; use {@link Board#inBounds(Position)} to check
 * that a position lies on a particular board.
 */
public final class Position {
    private final int row;
    private final int col;

    public Position(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    /**
     * Returns the adjacent position one step in the given direction. The result may be off the board.
     */
    public Position neighbor(Direction direction) {
        return new Position(row + direction.getRowDelta(), col + direction.getColDelta());
    }

    /**
     * Returns the point reflection of this position through the centre of a board of the given size,
     * i.e. {@code (size - 1 - row, size - 1 - col)}.
     */
    public Position mirror(int size) {
        return new Position(size - 1 - row, size - 1 - col);
    }

    /**
     * Manhattan distance to another position, ignoring walls.
     */
    public int distanceTo(Position other) {
        return Math.abs(row - other.row) + Math.abs(col - other.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Position)) {
            return false;
        }
        Position other = (Position) o;
        return row == other.row && col == other.col;
    }

    @Override
    public int hashCode() {
        return 31 * row + col;
    }

    @Override
    public String toString() {
        return "(" + row + ", " + col + ")";
    }
}
