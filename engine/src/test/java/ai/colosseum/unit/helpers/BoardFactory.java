package ai.colosseum.unit.helpers;

import ai.colosseum.game.Board;
import ai.colosseum.game.Direction;
import ai.colosseum.game.Position;

/**
 * Factory for hand-built boards used across the unit tests.
 */
public final class BoardFactory {
    private BoardFactory() {
    }

    /**
     * Board with border walls only.
     */
    public static Board open(int size) {
        return new Board(size);
    }

    /**
     * Board with a vertical wall on the right side of {@code col} in every row except {@code gapRow},
     * which is left open. Pass {@code gapRow = -1} to close the wall completely.
     */
    public static Board verticalWall(int size, int col, int gapRow) {
        Board board = new Board(size);
        for (int r = 0; r < size; r++) {
            if (r != gapRow) {
                board.setWall(r, col, Direction.RIGHT);
            }
        }
        return board;
    }

    /**
     * Walls off all four sides of {@code cell}.
     */
    public static Board enclosed(int size, Position cell) {
        Board board = new Board(size);
        for (Direction dir : Direction.values()) {
            if (!board.isWall(cell, dir)) {
                board.setWall(cell, dir);
            }
        }
        return board;
    }
}
