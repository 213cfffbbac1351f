package ai.colosseum.unit.game;

import static org.junit.jupiter.api.Assertions.*;

import ai.colosseum.game.Board;
import ai.colosseum.game.Direction;
import ai.colosseum.game.Position;
import ai.colosseum.game.SeededRandomSource;
import org.junit.jupiter.api.Test;

/**
 * Wall storage, border and mirroring invariants of {@link Board}.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>newBoardHasOnlyBorderWalls</b> - Every outward edge is walled; nothing else is</li>
 *   <li><b>setWallAlsoWritesMirror</b> - A wall shows up on both sides of the shared edge and no other bit changes</li>
 *   <li><b>setWallIsIdempotent</b> - Placing the same wall twice equals placing it once</li>
 *   <li><b>setWallRejectsEdgesLeavingTheBoard</b> - No neighbour means no write and an exception</li>
 *   <li><b>copyIsIndependent</b> - Mutating a copy never touches the original</li>
 *   <li><b>maxStepIsCeilingOfHalfSizePlusOne</b> - Move budget derived from the size</li>
 *   <li><b>randomBoardIsPointSymmetric</b> - Random walls come in point-mirrored pairs</li>
 *   <li><b>randomBoardIsReproducibleForSeed</b> - Same seed, same walls</li>
 *   <li><b>getWallsIsASnapshot</b> - Renderer view mirrors the bits but cannot write them</li>
 * </ul>
 */
class BoardTest {

    @Test
    void newBoardHasOnlyBorderWalls() {
        int n = 5;
        Board board = new Board(n);
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                assertEquals(r == 0, board.isWall(r, c, Direction.UP));
                assertEquals(r == n - 1, board.isWall(r, c, Direction.DOWN));
                assertEquals(c == 0, board.isWall(r, c, Direction.LEFT));
                assertEquals(c == n - 1, board.isWall(r, c, Direction.RIGHT));
            }
        }
        assertEquals(4 * n, board.countWalls());
    }

    @Test
    void setWallAlsoWritesMirror() {
        for (Direction dir : Direction.values()) {
            Board board = new Board(4);
            Board before = board.copy();
            Position cell = new Position(1, 2);
            board.setWall(cell, dir);

            Position neighbor = cell.neighbor(dir);
            assertTrue(board.isWall(cell, dir));
            assertTrue(board.isWall(neighbor, dir.opposite()));
            // Exactly the two new bits.
            assertEquals(before.countWalls() + 2, board.countWalls());
        }
    }

    @Test
    void setWallIsIdempotent() {
        Board once = new Board(6);
        once.setWall(2, 3, Direction.DOWN);

        Board twice = new Board(6);
        twice.setWall(2, 3, Direction.DOWN);
        twice.setWall(2, 3, Direction.DOWN);

        assertEquals(once, twice);
        // The mirrored call from the other side is the same wall too.
        twice.setWall(3, 3, Direction.UP);
        assertEquals(once, twice);
    }

    @Test
    void setWallRejectsEdgesLeavingTheBoard() {
        Board board = new Board(4);
        int walls = board.countWalls();
        assertThrows(IllegalArgumentException.class, () -> board.setWall(0, 2, Direction.UP));
        assertThrows(IllegalArgumentException.class, () -> board.setWall(3, 3, Direction.RIGHT));
        assertThrows(IllegalArgumentException.class, () -> board.setWall(4, 0, Direction.DOWN));
        assertEquals(walls, board.countWalls());
        assertThrows(IllegalArgumentException.class, () -> new Board(1));
    }

    @Test
    void copyIsIndependent() {
        Board board = new Board(5);
        Board copy = board.copy();
        copy.setWall(2, 2, Direction.LEFT);

        assertFalse(board.isWall(2, 2, Direction.LEFT));
        assertTrue(copy.isWall(2, 2, Direction.LEFT));
        assertNotEquals(board, copy);
    }

    @Test
    void maxStepIsCeilingOfHalfSizePlusOne() {
        assertEquals(3, new Board(4).getMaxStep());
        assertEquals(3, new Board(5).getMaxStep());
        assertEquals(4, new Board(6).getMaxStep());
        assertEquals(6, new Board(11).getMaxStep());
    }

    @Test
    void randomBoardIsPointSymmetric() {
        for (long seed = 0; seed < 50; seed++) {
            int n = 6 + (int) (seed % 6);
            Board board = Board.random(n, new SeededRandomSource(seed));
            for (int r = 0; r < n; r++) {
                for (int c = 0; c < n; c++) {
                    for (Direction dir : Direction.values()) {
                        assertEquals(board.isWall(r, c, dir), board.isWall(n - 1 - r, n - 1 - c, dir.opposite()),
                                "seed " + seed + " at (" + r + ", " + c + ") " + dir);
                    }
                }
            }
            // Border plus at most two mirrored walls (two bits each) per seeded barrier.
            int barriers = n / 2 - 1;
            assertTrue(board.countWalls() > 4 * n);
            assertTrue(board.countWalls() <= 4 * n + 4 * barriers);
        }
    }

    @Test
    void randomBoardIsReproducibleForSeed() {
        assertEquals(Board.random(9, new SeededRandomSource(7)), Board.random(9, new SeededRandomSource(7)));
    }

    @Test
    void getWallsIsASnapshot() {
        Board board = new Board(3);
        board.setWall(1, 1, Direction.UP);
        boolean[][][] walls = board.getWalls();

        assertTrue(walls[1][1][Direction.UP.getIndex()]);
        assertTrue(walls[0][1][Direction.DOWN.getIndex()]);
        assertFalse(walls[1][1][Direction.DOWN.getIndex()]);

        walls[2][2][Direction.UP.getIndex()] = true;
        assertFalse(board.isWall(2, 2, Direction.UP));
    }
}
