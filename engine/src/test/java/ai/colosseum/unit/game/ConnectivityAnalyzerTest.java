package ai.colosseum.unit.game;

import static org.junit.jupiter.api.Assertions.*;

import ai.colosseum.game.Board;
import ai.colosseum.game.ConnectivityAnalyzer;
import ai.colosseum.game.Direction;
import ai.colosseum.game.EndgameResult;
import ai.colosseum.game.Position;
import ai.colosseum.unit.helpers.BoardFactory;
import org.junit.jupiter.api.Test;

/**
 * Endgame detection by partitioning the board into wall-separated regions.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>openBoardNeverEnds</b> - No interior walls: one partition, both scores N²</li>
 *   <li><b>wallWithGapKeepsGameRunning</b> - A single opening is enough to stay connected</li>
 *   <li><b>fullWallSplitsIntoEqualHalvesAsTie</b> - Closed wall down the middle ends the game in a tie</li>
 *   <li><b>unevenSplitNamesLargerSideWinner</b> - Scores are the two partition sizes and add up to N²</li>
 *   <li><b>enclosedCellScoresOne</b> - A fully walled cell is its own partition</li>
 *   <li><b>thirdRegionIsCountedForNobody</b> - Cells cut off from both players belong to neither score</li>
 *   <li><b>resultIndependentOfWallOrder</b> - Same walls placed in a different order give the same result</li>
 * </ul>
 */
class ConnectivityAnalyzerTest {

    @Test
    void openBoardNeverEnds() {
        for (int n = 2; n <= 8; n++) {
            EndgameResult result = ConnectivityAnalyzer.checkEndgame(
                    BoardFactory.open(n), new Position(0, 0), new Position(n - 1, n - 1));
            assertFalse(result.ended());
            assertEquals(n * n, result.scoreA());
            assertEquals(n * n, result.scoreB());
            assertTrue(result.winner().isEmpty());
        }
    }

    @Test
    void wallWithGapKeepsGameRunning() {
        Board board = BoardFactory.verticalWall(4, 1, 0);
        EndgameResult result = ConnectivityAnalyzer.checkEndgame(board, new Position(0, 0), new Position(3, 3));
        assertFalse(result.ended());
        assertEquals(16, result.scoreA());
        assertEquals(16, result.scoreB());
    }

    @Test
    void fullWallSplitsIntoEqualHalvesAsTie() {
        Board board = BoardFactory.verticalWall(4, 1, -1);
        EndgameResult result = ConnectivityAnalyzer.checkEndgame(board, new Position(0, 0), new Position(3, 3));
        assertTrue(result.ended());
        assertEquals(8, result.scoreA());
        assertEquals(8, result.scoreB());
        assertTrue(result.isTie());
        assertTrue(result.winner().isEmpty());
    }

    @Test
    void unevenSplitNamesLargerSideWinner() {
        Board board = BoardFactory.verticalWall(5, 0, -1);
        EndgameResult result = ConnectivityAnalyzer.checkEndgame(board, new Position(2, 0), new Position(2, 3));
        assertTrue(result.ended());
        assertEquals(5, result.scoreA());
        assertEquals(20, result.scoreB());
        assertEquals(25, result.scoreA() + result.scoreB());
        assertEquals(EndgameResult.PLAYER_B, result.winner().orElseThrow());
    }

    @Test
    void enclosedCellScoresOne() {
        Position boxed = new Position(1, 1);
        Board board = BoardFactory.enclosed(4, boxed);
        EndgameResult result = ConnectivityAnalyzer.checkEndgame(board, new Position(3, 3), boxed);
        assertTrue(result.ended());
        assertEquals(15, result.scoreA());
        assertEquals(1, result.scoreB());
        assertEquals(EndgameResult.PLAYER_A, result.winner().orElseThrow());
    }

    @Test
    void thirdRegionIsCountedForNobody() {
        // Corner (0,0) cut off, then a full horizontal wall under row 1.
        Board board = BoardFactory.open(4);
        board.setWall(0, 0, Direction.RIGHT);
        board.setWall(0, 0, Direction.DOWN);
        for (int c = 0; c < 4; c++) {
            board.setWall(1, c, Direction.DOWN);
        }
        EndgameResult result = ConnectivityAnalyzer.checkEndgame(board, new Position(0, 3), new Position(3, 0));
        assertTrue(result.ended());
        assertEquals(7, result.scoreA());
        assertEquals(8, result.scoreB());
        assertEquals(15, result.scoreA() + result.scoreB());
    }

    @Test
    void resultIndependentOfWallOrder() {
        Board forward = BoardFactory.open(6);
        Board backward = BoardFactory.open(6);
        int[][] walls = {{0, 2, 1}, {1, 2, 1}, {2, 2, 1}, {3, 2, 2}, {3, 3, 2}, {4, 4, 1}, {5, 2, 1}, {4, 2, 1}};
        for (int[] w : walls) {
            forward.setWall(w[0], w[1], Direction.fromIndex(w[2]));
        }
        for (int i = walls.length - 1; i >= 0; i--) {
            backward.setWall(walls[i][0], walls[i][1], Direction.fromIndex(walls[i][2]));
        }
        Position a = new Position(0, 0);
        Position b = new Position(5, 5);
        assertEquals(forward, backward);
        assertEquals(ConnectivityAnalyzer.checkEndgame(forward, a, b), ConnectivityAnalyzer.checkEndgame(backward, a, b));
        assertEquals(ConnectivityAnalyzer.checkEndgame(forward, b, a).scoreA(),
                ConnectivityAnalyzer.checkEndgame(forward, a, b).scoreB());
    }
}
