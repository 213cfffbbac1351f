package ai.colosseum.game;

import java.util.Objects;

/**
 * Detects the end of the game by partitioning the board into wall-separated regions.
 */
public final class ConnectivityAnalyzer {
    private ConnectivityAnalyzer() {
    }

    /**
     * Checks whether the two players have been separated and computes each player's territory.
     * <p>
     * Every cell is joined with its right and down neighbours unless a wall lies between them;
     * looking only right and down visits each interior edge exactly once. The game has ended when
     * the two positions end up with different roots.
     *
     * @param board the board to analyse
     * @param posA  player A's position
     * @param posB  player B's position
     * @return the endgame flag and the size of each player's partition
     */
    public static EndgameResult checkEndgame(Board board, Position posA, Position posB) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(posA, "posA");
        Objects.requireNonNull(posB, "posB");
        int n = board.getSize();
        DisjointSet cells = new DisjointSet(n * n);
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                int index = r * n + c;
                if (!board.isWall(r, c, Direction.RIGHT)) {
                    cells.union(index, index + 1);
                }
                if (!board.isWall(r, c, Direction.DOWN)) {
                    cells.union(index, index + n);
                }
            }
        }

        int rootA = cells.find(posA.getRow() * n + posA.getCol());
        int rootB = cells.find(posB.getRow() * n + posB.getCol());
        int scoreA = 0;
        int scoreB = 0;
        for (int i = 0; i < n * n; i++) {
            int root = cells.find(i);
            if (root == rootA) {
                scoreA++;
            }
            if (root == rootB) {
                scoreB++;
            }
        }
        return new EndgameResult(rootA != rootB, scoreA, scoreB);
    }
}
