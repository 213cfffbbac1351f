package ai.colosseum.game;

/**
 * Renders a board and the two player positions as plain ASCII for console display.
 * <p>
 * Every cell is drawn three characters wide. Walls appear as {@code ---} and {@code |}; player A
 * and player B are marked with their names.
 * <pre>
 * +---+---+
 * | A |   |
 * +   +---+
 * |     B |
 * +---+---+
 * </pre>
 */
public class BoardFormatter {
    private final Board board;
    private final Position posA;
    private final Position posB;

    /**
     * @param board the board to draw
     * @param posA  player A's position, or {@code null} to leave it out
     * @param posB  player B's position, or {@code null} to leave it out
     */
    public BoardFormatter(Board board, Position posA, Position posB) {
        this.board = board;
        this.posA = posA;
        this.posB = posB;
    }

    /**
     * Returns the board as a multi-line string, one text row per wall line and one per cell row.
     */
    public String format() {
        int n = board.getSize();
        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < n; r++) {
            appendHorizontal(sb, r, Direction.UP);
            for (int c = 0; c < n; c++) {
                sb.append(board.isWall(r, c, Direction.LEFT) ? '|' : ' ');
                sb.append(' ').append(marker(r, c)).append(' ');
            }
            sb.append(board.isWall(r, n - 1, Direction.RIGHT) ? '|' : ' ').append('\n');
        }
        appendHorizontal(sb, n - 1, Direction.DOWN);
        return sb.toString();
    }

    private void appendHorizontal(StringBuilder sb, int row, Direction side) {
        for (int c = 0; c < board.getSize(); c++) {
            sb.append('+').append(board.isWall(row, c, side) ? "---" : "   ");
        }
        sb.append("+\n");
    }

    private char marker(int row, int col) {
        Position cell = new Position(row, col);
        if (cell.equals(posA)) {
            return EndgameResult.PLAYER_A.charAt(0);
        }
        if (cell.equals(posB)) {
            return EndgameResult.PLAYER_B.charAt(0);
        }
        return ' ';
    }
}
