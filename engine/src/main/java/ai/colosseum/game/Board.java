package ai.colosseum.game;

import java.util.Arrays;
import java.util.Objects;

/**
 * Square grid of cells, each carrying one wall bit per {@link Direction}.
 * <p>
 * Two invariants hold for the lifetime of a board:
 * <ul>
 *   <li><strong>Border:</strong> every boundary-facing edge is walled (top row up, bottom row down,
 *       left column left, right column right). These walls are set by the constructor.</li>
 *   <li><strong>Mirroring:</strong> a wall on side {@code d} of a cell is always matched by a wall on
 *       side {@code d.opposite()} of the neighbouring cell. {@link #setWall(int, int, Direction)} is
 *       the only mutator and always writes both bits.</li>
 * </ul>
 * Walls are never removed.
 * <p>
 * Wall records are stored in a dense {@code byte} array indexed by {@code row * size + col}.
 */
public class Board {
    /** Smallest board size drawn when no size is configured. */
    public static final int MIN_BOARD_SIZE = 6;

    /** Exclusive upper bound on the board size drawn when no size is configured. */
    public static final int MAX_BOARD_SIZE = 12;

    private final int size;
    private final byte[] cells;

    /**
     * Creates a board of the given size with only the border walls set.
     *
     * @param size number of rows (and columns); must be at least 2
     * @throws IllegalArgumentException if {@code size < 2}
     */
    public Board(int size) {
        if (size < 2) {
            throw new IllegalArgumentException("Board size must be at least 2, but was " + size);
        }
        this.size = size;
        this.cells = new byte[size * size];
        for (int i = 0; i < size; i++) {
            setBit(0, i, Direction.UP);
            setBit(size - 1, i, Direction.DOWN);
            setBit(i, 0, Direction.LEFT);
            setBit(i, size - 1, Direction.RIGHT);
        }
    }

    private Board(int size, byte[] cells) {
        this.size = size;
        this.cells = cells;
    }

    /**
     * Creates a board with border walls plus {@code size / 2 - 1} random interior walls, each
     * placed together with its point-symmetric counterpart at
     * {@code (size - 1 - row, size - 1 - col, opposite)}.
     * <p>
     * Few enough walls are placed that no cell starts fully enclosed.
     *
     * @param size   board size; must be at least 2
     * @param random source for the wall locations
     * @return the seeded board
     */
    public static Board random(int size, RandomSource random) {
        Objects.requireNonNull(random, "random");
        Board board = new Board(size);
        int barriers = size / 2 - 1;
        for (int i = 0; i < barriers; i++) {
            int r = random.nextInt(size);
            int c = random.nextInt(size);
            Direction dir = Direction.fromIndex(random.nextInt(4));
            while (board.isWall(r, c, dir)) {
                r = random.nextInt(size);
                c = random.nextInt(size);
                dir = Direction.fromIndex(random.nextInt(4));
            }
            board.setWall(r, c, dir);
            board.setWall(size - 1 - r, size - 1 - c, dir.opposite());
        }
        return board;
    }

    /**
     * Returns an independent copy; changes to either board are not visible in the other.
     */
    public Board copy() {
        return new Board(size, Arrays.copyOf(cells, cells.length));
    }

    public int getSize() {
        return size;
    }

    /**
     * Maximum number of edges a player may cross in one turn: {@code ceil((size + 1) / 2)}.
     */
    public int getMaxStep() {
        return (size + 2) / 2;
    }

    /**
     * Returns true if a wall exists on the given side of the cell.
     *
     * @throws IllegalArgumentException if the cell is off the board
     */
    public boolean isWall(int row, int col, Direction dir) {
        checkCell(row, col);
        return (cells[row * size + col] & dir.mask()) != 0;
    }

    public boolean isWall(Position pos, Direction dir) {
        return isWall(pos.getRow(), pos.getCol(), dir);
    }

    /**
     * Places a wall on the given side of the cell and the mirrored wall on the neighbour's
     * opposite side. Calling it again with the same arguments leaves the board unchanged.
     *
     * @throws IllegalArgumentException if the cell or its neighbour in {@code dir} is off the board;
     *                                  nothing is written in that case
     */
    public void setWall(int row, int col, Direction dir) {
        Objects.requireNonNull(dir, "dir");
        checkCell(row, col);
        int nr = row + dir.getRowDelta();
        int nc = col + dir.getColDelta();
        if (!inBounds(nr, nc)) {
            throw new IllegalArgumentException(
                    "Cannot place a wall facing " + dir + " at (" + row + ", " + col + "): no neighbour on the board");
        }
        setBit(row, col, dir);
        setBit(nr, nc, dir.opposite());
    }

    public void setWall(Position pos, Direction dir) {
        setWall(pos.getRow(), pos.getCol(), dir);
    }

    public boolean inBounds(Position pos) {
        return pos != null && inBounds(pos.getRow(), pos.getCol());
    }

    public boolean inBounds(int row, int col) {
        return row >= 0 && row < size && col >= 0 && col < size;
    }

    /**
     * Counts the wall bits set across the whole board. Each interior wall contributes two bits
     * and each border edge one.
     */
    public int countWalls() {
        int count = 0;
        for (byte cell : cells) {
            count += Integer.bitCount(cell & 0xF);
        }
        return count;
    }

    /**
     * Returns a fresh {@code [row][col][direction]} copy of all wall bits, for renderers.
     */
    public boolean[][][] getWalls() {
        boolean[][][] walls = new boolean[size][size][4];
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                for (Direction dir : Direction.values()) {
                    walls[r][c][dir.getIndex()] = (cells[r * size + c] & dir.mask()) != 0;
                }
            }
        }
        return walls;
    }

    private void setBit(int row, int col, Direction dir) {
        cells[row * size + col] |= (byte) dir.mask();
    }

    private void checkCell(int row, int col) {
        if (!inBounds(row, col)) {
            throw new IllegalArgumentException(
                    "Cell (" + row + ", " + col + ") is out of boundary for board size " + size);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Board)) {
            return false;
        }
        Board other = (Board) o;
        return size == other.size && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return 31 * size + Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return "Board(size=" + size + ", walls=" + countWalls() + ")";
    }
}
