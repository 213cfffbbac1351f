package ai.colosseum.game;

/**
 * The four cardinal directions a wall can face or a player can step in.
 * <p>
 * The ordinal order (up, right, down, left) is also the bit order of a cell's wall record
 * in {@link Board}, and {@link #getIndex()} is the integer form used by players that speak
 * in raw indices.
 */
public enum Direction {
    /** Towards row 0. */
    UP(0, -1, 0, "Up", 'u'),
    /** Towards the last column. */
    RIGHT(1, 0, 1, "Right", 'r'),
    /** Towards the last row. */
    DOWN(2, 1, 0, "Down", 'd'),
    /** Towards column 0. */
    LEFT(3, 0, -1, "Left", 'l');

    private static final Direction[] BY_INDEX = values();

    private final int index;
    private final int rowDelta;
    private final int colDelta;
    private final String displayName;
    private final char code;

    Direction(int index, int rowDelta, int colDelta, String displayName, char code) {
        this.index = index;
        this.rowDelta = rowDelta;
        this.colDelta = colDelta;
        this.displayName = displayName;
        this.code = code;
    }

    /**
     * Returns the direction for a raw index in {@code [0, 3]}.
     *
     * @throws IllegalArgumentException if the index is outside {@code [0, 3]}
     */
    public static Direction fromIndex(int index) {
        if (index < 0 || index >= BY_INDEX.length) {
            throw new IllegalArgumentException(
                    "Barrier dir should reside in [0, 3], but the dir is " + index);
        }
        return BY_INDEX[index];
    }

    /**
     * Parses a single-letter code ({@code u}, {@code r}, {@code d}, {@code l}) or a digit.
     *
     * @throws IllegalArgumentException if the text names no direction
     */
    public static Direction parse(String text) {
        String trimmed = text == null ? "" : text.trim().toLowerCase();
        if (trimmed.length() == 1) {
            char c = trimmed.charAt(0);
            for (Direction direction : BY_INDEX) {
                if (direction.code == c) {
                    return direction;
                }
            }
            if (Character.isDigit(c)) {
                return fromIndex(c - '0');
            }
        }
        for (Direction direction : BY_INDEX) {
            if (direction.displayName.equalsIgnoreCase(trimmed)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown direction: '" + text + "'");
    }

    public int getIndex() {
        return index;
    }

    public int getRowDelta() {
        return rowDelta;
    }

    public int getColDelta() {
        return colDelta;
    }

    /** Bit mask of this direction inside a cell's wall record. */
    int mask() {
        return 1 << index;
    }

    /**
     * Returns the direction pointing back the other way.
     */
    public Direction opposite() {
        return BY_INDEX[(index + 2) % 4];
    }

    @Override
    public String toString() {
        return displayName;
    }
}
