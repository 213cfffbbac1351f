package ai.colosseum.game;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces a uniformly random legal move. The engine substitutes it whenever a player fails to
 * deliver a valid move, and {@code RandomPlayer} plays with it directly.
 */
public final class RandomWalk {
    private RandomWalk() {
    }

    /**
     * Walks a random number of steps in {@code [0, maxStep]}, each in a uniformly chosen open
     * direction that does not lead onto the opponent, then picks a uniformly random unwalled side
     * of the final cell.
     * <p>
     * The walk stops early if every direction is blocked.
     *
     * @return a legal move
     * @throws IllegalStateException if the final cell is walled on all four sides; an enclosed cell
     *                               means the game should already have ended
     */
    public static Move randomWalk(Board board, Position myPos, Position advPos, int maxStep, RandomSource random) {
        int steps = random.nextInt(maxStep + 1);
        Position pos = myPos;
        for (int i = 0; i < steps; i++) {
            List<Direction> allowed = new ArrayList<>(4);
            for (Direction dir : Direction.values()) {
                if (!board.isWall(pos, dir) && !pos.neighbor(dir).equals(advPos)) {
                    allowed.add(dir);
                }
            }
            if (allowed.isEmpty()) {
                // Boxed in by walls and the opponent.
                break;
            }
            pos = pos.neighbor(allowed.get(random.nextInt(allowed.size())));
        }

        List<Direction> barriers = openSides(board, pos);
        if (barriers.isEmpty()) {
            throw new IllegalStateException("Cell " + pos + " is walled on all sides; board state is corrupt");
        }
        return new Move(pos, barriers.get(random.nextInt(barriers.size())));
    }

    /**
     * Returns the sides of {@code pos} that have no wall yet, in direction order.
     */
    public static List<Direction> openSides(Board board, Position pos) {
        List<Direction> open = new ArrayList<>(4);
        for (Direction dir : Direction.values()) {
            if (!board.isWall(pos, dir)) {
                open.add(dir);
            }
        }
        return open;
    }
}
