package ai.colosseum.game;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Decides whether a proposed move is legal: the destination must be reachable within the move
 * budget without crossing a wall or the opponent, and must still have room for the new wall.
 */
public final class ReachabilityValidator {
    private ReachabilityValidator() {
    }

    /**
     * Checks a proposed step.
     * <ol>
     *   <li>Rejects it if {@code end} already has a wall on side {@code barrierDir} (this covers the border).</li>
     *   <li>Accepts it if {@code end} equals {@code start}.</li>
     *   <li>Otherwise runs a breadth-first search from {@code start}, one layer per step, and accepts
     *       once {@code end} is discovered within {@code maxStep} layers.</li>
     * </ol>
     *
     * @param board      the current board
     * @param start      the mover's position
     * @param end        the proposed destination; must be on the board
     * @param barrierDir side of {@code end} where the wall will be placed
     * @param advPos     the opponent's position, which can be neither crossed nor entered
     * @param maxStep    move budget
     * @return true if the move is legal
     */
    public static boolean checkValidStep(
            Board board, Position start, Position end, Direction barrierDir, Position advPos, int maxStep) {
        if (board.isWall(end, barrierDir)) {
            return false;
        }
        if (start.equals(end)) {
            return true;
        }

        int n = board.getSize();
        boolean[] visited = new boolean[n * n];
        visited[start.getRow() * n + start.getCol()] = true;
        Deque<Position> frontier = new ArrayDeque<>();
        frontier.add(start);

        for (int depth = 0; depth < maxStep && !frontier.isEmpty(); depth++) {
            Deque<Position> next = new ArrayDeque<>();
            for (Position cur : frontier) {
                for (Direction dir : Direction.values()) {
                    if (board.isWall(cur, dir)) {
                        continue;
                    }
                    Position step = cur.neighbor(dir);
                    int index = step.getRow() * n + step.getCol();
                    if (step.equals(advPos) || visited[index]) {
                        continue;
                    }
                    if (step.equals(end)) {
                        return true;
                    }
                    visited[index] = true;
                    next.add(step);
                }
            }
            frontier = next;
        }
        return false;
    }
}
