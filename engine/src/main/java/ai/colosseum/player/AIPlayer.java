package ai.colosseum.player;

import ai.colosseum.game.Board;
import ai.colosseum.game.Direction;
import ai.colosseum.game.Position;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Base class for automated players with helpers for enumerating candidate moves.
 */
public abstract class AIPlayer implements Player {

    /**
     * Lists every cell reachable from {@code start} in at most {@code maxStep} steps without
     * crossing a wall or entering {@code advPos}. The start cell comes first; the rest follow in
     * breadth-first order.
     */
    protected List<Position> reachableCells(Board board, Position start, Position advPos, int maxStep) {
        int n = board.getSize();
        boolean[] visited = new boolean[n * n];
        visited[start.getRow() * n + start.getCol()] = true;
        List<Position> cells = new ArrayList<>();
        cells.add(start);
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
                    visited[index] = true;
                    cells.add(step);
                    next.add(step);
                }
            }
            frontier = next;
        }
        return cells;
    }

    /**
     * Counts the walled sides of a cell.
     */
    protected int wallsAround(Board board, Position pos) {
        int walls = 0;
        for (Direction dir : Direction.values()) {
            if (board.isWall(pos, dir)) {
                walls++;
            }
        }
        return walls;
    }
}
