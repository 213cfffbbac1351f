package ai.colosseum.player;

import ai.colosseum.game.Board;
import ai.colosseum.game.ConnectivityAnalyzer;
import ai.colosseum.game.Direction;
import ai.colosseum.game.EndgameResult;
import ai.colosseum.game.Move;
import ai.colosseum.game.Position;
import ai.colosseum.game.RandomWalk;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greedy (1-ply) player:
 *
 * - Enumerates every reachable destination and every open wall side there.
 * - Plays at once any move that separates the players with this player holding more cells.
 * - Avoids moves that end the game in a loss or a tie while any other move exists.
 * - Otherwise prefers destinations with fewer walls around them, then destinations nearer the
 *   opponent. Ties are broken by scan order.
 *
 * It never looks past its own move.
 */
public class GreedyPlayer extends AIPlayer {
    private static final Logger log = LoggerFactory.getLogger(GreedyPlayer.class);

    /** Score given to a move that ends the game without a win. */
    private static final int LOSING_SCORE = Integer.MIN_VALUE;

    @Override
    public Move step(Board board, Position myPos, Position advPos, int maxStep) {
        Move best = null;
        int bestScore = LOSING_SCORE;
        for (Position cell : reachableCells(board, myPos, advPos, maxStep)) {
            for (Direction dir : RandomWalk.openSides(board, cell)) {
                Board after = board.copy();
                after.setWall(cell, dir);
                EndgameResult result = ConnectivityAnalyzer.checkEndgame(after, cell, advPos);
                if (result.ended() && result.scoreA() > result.scoreB()) {
                    if (log.isDebugEnabled()) {
                        log.debug("Winning move {} {} ({} vs {})", cell, dir, result.scoreA(), result.scoreB());
                    }
                    return new Move(cell, dir);
                }
                int score = result.ended() ? LOSING_SCORE : score(after, cell, advPos);
                if (best == null || score > bestScore) {
                    best = new Move(cell, dir);
                    bestScore = score;
                }
            }
        }
        if (log.isTraceEnabled()) {
            log.trace("Greedy pick {} with score {}", best, bestScore);
        }
        return best;
    }

    private int score(Board after, Position cell, Position advPos) {
        return -10 * wallsAround(after, cell) - cell.distanceTo(advPos);
    }
}
