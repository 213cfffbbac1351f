package ai.colosseum.player;

import ai.colosseum.game.Board;
import ai.colosseum.game.Move;
import ai.colosseum.game.Position;
import ai.colosseum.game.RandomSource;
import ai.colosseum.game.RandomWalk;
import java.util.Objects;

/**
 * Baseline player that plays a {@link RandomWalk} every turn.
 */
public class RandomPlayer extends AIPlayer {
    private final RandomSource random;

    public RandomPlayer(RandomSource random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public Move step(Board board, Position myPos, Position advPos, int maxStep) {
        return RandomWalk.randomWalk(board, myPos, advPos, maxStep, random);
    }
}
