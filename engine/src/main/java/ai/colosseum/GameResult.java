package ai.colosseum;

import ai.colosseum.game.EndgameResult;
import java.util.List;

/**
 * Summary of a finished game.
 */
public final class GameResult {
    private final EndgameResult result;
    private final int turns;
    private final long durationNanos;
    private final long meanTurnNanosA;
    private final long meanTurnNanosB;

    public GameResult(EndgameResult result, int turns, long durationNanos, long meanTurnNanosA, long meanTurnNanosB) {
        this.result = result;
        this.turns = turns;
        this.durationNanos = durationNanos;
        this.meanTurnNanosA = meanTurnNanosA;
        this.meanTurnNanosB = meanTurnNanosB;
    }

    /**
     * Builds the summary from a world whose game has ended.
     */
    public static GameResult of(World world, long durationNanos) {
        return new GameResult(
                world.getLatestResult(),
                world.getTurnCount(),
                durationNanos,
                mean(world.getPlayerOneTimes()),
                mean(world.getPlayerTwoTimes()));
    }

    private static long mean(List<Long> times) {
        if (times.isEmpty()) {
            return 0L;
        }
        long total = 0L;
        for (long t : times) {
            total += t;
        }
        return total / times.size();
    }

    public EndgameResult getResult() {
        return result;
    }

    public int getScoreA() {
        return result.scoreA();
    }

    public int getScoreB() {
        return result.scoreB();
    }

    public int getTurns() {
        return turns;
    }

    public long getDurationNanos() {
        return durationNanos;
    }

    public long getMeanTurnNanosA() {
        return meanTurnNanosA;
    }

    public long getMeanTurnNanosB() {
        return meanTurnNanosB;
    }

    @Override
    public String toString() {
        return "GameResult(scoreA=" + getScoreA() + ", scoreB=" + getScoreB() + ", turns=" + turns + ")";
    }
}
