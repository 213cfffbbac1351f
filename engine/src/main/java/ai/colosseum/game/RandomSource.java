package ai.colosseum.game;

/**
 * Source of uniformly distributed integers used for every random decision in a game.
 * <p>
 * Injecting the source keeps a game reproducible under a fixed seed and keeps concurrently
 * simulated games independent of each other.
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * Returns a uniformly distributed integer in {@code [0, bound)}.
     *
     * @param bound exclusive upper bound; must be positive
     */
    int nextInt(int bound);

    /**
     * Returns a uniformly distributed integer in {@code [origin, bound)}.
     */
    default int nextInt(int origin, int bound) {
        return origin + nextInt(bound - origin);
    }
}
