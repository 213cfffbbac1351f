package ai.colosseum.game;

import java.util.Random;

/**
 * {@link RandomSource} backed by {@link java.util.Random}.
 */
public class SeededRandomSource implements RandomSource {
    private final Random random;

    /**
     * Creates an unseeded source.
     */
    public SeededRandomSource() {
        this.random = new Random();
    }

    /**
     * Creates a source that replays the same sequence for the same seed.
     */
    public SeededRandomSource(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }
}
