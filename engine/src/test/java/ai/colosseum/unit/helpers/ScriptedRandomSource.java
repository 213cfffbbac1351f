package ai.colosseum.unit.helpers;

import ai.colosseum.game.RandomSource;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * {@link RandomSource} that replays a fixed script of values, for tests that need to steer
 * every random decision.
 */
public class ScriptedRandomSource implements RandomSource {
    private final Deque<Integer> values = new ArrayDeque<>();

    public ScriptedRandomSource(int... script) {
        for (int value : script) {
            values.add(value);
        }
    }

    @Override
    public int nextInt(int bound) {
        if (values.isEmpty()) {
            throw new IllegalStateException("Random script exhausted");
        }
        int value = values.poll();
        if (value < 0 || value >= bound) {
            throw new IllegalStateException("Scripted value " + value + " outside [0, " + bound + ")");
        }
        return value;
    }

    public int remaining() {
        return values.size();
    }
}
