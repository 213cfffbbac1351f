package ai.colosseum.player;

import ai.colosseum.game.RandomSource;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Lookup table from player names to factories. The engine itself never consults it; the runner
 * uses it to turn configured names into {@link Player} instances.
 */
public class PlayerRegistry {
    public static final String RANDOM_AGENT = "random_agent";
    public static final String GREEDY_AGENT = "greedy_agent";
    public static final String HUMAN_AGENT = "human_agent";

    private final Map<String, Supplier<Player>> factories = new LinkedHashMap<>();

    /**
     * Returns a registry holding the bundled players. Random players draw from {@code random}.
     */
    public static PlayerRegistry withDefaults(RandomSource random) {
        Objects.requireNonNull(random, "random");
        PlayerRegistry registry = new PlayerRegistry();
        registry.register(RANDOM_AGENT, () -> new RandomPlayer(random));
        registry.register(GREEDY_AGENT, GreedyPlayer::new);
        registry.register(HUMAN_AGENT, HumanPlayer::new);
        return registry;
    }

    /**
     * Registers a factory, replacing any previous one under the same name.
     */
    public void register(String name, Supplier<Player> factory) {
        factories.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(factory, "factory"));
    }

    /**
     * Creates a fresh player.
     *
     * @throws IllegalArgumentException if no player is registered under {@code name}
     */
    public Player create(String name) {
        Supplier<Player> factory = factories.get(name);
        if (factory == null) {
            throw new IllegalArgumentException(
                    "Agent '" + name + "' is not registered. Registered agents: " + factories.keySet());
        }
        return factory.get();
    }

    public boolean contains(String name) {
        return factories.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(factories.keySet());
    }
}
