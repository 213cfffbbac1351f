package ai.colosseum.config;

import ai.colosseum.game.RandomSource;
import ai.colosseum.game.SeededRandomSource;
import ai.colosseum.player.PlayerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the random source and player registry from {@link WorldProperties}.
 */
@Configuration
public class GameConfiguration {

    @Bean
    public RandomSource randomSource(WorldProperties properties) {
        Long seed = properties.getSeed();
        return seed == null ? new SeededRandomSource() : new SeededRandomSource(seed);
    }

    @Bean
    public PlayerRegistry playerRegistry(RandomSource randomSource) {
        return PlayerRegistry.withDefaults(randomSource);
    }
}
