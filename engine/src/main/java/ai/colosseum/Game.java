package ai.colosseum;

import ai.colosseum.config.WorldProperties;
import ai.colosseum.game.BoardFormatter;
import ai.colosseum.game.RandomSource;
import ai.colosseum.player.Player;
import ai.colosseum.player.PlayerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Game implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Game.class);

    private final WorldProperties properties;
    private final PlayerRegistry registry;
    private final RandomSource random;

    public Game(WorldProperties properties, PlayerRegistry registry, RandomSource random) {
        this.properties = properties;
        this.registry = registry;
        this.random = random;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Game.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        // CLI entrypoint ignores the result; tests and other harnesses
        // can call play() directly and use the returned GameResult.
        GameResult result = play();
        log.info("Final score A={} B={} after {} turns", result.getScoreA(), result.getScoreB(), result.getTurns());
    }

    /**
     * Plays one game from start to end with the configured players.
     *
     * @return the final scores, turn count and timing
     * @throws IllegalArgumentException if a configured player name is not registered
     */
    public GameResult play() {
        log.info("Registering p0 agent : {}", properties.getPlayerOne());
        Player playerOne = registry.create(properties.getPlayerOne());
        log.info("Registering p1 agent : {}", properties.getPlayerTwo());
        Player playerTwo = registry.create(properties.getPlayerTwo());

        World world = World.create(playerOne, playerTwo, properties.getBoardSize(),
                properties.isAutoplay(), properties.isDebug(), random);
        long startNanos = System.nanoTime();
        render(world);
        while (!world.isEnded()) {
            world.step();
            render(world);
        }
        return GameResult.of(world, System.nanoTime() - startNanos);
    }

    private void render(World world) {
        if (world.isDebug()) {
            log.info("\n{}", format(world));
        } else if (log.isDebugEnabled()) {
            log.debug("\n{}", format(world));
        }
    }

    private static String format(World world) {
        return new BoardFormatter(world.getBoard(), world.getPlayerOnePosition(), world.getPlayerTwoPosition())
                .format();
    }
}
