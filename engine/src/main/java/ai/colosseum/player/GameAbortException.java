package ai.colosseum.player;

/**
 * Thrown by a player to stop the whole game, for example when a human at the console quits.
 * <p>
 * Unlike every other player failure, the engine does not recover from this exception: it
 * propagates out of {@code World.step()}.
 */
public class GameAbortException extends RuntimeException {

    public GameAbortException(String message) {
        super(message);
    }
}
