package ai.colosseum.game;

import java.util.Optional;

/**
 * Outcome of a connectivity check: whether the players have been separated and how many cells
 * each controls.
 * <p>
 * While the game is ongoing both scores hold the size of the shared partition; they only mean
 * territory once {@link #ended()} is true.
 *
 * @param ended  true if the two players sit in different partitions
 * @param scoreA cells in player A's partition
 * @param scoreB cells in player B's partition
 */
public record EndgameResult(boolean ended, int scoreA, int scoreB) {

    /** Name used for the first player in logs and reports. */
    public static final String PLAYER_A = "A";

    /** Name used for the second player in logs and reports. */
    public static final String PLAYER_B = "B";

    /**
     * Returns the winning player's name, or empty while the game is running or when it ended in a tie.
     */
    public Optional<String> winner() {
        if (!ended || scoreA == scoreB) {
            return Optional.empty();
        }
        return Optional.of(scoreA > scoreB ? PLAYER_A : PLAYER_B);
    }

    public boolean isTie() {
        return ended && scoreA == scoreB;
    }
}
