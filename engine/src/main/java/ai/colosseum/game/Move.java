package ai.colosseum.game;

/**
 * The atomic unit a player produces each turn: where to walk to and which side of the
 * destination cell to wall off.
 * <p>
 * Either component may be {@code null} when an untrusted player builds a move; the engine
 * rejects such moves during validation.
 *
 * @param destination the cell the player ends the turn on
 * @param direction   the side of {@code destination} that receives the new wall
 */
public record Move(Position destination, Direction direction) {

    @Override
    public String toString() {
        return destination + " " + direction;
    }
}
