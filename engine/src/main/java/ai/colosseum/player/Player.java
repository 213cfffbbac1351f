package ai.colosseum.player;

import ai.colosseum.game.Board;
import ai.colosseum.game.Move;
import ai.colosseum.game.Position;

/**
 * Represents a player capable of producing the next move for the game loop.
 * <p>
 * The engine treats every player as untrusted: a returned move is validated before it is
 * applied, and anything thrown other than {@link GameAbortException}, errors included, is
 * replaced by a random legal move.
 */
public interface Player {

    /**
     * Choose the next move.
     *
     * @param board   a private copy of the current board; changes made to it are ignored
     * @param myPos   this player's position
     * @param advPos  the opponent's position
     * @param maxStep how many edges this player may cross this turn
     * @return destination and wall side
     */
    Move step(Board board, Position myPos, Position advPos, int maxStep);

    /**
     * Whether this player can run unattended. Human players return false.
     */
    default boolean isAutoplay() {
        return true;
    }
}
