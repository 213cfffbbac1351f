package ai.colosseum;

import ai.colosseum.game.Move;
import ai.colosseum.player.GameAbortException;
import java.util.Objects;

/**
 * What came back from asking a player for a move.
 * <ul>
 *   <li>{@link Kind#VALID}: a move that passed validation and can be applied as is.</li>
 *   <li>{@link Kind#INVALID}: a malformed or illegal move, or a player failure; the engine plays a
 *       random move instead.</li>
 *   <li>{@link Kind#FATAL_ABORT}: the player asked to stop the game; the engine rethrows.</li>
 * </ul>
 */
public final class MoveOutcome {

    public enum Kind {
        VALID,
        INVALID,
        FATAL_ABORT
    }

    private final Kind kind;
    private final Move move;
    private final String reason;
    private final Throwable cause;

    private MoveOutcome(Kind kind, Move move, String reason, Throwable cause) {
        this.kind = kind;
        this.move = move;
        this.reason = reason;
        this.cause = cause;
    }

    public static MoveOutcome valid(Move move) {
        return new MoveOutcome(Kind.VALID, Objects.requireNonNull(move, "move"), null, null);
    }

    public static MoveOutcome invalid(String reason) {
        return new MoveOutcome(Kind.INVALID, null, reason, null);
    }

    public static MoveOutcome invalid(String reason, Throwable cause) {
        return new MoveOutcome(Kind.INVALID, null, reason, cause);
    }

    public static MoveOutcome fatalAbort(GameAbortException abort) {
        return new MoveOutcome(Kind.FATAL_ABORT, null, abort.getMessage(), abort);
    }

    public Kind getKind() {
        return kind;
    }

    /** The validated move; only set for {@link Kind#VALID}. */
    public Move getMove() {
        return move;
    }

    public String getReason() {
        return reason;
    }

    /** The exception raised by the player, if any. */
    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return kind == Kind.VALID ? "VALID " + move : kind + " (" + reason + ")";
    }
}
