package ai.colosseum;

import ai.colosseum.game.Board;
import ai.colosseum.game.ConnectivityAnalyzer;
import ai.colosseum.game.Direction;
import ai.colosseum.game.EndgameResult;
import ai.colosseum.game.Move;
import ai.colosseum.game.Position;
import ai.colosseum.game.RandomSource;
import ai.colosseum.game.RandomWalk;
import ai.colosseum.game.ReachabilityValidator;
import ai.colosseum.player.GameAbortException;
import ai.colosseum.player.Player;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The game world: board, both players and their positions, and the turn protocol.
 *
 * <p>Each call to {@link #step()} plays exactly one turn:
 * <ol>
 *     <li>Ask the active player for a move, handing it a private copy of the board, and time the call.</li>
 *     <li>Validate the move (on the board, direction present, reachable, wall slot free).</li>
 *     <li>On any failure, substitute a {@link RandomWalk} move. A {@link GameAbortException} is the
 *         one failure that is not recovered.</li>
 *     <li>Move the player and place the wall.</li>
 *     <li>Flip the turn and recompute the endgame result.</li>
 * </ol>
 *
 * <p>A world is single-threaded and owns its board exclusively. Independent games must use
 * independent worlds and random sources.
 */
public class World {
    private static final Logger log = LoggerFactory.getLogger(World.class);

    private final Player playerOne;
    private final Player playerTwo;
    private final Board board;
    private final int maxStep;
    private final RandomSource random;
    private final boolean debug;

    private Position playerOnePos;
    private Position playerTwoPos;
    /** 0 when player A is to move, 1 for player B. */
    private int turn;
    private int turnCount;
    private EndgameResult latestResult;

    /** Wall-clock nanoseconds each player spent per turn. */
    private final List<Long> playerOneTimes = new ArrayList<>();
    private final List<Long> playerTwoTimes = new ArrayList<>();

    /**
     * Creates a world from an explicit board and starting positions. Player A moves first.
     *
     * @throws IllegalArgumentException if a position is off the board or both positions coincide
     */
    public World(Player playerOne, Player playerTwo, Board board,
                 Position playerOnePos, Position playerTwoPos, RandomSource random) {
        this(playerOne, playerTwo, board, playerOnePos, playerTwoPos, random, false);
    }

    private World(Player playerOne, Player playerTwo, Board board,
                  Position playerOnePos, Position playerTwoPos, RandomSource random, boolean debug) {
        this.playerOne = Objects.requireNonNull(playerOne, "playerOne");
        this.playerTwo = Objects.requireNonNull(playerTwo, "playerTwo");
        this.board = Objects.requireNonNull(board, "board");
        this.random = Objects.requireNonNull(random, "random");
        this.debug = debug;
        if (!board.inBounds(playerOnePos) || !board.inBounds(playerTwoPos)) {
            throw new IllegalArgumentException(
                    "Start positions " + playerOnePos + " and " + playerTwoPos + " must be on the board");
        }
        if (playerOnePos.equals(playerTwoPos)) {
            throw new IllegalArgumentException("Players cannot start on the same cell " + playerOnePos);
        }
        this.maxStep = board.getMaxStep();
        this.playerOnePos = playerOnePos;
        this.playerTwoPos = playerTwoPos;
        this.latestResult = ConnectivityAnalyzer.checkEndgame(board, playerOnePos, playerTwoPos);
    }

    /**
     * Creates a world on a random board.
     * <p>
     * The board gets border walls plus point-symmetric random walls. Player A starts on a random cell
     * and player B on its point mirror; the positions (never the walls) are re-rolled until they differ
     * and the players are not already separated.
     *
     * @param boardSize board size, or {@code null} for a random size in
     *                  [{@link Board#MIN_BOARD_SIZE}, {@link Board#MAX_BOARD_SIZE})
     * @param autoplay  when true, both players must support unattended play
     * @param debug     exposed to renderers
     * @throws IllegalArgumentException if autoplay is requested and a player does not support it
     */
    public static World create(Player playerOne, Player playerTwo, Integer boardSize,
                               boolean autoplay, boolean debug, RandomSource random) {
        Objects.requireNonNull(playerOne, "playerOne");
        Objects.requireNonNull(playerTwo, "playerTwo");
        Objects.requireNonNull(random, "random");
        log.info("Initialize the game world");
        if (autoplay && (!playerOne.isAutoplay() || !playerTwo.isAutoplay())) {
            throw new IllegalArgumentException(String.format(
                    "Autoplay mode is not supported by one of the agents (%s -> %s, %s -> %s).",
                    playerOne.getClass().getSimpleName(), playerOne.isAutoplay(),
                    playerTwo.getClass().getSimpleName(), playerTwo.isAutoplay()));
        }

        int size;
        if (boardSize == null) {
            size = random.nextInt(Board.MIN_BOARD_SIZE, Board.MAX_BOARD_SIZE);
            log.info("No board size specified. Randomly generating size : {}x{}", size, size);
        } else {
            size = boardSize;
            log.info("Setting board size to {}x{}", size, size);
        }

        Board board = Board.random(size, random);
        Position a = randomPosition(size, random);
        Position b = a.mirror(size);
        while (a.equals(b) || ConnectivityAnalyzer.checkEndgame(board, a, b).ended()) {
            a = randomPosition(size, random);
            b = a.mirror(size);
        }
        return new World(playerOne, playerTwo, board, a, b, random, debug);
    }

    private static Position randomPosition(int size, RandomSource random) {
        return new Position(random.nextInt(size), random.nextInt(size));
    }

    /**
     * Plays one turn.
     *
     * @return the endgame result after the turn
     * @throws GameAbortException    if the active player aborted the game
     * @throws IllegalStateException if the game has already ended
     */
    public EndgameResult step() {
        if (latestResult.ended()) {
            throw new IllegalStateException("The game has already ended: " + latestResult);
        }
        Player current = turn == 0 ? playerOne : playerTwo;
        Position curPos = turn == 0 ? playerOnePos : playerTwoPos;
        Position advPos = turn == 0 ? playerTwoPos : playerOnePos;

        long startNanos = System.nanoTime();
        MoveOutcome outcome = requestMove(current, curPos, advPos);
        long elapsedNanos = System.nanoTime() - startNanos;
        (turn == 0 ? playerOneTimes : playerTwoTimes).add(elapsedNanos);

        Move move;
        switch (outcome.getKind()) {
            case FATAL_ABORT:
                log.info("Player {} aborted the game: {}", playerName(turn), outcome.getReason());
                throw (GameAbortException) outcome.getCause();
            case INVALID:
                if (outcome.getCause() != null) {
                    log.warn("Player {} failed to produce a move: {}", playerName(turn), outcome.getReason(),
                            outcome.getCause());
                } else {
                    log.warn("Player {} produced an invalid move: {}", playerName(turn), outcome.getReason());
                }
                log.warn("Execute Random Walk!");
                move = RandomWalk.randomWalk(board, curPos, advPos, maxStep, random);
                break;
            default:
                move = outcome.getMove();
                break;
        }

        log.info("Player {} moves to {} facing {}. Time taken this turn (in seconds): {}",
                playerName(turn), move.destination(), move.direction(), elapsedNanos / 1e9);
        if (turn == 0) {
            playerOnePos = move.destination();
        } else {
            playerTwoPos = move.destination();
        }
        board.setWall(move.destination(), move.direction());

        turn = 1 - turn;
        turnCount++;

        latestResult = ConnectivityAnalyzer.checkEndgame(board, playerOnePos, playerTwoPos);
        if (latestResult.ended()) {
            logGameEnd(latestResult);
        }
        return latestResult;
    }

    /**
     * Calls the player and validates what it returns. Every failure raised by the player, errors
     * such as {@link StackOverflowError} or {@link AssertionError} included, is folded into the
     * returned outcome. Only a {@link VirtualMachineError} other than a stack overflow escapes.
     */
    MoveOutcome requestMove(Player player, Position curPos, Position advPos) {
        Move move;
        try {
            move = player.step(board.copy(), curPos, advPos, maxStep);
        } catch (GameAbortException e) {
            return MoveOutcome.fatalAbort(e);
        } catch (StackOverflowError e) {
            return MoveOutcome.invalid("Stack overflow in " + player.getClass().getSimpleName(), e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            return MoveOutcome.invalid("An exception was raised by " + player.getClass().getSimpleName(), e);
        }
        return validate(move, curPos, advPos);
    }

    private MoveOutcome validate(Move move, Position curPos, Position advPos) {
        if (move == null || move.destination() == null) {
            return MoveOutcome.invalid("No end position was returned");
        }
        Position next = move.destination();
        if (!board.inBounds(next)) {
            return MoveOutcome.invalid("End position " + next + " is out of boundary");
        }
        Direction dir = move.direction();
        if (dir == null) {
            return MoveOutcome.invalid("Barrier dir should reside in [0, 3], but no dir was given");
        }
        if (!ReachabilityValidator.checkValidStep(board, curPos, next, dir, advPos, maxStep)) {
            return MoveOutcome.invalid(String.format(
                    "Not a valid step from %s to %s and put barrier at %s, with max steps = %d",
                    curPos, next, dir, maxStep));
        }
        return MoveOutcome.valid(move);
    }

    private void logGameEnd(EndgameResult result) {
        if (result.isTie()) {
            log.info("Game ends! It is a Tie!");
        } else {
            String winner = result.winner().orElseThrow();
            int blocks = Math.max(result.scoreA(), result.scoreB());
            log.info("Game ends! Player {} wins having control over {} blocks!", winner, blocks);
        }
    }

    private static String playerName(int turn) {
        return turn == 0 ? EndgameResult.PLAYER_A : EndgameResult.PLAYER_B;
    }

    public boolean isEnded() {
        return latestResult.ended();
    }

    /** Result of the most recent endgame check. */
    public EndgameResult getLatestResult() {
        return latestResult;
    }

    public int getBoardSize() {
        return board.getSize();
    }

    /**
     * Returns a snapshot of the board; changes to it do not affect the game.
     */
    public Board getBoard() {
        return board.copy();
    }

    /** Fresh {@code [row][col][direction]} copy of the wall bits. */
    public boolean[][][] getWalls() {
        return board.getWalls();
    }

    public Position getPlayerOnePosition() {
        return playerOnePos;
    }

    public Position getPlayerTwoPosition() {
        return playerTwoPos;
    }

    public Player getPlayerOne() {
        return playerOne;
    }

    public Player getPlayerTwo() {
        return playerTwo;
    }

    /** 0 when player A moves next, 1 for player B. */
    public int getTurn() {
        return turn;
    }

    public int getTurnCount() {
        return turnCount;
    }

    public int getMaxStep() {
        return maxStep;
    }

    public boolean isDebug() {
        return debug;
    }

    public List<Long> getPlayerOneTimes() {
        return Collections.unmodifiableList(playerOneTimes);
    }

    public List<Long> getPlayerTwoTimes() {
        return Collections.unmodifiableList(playerTwoTimes);
    }
}
