package ai.colosseum.player;

import ai.colosseum.game.Board;
import ai.colosseum.game.Direction;
import ai.colosseum.game.Move;
import ai.colosseum.game.Position;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Scanner;

/**
 * Human player that reads moves from stdin (CLI).
 * <p>
 * A move is typed as {@code row,col dir}, where {@code dir} is one of {@code u r d l} or a digit
 * {@code 0..3}. Typing {@code quit}, or closing the input, aborts the game.
 */
public class HumanPlayer implements Player {
    private final Scanner scanner;
    private final PrintStream out;

    public HumanPlayer() {
        this(System.in, System.out);
    }

    public HumanPlayer(InputStream in, PrintStream out) {
        this.scanner = new Scanner(in);
        this.out = out;
    }

    @Override
    public Move step(Board board, Position myPos, Position advPos, int maxStep) {
        out.print("You are at " + myPos + ", max steps " + maxStep
                + ". Enter move (row,col dir | quit): ");
        if (!scanner.hasNextLine()) {
            throw new GameAbortException("Input closed");
        }
        String line = scanner.nextLine().trim();
        if ("quit".equalsIgnoreCase(line)) {
            throw new GameAbortException("Player quit");
        }
        return parseMove(line);
    }

    /**
     * Parses {@code row,col dir}. Malformed input raises an unchecked exception, which the engine
     * answers with a random move.
     *
     * @throws IllegalArgumentException if the text is not a move
     */
    static Move parseMove(String line) {
        String[] parts = line.trim().split("\\s+");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected 'row,col dir' but got '" + line + "'");
        }
        String[] coords = parts[0].split(",");
        if (coords.length != 2) {
            throw new IllegalArgumentException("Expected 'row,col' but got '" + parts[0] + "'");
        }
        int row = Integer.parseInt(coords[0].trim());
        int col = Integer.parseInt(coords[1].trim());
        return new Move(new Position(row, col), Direction.parse(parts[1]));
    }

    @Override
    public boolean isAutoplay() {
        return false;
    }
}
