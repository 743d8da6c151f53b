package lazor.client;

import lazor.domain.Board;
import lazor.domain.BlockType;
import lazor.domain.Cell;
import lazor.domain.CellKind;
import lazor.domain.Point;
import lazor.planning.Solution;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Renders a solution as a plain-text report.
 *
 * Fixed blocks print in brackets, placed blocks bare, open cells as
 * {@code o} and forbidden cells as {@code x}.
 */
public class SolutionWriter {

    private static final String RULE = "=".repeat(50);

    /**
     * @return the full report text
     */
    public String format(Solution solution) {
        Board board = solution.getBoard();
        StringBuilder sb = new StringBuilder();
        sb.append("LAZOR BOARD SOLUTION: ").append(board.getName()).append('\n');
        sb.append(RULE).append("\n\n");

        sb.append("Board Configuration:\n");
        for (int row = 0; row < board.getHeight(); row++) {
            StringBuilder line = new StringBuilder();
            for (int col = 0; col < board.getWidth(); col++) {
                line.append(cellText(board, solution, col, row));
            }
            sb.append(stripTrailing(line)).append('\n');
        }

        sb.append('\n').append(RULE).append('\n');
        sb.append("Block Placement:\n");
        if (solution.getPlacement().isEmpty()) {
            sb.append("  (no movable blocks placed)\n");
        }
        for (Map.Entry<Cell, BlockType> e : solution.getPlacement().entrySet()) {
            Cell cell = e.getKey();
            sb.append(String.format("  Block %c at grid position (%d, %d)\n", e.getValue().symbol, cell.col, cell.row));
        }

        sb.append('\n').append(RULE).append('\n');
        sb.append("Target Points Hit:\n");
        for (Map.Entry<Point, Boolean> e : solution.getTargetHits().entrySet()) {
            sb.append("  ").append(e.getValue() ? "[+]" : "[-]").append(" Point ").append(e.getKey()).append('\n');
        }

        sb.append('\n').append(RULE).append('\n');
        sb.append("Solution Status: ").append(solution.isSolved() ? "SOLVED" : "NOT SOLVED").append('\n');
        sb.append(String.format("Targets hit: %d/%d\n", solution.getHitCount(), solution.getTargetCount()));
        sb.append(String.format("Elapsed: %d ms, nodes: %d\n", solution.getElapsedMs(), solution.getNodesExpanded()));
        sb.append(String.format("Seed: %d, collision model: %s, search mode: %s\n",
                solution.getSeed(), solution.getCollisionModel(), solution.getSearchMode()));
        return sb.toString();
    }

    /**
     * Writes the report to a file, replacing any existing one.
     *
     * @throws IOException if writing fails
     */
    public void write(Solution solution, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, format(solution), StandardCharsets.UTF_8);
    }

    private String cellText(Board board, Solution solution, int col, int row) {
        CellKind kind = board.getKind(col, row);
        switch (kind) {
            case FIXED:
                return "[" + board.getFixedBlock(col, row).symbol + "] ";
            case FORBIDDEN:
                return " x  ";
            default:
                BlockType placed = solution.getPlacedBlock(Cell.of(col, row));
                return placed != null ? " " + placed.symbol + "  " : " o  ";
        }
    }

    private static String stripTrailing(StringBuilder line) {
        int end = line.length();
        while (end > 0 && line.charAt(end - 1) == ' ') {
            end--;
        }
        return line.substring(0, end);
    }
}
