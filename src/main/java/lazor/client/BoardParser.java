package lazor.client;

import lazor.domain.Board;
import lazor.domain.BlockType;
import lazor.domain.Inventory;
import lazor.domain.Laser;
import lazor.domain.Point;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses board files in the .bff text format.
 *
 * Board format:
 * <pre>
 * # comment
 * GRID START
 * o o o
 * o x B
 * o o o
 * GRID STOP
 * A 2
 * C: 1
 * L 0 1 1 1
 * P 5 6
 * </pre>
 *
 * Grid symbols:
 * - 'o' : Empty cell, a movable block may go here
 * - 'x' : Forbidden cell, no block may go here
 * - 'A' / 'B' / 'C' : fixed Reflect / Opaque / Refract block
 *
 * Inventory lines accept {@code A 2}, {@code A: 2} and {@code A=2}. Laser lines
 * are {@code L x y vx vy}, target lines {@code P x y}, both in lattice coordinates.
 */
public class BoardParser {

    private static final Pattern INVENTORY_LINE = Pattern.compile("^([ABC])\\s*[:=]?\\s*(\\d+)$", Pattern.CASE_INSENSITIVE);

    /**
     * Parses a board file; the board is named after the file.
     *
     * @throws IOException if reading fails
     * @throws IllegalArgumentException if the board is invalid
     */
    public Board parseFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        if (name.toLowerCase().endsWith(".bff")) {
            name = name.substring(0, name.length() - 4);
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader, name);
        }
    }

    /**
     * Parses a board from a BufferedReader, reading to the end of the stream.
     *
     * @param reader the reader to read from
     * @param name board name
     * @return the validated board
     * @throws IOException if reading fails
     * @throws IllegalArgumentException if the board format is invalid
     */
    public Board parse(BufferedReader reader, String name) throws IOException {
        List<String> grid = new ArrayList<>();
        Map<BlockType, Integer> stock = new EnumMap<>(BlockType.class);
        List<Laser> lasers = new ArrayList<>();
        List<Point> targets = new ArrayList<>();

        boolean inGrid = false;
        boolean gridSeen = false;
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            String upper = line.toUpperCase();
            if (upper.startsWith("GRID START")) {
                inGrid = true;
                gridSeen = true;
                continue;
            }
            if (upper.startsWith("GRID STOP")) {
                inGrid = false;
                continue;
            }
            if (inGrid) {
                grid.add(line);
                continue;
            }

            Matcher m = INVENTORY_LINE.matcher(line);
            if (m.matches()) {
                BlockType type = BlockType.fromSymbol(m.group(1).charAt(0));
                stock.put(type, Integer.parseInt(m.group(2)));
                continue;
            }

            if (line.startsWith("L")) {
                int[] nums = parseNumbers(line, 4, "laser", lineNumber);
                lasers.add(Laser.of(nums[0], nums[1], nums[2], nums[3]));
            } else if (line.startsWith("P")) {
                int[] nums = parseNumbers(line, 2, "target", lineNumber);
                targets.add(Point.of(nums[0], nums[1]));
            }
            // Any other line is ignored, as the format allows free-form notes
        }

        if (!gridSeen || grid.isEmpty()) {
            throw new IllegalArgumentException("No GRID found in board " + name);
        }
        return Board.fromRows(name, grid, Inventory.of(stock), lasers, targets);
    }

    /**
     * Reads the integers after the line's leading keyword.
     */
    private int[] parseNumbers(String line, int expected, String what, int lineNumber) {
        String[] parts = line.split("\\s+");
        if (parts.length - 1 < expected) {
            throw new IllegalArgumentException("Invalid " + what + " line " + lineNumber + ": '" + line + "'");
        }
        int[] nums = new int[expected];
        for (int i = 0; i < expected; i++) {
            try {
                nums[i] = Integer.parseInt(parts[i + 1]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + what + " line " + lineNumber + ": '" + line + "'", e);
            }
        }
        return nums;
    }
}
