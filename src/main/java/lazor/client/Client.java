package lazor.client;

import lazor.domain.Board;
import lazor.planning.SearchConfig;
import lazor.planning.SearchStrategy;
import lazor.planning.Solution;
import lazor.planning.StrategySelector;
import lazor.simulation.CollisionModel;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point: solves one or more board files and reports the results.
 *
 * Usage:
 * <pre>
 * lazor [--collision wall|center] [--time-limit seconds] [--seed n]
 *       [--seeds n,n,...] [--parallel] [--max-nodes n] [--out dir] board.bff|dir ...
 * </pre>
 *
 * Reports go to stdout, or one {@code <name>_solution.txt} per board under
 * {@code --out}. Diagnostics go to stderr. Exit status is 0 when every board
 * is solved, 1 when any board fails or stays unsolved, 2 on usage errors.
 */
public class Client {

    public static final int EXIT_SOLVED = 0;
    public static final int EXIT_UNSOLVED = 1;
    public static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: lazor [--collision wall|center] [--time-limit seconds] [--seed n]\n"
            + "             [--seeds n,n,...] [--parallel] [--max-nodes n] [--out dir] board.bff|dir ...";

    /** Report output */
    private final PrintStream out;

    /** Debug output stream */
    private final PrintStream debugOut;

    /**
     * Creates a new Client with standard streams.
     */
    public Client() {
        this(System.out, System.err);
    }

    /**
     * Creates a new Client with custom streams (for testing).
     *
     * @param out report output
     * @param debug debug output stream
     */
    public Client(PrintStream out, PrintStream debug) {
        this.out = out;
        this.debugOut = debug;
    }

    /**
     * Main entry point.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        System.exit(new Client().run(args));
    }

    /**
     * Parsed command line.
     */
    static class Options {
        final SearchConfig config = SearchConfig.defaults();
        final List<Path> inputs = new ArrayList<>();
        Path outDir;
    }

    /**
     * Runs the client on the given arguments.
     *
     * @return the process exit status
     */
    public int run(String[] args) {
        Options options;
        try {
            options = parseArguments(args);
        } catch (IllegalArgumentException e) {
            debugOut.println("[Client] " + e.getMessage());
            debugOut.println(USAGE);
            return EXIT_USAGE;
        }

        List<Path> boards;
        try {
            boards = collectBoards(options.inputs);
        } catch (IOException e) {
            debugOut.println("[Client] Cannot list board files: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (boards.isEmpty()) {
            debugOut.println("[Client] No board files found");
            return EXIT_USAGE;
        }

        List<String> summary = new ArrayList<>();
        boolean allSolved = true;
        for (Path file : boards) {
            Solution solution = solveFile(file, options);
            if (solution == null) {
                allSolved = false;
                summary.add(String.format("[-] FAILED   %s (error)", file.getFileName()));
                continue;
            }
            if (!solution.isSolved()) {
                allSolved = false;
            }
            summary.add(String.format("%s %s (%d/%d targets, %.2fs)",
                    solution.isSolved() ? "[+] SOLVED  " : "[-] FAILED  ",
                    solution.getBoard().getName(), solution.getHitCount(), solution.getTargetCount(),
                    solution.getElapsedMs() / 1000.0));
        }

        if (boards.size() > 1 || options.outDir != null) {
            out.println("========== SUMMARY ==========");
            for (String line : summary) {
                out.println(line);
            }
        }
        return allSolved ? EXIT_SOLVED : EXIT_UNSOLVED;
    }

    /**
     * Solves one board file; failures are reported and yield null so the batch continues.
     */
    private Solution solveFile(Path file, Options options) {
        Board board;
        try {
            board = new BoardParser().parseFile(file);
        } catch (IOException e) {
            debugOut.println("[Client] Cannot read " + file + ": " + e.getMessage());
            return null;
        } catch (IllegalArgumentException e) {
            debugOut.println("[Client] Invalid board " + file + ": " + e.getMessage());
            return null;
        }

        if (SearchConfig.isMinimal()) {
            debugOut.println("[Client] Solving " + board);
        }
        SearchStrategy strategy = new StrategySelector(options.config).selectStrategy(board);
        Solution solution = strategy.search(board);
        if (SearchConfig.isMinimal()) {
            debugOut.println("[Client] " + board.getName() + ": " + solution);
        }

        SolutionWriter writer = new SolutionWriter();
        if (options.outDir == null) {
            out.println(writer.format(solution));
            return solution;
        }
        Path target = options.outDir.resolve(board.getName() + "_solution.txt");
        try {
            writer.write(solution, target);
            if (SearchConfig.isNormal()) {
                debugOut.println("[Client] Report written to " + target);
            }
        } catch (IOException e) {
            debugOut.println("[Client] Cannot write " + target + ": " + e.getMessage());
            return null;
        }
        return solution;
    }

    /**
     * Parses command line flags into options.
     *
     * @throws IllegalArgumentException on unknown flags or bad values
     */
    static Options parseArguments(String[] args) {
        Options options = new Options();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--collision" -> options.config.setCollisionModel(CollisionModel.fromString(value(args, ++i, arg)));
                case "--time-limit" -> {
                    double seconds = parseDouble(value(args, ++i, arg), arg);
                    options.config.setTimeoutMs((long) (seconds * 1000));
                }
                case "--seed" -> options.config.setSeed(parseLong(value(args, ++i, arg), arg));
                case "--seeds" -> {
                    String[] parts = value(args, ++i, arg).split(",");
                    int[] seeds = new int[parts.length];
                    for (int k = 0; k < parts.length; k++) {
                        seeds[k] = parseInt(parts[k].trim(), arg);
                    }
                    options.config.setSeeds(seeds);
                    options.config.setParallel(true);
                }
                case "--parallel" -> options.config.setParallel(true);
                case "--max-nodes" -> options.config.setMaxNodes(parseLong(value(args, ++i, arg), arg));
                case "--out" -> options.outDir = Paths.get(value(args, ++i, arg));
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option " + arg);
                    }
                    options.inputs.add(Paths.get(arg));
                }
            }
        }
        if (options.inputs.isEmpty()) {
            throw new IllegalArgumentException("No board files given");
        }
        return options;
    }

    /**
     * Expands directories into their .bff files, sorted by name.
     */
    static List<Path> collectBoards(List<Path> inputs) throws IOException {
        List<Path> boards = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                List<Path> found = new ArrayList<>();
                try (DirectoryStream<Path> stream = Files.newDirectoryStream(input, "*.bff")) {
                    for (Path p : stream) {
                        found.add(p);
                    }
                }
                found.sort(null);
                boards.addAll(found);
            } else {
                boards.add(input);
            }
        }
        return boards;
    }

    private static String value(String[] args, int i, String flag) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[i];
    }

    private static int parseInt(String s, String flag) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + flag + ": " + s, e);
        }
    }

    private static long parseLong(String s, String flag) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + flag + ": " + s, e);
        }
    }

    private static double parseDouble(String s, String flag) {
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + flag + ": " + s, e);
        }
    }
}
