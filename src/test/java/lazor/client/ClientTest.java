package lazor.client;

import lazor.planning.SearchConfig;
import lazor.simulation.CollisionModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClientTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        Client client = new Client(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return client.run(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("a solved board prints its report and exits 0")
    void singleBoardToStdout() {
        int status = run("--time-limit", "30", BoardParserTest.resource("boards/four_lasers.bff").toString());

        assertEquals(Client.EXIT_SOLVED, status);
        assertTrue(stdout().contains("Solution Status: SOLVED"));
        assertFalse(stdout().contains("SUMMARY"));
    }

    @Test
    @DisplayName("batch over a directory writes one report per board and a summary")
    void batchDirectory() throws IOException {
        Path boards = BoardParserTest.resource("boards");
        Path outDir = tempDir.resolve("reports");

        int status = run("--time-limit", "30", "--out", outDir.toString(), boards.toString());

        assertEquals(Client.EXIT_UNSOLVED, status);
        assertTrue(Files.exists(outDir.resolve("four_lasers_solution.txt")));
        assertTrue(Files.exists(outDir.resolve("surplus_solution.txt")));
        assertTrue(Files.exists(outDir.resolve("three_lasers_solution.txt")));
        assertTrue(stdout().contains("[+] SOLVED   four_lasers"), stdout());
        assertTrue(stdout().contains("[+] SOLVED   surplus"), stdout());
        assertTrue(stdout().contains("[-] FAILED   three_lasers"), stdout());
    }

    @Test
    void parallelModeSolves() {
        int status = run("--seeds", "0,1,2", "--time-limit", "30",
                BoardParserTest.resource("boards/surplus.bff").toString());

        assertEquals(Client.EXIT_SOLVED, status);
        assertTrue(stdout().contains("search mode: MULTI_SEED"));
    }

    @Test
    @DisplayName("an unreadable board is reported and the batch continues")
    void invalidBoardContinuesBatch() {
        int status = run("--time-limit", "30",
                BoardParserTest.resource("invalid/no_grid.bff").toString(),
                BoardParserTest.resource("boards/four_lasers.bff").toString());

        assertEquals(Client.EXIT_UNSOLVED, status);
        assertTrue(stdout().contains("[-] FAILED   no_grid.bff (error)"), stdout());
        assertTrue(stdout().contains("[+] SOLVED   four_lasers"), stdout());
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Invalid board"));
    }

    @Test
    void usageErrors() {
        assertEquals(Client.EXIT_USAGE, run());
        assertEquals(Client.EXIT_USAGE, run("--bogus", "x.bff"));
        assertEquals(Client.EXIT_USAGE, run("--collision", "sideways", "x.bff"));
        assertEquals(Client.EXIT_USAGE, run("--time-limit"));
        assertEquals(Client.EXIT_USAGE, run("--max-nodes", "lots", "x.bff"));
        assertEquals(Client.EXIT_USAGE, run("--seeds", "1,4294967297", "x.bff"));
        assertEquals(Client.EXIT_USAGE, run(tempDir.toString()));
    }

    @Test
    void optionsOverrideDefaults() {
        Client.Options options = Client.parseArguments(new String[] {
                "--collision", "center", "--time-limit", "2.5", "--seed", "9",
                "--max-nodes", "500", "--seeds", "4,6", "a.bff", "b.bff"});

        SearchConfig config = options.config;
        assertEquals(CollisionModel.CENTER, config.getCollisionModel());
        assertEquals(2_500, config.getTimeoutMs());
        assertEquals(9, config.getSeed());
        assertEquals(500, config.getMaxNodes());
        assertArrayEquals(new int[] {4, 6}, config.getSeeds());
        assertTrue(config.isParallel());
        assertEquals(List.of(Path.of("a.bff"), Path.of("b.bff")), options.inputs);
        assertNull(options.outDir);
    }

    @Test
    void seedsOutsideTheIntRangeAreRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Client.parseArguments(new String[] {"--seeds", "4294967297", "a.bff"}));
        assertTrue(e.getMessage().contains("--seeds"));
    }

    @Test
    void directoriesExpandToSortedBoardFiles() throws IOException {
        Files.writeString(tempDir.resolve("b.bff"), "");
        Files.writeString(tempDir.resolve("a.bff"), "");
        Files.writeString(tempDir.resolve("notes.txt"), "");

        List<Path> boards = Client.collectBoards(Arrays.asList(tempDir));
        assertEquals(List.of(tempDir.resolve("a.bff"), tempDir.resolve("b.bff")), boards);
    }
}
