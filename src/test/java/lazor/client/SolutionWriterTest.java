package lazor.client;

import lazor.domain.Board;
import lazor.planning.PlacementSearch;
import lazor.planning.SearchConfig;
import lazor.planning.Solution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SolutionWriterTest {

    @TempDir
    Path tempDir;

    private static Solution solve(String resource) throws IOException {
        Board board = new BoardParser().parseFile(BoardParserTest.resource(resource));
        SearchConfig config = SearchConfig.defaults();
        config.setTimeoutMs(30_000);
        return new PlacementSearch(config).search(board);
    }

    @Test
    @DisplayName("report shows the board, placements, target status and metadata")
    void solvedReport() throws IOException {
        String report = new SolutionWriter().format(solve("boards/four_lasers.bff"));

        assertTrue(report.startsWith("LAZOR BOARD SOLUTION: four_lasers"));
        assertTrue(report.contains(" C   x   x"), report);
        assertTrue(report.contains(" x  [B]  x"), report);
        assertTrue(report.contains(" x   x   A"), report);
        assertTrue(report.contains("Block C at grid position (0, 0)"));
        assertTrue(report.contains("Block A at grid position (2, 2)"));
        assertTrue(report.contains("[+] Point (1,6)"));
        assertFalse(report.contains("[-]"));
        assertTrue(report.contains("Solution Status: SOLVED"));
        assertTrue(report.contains("Targets hit: 4/4"));
        assertTrue(report.contains("collision model: WALL, search mode: SINGLE"));
    }

    @Test
    void unsolvedReportMarksDarkTargets() throws IOException {
        String report = new SolutionWriter().format(solve("boards/three_lasers.bff"));

        assertTrue(report.contains("Solution Status: NOT SOLVED"));
        assertTrue(report.contains("Targets hit: 3/4"));
        assertEquals(1, report.split("\\[-\\]", -1).length - 1, report);
    }

    @Test
    void writesReportToFile() throws IOException {
        Solution solution = solve("boards/four_lasers.bff");
        Path file = tempDir.resolve("out").resolve("four_lasers_solution.txt");

        new SolutionWriter().write(solution, file);

        assertTrue(Files.exists(file));
        assertEquals(new SolutionWriter().format(solution), Files.readString(file));
    }
}
