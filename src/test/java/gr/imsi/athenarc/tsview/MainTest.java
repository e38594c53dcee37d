package gr.imsi.athenarc.tsview;

import com.beust.jcommander.JCommander;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import gr.imsi.athenarc.tsview.config.ServiceConfiguration;
import gr.imsi.athenarc.tsview.exception.UnknownEntityException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTest {

    @TempDir
    Path workDir;

    private Path input;
    private ServiceConfiguration configuration;
    private PrintStream originalOut;
    private ByteArrayOutputStream captured;

    @BeforeEach
    public void setUp() throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add("time,load,site");
        for (int hour = 0; hour < 100; hour++) {
            lines.add(String.format("2020-01-%02d %02d:00:00,%d,site-%d", 1 + hour / 24, hour % 24, hour, hour % 2));
        }
        input = workDir.resolve("load.csv");
        Files.write(input, lines, StandardCharsets.UTF_8);
        configuration = ServiceConfiguration.builder()
                .dataDir(workDir.resolve("data"))
                .metadataDir(workDir.resolve("metadata"))
                .build();

        originalOut = System.out;
        captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    public void restoreOut() {
        System.setOut(originalOut);
    }

    private static void run(ServiceConfiguration configuration, String... args) throws IOException {
        Main main = new Main();
        new JCommander(main).parse(args);
        main.run(configuration);
    }

    private String stdout() {
        return new String(captured.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testInspectReportsColumnsAndFrequency() throws IOException {
        run(configuration, "-mode", "inspect", "-input", input.toString());

        String report = stdout();
        assertTrue(report.contains("rows,100"), report);
        assertTrue(report.contains("series,load"), report);
        assertTrue(report.contains("timestamps,time"), report);
        assertTrue(report.contains("frequency,PT1H"), report);
    }

    @Test
    public void testAggregateWritesAtMostMaxPointsRows() throws IOException {
        Path out = workDir.resolve("out/aggregated.csv");

        run(configuration, "-mode", "aggregate", "-input", input.toString(), "-out", out.toString(),
                "-maxPoints", "10");

        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(11, lines.size());
        assertEquals("time,load,site", lines.get(0));
        assertEquals("2020-01-01 00:00:00.000,4.5,site-0", lines.get(1));
    }

    @Test
    public void testRegisteredDatasetCanBeViewed() throws IOException {
        run(configuration, "-mode", "register", "-input", input.toString(), "-name", "load");
        String datasetId = stdout().trim();
        captured.reset();

        Path out = workDir.resolve("view.csv");
        run(configuration, "-mode", "view", "-dataset", datasetId, "-series", "load",
                "-offset", "10", "-limit", "5", "-out", out.toString());

        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(6, lines.size());
        assertEquals("timestamp,load", lines.get(0));
        assertEquals("2020-01-01 10:00:00.000,10.0", lines.get(1));
    }

    @Test
    public void testListShowsRegisteredDatasets() throws IOException {
        run(configuration, "-mode", "register", "-input", input.toString(), "-name", "load");
        String datasetId = stdout().trim();
        captured.reset();

        run(configuration, "-mode", "list");

        String[] lines = stdout().trim().split("\\R");
        assertEquals(2, lines.length);
        assertEquals("id,name,file,rows,series,conditions", lines[0]);
        assertTrue(lines[1].startsWith(datasetId + ",load,load.tsv.bin,100,load,"), lines[1]);
    }

    @Test
    public void testDeleteByNameRemovesDatasetAndDataFile() throws IOException {
        run(configuration, "-mode", "register", "-input", input.toString(), "-name", "load");
        String datasetId = stdout().trim();
        captured.reset();

        run(configuration, "-mode", "delete", "-name", "load");

        assertEquals(datasetId, stdout().trim());
        assertFalse(Files.exists(workDir.resolve("data").resolve("load.tsv.bin")));
        captured.reset();
        run(configuration, "-mode", "list");
        assertEquals("id,name,file,rows,series,conditions", stdout().trim());
    }

    @Test
    public void testDeleteById() throws IOException {
        run(configuration, "-mode", "register", "-input", input.toString(), "-name", "load");
        String datasetId = stdout().trim();
        captured.reset();

        run(configuration, "-mode", "delete", "-dataset", datasetId);

        assertEquals(datasetId, stdout().trim());
        assertThrows(UnknownEntityException.class, () -> run(configuration, "-mode", "delete", "-dataset", datasetId));
    }

    @Test
    public void testUnknownModeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> run(configuration, "-mode", "plot"));
    }
}
