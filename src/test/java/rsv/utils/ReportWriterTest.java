package rsv.utils;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import rsv.sync.ComparisonMode;
import rsv.sync.ComparisonOrchestrator;
import rsv.sync.ComparisonReport;
import rsv.sync.ComparisonResult;
import rsv.sync.ComparisonSettings;
import rsv.sync.ComponentProfile;
import rsv.sync.FakeSparqlTransport;
import rsv.sync.FilterSet;
import rsv.sync.SparqlStore;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ReportWriterTest {

    private static final String ST = "https://stardog.example.org/query";
    private static final String GDB = "https://graphdb.example.org/query";
    private static final SparqlStore STARDOG = new SparqlStore("LINDAS PROD", ST, "https://example.org/graph/st");
    private static final SparqlStore GRAPHDB = new SparqlStore("LINDASnext PROD", GDB, "https://example.org/graph/gdb");
    private static final ComponentProfile CUBE = new ComponentProfile("cube", "https://cube.link/Cube",
            ComparisonMode.ENTITY_METADATA, true, false);

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static String triple(String s, String o) {
        return "<https://example.org/" + s + "> <http://schema.org/name> \"" + o + "\" .\n";
    }

    @Test
    public void testComponentArtifacts() throws Exception {
        FakeSparqlTransport transport = new FakeSparqlTransport()
                .population(ST, "https://example.org/a", "https://example.org/b")
                .population(GDB, "https://example.org/b", "https://example.org/c")
                .construct(ST, "<https://example.org/b>", triple("b", "Before, \\\"quoted\\\""))
                .construct(GDB, "<https://example.org/b>", triple("b", "After"));
        ComparisonReport report = new ComparisonOrchestrator(transport, ComparisonSettings.defaults())
                .compareComponent(STARDOG, GRAPHDB, CUBE, FilterSet.none());

        Path out = folder.getRoot().toPath().resolve("out");
        List<Path> written = new ReportWriter(out).write(report);

        List<String> csv = Files.readAllLines(out.resolve("cube_report.csv"), StandardCharsets.UTF_8);
        assertEquals(ReportWriter.CSV_HEADER, csv.get(0));
        assertEquals(2, csv.size());
        assertTrue(csv.get(1).startsWith("https://example.org/b,False,1,MISMATCH,1,"));

        assertEquals(List.of("https://example.org/a"),
                Files.readAllLines(out.resolve("cube_only_in_lindas_prod.txt"), StandardCharsets.UTF_8));
        assertEquals(List.of("https://example.org/c"),
                Files.readAllLines(out.resolve("cube_only_in_lindasnext_prod.txt"), StandardCharsets.UTF_8));
        List<String> fetched = Files.readAllLines(out.resolve("cube_lindas_prod.nt"), StandardCharsets.UTF_8);
        assertEquals("<https://example.org/b> <http://schema.org/name> \"Before, \\\"quoted\\\"\" .", fetched.get(0));
        assertEquals(5, written.size());
    }

    @Test
    public void testWholeGraphVerified() throws Exception {
        FakeSparqlTransport transport = new FakeSparqlTransport()
                .construct(ST, "?s ?p ?o", triple("b", "B") + triple("a", "A"))
                .construct(GDB, "?s ?p ?o", triple("a", "A") + triple("b", "B"));
        ComparisonReport report = new ComparisonOrchestrator(transport, ComparisonSettings.defaults())
                .compareWholeGraphs(STARDOG, GRAPHDB, FilterSet.none());

        Path out = folder.getRoot().toPath();
        new ReportWriter(out).write(report);

        List<String> verified = Files.readAllLines(out.resolve("full_verified.nt"), StandardCharsets.UTF_8);
        assertEquals(2, verified.size());
        assertTrue(verified.get(0).startsWith("<https://example.org/a>"));
        assertFalse(Files.exists(out.resolve("full_only_in_lindas_prod.nt")));
        assertTrue(ReportWriter.summary(report).contains("ALL_MATCHED"));
    }

    @Test
    public void testWholeGraphDifferences() throws Exception {
        FakeSparqlTransport transport = new FakeSparqlTransport()
                .construct(ST, "?s ?p ?o", triple("a", "A") + triple("b", "B"))
                .construct(GDB, "?s ?p ?o", triple("a", "A"));
        ComparisonReport report = new ComparisonOrchestrator(transport, ComparisonSettings.defaults())
                .compareWholeGraphs(STARDOG, GRAPHDB, FilterSet.none());

        Path out = folder.getRoot().toPath();
        List<Path> written = new ReportWriter(out).write(report);

        assertEquals(List.of(triple("b", "B").trim()),
                Files.readAllLines(out.resolve("full_only_in_lindas_prod.nt"), StandardCharsets.UTF_8));
        assertFalse(Files.exists(out.resolve("full_only_in_lindasnext_prod.nt")));
        assertFalse(Files.exists(out.resolve("full_verified.nt")));
        assertEquals(2, written.size());
    }

    @Test
    public void testCsvEscaping() {
        assertEquals("plain", ReportWriter.escapeCsv("plain"));
        assertEquals("\"a,b\"", ReportWriter.escapeCsv("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", ReportWriter.escapeCsv("say \"hi\""));
        assertEquals("\"two\nlines\"", ReportWriter.escapeCsv("two\nlines"));
    }

    @Test
    public void testErrorRow() {
        ComparisonResult error = ComparisonResult.error("https://example.org/x", STARDOG, new Exception("timed out after 60s"));
        String row = ReportWriter.toCsvRow(error);
        assertTrue(row.startsWith("https://example.org/x,False,-1,ERROR,-1,"));
        assertTrue(row.contains("timed out after 60s"));
    }

    @Test
    public void testSlug() {
        assertEquals("lindasnext_prod", Utils.slug("LINDASnext PROD"));
        assertEquals("forest_fire_prevention", Utils.slug(" Forest Fire Prevention "));
        assertEquals("store", Utils.slug("***"));
    }
}
