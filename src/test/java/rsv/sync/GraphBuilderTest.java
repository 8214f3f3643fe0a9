package rsv.sync;

import org.junit.Test;
import rsv.sync.model.RdfGraph;
import rsv.sync.model.RdfTriple;
import rsv.sync.model.Term;
import rsv.sync.transport.RdfSyntax;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class GraphBuilderTest {

    private static final String TURTLE = "@prefix ex: <http://example.org/> .\n"
            + "@prefix dcat: <http://www.w3.org/ns/dcat#> .\n"
            + "ex:cube ex:name \"Caf\u00e9\"@fr ;\n"
            + "    dcat:dateModified \"2024-01-01\" ;\n"
            + "    ex:shape [ ex:path ex:height ; ex:minCount 1 ] .\n";

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testParseTurtle() throws Exception {
        RdfGraph graph = GraphBuilder.parse(bytes(TURTLE), RdfSyntax.TURTLE, FilterSet.none());
        assertEquals(5, graph.size());
        assertEquals(1, graph.blankNodes().size());
        assertTrue(graph.contains(RdfTriple.of(Term.iri("http://example.org/cube"), Term.iri("http://example.org/name"),
                Term.langLiteral("Caf\u00e9", "fr"))));
    }

    @Test
    public void testExcludedPredicatesDropped() throws Exception {
        FilterSet filters = FilterSet.of("http://www.w3.org/ns/dcat#dateModified");
        RdfGraph graph = GraphBuilder.parse(bytes(TURTLE), RdfSyntax.TURTLE, filters);
        assertEquals(4, graph.size());
        for (RdfTriple triple : graph) {
            assertTrue(!triple.getPredicate().getValue().endsWith("dateModified"));
        }
    }

    @Test
    public void testFilteringOnlyShrinks() throws Exception {
        RdfGraph unfiltered = GraphBuilder.parse(bytes(TURTLE), RdfSyntax.TURTLE, FilterSet.none());
        RdfGraph filtered = GraphBuilder.parse(bytes(TURTLE), RdfSyntax.TURTLE,
                FilterSet.of("http://www.w3.org/ns/dcat#dateModified", "http://example.org/minCount"));
        for (RdfTriple triple : filtered) {
            assertTrue(unfiltered.contains(triple) || triple.hasBlankNode());
        }
        assertEquals(unfiltered.size() - 2, filtered.size());
    }

    @Test
    public void testLiteralsNormalizedOnParse() throws Exception {
        String ntriples = "<http://example.org/s> <http://example.org/p> \"cafe\u0301\" .\n";
        RdfGraph graph = GraphBuilder.parse(bytes(ntriples), RdfSyntax.NTRIPLES, FilterSet.none());
        RdfTriple triple = graph.getTriples().iterator().next();
        assertEquals("caf\u00e9", triple.getObject().asLiteral().getLexical());
    }

    @Test
    public void testSimpleAndStringTypedLiteralsCollapse() throws Exception {
        String ntriples = "<http://example.org/s> <http://example.org/p> \"a\" .\n"
                + "<http://example.org/s> <http://example.org/p> \"a\"^^<http://www.w3.org/2001/XMLSchema#string> .\n";
        RdfGraph graph = GraphBuilder.parse(bytes(ntriples), RdfSyntax.NTRIPLES, FilterSet.none());
        assertEquals(1, graph.size());
    }

    @Test
    public void testEmptyPayloadGivesEmptyGraph() throws Exception {
        assertTrue(GraphBuilder.parse(new byte[0], RdfSyntax.NTRIPLES, FilterSet.none()).isEmpty());
    }

    @Test
    public void testMalformedPayload() {
        try {
            GraphBuilder.parse(bytes("<http://example.org/s> <http://example.org/p> \"unterminated .\n"),
                    RdfSyntax.NTRIPLES, FilterSet.none());
            fail("Expected GraphParseException");
        } catch (GraphParseException e) {
            assertTrue(e.getMessage().contains("NTRIPLES"));
        }
    }

    @Test
    public void testHtmlErrorPageRejected() {
        try {
            GraphBuilder.parse(bytes("<html><body>Service unavailable</body></html>"), RdfSyntax.TURTLE, FilterSet.none());
            fail("Expected GraphParseException");
        } catch (GraphParseException e) {
            assertTrue(e.getCause() != null);
        }
    }

    @Test
    public void testInvalidUtf8Rejected() {
        byte[] truncated = {'<', 'h', 't', 't', 'p', ':', '/', '/', 'a', '>', ' ',
                '<', 'h', 't', 't', 'p', ':', '/', '/', 'p', '>', ' ', '"', (byte) 0xC3, '(', '"', ' ', '.', '\n'};
        try {
            GraphBuilder.parse(truncated, RdfSyntax.NTRIPLES, FilterSet.none());
            fail("Expected GraphParseException");
        } catch (GraphParseException e) {
            assertTrue(e.getMessage().contains("UTF-8"));
        }
    }

    @Test
    public void testLatin1PayloadRejected() {
        byte[] latin1 = "<http://a> <http://p> \"caf\u00e9\" .\n".getBytes(StandardCharsets.ISO_8859_1);
        try {
            GraphBuilder.parse(latin1, RdfSyntax.TURTLE, FilterSet.none());
            fail("Expected GraphParseException");
        } catch (GraphParseException e) {
            assertTrue(e.getCause() instanceof java.nio.charset.CharacterCodingException);
        }
    }
}
