package rsv.sync;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SparqlQueriesTest {

    private static final String GRAPH = "https://lindas.admin.ch/foen/forest-fire-prevention-measures-cantons";

    @Test
    public void testDiscoveryQuery() {
        assertEquals("SELECT DISTINCT ?item WHERE { GRAPH <" + GRAPH + "> { ?item a <https://cube.link/Cube> . "
                        + "FILTER (isIRI(?item)) } }",
                SparqlQueries.selectEntitiesOfType(GRAPH, "https://cube.link/Cube"));
        assertFalse(SparqlQueries.selectEntitiesOfType(GRAPH, "https://cube.link/Cube").contains("LIMIT"));
    }

    @Test
    public void testWholeGraphQuery() {
        assertEquals("CONSTRUCT { ?s ?p ?o } WHERE { GRAPH <" + GRAPH + "> { ?s ?p ?o .  } }",
                SparqlQueries.constructWholeGraph(GRAPH, FilterSet.none()));
        String filtered = SparqlQueries.constructWholeGraph(GRAPH, FilterSet.of("http://purl.org/dc/terms/modified"));
        assertTrue(filtered.contains("FILTER (?p NOT IN (<http://purl.org/dc/terms/modified>))"));
    }

    @Test
    public void testEntityMetadataQuery() {
        String query = SparqlQueries.constructEntityMetadata(GRAPH, "https://example.org/cube/1",
                FilterSet.of("http://www.w3.org/ns/dcat#dateModified"));
        assertTrue(query.startsWith("CONSTRUCT { <https://example.org/cube/1> ?p ?o . } WHERE { GRAPH <" + GRAPH + ">"));
        assertTrue(query.contains("FILTER (?p NOT IN (<http://www.w3.org/ns/dcat#dateModified>))"));
    }

    @Test
    public void testDeepSubgraphQuery() {
        String query = SparqlQueries.constructDeepSubgraph(GRAPH, "https://example.org/shape/1");
        assertTrue(query.contains("<https://example.org/shape/1> (!<http://nodefault>)* ?n . ?n ?p ?o ."));
        assertTrue(query.contains("FILTER (isBlank(?n) || ?n = <https://example.org/shape/1>)"));
        assertFalse(query.contains("NOT IN"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInjectionRejected() {
        SparqlQueries.constructEntityMetadata(GRAPH, "https://example.org/x> ?p ?o } } #", FilterSet.none());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSpaceRejected() {
        SparqlQueries.selectEntitiesOfType(GRAPH, "https://cube.link/Cube Observation");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyGraphRejected() {
        SparqlQueries.constructWholeGraph("", FilterSet.none());
    }
}
