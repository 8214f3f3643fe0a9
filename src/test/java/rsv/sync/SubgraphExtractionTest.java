package rsv.sync;

import org.junit.Test;
import rsv.sync.model.RdfGraph;
import rsv.sync.model.RdfTriple;
import rsv.sync.model.Term;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SubgraphExtractionTest {

    private static final Term.Iri SHAPE = Term.iri("http://example.org/shape");
    private static final Term.Iri OTHER = Term.iri("http://example.org/other");

    private static RdfTriple triple(Term s, String p, Term o) {
        return new RdfTriple(s, Term.iri("http://example.org/" + p), o);
    }

    @Test
    public void testFollowsBlankNodesOnly() {
        RdfGraph graph = new RdfGraph();
        graph.add(triple(SHAPE, "property", Term.blank("p1")));
        graph.add(triple(Term.blank("p1"), "in", Term.blank("list")));
        graph.add(triple(Term.blank("list"), "first", Term.literal("a")));
        graph.add(triple(SHAPE, "node", OTHER));
        // reachable only through the IRI object, so owned by the other entity
        graph.add(triple(OTHER, "property", Term.blank("p2")));
        graph.add(triple(Term.blank("p2"), "path", Term.literal("b")));

        RdfGraph closure = SubgraphExtraction.blankNodeClosure(graph, SHAPE);
        assertEquals(4, closure.size());
        assertTrue(closure.contains(triple(SHAPE, "node", OTHER)));
        assertFalse(closure.contains(triple(Term.blank("p2"), "path", Term.literal("b"))));
    }

    @Test
    public void testBlankCycleTerminates() {
        RdfGraph graph = new RdfGraph();
        graph.add(triple(SHAPE, "p", Term.blank("a")));
        graph.add(triple(Term.blank("a"), "p", Term.blank("b")));
        graph.add(triple(Term.blank("b"), "p", Term.blank("a")));
        assertEquals(3, SubgraphExtraction.blankNodeClosure(graph, SHAPE).size());
    }

    @Test
    public void testUnknownRootGivesEmptyGraph() {
        RdfGraph graph = new RdfGraph();
        graph.add(triple(OTHER, "p", Term.literal("x")));
        assertTrue(SubgraphExtraction.blankNodeClosure(graph, SHAPE).isEmpty());
    }
}
