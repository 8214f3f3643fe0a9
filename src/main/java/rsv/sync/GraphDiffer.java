package rsv.sync;

import rsv.sync.model.RdfGraph;
import rsv.sync.model.RdfTriple;

/**
 * Structural equality and triple-level difference of two graphs, computed over their
 * canonical forms so that blank node labels do not matter.
 */
public class GraphDiffer {

    private final Canonicalizer canonicalizer;

    public GraphDiffer(Canonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    public boolean equal(RdfGraph first, RdfGraph second) {
        return canonicalizer.isomorphic(first, second);
    }

    public GraphDiff diff(RdfGraph first, RdfGraph second) {
        return diff(canonicalizer.canonicalize(first), canonicalizer.canonicalize(second));
    }

    public static GraphDiff diff(CanonicalGraph first, CanonicalGraph second) {
        RdfGraph shared = new RdfGraph();
        RdfGraph onlyInFirst = new RdfGraph();
        RdfGraph onlyInSecond = new RdfGraph();
        for (RdfTriple triple : first.getTriples()) {
            if (second.contains(triple)) {
                shared.add(triple);
            } else {
                onlyInFirst.add(triple);
            }
        }
        for (RdfTriple triple : second.getTriples()) {
            if (!first.contains(triple)) {
                onlyInSecond.add(triple);
            }
        }
        return new GraphDiff(first, second, shared, onlyInFirst, onlyInSecond);
    }
}
