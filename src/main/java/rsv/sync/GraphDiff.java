package rsv.sync;

import rsv.sync.model.RdfGraph;

/**
 * Partition of two canonical graphs into the triples both share and the triples unique to each.
 */
public class GraphDiff {

    private final CanonicalGraph first;
    private final CanonicalGraph second;
    private final RdfGraph shared;
    private final RdfGraph onlyInFirst;
    private final RdfGraph onlyInSecond;

    GraphDiff(CanonicalGraph first, CanonicalGraph second, RdfGraph shared, RdfGraph onlyInFirst, RdfGraph onlyInSecond) {
        this.first = first;
        this.second = second;
        this.shared = shared;
        this.onlyInFirst = onlyInFirst;
        this.onlyInSecond = onlyInSecond;
    }

    public CanonicalGraph getFirst() {
        return first;
    }

    public CanonicalGraph getSecond() {
        return second;
    }

    public RdfGraph getShared() {
        return shared;
    }

    public RdfGraph getOnlyInFirst() {
        return onlyInFirst;
    }

    public RdfGraph getOnlyInSecond() {
        return onlyInSecond;
    }

    public boolean isIdentical() {
        return onlyInFirst.isEmpty() && onlyInSecond.isEmpty();
    }

    @Override
    public String toString() {
        return "GraphDiff{shared=" + shared.size()
                + ", onlyInFirst=" + onlyInFirst.size()
                + ", onlyInSecond=" + onlyInSecond.size() + '}';
    }
}
