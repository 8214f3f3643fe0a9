package rsv.sync;

import rsv.sync.model.RdfGraph;
import rsv.sync.model.RdfTriple;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable canonical view of a graph. Blank nodes carry structurally determined labels,
 * so two canonical graphs are equal exactly when they hold the same triples.
 */
public final class CanonicalGraph {

    private final Set<RdfTriple> triples;
    private final boolean exhaustive;

    CanonicalGraph(Collection<RdfTriple> triples, boolean exhaustive) {
        this.triples = Collections.unmodifiableSet(new LinkedHashSet<>(triples));
        this.exhaustive = exhaustive;
    }

    public Set<RdfTriple> getTriples() {
        return triples;
    }

    public int size() {
        return triples.size();
    }

    public boolean contains(RdfTriple triple) {
        return triples.contains(triple);
    }

    // False when the labeling search was cut short.
    public boolean isExhaustive() {
        return exhaustive;
    }

    public RdfGraph toGraph() {
        return new RdfGraph(triples);
    }

    public List<String> toSortedNTriples() {
        return triples.stream().map(RdfTriple::toNTriples).sorted().collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CanonicalGraph)) return false;
        return triples.equals(((CanonicalGraph) o).triples);
    }

    @Override
    public int hashCode() {
        return triples.hashCode();
    }

    @Override
    public String toString() {
        return "CanonicalGraph{size=" + triples.size() + ", exhaustive=" + exhaustive + '}';
    }
}
