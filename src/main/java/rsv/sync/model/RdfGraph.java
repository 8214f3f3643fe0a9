package rsv.sync.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * In-memory set of triples produced by one fetch. Identical triples collapse.
 * Blank node labels are only meaningful inside one graph.
 */
public class RdfGraph implements Iterable<RdfTriple> {

    private final Set<RdfTriple> triples;

    public RdfGraph() {
        this.triples = new LinkedHashSet<>();
    }

    public RdfGraph(Collection<RdfTriple> triples) {
        this.triples = new LinkedHashSet<>(triples);
    }

    public boolean add(RdfTriple triple) {
        return triples.add(triple);
    }

    public void addAll(RdfGraph other) {
        triples.addAll(other.triples);
    }

    public boolean contains(RdfTriple triple) {
        return triples.contains(triple);
    }

    public int size() {
        return triples.size();
    }

    public boolean isEmpty() {
        return triples.isEmpty();
    }

    public Set<RdfTriple> getTriples() {
        return Collections.unmodifiableSet(triples);
    }

    public Set<Term.Blank> blankNodes() {
        Set<Term.Blank> blankNodes = new LinkedHashSet<>();
        for (RdfTriple triple : triples) {
            if (triple.getSubject().isBlank()) {
                blankNodes.add(triple.getSubject().asBlank());
            }
            if (triple.getObject().isBlank()) {
                blankNodes.add(triple.getObject().asBlank());
            }
        }
        return blankNodes;
    }

    // Sorted N-Triples lines, one per triple.
    public List<String> toSortedNTriples() {
        return triples.stream()
                .map(RdfTriple::toNTriples)
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public Iterator<RdfTriple> iterator() {
        return Collections.unmodifiableSet(triples).iterator();
    }

    @Override
    public String toString() {
        return "RdfGraph{size=" + triples.size() + '}';
    }
}
