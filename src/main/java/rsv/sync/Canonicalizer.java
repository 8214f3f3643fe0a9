package rsv.sync;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.Multimap;
import com.google.common.collect.Multimaps;
import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import rsv.sync.model.RdfGraph;
import rsv.sync.model.RdfTriple;
import rsv.sync.model.Term;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Computes a blank-node-label-independent form of a graph.
 * <p>
 * Blank nodes are hashed by iterative refinement over their neighbourhood (predicates and
 * neighbouring terms, in both directions) until the partition induced by the hashes stops
 * growing. Blank nodes that remain indistinguishable are individualized one at a time and
 * refined again; every fully distinguished outcome is a relabeling of the input graph and the
 * one with the smallest sorted N-Triples serialization becomes the canonical form.
 * <p>
 * Any canonical form produced here is a relabeling of its input, so equal canonical forms
 * always mean isomorphic inputs. When the individualization search is cut short by
 * {@code maxSearchLeaves}, isomorphic inputs may produce different canonical forms.
 */
public class Canonicalizer {

    private static final Logger logger = Logger.getLogger(Canonicalizer.class.getName());

    public static final String LABEL_PREFIX = "c14n";
    public static final int DEFAULT_MAX_ROUNDS = 10_000;
    public static final int DEFAULT_MAX_SEARCH_LEAVES = 256;

    private static final HashFunction hashFunction = Hashing.murmur3_128();
    private static final HashCode initialHashCode = hashString("");
    private static final HashCode outgoing = hashString("+");
    private static final HashCode incoming = hashString("-");
    private static final HashCode distinguisher = hashString("@");

    private static final Comparator<HashCode> HASH_ORDER = Comparator.comparing(HashCode::toString);

    private final int maxRounds;
    private final int maxSearchLeaves;

    public Canonicalizer() {
        this(DEFAULT_MAX_ROUNDS, DEFAULT_MAX_SEARCH_LEAVES);
    }

    public Canonicalizer(int maxRounds, int maxSearchLeaves) {
        if (maxRounds < 1 || maxSearchLeaves < 1) {
            throw new IllegalArgumentException("maxRounds and maxSearchLeaves must be positive");
        }
        this.maxRounds = maxRounds;
        this.maxSearchLeaves = maxSearchLeaves;
    }

    public CanonicalGraph canonicalize(RdfGraph graph) {
        Set<Term.Blank> blankNodes = graph.blankNodes();
        if (blankNodes.isEmpty()) {
            return new CanonicalGraph(graph.getTriples(), true);
        }

        Map<Term.Blank, List<RdfTriple>> edges = collectEdges(graph, blankNodes);
        Map<Term, HashCode> groundedHashes = new HashMap<>();

        Map<Term.Blank, HashCode> initial = new HashMap<>();
        blankNodes.forEach(node -> initial.put(node, initialHashCode));
        Map<Term.Blank, HashCode> refined = refine(initial, edges, groundedHashes);

        SearchState state = new SearchState();
        search(graph, refined, edges, groundedHashes, state);
        if (state.truncated) {
            logger.warning("Canonical labeling search stopped after " + state.leaves + " leaves for a graph with "
                    + blankNodes.size() + " blank nodes; result may not be canonical");
        }
        return new CanonicalGraph(state.best, !state.truncated);
    }

    public boolean isomorphic(RdfGraph first, RdfGraph second) {
        if (first.size() != second.size()) {
            return false;
        }
        if (first.blankNodes().size() != second.blankNodes().size()) {
            return false;
        }
        return canonicalize(first).equals(canonicalize(second));
    }

    private static Map<Term.Blank, List<RdfTriple>> collectEdges(RdfGraph graph, Set<Term.Blank> blankNodes) {
        Map<Term.Blank, List<RdfTriple>> edges = new LinkedHashMap<>();
        blankNodes.forEach(node -> edges.put(node, new ArrayList<>()));
        for (RdfTriple triple : graph) {
            if (triple.getSubject().isBlank()) {
                edges.get(triple.getSubject().asBlank()).add(triple);
            }
            // self loops are listed once and contribute both directions below
            if (triple.getObject().isBlank() && !triple.getObject().equals(triple.getSubject())) {
                edges.get(triple.getObject().asBlank()).add(triple);
            }
        }
        return edges;
    }

    // Refines until the number of distinct hashes stops growing or every blank node is distinguished.
    private Map<Term.Blank, HashCode> refine(Map<Term.Blank, HashCode> start,
                                             Map<Term.Blank, List<RdfTriple>> edges,
                                             Map<Term, HashCode> groundedHashes) {
        Map<Term.Blank, HashCode> current = start;
        int classes = distinctCount(current);
        for (int round = 0; round < maxRounds; round++) {
            if (classes == current.size()) {
                return current;
            }
            Map<Term.Blank, HashCode> next = new HashMap<>();
            for (Map.Entry<Term.Blank, List<RdfTriple>> entry : edges.entrySet()) {
                Term.Blank node = entry.getKey();
                List<HashCode> signatures = new ArrayList<>();
                for (RdfTriple triple : entry.getValue()) {
                    HashCode predicate = hashForTerm(triple.getPredicate(), current, groundedHashes);
                    if (triple.getSubject().equals(node)) {
                        signatures.add(hashTuple(predicate, hashForTerm(triple.getObject(), current, groundedHashes), outgoing));
                    }
                    if (triple.getObject().equals(node)) {
                        signatures.add(hashTuple(predicate, hashForTerm(triple.getSubject(), current, groundedHashes), incoming));
                    }
                }
                next.put(node, hashTuple(current.get(node), Hashing.combineUnordered(signatures)));
            }
            int nextClasses = distinctCount(next);
            if (nextClasses == classes) {
                return current;
            }
            current = next;
            classes = nextClasses;
        }
        throw new CanonicalizationException("Blank node refinement did not settle within " + maxRounds
                + " rounds (" + edges.size() + " blank nodes)");
    }

    private void search(RdfGraph graph, Map<Term.Blank, HashCode> hashes,
                        Map<Term.Blank, List<RdfTriple>> edges,
                        Map<Term, HashCode> groundedHashes, SearchState state) {
        Multimap<HashCode, Term.Blank> partition = partitionMapping(hashes);
        if (isFine(partition)) {
            state.leaves++;
            List<RdfTriple> candidate = labelGraph(graph, hashes);
            if (state.best == null || compareTriples(candidate, state.best) < 0) {
                state.best = candidate;
            }
            return;
        }

        Collection<Term.Blank> cell = smallestNonTrivialCell(partition);
        for (Term.Blank node : cell) {
            if (state.leaves >= maxSearchLeaves) {
                state.truncated = true;
                return;
            }
            Map<Term.Blank, HashCode> individualized = new HashMap<>(hashes);
            individualized.put(node, hashTuple(hashes.get(node), distinguisher));
            search(graph, refine(individualized, edges, groundedHashes), edges, groundedHashes, state);
        }
    }

    private static Collection<Term.Blank> smallestNonTrivialCell(Multimap<HashCode, Term.Blank> partition) {
        Map.Entry<HashCode, Collection<Term.Blank>> smallest = null;
        for (Map.Entry<HashCode, Collection<Term.Blank>> cell : partition.asMap().entrySet()) {
            int size = cell.getValue().size();
            if (size < 2) {
                continue;
            }
            if (smallest == null
                    || size < smallest.getValue().size()
                    || (size == smallest.getValue().size() && HASH_ORDER.compare(cell.getKey(), smallest.getKey()) < 0)) {
                smallest = cell;
            }
        }
        if (smallest == null) {
            throw new IllegalStateException("Partition has no non-trivial cell");
        }
        return smallest.getValue();
    }

    // Labels blank nodes c14n0..c14nN in hash order and returns the triples sorted.
    private static List<RdfTriple> labelGraph(RdfGraph graph, Map<Term.Blank, HashCode> hashes) {
        List<Term.Blank> ordered = new ArrayList<>(hashes.keySet());
        ordered.sort(Comparator.comparing(hashes::get, HASH_ORDER));
        Map<Term.Blank, Term.Blank> labels = new HashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            labels.put(ordered.get(i), Term.blank(LABEL_PREFIX + i));
        }

        List<RdfTriple> labelled = new ArrayList<>(graph.size());
        for (RdfTriple triple : graph) {
            if (!triple.hasBlankNode()) {
                labelled.add(triple);
                continue;
            }
            Term subject = triple.getSubject().isBlank() ? labels.get(triple.getSubject().asBlank()) : triple.getSubject();
            Term object = triple.getObject().isBlank() ? labels.get(triple.getObject().asBlank()) : triple.getObject();
            labelled.add(new RdfTriple(subject, triple.getPredicate(), object));
        }
        labelled.sort(null);
        return labelled;
    }

    private static int compareTriples(List<RdfTriple> a, List<RdfTriple> b) {
        int length = Math.min(a.size(), b.size());
        for (int i = 0; i < length; i++) {
            int result = a.get(i).compareTo(b.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    private static HashCode hashForTerm(Term term, Map<Term.Blank, HashCode> blankHashes, Map<Term, HashCode> groundedHashes) {
        switch (term.kind()) {
            case BLANK:
                return blankHashes.get(term.asBlank());
            case IRI:
            case LITERAL:
                return groundedHashes.computeIfAbsent(term, t -> hashString(t.toNTriples()));
            default:
                throw new IllegalArgumentException("Unknown term kind: " + term.kind());
        }
    }

    private static Multimap<HashCode, Term.Blank> partitionMapping(Map<Term.Blank, HashCode> hashes) {
        return Multimaps.invertFrom(Multimaps.forMap(hashes), HashMultimap.create());
    }

    private static boolean isFine(Multimap<HashCode, Term.Blank> partition) {
        return partition.keySet().size() == partition.size();
    }

    private static int distinctCount(Map<Term.Blank, HashCode> hashes) {
        return new LinkedHashSet<>(hashes.values()).size();
    }

    private static HashCode hashTuple(HashCode... hashCodes) {
        return Hashing.combineOrdered(Arrays.asList(hashCodes));
    }

    private static HashCode hashString(String value) {
        return hashFunction.hashString(value, StandardCharsets.UTF_8);
    }

    private static class SearchState {
        List<RdfTriple> best;
        int leaves;
        boolean truncated;
    }
}
