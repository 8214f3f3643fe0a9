package rsv.sync;

import rsv.sync.model.RdfGraph;
import rsv.sync.model.RdfTriple;
import rsv.sync.model.Term;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Restricts a fetched graph to the part owned by one entity: its own triples and the triples
 * of every blank node reachable from it through blank node objects only.
 * <p>
 * The deep subgraph query can reach blank nodes through intermediate IRIs, which drags in
 * structures that belong to other entities; those are removed here.
 */
public class SubgraphExtraction {

    private SubgraphExtraction() {
    }

    public static RdfGraph blankNodeClosure(RdfGraph graph, Term root) {
        Map<Term, List<RdfTriple>> bySubject = new LinkedHashMap<>();
        for (RdfTriple triple : graph) {
            bySubject.computeIfAbsent(triple.getSubject(), k -> new ArrayList<>()).add(triple);
        }

        RdfGraph closure = new RdfGraph();
        Set<Term> visitedNodes = new HashSet<>();
        Deque<Term> pending = new ArrayDeque<>();
        pending.add(root);
        visitedNodes.add(root);
        while (!pending.isEmpty()) {
            Term node = pending.poll();
            for (RdfTriple triple : bySubject.getOrDefault(node, List.of())) {
                closure.add(triple);
                Term object = triple.getObject();
                if (object.isBlank() && visitedNodes.add(object)) {
                    pending.add(object);
                }
            }
        }
        return closure;
    }
}
