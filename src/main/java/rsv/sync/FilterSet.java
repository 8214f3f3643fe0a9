package rsv.sync;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable set of predicate IRIs excluded from a comparison run.
 */
public class FilterSet {

    private static final FilterSet NONE = new FilterSet(Collections.emptySet());

    private final Set<String> excludedPredicates;

    private FilterSet(Collection<String> excludedPredicates) {
        this.excludedPredicates = Collections.unmodifiableSet(new TreeSet<>(excludedPredicates));
    }

    public static FilterSet none() {
        return NONE;
    }

    public static FilterSet of(Collection<String> predicateIris) {
        for (String iri : predicateIris) {
            SparqlQueries.checkIri(iri);
        }
        return predicateIris.isEmpty() ? NONE : new FilterSet(predicateIris);
    }

    public static FilterSet of(String... predicateIris) {
        return of(Arrays.asList(predicateIris));
    }

    public boolean shouldExclude(String predicateIri) {
        return excludedPredicates.contains(predicateIri);
    }

    public boolean isEmpty() {
        return excludedPredicates.isEmpty();
    }

    public Set<String> getExcludedPredicates() {
        return excludedPredicates;
    }

    // FILTER (?p NOT IN (<a>, <b>)) or "" when nothing is excluded.
    public String toSparqlClause(String variable) {
        if (excludedPredicates.isEmpty()) {
            return "";
        }
        String iriList = excludedPredicates.stream()
                .map(iri -> "<" + iri + ">")
                .collect(Collectors.joining(", "));
        return "FILTER (" + variable + " NOT IN (" + iriList + "))";
    }

    @Override
    public String toString() {
        return "FilterSet" + excludedPredicates;
    }
}
