package rsv.sync;

/**
 * Text of every SELECT / CONSTRUCT query issued against the stores.
 */
public class SparqlQueries {

    // Predicate no store uses, so the negated property set matches every predicate.
    static final String NO_DEFAULT_PREDICATE = "http://nodefault";

    private static final String FORBIDDEN_IRI_CHARS = "<>\"{}|\\^`";

    private SparqlQueries() {
    }

    public static String selectEntitiesOfType(String graphIri, String rdfType) {
        checkIri(graphIri);
        checkIri(rdfType);
        return String.format(
                "SELECT DISTINCT ?item WHERE { GRAPH <%s> { ?item a <%s> . FILTER (isIRI(?item)) } }",
                graphIri, rdfType);
    }

    public static String constructWholeGraph(String graphIri, FilterSet filters) {
        checkIri(graphIri);
        return String.format(
                "CONSTRUCT { ?s ?p ?o } WHERE { GRAPH <%s> { ?s ?p ?o . %s } }",
                graphIri, filters.toSparqlClause("?p"));
    }

    public static String constructEntityMetadata(String graphIri, String entityIri, FilterSet filters) {
        checkIri(graphIri);
        checkIri(entityIri);
        return String.format(
                "CONSTRUCT { <%2$s> ?p ?o . } WHERE { GRAPH <%1$s> { <%2$s> ?p ?o . %3$s } }",
                graphIri, entityIri, filters.toSparqlClause("?p"));
    }

    // Follows any predicate any number of times; only the entity itself and blank nodes contribute triples.
    public static String constructDeepSubgraph(String graphIri, String entityIri) {
        checkIri(graphIri);
        checkIri(entityIri);
        return String.format(
                "CONSTRUCT { ?n ?p ?o . } WHERE { GRAPH <%1$s> { "
                        + "<%2$s> (!<%3$s>)* ?n . ?n ?p ?o . "
                        + "FILTER (isBlank(?n) || ?n = <%2$s>) } }",
                graphIri, entityIri, NO_DEFAULT_PREDICATE);
    }

    static void checkIri(String iri) {
        if (iri == null || iri.isEmpty()) {
            throw new IllegalArgumentException("IRI cannot be null or empty.");
        }
        for (int i = 0; i < iri.length(); i++) {
            char c = iri.charAt(i);
            if (c <= ' ' || FORBIDDEN_IRI_CHARS.indexOf(c) >= 0) {
                throw new IllegalArgumentException("Invalid character in IRI: " + iri);
            }
        }
        if (iri.indexOf(':') <= 0) {
            throw new IllegalArgumentException("IRI must be absolute: " + iri);
        }
    }
}
