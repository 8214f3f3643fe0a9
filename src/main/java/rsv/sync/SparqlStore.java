package rsv.sync;

import java.util.Objects;

/**
 * One side of a comparison: a named endpoint and the named graph to read from it.
 */
public class SparqlStore {

    private final String name;
    private final String endpoint;
    private final String graphIri;

    public SparqlStore(String name, String endpoint, String graphIri) {
        this.name = Objects.requireNonNull(name, "Store name cannot be null");
        this.endpoint = Objects.requireNonNull(endpoint, "Endpoint cannot be null");
        this.graphIri = Objects.requireNonNull(graphIri, "Graph IRI cannot be null");
        SparqlQueries.checkIri(graphIri);
    }

    public String getName() {
        return name;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getGraphIri() {
        return graphIri;
    }

    @Override
    public String toString() {
        return name + " (" + endpoint + ", graph <" + graphIri + ">)";
    }
}
