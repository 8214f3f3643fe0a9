package rsv.sync;

import java.util.Objects;

/**
 * How one kind of entity is compared: which RDF type defines the population, the fetch
 * granularity, and whether predicate filters and sampling apply.
 */
public class ComponentProfile {

    private final String name;
    private final String rdfType;
    private final ComparisonMode mode;
    private final boolean applyFilters;
    private final boolean useSampling;

    public ComponentProfile(String name, String rdfType, ComparisonMode mode, boolean applyFilters, boolean useSampling) {
        this.name = Objects.requireNonNull(name, "Profile name cannot be null");
        this.rdfType = Objects.requireNonNull(rdfType, "RDF type cannot be null");
        this.mode = Objects.requireNonNull(mode, "Mode cannot be null");
        if (mode == ComparisonMode.WHOLE_GRAPH) {
            throw new IllegalArgumentException("Component profiles compare entities, not whole graphs: " + name);
        }
        if (mode == ComparisonMode.DEEP_SUBGRAPH && applyFilters) {
            throw new IllegalArgumentException("Deep subgraph comparison cannot filter predicates: " + name);
        }
        SparqlQueries.checkIri(rdfType);
        this.applyFilters = applyFilters;
        this.useSampling = useSampling;
    }

    public String getName() {
        return name;
    }

    public String getRdfType() {
        return rdfType;
    }

    public ComparisonMode getMode() {
        return mode;
    }

    public boolean isApplyFilters() {
        return applyFilters;
    }

    public boolean isUseSampling() {
        return useSampling;
    }

    @Override
    public String toString() {
        return "ComponentProfile{" +
                "name=" + name +
                ", rdfType=" + rdfType +
                ", mode=" + mode +
                ", applyFilters=" + applyFilters +
                ", useSampling=" + useSampling +
                '}';
    }
}
