package rsv.utils;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named pair of graph IRIs, one per store kind, with the filter labels selected by default.
 */
public class Preset {

    private final String name;
    private final String stardogGraph;
    private final String graphdbGraph;
    private final List<String> defaultFilters;

    public Preset(String name, String stardogGraph, String graphdbGraph, List<String> defaultFilters) {
        this.name = Objects.requireNonNull(name, "Preset name cannot be null");
        this.stardogGraph = Objects.requireNonNull(stardogGraph, "Stardog graph cannot be null");
        this.graphdbGraph = Objects.requireNonNull(graphdbGraph, "GraphDB graph cannot be null");
        this.defaultFilters = Collections.unmodifiableList(defaultFilters);
    }

    public String getName() {
        return name;
    }

    public String getStardogGraph() {
        return stardogGraph;
    }

    public String getGraphdbGraph() {
        return graphdbGraph;
    }

    public List<String> getDefaultFilters() {
        return defaultFilters;
    }

    @Override
    public String toString() {
        return "Preset{" +
                "name=" + name +
                ", stardogGraph=" + stardogGraph +
                ", graphdbGraph=" + graphdbGraph +
                ", defaultFilters=" + defaultFilters +
                '}';
    }
}
