package rsv.utils;

import java.util.Objects;

/**
 * A configured SPARQL endpoint, selectable by its display name.
 */
public class Endpoint {

    private final String name;
    private final String url;

    public Endpoint(String name, String url) {
        this.name = Objects.requireNonNull(name, "Endpoint name cannot be null");
        this.url = Objects.requireNonNull(url, "Endpoint URL cannot be null");
    }

    public String getName() {
        return name;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public String toString() {
        return name + " (" + url + ")";
    }
}
