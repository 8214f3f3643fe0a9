package rsv.sync.transport;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Read-only access to a SPARQL endpoint.
 */
public interface SparqlTransport {

    /**
     * Runs a CONSTRUCT query and returns the raw serialized graph.
     *
     * @param endpoint SPARQL endpoint URL
     * @param query    query text
     * @param syntax   requested serialization
     * @param timeout  limit for connecting and for reading the response
     */
    byte[] executeConstructQuery(String endpoint, String query, RdfSyntax syntax, Duration timeout) throws TransportException;

    /**
     * Runs a SELECT query. Each binding maps a variable name to the lexical value of its term.
     */
    List<Map<String, String>> executeSelectQuery(String endpoint, String query, Duration timeout) throws TransportException;
}
