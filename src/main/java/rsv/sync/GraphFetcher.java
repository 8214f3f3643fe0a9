package rsv.sync;

import rsv.sync.model.RdfGraph;
import rsv.sync.model.Term;
import rsv.sync.transport.SparqlTransport;
import rsv.sync.transport.TransportException;

import java.util.logging.Logger;

/**
 * Fetches whole graphs or entity subgraphs and parses them into normalized {@link RdfGraph}s.
 */
public class GraphFetcher {

    private static final Logger logger = Logger.getLogger(GraphFetcher.class.getName());

    private final SparqlTransport transport;
    private final ComparisonSettings settings;

    public GraphFetcher(SparqlTransport transport, ComparisonSettings settings) {
        this.transport = transport;
        this.settings = settings;
    }

    public RdfGraph fetchWholeGraph(SparqlStore store, FilterSet filters) throws TransportException, GraphParseException {
        String query = SparqlQueries.constructWholeGraph(store.getGraphIri(), filters);
        RdfGraph graph = fetch(store, query, filters, ComparisonMode.WHOLE_GRAPH);
        logger.info("Loaded " + graph.size() + " triples from " + store.getName());
        return graph;
    }

    public RdfGraph fetchEntity(SparqlStore store, String entityIri, ComparisonMode mode, FilterSet filters)
            throws TransportException, GraphParseException {
        switch (mode) {
            case ENTITY_METADATA:
                return fetch(store, SparqlQueries.constructEntityMetadata(store.getGraphIri(), entityIri, filters),
                        filters, mode);
            case DEEP_SUBGRAPH:
                RdfGraph fetched = fetch(store, SparqlQueries.constructDeepSubgraph(store.getGraphIri(), entityIri),
                        FilterSet.none(), mode);
                RdfGraph closure = SubgraphExtraction.blankNodeClosure(fetched, Term.iri(entityIri));
                if (closure.size() != fetched.size()) {
                    logger.fine("Dropped " + (fetched.size() - closure.size()) + " triples not owned by <" + entityIri
                            + "> in " + store.getName());
                }
                return closure;
            case WHOLE_GRAPH:
            default:
                throw new IllegalArgumentException("Not an entity mode: " + mode);
        }
    }

    private RdfGraph fetch(SparqlStore store, String query, FilterSet filters, ComparisonMode mode)
            throws TransportException, GraphParseException {
        byte[] payload = transport.executeConstructQuery(store.getEndpoint(), query, settings.getConstructSyntax(),
                settings.timeoutFor(mode));
        try {
            return GraphBuilder.parse(payload, settings.getConstructSyntax(), filters);
        } catch (GraphParseException e) {
            throw new GraphParseException(store.getName() + ": " + e.getMessage(), e);
        }
    }
}
