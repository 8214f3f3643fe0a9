package rsv.sync;

import rsv.sync.transport.SparqlTransport;
import rsv.sync.transport.TransportException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * Finds every entity IRI of an RDF type in a store. Results are never paged or capped,
 * since an entity missing from one store is exactly what the comparison must report.
 */
public class PopulationDiscoverer {

    private static final Logger logger = Logger.getLogger(PopulationDiscoverer.class.getName());

    static final String ITEM_VARIABLE = "item";

    private final SparqlTransport transport;
    private final Duration timeout;

    public PopulationDiscoverer(SparqlTransport transport, Duration timeout) {
        this.transport = transport;
        this.timeout = timeout;
    }

    public SortedSet<String> discover(SparqlStore store, String rdfType) throws TransportException {
        String query = SparqlQueries.selectEntitiesOfType(store.getGraphIri(), rdfType);
        List<Map<String, String>> bindings = transport.executeSelectQuery(store.getEndpoint(), query, timeout);
        SortedSet<String> population = new TreeSet<>();
        for (Map<String, String> binding : bindings) {
            String item = binding.get(ITEM_VARIABLE);
            if (item != null) {
                population.add(item);
            }
        }
        logger.info("Discovered " + population.size() + " <" + rdfType + "> entities in " + store.getName());
        return population;
    }

    // Both lookups are independent reads; the first failure is rethrown unchanged.
    public PopulationComparison discoverBoth(SparqlStore first, SparqlStore second, String rdfType, boolean parallel)
            throws TransportException {
        if (!parallel) {
            return PopulationComparison.compare(discover(first, rdfType), discover(second, rdfType));
        }
        ExecutorService executorService = Executors.newFixedThreadPool(2);
        try {
            Future<SortedSet<String>> firstFuture = executorService.submit(discoverTask(first, rdfType));
            Future<SortedSet<String>> secondFuture = executorService.submit(discoverTask(second, rdfType));
            return PopulationComparison.compare(waitFor(firstFuture), waitFor(secondFuture));
        } finally {
            executorService.shutdownNow();
        }
    }

    private Callable<SortedSet<String>> discoverTask(SparqlStore store, String rdfType) {
        return () -> discover(store, rdfType);
    }

    private static SortedSet<String> waitFor(Future<SortedSet<String>> future) throws TransportException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while discovering populations", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransportException) {
                throw (TransportException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Population discovery failed", cause);
        }
    }
}
