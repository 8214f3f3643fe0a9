package rsv.sync;

import org.apache.commons.lang3.time.StopWatch;
import rsv.sync.model.RdfGraph;
import rsv.sync.transport.SparqlTransport;
import rsv.sync.transport.TransportException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Drives one comparison run between two stores.
 * <p>
 * A run moves through {@link RunState}: populations are discovered in both stores, entities
 * present in only one store are reported, the shared population is optionally sampled, and
 * every selected entity is fetched from both stores, canonicalized and compared. Entity-level
 * failures become {@link ComparisonResult.Outcome#ERROR} rows and the run continues; failures
 * during discovery or a whole graph fetch end the run in {@link RunState#FAILED} and are rethrown.
 * <p>
 * Instances are single use: create a new orchestrator for every run.
 */
public class ComparisonOrchestrator {

    private static final Logger logger = Logger.getLogger(ComparisonOrchestrator.class.getName());

    private final ComparisonSettings settings;
    private final GraphFetcher fetcher;
    private final GraphDiffer differ;
    private final PopulationDiscoverer discoverer;
    private final Sampler sampler;
    private final Map<String, Long> phaseTimings = new LinkedHashMap<>();
    private RunState state = RunState.IDLE;

    public ComparisonOrchestrator(SparqlTransport transport, ComparisonSettings settings) {
        this(transport, settings, settings.getSampleSeed() == null ? new Sampler() : Sampler.seeded(settings.getSampleSeed()));
    }

    public ComparisonOrchestrator(SparqlTransport transport, ComparisonSettings settings, Sampler sampler) {
        this.settings = settings;
        this.fetcher = new GraphFetcher(transport, settings);
        this.differ = new GraphDiffer(new Canonicalizer(settings.getMaxRefinementRounds(), settings.getMaxSearchLeaves()));
        this.discoverer = new PopulationDiscoverer(transport, settings.getDiscoveryTimeout());
        this.sampler = sampler;
    }

    public RunState getState() {
        return state;
    }

    public ComparisonReport compareWholeGraphs(SparqlStore first, SparqlStore second, FilterSet filters)
            throws TransportException, GraphParseException {
        start();
        try {
            StopWatch watch = StopWatch.createStarted();
            transition(RunState.FETCHING);
            RdfGraph firstGraph = fetcher.fetchWholeGraph(first, filters);
            RdfGraph secondGraph = fetcher.fetchWholeGraph(second, filters);
            recordPhase("Fetch Whole Graphs", watch);

            transition(RunState.PER_ENTITY_COMPARING);
            String iri = first.getGraphIri();
            GraphDiff diff = null;
            ComparisonResult result;
            try {
                diff = differ.diff(firstGraph, secondGraph);
                result = toResult(iri, diff);
            } catch (CanonicalizationException e) {
                logger.warning("Whole graph comparison treated as non-isomorphic: " + e.getMessage());
                result = ComparisonResult.mismatch(iri, firstGraph.size(), secondGraph.size(),
                        "Treated as non-isomorphic: " + e.getMessage());
            }
            recordPhase("Canonicalize and Diff", watch);

            transition(RunState.REPORTING);
            ComparisonReport.Outcome outcome = result.isMatch()
                    ? ComparisonReport.Outcome.ALL_MATCHED
                    : ComparisonReport.Outcome.MISMATCHES_FOUND;
            List<ComparisonResult> results = new ArrayList<>();
            results.add(result);
            ComparisonReport report = new ComparisonReport("full", ComparisonMode.WHOLE_GRAPH, first, second, outcome,
                    null, 1, results, firstGraph, secondGraph, diff, phaseTimings);
            transition(RunState.DONE);
            return report;
        } catch (TransportException | GraphParseException | RuntimeException e) {
            fail(e);
            throw e;
        }
    }

    public ComparisonReport compareComponent(SparqlStore first, SparqlStore second, ComponentProfile profile, FilterSet filters)
            throws TransportException {
        start();
        try {
            StopWatch watch = StopWatch.createStarted();
            transition(RunState.DISCOVERING);
            PopulationComparison population = discoverer.discoverBoth(first, second, profile.getRdfType(),
                    settings.isParallelDiscovery());
            recordPhase("Discover Populations", watch);

            transition(RunState.POPULATION_COMPARED);
            if (population.isAligned()) {
                logger.info("Population match: both stores contain the same " + population.getShared().size() + " "
                        + profile.getName() + " entities");
            } else {
                logger.warning("Population mismatch: " + population.getOnlyInFirst().size() + " unique to "
                        + first.getName() + ", " + population.getOnlyInSecond().size() + " unique to " + second.getName());
            }
            if (population.getShared().isEmpty()) {
                transition(RunState.ABORTED);
                logger.warning("No shared " + profile.getName() + " entities; skipping triple-level comparison");
                return new ComparisonReport(profile.getName(), profile.getMode(), first, second,
                        ComparisonReport.Outcome.ABORTED, population, 0, new ArrayList<>(),
                        new RdfGraph(), new RdfGraph(), null, phaseTimings);
            }

            transition(RunState.SAMPLING);
            List<String> entities = profile.isUseSampling()
                    ? sampler.sample(population.getShared(), settings.getMaxSampleSize())
                    : new ArrayList<>(population.getShared());
            if (entities.size() < population.getShared().size()) {
                logger.info("Sampling " + entities.size() + " out of " + population.getShared().size()
                        + " shared entities for triple-level check");
            }

            FilterSet effectiveFilters = profile.isApplyFilters() ? filters : FilterSet.none();
            RdfGraph fetchedFirst = new RdfGraph();
            RdfGraph fetchedSecond = new RdfGraph();
            List<ComparisonResult> results = new ArrayList<>(entities.size());
            for (int i = 0; i < entities.size(); i++) {
                String iri = entities.get(i);
                logger.fine("Checking triples " + (i + 1) + "/" + entities.size() + ": " + iri);
                results.add(compareEntity(iri, first, second, profile.getMode(), effectiveFilters, fetchedFirst, fetchedSecond));
            }
            recordPhase("Compare Entities", watch);

            transition(RunState.REPORTING);
            boolean allMatched = population.isAligned() && results.stream().allMatch(ComparisonResult::isMatch);
            ComparisonReport report = new ComparisonReport(profile.getName(), profile.getMode(), first, second,
                    allMatched ? ComparisonReport.Outcome.ALL_MATCHED : ComparisonReport.Outcome.MISMATCHES_FOUND,
                    population, population.getShared().size(), results, fetchedFirst, fetchedSecond, null, phaseTimings);
            transition(RunState.DONE);
            return report;
        } catch (TransportException | RuntimeException e) {
            fail(e);
            throw e;
        }
    }

    private ComparisonResult compareEntity(String iri, SparqlStore first, SparqlStore second, ComparisonMode mode,
                                           FilterSet filters, RdfGraph fetchedFirst, RdfGraph fetchedSecond) {
        transition(RunState.FETCHING);
        RdfGraph firstGraph;
        try {
            firstGraph = fetcher.fetchEntity(first, iri, mode, filters);
        } catch (TransportException | GraphParseException | IllegalArgumentException e) {
            logger.warning("Entity <" + iri + "> failed on " + first.getName() + ": " + e.getMessage());
            return ComparisonResult.error(iri, first, e);
        }
        RdfGraph secondGraph;
        try {
            secondGraph = fetcher.fetchEntity(second, iri, mode, filters);
        } catch (TransportException | GraphParseException | IllegalArgumentException e) {
            logger.warning("Entity <" + iri + "> failed on " + second.getName() + ": " + e.getMessage());
            return ComparisonResult.error(iri, second, e);
        }
        fetchedFirst.addAll(firstGraph);
        fetchedSecond.addAll(secondGraph);

        transition(RunState.PER_ENTITY_COMPARING);
        try {
            return toResult(iri, differ.diff(firstGraph, secondGraph));
        } catch (CanonicalizationException e) {
            logger.warning("Entity <" + iri + "> treated as non-isomorphic: " + e.getMessage());
            return ComparisonResult.mismatch(iri, firstGraph.size(), secondGraph.size(),
                    "Treated as non-isomorphic: " + e.getMessage());
        }
    }

    private static ComparisonResult toResult(String iri, GraphDiff diff) {
        int firstSize = diff.getFirst().size();
        if (diff.isIdentical()) {
            return ComparisonResult.match(iri, firstSize);
        }
        String detail = diff.getOnlyInFirst().size() + " triples only in first store, "
                + diff.getOnlyInSecond().size() + " only in second store";
        if (!diff.getFirst().isExhaustive() || !diff.getSecond().isExhaustive()) {
            detail += " (canonical labeling search truncated; mismatch may be spurious)";
        }
        return ComparisonResult.mismatch(iri, firstSize, diff.getSecond().size(), detail);
    }

    private void start() {
        if (state != RunState.IDLE) {
            throw new IllegalStateException("Orchestrator already used (state " + state + "); create a new one per run");
        }
    }

    private void transition(RunState next) {
        if (state != next) {
            logger.fine("Run state " + state + " -> " + next);
            state = next;
        }
    }

    private void fail(Exception e) {
        logger.severe("Run failed in state " + state + ": " + e.getMessage());
        state = RunState.FAILED;
    }

    private void recordPhase(String phase, StopWatch watch) {
        watch.stop();
        phaseTimings.put(phase, watch.getTime());
        watch.reset();
        watch.start();
    }
}
