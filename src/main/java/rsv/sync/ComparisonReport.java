package rsv.sync;

import rsv.sync.model.RdfGraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final output of one comparison run.
 */
public class ComparisonReport {

    public enum Outcome {
        /** Every compared entity matched and both populations were identical. */
        ALL_MATCHED,
        /** At least one mismatch, error or population discrepancy. */
        MISMATCHES_FOUND,
        /** The stores share no entity of the requested type; nothing was compared. */
        ABORTED
    }

    private final String label;
    private final ComparisonMode mode;
    private final SparqlStore first;
    private final SparqlStore second;
    private final Outcome outcome;
    private final PopulationComparison population;
    private final int sampledFrom;
    private final List<ComparisonResult> results;
    private final RdfGraph fetchedFirst;
    private final RdfGraph fetchedSecond;
    private final GraphDiff wholeGraphDiff;
    private final Map<String, Long> phaseTimings;

    ComparisonReport(String label, ComparisonMode mode, SparqlStore first, SparqlStore second, Outcome outcome,
                     PopulationComparison population, int sampledFrom, List<ComparisonResult> results,
                     RdfGraph fetchedFirst, RdfGraph fetchedSecond, GraphDiff wholeGraphDiff,
                     Map<String, Long> phaseTimings) {
        this.label = label;
        this.mode = mode;
        this.first = first;
        this.second = second;
        this.outcome = outcome;
        this.population = population;
        this.sampledFrom = sampledFrom;
        this.results = Collections.unmodifiableList(results);
        this.fetchedFirst = fetchedFirst;
        this.fetchedSecond = fetchedSecond;
        this.wholeGraphDiff = wholeGraphDiff;
        this.phaseTimings = Collections.unmodifiableMap(new LinkedHashMap<>(phaseTimings));
    }

    public String getLabel() {
        return label;
    }

    public ComparisonMode getMode() {
        return mode;
    }

    public SparqlStore getFirst() {
        return first;
    }

    public SparqlStore getSecond() {
        return second;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    // Null in whole graph mode.
    public PopulationComparison getPopulation() {
        return population;
    }

    // Size of the shared population the results were drawn from.
    public int getSampledFrom() {
        return sampledFrom;
    }

    public boolean isSampled() {
        return sampledFrom > results.size();
    }

    public List<ComparisonResult> getResults() {
        return results;
    }

    public RdfGraph getFetchedFirst() {
        return fetchedFirst;
    }

    public RdfGraph getFetchedSecond() {
        return fetchedSecond;
    }

    // Only set in whole graph mode, and null when canonicalization gave up.
    public GraphDiff getWholeGraphDiff() {
        return wholeGraphDiff;
    }

    public Map<String, Long> getPhaseTimings() {
        return phaseTimings;
    }

    public long count(ComparisonResult.Outcome resultOutcome) {
        return results.stream().filter(r -> r.getOutcome() == resultOutcome).count();
    }

    @Override
    public String toString() {
        return "ComparisonReport{" +
                "label=" + label +
                ", mode=" + mode +
                ", outcome=" + outcome +
                ", results=" + results.size() +
                ", matched=" + count(ComparisonResult.Outcome.MATCH) +
                ", mismatched=" + count(ComparisonResult.Outcome.MISMATCH) +
                ", errors=" + count(ComparisonResult.Outcome.ERROR) +
                '}';
    }
}
