package rsv.sync;

import java.util.Objects;

/**
 * Outcome of comparing one entity (or one whole graph) across the two stores.
 */
public final class ComparisonResult {

    public enum Outcome { MATCH, MISMATCH, ERROR }

    private final String iri;
    private final Outcome outcome;
    private final int tripleCount;
    private final int tripleCountSecond;
    private final String detail;

    private ComparisonResult(String iri, Outcome outcome, int tripleCount, int tripleCountSecond, String detail) {
        this.iri = Objects.requireNonNull(iri, "IRI cannot be null");
        this.outcome = outcome;
        this.tripleCount = tripleCount;
        this.tripleCountSecond = tripleCountSecond;
        this.detail = detail;
    }

    public static ComparisonResult match(String iri, int tripleCount) {
        return new ComparisonResult(iri, Outcome.MATCH, tripleCount, tripleCount, null);
    }

    public static ComparisonResult mismatch(String iri, int tripleCount, int tripleCountSecond, String detail) {
        return new ComparisonResult(iri, Outcome.MISMATCH, tripleCount, tripleCountSecond, detail);
    }

    // Counts are -1 for graphs that were never fetched.
    public static ComparisonResult error(String iri, SparqlStore store, Exception cause) {
        String detail = "Failed to compare <" + iri + "> on " + store.getName() + " (" + store.getEndpoint() + "): "
                + cause.getMessage();
        return new ComparisonResult(iri, Outcome.ERROR, -1, -1, detail);
    }

    public String getIri() {
        return iri;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isMatch() {
        return outcome == Outcome.MATCH;
    }

    public int getTripleCount() {
        return tripleCount;
    }

    public int getTripleCountSecond() {
        return tripleCountSecond;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return "ComparisonResult{" +
                "iri=" + iri +
                ", outcome=" + outcome +
                ", triples=" + tripleCount +
                (detail != null ? ", detail=" + detail : "") +
                '}';
    }
}
