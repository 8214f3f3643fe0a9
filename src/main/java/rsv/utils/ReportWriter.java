package rsv.utils;

import rsv.sync.ComparisonMode;
import rsv.sync.ComparisonReport;
import rsv.sync.ComparisonResult;
import rsv.sync.GraphDiff;
import rsv.sync.PopulationComparison;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Writes the artifacts of a finished run into one output directory.
 * <p>
 * Every run gets a CSV report ({@code <label>_report.csv}). Component runs add the population
 * discrepancy listings and the union of all fetched triples per store; whole graph runs add
 * either the triples unique to each store or, when both graphs are identical, the verified
 * canonical graph.
 */
public class ReportWriter {

    static final String CSV_HEADER = "IRI,Match,Triples,Outcome,TriplesSecond,Detail";

    private final Path outputDir;

    public ReportWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    public List<Path> write(ComparisonReport report) throws IOException {
        Files.createDirectories(outputDir);
        String label = Utils.slug(report.getLabel());
        String firstName = storeFileName(report, true);
        String secondName = storeFileName(report, false);

        List<Path> written = new ArrayList<>();
        written.add(writeCsv(label + "_report.csv", report.getResults()));

        if (report.getMode() == ComparisonMode.WHOLE_GRAPH) {
            GraphDiff diff = report.getWholeGraphDiff();
            if (diff != null && diff.isIdentical()) {
                written.add(writeLines(label + "_verified.nt", diff.getFirst().toSortedNTriples()));
            } else if (diff != null) {
                if (!diff.getOnlyInFirst().isEmpty()) {
                    written.add(writeLines(label + "_only_in_" + firstName + ".nt", diff.getOnlyInFirst().toSortedNTriples()));
                }
                if (!diff.getOnlyInSecond().isEmpty()) {
                    written.add(writeLines(label + "_only_in_" + secondName + ".nt", diff.getOnlyInSecond().toSortedNTriples()));
                }
            }
            return written;
        }

        PopulationComparison population = report.getPopulation();
        if (population != null) {
            if (!population.getOnlyInFirst().isEmpty()) {
                written.add(writeLines(label + "_only_in_" + firstName + ".txt", population.getOnlyInFirst()));
            }
            if (!population.getOnlyInSecond().isEmpty()) {
                written.add(writeLines(label + "_only_in_" + secondName + ".txt", population.getOnlyInSecond()));
            }
        }
        if (!report.getFetchedFirst().isEmpty()) {
            written.add(writeLines(label + "_" + firstName + ".nt", report.getFetchedFirst().toSortedNTriples()));
        }
        if (!report.getFetchedSecond().isEmpty()) {
            written.add(writeLines(label + "_" + secondName + ".nt", report.getFetchedSecond().toSortedNTriples()));
        }
        return written;
    }

    public Path writeCsv(String fileName, List<ComparisonResult> results) throws IOException {
        Path path = outputDir.resolve(fileName);
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(CSV_HEADER);
            writer.newLine();
            for (ComparisonResult result : results) {
                writer.write(toCsvRow(result));
                writer.newLine();
            }
        }
        return path;
    }

    public Path writeLines(String fileName, Collection<String> lines) throws IOException {
        Path path = outputDir.resolve(fileName);
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            for (String line : lines) {
                writer.write(line);
                writer.newLine();
            }
        }
        return path;
    }

    static String toCsvRow(ComparisonResult result) {
        return escapeCsv(result.getIri()) + ","
                + (result.isMatch() ? "True" : "False") + ","
                + result.getTripleCount() + ","
                + result.getOutcome() + ","
                + result.getTripleCountSecond() + ","
                + escapeCsv(result.getDetail() == null ? "" : result.getDetail());
    }

    static String escapeCsv(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    public static String summary(ComparisonReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Comparison '").append(report.getLabel()).append("' (").append(report.getMode()).append(")\n");
        sb.append("  First:  ").append(report.getFirst()).append('\n');
        sb.append("  Second: ").append(report.getSecond()).append('\n');

        PopulationComparison population = report.getPopulation();
        if (population != null) {
            sb.append("  Population: ").append(population.getShared().size()).append(" shared, ")
                    .append(population.getOnlyInFirst().size()).append(" only in ").append(report.getFirst().getName()).append(", ")
                    .append(population.getOnlyInSecond().size()).append(" only in ").append(report.getSecond().getName()).append('\n');
        }
        if (report.isSampled()) {
            sb.append("  Sampled ").append(report.getResults().size()).append(" of ").append(report.getSampledFrom())
                    .append(" shared entities\n");
        }
        GraphDiff diff = report.getWholeGraphDiff();
        if (diff != null) {
            sb.append("  Triples: ").append(diff.getShared().size()).append(" shared, ")
                    .append(diff.getOnlyInFirst().size()).append(" only in ").append(report.getFirst().getName()).append(", ")
                    .append(diff.getOnlyInSecond().size()).append(" only in ").append(report.getSecond().getName()).append('\n');
        }
        sb.append("  Results: ").append(report.count(ComparisonResult.Outcome.MATCH)).append(" matched, ")
                .append(report.count(ComparisonResult.Outcome.MISMATCH)).append(" mismatched, ")
                .append(report.count(ComparisonResult.Outcome.ERROR)).append(" errors\n");
        for (ComparisonResult result : report.getResults()) {
            if (!result.isMatch()) {
                sb.append("    ").append(result.getOutcome()).append(' ').append(result.getIri());
                if (result.getDetail() != null) {
                    sb.append(": ").append(result.getDetail());
                }
                sb.append('\n');
            }
        }
        for (Map.Entry<String, Long> phase : report.getPhaseTimings().entrySet()) {
            sb.append("  ").append(phase.getKey()).append(": ").append(phase.getValue()).append("ms\n");
        }
        sb.append("  Outcome: ").append(report.getOutcome());
        return sb.toString();
    }

    // Falls back to positional names when both stores share a display name.
    private static String storeFileName(ComparisonReport report, boolean first) {
        String firstSlug = Utils.slug(report.getFirst().getName());
        String secondSlug = Utils.slug(report.getSecond().getName());
        if (firstSlug.equals(secondSlug)) {
            return (first ? firstSlug + "_first" : secondSlug + "_second");
        }
        return first ? firstSlug : secondSlug;
    }
}
