package rsv;

import rsv.sync.ComparisonOrchestrator;
import rsv.sync.ComparisonReport;
import rsv.sync.ComponentProfile;
import rsv.sync.FilterSet;
import rsv.sync.GraphParseException;
import rsv.sync.SparqlStore;
import rsv.sync.transport.HttpSparqlTransport;
import rsv.sync.transport.SparqlTransport;
import rsv.sync.transport.TransportException;
import rsv.utils.ConfigManager;
import rsv.utils.ConfigurationException;
import rsv.utils.Endpoint;
import rsv.utils.Preset;
import rsv.utils.ReportWriter;
import rsv.utils.Utils;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Compares one named graph of a Stardog endpoint with its counterpart in a GraphDB endpoint.
 * <p>
 * Usage: {@code <config.properties> <full|component-name>}. Exits with 0 when the stores
 * agree, 1 when differences were found or nothing could be compared, 2 on failure.
 */
public class Main {

    public static final int EXIT_MATCH = 0;
    public static final int EXIT_DIFFERENCES = 1;
    public static final int EXIT_FAILURE = 2;

    public static final String FULL = "full";

    public static void main(String[] args) {
        System.exit(run(args, new HttpSparqlTransport()));
    }

    static int run(String[] args, SparqlTransport transport) {
        if (args.length < 2) {
            System.err.println("Usage: rdf-sync-validator <config.properties> <" + FULL + "|component-name>");
            return EXIT_FAILURE;
        }
        String configPath = args[0];
        String target = args[1];
        long startTimeTotal = System.nanoTime();
        long startMemoryTotal = Utils.getMemoryUsage();
        String runtimeLogPath = null;

        try {
            long startTime = System.nanoTime();
            long startMemory = Utils.getMemoryUsage();
            ConfigManager config = ConfigManager.load(configPath);
            Path outputDir = Paths.get(config.getProperty("output_file_path", "output"));
            runtimeLogPath = outputDir.resolve(config.getProperty("runtime_log", "runtime.log")).toString();
            outputDir.toFile().mkdirs();

            Endpoint stardog = config.getEndpoint(ConfigManager.STARDOG, config.getRequiredProperty("run.stardog"));
            Endpoint graphdb = config.getEndpoint(ConfigManager.GRAPHDB, config.getRequiredProperty("run.graphdb"));
            Preset preset = config.getPreset(config.getRequiredProperty("run.preset"));
            List<String> filterLabels = config.getProperty("run.filters") != null
                    ? config.getList("run.filters")
                    : preset.getDefaultFilters();
            FilterSet filters = config.resolveFilters(filterLabels, config.getList("run.extra_filters"));
            SparqlStore first = new SparqlStore(stardog.getName(), stardog.getUrl(), preset.getStardogGraph());
            SparqlStore second = new SparqlStore(graphdb.getName(), graphdb.getUrl(), preset.getGraphdbGraph());
            ComparisonOrchestrator orchestrator = new ComparisonOrchestrator(transport, config.toSettings());
            Utils.logRuntime(runtimeLogPath, "Load Configuration", Utils.calculateElapsedTime(startTime), Utils.calculateMemoryUsage(startMemory));

            System.out.println("Comparing " + first + " with " + second + " [" + target + "], excluding " + filters);
            ComparisonReport report;
            if (FULL.equals(target)) {
                report = orchestrator.compareWholeGraphs(first, second, filters);
            } else {
                ComponentProfile profile = config.getComponent(target);
                report = orchestrator.compareComponent(first, second, profile, filters);
            }
            for (Map.Entry<String, Long> phase : report.getPhaseTimings().entrySet()) {
                Utils.logRuntime(runtimeLogPath, phase.getKey(), phase.getValue(), Utils.getMemoryUsage() / (1024 * 1024));
            }

            startTime = System.nanoTime();
            startMemory = Utils.getMemoryUsage();
            List<Path> artifacts = new ReportWriter(outputDir).write(report);
            Utils.logRuntime(runtimeLogPath, "Write Report", Utils.calculateElapsedTime(startTime), Utils.calculateMemoryUsage(startMemory));

            System.out.println(ReportWriter.summary(report));
            artifacts.forEach(path -> System.out.println("Written: " + path));
            Utils.logRuntime(runtimeLogPath, "Total Runtime", Utils.calculateElapsedTime(startTimeTotal), Utils.calculateMemoryUsage(startMemoryTotal));
            return report.getOutcome() == ComparisonReport.Outcome.ALL_MATCHED ? EXIT_MATCH : EXIT_DIFFERENCES;
        } catch (ConfigurationException e) {
            System.err.println("Configuration error: " + e.getMessage());
        } catch (TransportException e) {
            System.err.println("SPARQL request failed: " + e.getMessage());
        } catch (GraphParseException e) {
            System.err.println("Invalid RDF response: " + e.getMessage());
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
        } catch (RuntimeException e) {
            e.printStackTrace();
            System.err.println("Error encountered: " + e.getMessage());
        }
        Utils.logRuntime(runtimeLogPath, "Failed Run", Utils.calculateElapsedTime(startTimeTotal), Utils.calculateMemoryUsage(startMemoryTotal));
        return EXIT_FAILURE;
    }
}
