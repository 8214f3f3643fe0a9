package rsv.utils;

import org.apache.commons.lang3.StringUtils;
import rsv.sync.ComparisonMode;
import rsv.sync.ComparisonSettings;
import rsv.sync.ComponentProfile;
import rsv.sync.FilterSet;
import rsv.sync.transport.RdfSyntax;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Read-only view of the run configuration, loaded once from a properties file.
 * <p>
 * Lists (endpoints, presets, filters) use numbered keys such as {@code endpoint.stardog.1.name};
 * entries are returned in ascending index order. Component profiles are keyed by name:
 * {@code component.cube.type}.
 */
public class ConfigManager {

    public static final String STARDOG = "stardog";
    public static final String GRAPHDB = "graphdb";

    private static final Pattern COMPONENT_KEY = Pattern.compile("^component\\.([^.]+)\\.type$");

    private final Properties properties;

    public ConfigManager(Properties properties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
    }

    public static ConfigManager load(String configPath) throws IOException {
        Properties properties = new Properties();
        try (InputStream configFile = new FileInputStream(configPath)) {
            properties.load(new InputStreamReader(configFile, StandardCharsets.UTF_8));
        }
        return new ConfigManager(properties);
    }

    public String getProperty(String property) {
        String value = properties.getProperty(property);
        return value == null ? null : value.trim();
    }

    public String getProperty(String property, String defaultValue) {
        String value = getProperty(property);
        return StringUtils.isEmpty(value) ? defaultValue : value;
    }

    public String getRequiredProperty(String property) {
        String value = getProperty(property);
        if (StringUtils.isEmpty(value)) {
            throw new ConfigurationException("Missing configuration key: " + property);
        }
        return value;
    }

    public int getInt(String property, int defaultValue) {
        String value = getProperty(property);
        if (StringUtils.isEmpty(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Not an integer for " + property + ": " + value, e);
        }
    }

    public boolean getBoolean(String property, boolean defaultValue) {
        String value = getProperty(property);
        if (StringUtils.isEmpty(value)) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new ConfigurationException("Not a boolean for " + property + ": " + value);
    }

    // Comma separated, blanks dropped.
    public List<String> getList(String property) {
        String value = getProperty(property);
        if (StringUtils.isBlank(value)) {
            return Collections.emptyList();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .collect(Collectors.toList());
    }

    public List<Endpoint> getEndpoints(String kind) {
        List<Endpoint> endpoints = new ArrayList<>();
        for (int index : indices("endpoint." + kind + ".")) {
            String prefix = "endpoint." + kind + "." + index;
            endpoints.add(new Endpoint(getRequiredProperty(prefix + ".name"), getRequiredProperty(prefix + ".url")));
        }
        return endpoints;
    }

    public Endpoint getEndpoint(String kind, String name) {
        for (Endpoint endpoint : getEndpoints(kind)) {
            if (endpoint.getName().equals(name)) {
                return endpoint;
            }
        }
        throw new ConfigurationException("Unknown " + kind + " endpoint: " + name);
    }

    public List<Preset> getPresets() {
        List<Preset> presets = new ArrayList<>();
        for (int index : indices("preset.")) {
            String prefix = "preset." + index;
            presets.add(new Preset(getRequiredProperty(prefix + ".name"),
                    getRequiredProperty(prefix + ".st_graph"),
                    getRequiredProperty(prefix + ".gdb_graph"),
                    getList(prefix + ".default_filters")));
        }
        return presets;
    }

    public Preset getPreset(String name) {
        for (Preset preset : getPresets()) {
            if (preset.getName().equals(name)) {
                return preset;
            }
        }
        throw new ConfigurationException("Unknown preset: " + name);
    }

    // Label to predicate IRI, in configuration order.
    public Map<String, String> getFilterOptions() {
        Map<String, String> options = new LinkedHashMap<>();
        for (int index : indices("filter.")) {
            String prefix = "filter." + index;
            options.put(getRequiredProperty(prefix + ".label"), getRequiredProperty(prefix + ".iri"));
        }
        return options;
    }

    public FilterSet resolveFilters(Collection<String> labels, Collection<String> extraIris) {
        Map<String, String> options = getFilterOptions();
        Set<String> iris = new LinkedHashSet<>();
        for (String label : labels) {
            String iri = options.get(label);
            if (iri == null) {
                throw new ConfigurationException("Unknown filter label: " + label);
            }
            iris.add(iri);
        }
        iris.addAll(extraIris);
        try {
            return FilterSet.of(iris);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid filter predicate: " + e.getMessage(), e);
        }
    }

    public Set<String> getComponentNames() {
        Set<String> names = new TreeSet<>();
        for (String key : properties.stringPropertyNames()) {
            Matcher matcher = COMPONENT_KEY.matcher(key);
            if (matcher.matches()) {
                names.add(matcher.group(1));
            }
        }
        return names;
    }

    public ComponentProfile getComponent(String name) {
        String prefix = "component." + name;
        String type = getProperty(prefix + ".type");
        if (StringUtils.isEmpty(type)) {
            throw new ConfigurationException("Unknown component: " + name + " (known: " + getComponentNames() + ")");
        }
        String modeValue = getProperty(prefix + ".mode", ComparisonMode.ENTITY_METADATA.name());
        ComparisonMode mode;
        try {
            mode = ComparisonMode.valueOf(modeValue.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown mode for component " + name + ": " + modeValue, e);
        }
        try {
            return new ComponentProfile(name, type, mode,
                    getBoolean(prefix + ".filters", false),
                    getBoolean(prefix + ".sampling", false));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid component " + name + ": " + e.getMessage(), e);
        }
    }

    public ComparisonSettings toSettings() {
        ComparisonSettings.Builder builder = ComparisonSettings.builder()
                .metadataTimeout(Duration.ofSeconds(getInt("timeout.metadata", 60)))
                .deepSubgraphTimeout(Duration.ofSeconds(getInt("timeout.deep_subgraph", 120)))
                .discoveryTimeout(Duration.ofSeconds(getInt("timeout.discovery", 120)))
                .wholeGraphTimeout(Duration.ofSeconds(getInt("timeout.whole_graph", 300)))
                .maxSampleSize(getInt("sample_size", 100))
                .parallelDiscovery(getBoolean("discovery.parallel", true))
                .maxRefinementRounds(getInt("canonicalization.max_rounds", 10_000))
                .maxSearchLeaves(getInt("canonicalization.max_search_leaves", 256));
        String syntax = getProperty("construct.syntax");
        if (StringUtils.isNotEmpty(syntax)) {
            try {
                builder.constructSyntax(RdfSyntax.valueOf(syntax.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown construct.syntax: " + syntax, e);
            }
        }
        String seed = getProperty("sample.seed");
        if (StringUtils.isNotEmpty(seed)) {
            try {
                builder.sampleSeed(Long.parseLong(seed));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Not a number for sample.seed: " + seed, e);
            }
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    // Numeric indices n of keys "<prefix>n.<field>", ascending.
    private List<Integer> indices(String prefix) {
        Set<Integer> indices = new TreeSet<>();
        for (String key : properties.stringPropertyNames()) {
            if (!key.startsWith(prefix)) {
                continue;
            }
            String rest = key.substring(prefix.length());
            int dot = rest.indexOf('.');
            if (dot > 0 && StringUtils.isNumeric(rest.substring(0, dot))) {
                indices.add(Integer.parseInt(rest.substring(0, dot)));
            }
        }
        return new ArrayList<>(indices);
    }
}
