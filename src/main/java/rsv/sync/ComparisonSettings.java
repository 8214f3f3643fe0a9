package rsv.sync;

import rsv.sync.transport.RdfSyntax;

import java.time.Duration;

/**
 * Immutable settings of one comparison run.
 */
public class ComparisonSettings {

    private final Duration metadataTimeout;
    private final Duration deepSubgraphTimeout;
    private final Duration discoveryTimeout;
    private final Duration wholeGraphTimeout;
    private final int maxSampleSize;
    private final Long sampleSeed;
    private final boolean parallelDiscovery;
    private final RdfSyntax constructSyntax;
    private final int maxRefinementRounds;
    private final int maxSearchLeaves;

    private ComparisonSettings(Builder builder) {
        this.metadataTimeout = builder.metadataTimeout;
        this.deepSubgraphTimeout = builder.deepSubgraphTimeout;
        this.discoveryTimeout = builder.discoveryTimeout;
        this.wholeGraphTimeout = builder.wholeGraphTimeout;
        this.maxSampleSize = builder.maxSampleSize;
        this.sampleSeed = builder.sampleSeed;
        this.parallelDiscovery = builder.parallelDiscovery;
        this.constructSyntax = builder.constructSyntax;
        this.maxRefinementRounds = builder.maxRefinementRounds;
        this.maxSearchLeaves = builder.maxSearchLeaves;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ComparisonSettings defaults() {
        return builder().build();
    }

    public Duration timeoutFor(ComparisonMode mode) {
        switch (mode) {
            case WHOLE_GRAPH:
                return wholeGraphTimeout;
            case ENTITY_METADATA:
                return metadataTimeout;
            case DEEP_SUBGRAPH:
                return deepSubgraphTimeout;
            default:
                throw new IllegalArgumentException("Unknown mode: " + mode);
        }
    }

    public Duration getDiscoveryTimeout() {
        return discoveryTimeout;
    }

    public int getMaxSampleSize() {
        return maxSampleSize;
    }

    // Null when sampling should not be reproducible.
    public Long getSampleSeed() {
        return sampleSeed;
    }

    public boolean isParallelDiscovery() {
        return parallelDiscovery;
    }

    public RdfSyntax getConstructSyntax() {
        return constructSyntax;
    }

    public int getMaxRefinementRounds() {
        return maxRefinementRounds;
    }

    public int getMaxSearchLeaves() {
        return maxSearchLeaves;
    }

    public static class Builder {
        private Duration metadataTimeout = Duration.ofSeconds(60);
        private Duration deepSubgraphTimeout = Duration.ofSeconds(120);
        private Duration discoveryTimeout = Duration.ofSeconds(120);
        private Duration wholeGraphTimeout = Duration.ofSeconds(300);
        private int maxSampleSize = 100;
        private Long sampleSeed;
        private boolean parallelDiscovery = true;
        private RdfSyntax constructSyntax = RdfSyntax.NTRIPLES;
        private int maxRefinementRounds = Canonicalizer.DEFAULT_MAX_ROUNDS;
        private int maxSearchLeaves = Canonicalizer.DEFAULT_MAX_SEARCH_LEAVES;

        public Builder metadataTimeout(Duration timeout) {
            this.metadataTimeout = timeout;
            return this;
        }

        public Builder deepSubgraphTimeout(Duration timeout) {
            this.deepSubgraphTimeout = timeout;
            return this;
        }

        public Builder discoveryTimeout(Duration timeout) {
            this.discoveryTimeout = timeout;
            return this;
        }

        public Builder wholeGraphTimeout(Duration timeout) {
            this.wholeGraphTimeout = timeout;
            return this;
        }

        public Builder maxSampleSize(int maxSampleSize) {
            this.maxSampleSize = maxSampleSize;
            return this;
        }

        public Builder sampleSeed(Long sampleSeed) {
            this.sampleSeed = sampleSeed;
            return this;
        }

        public Builder parallelDiscovery(boolean parallelDiscovery) {
            this.parallelDiscovery = parallelDiscovery;
            return this;
        }

        public Builder constructSyntax(RdfSyntax constructSyntax) {
            this.constructSyntax = constructSyntax;
            return this;
        }

        public Builder maxRefinementRounds(int maxRefinementRounds) {
            this.maxRefinementRounds = maxRefinementRounds;
            return this;
        }

        public Builder maxSearchLeaves(int maxSearchLeaves) {
            this.maxSearchLeaves = maxSearchLeaves;
            return this;
        }

        public ComparisonSettings build() {
            if (maxSampleSize < 1) {
                throw new IllegalArgumentException("Max sample size must be at least 1");
            }
            return new ComparisonSettings(this);
        }
    }
}
