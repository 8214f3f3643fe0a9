package rsv.sync;

/**
 * Fetch granularity of a comparison run.
 */
public enum ComparisonMode {
    /** The whole named graph as one unit, with predicate filtering. */
    WHOLE_GRAPH,
    /** Triples whose subject is the entity, with predicate filtering. */
    ENTITY_METADATA,
    /** The entity and its nested blank node structure, never filtered. */
    DEEP_SUBGRAPH
}
