package rsv.sync;

/**
 * States of one comparison run.
 */
public enum RunState {
    IDLE,
    DISCOVERING,
    POPULATION_COMPARED,
    ABORTED,
    SAMPLING,
    FETCHING,
    PER_ENTITY_COMPARING,
    REPORTING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == ABORTED || this == DONE || this == FAILED;
    }
}
