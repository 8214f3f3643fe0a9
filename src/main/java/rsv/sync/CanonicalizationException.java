package rsv.sync;

/**
 * Blank node refinement did not settle within the configured number of rounds.
 */
public class CanonicalizationException extends RuntimeException {

    public CanonicalizationException(String message) {
        super(message);
    }
}
