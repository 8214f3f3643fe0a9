package rsv.sync;

/**
 * The bytes returned by a CONSTRUCT query are not valid Turtle / N-Triples.
 */
public class GraphParseException extends Exception {

    public GraphParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
