package rsv.sync.transport;

/**
 * Non-success HTTP status or timeout while talking to a SPARQL endpoint.
 */
public class TransportException extends Exception {

    private final String endpoint;
    private final int statusCode;

    public TransportException(String endpoint, String message) {
        this(endpoint, -1, message, null);
    }

    public TransportException(String endpoint, String message, Throwable cause) {
        this(endpoint, -1, message, cause);
    }

    public TransportException(String endpoint, int statusCode, String message, Throwable cause) {
        super(endpoint + ": " + message, cause);
        this.endpoint = endpoint;
        this.statusCode = statusCode;
    }

    public String getEndpoint() {
        return endpoint;
    }

    // -1 when no response was received.
    public int getStatusCode() {
        return statusCode;
    }
}
