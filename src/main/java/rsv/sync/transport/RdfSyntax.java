package rsv.sync.transport;

/**
 * Serializations a CONSTRUCT query may be asked to return.
 */
public enum RdfSyntax {
    TURTLE("text/turtle"),
    NTRIPLES("application/n-triples");

    private final String mediaType;

    RdfSyntax(String mediaType) {
        this.mediaType = mediaType;
    }

    public String getMediaType() {
        return mediaType;
    }
}
