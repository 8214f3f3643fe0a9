package rsv.sync;

import org.apache.jena.graph.Node;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFParser;
import org.apache.jena.riot.RiotException;
import org.apache.jena.riot.system.StreamRDFBase;
import rsv.sync.model.RdfGraph;
import rsv.sync.model.RdfTriple;
import rsv.sync.model.Term;
import rsv.sync.transport.RdfSyntax;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Collects parsed triples into an {@link RdfGraph}. Every literal object is NFC normalized
 * and triples with an excluded predicate are dropped before they enter the graph.
 */
public class GraphBuilder extends StreamRDFBase {

    private final FilterSet filters;
    private final RdfGraph graph = new RdfGraph();

    public GraphBuilder(FilterSet filters) {
        this.filters = filters;
    }

    public static RdfGraph parse(byte[] payload, RdfSyntax syntax, FilterSet filters) throws GraphParseException {
        GraphBuilder builder = new GraphBuilder(filters);
        String text;
        try {
            text = decodeUtf8(payload);
        } catch (CharacterCodingException e) {
            throw new GraphParseException("Invalid " + syntax + " payload: not valid UTF-8 (" + e + ")", e);
        }
        try {
            RDFParser.fromString(text).lang(toLang(syntax)).parse(builder);
        } catch (RiotException | IllegalArgumentException e) {
            throw new GraphParseException("Invalid " + syntax + " payload: " + e.getMessage(), e);
        }
        return builder.build();
    }

    // RIOT replaces malformed sequences with U+FFFD, which would let different bytes compare equal.
    static String decodeUtf8(byte[] payload) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(payload))
                .toString();
    }

    @Override
    public void triple(org.apache.jena.graph.Triple triple) {
        add(RdfTriple.of(toTerm(triple.getSubject()), toTerm(triple.getPredicate()), toTerm(triple.getObject())));
    }

    public void add(RdfTriple triple) {
        if (filters.shouldExclude(triple.getPredicate().getValue())) {
            return;
        }
        graph.add(LiteralNormalizer.normalize(triple));
    }

    public RdfGraph build() {
        return graph;
    }

    static Term toTerm(Node node) {
        if (node.isURI()) {
            return Term.iri(node.getURI());
        } else if (node.isBlank()) {
            return Term.blank(node.getBlankNodeLabel());
        } else if (node.isLiteral()) {
            return Term.literal(node.getLiteralLexicalForm(), node.getLiteralLanguage(), node.getLiteralDatatypeURI());
        }
        throw new IllegalArgumentException("Unsupported RDF node: " + node);
    }

    private static Lang toLang(RdfSyntax syntax) {
        switch (syntax) {
            case TURTLE:
                return Lang.TURTLE;
            case NTRIPLES:
                return Lang.NTRIPLES;
            default:
                throw new IllegalArgumentException("Unsupported syntax: " + syntax);
        }
    }
}
