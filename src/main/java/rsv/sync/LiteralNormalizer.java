package rsv.sync;

import rsv.sync.model.RdfTriple;
import rsv.sync.model.Term;

import java.text.Normalizer;

/**
 * Rewrites literal lexical forms to Unicode NFC so that stores serializing the same
 * characters with different decompositions compare equal.
 */
public class LiteralNormalizer {

    private LiteralNormalizer() {
    }

    public static Term.Literal normalize(Term.Literal literal) {
        String lexical = literal.getLexical();
        if (Normalizer.isNormalized(lexical, Normalizer.Form.NFC)) {
            return literal;
        }
        return literal.withLexical(Normalizer.normalize(lexical, Normalizer.Form.NFC));
    }

    // IRIs and blank nodes are returned as they are.
    public static Term normalize(Term term) {
        switch (term.kind()) {
            case LITERAL:
                return normalize(term.asLiteral());
            case IRI:
            case BLANK:
                return term;
            default:
                throw new IllegalArgumentException("Unknown term kind: " + term.kind());
        }
    }

    public static RdfTriple normalize(RdfTriple triple) {
        Term object = triple.getObject();
        Term normalized = normalize(object);
        return normalized == object ? triple : triple.withObject(normalized);
    }
}
