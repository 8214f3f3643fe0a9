package rsv.sync;

import org.junit.Test;
import rsv.sync.model.RdfTriple;
import rsv.sync.model.Term;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;

public class LiteralNormalizerTest {

    private static final String CAFE_NFC = "caf\u00e9";
    private static final String CAFE_NFD = "cafe\u0301";

    @Test
    public void testDecomposedFormIsComposed() {
        assertNotEquals(Term.literal(CAFE_NFC), Term.literal(CAFE_NFD));
        assertEquals(Term.literal(CAFE_NFC), LiteralNormalizer.normalize(Term.literal(CAFE_NFD)));
    }

    @Test
    public void testLanguageAndDatatypeKept() {
        Term.Literal tagged = LiteralNormalizer.normalize(Term.langLiteral(CAFE_NFD, "fr"));
        assertEquals("fr", tagged.getLanguage());
        assertEquals(CAFE_NFC, tagged.getLexical());

        Term.Literal typed = LiteralNormalizer.normalize(Term.typedLiteral(CAFE_NFD, "http://example.org/dt"));
        assertEquals("http://example.org/dt", typed.getDatatype());
    }

    @Test
    public void testNormalizedLiteralReturnedAsIs() {
        Term.Literal literal = Term.literal(CAFE_NFC);
        assertSame(literal, LiteralNormalizer.normalize(literal));
    }

    @Test
    public void testNonLiteralsUntouched() {
        Term iri = Term.iri("http://example.org/" + CAFE_NFD);
        assertSame(iri, LiteralNormalizer.normalize(iri));
        Term blank = Term.blank("b1");
        assertSame(blank, LiteralNormalizer.normalize(blank));
    }

    @Test
    public void testTripleObjectNormalized() {
        RdfTriple triple = RdfTriple.of(Term.iri("http://example.org/s"), Term.iri("http://example.org/p"), Term.literal(CAFE_NFD));
        RdfTriple normalized = LiteralNormalizer.normalize(triple);
        assertEquals(Term.literal(CAFE_NFC), normalized.getObject());
        assertEquals(triple.getSubject(), normalized.getSubject());
    }
}
