package rsv.sync.model;

import java.util.Objects;

/**
 * Immutable RDF triple. The subject is an IRI or blank node, the predicate an IRI.
 */
public class RdfTriple implements Comparable<RdfTriple> {

    private final Term subject;
    private final Term.Iri predicate;
    private final Term object;
    private String ntriples;

    public RdfTriple(Term subject, Term.Iri predicate, Term object) {
        this.subject = Objects.requireNonNull(subject, "Subject cannot be null");
        this.predicate = Objects.requireNonNull(predicate, "Predicate cannot be null");
        this.object = Objects.requireNonNull(object, "Object cannot be null");
        if (subject.isLiteral()) {
            throw new IllegalArgumentException("Literal cannot be a subject: " + subject);
        }
    }

    public static RdfTriple of(Term subject, Term predicate, Term object) {
        return new RdfTriple(subject, predicate.asIri(), object);
    }

    public Term getSubject() {
        return subject;
    }

    public Term.Iri getPredicate() {
        return predicate;
    }

    public Term getObject() {
        return object;
    }

    public boolean hasBlankNode() {
        return subject.isBlank() || object.isBlank();
    }

    public RdfTriple withObject(Term newObject) {
        return new RdfTriple(subject, predicate, newObject);
    }

    // One N-Triples line, without the trailing newline.
    public String toNTriples() {
        if (ntriples == null) {
            ntriples = subject.toNTriples() + " " + predicate.toNTriples() + " " + object.toNTriples() + " .";
        }
        return ntriples;
    }

    @Override
    public int compareTo(RdfTriple other) {
        return toNTriples().compareTo(other.toNTriples());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RdfTriple)) return false;
        RdfTriple other = (RdfTriple) o;
        return subject.equals(other.subject)
                && predicate.equals(other.predicate)
                && object.equals(other.object);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, predicate, object);
    }

    @Override
    public String toString() {
        return toNTriples();
    }
}
