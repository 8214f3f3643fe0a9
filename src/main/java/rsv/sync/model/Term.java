package rsv.sync.model;

import org.eclipse.rdf4j.rio.ntriples.NTriplesUtil;

import java.util.Objects;

/**
 * An RDF term. The set of variants is closed: {@link Iri}, {@link Blank} and {@link Literal}.
 * Consumers switch on {@link #kind()}.
 */
public abstract class Term implements Comparable<Term> {

    public enum Kind { IRI, BLANK, LITERAL }

    public static final String XSD_STRING = "http://www.w3.org/2001/XMLSchema#string";
    public static final String RDF_LANG_STRING = "http://www.w3.org/1999/02/22-rdf-syntax-ns#langString";

    private Term() {
    }

    public abstract Kind kind();

    public abstract String toNTriples();

    public static Iri iri(String value) {
        return new Iri(value);
    }

    public static Blank blank(String label) {
        return new Blank(label);
    }

    public static Literal literal(String lexical) {
        return new Literal(lexical, null, null);
    }

    public static Literal langLiteral(String lexical, String language) {
        return new Literal(lexical, language, null);
    }

    public static Literal typedLiteral(String lexical, String datatype) {
        return new Literal(lexical, null, datatype);
    }

    public static Literal literal(String lexical, String language, String datatype) {
        return new Literal(lexical, language, datatype);
    }

    public boolean isIri() {
        return kind() == Kind.IRI;
    }

    public boolean isBlank() {
        return kind() == Kind.BLANK;
    }

    public boolean isLiteral() {
        return kind() == Kind.LITERAL;
    }

    public Iri asIri() {
        if (!isIri()) {
            throw new IllegalStateException("Not an IRI: " + this);
        }
        return (Iri) this;
    }

    public Blank asBlank() {
        if (!isBlank()) {
            throw new IllegalStateException("Not a blank node: " + this);
        }
        return (Blank) this;
    }

    public Literal asLiteral() {
        if (!isLiteral()) {
            throw new IllegalStateException("Not a literal: " + this);
        }
        return (Literal) this;
    }

    // Orders by kind first, then by N-Triples form.
    @Override
    public int compareTo(Term other) {
        int byKind = kind().compareTo(other.kind());
        return byKind != 0 ? byKind : toNTriples().compareTo(other.toNTriples());
    }

    @Override
    public String toString() {
        return toNTriples();
    }

    public static final class Iri extends Term {
        private final String value;

        private Iri(String value) {
            this.value = Objects.requireNonNull(value, "IRI cannot be null");
        }

        public String getValue() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.IRI;
        }

        @Override
        public String toNTriples() {
            return "<" + value + ">";
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Iri)) return false;
            return value.equals(((Iri) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }
    }

    public static final class Blank extends Term {
        private final String label;

        private Blank(String label) {
            this.label = Objects.requireNonNull(label, "Blank node label cannot be null");
        }

        public String getLabel() {
            return label;
        }

        @Override
        public Kind kind() {
            return Kind.BLANK;
        }

        @Override
        public String toNTriples() {
            return "_:" + label;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Blank)) return false;
            return label.equals(((Blank) o).label);
        }

        @Override
        public int hashCode() {
            return 31 * label.hashCode() + 7;
        }
    }

    /**
     * Literal with lexical form, optional language tag and optional datatype.
     * Simple literals ({@code xsd:string}) and language-tagged literals carry no datatype.
     */
    public static final class Literal extends Term {
        private final String lexical;
        private final String language;
        private final String datatype;

        private Literal(String lexical, String language, String datatype) {
            this.lexical = Objects.requireNonNull(lexical, "Lexical form cannot be null");
            this.language = (language == null || language.isEmpty()) ? null : language;
            if (this.language != null || XSD_STRING.equals(datatype) || RDF_LANG_STRING.equals(datatype)) {
                this.datatype = null;
            } else {
                this.datatype = (datatype == null || datatype.isEmpty()) ? null : datatype;
            }
        }

        public String getLexical() {
            return lexical;
        }

        public String getLanguage() {
            return language;
        }

        public String getDatatype() {
            return datatype;
        }

        public Literal withLexical(String newLexical) {
            return new Literal(newLexical, language, datatype);
        }

        @Override
        public Kind kind() {
            return Kind.LITERAL;
        }

        @Override
        public String toNTriples() {
            StringBuilder sb = new StringBuilder();
            sb.append('"').append(NTriplesUtil.escapeString(lexical)).append('"');
            if (language != null) {
                sb.append('@').append(language);
            } else if (datatype != null) {
                sb.append("^^<").append(datatype).append('>');
            }
            return sb.toString();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Literal)) return false;
            Literal other = (Literal) o;
            return lexical.equals(other.lexical)
                    && Objects.equals(language, other.language)
                    && Objects.equals(datatype, other.datatype);
        }

        @Override
        public int hashCode() {
            return Objects.hash(lexical, language, datatype);
        }
    }
}
