package kast.term;

import kast.KastJson;
import kast.Matcher;
import kast.Substitution;
import kast.Traversal;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A pattern bound to an alias, {@code pattern #as alias}.
 */
final public class As implements Term {

    private final Term pattern;
    private final Term alias;

    private final int hashCode;
    private String hash;

    public As(Term pattern, Term alias) {
        this.pattern = Objects.requireNonNull(pattern);
        this.alias = Objects.requireNonNull(alias);
        this.hashCode = 17 * pattern.hashCode() + alias.hashCode();
    }

    public Term pattern() {
        return pattern;
    }

    public Term alias() {
        return alias;
    }

    @Override
    public List<Term> children() {
        return List.of(pattern, alias);
    }

    @Override
    public As withChildren(List<Term> children) {
        if (children.size() != 2) throw new IllegalArgumentException("As takes 2 children, got " + children.size());
        return new As(children.get(0), children.get(1));
    }

    @Override
    public Optional<Substitution> match(Term term) {
        return Matcher.match(this, term);
    }

    @Override
    public String hash() {
        String h = hash;
        if (h == null) {
            h = KastJson.hash(this);
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        return Printer.print(this);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof As other)) return false;
        return Traversal.equal(this, other);
    }
}
