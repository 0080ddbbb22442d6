package kast.term;

import kast.KastJson;
import kast.Matcher;
import kast.Substitution;
import kast.Traversal;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A one-step transition {@code lhs => rhs}.
 */
final public class Rewrite implements Term {

    private final Term lhs;
    private final Term rhs;

    private final int hashCode;
    private String hash;

    public Rewrite(Term lhs, Term rhs) {
        this.lhs = Objects.requireNonNull(lhs);
        this.rhs = Objects.requireNonNull(rhs);
        this.hashCode = 37 * lhs.hashCode() + rhs.hashCode();
    }

    public Term lhs() {
        return lhs;
    }

    public Term rhs() {
        return rhs;
    }

    /**
     * Rewrite {@code term} if the left-hand side matches it as a pattern, otherwise return it unchanged.
     */
    public Term applyTop(Term term) {
        return lhs.match(term).map(subst -> subst.apply(rhs)).orElse(term);
    }

    /**
     * Apply {@link #applyTop} at every position, bottom-up.
     */
    public Term apply(Term term) {
        return Traversal.bottomUp(this::applyTop, term);
    }

    /**
     * Replace {@code term} with the right-hand side if it is syntactically the left-hand side.
     */
    public Term replaceTop(Term term) {
        return lhs.equals(term) ? rhs : term;
    }

    public Term replace(Term term) {
        return Traversal.bottomUp(this::replaceTop, term);
    }

    @Override
    public List<Term> children() {
        return List.of(lhs, rhs);
    }

    @Override
    public Rewrite withChildren(List<Term> children) {
        if (children.size() != 2) throw new IllegalArgumentException("Rewrite takes 2 children, got " + children.size());
        return new Rewrite(children.get(0), children.get(1));
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
        if (!(obj instanceof Rewrite other)) return false;
        return Traversal.equal(this, other);
    }
}
