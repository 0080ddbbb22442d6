package kast.term;

import com.google.common.collect.ImmutableList;
import kast.KastJson;
import kast.Matcher;
import kast.Substitution;
import kast.Traversal;

import java.util.List;
import java.util.Optional;

/**
 * An ordered sequence of terms. Nested sequences are flattened into their parent on construction.
 */
final public class Sequence implements Term {

    private final ImmutableList<Term> items;

    private final int hashCode;
    private String hash;

    public Sequence(List<? extends Term> items) {
        ImmutableList.Builder<Term> builder = ImmutableList.builder();
        for (Term item : items) {
            if (item instanceof Sequence nested) {
                builder.addAll(nested.items);
            } else {
                builder.add(item);
            }
        }
        this.items = builder.build();
        this.hashCode = 7 + this.items.hashCode();
    }

    public Sequence(Term... items) {
        this(List.of(items));
    }

    public List<Term> items() {
        return items;
    }

    public int arity() {
        return items.size();
    }

    @Override
    public List<Term> children() {
        return items;
    }

    @Override
    public Sequence withChildren(List<Term> children) {
        return new Sequence(children);
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
        if (!(obj instanceof Sequence other)) return false;
        return Traversal.equal(this, other);
    }
}
