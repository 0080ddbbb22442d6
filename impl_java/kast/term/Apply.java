package kast.term;

import com.google.common.collect.ImmutableList;
import kast.Matcher;
import kast.KastJson;
import kast.Substitution;
import kast.Traversal;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

final public class Apply implements Term {

    private final Label label;
    private final ImmutableList<Term> args;

    private final int hashCode;
    private String hash;

    public Apply(Label label, List<? extends Term> args) {
        this.label = Objects.requireNonNull(label);
        this.args = ImmutableList.copyOf(args);
        this.hashCode = 31 * label.hashCode() + this.args.hashCode();
    }

    public Apply(Label label, Term... args) {
        this(label, List.of(args));
    }

    public Apply(String label, Term... args) {
        this(new Label(label), List.of(args));
    }

    public Apply(String label, List<? extends Term> args) {
        this(new Label(label), args);
    }

    public Label label() {
        return label;
    }

    public List<Term> args() {
        return args;
    }

    public int arity() {
        return args.size();
    }

    /**
     * Whether this application is a configuration cell, i.e. its label is written {@code <name>}.
     */
    public boolean isCell() {
        String name = label.name();
        return name.length() > 1 && name.startsWith("<") && name.endsWith(">");
    }

    public Apply withLabel(Label newLabel) {
        return new Apply(newLabel, args);
    }

    @Override
    public List<Term> children() {
        return args;
    }

    @Override
    public Apply withChildren(List<Term> children) {
        return new Apply(label, children);
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
        if (!(obj instanceof Apply other)) return false;
        return Traversal.equal(this, other);
    }
}
