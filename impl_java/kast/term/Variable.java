package kast.term;

import kast.Matcher;
import kast.Substitution;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record Variable(String name, Optional<Sort> sort) implements Term {
    /** Marks a variable that occurs only once in a rule. */
    public static final String UNUSED_PREFIX = "_";
    /** Marks a variable bound only on the right-hand side of a rule. */
    public static final String EXISTENTIAL_PREFIX = "?";

    public Variable {
        Objects.requireNonNull(name);
        Objects.requireNonNull(sort);
    }

    public Variable(String name) {
        this(name, Optional.empty());
    }

    public Variable(String name, Sort sort) {
        this(name, Optional.of(sort));
    }

    public boolean isAnonymous() {
        return name.startsWith(UNUSED_PREFIX);
    }

    public boolean isExistential() {
        return name.startsWith(EXISTENTIAL_PREFIX);
    }

    public Variable withName(String newName) {
        return new Variable(newName, sort);
    }

    public Variable withSort(Sort newSort) {
        return new Variable(name, Optional.of(newSort));
    }

    public Variable withoutSort() {
        return new Variable(name);
    }

    @Override
    public List<Term> children() {
        return List.of();
    }

    @Override
    public Term withChildren(List<Term> children) {
        if (!children.isEmpty()) throw new IllegalArgumentException("Variable takes no children, got " + children.size());
        return this;
    }

    @Override
    public Optional<Substitution> match(Term term) {
        return Matcher.match(this, term);
    }

    @Override
    public String toString() {
        return sort.map(s -> name + ":" + s.name()).orElse(name);
    }
}
