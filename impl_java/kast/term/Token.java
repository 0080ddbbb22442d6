package kast.term;

import kast.Matcher;
import kast.Substitution;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record Token(String token, Sort sort) implements Term {
    public Token {
        Objects.requireNonNull(token);
        Objects.requireNonNull(sort);
    }

    public Token(String token, String sort) {
        this(token, new Sort(sort));
    }

    @Override
    public List<Term> children() {
        return List.of();
    }

    @Override
    public Term withChildren(List<Term> children) {
        if (!children.isEmpty()) throw new IllegalArgumentException("Token takes no children, got " + children.size());
        return this;
    }

    @Override
    public Optional<Substitution> match(Term term) {
        return Matcher.match(this, term);
    }

    @Override
    public String toString() {
        return token;
    }
}
