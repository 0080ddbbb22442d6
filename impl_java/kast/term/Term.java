package kast.term;

import kast.KastJson;
import kast.Substitution;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

public sealed interface Term permits Token, Variable, Apply, As, Rewrite, Sequence {
    /**
     * Immediate subterms in order. Leaves have none.
     */
    List<Term> children();

    /**
     * Rebuild this node over a replacement list of children.
     *
     * @throws IllegalArgumentException if the number of children does not fit the node
     */
    Term withChildren(List<Term> children);

    default Term mapChildren(UnaryOperator<Term> f) {
        List<Term> children = children();
        if (children.isEmpty()) return this;
        return withChildren(children.stream().map(f).toList());
    }

    /**
     * Match this term, as a pattern, against a concrete term.
     *
     * @return a substitution {@code s} with {@code s.apply(this).equals(term)}, or empty if there is none
     */
    Optional<Substitution> match(Term term);

    default Map<String, Object> toDict() {
        return KastJson.toDict(this);
    }

    default String toJson() {
        return KastJson.toJson(toDict());
    }

    /**
     * Hex SHA-256 digest of the canonical JSON form.
     */
    default String hash() {
        return KastJson.hash(this);
    }

    static Term fromDict(Map<String, ?> dict) {
        return KastJson.termFromDict(dict);
    }
}
