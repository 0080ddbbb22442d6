package kast;

import kast.term.Apply;
import kast.term.Sequence;
import kast.term.Term;
import kast.term.Token;
import kast.term.Variable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class Matcher {
    public static Optional<Substitution> match(Term pattern, Term term) {
        return matchAll(List.of(pattern), List.of(term));
    }

    /**
     * Union all the given match results, failing if any of them failed or if two of them disagree
     * on the value of a variable.
     */
    public static Optional<Substitution> combineMatches(Iterable<Optional<Substitution>> matches) {
        Substitution current = Substitution.empty();
        for (Optional<Substitution> match : matches) {
            if (match.isEmpty()) return Optional.empty();
            Optional<Substitution> res = current.union(match.get());
            if (res.isEmpty()) return Optional.empty();
            current = res.get();
        }
        return Optional.of(current);
    }

    /**
     * Match patterns against terms pairwise and combine the results. Pairs of subterms wait on a
     * work stack and are visited left to right; the first failure or conflicting binding stops the match.
     */
    public static Optional<Substitution> matchAll(List<Term> patterns, List<Term> terms) {
        if (patterns.size() != terms.size()) return Optional.empty();
        Map<String, Term> bindings = new LinkedHashMap<>();
        Deque<Term> pending = new ArrayDeque<>();
        Deque<Term> against = new ArrayDeque<>();
        pushPairs(pending, against, patterns, terms);
        while (!pending.isEmpty()) {
            Term pattern = pending.pop();
            Term term = against.pop();
            if (pattern instanceof Variable var) {
                Term bound = bindings.putIfAbsent(var.name(), term);
                if (bound != null && !bound.equals(term)) return Optional.empty();
            } else if (pattern instanceof Token) {
                if (!pattern.equals(term)) return Optional.empty();
            } else if (pattern instanceof Apply app) {
                if (!(term instanceof Apply other && app.label().equals(other.label()) && app.arity() == other.arity())) {
                    return Optional.empty();
                }
                pushPairs(pending, against, app.args(), other.args());
            } else if (pattern instanceof Sequence seq) {
                if (!(term instanceof Sequence other)) return Optional.empty();
                Optional<List<Term>> aligned = alignItems(seq, other);
                if (aligned.isEmpty()) return Optional.empty();
                pushPairs(pending, against, seq.items(), aligned.get());
            } else {
                // As and Rewrite match component-wise
                if (pattern.getClass() != term.getClass()) return Optional.empty();
                pushPairs(pending, against, pattern.children(), term.children());
            }
        }
        return Optional.of(Substitution.of(bindings));
    }

    /**
     * Items are matched pairwise. A shorter pattern whose last item is a variable not used
     * elsewhere in the pattern binds that variable to the remaining tail of the term.
     */
    private static Optional<List<Term>> alignItems(Sequence pattern, Sequence term) {
        int arity = pattern.arity();
        if (arity == term.arity()) return Optional.of(term.items());
        if (arity == 0 || arity >= term.arity()) return Optional.empty();
        if (!(pattern.items().get(arity - 1) instanceof Variable tail)) return Optional.empty();

        List<Term> front = pattern.items().subList(0, arity - 1);
        if (Traversal.freeVars(new Sequence(front)).contains(tail.name())) return Optional.empty();

        List<Term> aligned = new ArrayList<>(term.items().subList(0, arity - 1));
        aligned.add(new Sequence(term.items().subList(arity - 1, term.arity())));
        return Optional.of(aligned);
    }

    private static void pushPairs(Deque<Term> pending, Deque<Term> against, List<Term> patterns, List<Term> terms) {
        for (int i = patterns.size() - 1; i >= 0; i--) {
            pending.push(patterns.get(i));
            against.push(terms.get(i));
        }
    }
}
