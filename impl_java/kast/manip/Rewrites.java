package kast.manip;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import kast.Traversal;
import kast.prelude.Ml;
import kast.term.Apply;
import kast.term.Rewrite;
import kast.term.Sequence;
import kast.term.Sort;
import kast.term.Term;
import kast.term.Token;
import kast.term.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public final class Rewrites {

    private Rewrites() {
    }

    public static Term extractLhs(Term term) {
        return Traversal.topDown(t -> t instanceof Rewrite rw ? rw.lhs() : t, term);
    }

    public static Term extractRhs(Term term) {
        return Traversal.topDown(t -> t instanceof Rewrite rw ? rw.rhs() : t, term);
    }

    /**
     * Move rewrites as far down as the shared structure of their two sides allows, so that only
     * the parts that actually change stay under a rewrite.
     */
    public static Term pushDownRewrites(Term term) {
        return Traversal.topDown(Rewrites::pushDownRewrite, term);
    }

    private static Term pushDownRewrite(Term term) {
        if (!(term instanceof Rewrite rw)) return term;
        Term lhs = rw.lhs();
        Term rhs = rw.rhs();

        if (lhs.equals(rhs)) return lhs;
        if (lhs instanceof Variable lv && rhs instanceof Variable rv && lv.name().equals(rv.name())) return lhs;

        if (lhs instanceof Apply la && rhs instanceof Apply ra
                && la.label().equals(ra.label()) && la.arity() == ra.arity()) {
            List<Term> args = new ArrayList<>(la.arity());
            for (int i = 0; i < la.arity(); i++) {
                args.add(new Rewrite(la.args().get(i), ra.args().get(i)));
            }
            return la.withChildren(args);
        }

        if (lhs instanceof Sequence ls && rhs instanceof Sequence rs && ls.arity() > 0 && rs.arity() > 0) {
            List<Term> li = ls.items();
            List<Term> ri = rs.items();
            if (ls.arity() == 1 && rs.arity() == 1) {
                return pushDownRewrite(new Rewrite(li.get(0), ri.get(0)));
            }
            if (li.get(0).equals(ri.get(0))) {
                Term lower = pushDownRewrite(new Rewrite(
                        new Sequence(li.subList(1, li.size())), new Sequence(ri.subList(1, ri.size()))));
                return new Sequence(li.get(0), lower);
            }
            if (li.get(li.size() - 1).equals(ri.get(ri.size() - 1))) {
                Term lower = pushDownRewrite(new Rewrite(
                        new Sequence(li.subList(0, li.size() - 1)), new Sequence(ri.subList(0, ri.size() - 1))));
                return new Sequence(lower, li.get(li.size() - 1));
            }
        }

        if (lhs instanceof Sequence ls && ls.arity() > 0 && rhs instanceof Variable
                && ls.items().get(ls.arity() - 1).equals(rhs)) {
            return new Sequence(
                    new Rewrite(new Sequence(ls.items().subList(0, ls.arity() - 1)), new Sequence()),
                    rhs);
        }
        return term;
    }

    /**
     * Apply the given rewrites at every position until nothing changes. Rewrites are indexed by the
     * head of their left-hand side, so each node is only tried against the ones that could match it.
     */
    public static Term indexedRewrite(Term term, Iterable<Rewrite> rewrites) {
        List<Rewrite> tokenRewrites = new ArrayList<>();
        ListMultimap<String, Rewrite> applyRewrites = ArrayListMultimap.create();
        List<Rewrite> otherRewrites = new ArrayList<>();
        for (Rewrite r : rewrites) {
            if (r.lhs() instanceof Token) {
                tokenRewrites.add(r);
            } else if (r.lhs() instanceof Apply app) {
                applyRewrites.put(app.label().name(), r);
            } else {
                otherRewrites.add(r);
            }
        }

        Term current = term;
        while (true) {
            Term next = Traversal.bottomUp(t -> {
                List<Rewrite> candidates;
                if (t instanceof Token) {
                    candidates = tokenRewrites;
                } else if (t instanceof Apply app) {
                    candidates = applyRewrites.get(app.label().name());
                } else {
                    candidates = otherRewrites;
                }
                Term result = t;
                for (Rewrite r : candidates) {
                    result = r.applyTop(result);
                }
                return result;
            }, current);
            if (next.equals(current)) return next;
            current = next;
        }
    }

    public static Term replaceRewritesWithImplies(Term term) {
        return Traversal.bottomUp(t -> t instanceof Rewrite rw ? Ml.mlImplies(rw.lhs(), rw.rhs()) : t, term);
    }

    /**
     * A variable standing for {@code term}, named {@code base_<first 8 hex digits of its hash>}.
     * Names in {@code existingNames} are avoided by hashing again.
     */
    public static Variable abstractTermSafely(Term term, String base, Optional<Sort> sort, Set<String> existingNames) {
        Variable newVar = new Variable(base + "_" + shortHash(term), sort);
        while (existingNames.contains(newVar.name())) {
            newVar = new Variable(base + "_" + shortHash(newVar), sort);
        }
        return newVar;
    }

    public static Variable abstractTermSafely(Term term, String base, Optional<Sort> sort) {
        return abstractTermSafely(term, base, sort, Set.of());
    }

    public static Variable abstractTermSafely(Term term, String base) {
        return abstractTermSafely(term, base, Optional.empty(), Set.of());
    }

    public static Variable abstractTermSafely(Term term) {
        return abstractTermSafely(term, "V");
    }

    private static String shortHash(Term term) {
        return term.hash().substring(0, 8);
    }
}
