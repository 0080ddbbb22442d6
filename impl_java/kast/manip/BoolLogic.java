package kast.manip;

import kast.Traversal;
import kast.prelude.KBool;
import kast.prelude.KInt;
import kast.prelude.Ml;
import kast.term.Apply;
import kast.term.Rewrite;
import kast.term.Sequence;
import kast.term.Sort;
import kast.term.Term;
import kast.term.Token;
import kast.term.Variable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

import static kast.prelude.K.GENERATED_TOP_CELL;
import static kast.prelude.KBool.FALSE;
import static kast.prelude.KBool.TRUE;

/**
 * Conversion between matching-logic predicates and Bool expressions, and simplification of the latter.
 */
public final class BoolLogic {
    private static final Logger log = LogManager.getLogger(BoolLogic.class);

    private static final List<Rewrite> SIMPLIFY_RULES = simplifyRules();

    private BoolLogic() {
    }

    /**
     * A term is term-like if it contains no matching-logic connective and no {@code @}-variable.
     */
    public static boolean isTermLike(Term term) {
        boolean[] nonTermFound = {false};
        Traversal.collect(t -> {
            if (t instanceof Variable v && v.name().startsWith("@")) {
                nonTermFound[0] = true;
            } else if (t instanceof Apply app && Ml.LABELS.contains(app.label().name())) {
                nonTermFound[0] = true;
            }
        }, term);
        return !nonTermFound[0];
    }

    /**
     * Split a Bool conjunction into {@code #Equals(true, _)} predicates. The literals {@code true} and
     * {@code false} become {@code #Top} and {@code #Bottom}.
     */
    public static Term boolToMlPred(Term term, Sort sort) {
        List<Term> conjuncts = Traversal.flattenLabel(KBool.AND_BOOL.name(), term).stream()
                .map(c -> {
                    if (TRUE.equals(c)) return (Term) Ml.mlTop(sort);
                    if (FALSE.equals(c)) return Ml.mlBottom(sort);
                    return Ml.mlEqualsTrue(c, sort);
                })
                .toList();
        return Ml.mlAnd(conjuncts, sort);
    }

    public static Term boolToMlPred(Term term) {
        return boolToMlPred(term, GENERATED_TOP_CELL);
    }

    public static Term mlPredToBool(Term term) {
        return mlPredToBool(term, false);
    }

    /**
     * Translate a matching-logic predicate into an expression of sort Bool.
     * <p>
     * In unsafe mode, equalities between arbitrary patterns become {@code _==K_}, and {@code #Ceil} and
     * {@code #Exists} subterms are replaced by fresh variables named after their hash. This loses
     * information and is logged.
     *
     * @throws IllegalArgumentException if the predicate has no Bool counterpart
     */
    public static Term mlPredToBool(Term term, boolean unsafe) {
        if (term instanceof Apply k) {
            String label = k.label().name();
            List<Term> args = k.args();
            switch (label) {
                case Ml.TOP:
                    return TRUE;
                case Ml.BOTTOM:
                    return FALSE;
                case Ml.NOT:
                    if (args.size() == 1) return KBool.notBool(mlPredToBool(args.get(0), unsafe));
                    break;
                case Ml.AND:
                    return KBool.andBool(args.stream().map(a -> mlPredToBool(a, unsafe)).toList());
                case Ml.OR:
                    return KBool.orBool(args.stream().map(a -> mlPredToBool(a, unsafe)).toList());
                case Ml.IMPLIES:
                    if (args.size() == 2) {
                        return KBool.impliesBool(mlPredToBool(args.get(0), unsafe), mlPredToBool(args.get(1), unsafe));
                    }
                    break;
                case Ml.EQUALS: {
                    if (args.size() != 2) break;
                    Optional<Term> converted = equalsToBool(args.get(0), args.get(1));
                    if (converted.isPresent()) return converted.get();
                    break;
                }
                default:
                    break;
            }

            if (unsafe) {
                if (label.equals(Ml.EQUALS)) {
                    return new Apply(KBool.EQ_K, args);
                }
                if (label.equals(Ml.CEIL) || label.equals(Ml.EXISTS)) {
                    Variable abstracted = Rewrites.abstractTermSafely(k, label.substring(1));
                    log.warn("Converting {} condition to variable {}: {}", label, abstracted.name(), k);
                    return abstracted;
                }
            }
        }
        throw new IllegalArgumentException("Could not convert ML predicate to sort Bool: " + term);
    }

    private static Optional<Term> equalsToBool(Term first, Term second) {
        if (TRUE.equals(first)) return Optional.of(second);
        if (FALSE.equals(first)) return Optional.of(KBool.notBool(second));
        if (TRUE.equals(second)) return Optional.of(first);
        if (FALSE.equals(second)) return Optional.of(KBool.notBool(first));

        if (first instanceof Variable || first instanceof Token) {
            return Optional.of(sortedEquality(first, second, leafSort(first)));
        }
        if (second instanceof Variable || second instanceof Token) {
            return Optional.of(sortedEquality(first, second, leafSort(second)));
        }
        if (first instanceof Sequence s1 && second instanceof Sequence s2 && s1.arity() == 1 && s2.arity() == 1) {
            return Optional.of(KBool.eqK(s1.items().get(0), s2.items().get(0)));
        }
        if (isTermLike(first) && isTermLike(second)) {
            return Optional.of(KBool.eqK(first, second));
        }
        return Optional.empty();
    }

    private static Term sortedEquality(Term first, Term second, Optional<Sort> sort) {
        if (sort.isPresent() && sort.get().equals(KInt.INT)) return KInt.eqInt(first, second);
        return KBool.eqK(first, second);
    }

    private static Optional<Sort> leafSort(Term term) {
        if (term instanceof Token token) return Optional.of(token.sort());
        if (term instanceof Variable var) return var.sort();
        return Optional.empty();
    }

    private static List<Rewrite> simplifyRules() {
        Variable lhs = new Variable("#LHS");
        Variable rhs = new Variable("#RHS");
        Variable v1 = new Variable("#V1");
        Variable v2 = new Variable("#V2");
        Variable rest = new Variable("#REST");
        return List.of(
                new Rewrite(KBool.eqK(lhs, TRUE), lhs),
                new Rewrite(KBool.eqK(TRUE, rhs), rhs),
                new Rewrite(KBool.eqK(lhs, FALSE), KBool.notBool(lhs)),
                new Rewrite(KBool.eqK(FALSE, rhs), KBool.notBool(rhs)),
                new Rewrite(KBool.notBool(FALSE), TRUE),
                new Rewrite(KBool.notBool(TRUE), FALSE),
                new Rewrite(KBool.notBool(KBool.notBool(v1)), v1),
                new Rewrite(KBool.notBool(KBool.eqK(v1, v2)), KBool.neqK(v1, v2)),
                new Rewrite(KBool.notBool(KBool.neqK(v1, v2)), KBool.eqK(v1, v2)),
                new Rewrite(KBool.notBool(KInt.eqInt(v1, v2)), KInt.neqInt(v1, v2)),
                new Rewrite(KBool.notBool(KInt.neqInt(v1, v2)), KInt.eqInt(v1, v2)),
                new Rewrite(new Apply(KBool.AND_BOOL, TRUE, rest), rest),
                new Rewrite(new Apply(KBool.AND_BOOL, rest, TRUE), rest),
                new Rewrite(new Apply(KBool.AND_BOOL, FALSE, rest), FALSE),
                new Rewrite(new Apply(KBool.AND_BOOL, rest, FALSE), FALSE),
                new Rewrite(new Apply(KBool.OR_BOOL, FALSE, rest), rest),
                new Rewrite(new Apply(KBool.OR_BOOL, rest, FALSE), rest),
                new Rewrite(new Apply(KBool.OR_BOOL, TRUE, rest), TRUE),
                new Rewrite(new Apply(KBool.OR_BOOL, rest, TRUE), TRUE));
    }

    /**
     * Apply the local simplification rules everywhere until none of them applies.
     */
    public static Term simplifyBool(Term term) {
        Term current = term;
        while (true) {
            Term next = current;
            for (Rewrite rule : SIMPLIFY_RULES) {
                next = rule.apply(next);
            }
            if (next.equals(current)) return next;
            current = next;
        }
    }

    /**
     * Canonical form of a constraint: through Bool, simplified, and back.
     */
    public static Term normalizeMlPred(Term pred) {
        return boolToMlPred(simplifyBool(mlPredToBool(pred)));
    }
}
