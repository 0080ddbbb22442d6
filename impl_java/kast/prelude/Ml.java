package kast.prelude;

import kast.Traversal;
import kast.term.Apply;
import kast.term.Label;
import kast.term.Sort;
import kast.term.Term;
import kast.term.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static kast.prelude.K.GENERATED_TOP_CELL;
import static kast.prelude.K.K_ITEM;

/**
 * Matching-logic connectives. Unless given, the result sort is {@code GeneratedTopCell}.
 */
public final class Ml {
    public static final String TOP = "#Top";
    public static final String BOTTOM = "#Bottom";
    public static final String NOT = "#Not";
    public static final String AND = "#And";
    public static final String OR = "#Or";
    public static final String IMPLIES = "#Implies";
    public static final String EQUALS = "#Equals";
    public static final String CEIL = "#Ceil";
    public static final String EXISTS = "#Exists";
    public static final String FORALL = "#Forall";

    public static final Set<String> LABELS = Set.of(EQUALS, AND, OR, TOP, BOTTOM, IMPLIES, NOT, CEIL, FORALL, EXISTS);

    private Ml() {
    }

    /**
     * Whether a term is {@code #Top}. A weak check also accepts conjunctions of {@code #Top}.
     */
    public static boolean isTop(Term term, boolean weak) {
        if (hasLabel(term, TOP)) return true;
        if (!weak) return false;
        List<Term> flat = Traversal.flattenLabel(AND, term);
        if (flat.size() == 1) return isTop(flat.get(0), false);
        return flat.stream().allMatch(t -> isTop(t, true));
    }

    public static boolean isTop(Term term) {
        return isTop(term, false);
    }

    /**
     * Whether a term is {@code #Bottom}. A weak check also accepts conjunctions with a {@code #Bottom} conjunct.
     */
    public static boolean isBottom(Term term, boolean weak) {
        if (hasLabel(term, BOTTOM)) return true;
        if (!weak) return false;
        List<Term> flat = Traversal.flattenLabel(AND, term);
        if (flat.size() == 1) return isBottom(flat.get(0), false);
        return flat.stream().anyMatch(t -> isBottom(t, true));
    }

    public static boolean isBottom(Term term) {
        return isBottom(term, false);
    }

    private static boolean hasLabel(Term term, String name) {
        return term instanceof Apply app && app.label().name().equals(name);
    }

    public static Apply mlEquals(Term t1, Term t2, Sort argSort, Sort sort) {
        return new Apply(new Label(EQUALS, argSort, sort), t1, t2);
    }

    public static Apply mlEquals(Term t1, Term t2, Sort argSort) {
        return mlEquals(t1, t2, argSort, GENERATED_TOP_CELL);
    }

    public static Apply mlEquals(Term t1, Term t2) {
        return mlEquals(t1, t2, K.K, GENERATED_TOP_CELL);
    }

    public static Apply mlEqualsTrue(Term term, Sort sort) {
        return mlEquals(KBool.TRUE, term, KBool.BOOL, sort);
    }

    public static Apply mlEqualsTrue(Term term) {
        return mlEqualsTrue(term, GENERATED_TOP_CELL);
    }

    public static Apply mlEqualsFalse(Term term, Sort sort) {
        return mlEquals(KBool.FALSE, term, KBool.BOOL, sort);
    }

    public static Apply mlEqualsFalse(Term term) {
        return mlEqualsFalse(term, GENERATED_TOP_CELL);
    }

    public static Apply mlTop(Sort sort) {
        return new Apply(new Label(TOP, sort));
    }

    public static Apply mlTop() {
        return mlTop(GENERATED_TOP_CELL);
    }

    public static Apply mlBottom(Sort sort) {
        return new Apply(new Label(BOTTOM, sort));
    }

    public static Apply mlBottom() {
        return mlBottom(GENERATED_TOP_CELL);
    }

    public static Apply mlNot(Term term, Sort sort) {
        return new Apply(new Label(NOT, sort), term);
    }

    public static Apply mlNot(Term term) {
        return mlNot(term, GENERATED_TOP_CELL);
    }

    /**
     * Right-nested {@code #And} of the conjuncts that are not {@code #Top}; {@code #Top} if none are left.
     */
    public static Term mlAnd(Iterable<? extends Term> conjuncts, Sort sort) {
        List<Term> filtered = new ArrayList<>();
        for (Term t : conjuncts) {
            if (!isTop(t)) filtered.add(t);
        }
        return Traversal.buildAssoc(mlTop(sort), new Label(AND, sort), filtered);
    }

    public static Term mlAnd(Iterable<? extends Term> conjuncts) {
        return mlAnd(conjuncts, GENERATED_TOP_CELL);
    }

    public static Term mlAnd(Term... conjuncts) {
        return mlAnd(List.of(conjuncts));
    }

    public static Term mlOr(Iterable<? extends Term> disjuncts, Sort sort) {
        List<Term> filtered = new ArrayList<>();
        for (Term t : disjuncts) {
            if (!isBottom(t)) filtered.add(t);
        }
        return Traversal.buildAssoc(mlBottom(sort), new Label(OR, sort), filtered);
    }

    public static Term mlOr(Iterable<? extends Term> disjuncts) {
        return mlOr(disjuncts, GENERATED_TOP_CELL);
    }

    public static Apply mlImplies(Term antecedent, Term consequent, Sort sort) {
        return new Apply(new Label(IMPLIES, sort), antecedent, consequent);
    }

    public static Apply mlImplies(Term antecedent, Term consequent) {
        return mlImplies(antecedent, consequent, GENERATED_TOP_CELL);
    }

    public static Apply mlExists(Variable var, Term body) {
        return new Apply(new Label(EXISTS, K_ITEM, GENERATED_TOP_CELL), var, body);
    }

    public static Apply mlCeil(Term term) {
        return new Apply(new Label(CEIL, GENERATED_TOP_CELL, GENERATED_TOP_CELL), term);
    }
}
