package kast.prelude;

import kast.Traversal;
import kast.term.Apply;
import kast.term.Label;
import kast.term.Sort;
import kast.term.Term;
import kast.term.Token;

import java.util.LinkedHashSet;
import java.util.List;

public final class KBool {
    public static final Sort BOOL = new Sort("Bool");
    public static final Token TRUE = new Token("true", BOOL);
    public static final Token FALSE = new Token("false", BOOL);

    public static final Label AND_BOOL = new Label("_andBool_");
    public static final Label OR_BOOL = new Label("_orBool_");
    public static final Label NOT_BOOL = new Label("notBool_");
    public static final Label IMPLIES_BOOL = new Label("_impliesBool_");
    public static final Label EQ_K = new Label("_==K_");
    public static final Label NEQ_K = new Label("_=/=K_");
    public static final Label EQ_INT = new Label("_==Int_");
    public static final Label NEQ_INT = new Label("_=/=Int_");

    private KBool() {
    }

    public static Token boolToken(boolean b) {
        return b ? TRUE : FALSE;
    }

    /**
     * Right-nested {@code _andBool_} of the distinct items, {@code true} if there are none.
     */
    public static Term andBool(Iterable<? extends Term> items) {
        return Traversal.buildAssoc(TRUE, AND_BOOL, unique(items));
    }

    public static Term andBool(Term... items) {
        return andBool(List.of(items));
    }

    public static Term orBool(Iterable<? extends Term> items) {
        return Traversal.buildAssoc(FALSE, OR_BOOL, unique(items));
    }

    public static Term orBool(Term... items) {
        return orBool(List.of(items));
    }

    public static Apply notBool(Term item) {
        return new Apply(NOT_BOOL, item);
    }

    public static Apply impliesBool(Term antecedent, Term consequent) {
        return new Apply(IMPLIES_BOOL, antecedent, consequent);
    }

    public static Apply eqK(Term t1, Term t2) {
        return new Apply(EQ_K, t1, t2);
    }

    public static Apply neqK(Term t1, Term t2) {
        return new Apply(NEQ_K, t1, t2);
    }

    private static List<Term> unique(Iterable<? extends Term> items) {
        LinkedHashSet<Term> seen = new LinkedHashSet<>();
        items.forEach(seen::add);
        return List.copyOf(seen);
    }
}
