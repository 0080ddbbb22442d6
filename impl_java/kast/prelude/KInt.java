package kast.prelude;

import kast.term.Apply;
import kast.term.Sort;
import kast.term.Term;
import kast.term.Token;

/**
 * Builders for integer tokens and the comparison and arithmetic symbols over them.
 */
public final class KInt {
    public static final Sort INT = new Sort("Int");

    private KInt() {
    }

    public static Token intToken(long i) {
        return new Token(Long.toString(i), INT);
    }

    public static Apply eqInt(Term i1, Term i2) {
        return new Apply(KBool.EQ_INT, i1, i2);
    }

    public static Apply neqInt(Term i1, Term i2) {
        return new Apply(KBool.NEQ_INT, i1, i2);
    }

    public static Apply ltInt(Term i1, Term i2) {
        return new Apply("_<Int_", i1, i2);
    }

    public static Apply leInt(Term i1, Term i2) {
        return new Apply("_<=Int_", i1, i2);
    }

    public static Apply gtInt(Term i1, Term i2) {
        return new Apply("_>Int_", i1, i2);
    }

    public static Apply geInt(Term i1, Term i2) {
        return new Apply("_>=Int_", i1, i2);
    }

    public static Apply addInt(Term i1, Term i2) {
        return new Apply("_+Int_", i1, i2);
    }

    public static Apply subInt(Term i1, Term i2) {
        return new Apply("_-Int_", i1, i2);
    }
}
