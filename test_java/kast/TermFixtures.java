package kast;

import kast.term.Apply;
import kast.term.Label;
import kast.term.Sort;
import kast.term.Term;
import kast.term.Variable;

/**
 * Shared small terms for tests.
 */
public final class TermFixtures {
    public static final Apply a = new Apply("a");
    public static final Apply b = new Apply("b");
    public static final Apply c = new Apply("c");
    public static final Variable x = new Variable("x");
    public static final Variable y = new Variable("y");
    public static final Variable z = new Variable("z");
    public static final Label f = new Label("f");
    public static final Label g = new Label("g");
    public static final Label h = new Label("h");

    private TermFixtures() {
    }

    public static Apply f(Term... args) {
        return f.apply(args);
    }

    public static Apply g(Term... args) {
        return g.apply(args);
    }

    public static Apply h(Term... args) {
        return h.apply(args);
    }

    public static Apply k(Term contents) {
        return new Apply("<k>", contents);
    }

    public static Variable var(String name, Sort sort) {
        return new Variable(name, sort);
    }
}
