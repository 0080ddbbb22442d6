package kast.prelude;

import kast.term.Apply;
import kast.term.Label;
import kast.term.Sort;
import kast.term.Term;
import kast.term.Token;

public final class K {
    public static final Sort K = new Sort("K");
    public static final Sort K_ITEM = new Sort("KItem");
    public static final Sort GENERATED_TOP_CELL = new Sort("GeneratedTopCell");

    /** Stands for any remaining part of a cell. */
    public static final Token DOTS = new Token("...", K);

    private K() {
    }

    public static Apply inj(Sort from, Sort to, Term term) {
        return new Apply(new Label("inj", from, to), term);
    }
}
