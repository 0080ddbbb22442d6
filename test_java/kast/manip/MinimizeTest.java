package kast.manip;

import kast.outer.Att;
import kast.outer.Claim;
import kast.outer.Rule;
import kast.prelude.KBool;
import kast.term.Apply;
import kast.term.Rewrite;
import kast.term.Term;
import kast.term.Variable;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static kast.TermFixtures.*;
import static kast.prelude.K.DOTS;
import static org.junit.Assert.*;

public class MinimizeTest {

    private static Apply top(Term... cells) {
        return new Apply("<T>", cells);
    }

    private static Apply mem(Term contents) {
        return new Apply("<mem>", contents);
    }

    private static Apply state(Term contents) {
        return new Apply("<state>", contents);
    }

    @Test
    public void collapseDotsMergesCells() {
        assertEquals(top(mem(a), DOTS), Minimize.collapseDots(top(k(DOTS), mem(a))));
        assertEquals(DOTS, Minimize.collapseDots(top(k(DOTS), mem(DOTS))));
        assertEquals(f(a, DOTS), Minimize.collapseDots(f(DOTS, a)));
        assertEquals(DOTS, Minimize.collapseDots(new Rewrite(DOTS, x)));
    }

    @Test
    public void uselessVarsToDots() {
        Term term = top(k(x), mem(y), state(f(y)));
        assertEquals(top(k(DOTS), mem(y), state(f(y))), Minimize.uselessVarsToDots(term, List.of()));
        assertEquals(term, Minimize.uselessVarsToDots(term, List.of("x")));
    }

    @Test
    public void labelsAndCellsToDots() {
        Term term = top(k(x), mem(y));
        assertEquals(top(k(x), DOTS), Minimize.labelsToDots(term, Set.of("<mem>")));
        assertEquals(top(k(x), DOTS), Minimize.extractCells(term, Set.of("<k>")));
        assertEquals(DOTS, Minimize.extractCells(term, Set.of()));
    }

    @Test
    public void inlineCellMapsAndRemoveCasts() {
        Term item = new Apply("AccountCellMapItem", new Apply("<acctID>", a), new Apply("<account>", b));
        assertEquals(f(new Apply("<account>", b)), Minimize.inlineCellMaps(f(item)));
        assertEquals(f(x), Minimize.removeSemanticCasts(f(new Apply("#SemanticCastToInt", x))));
    }

    @Test
    public void removeGeneratedCells() {
        Term config = top(k(x), mem(y));
        Term generated = new Apply("<generatedTop>", config, new Apply("<generatedCounter>", a));
        assertEquals(config, Minimize.removeGeneratedCells(generated));
    }

    @Test
    public void renameGeneratedVarsAfterCell() {
        Variable gen = new Variable("_Gen1");
        Variable dotVar = new Variable("?_DotVar0");
        Term renamed = Minimize.renameGeneratedVars(f(top(k(gen), mem(dotVar)), gen));
        Term expected = f(top(
                k(Rewrites.abstractTermSafely(gen, "K_CELL")),
                mem(Rewrites.abstractTermSafely(dotVar, "MEM_CELL"))), gen);
        assertEquals(expected, renamed);
    }

    @Test
    public void noCellRewriteToDotsHidesUnchangedCells() {
        Term term = top(k(new Rewrite(a, b)), mem(x));
        assertEquals(top(k(new Rewrite(a, b)), mem(DOTS)), Minimize.noCellRewriteToDots(term));
    }

    @Test
    public void sortAcCollections() {
        Term set = new Apply("_Set_", c, new Apply("_Set_", a, b));
        assertEquals(new Apply("_Set_", a, new Apply("_Set_", b, c)), Minimize.sortAssocLabel("_Set_", set));
        assertEquals(f(new Apply("_Set_", a, c)), Minimize.sortAcCollections(f(new Apply("_Set_", c, a))));
        assertEquals(f(a), Minimize.sortAssocLabel("_Set_", f(a)));
    }

    @Test
    public void minimizeTerm() {
        Term term = top(k(x), mem(new Apply("#SemanticCastToInt", y)), state(y));
        assertEquals(top(mem(y), state(y), DOTS), Minimize.minimizeTerm(term));
    }

    @Test
    public void minimizeRuleKeepsConstrainedVariables() {
        Rule rule = new Rule(top(k(x), mem(y)), KBool.eqK(y, a), KBool.TRUE, Att.of(Att.LABEL, "r"));
        Rule minimized = Minimize.minimizeRule(rule, List.of());
        assertEquals(top(mem(y), DOTS), minimized.body());
        assertEquals(KBool.eqK(y, a), minimized.requires());
        assertEquals(KBool.TRUE, minimized.ensures());
        assertEquals(rule.att(), minimized.att());
    }

    @Test
    public void minimizeClaimSimplifiesEnsures() {
        Claim claim = new Claim(top(k(x), mem(y)), KBool.TRUE, new Apply(KBool.AND_BOOL, KBool.TRUE, KBool.eqK(y, a)),
                Att.of(Att.LABEL, "c"));
        Claim minimized = Minimize.minimizeRule(claim, List.of());
        assertEquals(top(mem(y), DOTS), minimized.body());
        assertEquals(KBool.TRUE, minimized.requires());
        assertEquals(KBool.eqK(y, a), minimized.ensures());
        assertEquals(claim.att(), minimized.att());
    }
}
