package cterm;

import kast.Substitution;
import kast.manip.Rewrites;
import kast.outer.Claim;
import kast.prelude.KBool;
import kast.prelude.KInt;
import kast.prelude.Ml;
import kast.term.Apply;
import kast.term.Rewrite;
import kast.term.Term;
import kast.term.Variable;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static kast.TermFixtures.*;
import static org.junit.Assert.*;

public class CTermTest {

    private static final Variable X = new Variable("X", KInt.INT);
    private static final Variable Y = new Variable("Y", KInt.INT);
    private static final Variable Z = new Variable("Z", KInt.INT);

    private static Term geMl(Term v, int n) {
        return Ml.mlEqualsTrue(KInt.geInt(v, KInt.intToken(n)));
    }

    private static Term ltMl(Term v, Term w) {
        return Ml.mlEqualsTrue(KInt.ltInt(v, w));
    }

    private static Apply config(Term kContents, Term memContents) {
        return new Apply("<T>", k(kContents), new Apply("<mem>", memContents));
    }

    @Test(expected = IllegalArgumentException.class)
    public void configurationMustBeCell() {
        new CTerm(f(a));
    }

    @Test
    public void topAndBottom() {
        assertEquals(CTerm.top(), new CTerm(Ml.mlTop(), List.of(geMl(X, 0))));
        assertTrue(CTerm.top().constraints().isEmpty());
        assertTrue(CTerm.bottom().isBottom());
        assertFalse(CTerm.top().isBottom());
        assertTrue(new CTerm(k(x), List.of(Ml.mlBottom())).isBottom());
    }

    @Test
    public void fromKastRecognizesSentinels() {
        assertEquals(CTerm.bottom(), CTerm.fromKast(Ml.mlBottom()));
        assertEquals(CTerm.top(), CTerm.fromKast(Ml.mlTop()));
        assertEquals(CTerm.bottom(), CTerm.fromKast(Ml.mlAnd(Ml.mlBottom(), Ml.mlBottom())));
    }

    @Test
    public void fromKastSplitsConfiguration() {
        CTerm cterm = CTerm.fromKast(Ml.mlAnd(geMl(X, 0), k(X), geMl(Y, 0)));
        assertEquals(k(X), cterm.config());
        assertEquals(List.of(geMl(X, 0), geMl(Y, 0)), cterm.constraints());
        assertEquals(cterm, CTerm.fromKast(cterm.kast()));
    }

    @Test
    public void constraintsAreCanonicallyOrdered() {
        Term shortConstraint = geMl(X, 0);
        Term longConstraint = Ml.mlEqualsTrue(KInt.geInt(KInt.addInt(X, Y), KInt.intToken(10)));
        CTerm c1 = new CTerm(k(X), List.of(longConstraint, shortConstraint, longConstraint));
        CTerm c2 = new CTerm(k(X), List.of(shortConstraint, Ml.mlTop(), longConstraint));
        assertEquals(c1, c2);
        assertEquals(c1.hashCode(), c2.hashCode());
        assertEquals(List.of(shortConstraint, longConstraint), c1.constraints());
        assertEquals(c1.constraints(), new CTerm(k(X), c1.constraints()).constraints());
        assertEquals(c1.hash(), c2.hash());
    }

    @Test
    public void cells() {
        CTerm cterm = new CTerm(config(f(x), a));
        assertEquals(Substitution.of(Map.of("K_CELL", f(x), "MEM_CELL", a)), cterm.cells());
        assertEquals(f(x), cterm.cell("K_CELL"));
        assertEquals(Optional.empty(), cterm.tryCell("NOPE_CELL"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingCellFails() {
        new CTerm(config(f(x), a)).cell("NOPE_CELL");
    }

    @Test
    public void freeVarsIncludeConstraints() {
        CTerm cterm = new CTerm(k(X), List.of(ltMl(X, Y)));
        assertEquals(Set.of("X", "Y"), cterm.freeVars());
    }

    @Test
    public void matchWithConstraintKeepsUnimpliedConstraints() {
        Variable x = new Variable("x");
        Variable y = new Variable("y");
        CTerm t1 = new CTerm(k(x), List.of(geMl(y, 0)));
        CTerm t2 = new CTerm(k(y), List.of(geMl(y, 0), geMl(y, 5)));
        CSubst csubst = t1.matchWithConstraint(t2).orElseThrow();
        assertEquals(Substitution.of("x", y), csubst.subst());
        assertEquals(List.of(geMl(y, 5)), csubst.constraints());
        assertEquals(new CTerm(k(y), List.of(geMl(y, 0), geMl(y, 5))), csubst.apply(t1));
    }

    @Test
    public void matchRequiresNoLeftoverConstraint() {
        CTerm pattern = new CTerm(k(x));
        assertEquals(Optional.of(Substitution.of("x", a)), pattern.match(new CTerm(k(a))));
        assertEquals(Optional.empty(), pattern.match(new CTerm(k(a), List.of(geMl(X, 0)))));
        assertEquals(Optional.empty(), pattern.match(new CTerm(new Apply("<mem>", a))));
    }

    @Test
    public void addConstraintRenormalizes() {
        CTerm cterm = new CTerm(k(X), List.of(geMl(X, 0)));
        assertEquals(new CTerm(k(X), List.of(geMl(X, 0), geMl(Y, 0))), cterm.addConstraint(geMl(Y, 0)));
        assertEquals(cterm, cterm.addConstraint(geMl(X, 0)));
    }

    @Test
    public void removeUselessConstraints() {
        CTerm cterm = new CTerm(k(X), List.of(ltMl(X, Y), geMl(Z, 0)));
        assertEquals(new CTerm(k(X), List.of(ltMl(X, Y))), cterm.removeUselessConstraints());
        assertEquals(cterm, cterm.removeUselessConstraints(List.of("Z")));
    }

    @Test
    public void dictRoundTrip() {
        CTerm cterm = new CTerm(config(new Rewrite(x, a), y), List.of(geMl(X, 0), ltMl(X, Y)));
        assertEquals(cterm, CTerm.fromDict(cterm.toDict()));
    }

    @Test
    public void antiUnifyGeneralizesDifferingCells() {
        CTerm t1 = new CTerm(k(a));
        CTerm t2 = new CTerm(k(b));
        CTerm.AntiUnification result = t1.antiUnify(t2);

        assertEquals(new CTerm(k(Rewrites.abstractTermSafely(new Rewrite(a, b)))), result.cterm());
        assertEquals(t1, result.subst1().apply(result.cterm()));
        assertEquals(t2, result.subst2().apply(result.cterm()));
    }

    @Test
    public void antiUnifyKeepsCommonConstraints() {
        CTerm t1 = new CTerm(k(f(X, a)), List.of(geMl(X, 0), geMl(Z, 0)));
        CTerm t2 = new CTerm(k(f(X, b)), List.of(geMl(X, 0)));
        CTerm.AntiUnification result = t1.antiUnify(t2);

        assertEquals(List.of(geMl(X, 0)), result.cterm().constraints());
        assertEquals(List.of(geMl(Z, 0)), result.subst1().constraints());
        assertEquals(List.of(), result.subst2().constraints());
        assertEquals(t1, result.subst1().apply(result.cterm()));
        assertEquals(t2, result.subst2().apply(result.cterm()));
    }

    @Test
    public void antiUnifyWithKeepValuesAddsDisjunction() {
        CTerm t1 = new CTerm(k(a));
        CTerm t2 = new CTerm(k(b));
        CTerm.AntiUnification result = t1.antiUnify(t2, true, Optional.empty());

        Variable v = Rewrites.abstractTermSafely(new Rewrite(a, b));
        Term guard = Ml.mlEqualsTrue(KBool.orBool(KBool.eqK(v, a), KBool.eqK(v, b)));
        assertEquals(new CTerm(k(v), List.of(guard)), result.cterm());
        assertEquals(Substitution.of(v.name(), a), result.subst1().subst());
        assertEquals(Substitution.of(v.name(), b), result.subst2().subst());
    }

    @Test
    public void buildClaimFromStates() {
        Variable v1 = new Variable("V1");
        CTerm init = new CTerm(k(v1), List.of(Ml.mlEqualsTrue(KInt.leInt(KInt.intToken(0), v1))));
        CTerm target = new CTerm(k(new Variable("V2")));
        Claim claim = CTerm.buildClaim("c", init, target, Set.of()).rule();
        assertEquals(k(new Rewrite(v1, new Variable("?_V2"))), claim.body());
        assertEquals(KInt.leInt(KInt.intToken(0), v1), claim.requires());
        assertEquals(KBool.TRUE, claim.ensures());
    }

    @Test
    public void buildRuleFromStates() {
        CTerm init = new CTerm(k(a));
        CTerm target = new CTerm(k(b));
        assertEquals(k(new Rewrite(a, b)), CTerm.buildRule("r", init, target).rule().body());
    }
}
