package kast.manip;

import kast.prelude.KInt;
import kast.term.Label;
import kast.prelude.Ml;
import kast.term.Rewrite;
import kast.term.Sequence;
import kast.term.Term;
import kast.term.Variable;
import org.junit.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static kast.TermFixtures.*;
import static org.junit.Assert.*;

public class RewritesTest {

    @Test
    public void pushDownThroughSequenceHeads() {
        Term rewrite = new Rewrite(new Sequence(f(a), b), new Sequence(f(c), b));
        assertEquals(new Sequence(f(new Rewrite(a, c)), b), Rewrites.pushDownRewrites(rewrite));
    }

    @Test
    public void pushDownKeepsCommonTail() {
        Term rewrite = new Rewrite(new Sequence(a, b), new Sequence(b));
        assertEquals(new Sequence(new Rewrite(new Sequence(a), new Sequence()), b), Rewrites.pushDownRewrites(rewrite));
    }

    @Test
    public void pushDownOntoTailVariable() {
        Term rewrite = new Rewrite(new Sequence(a, x), x);
        assertEquals(new Sequence(new Rewrite(new Sequence(a), new Sequence()), x), Rewrites.pushDownRewrites(rewrite));
    }

    @Test
    public void pushDownThroughSharedLabels() {
        Term rewrite = new Rewrite(k(f(a, g(b))), k(f(a, g(c))));
        assertEquals(k(f(a, g(new Rewrite(b, c)))), Rewrites.pushDownRewrites(rewrite));
        assertEquals(new Variable("x", KInt.INT), Rewrites.pushDownRewrites(new Rewrite(new Variable("x", KInt.INT), x)));
        assertEquals(new Rewrite(f(a), g(a)), Rewrites.pushDownRewrites(new Rewrite(f(a), g(a))));
    }

    @Test
    public void pushDownStopsAtLabelsWithDifferentParams() {
        Term rewrite = new Rewrite(new Label("f", KInt.INT).apply(a), new Label("f").apply(b));
        assertEquals(rewrite, Rewrites.pushDownRewrites(rewrite));
    }

    @Test
    public void extractSides() {
        Term term = f(new Rewrite(a, b), g(new Rewrite(x, y)));
        assertEquals(f(a, g(x)), Rewrites.extractLhs(term));
        assertEquals(f(b, g(y)), Rewrites.extractRhs(term));
    }

    @Test
    public void indexedRewriteRunsToFixpoint() {
        List<Rewrite> rules = List.of(
                new Rewrite(f(x), g(x)),
                new Rewrite(g(a), b),
                new Rewrite(KInt.intToken(0), a));
        assertEquals(h(b, g(c)), Rewrites.indexedRewrite(h(f(KInt.intToken(0)), f(c)), rules));
    }

    @Test
    public void replaceRewritesWithImplies() {
        assertEquals(f(Ml.mlImplies(a, b)), Rewrites.replaceRewritesWithImplies(f(new Rewrite(a, b))));
    }

    @Test
    public void abstractTermSafelyIsDeterministic() {
        Variable v1 = Rewrites.abstractTermSafely(f(a));
        Variable v2 = Rewrites.abstractTermSafely(f(a));
        assertEquals(v1, v2);
        assertEquals("V_" + f(a).hash().substring(0, 8), v1.name());
        assertEquals(Optional.empty(), v1.sort());
        assertNotEquals(v1, Rewrites.abstractTermSafely(f(b)));
    }

    @Test
    public void abstractTermSafelyAvoidsExistingNames() {
        Variable taken = Rewrites.abstractTermSafely(f(a), "V", Optional.of(KInt.INT));
        Variable fresh = Rewrites.abstractTermSafely(f(a), "V", Optional.of(KInt.INT), Set.of(taken.name()));
        assertNotEquals(taken.name(), fresh.name());
        assertTrue(fresh.name().startsWith("V_"));
        assertEquals(Optional.of(KInt.INT), fresh.sort());
    }
}
