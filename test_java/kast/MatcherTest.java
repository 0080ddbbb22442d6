package kast;

import kast.prelude.Ml;
import kast.term.Sequence;
import kast.term.Term;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static kast.TermFixtures.*;
import static org.junit.Assert.*;

public class MatcherTest {

    private static void assertMatches(Term term, Term pattern) {
        Optional<Substitution> subst = Matcher.match(pattern, term);
        assertTrue(pattern + " should match " + term, subst.isPresent());
        assertEquals(term, subst.get().apply(pattern));
    }

    private static void assertNoMatch(Term term, Term pattern) {
        assertEquals(Optional.empty(), Matcher.match(pattern, term));
    }

    @Test
    public void matchInstantiatesPattern() {
        assertMatches(a, x);
        assertMatches(f(a), f(x));
        assertMatches(f(a, b), f(x, y));
        assertMatches(f(g(h(x))), f(x));
        assertMatches(f(x, x), f(y, y));
    }

    @Test
    public void matchBindsSequenceTail() {
        assertMatches(new Sequence(a, x), new Sequence(y));
        assertMatches(new Sequence(f(a), b, c, x), new Sequence(f(z), y));

        Substitution subst = new Sequence(f(z), y).match(new Sequence(f(a), b, c, x)).orElseThrow();
        assertEquals(Substitution.of(Map.of("z", a, "y", new Sequence(b, c, x))), subst);
    }

    @Test
    public void matchFails() {
        assertNoMatch(f(x, x), f(x, a));
        assertNoMatch(Ml.mlTop(), Ml.mlBottom());
        assertNoMatch(f(a, b), f(x, x));
        assertNoMatch(new Sequence(a, b, c), new Sequence(x, x));
        assertNoMatch(new Sequence(a), new Sequence(a, x));
        assertNoMatch(new Sequence(a, b), new Sequence(a, c));
    }

    @Test
    public void combineMatchesFailsOnDisagreement() {
        assertEquals(Optional.empty(), Matcher.combineMatches(List.of(
                Optional.of(Substitution.of("x", a)), Optional.of(Substitution.of("x", b)))));
        assertEquals(Optional.empty(), Matcher.combineMatches(List.of(
                Optional.of(Substitution.of("x", a)), Optional.empty())));
        assertEquals(Optional.of(Substitution.of(Map.of("x", a, "y", b))), Matcher.combineMatches(List.of(
                Optional.of(Substitution.of("x", a)), Optional.of(Substitution.of("y", b)))));
    }

    @Test
    public void matchAllRequiresSameLength() {
        assertEquals(Optional.empty(), Matcher.matchAll(List.of(x), List.of(a, b)));
        assertEquals(Optional.of(Substitution.empty()), Matcher.matchAll(List.of(), List.of()));
    }
}
