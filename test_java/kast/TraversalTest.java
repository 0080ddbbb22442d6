package kast;

import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multiset;
import kast.prelude.KInt;
import kast.term.Label;
import kast.term.Rewrite;
import kast.term.Sort;
import kast.term.Term;
import kast.term.Token;
import kast.term.Variable;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static kast.TermFixtures.*;
import static org.junit.Assert.*;

public class TraversalTest {

    @Test
    public void countVarsCountsEveryOccurrence() {
        Multiset<String> counts = Traversal.countVars(f(x, g(x, y), h(x, z)));
        assertEquals(ImmutableMultiset.of("x", "x", "x", "y", "z"), counts);
    }

    @Test
    public void freeVarsInOrderOfFirstOccurrence() {
        assertEquals(List.of("y", "x", "z"), new ArrayList<>(Traversal.freeVars(f(y, g(x, y), z))));
        assertEquals(Set.of(), Traversal.freeVars(f(a, b)));
    }

    @Test
    public void bottomUpRebuildsFromLeaves() {
        Term result = Traversal.bottomUp(t -> t.equals(a) ? b : t, f(a, g(a, c)));
        assertEquals(f(b, g(b, c)), result);
    }

    @Test
    public void bottomUpKeepsUnchangedNodes() {
        Term term = f(a, g(x));
        assertSame(term, Traversal.bottomUp(t -> t, term));
    }

    @Test
    public void topDownVisitsChildrenOfReplacement() {
        List<Term> visited = new ArrayList<>();
        Term result = Traversal.topDown(t -> {
            visited.add(t);
            return t.equals(a) ? f(b) : t;
        }, g(a));
        assertEquals(g(f(b)), result);
        assertEquals(List.of(g(a), a, b), visited);
    }

    @Test
    public void collectVisitsInPreOrder() {
        List<Term> visited = new ArrayList<>();
        Traversal.collect(visited::add, f(a, g(b)));
        assertEquals(List.of(f(a, g(b)), a, g(b), b), visited);
    }

    @Test
    public void flattenLabelUnnests() {
        Label and = new Label("_andBool_");
        Term nested = and.apply(a, and.apply(and.apply(b, c), x));
        assertEquals(List.of(a, b, c, x), Traversal.flattenLabel("_andBool_", nested));
        assertEquals(List.of(a), Traversal.flattenLabel("_andBool_", a));
    }

    @Test
    public void buildAssocSkipsUnit() {
        Token zero = KInt.intToken(0);
        Label plus = new Label("_+Int_");
        assertEquals(plus.apply(x, plus.apply(y, z)),
                Traversal.buildAssoc(zero, plus, List.of(zero, x, zero, y, z, zero)));
        assertEquals(zero, Traversal.buildAssoc(zero, plus, List.of(zero)));
        assertEquals(x, Traversal.buildAssoc(zero, "_+Int_", List.of(x)));
    }

    @Test
    public void buildConsEndsWithUnit() {
        Label cons = new Label("_List_");
        Term unit = new Label(".List").apply();
        assertEquals(cons.apply(a, cons.apply(b, unit)), Traversal.buildCons(unit, cons, List.of(a, b)));
        assertEquals(unit, Traversal.buildCons(unit, cons, List.of()));
    }

    @Test
    public void keepVarsSortedAgreesOnSort() {
        Variable xInt = new Variable("x", KInt.INT);
        Variable yInt = new Variable("y", KInt.INT);
        Variable yBool = new Variable("y", new Sort("Bool"));
        ListMultimap<String, Variable> occurrences = Traversal.varOccurrences(f(xInt, x, yInt, yBool, z));
        Map<String, Variable> sorted = Traversal.keepVarsSorted(occurrences);
        assertEquals(xInt, sorted.get("x"));
        assertEquals(y, sorted.get("y"));
        assertEquals(z, sorted.get("z"));
    }

    @Test
    public void traversalsHandleVeryDeepTerms() {
        Term deep = x;
        for (int i = 0; i < 100_000; i++) {
            deep = f.apply(deep);
        }
        assertEquals(Set.of("x"), Traversal.freeVars(deep));
        assertEquals(Set.of("y"), Traversal.freeVars(Traversal.bottomUp(t -> t instanceof Variable ? y : t, deep)));
        assertEquals(Set.of("z"), Traversal.freeVars(new Rewrite(x, z).replace(deep)));
    }

    private static Term nest(Term leaf, int depth) {
        Term term = leaf;
        for (int i = 0; i < depth; i++) {
            term = f.apply(term);
        }
        return term;
    }

    @Test
    public void equalityHashingAndPrintingHandleVeryDeepTerms() {
        Term deep = nest(a, 100_000);
        Term same = nest(a, 100_000);
        assertNotSame(deep, same);
        assertEquals(deep.hashCode(), same.hashCode());
        assertTrue(deep.equals(same));
        assertFalse(deep.equals(nest(b, 100_000)));
        assertTrue(Traversal.equal(deep, same));

        assertEquals(64, deep.hash().length());
        assertEquals(deep.hash(), same.hash());
        assertEquals(deep, Term.fromDict(deep.toDict()));
        assertTrue(deep.toString().startsWith("f(f(f("));
    }

    @Test
    public void matchingHandlesVeryDeepTerms() {
        Term pattern = nest(x, 100_000);
        Term term = nest(a, 100_000);
        assertEquals(Optional.of(Substitution.of("x", a)), pattern.match(term));
        assertEquals(Optional.of(Substitution.empty()), term.match(nest(a, 100_000)));
        assertEquals(Optional.empty(), term.match(nest(b, 100_000)));
    }
}
