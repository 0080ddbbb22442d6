package kast.outer;

import kast.prelude.KInt;
import kast.term.Apply;
import kast.term.Label;
import kast.term.Rewrite;
import kast.term.Sort;
import kast.term.Variable;
import org.junit.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.Assert.*;

public class DefinitionTest {

    private static final Sort INT = KInt.INT;
    private static final Sort EXP = new Sort("Exp");
    private static final Sort KITEM = new Sort("KItem");
    private static final Sort PARAM = new Sort("S");

    private static Definition definition() {
        return Definition.builder()
                .production(new Production(new Label("_+_"), EXP, List.of(EXP, EXP)))
                .production(new Production(new Label("size"), INT, List.of(EXP), List.of(), Att.of(Att.FUNCTION, "")))
                .production(new Production(new Label("id"), PARAM, List.of(PARAM), List.of(PARAM), Att.empty()))
                .subsort(INT, EXP)
                .subsort(EXP, KITEM)
                .build();
    }

    @Test
    public void functionsAreThoseWithFunctionAttribute() {
        Definition defn = definition();
        assertEquals(Set.of("size"), defn.functionLabels());
        assertEquals(1, defn.functions().size());
        assertTrue(defn.symbol("size").orElseThrow().isFunction());
        assertFalse(defn.symbol("_+_").orElseThrow().isFunction());
        assertEquals(Optional.empty(), defn.symbol("missing"));
    }

    @Test
    public void subsortsAreTransitive() {
        Definition defn = definition();
        assertEquals(Set.of(INT, EXP), defn.subsorts(KITEM));
        assertEquals(Set.of(INT), defn.subsorts(EXP));
        assertEquals(Set.of(), defn.subsorts(INT));
    }

    @Test
    public void commonSorts() {
        Definition defn = definition();
        assertEquals(Optional.of(EXP), defn.leastCommonSupersort(INT, EXP));
        assertEquals(Optional.of(KITEM), defn.leastCommonSupersort(KITEM, INT));
        assertEquals(Optional.of(INT), defn.greatestCommonSubsort(INT, KITEM));
        assertEquals(Optional.empty(), defn.leastCommonSupersort(INT, new Sort("Bool")));
    }

    @Test
    public void sortOfTerms() {
        Definition defn = definition();
        assertEquals(Optional.of(INT), defn.sort(KInt.intToken(3)));
        assertEquals(Optional.of(INT), defn.sort(new Variable("X", INT)));
        assertEquals(Optional.empty(), defn.sort(new Variable("X")));
        assertEquals(Optional.of(EXP), defn.sort(new Apply("_+_", KInt.intToken(1), KInt.intToken(2))));
        assertEquals(Optional.of(EXP), defn.sort(new Rewrite(KInt.intToken(1), new Variable("E", EXP))));
        assertEquals(Optional.empty(), defn.sort(new Apply("unknown")));
        assertEquals(INT, defn.sortStrict(new Apply("size", new Variable("E", EXP))));
    }

    @Test
    public void sortParametersAreInstantiated() {
        Definition defn = definition();
        Definition.ResolvedSorts resolved = defn.resolveSorts(new Label("id", INT));
        assertEquals(INT, resolved.sort());
        assertEquals(List.of(INT), resolved.argumentSorts());
    }

    @Test(expected = IllegalArgumentException.class)
    public void sortStrictFailsForUnknownSymbol() {
        definition().sortStrict(new Apply("unknown"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void conflictingProductionsAreRejected() {
        Definition.builder()
                .production(new Production(new Label("f"), INT, List.of()))
                .production(new Production(new Label("f"), EXP, List.of()));
    }

    @Test
    public void identicalProductionsAreMerged() {
        Definition defn = Definition.builder()
                .production(new Production(new Label("f"), INT, List.of()))
                .production(new Production(new Label("f"), INT, List.of()))
                .build();
        assertEquals(1, defn.symbols().size());
    }

    @Test
    public void ruleAndClaimAttributes() {
        Rule rule = new Rule(new Apply("<k>", new Variable("X"))).withAtt(Att.of(Att.OWISE, ""));
        assertEquals(Rule.OWISE_PRIORITY, rule.priority());

        Claim claim = new Claim(new Apply("<k>", new Variable("X")))
                .withAtt(Att.empty().update(Att.DEPENDS, "a, b,").update(Att.TRUSTED, ""));
        assertEquals(List.of("a", "b"), claim.dependencies());
        assertTrue(claim.isTrusted());
        assertFalse(claim.isCircularity());
    }
}
