package kast.manip;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import kast.Substitution;
import kast.Traversal;
import kast.outer.Claim;
import kast.outer.Rule;
import kast.outer.RuleLike;
import kast.prelude.KBool;
import kast.term.Apply;
import kast.term.Label;
import kast.term.Rewrite;
import kast.term.Term;
import kast.term.Variable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static kast.prelude.K.DOTS;

/**
 * Passes that shrink a configuration down to the parts a reader needs to see.
 */
public final class Minimize {

    private static final Set<String> AC_LABELS = Set.of("_Set_", "_Map_", "_RangeMap_");

    private Minimize() {
    }

    public static boolean isAnonVar(Term term) {
        return term instanceof Variable v && v.isAnonymous();
    }

    /**
     * Merge adjacent {@code ...} and collapse cells that contain nothing else.
     */
    public static Term collapseDots(Term term) {
        return Traversal.bottomUp(k -> {
            if (k instanceof Apply app) {
                if (app.isCell() && app.arity() == 1 && app.args().get(0).equals(DOTS)) return DOTS;
                List<Term> newArgs = new ArrayList<>();
                for (Term arg : app.args()) {
                    if (!arg.equals(DOTS)) newArgs.add(arg);
                }
                if (app.isCell() && newArgs.isEmpty()) return DOTS;
                if (newArgs.size() < app.arity()) newArgs.add(DOTS);
                return app.withChildren(newArgs);
            } else if (k instanceof Rewrite rw && rw.lhs().equals(DOTS)) {
                return DOTS;
            }
            return k;
        }, term);
    }

    /**
     * Replace cell arguments that are variables used only once (and not kept) with {@code ...}.
     */
    public static Term uselessVarsToDots(Term term, Iterable<String> keepVars) {
        Multiset<String> numOccs = HashMultiset.create(Traversal.countVars(term));
        keepVars.forEach(numOccs::add);
        return Traversal.bottomUp(k -> {
            if (k instanceof Apply app && app.isCell()) {
                List<Term> newArgs = new ArrayList<>();
                for (Term arg : app.args()) {
                    if (arg instanceof Variable v && numOccs.count(v.name()) == 1) {
                        newArgs.add(DOTS);
                    } else {
                        newArgs.add(arg);
                    }
                }
                return app.withChildren(newArgs);
            }
            return k;
        }, term);
    }

    public static Term labelsToDots(Term term, Set<String> labels) {
        return Traversal.bottomUp(k -> {
            if (k instanceof Apply app && app.isCell() && labels.contains(app.label().name())) return DOTS;
            return k;
        }, term);
    }

    /**
     * Replace every leaf cell not named in {@code keepCells} with {@code ...}.
     */
    public static Term extractCells(Term term, Set<String> keepCells) {
        return Traversal.bottomUp(k -> {
            if (k instanceof Apply app && app.isCell() && !keepCells.contains(app.label().name())
                    && app.args().stream().noneMatch(arg -> arg instanceof Apply child && child.isCell())) {
                return DOTS;
            }
            return k;
        }, term);
    }

    public static Term inlineCellMaps(Term term) {
        return Traversal.bottomUp(k -> {
            if (k instanceof Apply app && app.label().name().endsWith("CellMapItem") && app.arity() == 2
                    && app.args().get(0) instanceof Apply key && key.isCell()) {
                return app.args().get(1);
            }
            return k;
        }, term);
    }

    public static Term removeSemanticCasts(Term term) {
        return Traversal.bottomUp(k -> {
            if (k instanceof Apply app && app.arity() == 1 && app.label().name().startsWith("#SemanticCast")) {
                return app.args().get(0);
            }
            return k;
        }, term);
    }

    /**
     * Strip the {@code <generatedTop>} wrapper, keeping the configuration under it.
     */
    public static Term removeGeneratedCells(Term term) {
        Rewrite rewrite = new Rewrite(
                new Apply("<generatedTop>", new Variable("CONFIG"), new Variable("_")),
                new Variable("CONFIG"));
        return rewrite.apply(term);
    }

    /**
     * Give variables generated by the front end ({@code _Gen*}, {@code _DotVar*}) names derived from
     * the innermost enclosing cell.
     */
    public static Term renameGeneratedVars(Term term) {
        Set<String> vars = new LinkedHashSet<>(Traversal.freeVars(term));
        Deque<String> cellStack = new ArrayDeque<>();
        return renameVars(term, vars, cellStack);
    }

    private static Term renameVars(Term k, Set<String> vars, Deque<String> cellStack) {
        if (k instanceof Apply app && app.isCell()) {
            cellStack.push(Constraints.cellLabelToVarName(app.label().name()));
            Term res = app.mapChildren(child -> renameVars(child, vars, cellStack));
            cellStack.pop();
            return res;
        }
        if (k instanceof Variable v && isGenerated(v.name())) {
            if (cellStack.isEmpty()) return k;
            Variable newVar = Rewrites.abstractTermSafely(v, cellStack.peek(), v.sort(), vars);
            vars.add(newVar.name());
            return newVar;
        }
        return k.mapChildren(child -> renameVars(child, vars, cellStack));
    }

    private static boolean isGenerated(String name) {
        return name.startsWith("_Gen") || name.startsWith("?_Gen")
                || name.startsWith("_DotVar") || name.startsWith("?_DotVar");
    }

    /**
     * Replace the contents of every leaf cell that is not rewritten with {@code ...}.
     */
    public static Term noCellRewriteToDots(Term term) {
        Constraints.SplitConfig split = Constraints.splitConfigFrom(term);
        Map<String, Term> cells = new LinkedHashMap<>();
        split.cells().asMap().forEach((cell, contents) -> {
            boolean rewritten = !Rewrites.extractLhs(contents).equals(Rewrites.extractRhs(contents));
            cells.put(cell, rewritten ? contents : DOTS);
        });
        return Substitution.of(cells).apply(split.config());
    }

    /**
     * Re-nest an associative operator with its operands in a canonical order.
     */
    public static Term sortAssocLabel(String label, Term term) {
        if (!(term instanceof Apply app && app.label().name().equals(label))) return term;
        List<Term> terms = new ArrayList<>(Traversal.flattenLabel(label, term));
        terms.sort(Comparator.comparing(Term::toJson));
        Label assocLabel = app.label();
        Term result = terms.get(terms.size() - 1);
        for (int i = terms.size() - 2; i >= 0; i--) {
            result = new Apply(assocLabel, terms.get(i), result);
        }
        return result;
    }

    /**
     * Canonically order the elements of sets, maps and cell maps.
     */
    public static Term sortAcCollections(Term term) {
        return Traversal.topDown(k -> {
            if (k instanceof Apply app) {
                String name = app.label().name();
                if (AC_LABELS.contains(name) || name.endsWith("CellMap_")) return sortAssocLabel(name, app);
            }
            return k;
        }, term);
    }

    public static Term minimizeTerm(Term term, Iterable<String> keepVars) {
        Term result = inlineCellMaps(term);
        result = removeSemanticCasts(result);
        result = uselessVarsToDots(result, keepVars);
        return collapseDots(result);
    }

    public static Term minimizeTerm(Term term) {
        return minimizeTerm(term, List.of());
    }

    private record Clauses(Term body, Term requires, Term ensures) {
    }

    /**
     * Simplify the side conditions of a rule and minimize its body, keeping every variable the
     * side conditions mention.
     */
    public static Rule minimizeRule(Rule rule, Iterable<String> keepVars) {
        Clauses clauses = minimizeClauses(rule, keepVars);
        return rule.withClauses(clauses.body(), clauses.requires(), clauses.ensures());
    }

    public static Claim minimizeRule(Claim claim, Iterable<String> keepVars) {
        Clauses clauses = minimizeClauses(claim, keepVars);
        return claim.withClauses(clauses.body(), clauses.requires(), clauses.ensures());
    }

    private static Clauses minimizeClauses(RuleLike rule, Iterable<String> keepVars) {
        Term requires = BoolLogic.simplifyBool(KBool.andBool(Traversal.flattenLabel(KBool.AND_BOOL.name(), rule.requires())));
        Term ensures = BoolLogic.simplifyBool(KBool.andBool(Traversal.flattenLabel(KBool.AND_BOOL.name(), rule.ensures())));
        Set<String> constrainedVars = new LinkedHashSet<>();
        keepVars.forEach(constrainedVars::add);
        constrainedVars.addAll(Traversal.freeVars(requires));
        constrainedVars.addAll(Traversal.freeVars(ensures));
        return new Clauses(minimizeTerm(rule.body(), constrainedVars), requires, ensures);
    }
}
