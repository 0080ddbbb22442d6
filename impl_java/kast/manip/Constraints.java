package kast.manip;

import kast.Substitution;
import kast.Traversal;
import kast.prelude.KBool;
import kast.prelude.Ml;
import kast.term.Apply;
import kast.term.Sort;
import kast.term.Term;
import kast.term.Variable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static kast.prelude.K.GENERATED_TOP_CELL;

/**
 * Operations on constraint lists and on configurations conjoined with constraints.
 */
public final class Constraints {

    private Constraints() {
    }

    /**
     * Reflexive equalities and (weakly) {@code #Top} predicates carry no information.
     */
    public static boolean isSpuriousConstraint(Term term) {
        if (term instanceof Apply app && app.label().name().equals(Ml.EQUALS) && app.arity() == 2
                && app.args().get(0).equals(app.args().get(1))) {
            return true;
        }
        return Ml.isTop(term, true);
    }

    /**
     * Flatten conjunctions, drop duplicates (keeping the first occurrence) and drop spurious constraints.
     */
    public static List<Term> normalizeConstraints(Iterable<? extends Term> constraints) {
        Set<Term> flat = new LinkedHashSet<>();
        for (Term constraint : constraints) {
            flat.addAll(Traversal.flattenLabel(Ml.AND, constraint));
        }
        List<Term> result = new ArrayList<>();
        for (Term c : flat) {
            if (!isSpuriousConstraint(c)) result.add(c);
        }
        return result;
    }

    /**
     * Keep only the constraints connected, through shared variables, to {@code initialVars}.
     */
    public static List<Term> removeUselessConstraints(Iterable<? extends Term> constraints, Iterable<String> initialVars) {
        Set<String> usedVars = new LinkedHashSet<>();
        initialVars.forEach(usedVars::add);
        List<Term> kept = new ArrayList<>();
        int prevSize = -1;
        while (usedVars.size() > prevSize) {
            prevSize = usedVars.size();
            for (Term c : constraints) {
                if (kept.contains(c)) continue;
                Set<String> vars = Traversal.freeVars(c);
                if (vars.stream().anyMatch(usedVars::contains)) {
                    kept.add(c);
                    usedVars.addAll(vars);
                }
            }
        }
        return kept;
    }

    /**
     * Factor the conjuncts common to both sides of each {@code #Or} out of the disjunction.
     */
    public static Term propagateUpConstraints(Term term) {
        return Traversal.bottomUp(Constraints::propagateUp, term);
    }

    private static Term propagateUp(Term term) {
        if (!(term instanceof Apply or && or.label().name().equals(Ml.OR) && or.arity() == 2)) return term;
        Sort sort = or.label().params().isEmpty() ? GENERATED_TOP_CELL : or.label().params().get(0);
        List<Term> left = new ArrayList<>(Traversal.flattenLabel(Ml.AND, or.args().get(0)));
        List<Term> right = new ArrayList<>(Traversal.flattenLabel(Ml.AND, or.args().get(1)));
        List<Term> common = new ArrayList<>();
        for (Term c : left) {
            if (right.contains(c) && !common.contains(c)) common.add(c);
        }
        if (common.isEmpty()) return term;
        left.removeAll(common);
        right.removeAll(common);
        Term disjunct = Ml.mlOr(List.of(Ml.mlAnd(left, sort), Ml.mlAnd(right, sort)), sort);
        List<Term> conjuncts = new ArrayList<>();
        conjuncts.add(disjunct);
        conjuncts.addAll(common);
        return Ml.mlAnd(conjuncts, sort);
    }

    public record ConfigAndConstraint(Term config, Term constraint) {
    }

    /**
     * Separate the single cell application of a conjunction from the other conjuncts.
     *
     * @throws IllegalArgumentException if there is no cell application, or more than one
     */
    public static ConfigAndConstraint splitConfigAndConstraints(Term term) {
        Term config = null;
        List<Term> constraints = new ArrayList<>();
        for (Term c : Traversal.flattenLabel(Ml.AND, term)) {
            if (c instanceof Apply app && app.isCell()) {
                if (config != null) {
                    throw new IllegalArgumentException("Found two configurations in pattern: " + config + " and " + c);
                }
                config = c;
            } else {
                constraints.add(c);
            }
        }
        if (config == null) throw new IllegalArgumentException("Could not find configuration for: " + term);
        return new ConfigAndConstraint(config, Ml.mlAnd(constraints, GENERATED_TOP_CELL));
    }

    /**
     * {@code <k-cell>} becomes {@code K_CELL_CELL}, {@code <k>} becomes {@code K_CELL}.
     */
    public static String cellLabelToVarName(String label) {
        return label.replace("-", "_").replace("<", "").replace(">", "").toUpperCase() + "_CELL";
    }

    public record SplitConfig(Term config, Substitution cells) {
    }

    /**
     * Replace the contents of every leaf cell with a variable named after the cell, and return the
     * contents as a substitution for those variables.
     */
    public static SplitConfig splitConfigFrom(Term configuration) {
        Map<String, Term> cells = new LinkedHashMap<>();
        Term symbolic = Traversal.topDown(t -> {
            if (t instanceof Apply app && app.isCell() && app.arity() == 1
                    && !(app.args().get(0) instanceof Apply child && child.isCell())) {
                String var = cellLabelToVarName(app.label().name());
                cells.put(var, app.args().get(0));
                return new Apply(app.label(), new Variable(var));
            }
            return t;
        }, configuration);
        return new SplitConfig(symbolic, Substitution.of(cells));
    }

    /**
     * Replace the contents of one cell of a constrained configuration.
     */
    public static Term setCell(Term constrainedTerm, String cellVariable, Term cellValue) {
        ConfigAndConstraint split = splitConfigAndConstraints(constrainedTerm);
        SplitConfig config = splitConfigFrom(split.config());
        Map<String, Term> cells = new LinkedHashMap<>(config.cells().asMap());
        cells.put(cellVariable, cellValue);
        return Ml.mlAnd(Substitution.of(cells).apply(config.config()), split.constraint());
    }

    public record StateAndConstraints(Term state, List<Term> constraints) {
    }

    /**
     * Inline constraints of the form {@code true #Equals (?X ==K V)} into the state and the
     * remaining constraints.
     */
    public static StateAndConstraints applyExistentialSubstitutions(Term state, Iterable<? extends Term> constraints) {
        Term pattern = Ml.mlEqualsTrue(new Apply(KBool.EQ_K, new Variable("#VAR"), new Variable("#VAL")));
        Map<String, Term> subst = new LinkedHashMap<>();
        List<Term> remaining = new ArrayList<>();
        for (Term c : constraints) {
            Optional<Substitution> match = pattern.match(c);
            if (match.isPresent()
                    && match.get().get("#VAR").orElseThrow() instanceof Variable var
                    && var.isExistential()) {
                subst.put(var.name(), match.get().get("#VAL").orElseThrow());
            } else {
                remaining.add(c);
            }
        }
        Substitution s = Substitution.of(subst);
        return new StateAndConstraints(s.apply(state), remaining.stream().map(s::apply).toList());
    }
}
