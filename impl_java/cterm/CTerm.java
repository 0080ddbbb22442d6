package cterm;

import kast.Substitution;
import kast.Traversal;
import kast.manip.BoolLogic;
import kast.manip.Constraints;
import kast.manip.RuleBuilder;
import kast.outer.Claim;
import kast.outer.Definition;
import kast.outer.Rule;
import kast.prelude.KBool;
import kast.prelude.Ml;
import kast.term.Apply;
import kast.term.Term;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

import static kast.prelude.K.GENERATED_TOP_CELL;

/**
 * A symbolic program state: a configuration, possibly containing free variables, together with
 * the constraints on those variables.
 * <p>
 * Constraints are kept flattened, deduplicated and in a canonical order, so two states with the
 * same constraints in a different order are equal.
 */
public final class CTerm {
    private static final Logger log = LogManager.getLogger(CTerm.class);

    private static final Comparator<Term> CONSTRAINT_ORDER =
            Comparator.<Term>comparingInt(t -> t.toJson().length()).thenComparing(Term::toJson);

    private final Term config;
    private final List<Term> constraints;

    /**
     * @throws IllegalArgumentException if {@code config} is neither {@code #Top}, {@code #Bottom} nor a cell
     */
    public CTerm(Term config, Iterable<? extends Term> constraints) {
        if (Ml.isTop(config, true)) {
            this.config = Ml.mlTop();
            this.constraints = List.of();
        } else if (Ml.isBottom(config, true)) {
            this.config = Ml.mlBottom();
            this.constraints = List.of();
        } else {
            if (!(config instanceof Apply app && app.isCell())) {
                throw new IllegalArgumentException("Expected cell label, found: " + config);
            }
            this.config = config;
            List<Term> normalized = new ArrayList<>(Constraints.normalizeConstraints(constraints));
            normalized.sort(CONSTRAINT_ORDER);
            this.constraints = List.copyOf(normalized);
        }
    }

    public CTerm(Term config) {
        this(config, List.of());
    }

    public static CTerm top() {
        return new CTerm(Ml.mlTop());
    }

    public static CTerm bottom() {
        return new CTerm(Ml.mlBottom());
    }

    /**
     * Split a conjunction into its configuration and its constraints.
     *
     * @throws IllegalArgumentException if the conjunction has no cell, or more than one
     */
    public static CTerm fromKast(Term kast) {
        if (Ml.isTop(kast, true)) return top();
        if (Ml.isBottom(kast, true)) return bottom();
        Constraints.ConfigAndConstraint split = Constraints.splitConfigAndConstraints(kast);
        return new CTerm(split.config(), Traversal.flattenLabel(Ml.AND, split.constraint()));
    }

    @SuppressWarnings("unchecked")
    public static CTerm fromDict(Map<String, ?> dict) {
        Term config = Term.fromDict((Map<String, ?>) dict.get("config"));
        List<Term> constraints = new ArrayList<>();
        for (Object c : (List<?>) dict.get("constraints")) {
            constraints.add(Term.fromDict((Map<String, ?>) c));
        }
        return new CTerm(config, constraints);
    }

    public Map<String, Object> toDict() {
        return Map.of(
                "config", config.toDict(),
                "constraints", constraints.stream().map(Term::toDict).toList());
    }

    public Term config() {
        return config;
    }

    public List<Term> constraints() {
        return constraints;
    }

    public boolean isBottom() {
        return Ml.isBottom(config, true) || constraints.stream().anyMatch(c -> Ml.isBottom(c, true));
    }

    /**
     * The state as a single conjunction, the inverse of {@link #fromKast}.
     */
    public Term kast() {
        List<Term> conjuncts = new ArrayList<>();
        conjuncts.add(config);
        conjuncts.addAll(constraints);
        return Ml.mlAnd(conjuncts, GENERATED_TOP_CELL);
    }

    public Term constraint() {
        return Ml.mlAnd(constraints, GENERATED_TOP_CELL);
    }

    public Set<String> freeVars() {
        return Traversal.freeVars(kast());
    }

    public String hash() {
        return kast().hash();
    }

    /**
     * Contents of each leaf cell, keyed by the cell's variable name ({@code <k>} gives {@code K_CELL}).
     */
    public Substitution cells() {
        return Constraints.splitConfigFrom(config).cells();
    }

    /**
     * @throws IllegalArgumentException if there is no such cell
     */
    public Term cell(String cell) {
        return tryCell(cell).orElseThrow(() -> new IllegalArgumentException("Cell " + cell + " not found"));
    }

    public Optional<Term> tryCell(String cell) {
        return cells().get(cell);
    }

    /**
     * The substitution instantiating this state to {@code other}, if no constraint is left over.
     */
    public Optional<Substitution> match(CTerm other) {
        Optional<CSubst> csubst = matchWithConstraint(other);
        if (csubst.isEmpty() || !csubst.get().constraint().equals(Ml.mlTop(GENERATED_TOP_CELL))) {
            return Optional.empty();
        }
        return Optional.of(csubst.get().subst());
    }

    /**
     * Match the configurations, and keep the constraints of {@code other} that do not already follow,
     * syntactically, from the instantiated constraints of this state.
     */
    public Optional<CSubst> matchWithConstraint(CTerm other) {
        Optional<Substitution> subst = config.match(other.config);
        if (subst.isEmpty()) return Optional.empty();
        Set<Term> sourceConstraints = new LinkedHashSet<>();
        for (Term c : constraints) {
            sourceConstraints.add(subst.get().apply(c));
        }
        List<Term> remaining = other.constraints.stream()
                .filter(c -> !sourceConstraints.contains(c))
                .toList();
        return Optional.of(new CSubst(subst.get(), remaining));
    }

    public CTerm addConstraint(Term newConstraint) {
        List<Term> newConstraints = new ArrayList<>();
        newConstraints.add(newConstraint);
        newConstraints.addAll(constraints);
        return new CTerm(config, newConstraints);
    }

    public record AntiUnification(CTerm cterm, CSubst subst1, CSubst subst2) {
    }

    public AntiUnification antiUnify(CTerm other) {
        return antiUnify(other, false, Optional.empty());
    }

    /**
     * A state more general than both this one and {@code other}, with the constrained
     * substitutions recovering each of them.
     * <p>
     * Constraints shared by both states are kept when they are connected to the generalized
     * configuration. With {@code keepValues}, the bindings and constraints specific to each side are
     * also kept, as a disjunction.
     *
     * @throws IllegalStateException if the generalization does not match one of the two states
     */
    public AntiUnification antiUnify(CTerm other, boolean keepValues, Optional<Definition> defn) {
        AntiUnifier.Result result = AntiUnifier.antiUnify(config, other.config, defn);
        List<Term> commonConstraints = constraints.stream().filter(other.constraints::contains).toList();

        CTerm newCterm = new CTerm(result.term());
        if (keepValues) {
            List<Term> lhs = new ArrayList<>();
            lhs.add(result.subst1().pred());
            constraints.stream()
                    .filter(c -> !other.constraints.contains(c))
                    .forEach(c -> lhs.add(BoolLogic.mlPredToBool(c)));
            List<Term> rhs = new ArrayList<>();
            rhs.add(result.subst2().pred());
            other.constraints.stream()
                    .filter(c -> !constraints.contains(c))
                    .forEach(c -> rhs.add(BoolLogic.mlPredToBool(c)));

            Term disjunctLhs = KBool.andBool(lhs);
            Term disjunctRhs = KBool.andBool(rhs);
            if (!KBool.TRUE.equals(disjunctLhs) && !KBool.TRUE.equals(disjunctRhs)) {
                newCterm = newCterm.addConstraint(Ml.mlEqualsTrue(KBool.orBool(disjunctLhs, disjunctRhs)));
            }
        }

        for (Term constraint : Constraints.removeUselessConstraints(commonConstraints, newCterm.freeVars())) {
            newCterm = newCterm.addConstraint(constraint);
        }

        Optional<CSubst> selfCsubst = newCterm.matchWithConstraint(this);
        Optional<CSubst> otherCsubst = newCterm.matchWithConstraint(other);
        if (selfCsubst.isEmpty() || otherCsubst.isEmpty()) {
            throw new IllegalStateException("Anti-unification failed to produce a more general state: "
                    + newCterm + " does not match " + this + " and " + other);
        }
        log.debug("Anti-unified {} and {} into {}", this, other, newCterm);
        return new AntiUnification(newCterm, selfCsubst.get(), otherCsubst.get());
    }

    /**
     * Drop the constraints not connected to the free variables of the configuration or {@code keepVars}.
     */
    public CTerm removeUselessConstraints(Iterable<String> keepVars) {
        Set<String> initialVars = new LinkedHashSet<>(Traversal.freeVars(config));
        keepVars.forEach(initialVars::add);
        return new CTerm(config, Constraints.removeUselessConstraints(constraints, initialVars));
    }

    public CTerm removeUselessConstraints() {
        return removeUselessConstraints(List.of());
    }

    /**
     * A claim from {@code init} to {@code target}: constraints of the first become the
     * {@code requires} clause, constraints of the second the {@code ensures} clause.
     */
    public static RuleBuilder.Synthesized<Claim> buildClaim(String claimId, CTerm init, CTerm target,
                                                            Set<String> keepVars) {
        return RuleBuilder.buildClaim(claimId, init.config, target.config, init.constraints, target.constraints, keepVars);
    }

    public static RuleBuilder.Synthesized<Rule> buildRule(String ruleId, CTerm init, CTerm target,
                                                          OptionalInt priority, Set<String> keepVars,
                                                          Optional<Definition> defuncWith) {
        return RuleBuilder.buildRule(ruleId, init.config, target.config, init.constraints, target.constraints,
                priority, keepVars, defuncWith);
    }

    public static RuleBuilder.Synthesized<Rule> buildRule(String ruleId, CTerm init, CTerm target) {
        return buildRule(ruleId, init, target, OptionalInt.empty(), Set.of(), Optional.empty());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CTerm other)) return false;
        return config.equals(other.config) && constraints.equals(other.constraints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(config, constraints);
    }

    @Override
    public String toString() {
        return "CTerm(" + config + ", " + constraints + ")";
    }
}
