package cterm;

import kast.Substitution;
import kast.Traversal;
import kast.manip.Constraints;
import kast.outer.Definition;
import kast.prelude.Ml;
import kast.term.Sort;
import kast.term.Term;
import kast.term.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static kast.prelude.K.K;

/**
 * Instantiation of a {@link CTerm} into a more specific one: a substitution for its free variables
 * and the constraints to add.
 */
public final class CSubst {

    private final Substitution subst;
    private final List<Term> constraints;

    public CSubst(Substitution subst, Iterable<? extends Term> constraints) {
        this.subst = subst;
        this.constraints = List.copyOf(Constraints.normalizeConstraints(constraints));
    }

    public CSubst(Substitution subst) {
        this(subst, List.of());
    }

    public CSubst() {
        this(Substitution.empty());
    }

    /**
     * Pull the variable bindings out of a conjunction, keeping the other conjuncts as constraints.
     */
    public static CSubst fromPred(Term pred) {
        Substitution.Extraction extraction = Substitution.extract(pred);
        return new CSubst(extraction.subst(), Traversal.flattenLabel(Ml.AND, extraction.residual()));
    }

    @SuppressWarnings("unchecked")
    public static CSubst fromDict(Map<String, ?> dict) {
        Substitution subst = Substitution.fromDict((Map<String, ?>) dict.get("subst"));
        List<Term> constraints = new ArrayList<>();
        for (Object c : (List<?>) dict.get("constraints")) {
            constraints.add(Term.fromDict((Map<String, ?>) c));
        }
        return new CSubst(subst, constraints);
    }

    public Map<String, Object> toDict() {
        return Map.of(
                "subst", subst.toDict(),
                "constraints", constraints.stream().map(Term::toDict).toList());
    }

    public Substitution subst() {
        return subst;
    }

    public List<Term> constraints() {
        return constraints;
    }

    public Term pred() {
        return pred(Optional.empty(), true, true);
    }

    /**
     * This instantiation as a matching-logic predicate. Each binding {@code X -> v} becomes
     * {@code #Equals(X, v)} at sort {@code K}, or at the sort of {@code v} when a definition knows it.
     */
    public Term pred(Optional<Definition> sortWith, boolean includeSubst, boolean includeConstraints) {
        List<Term> preds = new ArrayList<>();
        if (includeSubst) {
            subst.minimize().asMap().forEach((k, v) -> {
                Sort sort = sortWith.flatMap(defn -> defn.sort(v)).orElse(K);
                preds.add(Ml.mlEquals(new Variable(k, sort), v, sort));
            });
        }
        if (includeConstraints) preds.addAll(constraints);
        return Ml.mlAnd(preds);
    }

    public Term constraint() {
        return Ml.mlAnd(constraints);
    }

    public CSubst addConstraint(Term constraint) {
        List<Term> newConstraints = new ArrayList<>(constraints);
        newConstraints.add(constraint);
        return new CSubst(subst, newConstraints);
    }

    /**
     * Instantiate the free variables of {@code cterm} and add this instantiation's constraints.
     */
    public CTerm apply(CTerm cterm) {
        Term config = subst.apply(cterm.config());
        List<Term> newConstraints = new ArrayList<>();
        for (Term c : cterm.constraints()) {
            newConstraints.add(subst.apply(c));
        }
        newConstraints.addAll(constraints);
        return new CTerm(config, newConstraints);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CSubst other)) return false;
        return subst.equals(other.subst) && constraints.equals(other.constraints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subst, constraints);
    }

    @Override
    public String toString() {
        return "CSubst(" + subst + ", " + constraints + ")";
    }
}
