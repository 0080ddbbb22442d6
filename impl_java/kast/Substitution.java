package kast;

import com.google.common.collect.ImmutableMap;
import kast.prelude.KBool;
import kast.prelude.Ml;
import kast.term.Apply;
import kast.term.Rewrite;
import kast.term.Term;
import kast.term.Variable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from variable names to terms. Iteration follows insertion order.
 */
public final class Substitution {

    private static final Substitution EMPTY = new Substitution(ImmutableMap.of());

    private final ImmutableMap<String, Term> map;

    private Substitution(ImmutableMap<String, Term> map) {
        this.map = map;
    }

    public static Substitution empty() {
        return EMPTY;
    }

    public static Substitution of(String var, Term term) {
        return new Substitution(ImmutableMap.of(var, term));
    }

    public static Substitution of(Map<String, ? extends Term> map) {
        if (map.isEmpty()) return EMPTY;
        return new Substitution(ImmutableMap.copyOf(map));
    }

    public Optional<Term> get(String var) {
        return Optional.ofNullable(map.get(var));
    }

    public Term getOrDefault(String var, Term defaultTerm) {
        return map.getOrDefault(var, defaultTerm);
    }

    public boolean containsKey(String var) {
        return map.containsKey(var);
    }

    public Set<String> keySet() {
        return map.keySet();
    }

    public Map<String, Term> asMap() {
        return map;
    }

    public int size() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    /**
     * Replace every variable bound here by its value.
     */
    public Term apply(Term term) {
        if (map.isEmpty()) return term;
        return Traversal.bottomUp(t -> {
            if (t instanceof Variable v) return map.getOrDefault(v.name(), v);
            return t;
        }, term);
    }

    /**
     * Merge two substitutions. Empty if some variable is bound to different values by the two.
     */
    public Optional<Substitution> union(Substitution other) {
        if (other.isEmpty()) return Optional.of(this);
        if (isEmpty()) return Optional.of(other);
        Map<String, Term> newMap = new LinkedHashMap<>(map);
        for (var e : other.map.entrySet()) {
            Term existing = newMap.putIfAbsent(e.getKey(), e.getValue());
            if (existing != null && !existing.equals(e.getValue())) return Optional.empty();
        }
        return Optional.of(new Substitution(ImmutableMap.copyOf(newMap)));
    }

    /**
     * Sequential composition: {@code this.compose(other).apply(t) == this.apply(other.apply(t))}.
     * Where both bind a variable the binding from {@code other} wins.
     */
    public Substitution compose(Substitution other) {
        Map<String, Term> newMap = new LinkedHashMap<>();
        for (var e : other.map.entrySet()) {
            newMap.put(e.getKey(), apply(e.getValue()));
        }
        for (var e : map.entrySet()) {
            newMap.putIfAbsent(e.getKey(), e.getValue());
        }
        return new Substitution(ImmutableMap.copyOf(newMap));
    }

    /**
     * Drop identity bindings {@code x -> x}.
     */
    public Substitution minimize() {
        Map<String, Term> newMap = new LinkedHashMap<>();
        for (var e : map.entrySet()) {
            if (!(e.getValue() instanceof Variable v && v.name().equals(e.getKey()))) {
                newMap.put(e.getKey(), e.getValue());
            }
        }
        if (newMap.size() == map.size()) return this;
        return of(newMap);
    }

    /**
     * Replace syntactic occurrences of each bound value by its variable, in insertion order.
     */
    public Term unapply(Term term) {
        Term result = term;
        for (var e : map.entrySet()) {
            result = new Rewrite(e.getValue(), new Variable(e.getKey())).replace(result);
        }
        return result;
    }

    public Substitution without(String var) {
        if (!map.containsKey(var)) return this;
        Map<String, Term> newMap = new LinkedHashMap<>(map);
        newMap.remove(var);
        return of(newMap);
    }

    /**
     * The bindings as a boolean conjunction of {@code _==K_} equalities, {@code true} if there are none.
     */
    public Term pred() {
        List<Term> items = new ArrayList<>();
        for (var e : minimize().map.entrySet()) {
            items.add(new Apply(KBool.EQ_K, new Variable(e.getKey()), e.getValue()));
        }
        return KBool.andBool(items);
    }

    /**
     * The bindings as a matching-logic conjunction of {@code #Equals} predicates.
     */
    public Term mlPred() {
        List<Term> items = new ArrayList<>();
        for (var e : minimize().map.entrySet()) {
            items.add(Ml.mlEquals(new Variable(e.getKey()), e.getValue()));
        }
        return Ml.mlAnd(items);
    }

    /**
     * Read a substitution off a conjunction of {@code #Equals(X, t)} predicates.
     *
     * @throws IllegalArgumentException if the predicate is a disjunction or some conjunct is not such an equality
     */
    public static Substitution fromPred(Term pred) {
        if (pred instanceof Apply app && app.label().name().equals(Ml.OR)) {
            throw new IllegalArgumentException("Invalid substitution predicate, wrong connective: " + pred);
        }
        Map<String, Term> newMap = new LinkedHashMap<>();
        for (Term conjunct : Traversal.flattenLabel(Ml.AND, pred)) {
            if (conjunct instanceof Apply eq && eq.label().name().equals(Ml.EQUALS) && eq.arity() == 2
                    && eq.args().get(0) instanceof Variable var) {
                newMap.put(var.name(), eq.args().get(1));
            } else {
                throw new IllegalArgumentException("Invalid substitution predicate: " + conjunct);
            }
        }
        return of(newMap);
    }

    /**
     * Result of {@link #extract}: the bindings found and the conjuncts left over.
     */
    public record Extraction(Substitution subst, Term residual) {
    }

    /**
     * Greedily pull {@code X = t} bindings out of a conjunction, in order. A binding is taken only if
     * {@code X} is not bound yet, {@code t} mentions no variable bound so far, and {@code X} does
     * not occur in {@code t}. Everything else is kept in the residual.
     */
    public static Extraction extract(Term term) {
        Map<String, Term> newMap = new LinkedHashMap<>();
        List<Term> remaining = new ArrayList<>();
        List<Term> conjuncts = Traversal.flattenLabel(Ml.AND, term);

        for (Term conjunct : conjuncts) {
            Optional<Map.Entry<String, Term>> binding = Optional.empty();
            if (conjunct instanceof Apply eq && eq.label().name().equals(Ml.EQUALS) && eq.arity() == 2) {
                binding = extractBinding(eq.args().get(0), eq.args().get(1), newMap);
            }
            if (binding.isPresent()) {
                newMap.put(binding.get().getKey(), binding.get().getValue());
            } else {
                remaining.add(conjunct);
            }
        }

        Substitution subst = of(newMap);
        if (conjuncts.size() == 1 && newMap.isEmpty()) return new Extraction(subst, term);
        if (remaining.isEmpty()) return new Extraction(subst, Ml.mlTop());
        return new Extraction(subst, Ml.mlAnd(remaining));
    }

    private static Optional<Map.Entry<String, Term>> extractBinding(Term t1, Term t2, Map<String, Term> bound) {
        if (t1 instanceof Variable v && canBind(v, t2, bound)) return Optional.of(Map.entry(v.name(), t2));
        if (t2 instanceof Variable v && canBind(v, t1, bound)) return Optional.of(Map.entry(v.name(), t1));
        if (KBool.TRUE.equals(t1) && isBoolEquality(t2)) {
            Apply eq = (Apply) t2;
            return extractBinding(eq.args().get(0), eq.args().get(1), bound);
        }
        if (KBool.TRUE.equals(t2) && isBoolEquality(t1)) {
            Apply eq = (Apply) t1;
            return extractBinding(eq.args().get(0), eq.args().get(1), bound);
        }
        return Optional.empty();
    }

    private static boolean canBind(Variable var, Term value, Map<String, Term> bound) {
        if (bound.containsKey(var.name())) return false;
        Set<String> valueVars = Traversal.freeVars(value);
        if (valueVars.contains(var.name())) return false;
        for (String name : valueVars) {
            if (bound.containsKey(name)) return false;
        }
        return true;
    }

    private static boolean isBoolEquality(Term term) {
        return term instanceof Apply app && app.arity() == 2
                && (app.label().name().equals(KBool.EQ_K.name()) || app.label().name().equals(KBool.EQ_INT.name()));
    }

    public Map<String, Object> toDict() {
        ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
        map.forEach((k, v) -> builder.put(k, v.toDict()));
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    public static Substitution fromDict(Map<String, ?> dict) {
        Map<String, Term> newMap = new LinkedHashMap<>();
        dict.forEach((k, v) -> newMap.put(k, Term.fromDict((Map<String, ?>) v)));
        return of(newMap);
    }

    @Override
    public String toString() {
        return map.toString();
    }

    @Override
    public int hashCode() {
        return Objects.hash(map);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Substitution other)) return false;
        return map.equals(other.map);
    }
}
