package kast;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multiset;
import kast.term.Apply;
import kast.term.Label;
import kast.term.Sort;
import kast.term.Token;
import kast.term.Term;
import kast.term.Variable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Generic term walks. All of them keep their own work stack, so the depth of a term is
 * bounded by the heap rather than by the call stack.
 */
public final class Traversal {

    private Traversal() {
    }

    private static final class Frame<A> {
        final Term term;
        final List<Term> children;
        final List<A> done;
        int next = 0;

        Frame(Term term) {
            this.term = term;
            this.children = term.children();
            this.done = new ArrayList<>(children.size());
        }
    }

    /**
     * Fold a term from the leaves up: {@code f} receives each node together with the results
     * already computed for its children.
     */
    public static <A> A fold(Term term, BiFunction<Term, List<A>, A> f) {
        Deque<Frame<A>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(term));
        while (true) {
            Frame<A> top = stack.peek();
            if (top.next < top.children.size()) {
                stack.push(new Frame<>(top.children.get(top.next++)));
                continue;
            }
            stack.pop();
            A result = f.apply(top.term, top.done);
            if (stack.isEmpty()) return result;
            stack.peek().done.add(result);
        }
    }

    /**
     * Rebuild every node after its children have been rebuilt, then apply {@code f} to it.
     */
    public static Term bottomUp(UnaryOperator<Term> f, Term term) {
        return fold(term, (node, children) -> f.apply(rebuild(node, children)));
    }

    /**
     * Apply {@code f} to a node first, then descend into the children of its result.
     */
    public static Term topDown(UnaryOperator<Term> f, Term term) {
        Deque<Frame<Term>> stack = new ArrayDeque<>();
        stack.push(new Frame<>(f.apply(term)));
        while (true) {
            Frame<Term> top = stack.peek();
            if (top.next < top.children.size()) {
                stack.push(new Frame<>(f.apply(top.children.get(top.next++))));
                continue;
            }
            stack.pop();
            Term result = rebuild(top.term, top.done);
            if (stack.isEmpty()) return result;
            stack.peek().done.add(result);
        }
    }

    /**
     * Pre-order visit of every subterm, without rebuilding anything.
     */
    public static void collect(Consumer<Term> callback, Term term) {
        Deque<Term> stack = new ArrayDeque<>();
        stack.push(term);
        while (!stack.isEmpty()) {
            Term current = stack.pop();
            List<Term> children = current.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
            callback.accept(current);
        }
    }

    /**
     * Structural equality, compared pair by pair from a work stack. Subterms with different hash
     * codes are told apart without being visited.
     */
    public static boolean equal(Term left, Term right) {
        Deque<Term> lefts = new ArrayDeque<>();
        Deque<Term> rights = new ArrayDeque<>();
        lefts.push(left);
        rights.push(right);
        while (!lefts.isEmpty()) {
            Term l = lefts.pop();
            Term r = rights.pop();
            if (l == r) continue;
            if (l.getClass() != r.getClass() || l.hashCode() != r.hashCode()) return false;
            if (l instanceof Token || l instanceof Variable) {
                if (!l.equals(r)) return false;
                continue;
            }
            if (l instanceof Apply la && !la.label().equals(((Apply) r).label())) return false;
            List<Term> lc = l.children();
            List<Term> rc = r.children();
            if (lc.size() != rc.size()) return false;
            for (int i = lc.size() - 1; i >= 0; i--) {
                lefts.push(lc.get(i));
                rights.push(rc.get(i));
            }
        }
        return true;
    }

    private static Term rebuild(Term node, List<Term> newChildren) {
        List<Term> oldChildren = node.children();
        for (int i = 0; i < oldChildren.size(); i++) {
            if (oldChildren.get(i) != newChildren.get(i)) {
                return node.withChildren(newChildren);
            }
        }
        return node;
    }

    /**
     * Un-nest applications of {@code label} into the flat list of their operands.
     */
    public static List<Term> flattenLabel(String label, Term term) {
        List<Term> flattened = new ArrayList<>();
        Deque<Term> rest = new ArrayDeque<>();
        rest.push(term);
        while (!rest.isEmpty()) {
            Term current = rest.pop();
            if (current instanceof Apply app && app.label().name().equals(label)) {
                List<Term> args = app.args();
                for (int i = args.size() - 1; i >= 0; i--) {
                    rest.push(args.get(i));
                }
            } else {
                flattened.add(current);
            }
        }
        return flattened;
    }

    /**
     * Nest {@code terms} into a right-associated chain of {@code label}, leaving out every
     * occurrence of {@code unit}. Returns {@code unit} when nothing is left.
     */
    public static Term buildAssoc(Term unit, Label label, Iterable<? extends Term> terms) {
        List<Term> items = new ArrayList<>();
        for (Term term : terms) {
            if (!term.equals(unit)) items.add(term);
        }
        if (items.isEmpty()) return unit;
        Term result = items.get(items.size() - 1);
        for (int i = items.size() - 2; i >= 0; i--) {
            result = new Apply(label, items.get(i), result);
        }
        return result;
    }

    public static Term buildAssoc(Term unit, String label, Iterable<? extends Term> terms) {
        return buildAssoc(unit, new Label(label), terms);
    }

    /**
     * Build a cons list {@code label(t1, label(t2, ... unit))}.
     */
    public static Term buildCons(Term unit, Label label, Iterable<? extends Term> terms) {
        List<Term> items = ImmutableList.copyOf(terms);
        Term result = unit;
        for (int i = items.size() - 1; i >= 0; i--) {
            result = new Apply(label, items.get(i), result);
        }
        return result;
    }

    /**
     * Every variable occurrence in pre-order, grouped by name.
     */
    public static ListMultimap<String, Variable> varOccurrences(Term term) {
        ListMultimap<String, Variable> occurrences = ArrayListMultimap.create();
        collect(t -> {
            if (t instanceof Variable v) occurrences.put(v.name(), v);
        }, term);
        return occurrences;
    }

    public static Multiset<String> countVars(Term term) {
        Multiset<String> counts = HashMultiset.create();
        collect(t -> {
            if (t instanceof Variable v) counts.add(v.name());
        }, term);
        return counts;
    }

    /**
     * Names of the variables of a term, in order of first occurrence.
     */
    public static Set<String> freeVars(Term term) {
        Set<String> vars = new LinkedHashSet<>();
        collect(t -> {
            if (t instanceof Variable v) vars.add(v.name());
        }, term);
        return Collections.unmodifiableSet(vars);
    }

    /**
     * One variable per name, sorted if all of its sorted occurrences agree on the sort.
     */
    public static Map<String, Variable> keepVarsSorted(ListMultimap<String, Variable> occurrences) {
        Map<String, Variable> result = new LinkedHashMap<>();
        for (String name : occurrences.keySet()) {
            Optional<Sort> sort = Optional.empty();
            for (Variable v : occurrences.get(name)) {
                if (v.sort().isEmpty()) continue;
                if (sort.isEmpty()) {
                    sort = v.sort();
                } else if (!sort.equals(v.sort())) {
                    sort = Optional.empty();
                    break;
                }
            }
            result.put(name, new Variable(name, sort));
        }
        return ImmutableMap.copyOf(result);
    }
}
