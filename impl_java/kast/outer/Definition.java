package kast.outer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import kast.term.Apply;
import kast.term.Label;
import kast.term.Rewrite;
import kast.term.Sequence;
import kast.term.Sort;
import kast.term.Term;
import kast.term.Token;
import kast.term.Variable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Symbol table of a language definition: the productions by symbol name and the subsort lattice.
 */
public final class Definition {
    private static final Logger log = LogManager.getLogger(Definition.class);

    private final ImmutableMap<String, Production> symbols;
    private final ImmutableSetMultimap<Sort, Sort> subsorts;

    private Definition(ImmutableMap<String, Production> symbols, ImmutableSetMultimap<Sort, Sort> subsorts) {
        this.symbols = symbols;
        this.subsorts = subsorts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Production> symbol(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    public Map<String, Production> symbols() {
        return symbols;
    }

    public List<Production> functions() {
        return symbols.values().stream().filter(Production::isFunction).collect(ImmutableList.toImmutableList());
    }

    public Set<String> functionLabels() {
        return functions().stream().map(p -> p.klabel().name()).collect(ImmutableSet.toImmutableSet());
    }

    /**
     * All strict subsorts of {@code sort}, transitively.
     */
    public Set<Sort> subsorts(Sort sort) {
        return subsorts.get(sort);
    }

    /**
     * Best-effort sort of a term, empty where it cannot be determined.
     */
    public Optional<Sort> sort(Term term) {
        if (term instanceof Token token) {
            return Optional.of(token.sort());
        } else if (term instanceof Variable var) {
            return var.sort();
        } else if (term instanceof Rewrite rw) {
            Optional<Sort> lhs = sort(rw.lhs());
            Optional<Sort> rhs = sort(rw.rhs());
            if (lhs.isEmpty() || rhs.isEmpty()) return Optional.empty();
            return leastCommonSupersort(lhs.get(), rhs.get());
        } else if (term instanceof Sequence) {
            return Optional.of(new Sort("K"));
        } else if (term instanceof Apply app) {
            if (!symbols.containsKey(app.label().name())) {
                log.warn("No production for symbol {}", app.label().name());
                return Optional.empty();
            }
            return Optional.of(resolveSorts(app.label()).sort());
        }
        return Optional.empty();
    }

    /**
     * @throws IllegalArgumentException if the sort cannot be determined
     */
    public Sort sortStrict(Term term) {
        return sort(term).orElseThrow(() -> new IllegalArgumentException("Could not determine sort of term: " + term));
    }

    public record ResolvedSorts(Sort sort, List<Sort> argumentSorts) {
    }

    /**
     * Result and argument sorts of a symbol, with its sort parameters instantiated from the label.
     *
     * @throws IllegalArgumentException if the symbol is unknown
     */
    public ResolvedSorts resolveSorts(Label label) {
        Production prod = symbol(label.name())
                .orElseThrow(() -> new IllegalArgumentException("Unknown symbol: " + label.name()));
        Map<Sort, Sort> instantiation = new HashMap<>();
        for (int i = 0; i < prod.params().size() && i < label.params().size(); i++) {
            instantiation.put(prod.params().get(i), label.params().get(i));
        }
        return new ResolvedSorts(
                instantiation.getOrDefault(prod.sort(), prod.sort()),
                prod.argumentSorts().stream().map(s -> instantiation.getOrDefault(s, s)).toList());
    }

    public Optional<Sort> leastCommonSupersort(Sort sort1, Sort sort2) {
        if (sort1.equals(sort2)) return Optional.of(sort1);
        if (subsorts(sort2).contains(sort1)) return Optional.of(sort2);
        if (subsorts(sort1).contains(sort2)) return Optional.of(sort1);
        return Optional.empty();
    }

    public Optional<Sort> greatestCommonSubsort(Sort sort1, Sort sort2) {
        if (sort1.equals(sort2)) return Optional.of(sort1);
        if (subsorts(sort2).contains(sort1)) return Optional.of(sort1);
        if (subsorts(sort1).contains(sort2)) return Optional.of(sort2);
        return Optional.empty();
    }

    public static final class Builder {
        private final Map<String, Production> symbols = new LinkedHashMap<>();
        private final SetMultimap<Sort, Sort> directSubsorts = LinkedHashMultimap.create();

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if a different production was already given for the same symbol
         */
        public Builder production(Production production) {
            String name = production.klabel().name();
            Production other = symbols.putIfAbsent(name, production);
            if (other != null && !other.equals(production)) {
                throw new IllegalArgumentException("Found multiple productions for " + name);
            }
            return this;
        }

        public Builder subsort(Sort subsort, Sort supersort) {
            directSubsorts.put(supersort, subsort);
            return this;
        }

        public Definition build() {
            ImmutableSetMultimap.Builder<Sort, Sort> closure = ImmutableSetMultimap.builder();
            for (Sort supersort : directSubsorts.keySet()) {
                Deque<Sort> pending = new ArrayDeque<>(directSubsorts.get(supersort));
                Set<Sort> seen = new LinkedHashSet<>();
                while (!pending.isEmpty()) {
                    Sort sub = pending.pop();
                    if (seen.add(sub)) pending.addAll(directSubsorts.get(sub));
                }
                closure.putAll(supersort, seen);
            }
            return new Definition(ImmutableMap.copyOf(symbols), closure.build());
        }
    }
}
