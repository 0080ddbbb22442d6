package cterm;

import kast.Substitution;
import kast.Traversal;
import kast.manip.Rewrites;
import kast.outer.Definition;
import kast.term.Rewrite;
import kast.term.Sort;
import kast.term.Term;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Generalization of configurations: the least pattern that matches each of its inputs.
 */
public final class AntiUnifier {
    private static final Logger log = LogManager.getLogger(AntiUnifier.class);

    private AntiUnifier() {
    }

    /**
     * The generalized term and the substitutions that recover each input from it.
     */
    public record Result(Term term, Substitution subst1, Substitution subst2) {
    }

    public static Result antiUnify(Term state1, Term state2) {
        return antiUnify(state1, state2, Optional.empty());
    }

    /**
     * Push a rewrite between the two states down to where they differ, then replace each remaining
     * rewrite with a variable named after its hash. With a definition, those variables are sorted.
     *
     * @throws IllegalStateException if the generalized term does not instantiate back to both states
     */
    public static Result antiUnify(Term state1, Term state2, Optional<Definition> defn) {
        Term minimized = Rewrites.pushDownRewrites(new Rewrite(state1, state2));
        Term abstracted = Traversal.bottomUp(k -> {
            if (k instanceof Rewrite rw) {
                Optional<Sort> sort = defn.flatMap(d -> d.sort(rw));
                return Rewrites.abstractTermSafely(rw, "V", sort);
            }
            return k;
        }, minimized);

        Optional<Substitution> subst1 = abstracted.match(state1);
        Optional<Substitution> subst2 = abstracted.match(state2);
        if (subst1.isEmpty() || subst2.isEmpty()) {
            throw new IllegalStateException("Anti-unification failed to produce a more general state: " + abstracted);
        }
        if (!subst1.get().apply(abstracted).equals(state1) || !subst2.get().apply(abstracted).equals(state2)) {
            throw new IllegalStateException("Anti-unification does not reproduce its inputs: " + abstracted);
        }
        return new Result(abstracted, subst1.get(), subst2.get());
    }

    public record MultiResult(CTerm cterm, List<CSubst> csubsts) {
    }

    /**
     * Generalize several states at once, folding {@link CTerm#antiUnify} from the left.
     *
     * @throws IllegalArgumentException if {@code cterms} is empty
     */
    public static MultiResult antiUnifyAll(List<CTerm> cterms, boolean keepValues, Optional<Definition> defn) {
        if (cterms.isEmpty()) throw new IllegalArgumentException("Anti-unification failed, no CTerms provided");
        CTerm merged = cterms.get(0);
        for (CTerm cterm : cterms.subList(1, cterms.size())) {
            merged = merged.antiUnify(cterm, keepValues, defn).cterm();
        }
        List<CSubst> csubsts = new ArrayList<>();
        for (CTerm cterm : cterms) {
            CTerm generalized = merged;
            csubsts.add(merged.matchWithConstraint(cterm).orElseThrow(() -> new IllegalStateException(
                    "Anti-unification result " + generalized + " does not match " + cterm)));
        }
        log.debug("Anti-unified {} states into {}", cterms.size(), merged);
        return new MultiResult(merged, csubsts);
    }

    public static MultiResult antiUnifyAll(List<CTerm> cterms) {
        return antiUnifyAll(cterms, false, Optional.empty());
    }
}
