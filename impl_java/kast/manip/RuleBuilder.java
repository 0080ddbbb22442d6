package kast.manip;

import com.google.common.collect.ListMultimap;
import kast.Substitution;
import kast.Traversal;
import kast.outer.Att;
import kast.outer.Claim;
import kast.outer.Definition;
import kast.outer.Rule;
import kast.outer.RuleLike;
import kast.prelude.Ml;
import kast.term.Apply;
import kast.term.Rewrite;
import kast.term.Sort;
import kast.term.Term;
import kast.term.Variable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

import static kast.prelude.K.GENERATED_TOP_CELL;

/**
 * Synthesis of rules and claims from a pair of symbolic states.
 */
public final class RuleBuilder {
    private static final Logger log = LogManager.getLogger(RuleBuilder.class);

    private RuleBuilder() {
    }

    /**
     * A synthesized rule or claim, with the renaming that maps its variables back to the caller's.
     */
    public record Synthesized<R extends RuleLike>(R rule, Substitution varMap) {
    }

    public record Defunctionalized(Term term, List<Term> constraints) {
    }

    public static Synthesized<Rule> buildRule(String ruleId, Term initConfig, Term finalConfig,
                                              List<? extends Term> initConstraints, List<? extends Term> finalConstraints) {
        return buildRule(ruleId, initConfig, finalConfig, initConstraints, finalConstraints,
                OptionalInt.empty(), Set.of(), Optional.empty());
    }

    /**
     * Build the rule {@code initConfig => finalConfig requires initConstraints ensures finalConstraints}.
     * <p>
     * Variables occurring once are prefixed with {@code _}. Variables free only on the final side
     * are prefixed with {@code ?}. Function applications in {@code initConfig} are abstracted into
     * variables when a definition is given.
     *
     * @param keepVars accepted for symmetry with minimization; renaming does not consult it
     */
    public static Synthesized<Rule> buildRule(String ruleId, Term initConfig, Term finalConfig,
                                              List<? extends Term> initConstraints, List<? extends Term> finalConstraints,
                                              OptionalInt priority, Set<String> keepVars, Optional<Definition> defuncWith) {
        List<Term> init = new ArrayList<>(initConstraints.stream().map(BoolLogic::normalizeMlPred).toList());
        List<Term> fin = new ArrayList<>(finalConstraints.stream().map(BoolLogic::normalizeMlPred).toList());
        fin.removeIf(init::contains);

        if (defuncWith.isPresent()) {
            Defunctionalized defunc = defunctionalize(defuncWith.get(), initConfig);
            initConfig = defunc.term();
            init.addAll(defunc.constraints());
        }

        Set<String> lhsVars = Traversal.freeVars(Ml.mlAnd(prepend(initConfig, init)));
        Set<String> rhsVars = Traversal.freeVars(Ml.mlAnd(prepend(finalConfig, fin)));
        List<Term> occurrenceTerms = new ArrayList<>();
        occurrenceTerms.add(Rewrites.pushDownRewrites(new Rewrite(initConfig, finalConfig)));
        occurrenceTerms.addAll(init);
        occurrenceTerms.addAll(fin);
        ListMultimap<String, Variable> occurrences = Traversal.varOccurrences(Ml.mlAnd(occurrenceTerms, GENERATED_TOP_CELL));
        Map<String, Variable> sortedVars = Traversal.keepVarsSorted(occurrences);

        Map<String, Term> renaming = new LinkedHashMap<>();
        Map<String, Term> remap = new LinkedHashMap<>();
        for (String v : occurrences.keySet()) {
            String newName = v;
            if (occurrences.get(v).size() == 1) newName = Variable.UNUSED_PREFIX + newName;
            if (rhsVars.contains(v) && !lhsVars.contains(v)) newName = Variable.EXISTENTIAL_PREFIX + newName;
            if (!newName.equals(v)) {
                Variable sorted = sortedVars.get(v);
                renaming.put(v, new Variable(newName, sorted.sort()));
                remap.put(newName, sorted);
            }
        }
        log.debug("Renaming variables of {}: {}", ruleId, renaming);

        Substitution vSubst = Substitution.of(renaming);
        Term newInitConfig = vSubst.apply(initConfig);
        List<Term> newInitConstraints = init.stream().map(vSubst::apply).toList();
        Constraints.StateAndConstraints finalState = Constraints.applyExistentialSubstitutions(
                vSubst.apply(finalConfig), fin.stream().map(vSubst::apply).toList());

        Term body = Rewrites.pushDownRewrites(new Rewrite(newInitConfig, finalState.state()));
        Term requires = BoolLogic.simplifyBool(BoolLogic.mlPredToBool(Ml.mlAnd(newInitConstraints)));
        Term ensures = BoolLogic.simplifyBool(BoolLogic.mlPredToBool(Ml.mlAnd(finalState.constraints())));

        Att att = Att.empty();
        if (priority.isPresent()) att = att.update(Att.PRIORITY, Integer.toString(priority.getAsInt()));
        att = att.update(Att.LABEL, ruleId);

        return new Synthesized<>(new Rule(body, requires, ensures, att), Substitution.of(remap));
    }

    public static Synthesized<Claim> buildClaim(String claimId, Term initConfig, Term finalConfig,
                                                List<? extends Term> initConstraints, List<? extends Term> finalConstraints) {
        return buildClaim(claimId, initConfig, finalConfig, initConstraints, finalConstraints, Set.of());
    }

    /**
     * Same as {@link #buildRule} without priority or defunctionalization, producing a claim.
     */
    public static Synthesized<Claim> buildClaim(String claimId, Term initConfig, Term finalConfig,
                                                List<? extends Term> initConstraints, List<? extends Term> finalConstraints,
                                                Set<String> keepVars) {
        Synthesized<Rule> rule = buildRule(claimId, initConfig, finalConfig, initConstraints, finalConstraints,
                OptionalInt.empty(), keepVars, Optional.empty());
        Rule r = rule.rule();
        return new Synthesized<>(new Claim(r.body(), r.requires(), r.ensures(), r.att()), rule.varMap());
    }

    /**
     * Replace every application of a function symbol by a fresh sorted variable, returning the
     * equalities that define those variables.
     *
     * @throws IllegalArgumentException if the sort of a function application cannot be determined
     */
    public static Defunctionalized defunctionalize(Definition defn, Term term) {
        Set<String> functionLabels = defn.functionLabels();
        Set<Term> constraints = new LinkedHashSet<>();
        Term newTerm = Traversal.topDown(k -> {
            if (k instanceof Apply app && functionLabels.contains(app.label().name())) {
                Sort sort = defn.sort(app)
                        .orElseThrow(() -> new IllegalArgumentException("Could not determine sort for: " + app));
                Variable newVar = Rewrites.abstractTermSafely(app, "F", Optional.of(sort));
                constraints.add(Ml.mlEquals(newVar, app, sort));
                log.debug("Defunctionalized {} into {}", app, newVar);
                return newVar;
            }
            return k;
        }, term);
        return new Defunctionalized(newTerm, List.copyOf(constraints));
    }

    private static List<Term> prepend(Term head, List<Term> tail) {
        List<Term> result = new ArrayList<>(tail.size() + 1);
        result.add(head);
        result.addAll(tail);
        return result;
    }
}
