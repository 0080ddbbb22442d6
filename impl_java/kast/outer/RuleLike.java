package kast.outer;

import kast.term.Term;

import java.util.Map;

/**
 * A rewrite rule or a claim: a body with rewrites in it, guarded by {@code requires} and
 * promising {@code ensures}. Both side conditions are terms of sort Bool.
 */
public sealed interface RuleLike permits Rule, Claim {
    Term body();

    Term requires();

    Term ensures();

    Att att();

    RuleLike withClauses(Term body, Term requires, Term ensures);

    RuleLike withAtt(Att att);

    Map<String, Object> toDict();
}
