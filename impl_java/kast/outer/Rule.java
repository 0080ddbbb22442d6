package kast.outer;

import com.google.common.collect.ImmutableMap;
import kast.prelude.KBool;
import kast.term.Term;

import java.util.Map;
import java.util.Objects;

public record Rule(Term body, Term requires, Term ensures, Att att) implements RuleLike {
    public static final int DEFAULT_PRIORITY = 50;
    public static final int OWISE_PRIORITY = 200;

    public Rule {
        Objects.requireNonNull(body);
        Objects.requireNonNull(requires);
        Objects.requireNonNull(ensures);
        Objects.requireNonNull(att);
    }

    public Rule(Term body) {
        this(body, KBool.TRUE, KBool.TRUE, Att.empty());
    }

    public int priority() {
        return att.get(Att.PRIORITY).map(Integer::parseInt)
                .orElse(att.has(Att.OWISE) ? OWISE_PRIORITY : DEFAULT_PRIORITY);
    }

    @Override
    public Rule withClauses(Term body, Term requires, Term ensures) {
        return new Rule(body, requires, ensures, att);
    }

    @Override
    public Rule withAtt(Att att) {
        return new Rule(body, requires, ensures, att);
    }

    @Override
    public Map<String, Object> toDict() {
        return ImmutableMap.of("node", "KRule", "body", body.toDict(), "requires", requires.toDict(),
                "ensures", ensures.toDict(), "att", att.toDict());
    }
}
