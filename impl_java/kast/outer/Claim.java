package kast.outer;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import kast.prelude.KBool;
import kast.term.Term;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record Claim(Term body, Term requires, Term ensures, Att att) implements RuleLike {
    public Claim {
        Objects.requireNonNull(body);
        Objects.requireNonNull(requires);
        Objects.requireNonNull(ensures);
        Objects.requireNonNull(att);
    }

    public Claim(Term body) {
        this(body, KBool.TRUE, KBool.TRUE, Att.empty());
    }

    public boolean isCircularity() {
        return att.has(Att.CIRCULARITY);
    }

    public boolean isTrusted() {
        return att.has(Att.TRUSTED);
    }

    /**
     * Labels of the claims this one depends on, from the comma-separated {@code depends} attribute.
     */
    public List<String> dependencies() {
        return att.get(Att.DEPENDS)
                .map(deps -> Splitter.on(',').trimResults().omitEmptyStrings().splitToList(deps))
                .orElse(List.of());
    }

    @Override
    public Claim withClauses(Term body, Term requires, Term ensures) {
        return new Claim(body, requires, ensures, att);
    }

    @Override
    public Claim withAtt(Att att) {
        return new Claim(body, requires, ensures, att);
    }

    @Override
    public Map<String, Object> toDict() {
        return ImmutableMap.of("node", "KClaim", "body", body.toDict(), "requires", requires.toDict(),
                "ensures", ensures.toDict(), "att", att.toDict());
    }
}
