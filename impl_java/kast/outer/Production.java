package kast.outer;

import com.google.common.collect.ImmutableList;
import kast.term.Label;
import kast.term.Sort;

import java.util.List;

/**
 * The signature of a symbol: its result sort, argument sorts and sort parameters.
 */
public record Production(Label klabel, Sort sort, List<Sort> argumentSorts, List<Sort> params, Att att) {
    public Production {
        argumentSorts = ImmutableList.copyOf(argumentSorts);
        params = ImmutableList.copyOf(params);
    }

    public Production(Label klabel, Sort sort, List<Sort> argumentSorts) {
        this(klabel, sort, argumentSorts, List.of(), Att.empty());
    }

    public boolean isFunction() {
        return att.has(Att.FUNCTION);
    }
}
