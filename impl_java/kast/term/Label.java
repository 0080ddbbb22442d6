package kast.term;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A symbol name with its (possibly empty) list of sort parameters.
 */
public record Label(String name, List<Sort> params) {
    public Label {
        Objects.requireNonNull(name);
        params = ImmutableList.copyOf(params);
    }

    public Label(String name, Sort... params) {
        this(name, List.of(params));
    }

    public Apply apply(Term... args) {
        return new Apply(this, List.of(args));
    }

    public Apply apply(List<? extends Term> args) {
        return new Apply(this, args);
    }

    @Override
    public String toString() {
        if (params.isEmpty()) return name;
        return name + "{" + String.join(", ", params.stream().map(Sort::name).toArray(String[]::new)) + "}";
    }
}
