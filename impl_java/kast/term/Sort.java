package kast.term;

import java.util.Objects;

public record Sort(String name) {
    public Sort {
        Objects.requireNonNull(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
