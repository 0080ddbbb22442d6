package kast.outer;

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Attributes of a sentence, as a map from attribute key to its raw string value.
 * Flag attributes such as {@code function} map to the empty string.
 */
public record Att(Map<String, String> entries) {
    public static final String LABEL = "label";
    public static final String PRIORITY = "priority";
    public static final String OWISE = "owise";
    public static final String FUNCTION = "function";
    public static final String CIRCULARITY = "circularity";
    public static final String TRUSTED = "trusted";
    public static final String DEPENDS = "depends";

    private static final Att EMPTY = new Att(Map.of());

    public Att {
        entries = ImmutableMap.copyOf(entries);
    }

    public static Att empty() {
        return EMPTY;
    }

    public static Att of(String key, String value) {
        return new Att(Map.of(key, value));
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean has(String key) {
        return entries.containsKey(key);
    }

    /**
     * A copy with {@code key} set to {@code value}, replacing any previous value.
     */
    public Att update(String key, String value) {
        Map<String, String> newEntries = new LinkedHashMap<>(entries);
        newEntries.put(key, value);
        return new Att(newEntries);
    }

    public Map<String, Object> toDict() {
        return ImmutableMap.of("node", "KAtt", "att", entries);
    }
}
