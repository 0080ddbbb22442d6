package kast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hashing;
import kast.term.Apply;
import kast.term.As;
import kast.term.Label;
import kast.term.Rewrite;
import kast.term.Sequence;
import kast.term.Sort;
import kast.term.Term;
import kast.term.Token;
import kast.term.Variable;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Structured encoding of terms as nested maps keyed by a {@code "node"} tag, and the canonical
 * JSON text derived from it.
 */
public final class KastJson {
    public static final String FORMAT = "KAST";
    public static final int VERSION = 3;

    private KastJson() {
    }

    public static Map<String, Object> toDict(Sort sort) {
        return ImmutableMap.of("node", "KSort", "name", sort.name());
    }

    public static Map<String, Object> toDict(Label label) {
        List<Object> params = label.params().stream().map(p -> (Object) toDict(p)).toList();
        return ImmutableMap.of("node", "KLabel", "name", label.name(), "params", params);
    }

    public static Map<String, Object> toDict(Term term) {
        return Traversal.<Map<String, Object>>fold(term, (t, children) -> {
            if (t instanceof Token token) {
                return ImmutableMap.of("node", "KToken", "token", token.token(), "sort", toDict(token.sort()));
            } else if (t instanceof Variable var) {
                if (var.sort().isEmpty()) return ImmutableMap.of("node", "KVariable", "name", var.name());
                return ImmutableMap.of("node", "KVariable", "name", var.name(), "sort", toDict(var.sort().get()));
            } else if (t instanceof Apply app) {
                return ImmutableMap.of("node", "KApply", "label", toDict(app.label()),
                        "args", ImmutableList.copyOf(children), "arity", app.arity(), "variable", false);
            } else if (t instanceof As) {
                return ImmutableMap.of("node", "KAs", "pattern", children.get(0), "alias", children.get(1));
            } else if (t instanceof Rewrite) {
                return ImmutableMap.of("node", "KRewrite", "lhs", children.get(0), "rhs", children.get(1));
            } else if (t instanceof Sequence seq) {
                return ImmutableMap.of("node", "KSequence", "items", ImmutableList.copyOf(children), "arity", seq.arity());
            }
            throw new IllegalStateException("Unhandled term variant: " + t.getClass());
        });
    }

    public static Sort sortFromDict(Map<String, ?> dict) {
        expectNode(dict, "KSort");
        return new Sort((String) dict.get("name"));
    }

    @SuppressWarnings("unchecked")
    public static Label labelFromDict(Map<String, ?> dict) {
        expectNode(dict, "KLabel");
        List<Map<String, ?>> params = (List<Map<String, ?>>) dict.get("params");
        if (params == null) return new Label((String) dict.get("name"));
        return new Label((String) dict.get("name"), params.stream().map(KastJson::sortFromDict).toList());
    }

    /**
     * Decode a term. Nested dictionaries are visited from an explicit stack, children first.
     *
     * @throws IllegalArgumentException on a missing or unknown node tag
     */
    public static Term termFromDict(Map<String, ?> dict) {
        Deque<DictFrame> stack = new ArrayDeque<>();
        stack.push(new DictFrame(dict));
        while (true) {
            DictFrame top = stack.peek();
            if (top.next < top.children.size()) {
                stack.push(new DictFrame(top.children.get(top.next++)));
                continue;
            }
            stack.pop();
            Term result = buildTerm(top, top.done);
            if (stack.isEmpty()) return result;
            stack.peek().done.add(result);
        }
    }

    private static final class DictFrame {
        final Map<String, ?> dict;
        final String tag;
        final List<Map<String, ?>> children;
        final List<Term> done;
        int next = 0;

        DictFrame(Map<String, ?> dict) {
            if (dict == null) throw new IllegalArgumentException("Missing term");
            if (!(dict.get("node") instanceof String node)) {
                throw new IllegalArgumentException("Missing node tag, keys: " + dict.keySet());
            }
            this.dict = dict;
            this.tag = node;
            this.children = childDicts(node, dict);
            this.done = new ArrayList<>(children.size());
        }
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, ?>> childDicts(String tag, Map<String, ?> dict) {
        switch (tag) {
            case "KToken":
            case "KVariable":
                return List.of();
            case "KApply":
                return dict.get("args") == null ? List.of() : (List<Map<String, ?>>) dict.get("args");
            case "KAs":
                return List.of(childDict(dict, "pattern"), childDict(dict, "alias"));
            case "KRewrite":
                return List.of(childDict(dict, "lhs"), childDict(dict, "rhs"));
            case "KSequence":
                return dict.get("items") == null ? List.of() : (List<Map<String, ?>>) dict.get("items");
            default:
                throw new IllegalArgumentException("Unknown node type: " + tag);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> childDict(Map<String, ?> dict, String key) {
        Object child = dict.get(key);
        if (!(child instanceof Map)) throw new IllegalArgumentException("Missing " + key + " in " + dict.get("node"));
        return (Map<String, ?>) child;
    }

    @SuppressWarnings("unchecked")
    private static Term buildTerm(DictFrame frame, List<Term> children) {
        Map<String, ?> dict = frame.dict;
        switch (frame.tag) {
            case "KToken":
                return new Token((String) dict.get("token"), sortFromDict((Map<String, ?>) dict.get("sort")));
            case "KVariable": {
                Map<String, ?> sort = (Map<String, ?>) dict.get("sort");
                String name = (String) dict.get("name");
                return sort == null ? new Variable(name) : new Variable(name, sortFromDict(sort));
            }
            case "KApply":
                return new Apply(labelFromDict((Map<String, ?>) dict.get("label")), children);
            case "KAs":
                return new As(children.get(0), children.get(1));
            case "KRewrite":
                return new Rewrite(children.get(0), children.get(1));
            case "KSequence":
                return new Sequence(children);
            default:
                throw new IllegalStateException("Unhandled node type: " + frame.tag);
        }
    }

    private static void expectNode(Map<String, ?> dict, String tag) {
        if (!tag.equals(dict.get("node"))) {
            throw new IllegalArgumentException("Expected node " + tag + ", found: " + dict.get("node"));
        }
    }

    /**
     * Wrap a term into the versioned interchange envelope.
     */
    public static Map<String, Object> wrap(Term term) {
        return ImmutableMap.of("format", FORMAT, "version", VERSION, "term", term.toDict());
    }

    @SuppressWarnings("unchecked")
    public static Term unwrap(Map<String, ?> envelope) {
        if (!FORMAT.equals(envelope.get("format"))) {
            throw new IllegalArgumentException("Invalid format: " + envelope.get("format"));
        }
        if (!(envelope.get("version") instanceof Number version) || version.intValue() != VERSION) {
            throw new IllegalArgumentException("Expected version " + VERSION + ", found: " + envelope.get("version"));
        }
        return termFromDict((Map<String, ?>) envelope.get("term"));
    }

    public static String hash(Term term) {
        return Hashing.sha256().hashString(toJson(term.toDict()), StandardCharsets.UTF_8).toString();
    }

    /**
     * Compact JSON with object keys in sorted order.
     */
    public static String toJson(Object value) {
        StringBuilder sb = new StringBuilder();
        writeJson(sb, value);
        return sb.toString();
    }

    /**
     * Literal output text, as opposed to a JSON value still to be written.
     */
    private record Raw(String text) {
    }

    private static final Raw NULL = new Raw("null");

    private static void writeJson(StringBuilder sb, Object root) {
        Deque<Object> work = new ArrayDeque<>();
        work.push(root == null ? NULL : root);
        while (!work.isEmpty()) {
            Object value = work.pop();
            if (value instanceof Raw raw) {
                sb.append(raw.text());
            } else if (value instanceof String s) {
                writeString(sb, s);
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else if (value instanceof Map<?, ?> map) {
                Map<String, Object> sorted = new TreeMap<>();
                map.forEach((k, v) -> sorted.put(k.toString(), v));
                List<Object> parts = new ArrayList<>();
                StringBuilder open = new StringBuilder("{");
                for (var e : sorted.entrySet()) {
                    if (open.length() == 0) open.append(',');
                    writeString(open, e.getKey());
                    open.append(':');
                    parts.add(new Raw(open.toString()));
                    parts.add(e.getValue() == null ? NULL : e.getValue());
                    open.setLength(0);
                }
                if (open.length() > 0) parts.add(new Raw(open.toString()));
                parts.add(new Raw("}"));
                pushAll(work, parts);
            } else if (value instanceof List<?> list) {
                List<Object> parts = new ArrayList<>();
                parts.add(new Raw("["));
                for (int i = 0; i < list.size(); i++) {
                    if (i > 0) parts.add(new Raw(","));
                    parts.add(list.get(i) == null ? NULL : list.get(i));
                }
                parts.add(new Raw("]"));
                pushAll(work, parts);
            } else {
                throw new IllegalArgumentException("Not a JSON value: " + value.getClass());
            }
        }
    }

    private static void pushAll(Deque<Object> work, List<Object> parts) {
        for (int i = parts.size() - 1; i >= 0; i--) {
            work.push(parts.get(i));
        }
    }

    private static void writeString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
