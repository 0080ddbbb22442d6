package kast.term;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Readable rendering used by {@code toString}. Pending terms and literal text share one work stack.
 */
final class Printer {

    private Printer() {
    }

    static String print(Term term) {
        StringBuilder sb = new StringBuilder();
        Deque<Object> work = new ArrayDeque<>();
        work.push(term);
        while (!work.isEmpty()) {
            Object item = work.pop();
            if (item instanceof String text) {
                sb.append(text);
            } else if (item instanceof Apply app) {
                List<Object> parts = new ArrayList<>();
                parts.add(app.label().name() + "(");
                addSeparated(parts, app.args(), ", ");
                parts.add(")");
                pushAll(work, parts);
            } else if (item instanceof As as) {
                pushAll(work, List.of(as.pattern(), " #as ", as.alias()));
            } else if (item instanceof Rewrite rw) {
                pushAll(work, List.of("(", rw.lhs(), " => ", rw.rhs(), ")"));
            } else if (item instanceof Sequence seq) {
                if (seq.arity() == 0) {
                    sb.append(".K");
                } else {
                    List<Object> parts = new ArrayList<>();
                    addSeparated(parts, seq.items(), " ~> ");
                    pushAll(work, parts);
                }
            } else {
                sb.append(item);
            }
        }
        return sb.toString();
    }

    private static void addSeparated(List<Object> parts, List<Term> terms, String separator) {
        for (int i = 0; i < terms.size(); i++) {
            if (i > 0) parts.add(separator);
            parts.add(terms.get(i));
        }
    }

    private static void pushAll(Deque<Object> work, List<Object> parts) {
        for (int i = parts.size() - 1; i >= 0; i--) {
            work.push(parts.get(i));
        }
    }
}
