package celldsl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns loosely typed tokens into a flat command list.
 *
 * <p>
 * Accepted tokens:
 * <ul>
 * <li>{@link Command}: taken as is.</li>
 * <li>integer: a move; each digit is a step in numeric keypad layout, 5 and unknown digits do nothing.
 *
 * <pre>
 * 7 8 9    ↖ ↑ ↗
 * 4 5 6    ← . →
 * 1 2 3    ↙ ↓ ↘
 * </pre>
 *
 * </li>
 * <li>{@link String}: a write of that text.</li>
 * <li>{@link Style} or {@code Map}: a style for the next text. Styles in a row are merged.</li>
 * <li>{@link Iterable} or array: flattened in order.</li>
 * <li>{@code null}: skipped.</li>
 * </ul>
 * Two or more texts in a row (with only styles between them) become one {@link Command.WriteRich}; a style after
 * the last of them becomes the cell style.
 * </p>
 */
public final class CommitBuilder {

    private final List<Command> actions = new ArrayList<>();
    // flattened position of the last token seen, across commits
    private int position = -1;

    /** A null array commits nothing, like a null token. */
    public CommitBuilder commit(Object... tokens) {
        if (tokens != null) {
            commitSequence(Arrays.asList(tokens));
        }
        return this;
    }

    public List<Command> actions() {
        return Collections.unmodifiableList(actions);
    }

    private void commitSequence(Iterable<?> tokens) {
        RunCollector runs = new RunCollector();

        for (Object token : tokens) {
            if (!(token instanceof Iterable) && !(token instanceof Object[])) {
                position++;
            }
            if (token instanceof CharSequence) {
                runs.text(token.toString());
                continue;
            }
            if (token instanceof Style) {
                runs.style((Style) token);
                continue;
            }
            if (token instanceof Map) {
                runs.style(toStyle((Map<?, ?>) token));
                continue;
            }

            runs.flush(token);

            if (token == null) {
                continue;
            }
            if (isIntegral(token)) {
                actions.add(movement(((Number) token).longValue()));
            } else if (token instanceof Command) {
                actions.add((Command) token);
            } else if (token instanceof Iterable) {
                commitSequence((Iterable<?>) token);
            } else if (token instanceof Object[]) {
                commitSequence(Arrays.asList((Object[]) token));
            } else {
                throw error("Cannot process this type: " + token.getClass().getName() + ", " + token, token);
            }
        }
        runs.flush(null);
    }

    static Command.Move movement(long shortForm) {
        int deltaRow = 0;
        int deltaCol = 0;
        String digits = Long.toString(Math.abs(shortForm));
        for (int i = 0; i < digits.length(); i++) {
            switch (digits.charAt(i)) {
            case '1':
                deltaRow++;
                deltaCol--;
                break;
            case '2':
                deltaRow++;
                break;
            case '3':
                deltaRow++;
                deltaCol++;
                break;
            case '4':
                deltaCol--;
                break;
            case '6':
                deltaCol++;
                break;
            case '7':
                deltaRow--;
                deltaCol--;
                break;
            case '8':
                deltaRow--;
                break;
            case '9':
                deltaRow--;
                deltaCol++;
                break;
            default:
                // 5, 0: stay
                break;
            }
        }
        return Ops.move(deltaRow, deltaCol);
    }

    private static boolean isIntegral(Object token) {
        return token instanceof Integer || token instanceof Long || token instanceof Short || token instanceof Byte;
    }

    private BuilderException error(String reason, Object token) {
        return new BuilderException(reason, position, null, null, token, null, null);
    }

    private Style toStyle(Map<?, ?> raw) {
        TreeMap<String, Object> m = new TreeMap<>();
        for (Map.Entry<?, ?> e : raw.entrySet()) {
            if (!(e.getKey() instanceof String)) {
                throw error("Style attribute names must be strings: " + raw, raw);
            }
            m.put((String) e.getKey(), e.getValue());
        }
        return Style.of(m);
    }

    // Texts and styles waiting to become a Write or WriteRich
    private final class RunCollector {
        private final List<RichRun> pendingRuns = new ArrayList<>();
        private Style pendingStyle;

        void text(String text) {
            pendingRuns.add(new RichRun(text, pendingStyle));
            pendingStyle = null;
        }

        void style(Style style) {
            pendingStyle = pendingStyle == null ? style : pendingStyle.merge(style);
        }

        void flush(Object next) {
            if (pendingRuns.size() > 1) {
                actions.add(Ops.writeRich(pendingRuns, pendingStyle));
            } else if (pendingStyle != null) {
                throw error("A style must be followed by text or another style, got "
                        + (next == null ? "end of sequence" : next) + " after " + pendingStyle,
                        next == null ? pendingStyle : next);
            } else if (pendingRuns.size() == 1) {
                RichRun run = pendingRuns.get(0);
                Command.Write write = Ops.write(run.text);
                actions.add(run.style == null ? write : write.withStyle(run.style));
            }
            pendingRuns.clear();
            pendingStyle = null;
        }
    }
}
