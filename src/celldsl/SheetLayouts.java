package celldsl;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.lang3.Validate;

/**
 * Token sequences for common layouts. The results are meant to be passed to {@link CellDslSession#commit}.
 */
public final class SheetLayouts {
    private SheetLayouts() {
    }

    /**
     * Lays {@code items} out left to right, {@code step} columns apart, and returns the cursor to where it started.
     *
     * @param initialSaveName bookmark for the first cell, or null
     * @param finalSaveName   bookmark for the last cell, or null
     * @param rangeName       named range spanning the chain, or null
     * @param arrayName       forward reference spanning the chain, or null
     */
    public static List<Object> rowChain(Iterable<?> items, String initialSaveName, String finalSaveName,
            String rangeName, String arrayName, int step) {
        return chain(items, Ops.NEXT_COL, initialSaveName, finalSaveName, rangeName, arrayName, step);
    }

    public static List<Object> rowChain(Iterable<?> items) {
        return rowChain(items, null, null, null, null, 1);
    }

    /** Same as {@link #rowChain(Iterable, String, String, String, String, int)}, top to bottom. */
    public static List<Object> colChain(Iterable<?> items, String initialSaveName, String finalSaveName,
            String rangeName, String arrayName, int step) {
        return chain(items, Ops.NEXT_ROW, initialSaveName, finalSaveName, rangeName, arrayName, step);
    }

    public static List<Object> colChain(Iterable<?> items) {
        return colChain(items, null, null, null, null, 1);
    }

    private static List<Object> chain(Iterable<?> items, Command.Move move, String initialSaveName,
            String finalSaveName, String rangeName, String arrayName, int step) {
        Validate.notNull(items, "items");
        Validate.isTrue(step > 0, "step must be positive: %d", step);

        List<Object> out = new ArrayList<>();
        out.add(Ops.STACK_SAVE);
        if (initialSaveName != null) {
            out.add(Ops.save(initialSaveName));
        }
        Iterator<?> it = items.iterator();
        while (it.hasNext()) {
            out.add(it.next());
            if (it.hasNext()) {
                for (int i = 0; i < step; i++) {
                    out.add(move);
                }
            }
        }
        // -1 peeks the position saved on entry
        if (rangeName != null) {
            out.add(Ops.defineNamedRange(rangeName).topLeft(-1));
        }
        if (arrayName != null) {
            out.add(Ops.refArray(arrayName).topLeft(-1));
        }
        if (finalSaveName != null) {
            out.add(Ops.save(finalSaveName));
        }
        out.add(Ops.STACK_LOAD);
        return out;
    }

    public static Command.WriteRich chainRich(Iterable<Command.WriteRich> fragments) {
        Command.WriteRich out = null;
        for (Command.WriteRich f : fragments) {
            out = out == null ? f : out.then(f);
        }
        Validate.isTrue(out != null, "at least one fragment is required");
        return out;
    }

    public static List<Object> section(String name, Object... tokens) {
        List<Object> out = new ArrayList<>(tokens.length + 2);
        out.add(Ops.sectionBegin(name));
        for (Object t : tokens) {
            out.add(t);
        }
        out.add(Ops.SECTION_END);
        return out;
    }
}
