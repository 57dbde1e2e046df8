package celldsl;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Page breaks submitted by any number of sessions, written out together by {@link Command.ApplyBreaks}. Owned by
 * whoever owns the sheet; {@link SheetTarget} carries one.
 */
public final class PageBreakAccumulator {
    private final SortedSet<Integer> rows = new TreeSet<>();
    private final SortedSet<Integer> cols = new TreeSet<>();

    public void submitRow(int row) {
        rows.add(row);
    }

    public void submitCol(int col) {
        cols.add(col);
    }

    public SortedSet<Integer> rows() {
        return Collections.unmodifiableSortedSet(rows);
    }

    public SortedSet<Integer> cols() {
        return Collections.unmodifiableSortedSet(cols);
    }

    /** Hands the accumulated breaks to {@code surface} and starts over. */
    public SurfaceResult apply(OutputSurface surface) {
        SurfaceResult r = surface.setPageBreaks(new TreeSet<>(rows), new TreeSet<>(cols));
        rows.clear();
        cols.clear();
        return r;
    }
}
