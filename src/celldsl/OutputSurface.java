package celldsl;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Grid-addressed document the resolved commands are applied to. Styles arrive as handles issued by the
 * {@link StyleRegistrar} bound to the same document.
 */
public interface OutputSurface {

    // qualifies forward reference addresses; null for none
    String sheetName();

    SurfaceResult write(Coords at, Object data, DataKind kind, StyleHandle style);

    /** Merges {@code at} with {@code width} cells to its right; width 0 is a plain write. */
    SurfaceResult mergeWrite(Coords at, int width, Object data, DataKind kind, StyleHandle style);

    SurfaceResult writeRich(Coords at, List<StyledText> runs, StyleHandle cellStyle);

    SurfaceResult defineName(String name, Coords topLeft, Coords bottomRight);

    /** {@code format} may be null for a rule that only matches. */
    SurfaceResult addConditionalFormat(Coords topLeft, Coords bottomRight, Map<String, Object> options,
            Style format);

    SurfaceResult setRowHeight(int row, double points);

    SurfaceResult setColWidth(int col, double characters);

    // replaces the sheet's page breaks
    SurfaceResult setPageBreaks(SortedSet<Integer> rows, SortedSet<Integer> cols);

    SurfaceResult addComment(Coords at, String text, Map<String, Object> options);

    /** Exactly one of {@code filePath} and {@code data} is non-null. */
    SurfaceResult addImage(Coords at, String filePath, byte[] data, Map<String, Object> options);

    SurfaceResult addChart(Coords at, ChartSpec chart);
}
