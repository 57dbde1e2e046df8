package celldsl;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Ready-made commands and command factories.
 */
public final class Ops {
    private Ops() {
    }

    // ---------------- movement ----------------
    public static final Command.Move MOVE = new Command.Move(0, 0);
    public static final Command.Move NEXT_ROW = MOVE.r(1);
    public static final Command.Move NEXT_COL = MOVE.c(1);
    public static final Command.Move PREV_ROW = MOVE.r(-1);
    public static final Command.Move PREV_COL = MOVE.c(-1);
    public static final Command.Move NEXT_ROW_SKIP = MOVE.r(2);
    public static final Command.Move NEXT_COL_SKIP = MOVE.c(2);
    public static final Command.Move PREV_ROW_SKIP = MOVE.r(-2);
    public static final Command.Move PREV_COL_SKIP = MOVE.c(-2);

    public static final Command.StackSave STACK_SAVE = Command.StackSave.INSTANCE;
    public static final Command.StackLoad STACK_LOAD = Command.StackLoad.INSTANCE;
    public static final Command.SectionEnd SECTION_END = Command.SectionEnd.INSTANCE;

    // ---------------- page breaks ----------------
    public static final Command.SubmitRowBreak SUBMIT_ROW_BREAK = Command.SubmitRowBreak.INSTANCE;
    public static final Command.SubmitColBreak SUBMIT_COL_BREAK = Command.SubmitColBreak.INSTANCE;
    public static final Command.ApplyBreaks APPLY_BREAKS = Command.ApplyBreaks.INSTANCE;

    public static Command.Move move(int deltaRow, int deltaCol) {
        return new Command.Move(deltaRow, deltaCol);
    }

    public static Command.AtCell atCell(int row, int col) {
        return new Command.AtCell(row, col);
    }

    public static Command.Backtrack backtrack(int n) {
        return new Command.Backtrack(n);
    }

    public static Command.Save save(String name) {
        return new Command.Save(name);
    }

    public static Command.Load load(String name) {
        return new Command.Load(name);
    }

    public static Command.SectionBegin sectionBegin(String name) {
        return new Command.SectionBegin(name);
    }

    // ---------------- writes ----------------
    public static Command.Write write(Object data) {
        return new Command.Write(data, null, null);
    }

    public static Command.Write writeNumber(Number data) {
        return new Command.Write(data, null, DataKind.NUMBER);
    }

    public static Command.Write writeString(String data) {
        return new Command.Write(data, null, DataKind.STRING);
    }

    public static Command.Write writeBlank() {
        return new Command.Write(null, null, DataKind.BLANK);
    }

    public static Command.Write writeFormula(String formula) {
        return new Command.Write(formula, null, DataKind.FORMULA);
    }

    public static Command.Write writeDatetime(Object date) {
        return new Command.Write(date, null, DataKind.DATETIME);
    }

    public static Command.Write writeBoolean(boolean data) {
        return new Command.Write(data, null, DataKind.BOOLEAN);
    }

    public static Command.Write writeUrl(String url) {
        return new Command.Write(url, null, DataKind.URL);
    }

    public static Command.MergeWrite mergeWrite(Object data, int width) {
        return new Command.MergeWrite(data, null, null, width);
    }

    public static Command.WriteRich writeRich(String text) {
        return new Command.WriteRich(Collections.singletonList(new RichRun(text, null)), null, null);
    }

    public static Command.WriteRich writeRich(String text, Style style) {
        return new Command.WriteRich(Collections.singletonList(new RichRun(text, style)), null, null);
    }

    static Command.WriteRich writeRich(List<RichRun> runs, Style cellStyle) {
        return new Command.WriteRich(runs, null, cellStyle);
    }

    public static Command.ImposeStyle imposeStyle(Style style) {
        return new Command.ImposeStyle(style);
    }

    public static Command.OverrideStyle overrideStyle(Style style) {
        return new Command.OverrideStyle(style);
    }

    // ---------------- ranges ----------------
    public static final Command.DrawBoxBorder DRAW_BOX_BORDER = new Command.DrawBoxBorder(CellPointer.CURRENT,
            CellPointer.CURRENT, Styles.TOP_BORDER, Styles.RIGHT_BORDER, Styles.BOTTOM_BORDER, Styles.LEFT_BORDER);

    public static Command.DefineNamedRange defineNamedRange(String name) {
        return new Command.DefineNamedRange(name, CellPointer.CURRENT, CellPointer.CURRENT);
    }

    public static Command.RefArray refArray(String name) {
        return new Command.RefArray(name, CellPointer.CURRENT, CellPointer.CURRENT);
    }

    public static Command.AddConditionalFormat addConditionalFormat(Map<String, ?> options) {
        return new Command.AddConditionalFormat(options, null, CellPointer.CURRENT, CellPointer.CURRENT);
    }

    /** A use of the region declared by {@link #refArray(String)}, for chart options. */
    public static ChartRef ref(String name) {
        return new ChartRef(name);
    }

    // ---------------- sheet ----------------
    public static Command.SetRowHeight setRowHeight(double points) {
        return new Command.SetRowHeight(points);
    }

    public static Command.SetColWidth setColWidth(double characters) {
        return new Command.SetColWidth(characters);
    }

    public static Command.AddComment addComment(String text) {
        return new Command.AddComment(text, Collections.<String, Object>emptyMap());
    }

    public static Command.AddComment addComment(String text, Map<String, ?> options) {
        return new Command.AddComment(text, options);
    }

    public static Command.AddImage addImage(String filePath) {
        return new Command.AddImage(filePath, null, Collections.<String, Object>emptyMap());
    }

    public static Command.AddImage addImage(byte[] imageData) {
        return new Command.AddImage(null, imageData, Collections.<String, Object>emptyMap());
    }

    // ---------------- charts ----------------
    public static Command.AddChart addChart(Command.AddChart.Kind kind) {
        return new Command.AddChart(kind, null, Collections.<ChartOperation>emptyList(),
                Collections.<String, String>emptyMap());
    }

    public static Command.AddChart areaChart() {
        return addChart(Command.AddChart.Kind.AREA);
    }

    public static Command.AddChart barChart() {
        return addChart(Command.AddChart.Kind.BAR);
    }

    public static Command.AddChart columnChart() {
        return addChart(Command.AddChart.Kind.COLUMN);
    }

    public static Command.AddChart lineChart() {
        return addChart(Command.AddChart.Kind.LINE);
    }

    public static Command.AddChart pieChart() {
        return addChart(Command.AddChart.Kind.PIE);
    }

    public static Command.AddChart doughnutChart() {
        return addChart(Command.AddChart.Kind.DOUGHNUT);
    }

    public static Command.AddChart scatterChart() {
        return addChart(Command.AddChart.Kind.SCATTER);
    }

    public static Command.AddChart stockChart() {
        return addChart(Command.AddChart.Kind.STOCK);
    }

    public static Command.AddChart radarChart() {
        return addChart(Command.AddChart.Kind.RADAR);
    }
}
