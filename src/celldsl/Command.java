package celldsl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.commons.lang3.Validate;

/**
 * Closed set of layout commands. Instances are immutable; the {@code with*} methods return modified copies.
 *
 * <p>
 * Commands are usually obtained from {@link Ops} and submitted through {@link CommitBuilder}.
 * </p>
 */
public abstract class Command {

    private Command() {
    }

    public abstract <R> R accept(CommandVisitor<R> v);

    // two different commands of this kind on one cell are an overwrite
    public boolean isOverwriteSensitive() {
        return false;
    }

    // puts a value into its cell and carries a style
    public boolean isContent() {
        return false;
    }

    // =========================
    // movement
    // =========================

    public static final class Move extends Command {
        public final int deltaRow;
        public final int deltaCol;

        Move(int deltaRow, int deltaCol) {
            this.deltaRow = deltaRow;
            this.deltaCol = deltaCol;
        }

        public Move r(int deltaRow) {
            return new Move(deltaRow, deltaCol);
        }

        public Move c(int deltaCol) {
            return new Move(deltaRow, deltaCol);
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitMove(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Move))
                return false;
            Move other = (Move) o;
            return deltaRow == other.deltaRow && deltaCol == other.deltaCol;
        }

        @Override
        public int hashCode() {
            return 31 * deltaRow + deltaCol;
        }

        @Override
        public String toString() {
            return "Move(r=" + deltaRow + ", c=" + deltaCol + ")";
        }
    }

    public static final class AtCell extends Command {
        public final int row;
        public final int col;

        AtCell(int row, int col) {
            Validate.isTrue(Coords.of(row, col).isWithinSheet(), "cell (%d, %d) is outside the sheet", row, col);
            this.row = row;
            this.col = col;
        }

        public AtCell r(int row) {
            return new AtCell(row, col);
        }

        public AtCell c(int col) {
            return new AtCell(row, col);
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitAtCell(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof AtCell))
                return false;
            AtCell other = (AtCell) o;
            return row == other.row && col == other.col;
        }

        @Override
        public int hashCode() {
            return 31 * row + col;
        }

        @Override
        public String toString() {
            return "AtCell(" + row + ", " + col + ")";
        }
    }

    /** Rewinds the cursor through the visited history. 0 stays, 1 goes to the previously visited cell. */
    public static final class Backtrack extends Command {
        public final int n;

        Backtrack(int n) {
            Validate.isTrue(n >= 0, "backtrack count must not be negative: %d", n);
            this.n = n;
        }

        public Backtrack rewind(int cells) {
            return new Backtrack(cells);
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitBacktrack(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Backtrack && ((Backtrack) o).n == n;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(n);
        }

        @Override
        public String toString() {
            return "Backtrack(" + n + ")";
        }
    }

    public static final class StackSave extends Command {
        static final StackSave INSTANCE = new StackSave();

        private StackSave() {
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitStackSave(this);
        }

        @Override
        public String toString() {
            return "StackSave";
        }
    }

    public static final class StackLoad extends Command {
        static final StackLoad INSTANCE = new StackLoad();

        private StackLoad() {
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitStackLoad(this);
        }

        @Override
        public String toString() {
            return "StackLoad";
        }
    }

    public static final class Save extends Command {
        public final String name;

        Save(String name) {
            this.name = Validate.notNull(name, "name");
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitSave(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Save && ((Save) o).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return "Save(" + name + ")";
        }
    }

    public static final class Load extends Command {
        public final String name;

        Load(String name) {
            this.name = Validate.notNull(name, "name");
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitLoad(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Load && ((Load) o).name.equals(name);
        }

        @Override
        public int hashCode() {
            return 17 + name.hashCode();
        }

        @Override
        public String toString() {
            return "Load(" + name + ")";
        }
    }

    // only used to label error reports
    public static final class SectionBegin extends Command {
        public final String name;

        SectionBegin(String name) {
            this.name = Validate.notNull(name, "name");
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitSectionBegin(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SectionBegin && ((SectionBegin) o).name.equals(name);
        }

        @Override
        public int hashCode() {
            return 31 + name.hashCode();
        }

        @Override
        public String toString() {
            return "SectionBegin(" + name + ")";
        }
    }

    public static final class SectionEnd extends Command {
        static final SectionEnd INSTANCE = new SectionEnd();

        private SectionEnd() {
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitSectionEnd(this);
        }

        @Override
        public String toString() {
            return "SectionEnd";
        }
    }

    // =========================
    // content
    // =========================

    public static final class Write extends Command {
        public final Object data;
        // null: the session default style
        public final Style style;
        // null: inferred from data
        public final DataKind kind;

        Write(Object data, Style style, DataKind kind) {
            this.data = data;
            this.style = style;
            this.kind = kind;
        }

        public Write withData(Object data) {
            return new Write(data, style, kind);
        }

        public Write withStyle(Style s) {
            return new Write(data, style == null ? s : style.merge(s), kind);
        }

        public Write withKind(DataKind kind) {
            return new Write(data, style, kind);
        }

        Write replaceStyle(Style s) {
            return new Write(data, s, kind);
        }

        @Override
        public boolean isOverwriteSensitive() {
            return true;
        }

        @Override
        public boolean isContent() {
            return true;
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitWrite(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Write))
                return false;
            Write other = (Write) o;
            return Objects.equals(data, other.data) && Objects.equals(style, other.style) && kind == other.kind;
        }

        @Override
        public int hashCode() {
            return Objects.hash(data, style, kind);
        }

        @Override
        public String toString() {
            return "Write(" + (data instanceof String ? "'" + data + "'" : data) + (kind == null ? "" : ", " + kind)
                    + (style == null ? "" : ", " + style) + ")";
        }
    }

    // merges the current cell with width cells to its right
    public static final class MergeWrite extends Command {
        public final Object data;
        public final Style style;
        public final DataKind kind;
        public final int width;

        MergeWrite(Object data, Style style, DataKind kind, int width) {
            Validate.isTrue(width >= 0, "merge width must not be negative: %d", width);
            this.data = data;
            this.style = style;
            this.kind = kind;
            this.width = width;
        }

        public MergeWrite withData(Object data) {
            return new MergeWrite(data, style, kind, width);
        }

        public MergeWrite withStyle(Style s) {
            return new MergeWrite(data, style == null ? s : style.merge(s), kind, width);
        }

        public MergeWrite withKind(DataKind kind) {
            return new MergeWrite(data, style, kind, width);
        }

        public MergeWrite withWidth(int width) {
            return new MergeWrite(data, style, kind, width);
        }

        MergeWrite replaceStyle(Style s) {
            return new MergeWrite(data, s, kind, width);
        }

        @Override
        public boolean isOverwriteSensitive() {
            return true;
        }

        @Override
        public boolean isContent() {
            return true;
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitMergeWrite(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof MergeWrite))
                return false;
            MergeWrite other = (MergeWrite) o;
            return width == other.width && Objects.equals(data, other.data) && Objects.equals(style, other.style)
                    && kind == other.kind;
        }

        @Override
        public int hashCode() {
            return Objects.hash(data, style, kind, width);
        }

        @Override
        public String toString() {
            return "MergeWrite(" + (data instanceof String ? "'" + data + "'" : data) + ", width=" + width
                    + (style == null ? "" : ", " + style) + ")";
        }
    }

    /** Writes several differently styled text runs into one cell. */
    public static final class WriteRich extends Command {
        public final List<RichRun> runs;
        // style for runs that have none; null: the session default
        public final Style runStyle;
        // whole-cell style; null: the session default
        public final Style cellStyle;

        WriteRich(List<RichRun> runs, Style runStyle, Style cellStyle) {
            Validate.notEmpty(runs, "a rich write needs at least one run");
            this.runs = Collections.unmodifiableList(new ArrayList<>(runs));
            this.runStyle = runStyle;
            this.cellStyle = cellStyle;
        }

        // merges into the style of the last run
        public WriteRich withStyle(Style s) {
            List<RichRun> copy = new ArrayList<>(runs);
            int last = copy.size() - 1;
            copy.set(last, copy.get(last).withStyle(s));
            return new WriteRich(copy, runStyle, cellStyle);
        }

        public WriteRich withRunStyle(Style s) {
            return new WriteRich(runs, s, cellStyle);
        }

        public WriteRich withCellStyle(Style s) {
            return new WriteRich(runs, runStyle, s);
        }

        public WriteRich then(String text) {
            List<RichRun> copy = new ArrayList<>(runs);
            copy.add(new RichRun(text, null));
            return new WriteRich(copy, runStyle, cellStyle);
        }

        public WriteRich then(String text, Style s) {
            List<RichRun> copy = new ArrayList<>(runs);
            copy.add(new RichRun(text, s));
            return new WriteRich(copy, runStyle, cellStyle);
        }

        /**
         * Appends the runs of {@code next}. Its unstyled runs keep its own run style if it has one and fall back to
         * this write's otherwise; its cell style, when set, replaces this one.
         */
        public WriteRich then(WriteRich next) {
            List<RichRun> copy = new ArrayList<>(runs);
            for (RichRun run : next.runs) {
                copy.add(run.style == null && next.runStyle != null ? new RichRun(run.text, next.runStyle) : run);
            }
            return new WriteRich(copy, runStyle, next.cellStyle != null ? next.cellStyle : cellStyle);
        }

        @Override
        public boolean isOverwriteSensitive() {
            return true;
        }

        @Override
        public boolean isContent() {
            return true;
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitWriteRich(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof WriteRich))
                return false;
            WriteRich other = (WriteRich) o;
            return runs.equals(other.runs) && Objects.equals(runStyle, other.runStyle)
                    && Objects.equals(cellStyle, other.cellStyle);
        }

        @Override
        public int hashCode() {
            return Objects.hash(runs, runStyle, cellStyle);
        }

        @Override
        public String toString() {
            return "WriteRich(" + runs + (cellStyle == null ? "" : ", cell " + cellStyle) + ")";
        }
    }

    /** Adds attributes to whatever style the content of this cell ends up with. */
    public static final class ImposeStyle extends Command {
        public final Style style;

        ImposeStyle(Style style) {
            this.style = Validate.notNull(style, "style");
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitImposeStyle(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ImposeStyle && ((ImposeStyle) o).style.equals(style);
        }

        @Override
        public int hashCode() {
            return 7 + style.hashCode();
        }

        @Override
        public String toString() {
            return "ImposeStyle(" + style + ")";
        }
    }

    // at most one per cell
    public static final class OverrideStyle extends Command {
        public final Style style;

        OverrideStyle(Style style) {
            this.style = Validate.notNull(style, "style");
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitOverrideStyle(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof OverrideStyle && ((OverrideStyle) o).style.equals(style);
        }

        @Override
        public int hashCode() {
            return 11 + style.hashCode();
        }

        @Override
        public String toString() {
            return "OverrideStyle(" + style + ")";
        }
    }

    // =========================
    // ranges
    // =========================

    /**
     * A command spanning the rectangle between two corners. Both corners default to the current cell.
     */
    public abstract static class RangeCommand<T extends RangeCommand<T>> extends Command {
        public final CellPointer topLeft;
        public final CellPointer bottomRight;

        private RangeCommand(CellPointer topLeft, CellPointer bottomRight) {
            this.topLeft = Validate.notNull(topLeft, "topLeft");
            this.bottomRight = Validate.notNull(bottomRight, "bottomRight");
        }

        abstract T withCorners(CellPointer topLeft, CellPointer bottomRight);

        public T topLeft(CellPointer p) {
            return withCorners(p, bottomRight);
        }

        public T topLeft(String bookmark) {
            return topLeft(CellPointer.named(bookmark));
        }

        public T topLeft(int n) {
            return topLeft(CellPointer.relative(n));
        }

        public T topLeft(int row, int col) {
            return topLeft(CellPointer.absolute(row, col));
        }

        public T bottomRight(CellPointer p) {
            return withCorners(topLeft, p);
        }

        public T bottomRight(String bookmark) {
            return bottomRight(CellPointer.named(bookmark));
        }

        public T bottomRight(int n) {
            return bottomRight(CellPointer.relative(n));
        }

        public T bottomRight(int row, int col) {
            return bottomRight(CellPointer.absolute(row, col));
        }

        public boolean isResolved() {
            return topLeft.isResolved() && bottomRight.isResolved();
        }
    }

    // a null edge style leaves that edge alone
    public static final class DrawBoxBorder extends RangeCommand<DrawBoxBorder> {
        public final Style topStyle;
        public final Style rightStyle;
        public final Style bottomStyle;
        public final Style leftStyle;

        DrawBoxBorder(CellPointer topLeft, CellPointer bottomRight, Style topStyle, Style rightStyle,
                Style bottomStyle, Style leftStyle) {
            super(topLeft, bottomRight);
            this.topStyle = topStyle;
            this.rightStyle = rightStyle;
            this.bottomStyle = bottomStyle;
            this.leftStyle = leftStyle;
        }

        @Override
        DrawBoxBorder withCorners(CellPointer tl, CellPointer br) {
            return new DrawBoxBorder(tl, br, topStyle, rightStyle, bottomStyle, leftStyle);
        }

        public DrawBoxBorder withTopStyle(Style s) {
            return new DrawBoxBorder(topLeft, bottomRight, s, rightStyle, bottomStyle, leftStyle);
        }

        public DrawBoxBorder withRightStyle(Style s) {
            return new DrawBoxBorder(topLeft, bottomRight, topStyle, s, bottomStyle, leftStyle);
        }

        public DrawBoxBorder withBottomStyle(Style s) {
            return new DrawBoxBorder(topLeft, bottomRight, topStyle, rightStyle, s, leftStyle);
        }

        public DrawBoxBorder withLeftStyle(Style s) {
            return new DrawBoxBorder(topLeft, bottomRight, topStyle, rightStyle, bottomStyle, s);
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitDrawBoxBorder(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof DrawBoxBorder))
                return false;
            DrawBoxBorder other = (DrawBoxBorder) o;
            return topLeft.equals(other.topLeft) && bottomRight.equals(other.bottomRight)
                    && Objects.equals(topStyle, other.topStyle) && Objects.equals(rightStyle, other.rightStyle)
                    && Objects.equals(bottomStyle, other.bottomStyle) && Objects.equals(leftStyle, other.leftStyle);
        }

        @Override
        public int hashCode() {
            return Objects.hash(topLeft, bottomRight, topStyle, rightStyle, bottomStyle, leftStyle);
        }

        @Override
        public String toString() {
            return "DrawBoxBorder(" + topLeft + " -> " + bottomRight + ")";
        }
    }

    public static final class DefineNamedRange extends RangeCommand<DefineNamedRange> {
        public final String name;

        DefineNamedRange(String name, CellPointer topLeft, CellPointer bottomRight) {
            super(topLeft, bottomRight);
            this.name = Validate.notNull(name, "name");
        }

        public DefineNamedRange withName(String name) {
            return new DefineNamedRange(name, topLeft, bottomRight);
        }

        @Override
        DefineNamedRange withCorners(CellPointer tl, CellPointer br) {
            return new DefineNamedRange(name, tl, br);
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitDefineNamedRange(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof DefineNamedRange))
                return false;
            DefineNamedRange other = (DefineNamedRange) o;
            return name.equals(other.name) && topLeft.equals(other.topLeft) && bottomRight.equals(other.bottomRight);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, topLeft, bottomRight);
        }

        @Override
        public String toString() {
            return "DefineNamedRange(" + name + ", " + topLeft + " -> " + bottomRight + ")";
        }
    }

    /**
     * Declares a named region whose address is substituted into chart options referring to it through
     * {@link ChartRef}. Produces no sheet operation of its own.
     */
    public static final class RefArray extends RangeCommand<RefArray> {
        public final String name;

        RefArray(String name, CellPointer topLeft, CellPointer bottomRight) {
            super(topLeft, bottomRight);
            this.name = Validate.notNull(name, "name");
        }

        public RefArray at(String name) {
            return new RefArray(name, topLeft, bottomRight);
        }

        @Override
        RefArray withCorners(CellPointer tl, CellPointer br) {
            return new RefArray(name, tl, br);
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitRefArray(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof RefArray))
                return false;
            RefArray other = (RefArray) o;
            return name.equals(other.name) && topLeft.equals(other.topLeft) && bottomRight.equals(other.bottomRight);
        }

        @Override
        public int hashCode() {
            return Objects.hash("ref", name, topLeft, bottomRight);
        }

        @Override
        public String toString() {
            return "RefArray(" + name + ", " + topLeft + " -> " + bottomRight + ")";
        }
    }

    /**
     * Adds a conditional format to a rectangle. Options: {@code type} ({@code cell} or {@code formula}),
     * {@code criteria}, {@code value}, {@code minimum}, {@code maximum}, and optionally {@code format}. The format
     * is given either as the {@code format} option or with {@link #withFormat(Style)}, never both.
     */
    public static final class AddConditionalFormat extends RangeCommand<AddConditionalFormat> {
        public final Map<String, Object> options;
        public final Style format;

        AddConditionalFormat(Map<String, ?> options, Style format, CellPointer topLeft, CellPointer bottomRight) {
            super(topLeft, bottomRight);
            this.options = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(options));
            this.format = format;
        }

        public AddConditionalFormat withOptions(Map<String, ?> options) {
            return new AddConditionalFormat(options, format, topLeft, bottomRight);
        }

        public AddConditionalFormat withFormat(Style format) {
            return new AddConditionalFormat(options, format, topLeft, bottomRight);
        }

        @Override
        AddConditionalFormat withCorners(CellPointer tl, CellPointer br) {
            return new AddConditionalFormat(options, format, tl, br);
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitAddConditionalFormat(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof AddConditionalFormat))
                return false;
            AddConditionalFormat other = (AddConditionalFormat) o;
            return options.equals(other.options) && Objects.equals(format, other.format)
                    && topLeft.equals(other.topLeft) && bottomRight.equals(other.bottomRight);
        }

        @Override
        public int hashCode() {
            return Objects.hash(options, format, topLeft, bottomRight);
        }

        @Override
        public String toString() {
            return "AddConditionalFormat(" + options + ", " + topLeft + " -> " + bottomRight + ")";
        }
    }

    // =========================
    // sheet
    // =========================

    // points
    public static final class SetRowHeight extends Command {
        public final double size;

        SetRowHeight(double size) {
            Validate.isTrue(size >= 0, "row height must not be negative: %s", size);
            this.size = size;
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitSetRowHeight(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SetRowHeight && Double.compare(((SetRowHeight) o).size, size) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(size);
        }

        @Override
        public String toString() {
            return "SetRowHeight(" + size + ")";
        }
    }

    // characters
    public static final class SetColWidth extends Command {
        public final double size;

        SetColWidth(double size) {
            Validate.isTrue(size >= 0, "column width must not be negative: %s", size);
            this.size = size;
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitSetColWidth(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SetColWidth && Double.compare(((SetColWidth) o).size, size) == 0;
        }

        @Override
        public int hashCode() {
            return 3 + Double.hashCode(size);
        }

        @Override
        public String toString() {
            return "SetColWidth(" + size + ")";
        }
    }

    // queued in the target's PageBreakAccumulator until ApplyBreaks
    public static final class SubmitRowBreak extends Command {
        static final SubmitRowBreak INSTANCE = new SubmitRowBreak();

        private SubmitRowBreak() {
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitSubmitRowBreak(this);
        }

        @Override
        public String toString() {
            return "SubmitRowBreak";
        }
    }

    public static final class SubmitColBreak extends Command {
        static final SubmitColBreak INSTANCE = new SubmitColBreak();

        private SubmitColBreak() {
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitSubmitColBreak(this);
        }

        @Override
        public String toString() {
            return "SubmitColBreak";
        }
    }

    public static final class ApplyBreaks extends Command {
        static final ApplyBreaks INSTANCE = new ApplyBreaks();

        private ApplyBreaks() {
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitApplyBreaks(this);
        }

        @Override
        public String toString() {
            return "ApplyBreaks";
        }
    }

    /** Attaches a comment. Options: {@code author}, {@code visible}, {@code width}, {@code height}. */
    public static final class AddComment extends Command {
        public final String text;
        public final Map<String, Object> options;

        AddComment(String text, Map<String, ?> options) {
            this.text = Validate.notNull(text, "text");
            this.options = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(options));
        }

        public AddComment withOptions(Map<String, ?> options) {
            return new AddComment(text, options);
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitAddComment(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof AddComment))
                return false;
            AddComment other = (AddComment) o;
            return text.equals(other.text) && options.equals(other.options);
        }

        @Override
        public int hashCode() {
            return Objects.hash(text, options);
        }

        @Override
        public String toString() {
            return "AddComment('" + text + "')";
        }
    }

    /** Inserts a picture anchored at the current cell. Options: {@code x_scale}, {@code y_scale}. */
    public static final class AddImage extends Command {
        public final String filePath;
        private final byte[] imageData;
        public final Map<String, Object> options;

        AddImage(String filePath, byte[] imageData, Map<String, ?> options) {
            this.filePath = filePath;
            this.imageData = imageData == null ? null : imageData.clone();
            this.options = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(options));
        }

        public AddImage withFilePath(String filePath) {
            return new AddImage(filePath, null, options);
        }

        public AddImage withImageData(byte[] imageData) {
            return new AddImage(null, imageData, options);
        }

        public AddImage withOptions(Map<String, ?> options) {
            return new AddImage(filePath, imageData, options);
        }

        public byte[] imageData() {
            return imageData == null ? null : imageData.clone();
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitAddImage(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof AddImage))
                return false;
            AddImage other = (AddImage) o;
            return Objects.equals(filePath, other.filePath) && Arrays.equals(imageData, other.imageData)
                    && options.equals(other.options);
        }

        @Override
        public int hashCode() {
            return Objects.hash(filePath, Arrays.hashCode(imageData), options);
        }

        @Override
        public String toString() {
            if (filePath != null)
                return "AddImage(" + filePath + ")";
            return "AddImage(<" + (imageData == null ? 0 : imageData.length) + " bytes>)";
        }
    }

    /** Inserts a chart configured by a list of {@link ChartOperation}s. */
    public static final class AddChart extends Command {

        public enum Kind {
            AREA,
            BAR,
            COLUMN,
            LINE,
            PIE,
            DOUGHNUT,
            SCATTER,
            STOCK,
            RADAR
        }

        public final Kind kind;
        // stacked, percent_stacked or null
        public final String subtype;
        public final List<ChartOperation> operations;
        // forward reference name -> absolute address, filled in after resolution
        public final Map<String, String> resolvedRefs;

        AddChart(Kind kind, String subtype, List<ChartOperation> operations, Map<String, String> resolvedRefs) {
            this.kind = Validate.notNull(kind, "kind");
            this.subtype = subtype;
            this.operations = Collections.unmodifiableList(new ArrayList<>(operations));
            this.resolvedRefs = Collections.unmodifiableMap(new LinkedHashMap<>(resolvedRefs));
        }

        public AddChart withSubtype(String subtype) {
            return new AddChart(kind, subtype, operations, resolvedRefs);
        }

        public AddChart perform(ChartOperation... ops) {
            List<ChartOperation> copy = new ArrayList<>(operations);
            copy.addAll(Arrays.asList(ops));
            return new AddChart(kind, subtype, copy, resolvedRefs);
        }

        AddChart withResolvedRefs(Map<String, String> refs) {
            List<ChartOperation> copy = new ArrayList<>(operations.size());
            for (ChartOperation op : operations) {
                if (op instanceof ChartOperation.Combine) {
                    ChartOperation.Combine combine = (ChartOperation.Combine) op;
                    copy.add(combine.withSecondary(combine.secondary.withResolvedRefs(refs)));
                } else {
                    copy.add(op);
                }
            }
            return new AddChart(kind, subtype, copy, refs);
        }

        @Override
        public <R> R accept(CommandVisitor<R> v) {
            return v.visitAddChart(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof AddChart))
                return false;
            AddChart other = (AddChart) o;
            return kind == other.kind && Objects.equals(subtype, other.subtype) && operations.equals(other.operations)
                    && resolvedRefs.equals(other.resolvedRefs);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, subtype, operations, resolvedRefs);
        }

        @Override
        public String toString() {
            return "AddChart(" + kind + (subtype == null ? "" : "/" + subtype) + ", " + operations + ")";
        }
    }
}
