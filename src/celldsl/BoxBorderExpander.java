package celldsl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Third pass: replaces every {@link Command.DrawBoxBorder} with {@link Command.ImposeStyle}s on the box edges.
 *
 * <p>
 * Renderers do not draw the right and outer borders of merged regions reliably, so an edge cell holding a
 * {@link Command.MergeWrite} also gets a left border on the cell right after the merge, a bottom border on the
 * cells above it and, for single-row boxes, a top border on the cells below it.
 * </p>
 */
final class BoxBorderExpander {
    private static final Logger LOG = LoggerFactory.getLogger(BoxBorderExpander.class);

    private final Map<Coords, List<CellAction>> result = new LinkedHashMap<>();
    private final Map<Coords, List<CellAction>> impositions = new LinkedHashMap<>();
    // cells imposed by at least one box that is a single row tall
    private final Map<Coords, Boolean> singleRow = new LinkedHashMap<>();
    // widest merge written at a cell
    private final Map<Coords, Integer> mergeWidths = new LinkedHashMap<>();
    private final List<String> warnings;

    private BoxBorderExpander(List<String> warnings) {
        this.warnings = warnings;
    }

    /**
     * @param warnings receives a line for every compensation that had to be skipped
     */
    static Map<Coords, List<CellAction>> expand(Map<Coords, List<CellAction>> cells, List<String> warnings) {
        BoxBorderExpander x = new BoxBorderExpander(warnings);
        x.collect(cells);
        x.apply();
        return x.result;
    }

    private void collect(Map<Coords, List<CellAction>> cells) {
        Collector collector = new Collector();
        for (Map.Entry<Coords, List<CellAction>> e : cells.entrySet()) {
            for (CellAction action : e.getValue()) {
                collector.at = e.getKey();
                collector.action = action;
                action.command.accept(collector);
            }
        }
    }

    private void edges(CellAction origin, Command.DrawBoxBorder box) {
        Coords tl = box.topLeft.coords();
        Coords br = box.bottomRight.coords();
        boolean oneRow = tl.row == br.row;

        for (int r = tl.row; r <= br.row; r++) {
            imposeEdge(Coords.of(r, tl.col), box.leftStyle, origin, oneRow);
            imposeEdge(Coords.of(r, br.col), box.rightStyle, origin, oneRow);
        }
        for (int c = tl.col; c <= br.col; c++) {
            imposeEdge(Coords.of(tl.row, c), box.topStyle, origin, oneRow);
            imposeEdge(Coords.of(br.row, c), box.bottomStyle, origin, oneRow);
        }
    }

    private void imposeEdge(Coords at, Style style, CellAction origin, boolean oneRow) {
        if (style == null) {
            return;
        }
        listAt(impositions, at).add(origin.withCommand(Ops.imposeStyle(style)));
        Boolean prev = singleRow.get(at);
        singleRow.put(at, (prev != null && prev) || oneRow);
    }

    private void apply() {
        for (Map.Entry<Coords, List<CellAction>> e : impositions.entrySet()) {
            Coords at = e.getKey();
            CellAction origin = e.getValue().get(0);
            ensureContent(at, origin);

            Integer width = mergeWidths.get(at);
            if (width != null) {
                compensateMerge(at, width, origin);
            }
            result.get(at).addAll(e.getValue());
        }
    }

    private void compensateMerge(Coords at, int width, CellAction origin) {
        imposeTo(Coords.of(at.row, at.col + width + 1), Styles.LEFT_BORDER, origin);

        boolean below = singleRow.get(at);
        if (at.row < 1) {
            String w = "A row above is required to impose top border to a merged cell group at " + at + ".";
            LOG.warn(w);
            warnings.add(w);
        }
        for (int c = at.col; c <= at.col + width; c++) {
            if (at.row >= 1) {
                imposeTo(Coords.of(at.row - 1, c), Styles.BOTTOM_BORDER, origin);
            }
            if (below) {
                imposeTo(Coords.of(at.row + 1, c), Styles.TOP_BORDER, origin);
            }
        }
    }

    private void imposeTo(Coords at, Style style, CellAction origin) {
        if (!at.isWithinSheet()) {
            String w = "Border compensation at " + at + " is outside the sheet and was skipped.";
            LOG.warn(w);
            warnings.add(w);
            return;
        }
        ensureContent(at, origin);
        result.get(at).add(origin.withCommand(Ops.imposeStyle(style)));
    }

    // A style needs something to attach to
    private void ensureContent(Coords at, CellAction origin) {
        List<CellAction> list = listAt(result, at);
        for (CellAction a : list) {
            if (a.command.isContent()) {
                return;
            }
        }
        list.add(origin.withCommand(Ops.write(null)));
    }

    private static IllegalStateException consumed(Command c, String pass) {
        return new IllegalStateException(c + " should have been consumed by " + pass + " resolution");
    }

    static List<CellAction> listAt(Map<Coords, List<CellAction>> map, Coords at) {
        List<CellAction> list = map.get(at);
        if (list == null) {
            list = new ArrayList<>();
            map.put(at, list);
        }
        return list;
    }

    // Keeps everything except box borders, which become impositions
    private final class Collector implements CommandVisitor<Void> {
        Coords at;
        CellAction action;

        private Void keep() {
            listAt(result, at).add(action);
            return null;
        }

        // ---------------- movement ----------------

        @Override
        public Void visitMove(Command.Move c) {
            throw consumed(c, "movement");
        }

        @Override
        public Void visitAtCell(Command.AtCell c) {
            throw consumed(c, "movement");
        }

        @Override
        public Void visitBacktrack(Command.Backtrack c) {
            throw consumed(c, "movement");
        }

        @Override
        public Void visitStackSave(Command.StackSave c) {
            throw consumed(c, "movement");
        }

        @Override
        public Void visitStackLoad(Command.StackLoad c) {
            throw consumed(c, "movement");
        }

        @Override
        public Void visitSave(Command.Save c) {
            throw consumed(c, "movement");
        }

        @Override
        public Void visitLoad(Command.Load c) {
            throw consumed(c, "movement");
        }

        @Override
        public Void visitSectionBegin(Command.SectionBegin c) {
            throw consumed(c, "movement");
        }

        @Override
        public Void visitSectionEnd(Command.SectionEnd c) {
            throw consumed(c, "movement");
        }

        // ---------------- content ----------------

        @Override
        public Void visitWrite(Command.Write c) {
            return keep();
        }

        @Override
        public Void visitMergeWrite(Command.MergeWrite c) {
            Integer prev = mergeWidths.get(at);
            mergeWidths.put(at, prev == null ? c.width : Math.max(prev, c.width));
            return keep();
        }

        @Override
        public Void visitWriteRich(Command.WriteRich c) {
            return keep();
        }

        @Override
        public Void visitImposeStyle(Command.ImposeStyle c) {
            return keep();
        }

        @Override
        public Void visitOverrideStyle(Command.OverrideStyle c) {
            return keep();
        }

        // ---------------- ranges ----------------

        @Override
        public Void visitDrawBoxBorder(Command.DrawBoxBorder c) {
            edges(action, c);
            return null;
        }

        @Override
        public Void visitDefineNamedRange(Command.DefineNamedRange c) {
            return keep();
        }

        @Override
        public Void visitRefArray(Command.RefArray c) {
            throw consumed(c, "reference");
        }

        @Override
        public Void visitAddConditionalFormat(Command.AddConditionalFormat c) {
            return keep();
        }

        // ---------------- sheet ----------------

        @Override
        public Void visitSetRowHeight(Command.SetRowHeight c) {
            return keep();
        }

        @Override
        public Void visitSetColWidth(Command.SetColWidth c) {
            return keep();
        }

        @Override
        public Void visitSubmitRowBreak(Command.SubmitRowBreak c) {
            return keep();
        }

        @Override
        public Void visitSubmitColBreak(Command.SubmitColBreak c) {
            return keep();
        }

        @Override
        public Void visitApplyBreaks(Command.ApplyBreaks c) {
            return keep();
        }

        @Override
        public Void visitAddComment(Command.AddComment c) {
            return keep();
        }

        @Override
        public Void visitAddImage(Command.AddImage c) {
            return keep();
        }

        @Override
        public Void visitAddChart(Command.AddChart c) {
            return keep();
        }
    }
}
