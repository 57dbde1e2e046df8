package celldsl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.poi.ss.util.CellRangeAddress;

/**
 * Second pass: resolves range corners given by bookmark name, turns {@link Command.RefArray} markers into
 * addresses and hands those addresses to every chart.
 */
final class ReferenceResolver {

    static final class Result {
        final Map<Coords, List<CellAction>> cells;
        // forward reference name -> absolute, sheet-qualified address
        final Map<String, String> refs;

        Result(Map<Coords, List<CellAction>> cells, Map<String, String> refs) {
            this.cells = cells;
            this.refs = refs;
        }
    }

    private ReferenceResolver() {
    }

    /**
     * @param sheetName qualifies forward reference addresses; null leaves them unqualified
     */
    static Result resolve(Map<Coords, List<CellAction>> cells, Map<String, Coords> bookmarks, String sheetName) {
        Map<Coords, List<CellAction>> out = new LinkedHashMap<>();
        Map<String, String> refs = new LinkedHashMap<>();

        for (Map.Entry<Coords, List<CellAction>> e : cells.entrySet()) {
            List<CellAction> kept = new ArrayList<>();
            for (CellAction action : e.getValue()) {
                Command c = action.command.accept(new CornerResolver(action, bookmarks, refs, sheetName));
                // null: the command was a marker and is done
                if (c != null) {
                    kept.add(action.withCommand(c));
                }
            }
            if (!kept.isEmpty()) {
                out.put(e.getKey(), kept);
            }
        }
        return new Result(out, refs);
    }

    // substitution happens when the chart is built
    static Map<Coords, List<CellAction>> introduceRefs(Map<Coords, List<CellAction>> cells, Map<String, String> refs) {
        if (refs.isEmpty()) {
            return cells;
        }
        RefIntroducer introducer = new RefIntroducer(refs);
        Map<Coords, List<CellAction>> out = new LinkedHashMap<>();
        for (Map.Entry<Coords, List<CellAction>> e : cells.entrySet()) {
            List<CellAction> list = new ArrayList<>(e.getValue().size());
            for (CellAction action : e.getValue()) {
                list.add(action.withCommand(action.command.accept(introducer)));
            }
            out.put(e.getKey(), list);
        }
        return out;
    }

    static String address(Coords topLeft, Coords bottomRight, String sheetName) {
        return new CellRangeAddress(topLeft.row, bottomRight.row, topLeft.col, bottomRight.col)
                .formatAsString(sheetName, true);
    }

    private static IllegalStateException unplaced(Command c) {
        return new IllegalStateException(c + " should have been consumed by movement resolution");
    }

    private static final class CornerResolver implements CommandVisitor<Command> {
        private final CellAction action;
        private final Map<String, Coords> bookmarks;
        private final Map<String, String> refs;
        private final String sheetName;

        CornerResolver(CellAction action, Map<String, Coords> bookmarks, Map<String, String> refs,
                String sheetName) {
            this.action = action;
            this.bookmarks = bookmarks;
            this.refs = refs;
            this.sheetName = sheetName;
        }

        // Corners come back ordered: top-left holds the minimum row and column
        private <T extends Command.RangeCommand<T>> T corners(Command.RangeCommand<T> c) {
            Coords tl = lookup(c.topLeft, "top left");
            Coords br = lookup(c.bottomRight, "bottom right");
            Coords min = Coords.of(Math.min(tl.row, br.row), Math.min(tl.col, br.col));
            Coords max = Coords.of(Math.max(tl.row, br.row), Math.max(tl.col, br.col));
            return c.withCorners(CellPointer.absolute(min), CellPointer.absolute(max));
        }

        private Coords lookup(CellPointer p, String role) {
            if (p.isResolved()) {
                return p.coords();
            }
            if (p instanceof CellPointer.Named) {
                String name = ((CellPointer.Named) p).name;
                Coords found = bookmarks.get(name);
                if (found == null) {
                    throw new ReferenceException("Tried to use a save point named " + name + " for " + role
                            + " corner, but it doesn't exist.", action.actionIndex, null, action.sections,
                            action.command, bookmarks, null);
                }
                return found;
            }
            throw new IllegalStateException("Relative pointer " + p + " survived movement resolution");
        }

        // ---------------- movement ----------------

        @Override
        public Command visitMove(Command.Move c) {
            throw unplaced(c);
        }

        @Override
        public Command visitAtCell(Command.AtCell c) {
            throw unplaced(c);
        }

        @Override
        public Command visitBacktrack(Command.Backtrack c) {
            throw unplaced(c);
        }

        @Override
        public Command visitStackSave(Command.StackSave c) {
            throw unplaced(c);
        }

        @Override
        public Command visitStackLoad(Command.StackLoad c) {
            throw unplaced(c);
        }

        @Override
        public Command visitSave(Command.Save c) {
            throw unplaced(c);
        }

        @Override
        public Command visitLoad(Command.Load c) {
            throw unplaced(c);
        }

        @Override
        public Command visitSectionBegin(Command.SectionBegin c) {
            throw unplaced(c);
        }

        @Override
        public Command visitSectionEnd(Command.SectionEnd c) {
            throw unplaced(c);
        }

        // ---------------- content ----------------

        @Override
        public Command visitWrite(Command.Write c) {
            return c;
        }

        @Override
        public Command visitMergeWrite(Command.MergeWrite c) {
            return c;
        }

        @Override
        public Command visitWriteRich(Command.WriteRich c) {
            return c;
        }

        @Override
        public Command visitImposeStyle(Command.ImposeStyle c) {
            return c;
        }

        @Override
        public Command visitOverrideStyle(Command.OverrideStyle c) {
            return c;
        }

        // ---------------- ranges ----------------

        @Override
        public Command visitDrawBoxBorder(Command.DrawBoxBorder c) {
            return corners(c);
        }

        @Override
        public Command visitDefineNamedRange(Command.DefineNamedRange c) {
            return corners(c);
        }

        @Override
        public Command visitRefArray(Command.RefArray c) {
            Command.RefArray ref = corners(c);
            refs.put(ref.name, address(ref.topLeft.coords(), ref.bottomRight.coords(), sheetName));
            return null;
        }

        @Override
        public Command visitAddConditionalFormat(Command.AddConditionalFormat c) {
            return corners(c);
        }

        // ---------------- sheet ----------------

        @Override
        public Command visitSetRowHeight(Command.SetRowHeight c) {
            return c;
        }

        @Override
        public Command visitSetColWidth(Command.SetColWidth c) {
            return c;
        }

        @Override
        public Command visitSubmitRowBreak(Command.SubmitRowBreak c) {
            return c;
        }

        @Override
        public Command visitSubmitColBreak(Command.SubmitColBreak c) {
            return c;
        }

        @Override
        public Command visitApplyBreaks(Command.ApplyBreaks c) {
            return c;
        }

        @Override
        public Command visitAddComment(Command.AddComment c) {
            return c;
        }

        @Override
        public Command visitAddImage(Command.AddImage c) {
            return c;
        }

        @Override
        public Command visitAddChart(Command.AddChart c) {
            return c;
        }
    }

    private static final class RefIntroducer implements CommandVisitor<Command> {
        private final Map<String, String> refs;

        RefIntroducer(Map<String, String> refs) {
            this.refs = refs;
        }

        // ---------------- movement ----------------

        @Override
        public Command visitMove(Command.Move c) {
            throw unplaced(c);
        }

        @Override
        public Command visitAtCell(Command.AtCell c) {
            throw unplaced(c);
        }

        @Override
        public Command visitBacktrack(Command.Backtrack c) {
            throw unplaced(c);
        }

        @Override
        public Command visitStackSave(Command.StackSave c) {
            throw unplaced(c);
        }

        @Override
        public Command visitStackLoad(Command.StackLoad c) {
            throw unplaced(c);
        }

        @Override
        public Command visitSave(Command.Save c) {
            throw unplaced(c);
        }

        @Override
        public Command visitLoad(Command.Load c) {
            throw unplaced(c);
        }

        @Override
        public Command visitSectionBegin(Command.SectionBegin c) {
            throw unplaced(c);
        }

        @Override
        public Command visitSectionEnd(Command.SectionEnd c) {
            throw unplaced(c);
        }

        // ---------------- content ----------------

        @Override
        public Command visitWrite(Command.Write c) {
            return c;
        }

        @Override
        public Command visitMergeWrite(Command.MergeWrite c) {
            return c;
        }

        @Override
        public Command visitWriteRich(Command.WriteRich c) {
            return c;
        }

        @Override
        public Command visitImposeStyle(Command.ImposeStyle c) {
            return c;
        }

        @Override
        public Command visitOverrideStyle(Command.OverrideStyle c) {
            return c;
        }

        // ---------------- ranges ----------------

        @Override
        public Command visitDrawBoxBorder(Command.DrawBoxBorder c) {
            return c;
        }

        @Override
        public Command visitDefineNamedRange(Command.DefineNamedRange c) {
            return c;
        }

        @Override
        public Command visitRefArray(Command.RefArray c) {
            return c;
        }

        @Override
        public Command visitAddConditionalFormat(Command.AddConditionalFormat c) {
            return c;
        }

        // ---------------- sheet ----------------

        @Override
        public Command visitSetRowHeight(Command.SetRowHeight c) {
            return c;
        }

        @Override
        public Command visitSetColWidth(Command.SetColWidth c) {
            return c;
        }

        @Override
        public Command visitSubmitRowBreak(Command.SubmitRowBreak c) {
            return c;
        }

        @Override
        public Command visitSubmitColBreak(Command.SubmitColBreak c) {
            return c;
        }

        @Override
        public Command visitApplyBreaks(Command.ApplyBreaks c) {
            return c;
        }

        @Override
        public Command visitAddComment(Command.AddComment c) {
            return c;
        }

        @Override
        public Command visitAddImage(Command.AddImage c) {
            return c;
        }

        @Override
        public Command visitAddChart(Command.AddChart c) {
            return c.withResolvedRefs(refs);
        }
    }
}
