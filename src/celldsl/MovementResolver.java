package celldsl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * First pass: walks the command stream with a cursor and pins every non-movement command to a cell.
 *
 * <p>
 * Keeps the visited history (for {@link Command.Backtrack} and positive range pointers), the position stack
 * (for {@link Command.StackSave}/{@link Command.StackLoad} and negative range pointers), the bookmark table and
 * the section stack. Named range pointers are left for {@link ReferenceResolver}.
 * </p>
 */
final class MovementResolver implements CommandVisitor<Void> {

    static final class Result {
        final Map<Coords, List<CellAction>> cells;
        final Map<String, Coords> bookmarks;

        Result(Map<Coords, List<CellAction>> cells, Map<String, Coords> bookmarks) {
            this.cells = cells;
            this.bookmarks = bookmarks;
        }
    }

    private final List<Command> actions;

    private int row;
    private int col;
    private final List<Coords> visited = new ArrayList<>();
    private final List<Coords> stack = new ArrayList<>();
    private final Map<String, Coords> bookmarks = new LinkedHashMap<>();
    private final List<String> sections = new ArrayList<>();
    private final Map<Coords, List<CellAction>> cells = new LinkedHashMap<>();

    private int actionIndex;
    private Command current;

    private MovementResolver(List<Command> actions, Coords start) {
        this.actions = actions;
        this.row = start.row;
        this.col = start.col;
        visited.add(start);
    }

    static Result resolve(List<Command> actions, Coords start) {
        MovementResolver r = new MovementResolver(actions, start);
        r.walk();
        return new Result(r.cells, r.bookmarks);
    }

    private void walk() {
        if (!cursor().isWithinSheet()) {
            throw error("Starting cell " + cursor() + " is outside the sheet.", null);
        }
        for (actionIndex = 0; actionIndex < actions.size(); actionIndex++) {
            current = actions.get(actionIndex);
            current.accept(this);

            if (!cursor().isWithinSheet()) {
                throw error("Illegal coords have been reached: " + cursor() + ".", null);
            }
        }
        current = null;
        if (!sections.isEmpty()) {
            throw error("Section '" + sections.get(sections.size() - 1)
                    + "' is not closed, every SectionBegin must be matched with SectionEnd.", null);
        }
    }

    private Coords cursor() {
        return Coords.of(row, col);
    }

    private void relocate(Coords to) {
        row = to.row;
        col = to.col;
        visited.add(to);
    }

    private Void place(Command c) {
        Coords at = cursor();
        List<CellAction> list = cells.get(at);
        if (list == null) {
            list = new ArrayList<>();
            cells.put(at, list);
        }
        list.add(new CellAction(c, actionIndex, new ArrayList<>(sections)));
        return null;
    }

    private MovementException error(String reason, Throwable cause) {
        Integer index = current == null ? null : actionIndex;
        return new MovementException(reason, index, actions, sections, current, bookmarks, cause);
    }

    private <T extends Command.RangeCommand<T>> T resolveCorners(T c) {
        CellPointer tl = resolvePointer(c.topLeft, "Top left");
        CellPointer br = resolvePointer(c.bottomRight, "Bottom right");
        for (CellPointer p : new CellPointer[] { tl, br }) {
            if (p.isResolved() && !p.coords().isWithinSheet()) {
                throw error("Range corner " + p + " is outside the sheet.", null);
            }
        }
        return c.withCorners(tl, br);
    }

    private CellPointer resolvePointer(CellPointer p, String role) {
        if (!(p instanceof CellPointer.Relative)) {
            return p;
        }
        int n = ((CellPointer.Relative) p).n;
        if (n > 0) {
            if (n >= visited.size()) {
                throw error(role + " corner would use " + n + " last visited cell, but only " + visited.size()
                        + " cells have been visited.", null);
            }
            return CellPointer.absolute(visited.get(visited.size() - 1 - n));
        }
        if (n < 0) {
            if (-n > stack.size()) {
                throw error(role + " corner would look " + (-n) + " positions up the position stack, but there are only "
                        + stack.size() + " saves.", null);
            }
            return CellPointer.absolute(stack.get(stack.size() + n));
        }
        return CellPointer.absolute(cursor());
    }

    // ---------------- movement ----------------

    @Override
    public Void visitMove(Command.Move c) {
        relocate(Coords.of(row + c.deltaRow, col + c.deltaCol));
        return null;
    }

    @Override
    public Void visitAtCell(Command.AtCell c) {
        relocate(Coords.of(c.row, c.col));
        return null;
    }

    @Override
    public Void visitBacktrack(Command.Backtrack c) {
        if (c.n + 1 > visited.size()) {
            throw error("Could not backtrack " + c.n + " cells, only " + visited.size() + " are in history.", null);
        }
        Coords last = null;
        for (int i = 0; i <= c.n; i++) {
            last = visited.remove(visited.size() - 1);
        }
        row = last.row;
        col = last.col;
        return null;
    }

    @Override
    public Void visitStackSave(Command.StackSave c) {
        stack.add(cursor());
        return null;
    }

    @Override
    public Void visitStackLoad(Command.StackLoad c) {
        if (stack.isEmpty()) {
            throw error("Position stack is empty.", null);
        }
        relocate(stack.remove(stack.size() - 1));
        return null;
    }

    @Override
    public Void visitSave(Command.Save c) {
        bookmarks.put(c.name, cursor());
        return null;
    }

    @Override
    public Void visitLoad(Command.Load c) {
        Coords to = bookmarks.get(c.name);
        if (to == null) {
            throw error("Save point " + c.name + " does not exist.", null);
        }
        relocate(to);
        return null;
    }

    @Override
    public Void visitSectionBegin(Command.SectionBegin c) {
        sections.add(c.name);
        return null;
    }

    @Override
    public Void visitSectionEnd(Command.SectionEnd c) {
        if (sections.isEmpty()) {
            throw error("SectionEnd without a matching SectionBegin.", null);
        }
        sections.remove(sections.size() - 1);
        return null;
    }

    // ---------------- content ----------------

    @Override
    public Void visitWrite(Command.Write c) {
        return place(c);
    }

    @Override
    public Void visitMergeWrite(Command.MergeWrite c) {
        if (col + c.width >= Coords.MAX_COLS) {
            throw error("Merged region of width " + c.width + " at " + cursor() + " leaves the sheet.", null);
        }
        return place(c);
    }

    @Override
    public Void visitWriteRich(Command.WriteRich c) {
        return place(c);
    }

    @Override
    public Void visitImposeStyle(Command.ImposeStyle c) {
        return place(c);
    }

    @Override
    public Void visitOverrideStyle(Command.OverrideStyle c) {
        return place(c);
    }

    // ---------------- ranges ----------------

    @Override
    public Void visitDrawBoxBorder(Command.DrawBoxBorder c) {
        return place(resolveCorners(c));
    }

    @Override
    public Void visitDefineNamedRange(Command.DefineNamedRange c) {
        return place(resolveCorners(c));
    }

    @Override
    public Void visitRefArray(Command.RefArray c) {
        return place(resolveCorners(c));
    }

    @Override
    public Void visitAddConditionalFormat(Command.AddConditionalFormat c) {
        return place(resolveCorners(c));
    }

    // ---------------- sheet ----------------

    @Override
    public Void visitSetRowHeight(Command.SetRowHeight c) {
        return place(c);
    }

    @Override
    public Void visitSetColWidth(Command.SetColWidth c) {
        return place(c);
    }

    @Override
    public Void visitSubmitRowBreak(Command.SubmitRowBreak c) {
        return place(c);
    }

    @Override
    public Void visitSubmitColBreak(Command.SubmitColBreak c) {
        return place(c);
    }

    @Override
    public Void visitApplyBreaks(Command.ApplyBreaks c) {
        return place(c);
    }

    @Override
    public Void visitAddComment(Command.AddComment c) {
        return place(c);
    }

    @Override
    public Void visitAddImage(Command.AddImage c) {
        return place(c);
    }

    @Override
    public Void visitAddChart(Command.AddChart c) {
        return place(c);
    }
}
