package celldsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Last pass before execution: folds {@link Command.ImposeStyle} and {@link Command.OverrideStyle} into the
 * content of their cell and produces the row-major execution order.
 *
 * <p>
 * Impositions merge into the content style; an override replaces it. A cell may carry at most one override.
 * </p>
 */
final class StyleConflictResolver {

    private StyleConflictResolver() {
    }

    static List<Placement> resolve(Map<Coords, List<CellAction>> cells, Map<String, Coords> bookmarks) {
        List<Placement> out = new ArrayList<>();

        for (Map.Entry<Coords, List<CellAction>> e : cells.entrySet()) {
            Coords at = e.getKey();
            StyleFold fold = new StyleFold(at, bookmarks);
            for (CellAction action : e.getValue()) {
                fold.action = action;
                action.command.accept(fold);
            }
            List<CellAction> actions = e.getValue();
            if (!fold.hasContent && (fold.replacement != null || !fold.imposed.isEmpty())) {
                CellAction origin = fold.override != null ? fold.override : fold.firstImposition;
                actions = new ArrayList<>(actions);
                actions.add(origin.withCommand(Ops.write(null)));
            }

            Restyler restyler = new Restyler(fold.imposed, fold.replacement);
            for (CellAction action : actions) {
                Command c = action.command.accept(restyler);
                // null: a style command, now part of the content
                if (c != null) {
                    out.add(new Placement(at, action.withCommand(c)));
                }
            }
        }

        // stable: commands on one cell keep their authoring order
        Collections.sort(out);
        return out;
    }

    private static IllegalStateException consumed(Command c, String pass) {
        return new IllegalStateException(c + " should have been consumed by " + pass + " resolution");
    }

    // Collects the style commands of one cell
    private static final class StyleFold implements CommandVisitor<Void> {
        private final Coords at;
        private final Map<String, Coords> bookmarks;
        CellAction action;

        Style imposed = Style.EMPTY;
        CellAction firstImposition;
        CellAction override;
        Style replacement;
        boolean hasContent;

        StyleFold(Coords at, Map<String, Coords> bookmarks) {
            this.at = at;
            this.bookmarks = bookmarks;
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
            hasContent = true;
            return null;
        }

        @Override
        public Void visitMergeWrite(Command.MergeWrite c) {
            hasContent = true;
            return null;
        }

        @Override
        public Void visitWriteRich(Command.WriteRich c) {
            hasContent = true;
            return null;
        }

        @Override
        public Void visitImposeStyle(Command.ImposeStyle c) {
            imposed = imposed.merge(c.style);
            if (firstImposition == null) {
                firstImposition = action;
            }
            return null;
        }

        @Override
        public Void visitOverrideStyle(Command.OverrideStyle c) {
            if (override != null) {
                throw new StructuralException("There's already an OverrideStyle for cell " + at + ".",
                        action.actionIndex, null, action.sections, c, bookmarks, null);
            }
            override = action;
            replacement = c.style;
            return null;
        }

        // ---------------- ranges ----------------

        @Override
        public Void visitDrawBoxBorder(Command.DrawBoxBorder c) {
            throw consumed(c, "box border");
        }

        @Override
        public Void visitDefineNamedRange(Command.DefineNamedRange c) {
            return null;
        }

        @Override
        public Void visitRefArray(Command.RefArray c) {
            throw consumed(c, "reference");
        }

        @Override
        public Void visitAddConditionalFormat(Command.AddConditionalFormat c) {
            return null;
        }

        // ---------------- sheet ----------------

        @Override
        public Void visitSetRowHeight(Command.SetRowHeight c) {
            return null;
        }

        @Override
        public Void visitSetColWidth(Command.SetColWidth c) {
            return null;
        }

        @Override
        public Void visitSubmitRowBreak(Command.SubmitRowBreak c) {
            return null;
        }

        @Override
        public Void visitSubmitColBreak(Command.SubmitColBreak c) {
            return null;
        }

        @Override
        public Void visitApplyBreaks(Command.ApplyBreaks c) {
            return null;
        }

        @Override
        public Void visitAddComment(Command.AddComment c) {
            return null;
        }

        @Override
        public Void visitAddImage(Command.AddImage c) {
            return null;
        }

        @Override
        public Void visitAddChart(Command.AddChart c) {
            return null;
        }
    }

    private static final class Restyler implements CommandVisitor<Command> {
        private final Style imposed;
        private final Style replacement;

        Restyler(Style imposed, Style replacement) {
            this.imposed = imposed;
            this.replacement = replacement;
        }

        // ---------------- movement ----------------

        @Override
        public Command visitMove(Command.Move c) {
            throw consumed(c, "movement");
        }

        @Override
        public Command visitAtCell(Command.AtCell c) {
            throw consumed(c, "movement");
        }

        @Override
        public Command visitBacktrack(Command.Backtrack c) {
            throw consumed(c, "movement");
        }

        @Override
        public Command visitStackSave(Command.StackSave c) {
            throw consumed(c, "movement");
        }

        @Override
        public Command visitStackLoad(Command.StackLoad c) {
            throw consumed(c, "movement");
        }

        @Override
        public Command visitSave(Command.Save c) {
            throw consumed(c, "movement");
        }

        @Override
        public Command visitLoad(Command.Load c) {
            throw consumed(c, "movement");
        }

        @Override
        public Command visitSectionBegin(Command.SectionBegin c) {
            throw consumed(c, "movement");
        }

        @Override
        public Command visitSectionEnd(Command.SectionEnd c) {
            throw consumed(c, "movement");
        }

        // ---------------- content ----------------

        @Override
        public Command visitWrite(Command.Write c) {
            if (replacement != null) {
                return c.replaceStyle(replacement);
            }
            return imposed.isEmpty() ? c : c.withStyle(imposed);
        }

        @Override
        public Command visitMergeWrite(Command.MergeWrite c) {
            if (replacement != null) {
                return c.replaceStyle(replacement);
            }
            return imposed.isEmpty() ? c : c.withStyle(imposed);
        }

        @Override
        public Command visitWriteRich(Command.WriteRich c) {
            if (replacement != null) {
                return c.withCellStyle(replacement);
            }
            if (imposed.isEmpty()) {
                return c;
            }
            return c.withCellStyle(c.cellStyle == null ? imposed : c.cellStyle.merge(imposed));
        }

        @Override
        public Command visitImposeStyle(Command.ImposeStyle c) {
            return null;
        }

        @Override
        public Command visitOverrideStyle(Command.OverrideStyle c) {
            return null;
        }

        // ---------------- ranges ----------------

        @Override
        public Command visitDrawBoxBorder(Command.DrawBoxBorder c) {
            throw consumed(c, "box border");
        }

        @Override
        public Command visitDefineNamedRange(Command.DefineNamedRange c) {
            return c;
        }

        @Override
        public Command visitRefArray(Command.RefArray c) {
            throw consumed(c, "reference");
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
            return c;
        }
    }
}
