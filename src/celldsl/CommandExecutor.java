package celldsl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies resolved placements to a {@link SheetTarget}, one at a time, in the order given.
 *
 * <p>
 * Content styles are layered over the session default style before registration. Unless overwrites are allowed,
 * a second different content command on a cell is an error; an equal one is skipped.
 * </p>
 */
final class CommandExecutor implements CommandVisitor<SurfaceResult> {
    private static final Logger LOG = LoggerFactory.getLogger(CommandExecutor.class);

    private final SheetTarget target;
    private final Style defaultStyle;
    private final boolean overwritesOk;
    private final Map<Coords, Command> written = new HashMap<>();

    private Coords at;

    CommandExecutor(SheetTarget target, Style defaultStyle, boolean overwritesOk) {
        this.target = target;
        this.defaultStyle = defaultStyle;
        this.overwritesOk = overwritesOk;
    }

    SurfaceResult execute(Placement p) {
        if (!overwritesOk && p.command.isOverwriteSensitive()) {
            Command previous = written.get(p.coords);
            if (previous != null) {
                if (!previous.equals(p.command)) {
                    throw new ExecutionException("Overwrite has occurred at " + p.coords + ", previous: " + previous);
                }
                return SurfaceResult.OK;
            }
            written.put(p.coords, p.command);
        }
        at = p.coords;
        return p.command.accept(this);
    }

    private StyleHandle handle(Style s) {
        return target.styles.register(defaultStyle.merge(s));
    }

    private static DataKind kindOf(Object data, DataKind kind) {
        return kind == null ? DataKind.infer(data) : kind;
    }

    private static SurfaceResult unreachable(Command c) {
        throw new ExecutionException("Command " + c + " cannot be executed, it should have been resolved earlier.");
    }

    // ---------------- movement ----------------

    @Override
    public SurfaceResult visitMove(Command.Move c) {
        return unreachable(c);
    }

    @Override
    public SurfaceResult visitAtCell(Command.AtCell c) {
        return unreachable(c);
    }

    @Override
    public SurfaceResult visitBacktrack(Command.Backtrack c) {
        return unreachable(c);
    }

    @Override
    public SurfaceResult visitStackSave(Command.StackSave c) {
        return unreachable(c);
    }

    @Override
    public SurfaceResult visitStackLoad(Command.StackLoad c) {
        return unreachable(c);
    }

    @Override
    public SurfaceResult visitSave(Command.Save c) {
        return unreachable(c);
    }

    @Override
    public SurfaceResult visitLoad(Command.Load c) {
        return unreachable(c);
    }

    @Override
    public SurfaceResult visitSectionBegin(Command.SectionBegin c) {
        return unreachable(c);
    }

    @Override
    public SurfaceResult visitSectionEnd(Command.SectionEnd c) {
        return unreachable(c);
    }

    // ---------------- content ----------------

    @Override
    public SurfaceResult visitWrite(Command.Write c) {
        return target.surface.write(at, c.data, kindOf(c.data, c.kind), handle(c.style));
    }

    @Override
    public SurfaceResult visitMergeWrite(Command.MergeWrite c) {
        return target.surface.mergeWrite(at, c.width, c.data, kindOf(c.data, c.kind), handle(c.style));
    }

    @Override
    public SurfaceResult visitWriteRich(Command.WriteRich c) {
        if (c.runs.size() == 1) {
            RichRun only = c.runs.get(0);
            LOG.warn("Rich write at {} has a single run, writing it as a plain string", at);
            Style s = (c.cellStyle == null ? Style.EMPTY : c.cellStyle).merge(runStyle(c, only));
            return target.surface.write(at, only.text, DataKind.STRING, handle(s));
        }
        List<StyledText> runs = new ArrayList<>(c.runs.size());
        for (RichRun run : c.runs) {
            runs.add(new StyledText(run.text, handle(runStyle(c, run))));
        }
        return target.surface.writeRich(at, runs, handle(c.cellStyle));
    }

    private static Style runStyle(Command.WriteRich c, RichRun run) {
        return run.style != null ? run.style : c.runStyle;
    }

    @Override
    public SurfaceResult visitImposeStyle(Command.ImposeStyle c) {
        return unreachable(c);
    }

    @Override
    public SurfaceResult visitOverrideStyle(Command.OverrideStyle c) {
        return unreachable(c);
    }

    // ---------------- ranges ----------------

    @Override
    public SurfaceResult visitDrawBoxBorder(Command.DrawBoxBorder c) {
        return unreachable(c);
    }

    @Override
    public SurfaceResult visitDefineNamedRange(Command.DefineNamedRange c) {
        return target.surface.defineName(c.name, c.topLeft.coords(), c.bottomRight.coords());
    }

    @Override
    public SurfaceResult visitRefArray(Command.RefArray c) {
        return unreachable(c);
    }

    // the format is a difference applied on top of the cell style, so no default layering
    @Override
    @SuppressWarnings("unchecked")
    public SurfaceResult visitAddConditionalFormat(Command.AddConditionalFormat c) {
        Object optionFormat = c.options.get("format");
        if (c.format != null && optionFormat != null) {
            LOG.debug("Conditional format at {} has both a format option and a format", at);
            return SurfaceResult.INVALID_PARAMETER;
        }
        Style format = c.format;
        if (optionFormat instanceof Style) {
            format = (Style) optionFormat;
        } else if (optionFormat instanceof Map) {
            format = Style.of((Map<String, ?>) optionFormat);
        } else if (optionFormat != null) {
            return SurfaceResult.INVALID_PARAMETER;
        }
        Map<String, Object> options = new LinkedHashMap<>(c.options);
        options.remove("format");
        return target.surface.addConditionalFormat(c.topLeft.coords(), c.bottomRight.coords(), options, format);
    }

    // ---------------- sheet ----------------

    @Override
    public SurfaceResult visitSetRowHeight(Command.SetRowHeight c) {
        return target.surface.setRowHeight(at.row, c.size);
    }

    @Override
    public SurfaceResult visitSetColWidth(Command.SetColWidth c) {
        return target.surface.setColWidth(at.col, c.size);
    }

    @Override
    public SurfaceResult visitSubmitRowBreak(Command.SubmitRowBreak c) {
        target.pageBreaks.submitRow(at.row);
        return SurfaceResult.OK;
    }

    @Override
    public SurfaceResult visitSubmitColBreak(Command.SubmitColBreak c) {
        target.pageBreaks.submitCol(at.col);
        return SurfaceResult.OK;
    }

    @Override
    public SurfaceResult visitApplyBreaks(Command.ApplyBreaks c) {
        return target.pageBreaks.apply(target.surface);
    }

    @Override
    public SurfaceResult visitAddComment(Command.AddComment c) {
        return target.surface.addComment(at, c.text, c.options);
    }

    @Override
    public SurfaceResult visitAddImage(Command.AddImage c) {
        return target.surface.addImage(at, c.filePath, c.imageData(), c.options);
    }

    @Override
    public SurfaceResult visitAddChart(Command.AddChart c) {
        return target.surface.addChart(at, ChartInterpreter.interpret(c));
    }
}
