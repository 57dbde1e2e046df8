package celldsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects committed tokens and, on {@link #execute()}, lays them out on a sheet.
 *
 * <pre>
 * CellDslSession s = new CellDslSession(binding.sheet("Report"));
 * s.commit("Name", 6, "Value", 2, Ops.save("body"));
 * SessionStats stats = s.execute();
 * </pre>
 *
 * Execution walks the stream with a cursor, resolves range corners and forward references, expands box borders,
 * folds style impositions into cell content and applies the result in row-major order. Any failure aborts the
 * session; cells written before the failure stay written.
 */
public final class CellDslSession {
    private static final Logger LOG = LoggerFactory.getLogger(CellDslSession.class);

    private final SheetTarget target;
    private final Coords start;
    private final Style defaultStyle;
    private final boolean overwritesOk;
    private final CommitBuilder builder = new CommitBuilder();
    private boolean finished;

    public CellDslSession(SheetTarget target) {
        this(target, CellDslConfig.defaults());
    }

    public CellDslSession(SheetTarget target, CellDslConfig config) {
        this(target, config.start(), config.defaultStyle(), config.overwritesOk);
    }

    public CellDslSession(SheetTarget target, Coords start, Style defaultStyle, boolean overwritesOk) {
        this.target = Validate.notNull(target, "target");
        this.start = Validate.notNull(start, "start");
        this.defaultStyle = Validate.notNull(defaultStyle, "defaultStyle");
        this.overwritesOk = overwritesOk;
    }

    private CellDslSession(Coords start) {
        this.target = null;
        this.start = Validate.notNull(start, "start");
        this.defaultStyle = Styles.DEFAULT_FONT;
        this.overwritesOk = false;
    }

    /** A session without a sheet; only {@link #resolve()} is available. */
    public static CellDslSession detached(Coords start) {
        return new CellDslSession(start);
    }

    public CellDslSession commit(Object... tokens) {
        if (finished) {
            throw new IllegalStateException("Session has already been executed.");
        }
        builder.commit(tokens);
        return this;
    }

    public List<Command> actions() {
        return builder.actions();
    }

    /** Runs every resolution pass without touching the sheet. */
    public SessionStats resolve() {
        Plan plan = plan();
        return new SessionStats(start, plan.placements, plan.bookmarks, plan.warnings);
    }

    public SessionStats execute() {
        if (target == null) {
            throw new IllegalStateException("A detached session can only be resolved.");
        }
        if (finished) {
            throw new IllegalStateException("Session has already been executed.");
        }
        finished = true;

        Plan plan = plan();
        CommandExecutor executor = new CommandExecutor(target, defaultStyle, overwritesOk);

        for (int i = 0; i < plan.placements.size(); i++) {
            Placement p = plan.placements.get(i);
            SurfaceResult r;
            try {
                r = executor.execute(p);
            } catch (CellDslException e) {
                throw failure(e.getReason(), i, plan, p, e);
            } catch (RuntimeException e) {
                throw failure("Uncaught exception: " + e, i, plan, p, e);
            }
            if (!r.isOk()) {
                throw failure("Output rejected " + p.command + " at " + p.coords + ": " + r, i, plan, p, null);
            }
        }
        LOG.debug("Executed {} placements, {} styles registered", plan.placements.size(), target.styles.size());
        return new SessionStats(start, plan.placements, plan.bookmarks, plan.warnings);
    }

    private static ExecutionException failure(String reason, int index, Plan plan, Placement p, Throwable cause) {
        return new ExecutionException(reason, index, plan.placements, p.sections, p.command, plan.bookmarks, cause);
    }

    private Plan plan() {
        List<Command> actions = builder.actions();
        List<String> warnings = new ArrayList<>();

        MovementResolver.Result moved = MovementResolver.resolve(actions, start);
        LOG.debug("{} commands placed on {} cells", actions.size(), moved.cells.size());

        String sheetName = target == null ? null : target.surface.sheetName();
        ReferenceResolver.Result referenced = ReferenceResolver.resolve(moved.cells, moved.bookmarks, sheetName);
        Map<Coords, List<CellAction>> cells = ReferenceResolver.introduceRefs(referenced.cells, referenced.refs);

        cells = BoxBorderExpander.expand(cells, warnings);
        List<Placement> placements = StyleConflictResolver.resolve(cells, moved.bookmarks);
        LOG.debug("{} placements after expansion, {} forward references", placements.size(),
                referenced.refs.size());

        return new Plan(placements, moved.bookmarks, warnings);
    }

    private static final class Plan {
        final List<Placement> placements;
        final Map<String, Coords> bookmarks;
        final List<String> warnings;

        Plan(List<Placement> placements, Map<String, Coords> bookmarks, List<String> warnings) {
            this.placements = placements;
            this.bookmarks = bookmarks;
            this.warnings = warnings;
        }
    }
}
