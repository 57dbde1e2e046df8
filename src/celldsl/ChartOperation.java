package celldsl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.apache.commons.lang3.Validate;

/**
 * One step of chart configuration, replayed by {@link ChartInterpreter}.
 */
public abstract class ChartOperation {

    public interface Visitor<R> {
        R visitAddSeries(AddSeries op);

        R visitSetTitle(SetTitle op);

        R visitSetLegend(SetLegend op);

        R visitSetStyle(SetStyle op);

        R visitShowBlanksAs(ShowBlanksAs op);

        R visitShowHiddenData(ShowHiddenData op);

        R visitCombine(Combine op);
    }

    private ChartOperation() {
    }

    public abstract <R> R accept(Visitor<R> v);

    /**
     * Series options: {@code name}, {@code categories}, {@code values}. Values may be range strings or
     * {@link ChartRef}s, also inside nested maps.
     */
    public static AddSeries addSeries(Map<String, ?> options) {
        return new AddSeries(options);
    }

    public static SetTitle setTitle(String title) {
        return new SetTitle(title);
    }

    /** Position: {@code top}, {@code bottom}, {@code left}, {@code right}, {@code top_right} or {@code none}. */
    public static SetLegend setLegend(String position) {
        return new SetLegend(position);
    }

    public static SetStyle setStyle(boolean varyColors) {
        return new SetStyle(varyColors);
    }

    // gap, span or zero
    public static ShowBlanksAs showBlanksAs(String mode) {
        return new ShowBlanksAs(mode);
    }

    public static ShowHiddenData showHiddenData(boolean show) {
        return new ShowHiddenData(show);
    }

    public static Combine combine(Command.AddChart secondary) {
        return new Combine(secondary);
    }

    public static final class AddSeries extends ChartOperation {
        public final Map<String, Object> options;

        AddSeries(Map<String, ?> options) {
            Validate.notNull(options, "options");
            this.options = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(options));
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitAddSeries(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof AddSeries && ((AddSeries) o).options.equals(options);
        }

        @Override
        public int hashCode() {
            return options.hashCode();
        }

        @Override
        public String toString() {
            return "AddSeries" + options;
        }
    }

    public static final class SetTitle extends ChartOperation {
        public final String title;

        SetTitle(String title) {
            this.title = Validate.notNull(title, "title");
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitSetTitle(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SetTitle && ((SetTitle) o).title.equals(title);
        }

        @Override
        public int hashCode() {
            return title.hashCode();
        }

        @Override
        public String toString() {
            return "SetTitle(" + title + ")";
        }
    }

    public static final class SetLegend extends ChartOperation {
        public final String position;

        SetLegend(String position) {
            this.position = Validate.notNull(position, "position");
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitSetLegend(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SetLegend && ((SetLegend) o).position.equals(position);
        }

        @Override
        public int hashCode() {
            return position.hashCode();
        }

        @Override
        public String toString() {
            return "SetLegend(" + position + ")";
        }
    }

    public static final class SetStyle extends ChartOperation {
        public final boolean varyColors;

        SetStyle(boolean varyColors) {
            this.varyColors = varyColors;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitSetStyle(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SetStyle && ((SetStyle) o).varyColors == varyColors;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(varyColors);
        }

        @Override
        public String toString() {
            return "SetStyle(varyColors=" + varyColors + ")";
        }
    }

    public static final class ShowBlanksAs extends ChartOperation {
        public final String mode;

        ShowBlanksAs(String mode) {
            this.mode = Validate.notNull(mode, "mode");
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitShowBlanksAs(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ShowBlanksAs && ((ShowBlanksAs) o).mode.equals(mode);
        }

        @Override
        public int hashCode() {
            return mode.hashCode();
        }

        @Override
        public String toString() {
            return "ShowBlanksAs(" + mode + ")";
        }
    }

    public static final class ShowHiddenData extends ChartOperation {
        public final boolean show;

        ShowHiddenData(boolean show) {
            this.show = show;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitShowHiddenData(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ShowHiddenData && ((ShowHiddenData) o).show == show;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(show);
        }

        @Override
        public String toString() {
            return "ShowHiddenData(" + show + ")";
        }
    }

    public static final class Combine extends ChartOperation {
        public final Command.AddChart secondary;

        Combine(Command.AddChart secondary) {
            this.secondary = Objects.requireNonNull(secondary, "secondary");
        }

        Combine withSecondary(Command.AddChart chart) {
            return new Combine(chart);
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitCombine(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Combine && ((Combine) o).secondary.equals(secondary);
        }

        @Override
        public int hashCode() {
            return secondary.hashCode();
        }

        @Override
        public String toString() {
            return "Combine(" + secondary + ")";
        }
    }
}
