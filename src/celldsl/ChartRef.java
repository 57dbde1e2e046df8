package celldsl;

import org.apache.commons.lang3.Validate;

/**
 * Placeholder inside chart options for a region declared with {@link Command.RefArray}. Replaced by the
 * region's sheet-qualified absolute address when the chart is built.
 */
public final class ChartRef {
    public final String name;

    public ChartRef(String name) {
        this.name = Validate.notNull(name, "name");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ChartRef && ((ChartRef) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "ChartRef(" + name + ")";
    }
}
