package celldsl;

import org.apache.commons.lang3.Validate;

// one per sheet; every session on that sheet shares it
public final class SheetTarget {
    public final OutputSurface surface;
    public final StyleCache styles;
    public final PageBreakAccumulator pageBreaks;

    public SheetTarget(OutputSurface surface, StyleCache styles) {
        this(surface, styles, new PageBreakAccumulator());
    }

    public SheetTarget(OutputSurface surface, StyleCache styles, PageBreakAccumulator pageBreaks) {
        this.surface = Validate.notNull(surface, "surface");
        this.styles = Validate.notNull(styles, "styles");
        this.pageBreaks = Validate.notNull(pageBreaks, "pageBreaks");
    }
}
