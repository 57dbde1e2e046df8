package celldsl;

import java.util.List;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.util.AreaReference;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.xddf.usermodel.chart.AxisCrosses;
import org.apache.poi.xddf.usermodel.chart.AxisPosition;
import org.apache.poi.xddf.usermodel.chart.BarDirection;
import org.apache.poi.xddf.usermodel.chart.BarGrouping;
import org.apache.poi.xddf.usermodel.chart.ChartTypes;
import org.apache.poi.xddf.usermodel.chart.DisplayBlanks;
import org.apache.poi.xddf.usermodel.chart.Grouping;
import org.apache.poi.xddf.usermodel.chart.LegendPosition;
import org.apache.poi.xddf.usermodel.chart.XDDFAreaChartData;
import org.apache.poi.xddf.usermodel.chart.XDDFBarChartData;
import org.apache.poi.xddf.usermodel.chart.XDDFChartAxis;
import org.apache.poi.xddf.usermodel.chart.XDDFChartData;
import org.apache.poi.xddf.usermodel.chart.XDDFChartLegend;
import org.apache.poi.xddf.usermodel.chart.XDDFDataSource;
import org.apache.poi.xddf.usermodel.chart.XDDFDataSourcesFactory;
import org.apache.poi.xddf.usermodel.chart.XDDFLineChartData;
import org.apache.poi.xddf.usermodel.chart.XDDFNumericalDataSource;
import org.apache.poi.xddf.usermodel.chart.XDDFValueAxis;
import org.apache.poi.xssf.usermodel.XSSFChart;
import org.apache.poi.xssf.usermodel.XSSFClientAnchor;
import org.apache.poi.xssf.usermodel.XSSFDrawing;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Draws a {@link ChartSpec} with the XDDF chart API. Combined charts share the axes of the primary one. Stock
 * charts are drawn as line charts.
 */
final class PoiChartWriter {
    private static final Logger LOG = LoggerFactory.getLogger(PoiChartWriter.class);

    // about 480 x 288 pixels with default cell sizes
    static final int WIDTH_COLS = 8;
    static final int HEIGHT_ROWS = 15;

    private PoiChartWriter() {
    }

    static SurfaceResult draw(XSSFSheet sheet, Coords at, ChartSpec spec) {
        XSSFDrawing drawing = sheet.createDrawingPatriarch();
        XSSFClientAnchor anchor = drawing.createAnchor(0, 0, 0, 0, at.col, at.row, at.col + WIDTH_COLS,
                at.row + HEIGHT_ROWS);
        XSSFChart chart = drawing.createChart(anchor);

        try {
            if (spec.title() != null) {
                chart.setTitleText(spec.title());
                chart.setTitleOverlay(false);
            }
            legend(chart, spec.legendPosition());
            if (spec.blanksAs() != null) {
                chart.displayBlanksAs(blanks(spec.blanksAs()));
            }
            if (spec.showHiddenData() != null) {
                chart.setPlotOnlyVisibleCells(!spec.showHiddenData());
            }

            Axes axes = axes(chart, spec.kind);
            plot(sheet, chart, spec, axes);
            for (ChartSpec secondary : spec.combined()) {
                plot(sheet, chart, secondary, axes == null ? axes(chart, secondary.kind) : axes);
            }
        } catch (IllegalArgumentException e) {
            LOG.debug("Chart at {} rejected: {}", at, spec, e);
            return SurfaceResult.INVALID_PARAMETER;
        }
        return SurfaceResult.OK;
    }

    private static final class Axes {
        final XDDFChartAxis category;
        final XDDFValueAxis value;

        Axes(XDDFChartAxis category, XDDFValueAxis value) {
            this.category = category;
            this.value = value;
        }
    }

    private static Axes axes(XSSFChart chart, Command.AddChart.Kind kind) {
        switch (kind) {
        case PIE:
        case DOUGHNUT:
            return null;
        case SCATTER: {
            XDDFValueAxis x = chart.createValueAxis(AxisPosition.BOTTOM);
            XDDFValueAxis y = chart.createValueAxis(AxisPosition.LEFT);
            y.setCrosses(AxisCrosses.AUTO_ZERO);
            return new Axes(x, y);
        }
        case BAR: {
            XDDFChartAxis c = chart.createCategoryAxis(AxisPosition.LEFT);
            XDDFValueAxis v = chart.createValueAxis(AxisPosition.BOTTOM);
            v.setCrosses(AxisCrosses.AUTO_ZERO);
            return new Axes(c, v);
        }
        case AREA:
        case COLUMN:
        case LINE:
        case STOCK:
        case RADAR: {
            XDDFChartAxis c = chart.createCategoryAxis(AxisPosition.BOTTOM);
            XDDFValueAxis v = chart.createValueAxis(AxisPosition.LEFT);
            v.setCrosses(AxisCrosses.AUTO_ZERO);
            return new Axes(c, v);
        }
        default:
            throw new AssertionError("Unhandled chart kind: " + kind);
        }
    }

    private static void plot(XSSFSheet sheet, XSSFChart chart, ChartSpec spec, Axes axes) {
        XDDFChartData data = chart.createData(chartType(spec.kind), axes == null ? null : axes.category,
                axes == null ? null : axes.value);
        subtype(data, spec);
        if (spec.varyColors() != null) {
            data.setVaryColors(spec.varyColors());
        }

        List<ChartSpec.Series> series = spec.series();
        for (ChartSpec.Series s : series) {
            XDDFNumericalDataSource<Double> values = XDDFDataSourcesFactory.fromNumericCellRange(
                    sheetOf(sheet, s.values()), range(s.values()));
            XDDFDataSource<?> categories;
            if (s.categories() == null) {
                categories = XDDFDataSourcesFactory.fromArray(ordinals(values.getPointCount()));
            } else {
                if (spec.kind == Command.AddChart.Kind.SCATTER) {
                    categories = XDDFDataSourcesFactory.fromNumericCellRange(sheetOf(sheet, s.categories()),
                            range(s.categories()));
                } else {
                    categories = XDDFDataSourcesFactory.fromStringCellRange(sheetOf(sheet, s.categories()),
                            range(s.categories()));
                }
            }
            XDDFChartData.Series added = data.addSeries(categories, values);
            if (s.name() != null) {
                added.setTitle(s.name(), null);
            }
        }
        chart.plot(data);
    }

    // 1..n, used as categories when a series has none
    private static String[] ordinals(int n) {
        String[] out = new String[n];
        for (int i = 0; i < n; i++) {
            out[i] = Integer.toString(i + 1);
        }
        return out;
    }

    private static ChartTypes chartType(Command.AddChart.Kind kind) {
        switch (kind) {
        case AREA:
            return ChartTypes.AREA;
        case BAR:
        case COLUMN:
            return ChartTypes.BAR;
        case LINE:
        case STOCK:
            return ChartTypes.LINE;
        case PIE:
            return ChartTypes.PIE;
        case DOUGHNUT:
            return ChartTypes.DOUGHNUT;
        case SCATTER:
            return ChartTypes.SCATTER;
        case RADAR:
            return ChartTypes.RADAR;
        default:
            throw new AssertionError("Unhandled chart kind: " + kind);
        }
    }

    private static void subtype(XDDFChartData data, ChartSpec spec) {
        if (data instanceof XDDFBarChartData) {
            XDDFBarChartData bar = (XDDFBarChartData) data;
            bar.setBarDirection(spec.kind == Command.AddChart.Kind.BAR ? BarDirection.BAR : BarDirection.COL);
            if (spec.subtype != null) {
                bar.setBarGrouping(barGrouping(spec.subtype));
                bar.setOverlap((byte) 100);
            }
            return;
        }
        if (spec.subtype == null) {
            return;
        }
        if (data instanceof XDDFLineChartData) {
            ((XDDFLineChartData) data).setGrouping(grouping(spec.subtype));
        } else if (data instanceof XDDFAreaChartData) {
            ((XDDFAreaChartData) data).setGrouping(grouping(spec.subtype));
        } else {
            throw new IllegalArgumentException("Subtype " + spec.subtype + " does not apply to " + spec.kind);
        }
    }

    private static BarGrouping barGrouping(String subtype) {
        switch (subtype) {
        case "stacked":
            return BarGrouping.STACKED;
        case "percent_stacked":
            return BarGrouping.PERCENT_STACKED;
        default:
            throw new IllegalArgumentException("Unknown subtype: " + subtype);
        }
    }

    private static Grouping grouping(String subtype) {
        switch (subtype) {
        case "stacked":
            return Grouping.STACKED;
        case "percent_stacked":
            return Grouping.PERCENT_STACKED;
        default:
            throw new IllegalArgumentException("Unknown subtype: " + subtype);
        }
    }

    private static void legend(XSSFChart chart, String position) {
        if ("none".equals(position)) {
            chart.deleteLegend();
            return;
        }
        XDDFChartLegend legend = chart.getOrAddLegend();
        if (position == null) {
            legend.setPosition(LegendPosition.RIGHT);
            return;
        }
        switch (position) {
        case "top":
            legend.setPosition(LegendPosition.TOP);
            break;
        case "bottom":
            legend.setPosition(LegendPosition.BOTTOM);
            break;
        case "left":
            legend.setPosition(LegendPosition.LEFT);
            break;
        case "right":
            legend.setPosition(LegendPosition.RIGHT);
            break;
        case "top_right":
            legend.setPosition(LegendPosition.TOP_RIGHT);
            break;
        default:
            throw new IllegalArgumentException("Unknown legend position: " + position);
        }
    }

    private static DisplayBlanks blanks(String mode) {
        switch (mode) {
        case "gap":
            return DisplayBlanks.GAP;
        case "span":
            return DisplayBlanks.SPAN;
        case "zero":
            return DisplayBlanks.ZERO;
        default:
            throw new IllegalArgumentException("Unknown blanks mode: " + mode);
        }
    }

    private static CellRangeAddress range(String ref) {
        if (ref == null) {
            throw new IllegalArgumentException("A series needs values");
        }
        AreaReference area = new AreaReference(ref, SpreadsheetVersion.EXCEL2007);
        CellReference first = area.getFirstCell();
        CellReference last = area.getLastCell();
        return new CellRangeAddress(first.getRow(), last.getRow(), first.getCol(), last.getCol());
    }

    // unqualified references point at the chart's own sheet
    private static XSSFSheet sheetOf(XSSFSheet own, String ref) {
        String name = new AreaReference(ref, SpreadsheetVersion.EXCEL2007).getFirstCell().getSheetName();
        if (name == null) {
            return own;
        }
        XSSFSheet other = own.getWorkbook().getSheet(name);
        if (other == null) {
            throw new IllegalArgumentException("No sheet named " + name + " for " + ref);
        }
        return other;
    }
}
