package celldsl;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CellDslToExcel {

    public static void main(String[] args) throws Exception {
        CellDslConfig cfg = CellDslConfig.load(args);
        Path xlsxPath = Paths.get(cfg.outPath);

        try (WorkbookBinding binding = new WorkbookBinding()) {
            SheetTarget target = binding.sheet(cfg.sheetName);

            CellDslSession session = new CellDslSession(target, cfg);
            session.commit(demoLayout());
            SessionStats stats = session.execute();

            binding.write(xlsxPath);

            System.out.println("Done: " + xlsxPath.toAbsolutePath() + " (" + (stats.placements().size() - 1)
                    + " operations, last cell " + stats.maxCoords() + ")");
        }
    }

    // A quarterly table with a title, a boxed body, a total row and a chart of it
    static List<Object> demoLayout() {
        List<Object> quarters = new ArrayList<>();
        List<Object> sales = new ArrayList<>();
        int[] figures = { 120, 135, 160, 148 };
        for (int i = 0; i < figures.length; i++) {
            quarters.add("Q" + (i + 1));
            sales.add(Ops.writeNumber(figures[i]).withStyle(Styles.RIGHT));
        }

        Map<String, Object> series = new LinkedHashMap<>();
        series.put("name", "Sales");
        series.put("categories", Ops.ref("quarters"));
        series.put("values", Ops.ref("sales"));

        return Arrays.<Object>asList(
                SheetLayouts.section("title",
                        Ops.mergeWrite("Quarterly sales", 1).withStyle(Styles.DEFAULT_HEADER)),
                Ops.NEXT_ROW_SKIP,
                Ops.save("table"),
                SheetLayouts.section("header", Styles.BOLD, "Quarter", 6, Styles.BOLD, "Sales"),
                Ops.move(1, -1),
                SheetLayouts.section("body",
                        SheetLayouts.colChain(quarters, null, null, null, "quarters", 1),
                        6,
                        SheetLayouts.colChain(sales, null, null, "sales_figures", "sales", 1)),
                Ops.move(figures.length, -1),
                Styles.BOLD, "Total", 6,
                Ops.writeFormula("=SUM(sales_figures)").withStyle(Styles.BOLD),
                Ops.DRAW_BOX_BORDER.topLeft("table"),
                Ops.SUBMIT_ROW_BREAK,
                Ops.APPLY_BREAKS,
                Ops.atCell(0, 3),
                Ops.columnChart().perform(ChartOperation.addSeries(series), ChartOperation.setTitle("Sales"),
                        ChartOperation.setLegend("none")));
    }
}
