package celldsl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.ComparisonOperator;
import org.apache.poi.ss.usermodel.ConditionType;
import org.apache.poi.ss.util.CellAddress;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFComment;
import org.apache.poi.xssf.usermodel.XSSFConditionalFormatting;
import org.apache.poi.xssf.usermodel.XSSFConditionalFormattingRule;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFSheetConditionalFormatting;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PoiSheetSurfaceTest {

    private WorkbookBinding binding;
    private SheetTarget target;
    private XSSFSheet sheet;

    @BeforeEach
    void setUp() {
        binding = new WorkbookBinding();
        target = binding.sheet("Report");
        sheet = ((PoiSheetSurface) target.surface).sheet();
    }

    @AfterEach
    void tearDown() throws IOException {
        binding.close();
    }

    private SessionStats run(Object... tokens) {
        return new CellDslSession(target).commit(tokens).execute();
    }

    private Cell cell(int row, int col) {
        return sheet.getRow(row).getCell(col);
    }

    private XSSFCellStyle style(int row, int col) {
        return (XSSFCellStyle) cell(row, col).getCellStyle();
    }

    @Test
    void sameSheetSameTarget() {
        assertThat(binding.sheet("Report")).isSameAs(target);
        assertThat(binding.sheet("Other")).isNotSameAs(target);
        assertThat(binding.workbook().getNumberOfSheets()).isEqualTo(2);
    }

    @Test
    @DisplayName("Values are written with their inferred or explicit kind")
    void writesByKind() {
        run("text", 6, Ops.write(12.5), 6, Ops.write("=A1&\"!\""), 6, Ops.write(true), 6,
                Ops.writeNumber(Integer.valueOf(3)).withKind(DataKind.STRING), 6, Ops.writeBlank(), 6,
                Ops.writeUrl("https://example.com/"));

        assertThat(cell(0, 0).getStringCellValue()).isEqualTo("text");
        assertThat(cell(0, 1).getNumericCellValue()).isEqualTo(12.5);
        assertThat(cell(0, 2).getCellFormula()).isEqualTo("A1&\"!\"");
        assertThat(cell(0, 3).getBooleanCellValue()).isTrue();
        assertThat(cell(0, 4).getStringCellValue()).isEqualTo("3");
        assertThat(cell(0, 5).getCellType()).isEqualTo(CellType.BLANK);
        assertThat(cell(0, 6).getHyperlink().getAddress()).isEqualTo("https://example.com/");
    }

    @Test
    void stylesBecomeCellStylesAndFonts() {
        run(Styles.BOLD.merge(Styles.CENTER).merge(Style.of("bg_color", "#FFCC00", "font_color", "red")), "A", 6,
                Ops.write("B").withStyle(Styles.PERCENT), Ops.DRAW_BOX_BORDER);

        XSSFCellStyle a = style(0, 0);
        assertThat(a.getFont().getBold()).isTrue();
        assertThat(a.getFont().getFontName()).isEqualTo("Liberation Sans");
        assertThat(a.getFont().getFontHeightInPoints()).isEqualTo((short) 10);
        assertThat(a.getAlignment()).isEqualTo(PoiStyleFactory.horizontal("center"));
        assertThat(a.getFillForegroundXSSFColor().getRGB()).isEqualTo(new byte[] { (byte) 0xFF, (byte) 0xCC, 0 });
        assertThat(a.getFont().getXSSFColor().getRGB()).isEqualTo(new byte[] { (byte) 0xFF, 0, 0 });

        XSSFCellStyle b = style(0, 1);
        assertThat(b.getDataFormatString()).isEqualTo("0.0%");
        assertThat(b.getBorderTop()).isEqualTo(BorderStyle.THIN);
        assertThat(b.getBorderLeft()).isEqualTo(BorderStyle.THIN);
        assertThat(a.getBorderTop()).isEqualTo(BorderStyle.NONE);
    }

    @Test
    void equalStylesShareOneCellStyle() {
        run(Styles.ITALIC, "a", 6, Styles.ITALIC, "b");

        assertThat(cell(0, 0).getCellStyle().getIndex()).isEqualTo(cell(0, 1).getCellStyle().getIndex());
    }

    @Test
    @DisplayName("Merged writes cover their width, width 0 is a single cell")
    void mergedWrites() {
        run(Ops.mergeWrite("wide", 2), 2, Ops.mergeWrite("narrow", 0));

        assertThat(sheet.getMergedRegions()).hasSize(1);
        assertThat(sheet.getMergedRegion(0).formatAsString()).isEqualTo("A1:C1");
        assertThat(cell(1, 0).getStringCellValue()).isEqualTo("narrow");
    }

    @Test
    void richText() {
        run("plain ", Styles.BOLD, "bold");

        assertThat(cell(0, 0).getRichStringCellValue().getString()).isEqualTo("plain bold");
        assertThat(cell(0, 0).getRichStringCellValue().numFormattingRuns()).isEqualTo(2);
    }

    @Test
    void namesSizesBreaksAndComments() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("author", "reviewer");
        run(Ops.save("tl"), Ops.setRowHeight(30), Ops.setColWidth(12), 3,
                Ops.defineNamedRange("block").topLeft("tl"), Ops.addComment("check", options),
                Ops.SUBMIT_ROW_BREAK, Ops.SUBMIT_COL_BREAK, Ops.APPLY_BREAKS);

        assertThat(binding.workbook().getName("block").getRefersToFormula()).isEqualTo("Report!$A$1:$B$2");
        assertThat(sheet.getRow(0).getHeightInPoints()).isEqualTo(30f);
        assertThat(sheet.getColumnWidth(0)).isEqualTo(12 * 256);
        assertThat(sheet.getRowBreaks()).containsExactly(1);
        assertThat(sheet.getColumnBreaks()).containsExactly(1);
        XSSFComment comment = sheet.getCellComment(new CellAddress(1, 1));
        assertThat(comment.getString().getString()).isEqualTo("check");
        assertThat(comment.getAuthor()).isEqualTo("reviewer");
    }

    @Test
    void pageBreaksAreReplacedOnApply() {
        run(Ops.atCell(5, 0), Ops.SUBMIT_ROW_BREAK, Ops.APPLY_BREAKS);
        run(Ops.atCell(9, 0), Ops.SUBMIT_ROW_BREAK, Ops.APPLY_BREAKS);

        assertThat(sheet.getRowBreaks()).containsExactly(9);
    }

    @Test
    @DisplayName("Limits of the workbook format are reported as execution errors")
    void limits() {
        String tooLong = StringUtils.repeat('x', PoiSheetSurface.MAX_STRING_LENGTH + 1);

        assertThatThrownBy(() -> run(tooLong)).isInstanceOf(ExecutionException.class)
                .hasMessageContaining("CONTENT_LENGTH_EXCEEDED");
        assertThatThrownBy(() -> run(Ops.atCell(1, 0), Ops.writeFormula("=SUM(")))
                .isInstanceOf(ExecutionException.class).hasMessageContaining("INVALID_PARAMETER");
        assertThatThrownBy(() -> run(Ops.atCell(2, 0), Ops.setColWidth(300)))
                .isInstanceOf(ExecutionException.class).hasMessageContaining("INVALID_PARAMETER");
    }

    @Test
    void imagesNeedAKnownType() {
        assertThatThrownBy(() -> run(Ops.addImage("picture.bmp")))
                .isInstanceOf(ExecutionException.class).hasMessageContaining("INVALID_PARAMETER");
    }

    @Test
    void chartsAreDrawnFromForwardReferences() {
        Map<String, Object> series = new LinkedHashMap<>();
        series.put("name", "Values");
        series.put("values", Ops.ref("values"));
        run(Ops.pieChart().perform(ChartOperation.addSeries(series), ChartOperation.setLegend("bottom")), 2,
                SheetLayouts.colChain(
                        Arrays.<Object>asList(Ops.writeNumber(1), Ops.writeNumber(2), Ops.writeNumber(3)),
                        null, null, null, "values", 1));

        assertThat(sheet.getDrawingPatriarch().getCharts()).hasSize(1);
        assertThat(sheet.getDrawingPatriarch().getCharts().get(0).getChartSeries()).hasSize(1);
    }

    @Test
    void conditionalFormatsBecomeSheetRules() {
        Map<String, Object> between = new LinkedHashMap<>();
        between.put("type", "cell");
        between.put("criteria", "between");
        between.put("minimum", 1);
        between.put("maximum", "=$E$1");
        Map<String, Object> formula = new LinkedHashMap<>();
        formula.put("type", "formula");
        formula.put("criteria", "=$A$1>2");
        formula.put("format", Collections.singletonMap("bg_color", "yellow"));

        run(Ops.addConditionalFormat(between).withFormat(Style.of("bold", true, "font_color", "red"))
                .bottomRight(2, 1), Ops.addConditionalFormat(formula).topLeft(0, 3).bottomRight(4, 3));

        XSSFSheetConditionalFormatting cf = sheet.getSheetConditionalFormatting();
        assertThat(cf.getNumConditionalFormattings()).isEqualTo(2);

        XSSFConditionalFormatting first = cf.getConditionalFormattingAt(0);
        assertThat(first.getFormattingRanges()[0].formatAsString()).isEqualTo("A1:B3");
        XSSFConditionalFormattingRule range = first.getRule(0);
        assertThat(range.getComparisonOperation()).isEqualTo(ComparisonOperator.BETWEEN);
        assertThat(range.getFormula1()).isEqualTo("1");
        assertThat(range.getFormula2()).isEqualTo("$E$1");
        assertThat(range.getFontFormatting().isBold()).isTrue();

        XSSFConditionalFormatting second = cf.getConditionalFormattingAt(1);
        assertThat(second.getFormattingRanges()[0].formatAsString()).isEqualTo("D1:D5");
        XSSFConditionalFormattingRule byFormula = second.getRule(0);
        assertThat(byFormula.getConditionType()).isEqualTo(ConditionType.FORMULA);
        assertThat(byFormula.getFormula1()).isEqualTo("$A$1>2");
        assertThat(byFormula.getPatternFormatting()).isNotNull();
    }

    @Test
    void conditionalFormatsNeedAKnownType() {
        assertThatThrownBy(() -> run(Ops.addConditionalFormat(Collections.singletonMap("type", "icon_set"))))
                .isInstanceOf(ExecutionException.class).hasMessageContaining("INVALID_PARAMETER");
        assertThatThrownBy(() -> run(Ops.addConditionalFormat(Collections.singletonMap("criteria", ">"))))
                .isInstanceOf(ExecutionException.class).hasMessageContaining("INVALID_PARAMETER");
    }

    @Test
    void unknownStyleValuesFailTheSession() {
        assertThatThrownBy(() -> run(Ops.write("x").withStyle(Style.of("align", "sideways"))))
                .isInstanceOf(ExecutionException.class)
                .hasMessageContaining("Uncaught exception")
                .hasRootCauseInstanceOf(IllegalArgumentException.class);
        assertThat(PoiStyleFactory.color("navy").getRGB()).isEqualTo(new byte[] { 0, 0, (byte) 0x80 });
        assertThatThrownBy(() -> PoiStyleFactory.color("#12")).isInstanceOf(IllegalArgumentException.class);
    }
}
