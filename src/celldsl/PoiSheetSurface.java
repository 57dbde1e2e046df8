package celldsl;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Calendar;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;

import org.apache.poi.common.usermodel.HyperlinkType;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.formula.FormulaParseException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.ClientAnchor;
import org.apache.poi.ss.usermodel.Comment;
import org.apache.poi.ss.usermodel.CreationHelper;
import org.apache.poi.ss.usermodel.Hyperlink;
import org.apache.poi.ss.usermodel.Name;
import org.apache.poi.ss.usermodel.Picture;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFDrawing;
import org.apache.poi.xssf.usermodel.XSSFRichTextString;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link OutputSurface} on one sheet of an {@link XSSFWorkbook}.
 */
public final class PoiSheetSurface implements OutputSurface {
    private static final Logger LOG = LoggerFactory.getLogger(PoiSheetSurface.class);

    static final int MAX_STRING_LENGTH = SpreadsheetVersion.EXCEL2007.getMaxTextLength();
    static final int MAX_URL_LENGTH = 2079;
    static final int MAX_HYPERLINKS = 65530;
    static final double MAX_COLUMN_WIDTH = 255;

    private static final int DEFAULT_COMMENT_WIDTH = 2;
    private static final int DEFAULT_COMMENT_HEIGHT = 4;

    private final XSSFSheet sheet;
    private final XSSFWorkbook wb;
    private final PoiStyleFactory styles;

    public PoiSheetSurface(XSSFSheet sheet, PoiStyleFactory styles) {
        this.sheet = sheet;
        this.wb = sheet.getWorkbook();
        this.styles = styles;
    }

    public XSSFSheet sheet() {
        return sheet;
    }

    @Override
    public String sheetName() {
        return sheet.getSheetName();
    }

    @Override
    public SurfaceResult write(Coords at, Object data, DataKind kind, StyleHandle style) {
        Cell cell = RowUtil.getOrCreateCell(sheet, at);
        cell.setCellStyle(styles.cellStyle(style));

        switch (kind) {
        case BLANK:
            cell.setBlank();
            return SurfaceResult.OK;
        case NUMBER:
            return writeNumber(cell, data);
        case STRING:
            return writeString(cell, data == null ? "" : data.toString());
        case FORMULA:
            return writeFormula(cell, String.valueOf(data));
        case DATETIME:
            return writeDatetime(cell, data);
        case BOOLEAN:
            if (data instanceof Boolean) {
                cell.setCellValue((Boolean) data);
                return SurfaceResult.OK;
            }
            String s = String.valueOf(data).trim().toLowerCase(Locale.ROOT);
            if (!s.equals("true") && !s.equals("false")) {
                return SurfaceResult.INVALID_PARAMETER;
            }
            cell.setCellValue(Boolean.parseBoolean(s));
            return SurfaceResult.OK;
        case URL:
            return writeUrl(cell, String.valueOf(data));
        default:
            throw new AssertionError("Unhandled data kind: " + kind);
        }
    }

    private static SurfaceResult writeNumber(Cell cell, Object data) {
        if (data instanceof Number) {
            cell.setCellValue(((Number) data).doubleValue());
            return SurfaceResult.OK;
        }
        try {
            cell.setCellValue(Double.parseDouble(String.valueOf(data).trim()));
            return SurfaceResult.OK;
        } catch (NumberFormatException e) {
            LOG.debug("Not a number: {}", data, e);
            return SurfaceResult.INVALID_PARAMETER;
        }
    }

    private static SurfaceResult writeString(Cell cell, String s) {
        if (s.length() > MAX_STRING_LENGTH) {
            return SurfaceResult.CONTENT_LENGTH_EXCEEDED;
        }
        cell.setCellValue(s);
        return SurfaceResult.OK;
    }

    private static SurfaceResult writeFormula(Cell cell, String formula) {
        String f = formula.startsWith("=") ? formula.substring(1) : formula;
        try {
            cell.setCellFormula(f);
            return SurfaceResult.OK;
        } catch (FormulaParseException e) {
            LOG.debug("Formula {} does not parse", formula, e);
            return SurfaceResult.INVALID_PARAMETER;
        }
    }

    private static SurfaceResult writeDatetime(Cell cell, Object data) {
        if (data instanceof Date) {
            cell.setCellValue((Date) data);
        } else if (data instanceof Calendar) {
            cell.setCellValue((Calendar) data);
        } else if (data instanceof LocalDateTime) {
            cell.setCellValue((LocalDateTime) data);
        } else if (data instanceof LocalDate) {
            cell.setCellValue((LocalDate) data);
        } else {
            return SurfaceResult.INVALID_PARAMETER;
        }
        return SurfaceResult.OK;
    }

    private SurfaceResult writeUrl(Cell cell, String url) {
        if (url.length() > MAX_URL_LENGTH) {
            return SurfaceResult.CONTENT_LENGTH_EXCEEDED;
        }
        if (sheet.getHyperlinkList().size() >= MAX_HYPERLINKS) {
            return SurfaceResult.REFERENCE_COUNT_EXCEEDED;
        }
        Hyperlink link = wb.getCreationHelper().createHyperlink(HyperlinkType.URL);
        try {
            link.setAddress(url);
        } catch (IllegalArgumentException e) {
            LOG.debug("Bad URL {}", url, e);
            return SurfaceResult.INVALID_PARAMETER;
        }
        cell.setCellValue(url);
        cell.setHyperlink(link);
        return SurfaceResult.OK;
    }

    @Override
    public SurfaceResult mergeWrite(Coords at, int width, Object data, DataKind kind, StyleHandle style) {
        SurfaceResult r = write(at, data, kind, style);
        if (!r.isOk() || width == 0) {
            return r;
        }
        // covered cells carry the style too, or their borders are lost
        for (int c = at.col + 1; c <= at.col + width; c++) {
            RowUtil.getOrCreateCell(sheet, Coords.of(at.row, c)).setCellStyle(styles.cellStyle(style));
        }
        try {
            sheet.addMergedRegion(new CellRangeAddress(at.row, at.row, at.col, at.col + width));
        } catch (IllegalStateException | IllegalArgumentException e) {
            LOG.debug("Merge at {} width {} rejected", at, width, e);
            return SurfaceResult.INVALID_PARAMETER;
        }
        return SurfaceResult.OK;
    }

    @Override
    public SurfaceResult writeRich(Coords at, List<StyledText> runs, StyleHandle cellStyle) {
        if (PoiRichText.length(runs) > MAX_STRING_LENGTH) {
            return SurfaceResult.CONTENT_LENGTH_EXCEEDED;
        }
        XSSFRichTextString rich = PoiRichText.build(runs, styles);
        Cell cell = RowUtil.getOrCreateCell(sheet, at);
        cell.setCellStyle(styles.cellStyle(cellStyle));
        cell.setCellValue(rich);
        return SurfaceResult.OK;
    }

    @Override
    public SurfaceResult defineName(String name, Coords topLeft, Coords bottomRight) {
        try {
            Name n = wb.createName();
            n.setNameName(name);
            n.setRefersToFormula(ReferenceResolver.address(topLeft, bottomRight, sheetName()));
            return SurfaceResult.OK;
        } catch (IllegalArgumentException e) {
            LOG.debug("Name {} rejected", name, e);
            return SurfaceResult.INVALID_PARAMETER;
        }
    }

    @Override
    public SurfaceResult addConditionalFormat(Coords topLeft, Coords bottomRight, Map<String, Object> options,
            Style format) {
        return PoiConditionalFormat.add(sheet, topLeft, bottomRight, options, format);
    }

    @Override
    public SurfaceResult setRowHeight(int row, double points) {
        RowUtil.getOrCreateRow(sheet, row).setHeightInPoints((float) points);
        return SurfaceResult.OK;
    }

    @Override
    public SurfaceResult setColWidth(int col, double characters) {
        if (characters > MAX_COLUMN_WIDTH) {
            return SurfaceResult.INVALID_PARAMETER;
        }
        sheet.setColumnWidth(col, (int) Math.round(characters * 256));
        return SurfaceResult.OK;
    }

    @Override
    public SurfaceResult setPageBreaks(SortedSet<Integer> rows, SortedSet<Integer> cols) {
        for (int r : sheet.getRowBreaks()) {
            sheet.removeRowBreak(r);
        }
        for (int c : sheet.getColumnBreaks()) {
            sheet.removeColumnBreak(c);
        }
        for (int r : rows) {
            sheet.setRowBreak(r);
        }
        for (int c : cols) {
            sheet.setColumnBreak(c);
        }
        return SurfaceResult.OK;
    }

    @Override
    public SurfaceResult addComment(Coords at, String text, Map<String, Object> options) {
        if (text.length() > MAX_STRING_LENGTH) {
            return SurfaceResult.CONTENT_LENGTH_EXCEEDED;
        }
        CreationHelper helper = wb.getCreationHelper();
        XSSFDrawing drawing = sheet.createDrawingPatriarch();

        ClientAnchor anchor = helper.createClientAnchor();
        anchor.setCol1(at.col + 1);
        anchor.setCol2(at.col + 1 + intOption(options, "width", DEFAULT_COMMENT_WIDTH));
        anchor.setRow1(at.row);
        anchor.setRow2(at.row + intOption(options, "height", DEFAULT_COMMENT_HEIGHT));

        Cell cell = RowUtil.getOrCreateCell(sheet, at);
        try {
            Comment comment = drawing.createCellComment(anchor);
            comment.setString(helper.createRichTextString(text));
            if (options.get("author") != null) {
                comment.setAuthor(options.get("author").toString());
            }
            comment.setVisible(Boolean.TRUE.equals(options.get("visible")));
            cell.setCellComment(comment);
        } catch (IllegalArgumentException e) {
            LOG.debug("Comment at {} rejected", at, e);
            return SurfaceResult.INVALID_PARAMETER;
        }
        return SurfaceResult.OK;
    }

    @Override
    public SurfaceResult addImage(Coords at, String filePath, byte[] data, Map<String, Object> options) {
        byte[] bytes = data;
        int type = Workbook.PICTURE_TYPE_PNG;
        if (filePath != null) {
            type = pictureType(filePath);
            if (type < 0) {
                return SurfaceResult.INVALID_PARAMETER;
            }
            try {
                bytes = Files.readAllBytes(Paths.get(filePath));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read image " + filePath, e);
            }
        }
        if (bytes == null) {
            return SurfaceResult.INVALID_PARAMETER;
        }

        int idx = wb.addPicture(bytes, type);
        ClientAnchor anchor = wb.getCreationHelper().createClientAnchor();
        anchor.setCol1(at.col);
        anchor.setRow1(at.row);
        Picture pic = sheet.createDrawingPatriarch().createPicture(anchor, idx);
        pic.resize(doubleOption(options, "x_scale", 1.0), doubleOption(options, "y_scale", 1.0));
        return SurfaceResult.OK;
    }

    @Override
    public SurfaceResult addChart(Coords at, ChartSpec chart) {
        return PoiChartWriter.draw(sheet, at, chart);
    }

    private static int pictureType(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".png")) {
            return Workbook.PICTURE_TYPE_PNG;
        }
        if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) {
            return Workbook.PICTURE_TYPE_JPEG;
        }
        if (lower.endsWith(".gif")) {
            return XSSFWorkbook.PICTURE_TYPE_GIF;
        }
        return -1;
    }

    private static int intOption(Map<String, Object> options, String name, int defaultValue) {
        Object v = options.get(name);
        return (v instanceof Number) ? ((Number) v).intValue() : defaultValue;
    }

    private static double doubleOption(Map<String, Object> options, String name, double defaultValue) {
        Object v = options.get(name);
        return (v instanceof Number) ? ((Number) v).doubleValue() : defaultValue;
    }
}
