package celldsl;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * Ties an {@link XSSFWorkbook} to one style cache and hands out a {@link SheetTarget} per sheet. Asking twice for
 * the same sheet returns the same target, so page breaks accumulate across sessions.
 */
public final class WorkbookBinding implements AutoCloseable {
    private final XSSFWorkbook workbook;
    private final PoiStyleFactory styleFactory;
    private final StyleCache styles;
    private final Map<String, SheetTarget> targets = new HashMap<>();

    public WorkbookBinding() {
        this(new XSSFWorkbook());
    }

    public WorkbookBinding(XSSFWorkbook workbook) {
        this.workbook = workbook;
        this.styleFactory = new PoiStyleFactory(workbook);
        this.styles = new StyleCache(styleFactory);
    }

    public XSSFWorkbook workbook() {
        return workbook;
    }

    public StyleCache styles() {
        return styles;
    }

    public SheetTarget sheet(String name) {
        SheetTarget t = targets.get(name);
        if (t == null) {
            XSSFSheet sheet = workbook.getSheet(name);
            if (sheet == null) {
                sheet = workbook.createSheet(name);
            }
            t = new SheetTarget(new PoiSheetSurface(sheet, styleFactory), styles);
            targets.put(name, t);
        }
        return t;
    }

    public void write(Path out) throws IOException {
        try (OutputStream os = Files.newOutputStream(out)) {
            workbook.write(os);
        }
    }

    @Override
    public void close() throws IOException {
        workbook.close();
    }
}
