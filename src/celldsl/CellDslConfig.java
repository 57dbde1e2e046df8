package celldsl;

public final class CellDslConfig {
    public final String outPath;
    public final String sheetName;
    public final int initialRow;
    public final int initialCol;
    public final String fontName;
    public final int fontSize;
    public final String align;
    public final boolean overwritesOk;

    // defaults
    public static final String DEFAULT_OUT_PATH = "celldsl.xlsx";
    public static final String DEFAULT_SHEET_NAME = "Sheet1";
    public static final String DEFAULT_FONT_NAME = "Liberation Sans";
    public static final int DEFAULT_FONT_SIZE = 10;
    public static final String DEFAULT_ALIGN = "left";

    public CellDslConfig(String outPath, String sheetName, int initialRow, int initialCol, String fontName,
            int fontSize, String align, boolean overwritesOk) {
        this.outPath = outPath;
        this.sheetName = sheetName;
        this.initialRow = initialRow;
        this.initialCol = initialCol;
        this.fontName = fontName;
        this.fontSize = fontSize;
        this.align = align;
        this.overwritesOk = overwritesOk;
    }

    public static CellDslConfig defaults() {
        return new CellDslConfig(DEFAULT_OUT_PATH, DEFAULT_SHEET_NAME, 0, 0, DEFAULT_FONT_NAME, DEFAULT_FONT_SIZE,
                DEFAULT_ALIGN, false);
    }

    /**
     * Arguments, all optional: output path, sheet name, initial row, initial column, font name. Unparsable numbers
     * fall back to the defaults.
     */
    public static CellDslConfig load(String[] args) {
        if (args == null || args.length == 0) {
            return defaults();
        }
        String out = nonBlankOrDefault(args[0], DEFAULT_OUT_PATH);
        String sheet = (args.length >= 2) ? nonBlankOrDefault(args[1], DEFAULT_SHEET_NAME) : DEFAULT_SHEET_NAME;
        int row = (args.length >= 3) ? parseIntOrDefault(args[2], 0, Coords.MAX_ROWS) : 0;
        int col = (args.length >= 4) ? parseIntOrDefault(args[3], 0, Coords.MAX_COLS) : 0;
        String fontName = (args.length >= 5) ? nonBlankOrDefault(args[4], DEFAULT_FONT_NAME) : DEFAULT_FONT_NAME;

        return new CellDslConfig(out, sheet, row, col, fontName, DEFAULT_FONT_SIZE, DEFAULT_ALIGN, false);
    }

    public CellDslConfig withOverwritesOk(boolean ok) {
        return new CellDslConfig(outPath, sheetName, initialRow, initialCol, fontName, fontSize, align, ok);
    }

    public Coords start() {
        return Coords.of(initialRow, initialCol);
    }

    /** Base layer under every content style. */
    public Style defaultStyle() {
        return Style.of("font_name", fontName, "font_size", fontSize, "align", align);
    }

    private static String nonBlankOrDefault(String s, String defaultValue) {
        return (s == null || s.trim().isEmpty()) ? defaultValue : s.trim();
    }

    private static int parseIntOrDefault(String s, int defaultValue, int limit) {
        if (s == null || s.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            int v = Integer.parseInt(s.trim());
            return (v >= 0 && v < limit) ? v : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
