package celldsl;

import java.util.HashMap;
import java.util.Map;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.apache.poi.xssf.usermodel.extensions.XSSFCellBorder.BorderSide;

/**
 * Turns {@link Style} attribute maps into POI cell styles. Handles are cell style indexes of the workbook.
 *
 * <p>
 * Fonts are shared between cell styles with the same font attributes.
 * </p>
 */
public final class PoiStyleFactory implements StyleRegistrar {

    private static final String[] FONT_ATTRIBUTES = { "font_name", "font_size", "font_color", "bold", "italic",
            "underline", "font_strikeout", "font_script" };

    private static final Map<String, String> NAMED_COLORS = new HashMap<>();
    static {
        NAMED_COLORS.put("black", "000000");
        NAMED_COLORS.put("blue", "0000FF");
        NAMED_COLORS.put("brown", "800000");
        NAMED_COLORS.put("cyan", "00FFFF");
        NAMED_COLORS.put("gray", "808080");
        NAMED_COLORS.put("green", "008000");
        NAMED_COLORS.put("lime", "00FF00");
        NAMED_COLORS.put("magenta", "FF00FF");
        NAMED_COLORS.put("navy", "000080");
        NAMED_COLORS.put("orange", "FF6600");
        NAMED_COLORS.put("pink", "FF00FF");
        NAMED_COLORS.put("purple", "800080");
        NAMED_COLORS.put("red", "FF0000");
        NAMED_COLORS.put("silver", "C0C0C0");
        NAMED_COLORS.put("white", "FFFFFF");
        NAMED_COLORS.put("yellow", "FFFF00");
    }

    private final XSSFWorkbook wb;
    private final Map<Style, XSSFFont> fonts = new HashMap<>();

    public PoiStyleFactory(XSSFWorkbook wb) {
        this.wb = wb;
    }

    @Override
    public StyleHandle register(Style style) {
        XSSFCellStyle cs = wb.createCellStyle();
        cs.setFont(font(style));

        if (style.has("num_format")) {
            Object fmt = style.get("num_format");
            if (fmt instanceof Number) {
                cs.setDataFormat(((Number) fmt).shortValue());
            } else {
                cs.setDataFormat(wb.createDataFormat().getFormat(fmt.toString()));
            }
        }
        if (style.has("align")) {
            cs.setAlignment(horizontal(style.getString("align")));
        }
        if (style.has("valign")) {
            cs.setVerticalAlignment(vertical(style.getString("valign")));
        }
        if (style.has("rotation")) {
            int rotation = style.getInt("rotation", 0);
            // 270 is stacked text
            cs.setRotation((short) (rotation == 270 ? 255 : rotation));
        }
        cs.setWrapText(style.getBoolean("text_wrap"));
        if (style.has("locked")) {
            cs.setLocked(style.getBoolean("locked"));
        }
        if (style.has("bg_color")) {
            cs.setFillForegroundColor(color(style.getString("bg_color")));
            cs.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        }

        border(cs, style, "top", BorderSide.TOP);
        border(cs, style, "bottom", BorderSide.BOTTOM);
        border(cs, style, "left", BorderSide.LEFT);
        border(cs, style, "right", BorderSide.RIGHT);

        return new StyleHandle(cs.getIndex());
    }

    public XSSFCellStyle cellStyle(StyleHandle handle) {
        return wb.getCellStyleAt(handle.id());
    }

    public XSSFFont fontOf(StyleHandle handle) {
        return cellStyle(handle).getFont();
    }

    private XSSFFont font(Style style) {
        Style key = Style.EMPTY;
        for (String name : FONT_ATTRIBUTES) {
            if (style.has(name)) {
                key = key.with(name, style.get(name));
            }
        }
        XSSFFont cached = fonts.get(key);
        if (cached != null) {
            return cached;
        }

        XSSFFont f = wb.createFont();
        if (key.has("font_name")) {
            f.setFontName(key.getString("font_name"));
        }
        if (key.has("font_size")) {
            f.setFontHeight(key.getDouble("font_size", XSSFFont.DEFAULT_FONT_SIZE));
        }
        if (key.has("font_color")) {
            f.setColor(color(key.getString("font_color")));
        }
        f.setBold(key.getBoolean("bold"));
        f.setItalic(key.getBoolean("italic"));
        f.setStrikeout(key.getBoolean("font_strikeout"));
        if (key.has("underline")) {
            f.setUnderline(underline(key.get("underline")));
        }
        switch (key.getInt("font_script", 0)) {
        case 1:
            f.setTypeOffset(Font.SS_SUPER);
            break;
        case 2:
            f.setTypeOffset(Font.SS_SUB);
            break;
        default:
            break;
        }

        fonts.put(key, f);
        return f;
    }

    private static byte underline(Object v) {
        if (v instanceof Boolean) {
            return ((Boolean) v) ? Font.U_SINGLE : Font.U_NONE;
        }
        int code = (v instanceof Number) ? ((Number) v).intValue() : 1;
        switch (code) {
        case 0:
            return Font.U_NONE;
        case 2:
            return Font.U_DOUBLE;
        case 33:
            return Font.U_SINGLE_ACCOUNTING;
        case 34:
            return Font.U_DOUBLE_ACCOUNTING;
        default:
            return Font.U_SINGLE;
        }
    }

    private void border(XSSFCellStyle cs, Style style, String side, BorderSide poiSide) {
        if (!style.has(side)) {
            return;
        }
        BorderStyle b = BorderStyle.valueOf((short) style.getInt(side, 0));
        switch (poiSide) {
        case TOP:
            cs.setBorderTop(b);
            break;
        case BOTTOM:
            cs.setBorderBottom(b);
            break;
        case LEFT:
            cs.setBorderLeft(b);
            break;
        case RIGHT:
            cs.setBorderRight(b);
            break;
        default:
            throw new AssertionError("Unhandled border side: " + poiSide);
        }
        String c = style.has(side + "_color") ? style.getString(side + "_color") : style.getString("border_color");
        if (c != null) {
            cs.setBorderColor(poiSide, color(c));
        }
    }

    static HorizontalAlignment horizontal(String align) {
        switch (align) {
        case "left":
            return HorizontalAlignment.LEFT;
        case "center":
            return HorizontalAlignment.CENTER;
        case "right":
            return HorizontalAlignment.RIGHT;
        case "fill":
            return HorizontalAlignment.FILL;
        case "justify":
            return HorizontalAlignment.JUSTIFY;
        case "center_across":
            return HorizontalAlignment.CENTER_SELECTION;
        case "distributed":
            return HorizontalAlignment.DISTRIBUTED;
        default:
            throw new IllegalArgumentException("Unknown align: " + align);
        }
    }

    static VerticalAlignment vertical(String valign) {
        switch (valign) {
        case "top":
            return VerticalAlignment.TOP;
        case "vcenter":
            return VerticalAlignment.CENTER;
        case "bottom":
            return VerticalAlignment.BOTTOM;
        case "vjustify":
            return VerticalAlignment.JUSTIFY;
        case "vdistributed":
            return VerticalAlignment.DISTRIBUTED;
        default:
            throw new IllegalArgumentException("Unknown valign: " + valign);
        }
    }

    // "#RRGGBB" or one of the named colors
    static XSSFColor color(String spec) {
        String hex = spec.startsWith("#") ? spec.substring(1) : NAMED_COLORS.get(spec.toLowerCase());
        if (hex == null || hex.length() != 6) {
            throw new IllegalArgumentException("Unknown color: " + spec);
        }
        byte[] rgb = new byte[3];
        for (int i = 0; i < 3; i++) {
            rgb[i] = (byte) Integer.parseInt(hex.substring(i * 2, i * 2 + 2), 16);
        }
        return new XSSFColor(rgb, null);
    }
}
