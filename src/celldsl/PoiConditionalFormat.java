package celldsl;

import java.util.Locale;
import java.util.Map;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.ComparisonOperator;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.PatternFormatting;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFBorderFormatting;
import org.apache.poi.xssf.usermodel.XSSFConditionalFormattingRule;
import org.apache.poi.xssf.usermodel.XSSFFontFormatting;
import org.apache.poi.xssf.usermodel.XSSFPatternFormatting;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFSheetConditionalFormatting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class PoiConditionalFormat {
    private static final Logger LOG = LoggerFactory.getLogger(PoiConditionalFormat.class);

    private PoiConditionalFormat() {
    }

    static SurfaceResult add(XSSFSheet sheet, Coords topLeft, Coords bottomRight, Map<String, Object> options,
            Style format) {
        XSSFSheetConditionalFormatting cf = sheet.getSheetConditionalFormatting();
        XSSFConditionalFormattingRule rule;
        try {
            rule = rule(cf, options);
            if (format != null) {
                font(rule, format);
                fill(rule, format);
                border(rule, format);
            }
        } catch (IllegalArgumentException e) {
            LOG.debug("Conditional format {} rejected", options, e);
            return SurfaceResult.INVALID_PARAMETER;
        }
        CellRangeAddress region = new CellRangeAddress(topLeft.row, bottomRight.row, topLeft.col, bottomRight.col);
        cf.addConditionalFormatting(new CellRangeAddress[] { region }, rule);
        return SurfaceResult.OK;
    }

    private static XSSFConditionalFormattingRule rule(XSSFSheetConditionalFormatting cf, Map<String, Object> options) {
        Object type = options.get("type");
        if (type == null) {
            throw new IllegalArgumentException("A conditional format needs a type");
        }
        switch (type.toString()) {
        case "cell": {
            byte op = operator(String.valueOf(options.get("criteria")));
            if (op == ComparisonOperator.BETWEEN || op == ComparisonOperator.NOT_BETWEEN) {
                return cf.createConditionalFormattingRule(op, formula(options, "minimum"),
                        formula(options, "maximum"));
            }
            return cf.createConditionalFormattingRule(op, formula(options, "value"));
        }
        case "formula":
            return cf.createConditionalFormattingRule(formula(options, "criteria"));
        default:
            throw new IllegalArgumentException("Unknown conditional format type: " + type);
        }
    }

    private static byte operator(String criteria) {
        switch (criteria.toLowerCase(Locale.ROOT)) {
        case "between":
            return ComparisonOperator.BETWEEN;
        case "not between":
            return ComparisonOperator.NOT_BETWEEN;
        case "equal to":
        case "==":
        case "=":
            return ComparisonOperator.EQUAL;
        case "not equal to":
        case "!=":
        case "<>":
            return ComparisonOperator.NOT_EQUAL;
        case "greater than":
        case ">":
            return ComparisonOperator.GT;
        case "less than":
        case "<":
            return ComparisonOperator.LT;
        case "greater than or equal to":
        case ">=":
            return ComparisonOperator.GE;
        case "less than or equal to":
        case "<=":
            return ComparisonOperator.LE;
        default:
            throw new IllegalArgumentException("Unknown criteria: " + criteria);
        }
    }

    // numbers as they are, strings without their leading '='
    private static String formula(Map<String, Object> options, String name) {
        Object v = options.get(name);
        if (v == null) {
            throw new IllegalArgumentException("Conditional format option " + name + " is missing");
        }
        String s = v.toString();
        return s.startsWith("=") ? s.substring(1) : s;
    }

    private static void font(XSSFConditionalFormattingRule rule, Style format) {
        if (!format.has("bold") && !format.has("italic") && !format.has("font_color") && !format.has("underline")
                && !format.has("font_strikeout") && !format.has("font_size")) {
            return;
        }
        XSSFFontFormatting f = rule.createFontFormatting();
        f.setFontStyle(format.getBoolean("italic"), format.getBoolean("bold"));
        if (format.has("font_color")) {
            f.setFontColor(PoiStyleFactory.color(format.getString("font_color")));
        }
        if (format.has("underline")) {
            f.setUnderlineType(format.getBoolean("underline") ? Font.U_SINGLE : Font.U_NONE);
        }
        if (format.has("font_strikeout")) {
            f.setStrikeout(format.getBoolean("font_strikeout"));
        }
        if (format.has("font_size")) {
            // twips
            f.setFontHeight((int) Math.round(format.getDouble("font_size", 0) * 20));
        }
    }

    private static void fill(XSSFConditionalFormattingRule rule, Style format) {
        if (!format.has("bg_color")) {
            return;
        }
        XSSFPatternFormatting p = rule.createPatternFormatting();
        p.setFillBackgroundColor(PoiStyleFactory.color(format.getString("bg_color")));
        p.setFillPattern(PatternFormatting.SOLID_FOREGROUND);
    }

    private static void border(XSSFConditionalFormattingRule rule, Style format) {
        if (!format.has("top") && !format.has("bottom") && !format.has("left") && !format.has("right")) {
            return;
        }
        XSSFBorderFormatting b = rule.createBorderFormatting();
        if (format.has("top")) {
            b.setBorderTop(BorderStyle.valueOf((short) format.getInt("top", 0)));
        }
        if (format.has("bottom")) {
            b.setBorderBottom(BorderStyle.valueOf((short) format.getInt("bottom", 0)));
        }
        if (format.has("left")) {
            b.setBorderLeft(BorderStyle.valueOf((short) format.getInt("left", 0)));
        }
        if (format.has("right")) {
            b.setBorderRight(BorderStyle.valueOf((short) format.getInt("right", 0)));
        }
    }
}
