package celldsl;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Predefined styles. Compose with {@link Style#merge(Style)}.
 */
public final class Styles {
    private Styles() {
    }

    public static final Style BASE = Style.EMPTY;

    public static final Style DEFAULT_FONT_NAME = Style.of("font_name", "Liberation Sans");
    public static final Style DEFAULT_FONT_SIZE = Style.of("font_size", 10);
    public static final Style DEFAULT_HEADER_SIZE = Style.of("font_size", 18);

    // ---------------- number formats ----------------
    public static final Style PERCENT = Style.of("num_format", "0.0%");
    public static final Style REGULAR_FLOAT = Style.of("num_format", "0.00");
    public static final Style FLOAT_WITH_RED = Style.of("num_format", "0.00;[RED]-0.00");
    public static final Style PERCENT_WITH_RED = Style.of("num_format", "0.0%;[RED]-0.0%");

    // ---------------- alignment ----------------
    public static final Style LEFT = Style.of("align", "left");
    public static final Style CENTER = Style.of("align", "center", "valign", "vcenter");
    public static final Style RIGHT = Style.of("align", "right");
    public static final Style FILL = Style.of("align", "fill");
    public static final Style JUSTIFY = Style.of("align", "justify");
    public static final Style CENTER_ACROSS = Style.of("align", "center_across");
    public static final Style DISTRIBUTED = Style.of("align", "distributed");

    public static final Style VBOTTOM = Style.of("valign", "bottom");
    public static final Style VTOP = Style.of("valign", "top");
    public static final Style VCENTER = Style.of("valign", "vcenter");
    public static final Style VJUSTIFY = Style.of("valign", "vjustify");
    public static final Style VDISTRIBUTED = Style.of("valign", "vdistributed");

    public static final Style ROTATED_0 = Style.of("rotation", 0);
    public static final Style ROTATED_90 = Style.of("rotation", 90);
    public static final Style ROTATED_180 = Style.of("rotation", 270);
    public static final Style ROTATED_270 = Style.of("rotation", -90);

    public static final Style WRAPPED = Style.of("text_wrap", true);

    // ---------------- font decoration ----------------
    public static final Style BOLD = Style.of("bold", true);
    public static final Style ITALIC = Style.of("italic", true);
    public static final Style UNDERLINE = Style.of("underline", true);
    public static final Style STRIKEOUT = Style.of("font_strikeout", true);
    public static final Style SUPERSCRIPT = Style.of("font_script", 1);
    public static final Style SUBSCRIPT = Style.of("font_script", 2);

    // ---------------- composed defaults ----------------
    public static final Style DEFAULT_FONT = DEFAULT_FONT_NAME.merge(DEFAULT_FONT_SIZE).merge(LEFT);
    public static final Style DEFAULT_FONT_BOLD = DEFAULT_FONT.merge(BOLD);
    public static final Style DEFAULT_HEADER = DEFAULT_FONT_BOLD.merge(DEFAULT_HEADER_SIZE);
    public static final Style DEFAULT_PERCENT = DEFAULT_FONT.merge(PERCENT).merge(CENTER);
    public static final Style DEFAULT_PERCENT_BOLD = DEFAULT_PERCENT.merge(BOLD);

    public static final Style DEFAULT_FONT_CENTERED = DEFAULT_FONT.merge(CENTER);
    public static final Style DEFAULT_FONT_BOLD_CENTERED = DEFAULT_FONT_BOLD.merge(CENTER);

    public static final Style DEFAULT_TABLE_ROW_FONT = DEFAULT_FONT_BOLD_CENTERED.merge(WRAPPED);
    public static final Style DEFAULT_TABLE_COLUMN_FONT = DEFAULT_FONT_BOLD_CENTERED.merge(ROTATED_90).merge(VBOTTOM);

    // ---------------- borders ----------------
    public static final Style LEFT_BORDER = Style.of("left", 1);
    public static final Style TOP_BORDER = Style.of("top", 1);
    public static final Style RIGHT_BORDER = Style.of("right", 1);
    public static final Style BOTTOM_BORDER = Style.of("bottom", 1);
    public static final Style HIGHLIGHT_BORDER = LEFT_BORDER.merge(TOP_BORDER).merge(RIGHT_BORDER).merge(BOTTOM_BORDER);

    /**
     * Names of constants sharing the same content, grouped. Empty when every constant is distinct.
     */
    static List<List<String>> duplicates() {
        Map<Style, List<String>> byContent = new HashMap<>();
        for (Field f : Styles.class.getDeclaredFields()) {
            int mod = f.getModifiers();
            if (!Modifier.isStatic(mod) || f.getType() != Style.class) {
                continue;
            }
            try {
                Style s = (Style) f.get(null);
                byContent.computeIfAbsent(s, k -> new ArrayList<>()).add(f.getName());
            } catch (IllegalAccessException e) {
                throw new IllegalStateException(e);
            }
        }
        List<List<String>> out = new ArrayList<>();
        for (List<String> names : byContent.values()) {
            if (names.size() > 1) {
                out.add(names);
            }
        }
        return out;
    }
}
