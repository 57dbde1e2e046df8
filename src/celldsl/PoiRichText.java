package celldsl;

import java.util.List;

import org.apache.poi.xssf.usermodel.XSSFRichTextString;

final class PoiRichText {

    private PoiRichText() {
    }

    static int length(List<StyledText> runs) {
        int n = 0;
        for (StyledText run : runs) {
            n += run.text.length();
        }
        return n;
    }

    // Append each run at the end and apply its font to exactly that span
    static XSSFRichTextString build(List<StyledText> runs, PoiStyleFactory styles) {
        XSSFRichTextString rich = new XSSFRichTextString("");
        int pos = 0;
        for (StyledText run : runs) {
            if (run.text.isEmpty()) {
                continue;
            }
            int start = pos;
            rich.append(run.text);
            int end = start + run.text.length();
            rich.applyFont(start, end, styles.fontOf(run.style));
            pos = end;
        }
        return rich;
    }
}
