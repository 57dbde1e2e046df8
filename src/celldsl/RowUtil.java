package celldsl;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;

public final class RowUtil {
    private RowUtil() {
    }

    public static Row getOrCreateRow(Sheet sheet, int rowNum) {
        Row row = sheet.getRow(rowNum);
        if (row == null) {
            row = sheet.createRow(rowNum);
        }
        return row;
    }

    public static Cell getOrCreateCell(Sheet sheet, Coords at) {
        Row row = getOrCreateRow(sheet, at.row);
        Cell cell = row.getCell(at.col);
        if (cell == null) {
            cell = row.createCell(at.col);
        }
        return cell;
    }
}
