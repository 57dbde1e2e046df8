package celldsl;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Calendar;
import java.util.Date;

/**
 * Explicit cell value kind for writes. Without one the kind is inferred from the Java value.
 */
public enum DataKind {
    NUMBER,
    STRING,
    BLANK,
    FORMULA,
    DATETIME,
    BOOLEAN,
    URL;

    static DataKind infer(Object data) {
        if (data == null)
            return BLANK;
        if (data instanceof Number)
            return NUMBER;
        if (data instanceof Boolean)
            return BOOLEAN;
        if (data instanceof Date || data instanceof Calendar || data instanceof LocalDate
                || data instanceof LocalDateTime)
            return DATETIME;
        String s = data.toString();
        if (s.startsWith("=") && s.length() > 1)
            return FORMULA;
        return STRING;
    }
}
