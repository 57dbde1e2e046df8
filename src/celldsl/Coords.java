package celldsl;

/**
 * Zero-based (row, column) pair. Ordering is row-major.
 */
public final class Coords implements Comparable<Coords> {

    // Excel limits: 2^20 rows, 2^14 columns
    public static final int MAX_ROWS = 1 << 20;
    public static final int MAX_COLS = 1 << 14;

    public static final Coords ORIGIN = new Coords(0, 0);

    public final int row;
    public final int col;

    public Coords(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public static Coords of(int row, int col) {
        return new Coords(row, col);
    }

    public Coords offset(int deltaRow, int deltaCol) {
        return new Coords(row + deltaRow, col + deltaCol);
    }

    public boolean isWithinSheet() {
        return row >= 0 && row < MAX_ROWS && col >= 0 && col < MAX_COLS;
    }

    @Override
    public int compareTo(Coords o) {
        if (row != o.row) {
            return Integer.compare(row, o.row);
        }
        return Integer.compare(col, o.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Coords))
            return false;
        Coords other = (Coords) o;
        return row == other.row && col == other.col;
    }

    @Override
    public int hashCode() {
        return 31 * row + col;
    }

    @Override
    public String toString() {
        return "(" + row + ", " + col + ")";
    }
}
