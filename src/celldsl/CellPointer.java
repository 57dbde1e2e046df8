package celldsl;

import java.util.Objects;

import org.apache.commons.lang3.Validate;

/**
 * Locates one corner of a range.
 *
 * <ul>
 * <li>{@link Named}: a bookmark, resolved once the whole stream has been walked.</li>
 * <li>{@link Relative}: positive n = n-th previously visited cell, negative n = n-th entry from the top of the
 * position stack (peeked), zero = current cell. Resolved while walking.</li>
 * <li>{@link Absolute}: a fixed cell.</li>
 * </ul>
 */
public abstract class CellPointer {

    public static final CellPointer CURRENT = new Relative(0);

    private CellPointer() {
    }

    public static CellPointer named(String name) {
        return new Named(name);
    }

    public static CellPointer relative(int n) {
        return n == 0 ? CURRENT : new Relative(n);
    }

    public static CellPointer absolute(int row, int col) {
        return new Absolute(Coords.of(row, col));
    }

    public static CellPointer absolute(Coords coords) {
        return new Absolute(coords);
    }

    public boolean isResolved() {
        return false;
    }

    /** Only valid on {@link Absolute} pointers. */
    public Coords coords() {
        throw new IllegalStateException("Unresolved cell pointer: " + this);
    }

    public static final class Named extends CellPointer {
        public final String name;

        Named(String name) {
            this.name = Validate.notNull(name, "name");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Named && ((Named) o).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return "'" + name + "'";
        }
    }

    public static final class Relative extends CellPointer {
        public final int n;

        Relative(int n) {
            this.n = n;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Relative && ((Relative) o).n == n;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(n);
        }

        @Override
        public String toString() {
            return Integer.toString(n);
        }
    }

    public static final class Absolute extends CellPointer {
        private final Coords coords;

        Absolute(Coords coords) {
            this.coords = Objects.requireNonNull(coords, "coords");
        }

        @Override
        public boolean isResolved() {
            return true;
        }

        @Override
        public Coords coords() {
            return coords;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Absolute && ((Absolute) o).coords.equals(coords);
        }

        @Override
        public int hashCode() {
            return coords.hashCode();
        }

        @Override
        public String toString() {
            return coords.toString();
        }
    }
}
