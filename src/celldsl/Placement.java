package celldsl;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class Placement implements Comparable<Placement> {
    public final Coords coords;
    // null only for the implicit starting entry of SessionStats
    public final Command command;

    final int actionIndex;
    final List<String> sections;

    Placement(Coords coords, CellAction action) {
        this.coords = coords;
        this.command = action == null ? null : action.command;
        this.actionIndex = action == null ? -1 : action.actionIndex;
        this.sections = action == null ? Collections.<String>emptyList() : action.sections;
    }

    // Row-major; ties keep insertion order when sorted with a stable sort
    @Override
    public int compareTo(Placement o) {
        return coords.compareTo(o.coords);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Placement))
            return false;
        Placement other = (Placement) o;
        return coords.equals(other.coords) && Objects.equals(command, other.command);
    }

    @Override
    public int hashCode() {
        return Objects.hash(coords, command);
    }

    @Override
    public String toString() {
        return coords + " " + command;
    }
}
