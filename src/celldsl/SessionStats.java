package celldsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a session did: where it started, every executed placement, the bookmarks and any warnings. The first
 * placement is an implicit entry at the starting cell with no command.
 */
public final class SessionStats {
    public final Coords initial;
    private final List<Placement> placements;
    private final Map<String, Coords> bookmarks;
    private final List<String> warnings;

    SessionStats(Coords initial, List<Placement> executed, Map<String, Coords> bookmarks, List<String> warnings) {
        this.initial = initial;
        List<Placement> all = new ArrayList<>(executed.size() + 1);
        all.add(new Placement(initial, null));
        all.addAll(executed);
        this.placements = Collections.unmodifiableList(all);
        this.bookmarks = Collections.unmodifiableMap(new LinkedHashMap<>(bookmarks));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public List<Placement> placements() {
        return placements;
    }

    public Map<String, Coords> bookmarks() {
        return bookmarks;
    }

    public List<String> warnings() {
        return warnings;
    }

    /** Nothing but the implicit starting entry. */
    public boolean isNull() {
        return placements.size() < 2;
    }

    public int maxRow() {
        int max = Integer.MIN_VALUE;
        for (Placement p : placements) {
            max = Math.max(max, p.coords.row);
        }
        return max;
    }

    public int maxCol() {
        int max = Integer.MIN_VALUE;
        for (Placement p : placements) {
            max = Math.max(max, p.coords.col);
        }
        return max;
    }

    public int maxRowAtMaxCol() {
        int maxCol = maxCol();
        int max = Integer.MIN_VALUE;
        for (Placement p : placements) {
            if (p.coords.col == maxCol) {
                max = Math.max(max, p.coords.row);
            }
        }
        return max;
    }

    public int maxColAtMaxRow() {
        int maxRow = maxRow();
        int max = Integer.MIN_VALUE;
        for (Placement p : placements) {
            if (p.coords.row == maxRow) {
                max = Math.max(max, p.coords.col);
            }
        }
        return max;
    }

    public Coords maxCoords() {
        return Coords.of(maxRow(), maxCol());
    }
}
