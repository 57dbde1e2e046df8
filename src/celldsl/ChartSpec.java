package celldsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A chart after its operations have been replayed: forward references are replaced by addresses, the rest is
 * plain data for the surface to draw.
 */
public final class ChartSpec {

    // range values are address strings
    public static final class Series {
        public final Map<String, Object> options;

        Series(Map<String, Object> options) {
            this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
        }

        public String name() {
            Object v = options.get("name");
            return v == null ? null : v.toString();
        }

        public String categories() {
            Object v = options.get("categories");
            return v == null ? null : v.toString();
        }

        public String values() {
            Object v = options.get("values");
            return v == null ? null : v.toString();
        }

        @Override
        public String toString() {
            return "Series" + options;
        }
    }

    public final Command.AddChart.Kind kind;
    public final String subtype;

    String title;
    String legendPosition;
    Boolean varyColors;
    String blanksAs;
    Boolean showHiddenData;
    final List<Series> series = new ArrayList<>();
    final List<ChartSpec> combined = new ArrayList<>();

    ChartSpec(Command.AddChart.Kind kind, String subtype) {
        this.kind = kind;
        this.subtype = subtype;
    }

    public String title() {
        return title;
    }

    public String legendPosition() {
        return legendPosition;
    }

    public Boolean varyColors() {
        return varyColors;
    }

    public String blanksAs() {
        return blanksAs;
    }

    public Boolean showHiddenData() {
        return showHiddenData;
    }

    public List<Series> series() {
        return Collections.unmodifiableList(series);
    }

    public List<ChartSpec> combined() {
        return Collections.unmodifiableList(combined);
    }

    @Override
    public String toString() {
        return "ChartSpec(" + kind + (subtype == null ? "" : "/" + subtype) + ", title=" + title + ", " + series
                + (combined.isEmpty() ? "" : ", combined=" + combined) + ")";
    }
}
