package celldsl;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.apache.commons.lang3.Validate;

/**
 * Immutable set of style attributes (attribute name -> value).
 *
 * <p>
 * Attribute names are the ones understood by {@link PoiStyleFactory}: {@code font_name},
 * {@code font_size}, {@code font_color}, {@code bold}, {@code italic}, {@code underline}, {@code font_strikeout},
 * {@code font_script}, {@code num_format}, {@code align}, {@code valign}, {@code rotation}, {@code text_wrap},
 * {@code bg_color}, {@code left}, {@code right}, {@code top}, {@code bottom}, {@code border_color}.
 * </p>
 *
 * Equality and hash are by content, so two compositions with the same attributes are interchangeable.
 */
public final class Style {

    public static final Style EMPTY = new Style(new TreeMap<String, Object>());

    private final Map<String, Object> attributes;

    private Style(TreeMap<String, Object> attributes) {
        this.attributes = Collections.unmodifiableMap(attributes);
    }

    public static Style of(String name, Object value) {
        TreeMap<String, Object> m = new TreeMap<>();
        m.put(Validate.notNull(name, "name"), normalize(value));
        return new Style(m);
    }

    public static Style of(Map<String, ?> attributes) {
        Validate.notNull(attributes, "attributes");
        TreeMap<String, Object> m = new TreeMap<>();
        for (Map.Entry<String, ?> e : attributes.entrySet()) {
            m.put(Validate.notNull(e.getKey(), "attribute name"), normalize(e.getValue()));
        }
        return new Style(m);
    }

    /** Short form for ad hoc styles: {@code Style.of("bold", true, "font_size", 12)}. */
    public static Style of(Object... namesAndValues) {
        Validate.isTrue(namesAndValues.length % 2 == 0, "names and values must come in pairs");
        TreeMap<String, Object> m = new TreeMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            Validate.isInstanceOf(String.class, namesAndValues[i], "attribute name must be a String");
            m.put((String) namesAndValues[i], normalize(namesAndValues[i + 1]));
        }
        return new Style(m);
    }

    /** Union of both attribute sets; on a shared name the value of {@code other} wins. */
    public Style merge(Style other) {
        if (other == null || other.attributes.isEmpty()) {
            return this;
        }
        if (attributes.isEmpty()) {
            return other;
        }
        TreeMap<String, Object> m = new TreeMap<>(attributes);
        m.putAll(other.attributes);
        return new Style(m);
    }

    public Style with(String name, Object value) {
        return merge(of(name, value));
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    public boolean has(String name) {
        return attributes.containsKey(name);
    }

    public Object get(String name) {
        return attributes.get(name);
    }

    public boolean getBoolean(String name) {
        Object v = attributes.get(name);
        if (v instanceof Boolean)
            return (Boolean) v;
        if (v instanceof Number)
            return ((Number) v).intValue() != 0;
        return false;
    }

    public int getInt(String name, int defaultValue) {
        Object v = attributes.get(name);
        return (v instanceof Number) ? ((Number) v).intValue() : defaultValue;
    }

    public double getDouble(String name, double defaultValue) {
        Object v = attributes.get(name);
        return (v instanceof Number) ? ((Number) v).doubleValue() : defaultValue;
    }

    public String getString(String name) {
        Object v = attributes.get(name);
        return v == null ? null : v.toString();
    }

    public Map<String, Object> asMap() {
        return attributes;
    }

    // Long 1 and Integer 1 must collapse to the same registered style
    private static Object normalize(Object value) {
        if (value instanceof Long || value instanceof Short || value instanceof Byte) {
            long l = ((Number) value).longValue();
            if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                return (int) l;
            }
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Style && ((Style) o).attributes.equals(attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(attributes);
    }

    @Override
    public String toString() {
        return "Style" + attributes;
    }
}
