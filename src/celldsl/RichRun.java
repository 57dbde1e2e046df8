package celldsl;

import java.util.Objects;

import org.apache.commons.lang3.Validate;

public final class RichRun {
    public final String text;
    public final Style style;

    public RichRun(String text, Style style) {
        this.text = Validate.notNull(text, "text");
        this.style = style;
    }

    RichRun withStyle(Style s) {
        return new RichRun(text, style == null ? s : style.merge(s));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RichRun))
            return false;
        RichRun other = (RichRun) o;
        return text.equals(other.text) && Objects.equals(style, other.style);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, style);
    }

    @Override
    public String toString() {
        return style == null ? "'" + text + "'" : "'" + text + "' " + style;
    }
}
