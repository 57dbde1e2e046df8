package celldsl;

import java.util.Objects;

import org.apache.commons.lang3.Validate;

public final class StyledText {
    public final String text;
    public final StyleHandle style;

    public StyledText(String text, StyleHandle style) {
        this.text = Validate.notNull(text, "text");
        this.style = Validate.notNull(style, "style");
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof StyledText))
            return false;
        StyledText other = (StyledText) o;
        return text.equals(other.text) && style.equals(other.style);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, style);
    }

    @Override
    public String toString() {
        return "'" + text + "' " + style;
    }
}
