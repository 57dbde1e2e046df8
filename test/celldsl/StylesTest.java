package celldsl;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class StylesTest {

    @Test
    void constantsAreMutuallyDistinct() {
        assertThat(Styles.duplicates()).isEmpty();
    }

    @Test
    void composedDefaultsCarryTheirParts() {
        assertThat(Styles.DEFAULT_FONT.asMap()).containsEntry("font_name", "Liberation Sans")
                .containsEntry("font_size", 10).containsEntry("align", "left");
        assertThat(Styles.DEFAULT_HEADER.asMap()).containsEntry("bold", true).containsEntry("font_size", 18);
        assertThat(Styles.HIGHLIGHT_BORDER.asMap()).containsOnlyKeys("left", "top", "right", "bottom");
    }
}
