package celldsl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StyleCacheTest {

    @Test
    @DisplayName("The registrar sees each distinct style content once")
    void registersEachContentOnce() {
        StyleRegistrar registrar = mock(StyleRegistrar.class);
        when(registrar.register(any(Style.class))).thenReturn(new StyleHandle(1), new StyleHandle(2));
        StyleCache cache = new StyleCache(registrar);

        StyleHandle bold = cache.register(Styles.BOLD);
        StyleHandle boldAgain = cache.register(Style.of("bold", true));
        StyleHandle italic = cache.register(Styles.ITALIC);

        assertThat(bold).isEqualTo(boldAgain).isEqualTo(new StyleHandle(1));
        assertThat(italic).isEqualTo(new StyleHandle(2));
        assertThat(cache.size()).isEqualTo(2);
        verify(registrar, times(1)).register(Styles.BOLD);
        verify(registrar, times(1)).register(Styles.ITALIC);
    }

    @Test
    void needsARegistrar() {
        assertThatThrownBy(() -> new StyleCache(null)).isInstanceOf(NullPointerException.class)
                .hasMessageContaining("registrar");
    }
}
