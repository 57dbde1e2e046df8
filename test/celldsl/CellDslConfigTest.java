package celldsl;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CellDslConfigTest {

    @Test
    void defaults() {
        CellDslConfig cfg = CellDslConfig.load(new String[0]);

        assertThat(cfg.outPath).isEqualTo(CellDslConfig.DEFAULT_OUT_PATH);
        assertThat(cfg.sheetName).isEqualTo("Sheet1");
        assertThat(cfg.start()).isEqualTo(Coords.ORIGIN);
        assertThat(cfg.overwritesOk).isFalse();
        assertThat(cfg.defaultStyle()).isEqualTo(Styles.DEFAULT_FONT);
    }

    @Test
    void argumentsOverrideDefaults() {
        CellDslConfig cfg = CellDslConfig.load(new String[] { "out.xlsx", "Data", "4", "2", " Arial " });

        assertThat(cfg.outPath).isEqualTo("out.xlsx");
        assertThat(cfg.sheetName).isEqualTo("Data");
        assertThat(cfg.start()).isEqualTo(Coords.of(4, 2));
        assertThat(cfg.defaultStyle().getString("font_name")).isEqualTo("Arial");
    }

    @Test
    void badNumbersFallBack() {
        CellDslConfig cfg = CellDslConfig.load(new String[] { " ", "", "x", "-1" });

        assertThat(cfg.outPath).isEqualTo(CellDslConfig.DEFAULT_OUT_PATH);
        assertThat(cfg.sheetName).isEqualTo(CellDslConfig.DEFAULT_SHEET_NAME);
        assertThat(cfg.start()).isEqualTo(Coords.ORIGIN);
        assertThat(CellDslConfig.load(new String[] { "o", "s", "99999999" }).initialRow).isZero();
    }

    @Test
    void overwritesFlag() {
        assertThat(CellDslConfig.defaults().withOverwritesOk(true).overwritesOk).isTrue();
    }
}
