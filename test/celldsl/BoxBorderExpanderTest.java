package celldsl;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BoxBorderExpanderTest {

    private final List<String> warnings = new ArrayList<>();

    private Map<Coords, List<CellAction>> expand(Object... tokens) {
        MovementResolver.Result moved = MovementResolver.resolve(new CommitBuilder().commit(tokens).actions(),
                Coords.ORIGIN);
        ReferenceResolver.Result referenced = ReferenceResolver.resolve(moved.cells, moved.bookmarks, null);
        return BoxBorderExpander.expand(referenced.cells, warnings);
    }

    /** Union of the styles imposed on a cell; null when nothing is imposed there. */
    private static Style imposed(Map<Coords, List<CellAction>> cells, int row, int col) {
        List<CellAction> actions = cells.get(Coords.of(row, col));
        if (actions == null) {
            return null;
        }
        Style s = null;
        for (CellAction a : actions) {
            if (a.command instanceof Command.ImposeStyle) {
                Style next = ((Command.ImposeStyle) a.command).style;
                s = s == null ? next : s.merge(next);
            }
        }
        return s;
    }

    @Test
    @DisplayName("A box imposes its edge styles on exactly the perimeter cells")
    void perimeterOnly() {
        Map<Coords, List<CellAction>> cells = expand(Ops.atCell(1, 1), Ops.save("tl"), Ops.atCell(3, 3),
                Ops.DRAW_BOX_BORDER.topLeft("tl"));

        assertThat(cells.keySet()).containsExactlyInAnyOrder(
                Coords.of(1, 1), Coords.of(1, 2), Coords.of(1, 3),
                Coords.of(2, 1), Coords.of(2, 3),
                Coords.of(3, 1), Coords.of(3, 2), Coords.of(3, 3));
        assertThat(imposed(cells, 1, 1)).isEqualTo(Styles.LEFT_BORDER.merge(Styles.TOP_BORDER));
        assertThat(imposed(cells, 1, 2)).isEqualTo(Styles.TOP_BORDER);
        assertThat(imposed(cells, 2, 3)).isEqualTo(Styles.RIGHT_BORDER);
        assertThat(imposed(cells, 3, 3)).isEqualTo(Styles.RIGHT_BORDER.merge(Styles.BOTTOM_BORDER));
        assertThat(imposed(cells, 2, 2)).isNull();
        assertThat(warnings).isEmpty();
    }

    @Test
    void borderedCellsWithoutContentGetAPlaceholder() {
        Map<Coords, List<CellAction>> cells = expand(Ops.DRAW_BOX_BORDER);

        List<CellAction> actions = cells.get(Coords.ORIGIN);
        assertThat(actions.get(0).command).isEqualTo(Ops.write(null));
        assertThat(imposed(cells, 0, 0)).isEqualTo(Styles.HIGHLIGHT_BORDER);
    }

    @Test
    void existingContentIsKept() {
        Map<Coords, List<CellAction>> cells = expand("A", Ops.DRAW_BOX_BORDER);

        assertThat(cells.get(Coords.ORIGIN).get(0).command).isEqualTo(Ops.write("A"));
        assertThat(cells.get(Coords.ORIGIN)).hasSize(5);
    }

    @Test
    void edgesWithoutStyleAreSkipped() {
        Map<Coords, List<CellAction>> cells = expand(Ops.DRAW_BOX_BORDER.withLeftStyle(null).withRightStyle(null)
                .withBottomStyle(null).topLeft(0, 0).bottomRight(1, 0));

        assertThat(imposed(cells, 0, 0)).isEqualTo(Styles.TOP_BORDER);
        assertThat(cells).doesNotContainKey(Coords.of(1, 0));
    }

    @Test
    @DisplayName("Merged cells on a box edge get borders on their neighbours")
    void mergedCellCompensation() {
        Map<Coords, List<CellAction>> cells = expand(Ops.atCell(2, 1), Ops.mergeWrite("T", 2), Ops.DRAW_BOX_BORDER);

        assertThat(imposed(cells, 2, 4)).isEqualTo(Styles.LEFT_BORDER);
        for (int c = 1; c <= 3; c++) {
            assertThat(imposed(cells, 1, c)).isEqualTo(Styles.BOTTOM_BORDER);
            assertThat(imposed(cells, 3, c)).isEqualTo(Styles.TOP_BORDER);
        }
        assertThat(warnings).isEmpty();
    }

    @Test
    void tallBoxesDoNotCompensateBelow() {
        Map<Coords, List<CellAction>> cells = expand(Ops.atCell(2, 1), Ops.save("tl"), Ops.mergeWrite("T", 1), 2,
                Ops.DRAW_BOX_BORDER.topLeft("tl"));

        assertThat(imposed(cells, 1, 1)).isEqualTo(Styles.BOTTOM_BORDER);
        assertThat(imposed(cells, 1, 2)).isEqualTo(Styles.BOTTOM_BORDER);
        assertThat(imposed(cells, 3, 1).has("top")).isFalse();
        assertThat(imposed(cells, 3, 2)).isNull();
    }

    @Test
    @DisplayName("On the first row the compensation above is skipped with a warning")
    void firstRowCompensationWarns() {
        Map<Coords, List<CellAction>> cells = expand(Ops.mergeWrite("T", 1), Ops.DRAW_BOX_BORDER);

        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0)).contains("A row above is required");
        assertThat(imposed(cells, 0, 2)).isEqualTo(Styles.LEFT_BORDER);
        assertThat(imposed(cells, 1, 0)).isEqualTo(Styles.TOP_BORDER);
        assertThat(imposed(cells, 1, 1)).isEqualTo(Styles.TOP_BORDER);
    }
}
