package celldsl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StyleConflictResolverTest {

    private static List<Placement> resolve(Object... tokens) {
        MovementResolver.Result moved = MovementResolver.resolve(new CommitBuilder().commit(tokens).actions(),
                Coords.ORIGIN);
        ReferenceResolver.Result referenced = ReferenceResolver.resolve(moved.cells, moved.bookmarks, null);
        return StyleConflictResolver.resolve(BoxBorderExpander.expand(referenced.cells, new ArrayList<String>()),
                moved.bookmarks);
    }

    @Test
    void impositionsMergeIntoContent() {
        List<Placement> p = resolve(Styles.ITALIC, "A", Ops.imposeStyle(Styles.BOLD), Ops.imposeStyle(Styles.RIGHT));

        assertThat(p).hasSize(1);
        assertThat(p.get(0).command)
                .isEqualTo(Ops.write("A").withStyle(Styles.ITALIC.merge(Styles.BOLD).merge(Styles.RIGHT)));
    }

    @Test
    @DisplayName("An override replaces the content style, impositions do not apply on top of it")
    void overrideReplaces() {
        List<Placement> p = resolve(Styles.ITALIC, "A", Ops.overrideStyle(Styles.BOLD), Ops.imposeStyle(Styles.RIGHT));

        assertThat(p.get(0).command).isEqualTo(Ops.write("A").withStyle(Styles.BOLD));
    }

    @Test
    void secondOverrideOnACellFails() {
        assertThatThrownBy(() -> resolve("A", Ops.overrideStyle(Styles.BOLD), Ops.overrideStyle(Styles.ITALIC)))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("There's already an OverrideStyle for cell (0, 0)");
    }

    @Test
    @DisplayName("A style on an empty cell is kept by a content-less write")
    void styleWithoutContentGetsAPlaceholder() {
        List<Placement> p = resolve(6, Ops.imposeStyle(Styles.BOLD));

        assertThat(p).hasSize(1);
        assertThat(p.get(0).coords).isEqualTo(Coords.of(0, 1));
        assertThat(p.get(0).command).isEqualTo(Ops.write(null).withStyle(Styles.BOLD));
    }

    @Test
    void richWritesTakeImpositionsAndOverridesOnTheCellStyle() {
        List<Placement> imposed = resolve("a", "b", Styles.WRAPPED, 6, Ops.PREV_COL, Ops.imposeStyle(Styles.BOLD));
        Command.WriteRich rich = (Command.WriteRich) imposed.get(0).command;
        assertThat(rich.cellStyle).isEqualTo(Styles.WRAPPED.merge(Styles.BOLD));

        List<Placement> overridden = resolve("a", "b", Styles.WRAPPED, 6, Ops.PREV_COL,
                Ops.overrideStyle(Styles.ITALIC));
        assertThat(((Command.WriteRich) overridden.get(0).command).cellStyle).isEqualTo(Styles.ITALIC);
    }

    @Test
    void mergeWritesTakeImpositions() {
        List<Placement> p = resolve(Ops.mergeWrite("m", 2), Ops.imposeStyle(Styles.CENTER));

        assertThat(p.get(0).command).isEqualTo(Ops.mergeWrite("m", 2).withStyle(Styles.CENTER));
    }

    @Test
    @DisplayName("Placements come out row-major, commands on one cell in authoring order")
    void rowMajorOrder() {
        List<Placement> p = resolve(Ops.atCell(2, 0), "C", Ops.atCell(0, 5), "B", Ops.SUBMIT_ROW_BREAK,
                Ops.atCell(0, 1), "A");

        assertThat(p).extracting(pl -> pl.coords).containsExactly(Coords.of(0, 1), Coords.of(0, 5), Coords.of(0, 5),
                Coords.of(2, 0));
        assertThat(p.get(1).command).isEqualTo(Ops.write("B"));
        assertThat(p.get(2).command).isEqualTo(Ops.SUBMIT_ROW_BREAK);
    }

    @Test
    @DisplayName("Box borders reaching the last pass unexpanded are a programming error")
    void unexpandedBoxBorder() {
        MovementResolver.Result moved = MovementResolver.resolve(
                new CommitBuilder().commit("a", Ops.DRAW_BOX_BORDER).actions(), Coords.ORIGIN);
        ReferenceResolver.Result referenced = ReferenceResolver.resolve(moved.cells, moved.bookmarks, null);

        assertThatThrownBy(() -> StyleConflictResolver.resolve(referenced.cells, moved.bookmarks))
                .isInstanceOf(IllegalStateException.class).hasMessageContaining("box border");
    }

    @Test
    void nonContentCommandsPassThroughUnstyled() {
        List<Placement> p = resolve(Ops.imposeStyle(Styles.BOLD), Ops.setRowHeight(20),
                Ops.addConditionalFormat(Collections.singletonMap("type", "formula")));

        assertThat(p).extracting(pl -> pl.command).containsExactly(Ops.setRowHeight(20),
                Ops.addConditionalFormat(Collections.singletonMap("type", "formula")),
                Ops.write(null).withStyle(Styles.BOLD));
    }
}
