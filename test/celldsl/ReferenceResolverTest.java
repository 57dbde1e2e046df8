package celldsl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReferenceResolverTest {

    private static ReferenceResolver.Result resolve(String sheetName, Object... tokens) {
        MovementResolver.Result moved = MovementResolver.resolve(new CommitBuilder().commit(tokens).actions(),
                Coords.ORIGIN);
        return ReferenceResolver.resolve(moved.cells, moved.bookmarks, sheetName);
    }

    private static Command first(ReferenceResolver.Result r, int row, int col) {
        return r.cells.get(Coords.of(row, col)).get(0).command;
    }

    @Test
    @DisplayName("A range from a bookmark to the current cell")
    void bookmarkToCurrentCell() {
        ReferenceResolver.Result r = resolve(null, Ops.save("x"), 6, Ops.defineNamedRange("n").topLeft("x"));

        Command.DefineNamedRange n = (Command.DefineNamedRange) first(r, 0, 1);
        assertThat(n.topLeft.coords()).isEqualTo(Coords.of(0, 0));
        assertThat(n.bottomRight.coords()).isEqualTo(Coords.of(0, 1));
        assertThat(n.isResolved()).isTrue();
    }

    @Test
    @DisplayName("Bookmarks are visible to commands committed before them")
    void bookmarksAreForwardVisible() {
        ReferenceResolver.Result r = resolve(null, Ops.DRAW_BOX_BORDER.bottomRight("end"), 33, Ops.save("end"));

        Command.DrawBoxBorder box = (Command.DrawBoxBorder) first(r, 0, 0);
        assertThat(box.bottomRight.coords()).isEqualTo(Coords.of(2, 2));
    }

    @Test
    void cornersAreOrdered() {
        ReferenceResolver.Result r = resolve(null, Ops.atCell(4, 1), Ops.save("a"), Ops.atCell(1, 5),
                Ops.defineNamedRange("n").topLeft("a"));

        Command.DefineNamedRange n = (Command.DefineNamedRange) first(r, 1, 5);
        assertThat(n.topLeft.coords()).isEqualTo(Coords.of(1, 1));
        assertThat(n.bottomRight.coords()).isEqualTo(Coords.of(4, 5));
    }

    @Test
    void missingBookmarkIsNamed() {
        assertThatThrownBy(() -> resolve(null, Ops.DRAW_BOX_BORDER.topLeft("nope")))
                .isInstanceOf(ReferenceException.class)
                .hasMessageContaining("Tried to use a save point named nope for top left corner");
    }

    @Test
    @DisplayName("Forward reference markers become sheet-qualified absolute addresses")
    void refArraysBecomeAddresses() {
        ReferenceResolver.Result r = resolve("Data", Ops.STACK_SAVE, 3, Ops.refArray("block").topLeft(-1),
                Ops.STACK_LOAD, Ops.refArray("single"));

        assertThat(r.refs).containsEntry("block", "Data!$A$1:$B$2").containsEntry("single", "Data!$A$1");
        // markers leave nothing on the sheet
        assertThat(r.cells).isEmpty();
    }

    @Test
    void sheetNamesAreQuotedWhenNeeded() {
        assertThat(ReferenceResolver.address(Coords.of(0, 0), Coords.of(3, 1), "My Sheet"))
                .isEqualTo("'My Sheet'!$A$1:$B$4");
        assertThat(ReferenceResolver.address(Coords.of(9, 26), Coords.of(9, 27), null)).isEqualTo("$AA$10:$AB$10");
    }

    @Test
    @DisplayName("Charts anywhere in the stream receive every reference, including combined charts")
    void chartsReceiveReferences() {
        Command.AddChart combined = Ops.lineChart();
        ReferenceResolver.Result r = resolve("Data", Ops.columnChart().perform(ChartOperation.combine(combined)), 6,
                Ops.refArray("later"));

        List<CellAction> withRefs = ReferenceResolver.introduceRefs(r.cells, r.refs).get(Coords.ORIGIN);
        Command.AddChart chart = (Command.AddChart) withRefs.get(0).command;
        assertThat(chart.resolvedRefs).containsEntry("later", "Data!$B$1");
        ChartOperation.Combine op = (ChartOperation.Combine) chart.operations.get(0);
        assertThat(op.secondary.resolvedRefs).containsEntry("later", "Data!$B$1");
    }

    @Test
    void conditionalFormatCornersAreResolvedLikeAnyRange() {
        ReferenceResolver.Result r = resolve(null, Ops.atCell(3, 4), Ops.save("far"), Ops.atCell(1, 0),
                Ops.addConditionalFormat(Collections.singletonMap("type", "formula")).bottomRight("far"));

        Command.AddConditionalFormat cf = (Command.AddConditionalFormat) first(r, 1, 0);
        assertThat(cf.topLeft.coords()).isEqualTo(Coords.of(1, 0));
        assertThat(cf.bottomRight.coords()).isEqualTo(Coords.of(3, 4));
    }
}
