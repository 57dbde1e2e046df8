package celldsl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MovementResolverTest {

    private static MovementResolver.Result walk(Object... tokens) {
        return MovementResolver.resolve(new CommitBuilder().commit(tokens).actions(), Coords.ORIGIN);
    }

    private static List<Command> at(MovementResolver.Result r, int row, int col) {
        List<Command> out = new ArrayList<>();
        List<CellAction> actions = r.cells.get(Coords.of(row, col));
        if (actions != null) {
            for (CellAction a : actions) {
                out.add(a.command);
            }
        }
        return out;
    }

    /** Where the cursor ends up: the cell of a marker write appended to the stream. */
    private static Coords cursorAfter(Object... tokens) {
        Object[] withMarker = new Object[tokens.length + 1];
        System.arraycopy(tokens, 0, withMarker, 0, tokens.length);
        withMarker[tokens.length] = Ops.write("marker");
        MovementResolver.Result r = walk(withMarker);
        for (Map.Entry<Coords, List<CellAction>> e : r.cells.entrySet()) {
            for (CellAction a : e.getValue()) {
                if (Ops.write("marker").equals(a.command)) {
                    return e.getKey();
                }
            }
        }
        throw new AssertionError("marker not placed");
    }

    @Test
    @DisplayName("Writes land on the cell the cursor was on when they were committed")
    void movesBeforeWrites() {
        MovementResolver.Result r = walk(6, "A", 6, "B");

        assertThat(r.cells.keySet()).containsExactly(Coords.of(0, 1), Coords.of(0, 2));
        assertThat(at(r, 0, 1)).containsExactly(Ops.write("A"));
        assertThat(at(r, 0, 2)).containsExactly(Ops.write("B"));
    }

    @Test
    void withoutMovementEverythingIsAtTheStart() {
        MovementResolver.Result r = walk("A", Styles.BOLD, "B", Ops.imposeStyle(Styles.ITALIC));

        assertThat(r.cells.keySet()).containsExactly(Coords.ORIGIN);
    }

    @Test
    void commandsOnOneCellKeepTheirOrderAndOrigin() {
        MovementResolver.Result r = walk(Ops.sectionBegin("outer"), "A", Ops.imposeStyle(Styles.BOLD),
                Ops.SECTION_END);

        List<CellAction> actions = r.cells.get(Coords.ORIGIN);
        assertThat(actions).hasSize(2);
        assertThat(actions.get(0).actionIndex).isEqualTo(1);
        assertThat(actions.get(1).actionIndex).isEqualTo(2);
        assertThat(actions.get(1).sections).containsExactly("outer");
    }

    @Test
    void absoluteJumpAndBookmarks() {
        assertThat(cursorAfter(Ops.atCell(5, 3))).isEqualTo(Coords.of(5, 3));
        assertThat(cursorAfter(Ops.atCell(5, 3), Ops.save("x"), Ops.atCell(0, 0), Ops.load("x")))
                .isEqualTo(Coords.of(5, 3));
        assertThat(walk(2, Ops.save("a"), 6, Ops.save("b"), Ops.save("a")).bookmarks)
                .containsEntry("a", Coords.of(1, 1)).containsEntry("b", Coords.of(1, 1));
    }

    @Test
    void stackSaveAndLoad() {
        assertThat(cursorAfter(2, Ops.STACK_SAVE, 66, Ops.STACK_SAVE, 22, Ops.STACK_LOAD))
                .isEqualTo(Coords.of(1, 2));
        assertThat(cursorAfter(2, Ops.STACK_SAVE, 66, Ops.STACK_SAVE, 22, Ops.STACK_LOAD, Ops.STACK_LOAD))
                .isEqualTo(Coords.of(1, 0));
    }

    @Test
    @DisplayName("Backtrack(n) returns to the cell visited n relocations ago")
    void backtrack() {
        assertThat(cursorAfter(6, 6, 6, Ops.backtrack(1))).isEqualTo(Coords.of(0, 2));
        assertThat(cursorAfter(6, 6, 6, Ops.backtrack(2))).isEqualTo(Coords.of(0, 1));
        assertThat(cursorAfter(6, 6, 6, Ops.backtrack(3))).isEqualTo(Coords.ORIGIN);
        assertThat(cursorAfter(6, 6, 6, Ops.backtrack(0))).isEqualTo(Coords.of(0, 3));
        // the cell returned to leaves the history as well
        assertThat(cursorAfter(6, 6, 6, Ops.backtrack(1), Ops.backtrack(1))).isEqualTo(Coords.ORIGIN);
    }

    @Test
    void backtrackBeyondHistoryFails() {
        assertThatThrownBy(() -> walk(6, 6, Ops.backtrack(3))).isInstanceOf(MovementException.class)
                .hasMessageContaining("Could not backtrack 3 cells");
    }

    @Test
    void leavingTheSheetFails() {
        assertThatThrownBy(() -> walk(8)).isInstanceOf(MovementException.class)
                .hasMessageContaining("Illegal coords have been reached: (-1, 0)");
        assertThatThrownBy(() -> walk(Ops.atCell(0, Coords.MAX_COLS - 1), Ops.mergeWrite("x", 1)))
                .isInstanceOf(MovementException.class).hasMessageContaining("leaves the sheet");
    }

    @Test
    void emptyStackAndMissingSavePointFail() {
        assertThatThrownBy(() -> walk(Ops.STACK_LOAD)).isInstanceOf(MovementException.class)
                .hasMessageContaining("Position stack is empty");
        assertThatThrownBy(() -> walk(Ops.load("nowhere"))).isInstanceOf(MovementException.class)
                .hasMessageContaining("nowhere");
    }

    @Test
    @DisplayName("A section left open at the end of the stream is named in the error")
    void unclosedSectionFails() {
        assertThatThrownBy(() -> walk(Ops.sectionBegin("table"), "A"))
                .isInstanceOf(MovementException.class)
                .hasMessageContaining("Section 'table' is not closed");
        assertThatThrownBy(() -> walk(Ops.SECTION_END)).isInstanceOf(MovementException.class)
                .hasMessageContaining("SectionEnd without a matching SectionBegin");
    }

    @Test
    void errorsCarrySectionsAndBookmarks() {
        MovementException e = null;
        try {
            walk(Ops.save("a"), Ops.sectionBegin("outer"), Ops.sectionBegin("inner"), 8, Ops.SECTION_END,
                    Ops.SECTION_END);
        } catch (MovementException caught) {
            e = caught;
        }
        assertThat(e).isNotNull();
        assertThat(e.getActionIndex()).isEqualTo(3);
        assertThat(e.getSections()).containsExactly("inner", "outer");
        assertThat(e.getBookmarks()).containsEntry("a", Coords.ORIGIN);
        assertThat(e.getCommand()).isEqualTo(Ops.move(-1, 0));
    }

    @Test
    @DisplayName("Integer range pointers read the visited history or the position stack")
    void relativeRangePointers() {
        MovementResolver.Result r = walk(Ops.STACK_SAVE, 3, 3, Ops.defineNamedRange("n").topLeft(-1),
                Ops.refArray("h").topLeft(2));

        Command.DefineNamedRange name = (Command.DefineNamedRange) at(r, 2, 2).get(0);
        assertThat(name.topLeft.coords()).isEqualTo(Coords.ORIGIN);
        assertThat(name.bottomRight.coords()).isEqualTo(Coords.of(2, 2));
        Command.RefArray ref = (Command.RefArray) at(r, 2, 2).get(1);
        assertThat(ref.topLeft.coords()).isEqualTo(Coords.ORIGIN);
    }

    @Test
    void relativePointersBeyondTheirSourceFail() {
        assertThatThrownBy(() -> walk(Ops.defineNamedRange("n").topLeft(-1)))
                .isInstanceOf(MovementException.class).hasMessageContaining("position stack");
        assertThatThrownBy(() -> walk(6, Ops.defineNamedRange("n").topLeft(2)))
                .isInstanceOf(MovementException.class).hasMessageContaining("visited");
    }

    @Test
    void namedPointersAreLeftForLater() {
        MovementResolver.Result r = walk(Ops.defineNamedRange("n").topLeft("later"), Ops.save("later"));

        Command.DefineNamedRange name = (Command.DefineNamedRange) at(r, 0, 0).get(0);
        assertThat(name.topLeft).isEqualTo(CellPointer.named("later"));
        assertThat(name.bottomRight.coords()).isEqualTo(Coords.ORIGIN);
    }
}
