package celldsl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CommitBuilderTest {

    private static List<Command> commit(Object... tokens) {
        return new CommitBuilder().commit(tokens).actions();
    }

    @Test
    @DisplayName("Integers are moves in numeric keypad layout")
    void integersAreKeypadMoves() {
        assertThat(CommitBuilder.movement(6)).isEqualTo(Ops.move(0, 1));
        assertThat(CommitBuilder.movement(2)).isEqualTo(Ops.move(1, 0));
        assertThat(CommitBuilder.movement(7)).isEqualTo(Ops.move(-1, -1));
        assertThat(CommitBuilder.movement(3)).isEqualTo(Ops.move(1, 1));
        assertThat(CommitBuilder.movement(666)).isEqualTo(Ops.move(0, 3));
        assertThat(CommitBuilder.movement(2486)).isEqualTo(Ops.move(0, 0));
        assertThat(CommitBuilder.movement(5)).isEqualTo(Ops.move(0, 0));
    }

    @Test
    void textStyleAndCommandsAreTranslated() {
        List<Command> actions = commit("A", 6, Styles.BOLD, "B", Ops.SUBMIT_ROW_BREAK, null, 2L);

        assertThat(actions).containsExactly(
                Ops.write("A"),
                Ops.move(0, 1),
                Ops.write("B").withStyle(Styles.BOLD),
                Ops.SUBMIT_ROW_BREAK,
                Ops.move(1, 0));
    }

    @Test
    void nestedSequencesAreFlattened() {
        List<Command> actions = commit(Arrays.asList("A", 6, new Object[] { "B", Collections.singletonList(2) }));

        assertThat(actions).containsExactly(Ops.write("A"), Ops.move(0, 1), Ops.write("B"), Ops.move(1, 0));
    }

    @Test
    @DisplayName("Consecutive texts coalesce into one rich write, a trailing style becomes its cell style")
    void consecutiveTextsBecomeRich() {
        List<Command> actions = commit(Styles.BOLD, "bold ", "plain ", Styles.ITALIC, "italic", Styles.WRAPPED, 6);

        assertThat(actions).hasSize(2);
        Command.WriteRich rich = (Command.WriteRich) actions.get(0);
        assertThat(rich.runs).containsExactly(
                new RichRun("bold ", Styles.BOLD),
                new RichRun("plain ", null),
                new RichRun("italic", Styles.ITALIC));
        assertThat(rich.cellStyle).isEqualTo(Styles.WRAPPED);
        assertThat(actions.get(1)).isEqualTo(Ops.move(0, 1));
    }

    @Test
    void stylesInARowMerge() {
        List<Command> actions = commit(Styles.BOLD, Styles.ITALIC, "x");

        assertThat(actions).containsExactly(Ops.write("x").withStyle(Styles.BOLD.merge(Styles.ITALIC)));
    }

    @Test
    void mapsAreStyles() {
        List<Command> actions = commit(Collections.singletonMap("bold", true), "x");

        assertThat(actions).containsExactly(Ops.write("x").withStyle(Styles.BOLD));
    }

    @Test
    @DisplayName("A style must be followed by text")
    void danglingStyleIsRejected() {
        assertThatThrownBy(() -> commit(Styles.BOLD, 6)).isInstanceOf(BuilderException.class)
                .hasMessageContaining("A style must be followed by text");
        assertThatThrownBy(() -> commit("A", Styles.BOLD)).isInstanceOf(BuilderException.class)
                .hasMessageContaining("end of sequence");
    }

    @Test
    void unknownTokensAreRejected() {
        assertThatThrownBy(() -> commit(1.5d)).isInstanceOf(BuilderException.class)
                .hasMessageContaining("Cannot process this type: java.lang.Double");
        assertThatThrownBy(() -> commit(Collections.singletonMap(1, true), "x"))
                .isInstanceOf(BuilderException.class).hasMessageContaining("must be strings");
    }

    @Test
    @DisplayName("Builder errors name the offending token and its flattened position")
    void errorsCarryTheOffendingToken() {
        assertThatThrownBy(() -> commit("A", Arrays.<Object>asList(6, 1.5d)))
                .isInstanceOfSatisfying(BuilderException.class, e -> {
                    assertThat(e.getActionIndex()).isEqualTo(2);
                    assertThat(e.getCommand()).isEqualTo(1.5d);
                    assertThat(e.getMessage()).contains("Action num: 2", "Triggering action: 1.5");
                });
        assertThatThrownBy(() -> commit(Styles.BOLD, 6)).isInstanceOfSatisfying(BuilderException.class, e -> {
            assertThat(e.getActionIndex()).isEqualTo(1);
            assertThat(e.getCommand()).isEqualTo(6);
        });
        assertThatThrownBy(() -> commit("A", Styles.BOLD)).isInstanceOfSatisfying(BuilderException.class,
                e -> assertThat(e.getCommand()).isEqualTo(Styles.BOLD));
    }

    @Test
    void nullTokenArrayCommitsNothing() {
        CommitBuilder b = new CommitBuilder();
        b.commit((Object[]) null).commit("A", null);

        assertThat(b.actions()).containsExactly(Ops.write("A"));
    }

    @Test
    void commitsAccumulate() {
        CommitBuilder b = new CommitBuilder();
        b.commit("A").commit(6, "B");

        assertThat(b.actions()).containsExactly(Ops.write("A"), Ops.move(0, 1), Ops.write("B"));
    }
}
