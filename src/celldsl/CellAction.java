package celldsl;

import java.util.Collections;
import java.util.List;

// synthesized commands keep the origin of the command they were derived from
final class CellAction {
    final Command command;
    final int actionIndex;
    final List<String> sections;

    CellAction(Command command, int actionIndex, List<String> sections) {
        this.command = command;
        this.actionIndex = actionIndex;
        this.sections = Collections.unmodifiableList(sections);
    }

    CellAction withCommand(Command c) {
        return new CellAction(c, actionIndex, sections);
    }

    @Override
    public String toString() {
        return "#" + actionIndex + " " + command;
    }
}
