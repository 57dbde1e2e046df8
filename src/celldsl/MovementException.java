package celldsl;

import java.util.List;
import java.util.Map;

public class MovementException extends CellDslException {
    private static final long serialVersionUID = 1L;

    public MovementException(String reason) {
        super(reason);
    }

    public MovementException(String reason, Integer actionIndex, List<?> actions, List<String> sections, Object command,
            Map<String, Coords> bookmarks, Throwable cause) {
        super(reason, actionIndex, actions, sections, command, bookmarks, cause);
    }
}
