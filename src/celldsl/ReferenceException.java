package celldsl;

import java.util.List;
import java.util.Map;

public class ReferenceException extends CellDslException {
    private static final long serialVersionUID = 1L;

    public ReferenceException(String reason) {
        super(reason);
    }

    public ReferenceException(String reason, Integer actionIndex, List<?> actions, List<String> sections, Object command,
            Map<String, Coords> bookmarks, Throwable cause) {
        super(reason, actionIndex, actions, sections, command, bookmarks, cause);
    }
}
