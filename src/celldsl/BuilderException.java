package celldsl;

import java.util.List;
import java.util.Map;

public class BuilderException extends CellDslException {
    private static final long serialVersionUID = 1L;

    public BuilderException(String reason) {
        super(reason);
    }

    public BuilderException(String reason, Integer actionIndex, List<?> actions, List<String> sections, Object command,
            Map<String, Coords> bookmarks, Throwable cause) {
        super(reason, actionIndex, actions, sections, command, bookmarks, cause);
    }
}
