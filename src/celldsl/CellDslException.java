package celldsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base of all layout errors. Besides the message it carries whatever context was available when the error was
 * raised, rendered into {@link #getMessage()} under "Additional info".
 */
public class CellDslException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private static final int ADJACENT = 10;

    private final String reason;
    private final Integer actionIndex;
    private final List<?> actions;
    private final List<String> sections;
    private final Object command;
    private final Map<String, Coords> bookmarks;

    public CellDslException(String reason) {
        this(reason, null, null, null, null, null, null);
    }

    /**
     * @param reason what went wrong
     * @param actionIndex index of the triggering entry in {@code actions}
     * @param actions the list being processed
     * @param sections open section names, outermost first
     * @param command triggering command
     * @param bookmarks bookmarks known at the time
     * @param cause underlying exception
     */
    public CellDslException(String reason, Integer actionIndex, List<?> actions, List<String> sections,
            Object command, Map<String, Coords> bookmarks, Throwable cause) {
        super(reason, cause);
        this.reason = reason;
        this.actionIndex = actionIndex;
        this.actions = actions == null ? null : new ArrayList<>(actions);
        this.sections = sections == null ? null : new ArrayList<>(sections);
        this.command = command;
        this.bookmarks = bookmarks == null ? null : new LinkedHashMap<>(bookmarks);
    }

    public String getReason() {
        return reason;
    }

    public Integer getActionIndex() {
        return actionIndex;
    }

    public Object getCommand() {
        return command;
    }

    /** Open sections, innermost first. */
    public List<String> getSections() {
        if (sections == null) {
            return Collections.emptyList();
        }
        List<String> out = new ArrayList<>(sections);
        Collections.reverse(out);
        return out;
    }

    public Map<String, Coords> getBookmarks() {
        return bookmarks == null ? Collections.<String, Coords>emptyMap() : Collections.unmodifiableMap(bookmarks);
    }

    @Override
    public String getMessage() {
        List<String> info = new ArrayList<>();
        if (sections != null) {
            info.add("Name stack: " + sectionsForDisplay(sections));
        }
        if (actions != null && actionIndex != null) {
            int from = Math.max(actionIndex - ADJACENT, 0);
            int to = Math.min(actionIndex + ADJACENT, actions.size());
            info.add("Adjacent actions: " + actions.subList(from, to));
        }
        if (actionIndex != null) {
            info.add("Action num: " + actionIndex);
        }
        if (command != null) {
            info.add("Triggering action: " + command);
        }
        if (bookmarks != null) {
            info.add("Save points already present: " + bookmarks);
        }
        if (info.isEmpty()) {
            return reason;
        }
        return reason + "\nAdditional info:\n" + String.join("\n", info);
    }

    /** Innermost first; runs of the same name collapse into {@code namexN}. */
    static List<String> sectionsForDisplay(List<String> outermostFirst) {
        List<String> segments = new ArrayList<>();
        int i = 0;
        while (i < outermostFirst.size()) {
            String name = outermostFirst.get(i);
            int j = i;
            while (j < outermostFirst.size() && outermostFirst.get(j).equals(name)) {
                j++;
            }
            int count = j - i;
            segments.add(count > 1 ? name + "x" + count : name);
            i = j;
        }
        Collections.reverse(segments);
        return segments;
    }
}
