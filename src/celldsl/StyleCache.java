package celldsl;

import java.util.HashMap;
import java.util.Map;

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deduplicates style registrations: the registrar is called once per distinct style content. Bind one cache to
 * one workbook.
 */
public final class StyleCache {
    private static final Logger LOG = LoggerFactory.getLogger(StyleCache.class);

    private final StyleRegistrar registrar;
    private final Map<Style, StyleHandle> registered = new HashMap<>();

    public StyleCache(StyleRegistrar registrar) {
        this.registrar = Validate.notNull(registrar, "registrar");
    }

    public StyleHandle register(Style style) {
        StyleHandle handle = registered.get(style);
        if (handle == null) {
            handle = registrar.register(style);
            registered.put(style, handle);
            LOG.debug("Registered {} as {}", style, handle);
        }
        return handle;
    }

    public int size() {
        return registered.size();
    }
}
