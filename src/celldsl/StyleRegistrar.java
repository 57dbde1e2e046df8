package celldsl;

/**
 * Registers a composed style with the output document.
 */
public interface StyleRegistrar {

    StyleHandle register(Style style);
}
