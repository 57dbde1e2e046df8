package celldsl;

/**
 * Opaque token returned by a {@link StyleRegistrar}. Only the registrar that issued it knows what it refers to.
 */
public final class StyleHandle {
    private final int id;

    public StyleHandle(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StyleHandle && ((StyleHandle) o).id == id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "StyleHandle#" + id;
    }
}
