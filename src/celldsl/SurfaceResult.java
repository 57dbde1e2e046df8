package celldsl;

/**
 * Outcome of one {@link OutputSurface} operation.
 */
public enum SurfaceResult {
    OK,
    // text longer than a cell can hold
    CONTENT_LENGTH_EXCEEDED,
    // too many hyperlinks or similar per-sheet objects
    REFERENCE_COUNT_EXCEEDED,
    INVALID_PARAMETER;

    public boolean isOk() {
        return this == OK;
    }
}
