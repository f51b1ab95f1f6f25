package ai.docsite.bridge.anchor;

/**
 * Line index before which a new region is inserted, plus the blank lines that should surround it.
 */
public record InsertionPoint(int line, boolean blankBefore, boolean blankAfter) {

    public InsertionPoint {
        if (line < 0) {
            throw new IllegalArgumentException("line must not be negative");
        }
    }
}
