package org.dxworks.sqlportability.model.template;

/**
 * A contiguous slice of a template source. The regions produced for one source
 * tile {@code [0, source.length())} in order; {@code content} is the exact slice.
 */
public final class Region {
    public final int start;
    public final int end;
    public final RegionKind kind;
    public final String content;

    public Region(int start, RegionKind kind, String content) {
        this.start = start;
        this.end = start + content.length();
        this.kind = kind;
        this.content = content;
    }

    @Override
    public String toString() {
        return kind + "[" + start + ", " + end + ")";
    }
}
