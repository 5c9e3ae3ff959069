package org.dxworks.sqlportability.analyzer.rewrite;

import org.dxworks.sqlportability.model.template.MaskedSpan;

/**
 * Text of a file being rewritten plus the cumulative length change of the spans
 * already spliced into it. Span offsets refer to the original text; adding
 * {@code offset} maps them into {@code text}.
 */
public final class RewriteState {
    public final String text;
    public final int offset;

    public RewriteState(String text, int offset) {
        this.text = text;
        this.offset = offset;
    }

    public static RewriteState of(String source) {
        return new RewriteState(source, 0);
    }

    public String sliceOf(MaskedSpan span) {
        return text.substring(span.start + offset, span.end + offset);
    }

    /**
     * @return a state with the span's current slice replaced by {@code replacement}
     */
    public RewriteState splice(MaskedSpan span, String replacement) {
        int start = span.start + offset;
        int end = span.end + offset;
        String current = text.substring(start, end);
        if (current.equals(replacement)) {
            return this;
        }
        String spliced = text.substring(0, start) + replacement + text.substring(end);
        return new RewriteState(spliced, offset + replacement.length() - current.length());
    }
}
