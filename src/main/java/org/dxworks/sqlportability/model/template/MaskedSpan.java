package org.dxworks.sqlportability.model.template;

/**
 * Offsets into the original source together with the masked SQL that stands in
 * for that range. Only the masked text is parsed; rewriting happens on the original.
 */
public final class MaskedSpan {
    public final int start;
    public final int end;
    public final String maskedText;

    public MaskedSpan(int start, int end, String maskedText) {
        this.start = start;
        this.end = end;
        this.maskedText = maskedText;
    }
}
