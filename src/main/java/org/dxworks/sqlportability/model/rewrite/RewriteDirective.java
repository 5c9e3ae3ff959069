package org.dxworks.sqlportability.model.rewrite;

public final class RewriteDirective {
    public final String originalText;
    public final String replacementText;

    public RewriteDirective(String originalText, String replacementText) {
        this.originalText = originalText;
        this.replacementText = replacementText;
    }

    @Override
    public String toString() {
        return originalText + " -> " + replacementText;
    }
}
