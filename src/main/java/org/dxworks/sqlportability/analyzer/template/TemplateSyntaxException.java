package org.dxworks.sqlportability.analyzer.template;

/**
 * Raised by {@link TemplateLexer} when the templating syntax cannot be tokenized.
 */
public class TemplateSyntaxException extends Exception {

    private final int position;

    public TemplateSyntaxException(String message, int position) {
        super(message + " at offset " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
