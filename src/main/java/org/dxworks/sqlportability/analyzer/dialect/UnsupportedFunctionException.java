package org.dxworks.sqlportability.analyzer.dialect;

/**
 * A dialect cannot express a function call. The oracle reads this as a sign that
 * the call is not portable.
 */
public class UnsupportedFunctionException extends Exception {

    public UnsupportedFunctionException(String message) {
        super(message);
    }
}
