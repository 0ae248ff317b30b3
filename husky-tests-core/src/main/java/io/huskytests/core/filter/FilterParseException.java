package io.huskytests.core.filter;

/**
 * Thrown when a caller-supplied filter expression is malformed.
 */
public class FilterParseException extends RuntimeException {

    private final int position;

    public FilterParseException(String message, String expression, int position) {
        super(message + " at position " + position + " in filter '" + expression + "'");
        this.position = position;
    }

    public int getPosition() { return position; }
}
