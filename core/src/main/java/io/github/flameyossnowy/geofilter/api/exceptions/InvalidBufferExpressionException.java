package io.github.flameyossnowy.geofilter.api.exceptions;

/**
 * A caller-supplied per-feature buffer expression could not be parsed or evaluated.
 */
public class InvalidBufferExpressionException extends FilterException {
    private final String expression;
    private final int position;

    public InvalidBufferExpressionException(String expression, int position, String reason) {
        super("Invalid buffer expression '" + expression + "' at " + position + ": " + reason);
        this.expression = expression;
        this.position = position;
    }

    public String getExpression() {
        return expression;
    }

    public int getPosition() {
        return position;
    }
}
