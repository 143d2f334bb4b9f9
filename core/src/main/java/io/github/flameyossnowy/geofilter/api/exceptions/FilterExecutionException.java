package io.github.flameyossnowy.geofilter.api.exceptions;

/**
 * The store rejected or failed a statement (syntax, permission, timeout).
 * Carries the driver's own message so it can be shown verbatim.
 */
public class FilterExecutionException extends FilterException {
    private final String backendName;
    private final String operation;
    private final String nativeMessage;

    public FilterExecutionException(String backendName, String operation, String nativeMessage, Throwable cause) {
        super(backendName + " failed to " + operation + ": " + nativeMessage, cause);
        this.backendName = backendName;
        this.operation = operation;
        this.nativeMessage = nativeMessage;
    }

    public String getBackendName() {
        return backendName;
    }

    public String getOperation() {
        return operation;
    }

    public String getNativeMessage() {
        return nativeMessage;
    }
}
